package com.nosota.bounty.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * AMQP wiring for {@code bounty.notifications.transport=rabbit}.
 */
@Configuration
@ConditionalOnProperty(value = "bounty.notifications.transport", havingValue = "rabbit")
public class RabbitNotificationConfig {

    @Bean
    public TopicExchange lifecycleExchange(BountyProperties properties) {
        return new TopicExchange(properties.getNotifications().getExchange(), true, false);
    }

    /**
     * Sends events as JSON rather than serialized Java objects, reusing the application's ObjectMapper
     * so timestamps are written the same way as in HTTP responses.
     */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
