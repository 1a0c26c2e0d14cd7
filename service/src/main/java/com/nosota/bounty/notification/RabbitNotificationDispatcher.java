package com.nosota.bounty.notification;

import com.nosota.bounty.config.BountyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Publishes lifecycle events as JSON to the {@code bounty.notifications.exchange} topic exchange
 * with routing key {@code bounty.{event}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "bounty.notifications.transport", havingValue = "rabbit")
public class RabbitNotificationDispatcher implements NotificationDispatcher {

    public static final String ROUTING_KEY_PREFIX = "bounty.";

    private final RabbitTemplate rabbitTemplate;
    private final BountyProperties properties;

    @Override
    public void dispatch(LifecycleEvent event) {
        String routingKey = ROUTING_KEY_PREFIX + event.type().wireName();
        rabbitTemplate.convertAndSend(properties.getNotifications().getExchange(), routingKey, event);
        log.debug("Published notification: routingKey={}, bountyId={}", routingKey, event.bountyId());
    }
}
