package com.nosota.bounty.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(
        value = "bounty.notifications.transport",
        havingValue = "log",
        matchIfMissing = true
)
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void dispatch(LifecycleEvent event) {
        log.info("Notification: event={}, bountyId={}, recipientId={}, subjectId={}",
                event.type().wireName(), event.bountyId(), event.recipientId(), event.subjectId());
    }
}
