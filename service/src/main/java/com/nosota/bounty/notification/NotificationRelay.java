package com.nosota.bounty.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands lifecycle events to the {@link NotificationDispatcher} once the publishing transaction has committed.
 *
 * <p>Events of a rolled back transaction are never delivered. A failing dispatcher is logged and ignored:
 * the lifecycle change it reports is already committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationRelay {

    private final NotificationDispatcher notificationDispatcher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void relay(LifecycleEvent event) {
        try {
            notificationDispatcher.dispatch(event);
        } catch (RuntimeException e) {
            log.warn("Notification dispatch failed: event={}, bountyId={}, recipientId={}: {}",
                    event.type().wireName(), event.bountyId(), event.recipientId(), e.getMessage(), e);
        }
    }
}
