package com.nosota.bounty.notification;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Fire-and-forget notification about a lifecycle change.
 *
 * @param type        what happened
 * @param bountyId    bounty concerned
 * @param recipientId user to notify, may be null when that user no longer exists
 * @param subjectId   id of the request, submission or dispute the event is about, null for bounty-level events
 * @param occurredAt  when the change was made
 */
public record LifecycleEvent(
        LifecycleEventType type,
        UUID bountyId,
        UUID recipientId,
        UUID subjectId,
        LocalDateTime occurredAt
) {
    public static LifecycleEvent of(LifecycleEventType type, UUID bountyId, UUID recipientId, UUID subjectId) {
        return new LifecycleEvent(type, bountyId, recipientId, subjectId, LocalDateTime.now());
    }
}
