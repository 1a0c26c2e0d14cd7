package com.nosota.bounty.notification;

import java.util.Locale;

/**
 * Events the lifecycle engine emits after a committed state change.
 * The wire name is used in routing keys ({@code bounty.application_received}).
 */
public enum LifecycleEventType {
    APPLICATION_RECEIVED,
    REQUEST_ACCEPTED,
    SUBMISSION_RECEIVED,
    REVISION_REQUESTED,
    SUBMISSION_APPROVED,
    BOUNTY_CANCELLED,
    CANCELLATION_REQUESTED,
    CANCELLATION_REJECTED,
    DISPUTE_OPENED,
    DISPUTE_RESOLVED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
