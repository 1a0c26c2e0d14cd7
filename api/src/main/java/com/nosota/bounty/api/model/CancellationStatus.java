package com.nosota.bounty.api.model;

/**
 * State of a hunter's request to cancel an in-progress bounty.
 * CLOSED means the bounty left IN_PROGRESS by another path before the poster answered.
 */
public enum CancellationStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    CLOSED
}
