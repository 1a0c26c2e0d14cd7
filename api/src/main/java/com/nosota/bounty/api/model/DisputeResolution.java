package com.nosota.bounty.api.model;

/**
 * Outcome of a dispute.
 */
public enum DisputeResolution {
    /**
     * Work accepted: escrow released, bounty completed.
     */
    RELEASE_TO_HUNTER,

    /**
     * Work rejected: escrow refunded, bounty cancelled.
     */
    REFUND_TO_POSTER,

    /**
     * Dispute lost its subject (e.g. participant account deleted). No money movement.
     */
    VOID
}
