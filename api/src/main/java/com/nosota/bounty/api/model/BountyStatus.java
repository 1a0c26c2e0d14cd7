package com.nosota.bounty.api.model;

/**
 * Lifecycle status of a bounty.
 *
 * <pre>
 *   OPEN ──accept──▶ IN_PROGRESS ──approve──▶ COMPLETED
 *    │                   │  ▲
 *    │                   └──┘ revision loop
 *    ├──cancel──▶ CANCELLED ◀──cancel/dispute refund── IN_PROGRESS
 *    └──poster deleted──▶ ARCHIVED ◀──poster deleted── IN_PROGRESS
 * </pre>
 *
 * <p>IN_PROGRESS may also return to OPEN when the accepted hunter's account is deleted.
 */
public enum BountyStatus {
    /**
     * Accepting applications, no hunter assigned.
     */
    OPEN,

    /**
     * Exactly one request accepted, escrow held (unless for honor).
     */
    IN_PROGRESS,

    /**
     * Work approved and escrow released to the hunter. Final state.
     */
    COMPLETED,

    /**
     * Closed because the poster account was deleted. Final state.
     */
    ARCHIVED,

    /**
     * Withdrawn by the poster or closed by a dispute refund. Final state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ARCHIVED || this == CANCELLED;
    }
}
