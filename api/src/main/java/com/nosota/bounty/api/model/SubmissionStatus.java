package com.nosota.bounty.api.model;

/**
 * Review status of a completion submission.
 */
public enum SubmissionStatus {
    /**
     * Waiting for the poster's decision. At most one per bounty.
     */
    PENDING,

    /**
     * Accepted by the poster; escrow has been released. Final.
     */
    APPROVED,

    /**
     * Sent back to the hunter, superseded by the next submission.
     */
    REVISION_REQUESTED
}
