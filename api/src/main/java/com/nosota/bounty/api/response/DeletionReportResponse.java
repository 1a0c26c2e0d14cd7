package com.nosota.bounty.api.response;

import java.util.UUID;

/**
 * Summary of what an account deletion changed. All counts are zero when the account was already processed.
 *
 * @param archivedBounties        Posted bounties moved to ARCHIVED
 * @param refundedEscrows         Escrow holds refunded to the deleted poster's wallet
 * @param reopenedBounties        Bounties returned to OPEN because their hunter was deleted
 * @param rejectedRequests        Pending applications rejected
 * @param deletedPersonalRecords  Messages, skills and payment methods removed
 * @param profileDeleted          Whether a profile row existed and was removed
 */
public record DeletionReportResponse(
        UUID userId,
        int archivedBounties,
        int refundedEscrows,
        int reopenedBounties,
        int rejectedRequests,
        int deletedPersonalRecords,
        boolean profileDeleted
) {
}
