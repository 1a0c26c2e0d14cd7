package com.nosota.bounty.service;

import java.util.UUID;

/**
 * What one run of the account deletion cascade changed. All zeros (and {@code profileDeleted == false})
 * when the account had already been processed.
 */
public record DeletionReport(
        UUID userId,
        int archivedBounties,
        int refundedEscrows,
        int reopenedBounties,
        int rejectedRequests,
        int deletedPersonalRecords,
        boolean profileDeleted
) {
}
