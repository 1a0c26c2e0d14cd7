package com.nosota.bounty.api.response;

import com.nosota.bounty.api.model.RequestStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * @param hunterId null once the hunter account is deleted
 */
public record BountyRequestResponse(
        UUID id,
        UUID bountyId,
        UUID hunterId,
        RequestStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
