package com.nosota.bounty.api.response;

import com.nosota.bounty.api.model.CancellationStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record CancellationResponse(
        UUID id,
        UUID bountyId,
        UUID requesterId,
        String reason,
        CancellationStatus status,
        UUID responderId,
        String responseMessage,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {
}
