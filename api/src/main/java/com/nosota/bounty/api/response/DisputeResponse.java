package com.nosota.bounty.api.response;

import com.nosota.bounty.api.model.DisputeResolution;
import com.nosota.bounty.api.model.DisputeStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record DisputeResponse(
        UUID id,
        UUID bountyId,
        UUID initiatorId,
        String reason,
        DisputeStatus status,
        DisputeResolution resolution,
        String resolutionNote,
        UUID resolvedBy,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {
}
