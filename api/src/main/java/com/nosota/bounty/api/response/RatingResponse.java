package com.nosota.bounty.api.response;

import java.time.LocalDateTime;
import java.util.UUID;

public record RatingResponse(
        UUID id,
        UUID bountyId,
        UUID fromUserId,
        UUID toUserId,
        int rating,
        String comment,
        LocalDateTime createdAt
) {
}
