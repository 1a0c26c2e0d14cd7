package com.nosota.bounty.api.response;

import java.time.LocalDateTime;
import java.util.UUID;

public record AccountResponse(
        UUID userId,
        String displayName,
        LocalDateTime createdAt
) {
}
