package com.nosota.bounty.api.response;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.WorkType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a bounty.
 *
 * @param id               Bounty UUID
 * @param posterId         Owning user, null once the poster account is deleted
 * @param title            Title
 * @param description      Description
 * @param amount           Reward (0.00 for honor bounties)
 * @param isForHonor       True when no monetary reward is attached
 * @param workType         ONLINE or IN_PERSON
 * @param status           Lifecycle status
 * @param acceptedHunterId Hunter working on the bounty, null while open
 * @param createdAt        Creation timestamp
 * @param updatedAt        Last status change
 */
public record BountyResponse(
        UUID id,
        UUID posterId,
        String title,
        String description,
        BigDecimal amount,
        boolean isForHonor,
        WorkType workType,
        BountyStatus status,
        UUID acceptedHunterId,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
