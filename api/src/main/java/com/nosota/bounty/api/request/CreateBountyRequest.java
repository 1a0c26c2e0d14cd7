package com.nosota.bounty.api.request;

import com.nosota.bounty.api.model.WorkType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for posting a new bounty.
 *
 * <p>Amount rules (honor bounties carry zero, paid bounties a non-negative value with two decimals)
 * are checked by the lifecycle engine, not here, so that they hold for every caller.
 *
 * @param title       Short title shown in the feed
 * @param description Full task description
 * @param amount      Reward, in currency units with at most two decimals
 * @param isForHonor  True when the bounty carries no monetary reward
 * @param workType    ONLINE or IN_PERSON
 */
public record CreateBountyRequest(
        @NotBlank(message = "Title is required")
        @Size(max = 200, message = "Title must be at most 200 characters")
        String title,

        @Size(max = 5000, message = "Description must be at most 5000 characters")
        String description,

        @NotNull(message = "Amount is required")
        BigDecimal amount,

        boolean isForHonor,

        @NotNull(message = "Work type is required")
        WorkType workType
) {
}
