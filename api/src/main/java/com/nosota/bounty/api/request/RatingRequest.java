package com.nosota.bounty.api.request;

import jakarta.validation.constraints.Size;

/**
 * The 1..5 range is enforced by the lifecycle engine.
 */
public record RatingRequest(
        int rating,

        @Size(max = 1000, message = "Comment must be at most 1000 characters")
        String comment
) {
}
