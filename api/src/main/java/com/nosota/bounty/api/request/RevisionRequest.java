package com.nosota.bounty.api.request;

import jakarta.validation.constraints.Size;

/**
 * Poster's request to rework a submission. Blank feedback is rejected by the lifecycle engine.
 */
public record RevisionRequest(
        @Size(max = 2000, message = "Feedback must be at most 2000 characters")
        String feedback
) {
}
