package com.nosota.bounty.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Hunter's declaration that the work is done.
 *
 * @param message    Note to the poster
 * @param proofItems Ordered attachment references (upload ids or URLs)
 */
public record SubmitCompletionRequest(
        @Size(max = 5000, message = "Message must be at most 5000 characters")
        String message,

        @NotNull(message = "Proof items are required")
        @Size(max = 20, message = "At most 20 proof items can be attached")
        List<@NotNull String> proofItems
) {
}
