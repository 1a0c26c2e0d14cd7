package com.nosota.bounty.api.request;

import jakarta.validation.constraints.Size;

/**
 * Poster's answer to a cancellation request. The message is optional.
 */
public record RespondCancellationRequest(
        @Size(max = 2000, message = "Message must be at most 2000 characters")
        String message
) {
}
