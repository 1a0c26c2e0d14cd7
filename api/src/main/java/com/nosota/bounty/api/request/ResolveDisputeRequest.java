package com.nosota.bounty.api.request;

import com.nosota.bounty.api.model.DisputeResolution;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * @param resolution RELEASE_TO_HUNTER, REFUND_TO_POSTER, or VOID to let the work continue
 * @param note       Reviewer's explanation, stored for audit
 */
public record ResolveDisputeRequest(
        @NotNull(message = "Resolution is required")
        DisputeResolution resolution,

        @Size(max = 2000, message = "Note must be at most 2000 characters")
        String note
) {
}
