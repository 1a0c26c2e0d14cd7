package com.nosota.bounty.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OpenDisputeRequest(
        @NotBlank(message = "Reason is required")
        @Size(max = 2000, message = "Reason must be at most 2000 characters")
        String reason
) {
}
