package com.nosota.bounty.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * @param userId      Id issued by the identity provider
 * @param displayName Public name
 */
public record RegisterAccountRequest(
        @NotNull(message = "User ID is required")
        UUID userId,

        @NotBlank(message = "Display name is required")
        @Size(max = 100, message = "Display name must be at most 100 characters")
        String displayName
) {
}
