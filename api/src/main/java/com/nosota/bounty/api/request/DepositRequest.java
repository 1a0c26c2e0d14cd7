package com.nosota.bounty.api.request;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for funding a wallet from an external source.
 *
 * @param amount            Amount to credit (positive, two decimals)
 * @param externalReference Payment processor reference, used as idempotency key when present
 */
public record DepositRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        @Digits(integer = 10, fraction = 2, message = "Amount must have at most two decimals")
        BigDecimal amount,

        @Size(max = 255, message = "External reference must be at most 255 characters")
        String externalReference
) {
}
