package com.nosota.bounty.api.request;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * @param amount             Amount to debit (positive, two decimals)
 * @param destinationAccount Bank account or payout destination reference
 */
public record WithdrawalRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        @Digits(integer = 10, fraction = 2, message = "Amount must have at most two decimals")
        BigDecimal amount,

        @NotBlank(message = "Destination account is required")
        @Size(max = 255, message = "Destination account must be at most 255 characters")
        String destinationAccount
) {
}
