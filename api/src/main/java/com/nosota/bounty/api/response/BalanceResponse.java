package com.nosota.bounty.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param balance Spendable balance; funds in escrow are not included
 * @param held    Sum of this user's pending escrow holds
 */
public record BalanceResponse(
        UUID userId,
        BigDecimal balance,
        BigDecimal held
) {
}
