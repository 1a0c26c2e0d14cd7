package com.nosota.bounty.api.response;

import com.nosota.bounty.api.model.WalletTransactionStatus;
import com.nosota.bounty.api.model.WalletTransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * @param bountyId null for DEPOSIT and WITHDRAWAL
 * @param userId   wallet owner the row moved money for, null once that account is deleted
 */
public record WalletTransactionResponse(
        UUID id,
        UUID bountyId,
        UUID userId,
        WalletTransactionType type,
        BigDecimal amount,
        WalletTransactionStatus status,
        String description,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
}
