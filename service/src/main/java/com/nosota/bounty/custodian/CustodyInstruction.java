package com.nosota.bounty.custodian;

import com.nosota.bounty.api.model.WalletTransactionType;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.UUID;

/**
 * One money movement handed to the {@link PaymentCustodian}.
 *
 * @param bountyId       bounty the funds belong to
 * @param userId         payer for hold/refund, payee for release
 * @param amount         amount with two decimals
 * @param idempotencyKey {@code bounty:{bountyId}:{type}}, identical on every retry of the same movement
 */
public record CustodyInstruction(UUID bountyId, UUID userId, BigDecimal amount, String idempotencyKey) {

    public static CustodyInstruction of(UUID bountyId, UUID userId, BigDecimal amount, WalletTransactionType type) {
        return new CustodyInstruction(bountyId, userId, amount, idempotencyKey(bountyId, type));
    }

    public static String idempotencyKey(UUID bountyId, WalletTransactionType type) {
        return "bounty:" + bountyId + ":" + type.name().toLowerCase(Locale.ROOT);
    }
}
