package com.nosota.bounty.api.model;

/**
 * Type of a wallet ledger row.
 *
 * <p>ESCROW, REFUND and RELEASE are bound to a bounty and are written only by the escrow ledger.
 * DEPOSIT and WITHDRAWAL move money between a wallet and the outside world.
 */
public enum WalletTransactionType {
    /**
     * Poster funds moved into escrow when a request is accepted.
     */
    ESCROW,

    /**
     * Escrowed funds returned to the poster.
     */
    REFUND,

    /**
     * Escrowed funds paid out to the hunter.
     */
    RELEASE,

    DEPOSIT,

    WITHDRAWAL;

    public boolean isEscrowSettlement() {
        return this == REFUND || this == RELEASE;
    }
}
