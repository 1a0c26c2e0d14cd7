package com.nosota.bounty.api.model;

/**
 * PENDING is only ever used by an ESCROW row whose funds are still held.
 * Every other row is written as COMPLETED.
 */
public enum WalletTransactionStatus {
    PENDING,
    COMPLETED
}
