package com.nosota.bounty.custodian;

import com.nosota.bounty.error.PaymentProcessorException;

/**
 * External custody of escrowed funds.
 *
 * <p>Calls are synchronous and happen inside the ledger transaction: a failure throws
 * {@link PaymentProcessorException} and the enclosing transaction rolls back, so no local ledger write
 * survives a failed or timed out movement. Implementations must treat a repeated
 * {@link CustodyInstruction#idempotencyKey()} as the same movement.
 */
public interface PaymentCustodian {

    void hold(CustodyInstruction instruction);

    void release(CustodyInstruction instruction);

    void refund(CustodyInstruction instruction);
}
