package com.nosota.bounty.custodian;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Custodian used when the platform ledger itself holds the funds: wallet balances and escrow rows are
 * the whole truth and there is nothing external to call.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "bounty.custodian.mode",
        havingValue = "ledger",
        matchIfMissing = true
)
public class LedgerPaymentCustodian implements PaymentCustodian {

    @Override
    public void hold(CustodyInstruction instruction) {
        log.debug("Ledger custody hold: key={}, amount={}", instruction.idempotencyKey(), instruction.amount());
    }

    @Override
    public void release(CustodyInstruction instruction) {
        log.debug("Ledger custody release: key={}, amount={}", instruction.idempotencyKey(), instruction.amount());
    }

    @Override
    public void refund(CustodyInstruction instruction) {
        log.debug("Ledger custody refund: key={}, amount={}", instruction.idempotencyKey(), instruction.amount());
    }
}
