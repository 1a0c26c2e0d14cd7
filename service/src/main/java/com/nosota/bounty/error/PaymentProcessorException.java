package com.nosota.bounty.error;

import lombok.Getter;

/**
 * Failure reported by a {@link com.nosota.bounty.custodian.PaymentCustodian}.
 */
@Getter
public class PaymentProcessorException extends RuntimeException {

    /**
     * True when the custodian did not answer within the configured timeout.
     */
    private final boolean timedOut;

    public PaymentProcessorException(String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
    }
}
