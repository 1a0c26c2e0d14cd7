package com.nosota.bounty.error;

import com.nosota.bounty.api.model.LifecycleErrorKind;
import lombok.Getter;

/**
 * Signals a rejected lifecycle operation.
 *
 * <p>Unchecked, so throwing it from a {@code @Transactional} service method rolls back every write made
 * so far in that transaction (status changes, ledger rows, balance updates).
 *
 * <p>The exception message is a diagnostic for logs. Callers see {@link LifecycleErrorKind#getUserMessage()}.
 */
@Getter
public class BountyLifecycleException extends RuntimeException {

    private final LifecycleErrorKind kind;

    public BountyLifecycleException(LifecycleErrorKind kind) {
        this(kind, kind.getUserMessage());
    }

    public BountyLifecycleException(LifecycleErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BountyLifecycleException(LifecycleErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
