package com.tokenledger.common.exception;

/**
 * Thrown when a transfer is mined but not yet buried deep enough. Retryable.
 */
public class InsufficientConfirmationsException extends TokenLedgerException {

    private final long confirmations;
    private final int required;

    public InsufficientConfirmationsException(String reference, long confirmations, int required) {
        super(ErrorCode.INSUFFICIENT_CONFIRMATIONS,
            String.format("Insufficient confirmations for %s: %d/%d", reference, confirmations, required));
        this.confirmations = confirmations;
        this.required = required;
    }

    public long getConfirmations() {
        return confirmations;
    }

    public int getRequired() {
        return required;
    }
}
