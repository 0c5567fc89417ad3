package com.tokenledger.common.exception;

/**
 * Stable error codes surfaced to callers.
 *
 * Retryable codes leave no trace in the ledger: the caller may repeat the same
 * request later. Every other code is terminal for the attempt.
 */
public enum ErrorCode {
    INVALID_AMOUNT(false),
    INVALID_REFERENCE(false),
    INVALID_ADDRESS(false),
    NO_OPEN_INTENT(false),
    NOT_CONFIRMED(true),
    INSUFFICIENT_CONFIRMATIONS(true),
    NO_TRANSFER_FOUND(false),
    AMOUNT_MISMATCH(false),
    DUPLICATE_SETTLEMENT(false),
    INSUFFICIENT_BALANCE(false),
    INVALID_STATE(false),
    CHAIN_SUBMISSION_FAILED(false),
    CHAIN_UNAVAILABLE(true),
    ACCOUNT_NOT_FOUND(false),
    TRANSACTION_NOT_FOUND(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
