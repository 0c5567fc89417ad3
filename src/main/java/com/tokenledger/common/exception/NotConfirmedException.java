package com.tokenledger.common.exception;

/**
 * Thrown when a transfer is not yet known or not yet mined. Retryable.
 */
public class NotConfirmedException extends TokenLedgerException {

    public NotConfirmedException(String reference) {
        super(ErrorCode.NOT_CONFIRMED, "Transaction not found or not yet confirmed: " + reference);
    }
}
