package com.tokenledger.common.exception;

/**
 * Thrown when a chain transaction reference does not have the expected format.
 */
public class InvalidReferenceException extends TokenLedgerException {

    public InvalidReferenceException(String reference) {
        super(ErrorCode.INVALID_REFERENCE, "Invalid transaction hash format: " + reference);
    }
}
