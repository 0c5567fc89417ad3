package com.tokenledger.common.exception;

/**
 * Thrown when an amount is malformed or not positive.
 */
public class InvalidAmountException extends TokenLedgerException {

    public InvalidAmountException(String rawAmount) {
        super(ErrorCode.INVALID_AMOUNT, "Amount must be a positive number: " + rawAmount);
    }
}
