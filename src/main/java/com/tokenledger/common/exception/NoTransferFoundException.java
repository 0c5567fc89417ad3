package com.tokenledger.common.exception;

/**
 * Thrown when a mined transaction carries no token transfer to the deposit address.
 */
public class NoTransferFoundException extends TokenLedgerException {

    public NoTransferFoundException(String reference, String detail) {
        super(ErrorCode.NO_TRANSFER_FOUND, String.format("No token transfer found in %s: %s", reference, detail));
    }
}
