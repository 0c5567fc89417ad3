package com.tokenledger.common.exception;

/**
 * Thrown when a withdrawal target is not a well-formed chain address.
 */
public class InvalidAddressException extends TokenLedgerException {

    public InvalidAddressException(String address) {
        super(ErrorCode.INVALID_ADDRESS, "Invalid wallet address format: " + address);
    }
}
