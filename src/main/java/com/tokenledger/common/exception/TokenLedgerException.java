package com.tokenledger.common.exception;

/**
 * Base exception for all token ledger exceptions.
 * The message is safe to show to the account holder.
 */
public class TokenLedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    public TokenLedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TokenLedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
