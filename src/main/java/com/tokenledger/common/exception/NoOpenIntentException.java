package com.tokenledger.common.exception;

/**
 * Thrown when an account has no open (unexpired) deposit intent.
 */
public class NoOpenIntentException extends TokenLedgerException {

    public NoOpenIntentException(String accountId) {
        super(ErrorCode.NO_OPEN_INTENT,
            "No active deposit request found for account " + accountId + ". Please start a new deposit.");
    }
}
