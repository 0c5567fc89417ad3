package com.tokenledger.common.exception;

/**
 * Thrown when an account is not found.
 */
public class AccountNotFoundException extends TokenLedgerException {

    public AccountNotFoundException(String accountId) {
        super(ErrorCode.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
    }
}
