package com.tokenledger.common.exception;

import com.tokenledger.common.Money;

/**
 * Thrown when an account's spendable balance cannot cover an outgoing request.
 */
public class InsufficientBalanceException extends TokenLedgerException {

    public InsufficientBalanceException(String accountId, Money required, Money available) {
        super(ErrorCode.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance in account %s. Required: %s, Available: %s",
                accountId, required, available));
    }
}
