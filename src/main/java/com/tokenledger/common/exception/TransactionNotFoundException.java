package com.tokenledger.common.exception;

/**
 * Thrown when a transaction record is not found.
 */
public class TransactionNotFoundException extends TokenLedgerException {

    public TransactionNotFoundException(Long transactionId) {
        super(ErrorCode.TRANSACTION_NOT_FOUND, "Transaction not found: #" + transactionId);
    }
}
