package com.tokenledger.common.exception;

/**
 * Thrown when a status transition is not allowed from the record's current state.
 */
public class InvalidTransactionStateException extends TokenLedgerException {

    public InvalidTransactionStateException(Long transactionId, String currentState, String operation) {
        super(ErrorCode.INVALID_STATE, String.format("Cannot perform operation '%s' on transaction #%d in state %s",
            operation, transactionId, currentState));
    }
}
