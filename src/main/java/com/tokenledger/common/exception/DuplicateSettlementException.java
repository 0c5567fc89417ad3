package com.tokenledger.common.exception;

/**
 * Thrown when a chain transfer has already been settled into the ledger.
 */
public class DuplicateSettlementException extends TokenLedgerException {

    public DuplicateSettlementException(String reference) {
        super(ErrorCode.DUPLICATE_SETTLEMENT, "Transaction has already been settled: " + reference);
    }
}
