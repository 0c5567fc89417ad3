package com.tokenledger.common.exception;

import java.math.BigDecimal;

/**
 * Thrown when the transferred amount differs from the expected deposit amount.
 */
public class AmountMismatchException extends TokenLedgerException {

    public AmountMismatchException(String reference, BigDecimal expected, BigDecimal actual) {
        super(ErrorCode.AMOUNT_MISMATCH, String.format("Amount mismatch for %s: expected %s, got %s",
            reference, expected.toPlainString(), actual.stripTrailingZeros().toPlainString()));
    }
}
