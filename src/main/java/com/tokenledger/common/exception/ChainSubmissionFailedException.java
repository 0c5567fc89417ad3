package com.tokenledger.common.exception;

/**
 * Thrown when an outbound transfer could not be executed on chain.
 */
public class ChainSubmissionFailedException extends TokenLedgerException {

    public ChainSubmissionFailedException(String message) {
        super(ErrorCode.CHAIN_SUBMISSION_FAILED, message);
    }
}
