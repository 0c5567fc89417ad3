package com.tokenledger.chain;

import com.tokenledger.common.exception.ErrorCode;
import com.tokenledger.common.exception.TokenLedgerException;

/**
 * Thrown when the node cannot be reached or answers with an error.
 */
public class ChainClientException extends TokenLedgerException {

    public ChainClientException(String message) {
        super(ErrorCode.CHAIN_UNAVAILABLE, message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(ErrorCode.CHAIN_UNAVAILABLE, message, cause);
    }
}
