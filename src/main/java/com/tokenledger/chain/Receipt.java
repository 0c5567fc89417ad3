package com.tokenledger.chain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A mined transaction as reported by the node.
 */
@Value
@Builder
public class Receipt {
    String reference;
    long blockNumber;

    /**
     * False when execution reverted.
     */
    boolean successful;

    @Singular
    List<ReceiptLog> logs;
}
