package com.tokenledger.chain;

import lombok.Value;

/**
 * A transfer accepted by the node but not yet mined.
 */
@Value
public class SubmittedTransfer {
    String reference;
}
