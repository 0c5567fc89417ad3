package com.tokenledger.chain;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Decoded token transfer. The amount is in whole tokens at full chain precision.
 */
@Value
public class TransferEvent {
    String from;
    String to;
    BigDecimal amount;
}
