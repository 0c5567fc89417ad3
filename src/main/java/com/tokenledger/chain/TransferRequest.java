package com.tokenledger.chain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Token transfer from the hot wallet.
 */
@Value
@Builder
public class TransferRequest {
    String toAddress;

    /**
     * Amount in the token's smallest units.
     */
    BigInteger units;

    BigInteger gasLimit;
    FeeData feeData;
}
