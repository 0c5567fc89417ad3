package com.tokenledger.chain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Current network fee parameters, in wei.
 * The EIP-1559 fields are null on networks that only report a legacy gas price.
 */
@Value
@Builder
public class FeeData {
    BigInteger gasPrice;
    BigInteger maxFeePerGas;
    BigInteger maxPriorityFeePerGas;

    public boolean supportsDynamicFees() {
        return maxFeePerGas != null && maxPriorityFeePerGas != null;
    }
}
