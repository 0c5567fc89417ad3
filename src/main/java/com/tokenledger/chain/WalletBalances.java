package com.tokenledger.chain;

import lombok.Builder;
import lombok.Value;

/**
 * Token holdings of the service's own addresses, as formatted token amounts.
 */
@Value
@Builder
public class WalletBalances {

    String depositAddress;
    String depositBalance;
    String hotWalletAddress;
    String hotWalletBalance;
}
