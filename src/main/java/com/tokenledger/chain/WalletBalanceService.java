package com.tokenledger.chain;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reports what the deposit address and the hot wallet hold on chain.
 */
@Service
@Slf4j
public class WalletBalanceService {

    private final BlockchainClient blockchainClient;
    private final String depositAddress;
    private final String hotWalletAddress;

    public WalletBalanceService(
            BlockchainClient blockchainClient,
            @Value("${token-ledger.chain.deposit-address}") String depositAddress,
            @Value("${token-ledger.chain.hot-wallet-address}") String hotWalletAddress) {
        this.blockchainClient = blockchainClient;
        this.depositAddress = depositAddress;
        this.hotWalletAddress = hotWalletAddress;
    }

    /**
     * Live balances of both addresses.
     *
     * @throws ChainClientException if the node cannot be reached
     */
    public WalletBalances walletBalances() {
        Money deposit = Money.of(blockchainClient.getBalance(depositAddress), Currency.USDT);
        Money hotWallet = Money.of(blockchainClient.getBalance(hotWalletAddress), Currency.USDT);

        log.debug("Wallet balances: deposit {} holds {}, hot wallet {} holds {}",
            depositAddress, deposit, hotWalletAddress, hotWallet);

        return WalletBalances.builder()
            .depositAddress(depositAddress)
            .depositBalance(deposit.format())
            .hotWalletAddress(hotWalletAddress)
            .hotWalletBalance(hotWallet.format())
            .build();
    }
}
