package com.tokenledger.chain;

import com.tokenledger.common.Money;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Access to the token contract on the chain.
 *
 * All methods may throw {@link ChainClientException} when the node is unavailable.
 */
public interface BlockchainClient {

    /**
     * Token balance of an address, in whole tokens.
     */
    BigDecimal getBalance(String address);

    /**
     * Receipt of a transaction, or empty if it is unknown or not yet mined.
     */
    Optional<Receipt> getReceipt(String reference);

    long currentBlockHeight();

    /**
     * Transfers of the configured token contract found in the receipt's logs.
     */
    List<TransferEvent> parseTransferEvents(Receipt receipt);

    /**
     * Convert a token amount to the contract's smallest units.
     */
    BigInteger toChainUnits(Money amount);

    FeeData getFeeData();

    BigInteger estimateTransferGas(String toAddress, BigInteger units);

    /**
     * Sign and broadcast a transfer from the hot wallet.
     */
    SubmittedTransfer submitTransfer(TransferRequest request);

    /**
     * Block until the transaction is mined.
     *
     * @throws ChainClientException if it is not mined within the configured timeout
     */
    Receipt waitMined(String reference);
}
