package com.tokenledger.deposit;

import com.tokenledger.chain.BlockchainClient;
import com.tokenledger.chain.Receipt;
import com.tokenledger.chain.TransferEvent;
import com.tokenledger.common.ChainReference;
import com.tokenledger.common.exception.AmountMismatchException;
import com.tokenledger.common.exception.DuplicateSettlementException;
import com.tokenledger.common.exception.InsufficientConfirmationsException;
import com.tokenledger.common.exception.NoTransferFoundException;
import com.tokenledger.common.exception.NotConfirmedException;
import com.tokenledger.ledger.TransactionRecord;
import com.tokenledger.ledger.TransactionRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Credits a deposit only after the chain proves it happened.
 *
 * Verification steps, in order:
 * 1. Reference format
 * 2. Open intent for the account
 * 3. Mined, successful receipt
 * 4. Minimum confirmations
 * 5. Token transfer to the deposit address
 * 6. Amount exactly equal to the intent
 *
 * Only then is the deposit written, together with clearing the intent, in one
 * short database transaction. The chain is never queried while a transaction is open.
 * A reference can be settled once: the unique column on the record decides races.
 */
@Service
@Slf4j
public class DepositSettlementVerifier {

    private final DepositIntentRegistry intentRegistry;
    private final BlockchainClient blockchainClient;
    private final TransactionRecordStore recordStore;
    private final TransactionTemplate transactionTemplate;
    private final String depositAddress;
    private final int minConfirmations;

    public DepositSettlementVerifier(
            DepositIntentRegistry intentRegistry,
            BlockchainClient blockchainClient,
            TransactionRecordStore recordStore,
            PlatformTransactionManager transactionManager,
            @Value("${token-ledger.chain.deposit-address}") String depositAddress,
            @Value("${token-ledger.deposits.min-confirmations:5}") int minConfirmations) {
        ChainReference.validateAddress(depositAddress);

        this.intentRegistry = intentRegistry;
        this.blockchainClient = blockchainClient;
        this.recordStore = recordStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.depositAddress = depositAddress;
        this.minConfirmations = minConfirmations;
    }

    /**
     * Verify a deposit the account claims to have sent and credit it.
     *
     * @return the completed deposit record
     */
    public TransactionRecord verify(String accountId, String chainTxReference) {
        ChainReference.validateTransactionReference(chainTxReference);

        DepositIntent intent = intentRegistry.get(accountId);
        BigDecimal expected = intent.getExpectedAmount().getAmount();

        log.info("Verifying deposit for account {}: ref={}, expected={}",
            accountId, chainTxReference, intent.getExpectedAmount());

        Receipt receipt = blockchainClient.getReceipt(chainTxReference)
            .orElseThrow(() -> new NotConfirmedException(chainTxReference));

        if (!receipt.isSuccessful()) {
            log.warn("Deposit {} reverted on chain", chainTxReference);
            throw new NoTransferFoundException(chainTxReference, "transaction reverted");
        }

        long confirmations = blockchainClient.currentBlockHeight() - receipt.getBlockNumber();
        if (confirmations < minConfirmations) {
            log.info("Deposit {} has {}/{} confirmations", chainTxReference, confirmations, minConfirmations);
            throw new InsufficientConfirmationsException(chainTxReference, confirmations, minConfirmations);
        }

        List<TransferEvent> incoming = blockchainClient.parseTransferEvents(receipt).stream()
            .filter(transfer -> ChainReference.sameAddress(transfer.getTo(), depositAddress))
            .collect(Collectors.toList());

        if (incoming.isEmpty()) {
            log.warn("Deposit {} has no transfer to the deposit address", chainTxReference);
            throw new NoTransferFoundException(chainTxReference, "no transfer to the deposit address");
        }

        boolean matched = incoming.stream()
            .anyMatch(transfer -> transfer.getAmount().compareTo(expected) == 0);
        if (!matched) {
            BigDecimal actual = incoming.get(0).getAmount();
            log.warn("Deposit {} amount mismatch for account {}: expected={}, actual={}",
                chainTxReference, accountId, expected, actual);
            throw new AmountMismatchException(chainTxReference, expected, actual);
        }

        return settle(accountId, intent, chainTxReference, Math.toIntExact(confirmations));
    }

    private TransactionRecord settle(String accountId, DepositIntent intent, String chainTxReference,
                                     int confirmations) {
        try {
            return transactionTemplate.execute(status -> {
                if (recordStore.isSettled(chainTxReference)) {
                    throw new DuplicateSettlementException(chainTxReference);
                }
                TransactionRecord deposit = recordStore.recordCompletedDeposit(
                    accountId, intent.getExpectedAmount(), chainTxReference, confirmations);
                intentRegistry.clear(accountId);
                return deposit;
            });
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent settlement of {} rejected by unique constraint", chainTxReference);
            throw new DuplicateSettlementException(chainTxReference);
        }
    }
}
