package com.tokenledger.withdrawal;

import com.tokenledger.chain.BlockchainClient;
import com.tokenledger.chain.FeeData;
import com.tokenledger.chain.Receipt;
import com.tokenledger.chain.SubmittedTransfer;
import com.tokenledger.chain.TransferRequest;
import com.tokenledger.common.exception.ChainSubmissionFailedException;
import com.tokenledger.common.exception.InvalidTransactionStateException;
import com.tokenledger.ledger.StatusTransition;
import com.tokenledger.ledger.TransactionRecord;
import com.tokenledger.ledger.TransactionRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Sends a pending withdrawal to the chain and tracks it to a terminal status.
 *
 * Settlement flow:
 * 1. Claim the record (PENDING to PROCESSING)
 * 2. Convert the amount to token units
 * 3. Fetch fee data and estimate gas, plus a safety margin
 * 4. Submit the transfer and persist its reference
 * 5. Wait for it to be mined
 * 6. Mark COMPLETED
 *
 * Any failure after the claim marks the record FAILED, which releases the
 * reserved funds. Failed withdrawals are never retried automatically.
 */
@Service
@Slf4j
public class WithdrawalSettlementProcessor {

    private static final BigInteger PERCENT = BigInteger.valueOf(100);

    private final TransactionRecordStore recordStore;
    private final BlockchainClient blockchainClient;
    private final BigInteger gasLimitFactor;

    public WithdrawalSettlementProcessor(
            TransactionRecordStore recordStore,
            BlockchainClient blockchainClient,
            @Value("${token-ledger.withdrawals.gas-safety-margin-percent:20}") int gasSafetyMarginPercent) {
        this.recordStore = recordStore;
        this.blockchainClient = blockchainClient;
        this.gasLimitFactor = PERCENT.add(BigInteger.valueOf(gasSafetyMarginPercent));
    }

    /**
     * @throws InvalidTransactionStateException if the record is not a pending withdrawal
     */
    public WithdrawalResult process(Long transactionId) {
        TransactionRecord record = recordStore.updateStatus(transactionId, StatusTransition.processing());
        String reference = null;

        try {
            BigInteger units = blockchainClient.toChainUnits(record.getAmount());
            FeeData feeData = blockchainClient.getFeeData();
            BigInteger gasLimit = withSafetyMargin(
                blockchainClient.estimateTransferGas(record.getExternalAddress(), units));

            SubmittedTransfer submitted = blockchainClient.submitTransfer(TransferRequest.builder()
                .toAddress(record.getExternalAddress())
                .units(units)
                .gasLimit(gasLimit)
                .feeData(feeData)
                .build());
            reference = submitted.getReference();
            recordStore.updateStatus(transactionId, StatusTransition.submitted(reference));

            Receipt receipt = blockchainClient.waitMined(reference);
            if (!receipt.isSuccessful()) {
                throw new ChainSubmissionFailedException("Transfer " + reference + " reverted");
            }

            recordStore.updateStatus(transactionId, StatusTransition.withdrawalCompleted(1));
            log.info("Withdrawal #{} completed: {} to {}, ref={}",
                transactionId, record.getAmount(), record.getExternalAddress(), reference);

            return WithdrawalResult.completed(transactionId, reference);

        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Withdrawal #{} failed (ref={})", transactionId, reference, e);
            recordStore.updateStatus(transactionId, StatusTransition.failed("Failed: " + reason));
            return WithdrawalResult.failed(transactionId, reference, reason);
        }
    }

    BigInteger withSafetyMargin(BigInteger estimate) {
        return estimate.multiply(gasLimitFactor).divide(PERCENT);
    }
}
