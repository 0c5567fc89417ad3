package com.tokenledger.ledger;

import com.tokenledger.common.Money;
import com.tokenledger.common.exception.InvalidTransactionStateException;
import com.tokenledger.common.exception.TransactionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of deposits, withdrawals and exchanges.
 *
 * Records are inserted once and afterwards only move forward through
 * {@link StatusTransition}s. Each transition runs under a row lock so two
 * workers can never apply conflicting changes to the same record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionRecordStore {

    private final TransactionRecordRepository recordRepository;

    @Transactional
    public TransactionRecord createWithdrawal(String accountId, Money amount, String externalAddress, Money fee) {
        TransactionRecord record = recordRepository.saveAndFlush(
            TransactionRecord.pendingWithdrawal(accountId, amount, externalAddress, fee));

        log.info("Created WITHDRAWAL #{}: account={}, amount={}, fee={}, to={}",
            record.getId(), accountId, amount, fee, externalAddress);

        return record;
    }

    @Transactional
    public TransactionRecord createExchange(String accountId, Money amount, Money fiatAmount) {
        TransactionRecord record = recordRepository.saveAndFlush(
            TransactionRecord.pendingExchange(accountId, amount, fiatAmount));

        log.info("Created EXCHANGE #{}: account={}, amount={}, payout={}",
            record.getId(), accountId, amount, fiatAmount);

        return record;
    }

    /**
     * Insert a deposit that the chain has already confirmed.
     * Flushes immediately so a duplicate reference fails inside this call.
     */
    @Transactional
    public TransactionRecord recordCompletedDeposit(String accountId, Money amount, String chainTxReference,
                                                    int confirmations) {
        TransactionRecord record = recordRepository.saveAndFlush(
            TransactionRecord.completedDeposit(accountId, amount, chainTxReference, confirmations));

        log.info("Recorded DEPOSIT #{}: account={}, amount={}, ref={}, confirmations={}",
            record.getId(), accountId, amount, chainTxReference, confirmations);

        return record;
    }

    @Transactional(readOnly = true)
    public TransactionRecord get(Long id) {
        return recordRepository.findById(id)
            .orElseThrow(() -> new TransactionNotFoundException(id));
    }

    /**
     * Apply a transition to a record. Completed and failed records never change again.
     *
     * @throws InvalidTransactionStateException if the record is terminal or its kind or status does not allow it
     */
    @Transactional
    public TransactionRecord updateStatus(Long id, StatusTransition transition) {
        TransactionRecord record = recordRepository.findForUpdate(id)
            .orElseThrow(() -> new TransactionNotFoundException(id));

        if (record.getStatus().isTerminal() || !transition.isAllowedFor(record)) {
            throw new InvalidTransactionStateException(id,
                record.getKind() + "/" + record.getStatus(), transition.describe());
        }

        TransactionStatus previous = record.getStatus();
        record.apply(transition);
        TransactionRecord saved = recordRepository.save(record);

        log.info("Transaction #{} ({}) {} -> {} [{}]",
            id, record.getKind(), previous, saved.getStatus(), transition.describe());

        return saved;
    }

    @Transactional(readOnly = true)
    public List<TransactionRecord> findPendingByKind(TransactionKind kind) {
        return recordRepository.findByKindAndStatusOrderByCreatedAtAsc(kind, TransactionStatus.PENDING);
    }

    /**
     * Most recent records of an account, newest first.
     */
    @Transactional(readOnly = true)
    public List<TransactionRecord> historyForAccount(String accountId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be positive");
        }
        return recordRepository.findByAccountIdOrderByCreatedAtDescIdDesc(accountId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Optional<TransactionRecord> findByChainTxReference(String chainTxReference) {
        return recordRepository.findByChainTxReference(chainTxReference);
    }

    @Transactional(readOnly = true)
    public boolean isSettled(String chainTxReference) {
        return recordRepository.existsByChainTxReference(chainTxReference);
    }
}
