package com.tokenledger.ledger;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger record for a deposit, withdrawal or exchange.
 *
 * Records are only ever appended. The status moves forward through
 * {@link StatusTransition}s applied by {@link TransactionRecordStore}; once a
 * record is COMPLETED or FAILED it is never modified again.
 */
@Entity
@Table(name = "transaction_records",
    indexes = {
        @Index(name = "idx_txrec_account_id", columnList = "account_id"),
        @Index(name = "idx_txrec_kind_status", columnList = "kind, status"),
        @Index(name = "idx_txrec_created_at", columnList = "created_at")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_txrec_chain_tx_reference", columnNames = "chain_tx_reference")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransactionKind kind;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    /**
     * Token amount, always positive.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", precision = 24, scale = 6, nullable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency", nullable = false))
    })
    private Money amount;

    /**
     * Fiat payout, exchanges only.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "fiat_amount", precision = 24, scale = 2)),
        @AttributeOverride(name = "currency", column = @Column(name = "fiat_currency"))
    })
    private Money fiatAmount;

    /**
     * Destination address, withdrawals only.
     */
    @Column(name = "external_address")
    private String externalAddress;

    @Column(name = "chain_tx_reference")
    private String chainTxReference;

    /**
     * Network fee charged on top of the amount, withdrawals only.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "fee_amount", precision = 24, scale = 6)),
        @AttributeOverride(name = "currency", column = @Column(name = "fee_currency"))
    })
    private Money fee;

    @Column(name = "confirmation_count")
    private Integer confirmationCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransactionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "admin_note", length = 1000)
    private String adminNote;

    private TransactionRecord(TransactionKind kind, String accountId, Money amount, TransactionStatus status) {
        if (amount == null || amount.getCurrency() != Currency.USDT || !amount.isPositive()) {
            throw new IllegalArgumentException("Record amount must be a positive token amount: " + amount);
        }
        this.kind = kind;
        this.accountId = accountId;
        this.amount = amount;
        this.status = status;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    static TransactionRecord pendingWithdrawal(String accountId, Money amount, String externalAddress, Money fee) {
        TransactionRecord record = new TransactionRecord(
            TransactionKind.WITHDRAWAL, accountId, amount, TransactionStatus.PENDING);
        record.externalAddress = externalAddress;
        record.fee = fee;
        return record;
    }

    static TransactionRecord pendingExchange(String accountId, Money amount, Money fiatAmount) {
        if (fiatAmount == null || !fiatAmount.getCurrency().isFiat()) {
            throw new IllegalArgumentException("Exchange payout must be a fiat amount: " + fiatAmount);
        }
        TransactionRecord record = new TransactionRecord(
            TransactionKind.EXCHANGE, accountId, amount, TransactionStatus.PENDING);
        record.fiatAmount = fiatAmount;
        return record;
    }

    /**
     * A deposit is born completed: it is only written once the chain has confirmed it.
     */
    static TransactionRecord completedDeposit(String accountId, Money amount, String chainTxReference,
                                              int confirmations) {
        TransactionRecord record = new TransactionRecord(
            TransactionKind.DEPOSIT, accountId, amount, TransactionStatus.COMPLETED);
        record.chainTxReference = chainTxReference;
        record.confirmationCount = confirmations;
        record.completedAt = record.createdAt;
        return record;
    }

    /**
     * Amount this record holds against the account balance: the fee is reserved with the withdrawal.
     */
    public Money getReservedAmount() {
        return fee == null ? amount : amount.add(fee);
    }

    void apply(StatusTransition transition) {
        transition.applyTo(this);
        this.status = transition.getTargetStatus();
        this.updatedAt = Instant.now();
    }

    void assignChainTxReference(String chainTxReference) {
        this.chainTxReference = chainTxReference;
    }

    void markCompleted(Integer confirmations) {
        this.completedAt = Instant.now();
        if (confirmations != null) {
            this.confirmationCount = confirmations;
        }
    }

    void noteForAdmin(String note) {
        if (note != null && !note.isBlank()) {
            this.adminNote = note;
        }
    }
}
