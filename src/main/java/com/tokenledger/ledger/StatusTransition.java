package com.tokenledger.ledger;

/**
 * A status change together with exactly the fields that belong to the new status.
 *
 * Each variant knows which kinds and source states it applies to, so a record can
 * never end up in a status whose dependent fields are missing:
 * <pre>
 * WITHDRAWAL: PENDING -> PROCESSING -(submitted)-> PROCESSING -> COMPLETED | FAILED
 * EXCHANGE:   PENDING -> COMPLETED | FAILED
 * DEPOSIT:    created COMPLETED, no transitions
 * </pre>
 */
public abstract class StatusTransition {

    private StatusTransition() {
    }

    public static StatusTransition processing() {
        return new Processing();
    }

    public static StatusTransition submitted(String chainTxReference) {
        return new Submitted(chainTxReference);
    }

    public static StatusTransition withdrawalCompleted(int confirmations) {
        return new WithdrawalCompleted(confirmations);
    }

    public static StatusTransition exchangeCompleted(String adminNote) {
        return new ExchangeCompleted(adminNote);
    }

    public static StatusTransition failed(String reason) {
        return new Failed(reason);
    }

    public abstract TransactionStatus getTargetStatus();

    /**
     * Whether this transition may be applied to the record in its current state.
     */
    public abstract boolean isAllowedFor(TransactionRecord record);

    /**
     * Short operation name used in logs and error messages.
     */
    public abstract String describe();

    abstract void applyTo(TransactionRecord record);

    static final class Processing extends StatusTransition {

        @Override
        public TransactionStatus getTargetStatus() {
            return TransactionStatus.PROCESSING;
        }

        @Override
        public boolean isAllowedFor(TransactionRecord record) {
            return record.getKind() == TransactionKind.WITHDRAWAL
                && record.getStatus() == TransactionStatus.PENDING;
        }

        @Override
        public String describe() {
            return "start processing";
        }

        @Override
        void applyTo(TransactionRecord record) {
        }
    }

    /**
     * The transfer was handed to the chain. Status stays PROCESSING; the reference is
     * persisted before waiting for it to be mined so a crash can be reconciled.
     */
    static final class Submitted extends StatusTransition {

        private final String chainTxReference;

        private Submitted(String chainTxReference) {
            if (chainTxReference == null || chainTxReference.isBlank()) {
                throw new IllegalArgumentException("Chain reference is required");
            }
            this.chainTxReference = chainTxReference;
        }

        @Override
        public TransactionStatus getTargetStatus() {
            return TransactionStatus.PROCESSING;
        }

        @Override
        public boolean isAllowedFor(TransactionRecord record) {
            return record.getKind() == TransactionKind.WITHDRAWAL
                && record.getStatus() == TransactionStatus.PROCESSING
                && record.getChainTxReference() == null;
        }

        @Override
        public String describe() {
            return "record submission";
        }

        @Override
        void applyTo(TransactionRecord record) {
            record.assignChainTxReference(chainTxReference);
        }
    }

    static final class WithdrawalCompleted extends StatusTransition {

        private final int confirmations;

        private WithdrawalCompleted(int confirmations) {
            if (confirmations < 1) {
                throw new IllegalArgumentException("A completed withdrawal has at least one confirmation");
            }
            this.confirmations = confirmations;
        }

        @Override
        public TransactionStatus getTargetStatus() {
            return TransactionStatus.COMPLETED;
        }

        @Override
        public boolean isAllowedFor(TransactionRecord record) {
            return record.getKind() == TransactionKind.WITHDRAWAL
                && record.getStatus() == TransactionStatus.PROCESSING
                && record.getChainTxReference() != null;
        }

        @Override
        public String describe() {
            return "complete withdrawal";
        }

        @Override
        void applyTo(TransactionRecord record) {
            record.markCompleted(confirmations);
        }
    }

    static final class ExchangeCompleted extends StatusTransition {

        private final String adminNote;

        private ExchangeCompleted(String adminNote) {
            this.adminNote = adminNote;
        }

        @Override
        public TransactionStatus getTargetStatus() {
            return TransactionStatus.COMPLETED;
        }

        @Override
        public boolean isAllowedFor(TransactionRecord record) {
            return record.getKind() == TransactionKind.EXCHANGE
                && record.getStatus() == TransactionStatus.PENDING;
        }

        @Override
        public String describe() {
            return "complete exchange";
        }

        @Override
        void applyTo(TransactionRecord record) {
            record.markCompleted(null);
            record.noteForAdmin(adminNote);
        }
    }

    static final class Failed extends StatusTransition {

        private final String reason;

        private Failed(String reason) {
            this.reason = reason;
        }

        @Override
        public TransactionStatus getTargetStatus() {
            return TransactionStatus.FAILED;
        }

        @Override
        public boolean isAllowedFor(TransactionRecord record) {
            return switch (record.getKind()) {
                case WITHDRAWAL -> record.getStatus() == TransactionStatus.PROCESSING;
                case EXCHANGE -> record.getStatus() == TransactionStatus.PENDING;
                case DEPOSIT -> false;
            };
        }

        @Override
        public String describe() {
            return "fail";
        }

        @Override
        void applyTo(TransactionRecord record) {
            record.noteForAdmin(reason);
        }
    }
}
