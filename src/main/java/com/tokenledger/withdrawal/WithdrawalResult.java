package com.tokenledger.withdrawal;

import com.tokenledger.ledger.TransactionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of pushing a withdrawal through the chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalResult {

    private Long transactionId;
    private TransactionStatus status;
    private String chainTxReference;
    private String failureReason;

    public static WithdrawalResult completed(Long transactionId, String chainTxReference) {
        return WithdrawalResult.builder()
            .transactionId(transactionId)
            .status(TransactionStatus.COMPLETED)
            .chainTxReference(chainTxReference)
            .build();
    }

    public static WithdrawalResult failed(Long transactionId, String chainTxReference, String reason) {
        return WithdrawalResult.builder()
            .transactionId(transactionId)
            .status(TransactionStatus.FAILED)
            .chainTxReference(chainTxReference)
            .failureReason(reason)
            .build();
    }

    public boolean isCompleted() {
        return status == TransactionStatus.COMPLETED;
    }
}
