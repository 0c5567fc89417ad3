package com.tokenledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for transaction records.
 */
@Repository
public interface TransactionRecordRepository extends JpaRepository<TransactionRecord, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransactionRecord t WHERE t.id = :id")
    Optional<TransactionRecord> findForUpdate(@Param("id") Long id);

    List<TransactionRecord> findByKindAndStatusOrderByCreatedAtAsc(TransactionKind kind, TransactionStatus status);

    List<TransactionRecord> findByAccountIdOrderByCreatedAtDescIdDesc(String accountId, Pageable pageable);

    Optional<TransactionRecord> findByChainTxReference(String chainTxReference);

    boolean existsByChainTxReference(String chainTxReference);

    /**
     * Sum of token amounts; null when nothing matches.
     */
    @Query("SELECT SUM(t.amount.amount) FROM TransactionRecord t " +
           "WHERE t.accountId = :accountId AND t.kind = :kind AND t.status IN :statuses")
    BigDecimal sumAmount(@Param("accountId") String accountId,
                         @Param("kind") TransactionKind kind,
                         @Param("statuses") Collection<TransactionStatus> statuses);

    /**
     * Sum of fees; null when nothing matches.
     */
    @Query("SELECT SUM(t.fee.amount) FROM TransactionRecord t " +
           "WHERE t.accountId = :accountId AND t.kind = :kind AND t.status IN :statuses")
    BigDecimal sumFee(@Param("accountId") String accountId,
                      @Param("kind") TransactionKind kind,
                      @Param("statuses") Collection<TransactionStatus> statuses);
}
