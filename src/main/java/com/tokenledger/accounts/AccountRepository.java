package com.tokenledger.accounts;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for account persistence.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByAccountId(String accountId);

    /**
     * Load and row-lock an account for the rest of the surrounding transaction.
     * Outgoing requests for one account serialize on this lock while they reserve funds.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.accountId = :accountId")
    Optional<Account> findForUpdate(@Param("accountId") String accountId);
}
