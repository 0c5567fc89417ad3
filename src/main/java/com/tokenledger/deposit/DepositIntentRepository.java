package com.tokenledger.deposit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for deposit intents, keyed by account.
 */
@Repository
public interface DepositIntentRepository extends JpaRepository<DepositIntent, String> {
}
