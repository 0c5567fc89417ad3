package com.tokenledger.withdrawal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WithdrawalFeeRepository extends JpaRepository<WithdrawalFee, Long> {
}
