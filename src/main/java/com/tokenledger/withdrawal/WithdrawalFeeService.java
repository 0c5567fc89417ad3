package com.tokenledger.withdrawal;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.InvalidAmountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Reads and updates the withdrawal fee.
 */
@Service
@Slf4j
public class WithdrawalFeeService {

    private final WithdrawalFeeRepository feeRepository;
    private final Money defaultFee;

    public WithdrawalFeeService(
            WithdrawalFeeRepository feeRepository,
            @Value("${token-ledger.withdrawals.fee:0.4}") String defaultFee) {
        this.feeRepository = feeRepository;
        this.defaultFee = Money.parse(defaultFee, Currency.USDT);
    }

    /**
     * Current fee setting. Until an administrator changes it this is the configured
     * default, which is not written to the database; reads never insert.
     */
    @Transactional(readOnly = true)
    public WithdrawalFee currentSetting() {
        return feeRepository.findById(WithdrawalFee.SINGLETON_ID)
            .orElseGet(() -> new WithdrawalFee(defaultFee.getAmount()));
    }

    @Transactional(readOnly = true)
    public Money currentFee() {
        return Money.of(currentSetting().getFee(), Currency.USDT);
    }

    /**
     * Replace the fee applied to withdrawals requested from now on.
     *
     * @throws InvalidAmountException if the fee is not a positive token amount
     */
    @Transactional
    public WithdrawalFee updateFee(Money fee) {
        if (fee.getCurrency() != Currency.USDT || !fee.isPositive()) {
            throw new InvalidAmountException(fee.toString());
        }

        WithdrawalFee setting = feeRepository.findById(WithdrawalFee.SINGLETON_ID)
            .orElseGet(() -> new WithdrawalFee(defaultFee.getAmount()));
        Money previous = Money.of(setting.getFee(), Currency.USDT);
        setting.setFee(fee.getAmount());
        setting.setUpdatedAt(Instant.now());

        WithdrawalFee saved = feeRepository.save(setting);
        log.info("Withdrawal fee updated: {} -> {}", previous, fee);
        return saved;
    }
}
