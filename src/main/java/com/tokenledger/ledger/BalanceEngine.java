package com.tokenledger.ledger;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * Derives an account's spendable balance from its transaction records.
 *
 * Completed deposits count in. Withdrawals (amount plus fee) and exchanges count
 * out as soon as they are requested, so anything in flight is already reserved.
 * Failed records count nowhere.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceEngine {

    static final Set<TransactionStatus> CREDITED = EnumSet.of(TransactionStatus.COMPLETED);

    static final Set<TransactionStatus> RESERVED = EnumSet.of(
        TransactionStatus.PENDING, TransactionStatus.PROCESSING, TransactionStatus.COMPLETED);

    private final TransactionRecordRepository recordRepository;

    @Transactional(readOnly = true)
    public Money computeBalance(String accountId) {
        BigDecimal deposits = sum(recordRepository.sumAmount(accountId, TransactionKind.DEPOSIT, CREDITED));
        BigDecimal withdrawals = sum(recordRepository.sumAmount(accountId, TransactionKind.WITHDRAWAL, RESERVED));
        BigDecimal fees = sum(recordRepository.sumFee(accountId, TransactionKind.WITHDRAWAL, RESERVED));
        BigDecimal exchanges = sum(recordRepository.sumAmount(accountId, TransactionKind.EXCHANGE, RESERVED));

        Money balance = Money.of(deposits.subtract(withdrawals).subtract(fees).subtract(exchanges), Currency.USDT);

        if (balance.isNegative()) {
            log.error("Negative balance for account {}: {} (deposits={}, withdrawals={}, fees={}, exchanges={})",
                accountId, balance, deposits, withdrawals, fees, exchanges);
            return Money.zero(Currency.USDT);
        }

        return balance;
    }

    private static BigDecimal sum(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
