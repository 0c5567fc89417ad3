package com.tokenledger.ledger;

import com.tokenledger.accounts.AccountService;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.InsufficientBalanceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Supplier;

/**
 * Check-and-reserve for outgoing requests.
 *
 * The balance check and the insert of the reserving record run in one
 * transaction holding the account row lock, so two concurrent requests for the
 * same account see each other's reservations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundsReservationService {

    private final AccountService accountService;
    private final BalanceEngine balanceEngine;

    /**
     * Reserve {@code required} on the account by inserting the record produced by {@code reservation}.
     *
     * @throws InsufficientBalanceException if the spendable balance is below {@code required}
     */
    @Transactional
    public TransactionRecord reserve(String accountId, Money required, Supplier<TransactionRecord> reservation) {
        accountService.lockAccount(accountId);

        Money available = balanceEngine.computeBalance(accountId);
        if (available.isLessThan(required)) {
            log.warn("Reservation rejected for account {}: required={}, available={}",
                accountId, required, available);
            throw new InsufficientBalanceException(accountId, required, available);
        }

        return reservation.get();
    }
}
