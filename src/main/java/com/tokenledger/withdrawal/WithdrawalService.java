package com.tokenledger.withdrawal;

import com.tokenledger.common.ChainReference;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.InvalidAmountException;
import com.tokenledger.ledger.FundsReservationService;
import com.tokenledger.ledger.TransactionRecord;
import com.tokenledger.ledger.TransactionRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Accepts withdrawal requests.
 *
 * A request reserves amount plus the fee current at request time against the
 * balance; the transfer itself is done by {@link WithdrawalSettlementProcessor}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalService {

    private final FundsReservationService reservationService;
    private final TransactionRecordStore recordStore;
    private final WithdrawalSettlementProcessor settlementProcessor;
    private final WithdrawalFeeService feeService;

    /**
     * Reserve funds and create a pending withdrawal.
     */
    public TransactionRecord requestWithdrawal(String accountId, Money amount, String toAddress) {
        ChainReference.validateAddress(toAddress);
        if (amount.getCurrency() != Currency.USDT || !amount.isPositive()) {
            throw new InvalidAmountException(amount.toString());
        }

        Money fee = feeService.currentFee();
        Money required = amount.add(fee);
        TransactionRecord record = reservationService.reserve(accountId, required,
            () -> recordStore.createWithdrawal(accountId, amount, toAddress, fee));

        log.info("Withdrawal #{} requested by account {}: {} + fee {} to {}",
            record.getId(), accountId, amount, fee, toAddress);

        return record;
    }

    /**
     * Request a withdrawal and immediately push it through the chain.
     */
    public WithdrawalResult withdraw(String accountId, Money amount, String toAddress) {
        TransactionRecord record = requestWithdrawal(accountId, amount, toAddress);
        return settlementProcessor.process(record.getId());
    }
}
