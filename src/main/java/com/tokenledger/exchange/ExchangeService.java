package com.tokenledger.exchange;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.InvalidAmountException;
import com.tokenledger.common.exception.InvalidTransactionStateException;
import com.tokenledger.ledger.FundsReservationService;
import com.tokenledger.ledger.StatusTransition;
import com.tokenledger.ledger.TransactionKind;
import com.tokenledger.ledger.TransactionRecord;
import com.tokenledger.ledger.TransactionRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Token to fiat exchanges.
 *
 * The account requests an exchange, which reserves the tokens at the current
 * rate. The fiat payout happens off-system; an administrator then completes
 * the request, or rejects it to release the reservation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeService {

    private final FundsReservationService reservationService;
    private final TransactionRecordStore recordStore;
    private final ExchangeRateService rateService;

    public TransactionRecord requestExchange(String accountId, Money amount, Currency fiatCurrency) {
        if (!fiatCurrency.isFiat()) {
            throw new IllegalArgumentException("Exchange target must be a fiat currency: " + fiatCurrency);
        }
        if (amount.getCurrency() != Currency.USDT || !amount.isPositive()) {
            throw new InvalidAmountException(amount.toString());
        }

        Money payout = rateService.convert(amount, fiatCurrency);
        TransactionRecord record = reservationService.reserve(accountId, amount,
            () -> recordStore.createExchange(accountId, amount, payout));

        log.info("Exchange #{} requested by account {}: {} -> {}", record.getId(), accountId, amount, payout);
        return record;
    }

    public TransactionRecord completeExchange(Long transactionId, String note) {
        requireExchange(transactionId, "complete exchange");
        TransactionRecord record = recordStore.updateStatus(transactionId, StatusTransition.exchangeCompleted(note));

        log.info("Exchange #{} completed for account {}: {}", transactionId, record.getAccountId(), record.getFiatAmount());
        return record;
    }

    public TransactionRecord rejectExchange(Long transactionId, String reason) {
        requireExchange(transactionId, "reject exchange");
        TransactionRecord record = recordStore.updateStatus(transactionId, StatusTransition.failed(reason));

        log.info("Exchange #{} rejected for account {}: {}", transactionId, record.getAccountId(), reason);
        return record;
    }

    public List<TransactionRecord> pendingExchanges() {
        return recordStore.findPendingByKind(TransactionKind.EXCHANGE);
    }

    private void requireExchange(Long transactionId, String operation) {
        TransactionRecord record = recordStore.get(transactionId);
        if (record.getKind() != TransactionKind.EXCHANGE) {
            throw new InvalidTransactionStateException(transactionId,
                record.getKind() + "/" + record.getStatus(), operation);
        }
    }
}
