package com.tokenledger.ledger;

import com.tokenledger.IntegrationTestBase;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.InvalidTransactionStateException;
import com.tokenledger.common.exception.TransactionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for record creation and the per-kind status machines.
 */
@Transactional
class TransactionRecordStoreTest extends IntegrationTestBase {

    private String accountId;

    @BeforeEach
    void setUp() {
        accountId = newAccount();
    }

    @Test
    void testWithdrawalLifecycle() {
        TransactionRecord withdrawal = recordStore.createWithdrawal(
            accountId, usdt("5"), EXTERNAL_ADDRESS, usdt("0.4"));
        assertEquals(TransactionStatus.PENDING, withdrawal.getStatus());
        assertEquals(TransactionKind.WITHDRAWAL, withdrawal.getKind());
        assertEquals(usdt("5.4"), withdrawal.getReservedAmount());

        String reference = randomReference();
        recordStore.updateStatus(withdrawal.getId(), StatusTransition.processing());
        recordStore.updateStatus(withdrawal.getId(), StatusTransition.submitted(reference));
        TransactionRecord completed = recordStore.updateStatus(
            withdrawal.getId(), StatusTransition.withdrawalCompleted(1));

        assertEquals(TransactionStatus.COMPLETED, completed.getStatus());
        assertEquals(reference, completed.getChainTxReference());
        assertEquals(1, completed.getConfirmationCount());
        assertNotNull(completed.getCompletedAt());
    }

    @Test
    void testWithdrawal_DisallowedTransitions() {
        Long id = recordStore.createWithdrawal(accountId, usdt("5"), EXTERNAL_ADDRESS, usdt("0.4")).getId();

        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.submitted(randomReference())));
        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.failed("too early")));
        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.exchangeCompleted("wrong kind")));

        recordStore.updateStatus(id, StatusTransition.processing());
        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.processing()));
        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.withdrawalCompleted(1)));

        recordStore.updateStatus(id, StatusTransition.failed("Failed: node down"));
        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.failed("again")));

        TransactionRecord failed = recordStore.get(id);
        assertEquals(TransactionStatus.FAILED, failed.getStatus());
        assertEquals("Failed: node down", failed.getAdminNote());
    }

    @Test
    void testExchange_OnlyAdministrativeTransitions() {
        Long id = recordStore.createExchange(accountId, usdt("10"), Money.of("395", Currency.UAH)).getId();

        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.processing()));

        TransactionRecord completed = recordStore.updateStatus(id, StatusTransition.exchangeCompleted("paid"));
        assertEquals(TransactionStatus.COMPLETED, completed.getStatus());
        assertEquals("paid", completed.getAdminNote());

        assertThrows(InvalidTransactionStateException.class,
            () -> recordStore.updateStatus(id, StatusTransition.failed("late")));
    }

    @Test
    void testDeposit_BornCompletedAndImmutable() {
        TransactionRecord deposit = creditDeposit(accountId, "10.1234");

        assertEquals(TransactionStatus.COMPLETED, deposit.getStatus());
        assertEquals(6, deposit.getConfirmationCount());
        assertNotNull(deposit.getCompletedAt());

        for (StatusTransition transition : List.of(
                StatusTransition.processing(),
                StatusTransition.failed("no"),
                StatusTransition.exchangeCompleted("no"))) {
            assertThrows(InvalidTransactionStateException.class,
                () -> recordStore.updateStatus(deposit.getId(), transition));
        }
    }

    @Test
    void testTerminalRecords_RejectEveryTransition() {
        Long completedId = recordStore.createExchange(accountId, usdt("10"), Money.of("395", Currency.UAH)).getId();
        recordStore.updateStatus(completedId, StatusTransition.exchangeCompleted("paid"));
        Long failedId = recordStore.createWithdrawal(accountId, usdt("5"), EXTERNAL_ADDRESS, usdt("0.4")).getId();
        recordStore.updateStatus(failedId, StatusTransition.processing());
        recordStore.updateStatus(failedId, StatusTransition.failed("Failed: reverted"));

        for (Long id : List.of(completedId, failedId)) {
            assertTrue(recordStore.get(id).getStatus().isTerminal());
            for (StatusTransition transition : List.of(
                    StatusTransition.processing(),
                    StatusTransition.submitted(randomReference()),
                    StatusTransition.withdrawalCompleted(1),
                    StatusTransition.exchangeCompleted("again"),
                    StatusTransition.failed("again"))) {
                assertThrows(InvalidTransactionStateException.class, () -> recordStore.updateStatus(id, transition));
            }
        }
        assertFalse(TransactionStatus.PENDING.isTerminal());
        assertFalse(TransactionStatus.PROCESSING.isTerminal());
    }

    @Test
    void testTransitionFields_AreValidated() {
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.submitted(" "));
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.withdrawalCompleted(0));
    }

    @Test
    void testAmountMustBePositiveToken() {
        assertThrows(IllegalArgumentException.class,
            () -> recordStore.createWithdrawal(accountId, usdt("0"), EXTERNAL_ADDRESS, usdt("0.4")));
        assertThrows(IllegalArgumentException.class,
            () -> recordStore.createExchange(accountId, usdt("10"), usdt("10")));
        assertThrows(IllegalArgumentException.class,
            () -> recordStore.createExchange(accountId, Money.of("10", Currency.USD), Money.of("10", Currency.USD)));
    }

    @Test
    void testGet_NotFound() {
        assertThrows(TransactionNotFoundException.class, () -> recordStore.get(Long.MAX_VALUE));
        assertThrows(TransactionNotFoundException.class,
            () -> recordStore.updateStatus(Long.MAX_VALUE, StatusTransition.processing()));
    }

    @Test
    void testHistory_NewestFirstWithLimit() {
        TransactionRecord first = creditDeposit(accountId, "1");
        TransactionRecord second = creditDeposit(accountId, "2");
        TransactionRecord third = recordStore.createWithdrawal(accountId, usdt("1"), EXTERNAL_ADDRESS, usdt("0.4"));
        creditDeposit(newAccount(), "99");

        List<TransactionRecord> history = recordStore.historyForAccount(accountId, 10);
        assertEquals(List.of(third.getId(), second.getId(), first.getId()),
            history.stream().map(TransactionRecord::getId).toList());

        assertEquals(2, recordStore.historyForAccount(accountId, 2).size());
        assertThrows(IllegalArgumentException.class, () -> recordStore.historyForAccount(accountId, 0));
    }

    @Test
    void testFindPendingByKind_OldestFirst() {
        TransactionRecord older = recordStore.createExchange(accountId, usdt("1"), Money.of("1", Currency.USD));
        TransactionRecord newer = recordStore.createExchange(accountId, usdt("2"), Money.of("2", Currency.USD));
        TransactionRecord done = recordStore.createExchange(accountId, usdt("3"), Money.of("3", Currency.USD));
        recordStore.updateStatus(done.getId(), StatusTransition.exchangeCompleted(null));

        List<Long> pending = recordStore.findPendingByKind(TransactionKind.EXCHANGE).stream()
            .map(TransactionRecord::getId)
            .toList();

        assertTrue(pending.indexOf(older.getId()) < pending.indexOf(newer.getId()));
        assertTrue(pending.contains(older.getId()));
        assertFalse(pending.contains(done.getId()));
    }

    @Test
    void testFindByChainTxReference() {
        TransactionRecord deposit = creditDeposit(accountId, "3");

        assertEquals(deposit.getId(),
            recordStore.findByChainTxReference(deposit.getChainTxReference()).orElseThrow().getId());
        assertTrue(recordStore.isSettled(deposit.getChainTxReference()));
        assertFalse(recordStore.isSettled(randomReference()));
    }
}
