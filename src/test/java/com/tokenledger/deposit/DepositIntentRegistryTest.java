package com.tokenledger.deposit;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.NoOpenIntentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DepositIntentRegistry with a fixed clock.
 */
@ExtendWith(MockitoExtension.class)
class DepositIntentRegistryTest {

    private static final String ACCOUNT_ID = "acct-1";
    private static final Instant OPENED_AT = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private DepositIntentRepository intentRepository;

    private DepositIntentRegistry registryAt(Instant now) {
        return new DepositIntentRegistry(intentRepository, Clock.fixed(now, ZoneOffset.UTC), 24, "10");
    }

    @Test
    void testOpen_AddsFourDigitSuffix() {
        when(intentRepository.save(any(DepositIntent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        DepositIntentRegistry registry = registryAt(OPENED_AT);

        for (int i = 0; i < 200; i++) {
            BigDecimal expected = registry.open(ACCOUNT_ID, null).getExpectedAmount().getAmount();

            assertEquals(6, expected.scale());
            assertTrue(expected.compareTo(new BigDecimal("10")) >= 0, "below base: " + expected);
            assertTrue(expected.compareTo(new BigDecimal("10.9999")) <= 0, "above range: " + expected);
            assertEquals(0, expected.remainder(new BigDecimal("0.0001")).signum(), "more than 4 digits: " + expected);
        }
    }

    @Test
    void testOpen_UsesBaseAndTtl() {
        when(intentRepository.save(any(DepositIntent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DepositIntent intent = registryAt(OPENED_AT).open(ACCOUNT_ID, Money.of("25", Currency.USDT));

        assertEquals(ACCOUNT_ID, intent.getAccountId());
        assertTrue(intent.getExpectedAmount().getAmount().compareTo(new BigDecimal("25")) >= 0);
        assertTrue(intent.getExpectedAmount().getAmount().compareTo(new BigDecimal("26")) < 0);
        assertEquals(OPENED_AT, intent.getCreatedAt());
        assertEquals(OPENED_AT.plus(Duration.ofHours(24)), intent.getExpiresAt());
    }

    @Test
    void testOpenExact_ReplacesExistingIntent() {
        when(intentRepository.save(any(DepositIntent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        DepositIntentRegistry registry = registryAt(OPENED_AT);

        registry.openExact(ACCOUNT_ID, Money.of("10.1234", Currency.USDT));
        registry.openExact(ACCOUNT_ID, Money.of("10.5678", Currency.USDT));

        ArgumentCaptor<DepositIntent> saved = ArgumentCaptor.forClass(DepositIntent.class);
        verify(intentRepository, times(2)).save(saved.capture());
        assertEquals(ACCOUNT_ID, saved.getAllValues().get(1).getAccountId());
        assertEquals(Money.of("10.5678", Currency.USDT), saved.getAllValues().get(1).getExpectedAmount());
    }

    @Test
    void testOpen_RejectsNonPositiveBase() {
        assertThrows(IllegalArgumentException.class,
            () -> registryAt(OPENED_AT).open(ACCOUNT_ID, Money.zero(Currency.USDT)));
        verifyNoInteractions(intentRepository);
    }

    @Test
    void testGet_BeforeExpiry() {
        DepositIntent intent = intentOpenedAt(OPENED_AT);
        when(intentRepository.findById(ACCOUNT_ID)).thenReturn(Optional.of(intent));

        DepositIntent found = registryAt(OPENED_AT.plus(Duration.ofHours(24)).minusSeconds(1)).get(ACCOUNT_ID);

        assertSame(intent, found);
        verify(intentRepository, never()).delete(any());
    }

    @Test
    void testGet_ExpiredIntentIsDeletedAndAbsent() {
        DepositIntent intent = intentOpenedAt(OPENED_AT);
        when(intentRepository.findById(ACCOUNT_ID)).thenReturn(Optional.of(intent));

        DepositIntentRegistry registry = registryAt(OPENED_AT.plus(Duration.ofHours(24)).plusMillis(1));

        assertThrows(NoOpenIntentException.class, () -> registry.get(ACCOUNT_ID));
        verify(intentRepository).delete(intent);
    }

    @Test
    void testGet_ExactlyAtTtlIsExpired() {
        DepositIntent intent = intentOpenedAt(OPENED_AT);
        when(intentRepository.findById(ACCOUNT_ID)).thenReturn(Optional.of(intent));

        assertTrue(registryAt(OPENED_AT.plus(Duration.ofHours(24))).find(ACCOUNT_ID).isEmpty());
    }

    @Test
    void testGet_NoIntent() {
        when(intentRepository.findById(ACCOUNT_ID)).thenReturn(Optional.empty());

        assertThrows(NoOpenIntentException.class, () -> registryAt(OPENED_AT).get(ACCOUNT_ID));
    }

    @Test
    void testClear() {
        when(intentRepository.existsById(ACCOUNT_ID)).thenReturn(true);

        registryAt(OPENED_AT).clear(ACCOUNT_ID);

        verify(intentRepository).deleteById(ACCOUNT_ID);
    }

    private static DepositIntent intentOpenedAt(Instant openedAt) {
        return new DepositIntent(ACCOUNT_ID, Money.of("10.1234", Currency.USDT),
            openedAt, openedAt.plus(Duration.ofHours(24)));
    }
}
