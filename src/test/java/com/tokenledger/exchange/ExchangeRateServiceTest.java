package com.tokenledger.exchange;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExchangeRateServiceTest {

    @Mock
    private ExchangeRateRepository rateRepository;

    private ExchangeRateService rateService;

    @BeforeEach
    void setUp() {
        rateService = new ExchangeRateService(rateRepository, new BigDecimal("1.0"), new BigDecimal("39.5"));
    }

    @Test
    void testCurrentRates_InitializedWithDefaults() {
        when(rateRepository.findById(1L)).thenReturn(Optional.empty());
        when(rateRepository.save(any(ExchangeRate.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ExchangeRate rates = rateService.currentRates();

        assertEquals(1L, rates.getId());
        assertEquals(new BigDecimal("1.000000"), rates.getRateToUsd());
        assertEquals(new BigDecimal("39.500000"), rates.getRateToUah());
    }

    @Test
    void testUpdateRates_PartialUpdate() {
        when(rateRepository.findById(1L))
            .thenReturn(Optional.of(new ExchangeRate(new BigDecimal("1.000000"), new BigDecimal("39.500000"))));
        when(rateRepository.save(any(ExchangeRate.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ExchangeRate rates = rateService.updateRates(null, new BigDecimal("41.25"));

        assertEquals(new BigDecimal("1.000000"), rates.getRateToUsd());
        assertEquals(new BigDecimal("41.250000"), rates.getRateToUah());
    }

    @Test
    void testUpdateRates_RejectsNonPositive() {
        when(rateRepository.findById(1L))
            .thenReturn(Optional.of(new ExchangeRate(new BigDecimal("1.000000"), new BigDecimal("39.500000"))));

        assertThrows(IllegalArgumentException.class, () -> rateService.updateRates(BigDecimal.ZERO, null));
        assertThrows(IllegalArgumentException.class, () -> rateService.updateRates(null, new BigDecimal("-1")));
        verify(rateRepository, never()).save(any());
    }

    @Test
    void testUpdateRates_RejectsOutOfRange() {
        when(rateRepository.findById(1L))
            .thenReturn(Optional.of(new ExchangeRate(new BigDecimal("1.000000"), new BigDecimal("39.500000"))));

        assertThrows(IllegalArgumentException.class,
            () -> rateService.updateRates(new BigDecimal("1E+100000000"), null));
        assertThrows(IllegalArgumentException.class,
            () -> rateService.updateRates(null, new BigDecimal("1000000000000")));
        verify(rateRepository, never()).save(any());
    }

    @Test
    void testConvert_RoundsHalfUpToCents() {
        when(rateRepository.findById(1L))
            .thenReturn(Optional.of(new ExchangeRate(new BigDecimal("0.998750"), new BigDecimal("39.500000"))));

        assertEquals(Money.of("9.99", Currency.USD),
            rateService.convert(Money.of("10", Currency.USDT), Currency.USD));
        assertEquals(Money.of("4.88", Currency.UAH),
            rateService.convert(Money.of("0.123456", Currency.USDT), Currency.UAH));
    }

    @Test
    void testConvert_RejectsNonFiatTarget() {
        when(rateRepository.findById(1L))
            .thenReturn(Optional.of(new ExchangeRate(new BigDecimal("1.000000"), new BigDecimal("39.500000"))));

        assertThrows(IllegalArgumentException.class,
            () -> rateService.convert(Money.of("10", Currency.USDT), Currency.USDT));
    }
}
