package com.tokenledger.exchange;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Reads and updates the token to fiat rates.
 */
@Service
@Slf4j
public class ExchangeRateService {

    private static final int RATE_SCALE = 6;
    private static final int RATE_MAX_INTEGER_DIGITS = 12;

    private final ExchangeRateRepository rateRepository;
    private final BigDecimal defaultRateToUsd;
    private final BigDecimal defaultRateToUah;

    public ExchangeRateService(
            ExchangeRateRepository rateRepository,
            @Value("${token-ledger.exchange.default-rate-usd:1.0}") BigDecimal defaultRateToUsd,
            @Value("${token-ledger.exchange.default-rate-uah:39.5}") BigDecimal defaultRateToUah) {
        this.rateRepository = rateRepository;
        this.defaultRateToUsd = defaultRateToUsd.setScale(RATE_SCALE, RoundingMode.HALF_UP);
        this.defaultRateToUah = defaultRateToUah.setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Current rates, created with the configured defaults on first use.
     */
    @Transactional
    public ExchangeRate currentRates() {
        return rateRepository.findById(ExchangeRate.SINGLETON_ID)
            .orElseGet(() -> {
                log.info("Initializing exchange rates: USD={}, UAH={}", defaultRateToUsd, defaultRateToUah);
                return rateRepository.save(new ExchangeRate(defaultRateToUsd, defaultRateToUah));
            });
    }

    /**
     * Update either or both rates. A null rate keeps its current value.
     */
    @Transactional
    public ExchangeRate updateRates(BigDecimal rateToUsd, BigDecimal rateToUah) {
        ExchangeRate rates = currentRates();

        if (rateToUsd != null) {
            rates.setRateToUsd(requirePositive(rateToUsd, Currency.USD));
        }
        if (rateToUah != null) {
            rates.setRateToUah(requirePositive(rateToUah, Currency.UAH));
        }
        rates.setUpdatedAt(Instant.now());

        ExchangeRate saved = rateRepository.save(rates);
        log.info("Exchange rates updated: USD={}, UAH={}", saved.getRateToUsd(), saved.getRateToUah());
        return saved;
    }

    @Transactional
    public BigDecimal rateFor(Currency fiatCurrency) {
        ExchangeRate rates = currentRates();
        return switch (fiatCurrency) {
            case USD -> rates.getRateToUsd();
            case UAH -> rates.getRateToUah();
            default -> throw new IllegalArgumentException("Not a fiat currency: " + fiatCurrency);
        };
    }

    /**
     * Token amount converted at the current rate, rounded half-up to cents.
     */
    @Transactional
    public Money convert(Money tokenAmount, Currency fiatCurrency) {
        if (tokenAmount.getCurrency() != Currency.USDT) {
            throw new IllegalArgumentException("Only token amounts can be exchanged: " + tokenAmount);
        }
        return tokenAmount.convert(rateFor(fiatCurrency), fiatCurrency);
    }

    private static BigDecimal requirePositive(BigDecimal rate, Currency currency) {
        if (rate.signum() <= 0) {
            throw new IllegalArgumentException("Rate to " + currency + " must be positive: " + rate);
        }
        if (rate.precision() - rate.scale() > RATE_MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException("Rate to " + currency + " out of range: " + rate);
        }
        return rate.setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }
}
