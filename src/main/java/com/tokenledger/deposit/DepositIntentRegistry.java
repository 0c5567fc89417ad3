package com.tokenledger.deposit;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.common.exception.NoOpenIntentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps at most one open deposit intent per account.
 *
 * Opening an intent replaces the previous one. Intents expire after a fixed
 * time-to-live; an expired intent is removed the next time it is read.
 */
@Service
@Slf4j
public class DepositIntentRegistry {

    private static final int SUFFIX_RANGE = 10_000;
    private static final int SUFFIX_SCALE = 4;

    private final DepositIntentRepository intentRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Duration ttl;
    private final Money defaultBaseAmount;

    public DepositIntentRegistry(
            DepositIntentRepository intentRepository,
            Clock clock,
            @Value("${token-ledger.deposits.intent-ttl-hours:24}") long ttlHours,
            @Value("${token-ledger.deposits.default-base-amount:10}") String defaultBaseAmount) {
        this.intentRepository = intentRepository;
        this.clock = clock;
        this.ttl = Duration.ofHours(ttlHours);
        this.defaultBaseAmount = Money.parse(defaultBaseAmount, Currency.USDT);
    }

    /**
     * Open an intent for the base amount plus a random suffix between 0.0000 and 0.9999.
     */
    @Transactional
    public DepositIntent open(String accountId, Money baseAmount) {
        Money base = baseAmount != null ? baseAmount : defaultBaseAmount;
        if (!base.isPositive()) {
            throw new IllegalArgumentException("Deposit base amount must be positive: " + base);
        }

        BigDecimal suffix = BigDecimal.valueOf(random.nextInt(SUFFIX_RANGE), SUFFIX_SCALE);
        return openExact(accountId, base.add(Money.of(suffix, Currency.USDT)));
    }

    /**
     * Open an intent for exactly the given amount.
     */
    @Transactional
    public DepositIntent openExact(String accountId, Money expectedAmount) {
        Instant now = clock.instant();
        DepositIntent intent = intentRepository.save(
            new DepositIntent(accountId, expectedAmount, now, now.plus(ttl)));

        log.info("Opened deposit intent for account {}: expected={}, expiresAt={}",
            accountId, expectedAmount, intent.getExpiresAt());

        return intent;
    }

    /**
     * @throws NoOpenIntentException if the account has no intent or it has expired
     */
    @Transactional
    public DepositIntent get(String accountId) {
        return find(accountId).orElseThrow(() -> new NoOpenIntentException(accountId));
    }

    @Transactional
    public Optional<DepositIntent> find(String accountId) {
        Optional<DepositIntent> intent = intentRepository.findById(accountId);
        if (intent.isPresent() && intent.get().isExpiredAt(clock.instant())) {
            log.info("Deposit intent for account {} expired at {}", accountId, intent.get().getExpiresAt());
            intentRepository.delete(intent.get());
            return Optional.empty();
        }
        return intent;
    }

    @Transactional
    public void clear(String accountId) {
        if (intentRepository.existsById(accountId)) {
            intentRepository.deleteById(accountId);
            log.debug("Cleared deposit intent for account {}", accountId);
        }
    }
}
