package com.tokenledger.exchange;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Administrator-maintained token to fiat rates. There is only ever one row.
 */
@Entity
@Table(name = "exchange_rates")
@Data
@NoArgsConstructor
public class ExchangeRate {

    static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "rate_to_usd", precision = 18, scale = 6, nullable = false)
    private BigDecimal rateToUsd;

    @Column(name = "rate_to_uah", precision = 18, scale = 6, nullable = false)
    private BigDecimal rateToUah;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ExchangeRate(BigDecimal rateToUsd, BigDecimal rateToUah) {
        this.id = SINGLETON_ID;
        this.rateToUsd = rateToUsd;
        this.rateToUah = rateToUah;
        this.updatedAt = Instant.now();
    }
}
