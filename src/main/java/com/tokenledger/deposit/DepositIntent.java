package com.tokenledger.deposit;

import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An account's announced deposit: the exact amount it is expected to send to
 * the shared deposit address. The random fractional part makes the amount
 * identify the account when the transfer shows up on chain.
 */
@Entity
@Table(name = "deposit_intents")
@Data
@NoArgsConstructor
public class DepositIntent {

    @Id
    private String accountId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "expected_amount", precision = 24, scale = 6, nullable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "expected_currency", nullable = false))
    })
    private Money expectedAmount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public DepositIntent(String accountId, Money expectedAmount, Instant createdAt, Instant expiresAt) {
        if (expectedAmount.getCurrency() != Currency.USDT || !expectedAmount.isPositive()) {
            throw new IllegalArgumentException("Expected deposit must be a positive token amount: " + expectedAmount);
        }
        this.accountId = accountId;
        this.expectedAmount = expectedAmount;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
