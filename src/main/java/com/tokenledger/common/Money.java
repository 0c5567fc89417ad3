package com.tokenledger.common;

import com.tokenledger.common.exception.InvalidAmountException;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Immutable value object representing an exact monetary amount with currency.
 *
 * Amounts are fixed-point: token amounts keep 6 fractional digits, fiat amounts 2.
 * Every factory rounds half-up to the currency scale, so two equal amounts always
 * carry the same scale and compare equal.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Money {

    /**
     * Largest number of integer digits an amount may carry; keeps every value
     * within the 24 digit ledger columns.
     */
    public static final int MAX_INTEGER_DIGITS = 18;

    private static final Pattern PLAIN_DECIMAL =
        Pattern.compile("[+-]?\\d{1," + MAX_INTEGER_DIGITS + "}(\\.\\d{1,18})?");

    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    private Currency currency;

    public static Money of(BigDecimal amount, Currency currency) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency cannot be null");
        }
        if (amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException("Amount out of range: " + amount.toString());
        }
        return new Money(amount.setScale(currency.getScale(), RoundingMode.HALF_UP), currency);
    }

    /**
     * Read an amount from its plain decimal string form. Zero and negative values are accepted.
     * Exponent notation and more than {@link #MAX_INTEGER_DIGITS} integer digits are not.
     *
     * @throws InvalidAmountException if the string is not a plain decimal number in range
     */
    public static Money of(String amount, Currency currency) {
        if (amount == null || !PLAIN_DECIMAL.matcher(amount.trim()).matches()) {
            throw new InvalidAmountException(amount);
        }
        return of(new BigDecimal(amount.trim()), currency);
    }

    /**
     * Parse user supplied input. Only strictly positive amounts (after rounding) are valid.
     *
     * @throws InvalidAmountException if the string is malformed or not positive
     */
    public static Money parse(String amount, Currency currency) {
        Money money = of(amount, currency);
        if (!money.isPositive()) {
            throw new InvalidAmountException(amount);
        }
        return money;
    }

    public static Money zero(Currency currency) {
        return of(BigDecimal.ZERO, currency);
    }

    public Money add(Money other) {
        validateSameCurrency(other);
        return of(this.amount.add(other.amount), this.currency);
    }

    public Money subtract(Money other) {
        validateSameCurrency(other);
        return of(this.amount.subtract(other.amount), this.currency);
    }

    /**
     * Multiply by a conversion rate, producing an amount in the target currency.
     */
    public Money convert(BigDecimal rate, Currency targetCurrency) {
        return of(this.amount.multiply(rate), targetCurrency);
    }

    public boolean isGreaterThan(Money other) {
        validateSameCurrency(other);
        return this.amount.compareTo(other.amount) > 0;
    }

    public boolean isLessThan(Money other) {
        validateSameCurrency(other);
        return this.amount.compareTo(other.amount) < 0;
    }

    public boolean isPositive() {
        return this.amount.compareTo(BigDecimal.ZERO) > 0;
    }

    public boolean isNegative() {
        return this.amount.compareTo(BigDecimal.ZERO) < 0;
    }

    public boolean isZero() {
        return this.amount.compareTo(BigDecimal.ZERO) == 0;
    }

    /**
     * Render with exactly as many fractional digits as the currency keeps.
     */
    public String format() {
        return amount.setScale(currency.getScale(), RoundingMode.HALF_UP).toPlainString();
    }

    @Override
    public String toString() {
        return format() + " " + currency;
    }

    private void validateSameCurrency(Money other) {
        if (!this.currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                String.format("Cannot perform operation on different currencies: %s and %s",
                    this.currency, other.currency)
            );
        }
    }
}
