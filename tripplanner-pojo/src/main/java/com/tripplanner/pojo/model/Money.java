package com.tripplanner.pojo.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 金额：两位小数 + ISO 币种代码。
 * Amount with an ISO currency code, always kept at scale 2.
 */
@Value
@Builder
@Jacksonized
public class Money {

    BigDecimal amount;

    String currency;

    public static Money of(BigDecimal amount, String currency) {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(currency, "currency");
        return new Money(amount.setScale(2, RoundingMode.HALF_UP), currency.toUpperCase());
    }

    public static Money of(double amount, String currency) {
        return of(BigDecimal.valueOf(amount), currency);
    }

    public static Money zero(String currency) {
        return of(BigDecimal.ZERO, currency);
    }

    public Money plus(Money other) {
        requireSameCurrency(other);
        return of(amount.add(other.amount), currency);
    }

    public Money minus(Money other) {
        requireSameCurrency(other);
        return of(amount.subtract(other.amount), currency);
    }

    public boolean exceeds(Money other) {
        requireSameCurrency(other);
        return amount.compareTo(other.amount) > 0;
    }

    public boolean sameCurrency(Money other) {
        return other != null && currency.equalsIgnoreCase(other.currency);
    }

    public int signum() {
        return amount.signum();
    }

    private void requireSameCurrency(Money other) {
        if (!sameCurrency(other)) {
            throw new IllegalArgumentException("currency mismatch: " + currency + " vs "
                    + (other == null ? "null" : other.currency));
        }
    }

    @Override
    public String toString() {
        return currency + " " + amount.toPlainString();
    }
}
