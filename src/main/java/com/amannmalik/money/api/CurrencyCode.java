package com.amannmalik.money.api;

import com.amannmalik.money.util.Ensure;

import java.util.Currency;
import java.util.Locale;
import java.util.regex.Pattern;

public record CurrencyCode(String value) {
    private static final Pattern ISO_4217 = Pattern.compile("^[A-Z]{3}$");

    public CurrencyCode {
        var normalized = Ensure.nonBlank("currency", value).strip().toUpperCase(Locale.ROOT);
        if (!ISO_4217.matcher(normalized).matches()) {
            throw new IllegalArgumentException("currency MUST be an uppercase ISO-4217 code");
        }
        value = normalized;
    }

    /// Fails with IllegalArgumentException when the JDK has no currency data for this code.
    public Currency toCurrency() {
        return Currency.getInstance(value);
    }

    public int fractionDigits() {
        return Ensure.nonNegative("currency.fraction_digits", toCurrency().getDefaultFractionDigits());
    }

    @Override
    public String toString() {
        return value;
    }
}
