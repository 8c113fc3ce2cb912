package com.amannmalik.money.format;

import com.amannmalik.money.api.CurrencyCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class LocaleCurrencyFormatterTest {
    private static final CurrencyCode USD = new CurrencyCode("USD");
    private static final LocaleCurrencyFormatter FORMATTER = LocaleCurrencyFormatter.INSTANCE;

    @Test
    void formatsWithGroupingAndCurrencyDigits() {
        assertEquals("$10.00", FORMATTER.format(new BigDecimal("10.00"), USD, Locale.US));
        assertEquals("$1,234.50", FORMATTER.format(new BigDecimal("1234.5"), USD, Locale.US));
        assertEquals("$6,150,593.22", FORMATTER.format(new BigDecimal("6150593.22"), USD, Locale.US));
    }

    @Test
    void extraDigitsRoundHalfEven() {
        assertEquals("$0.12", FORMATTER.format(new BigDecimal("0.125"), USD, Locale.US));
        assertEquals("$0.14", FORMATTER.format(new BigDecimal("0.135"), USD, Locale.US));
    }

    @Test
    void zeroDigitCurrenciesDropFraction() {
        assertEquals("¥1,235", FORMATTER.format(new BigDecimal("1234.56"), new CurrencyCode("JPY"), Locale.US));
    }

    @Test
    void argumentsAreRequired() {
        assertThrows(NullPointerException.class, () -> FORMATTER.format(null, USD, Locale.US));
        assertThrows(NullPointerException.class, () -> FORMATTER.format(BigDecimal.ONE, null, Locale.US));
        assertThrows(NullPointerException.class, () -> FORMATTER.format(BigDecimal.ONE, USD, null));
    }
}
