package com.amannmalik.money.format;

import com.amannmalik.money.api.CurrencyCode;
import com.amannmalik.money.spi.format.MoneyFormatter;
import com.amannmalik.money.util.Ensure;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Standard locale currency format backed by {@link NumberFormat#getCurrencyInstance(Locale)}.
 * The currency's default fraction digits are always shown, so {@code 10} renders as
 * {@code $10.00} in {@link Locale#US}.
 */
public final class LocaleCurrencyFormatter implements MoneyFormatter {
    public static final LocaleCurrencyFormatter INSTANCE = new LocaleCurrencyFormatter();

    private LocaleCurrencyFormatter() {
    }

    @Override
    public String format(BigDecimal majorUnits, CurrencyCode currency, Locale locale) {
        Ensure.notNull("format.major_units", majorUnits);
        Ensure.notNull("format.currency", currency);
        Ensure.notNull("format.locale", locale);
        // NumberFormat is stateful; never share one across calls.
        var numberFormat = NumberFormat.getCurrencyInstance(locale);
        numberFormat.setCurrency(currency.toCurrency());
        var digits = currency.fractionDigits();
        numberFormat.setMinimumFractionDigits(digits);
        numberFormat.setMaximumFractionDigits(digits);
        numberFormat.setRoundingMode(RoundingMode.HALF_EVEN);
        return numberFormat.format(majorUnits);
    }
}
