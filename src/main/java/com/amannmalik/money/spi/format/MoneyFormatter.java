package com.amannmalik.money.spi.format;

import com.amannmalik.money.api.CurrencyCode;

import java.math.BigDecimal;
import java.util.Locale;

/// Turns a major-unit amount into display text. Implementations own locale data,
/// grouping and symbol placement; callers only supply a correctly scaled value.
public interface MoneyFormatter {
    MoneyFormatter PLAIN = (majorUnits, currency, locale) -> majorUnits.toPlainString() + " " + currency;

    String format(BigDecimal majorUnits, CurrencyCode currency, Locale locale);
}
