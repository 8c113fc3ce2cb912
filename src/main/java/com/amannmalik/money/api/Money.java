package com.amannmalik.money.api;

import com.amannmalik.money.format.LocaleCurrencyFormatter;
import com.amannmalik.money.spi.format.MoneyFormatter;
import com.amannmalik.money.util.Ensure;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fowler's Money pattern: an immutable amount held as a signed count of minor units
 * (cents for USD), so arithmetic never goes through binary floating point unless a
 * caller explicitly hands in a {@code double}.
 *
 * <p>Every operation is typed by the operand it accepts. Overloads taking {@link Number}
 * exist for boxed values and check the nominal type at runtime:
 * <ul>
 *     <li>{@code add}, {@code subtract} and the comparisons take integers only and reject
 *     floating point with {@link InvalidOperandException};</li>
 *     <li>{@code multiply}, {@code divide} and {@code floorDivide} take integers and floating
 *     point values.</li>
 * </ul>
 *
 * <p>Equality and ordering look at {@link #amount()} only. The currency code is carried for
 * display and is not compared.
 */
public record Money(long amount, CurrencyCode currency) implements Comparable<Money> {
    public static final CurrencyCode DEFAULT_CURRENCY = new CurrencyCode("USD");
    public static final Locale DISPLAY_LOCALE = Locale.US;
    private static final int MINOR_UNIT_SCALE = 2;
    private static final long MINOR_UNITS_PER_MAJOR_UNIT = 100L;
    private static final Pattern NON_DECIMAL_CHARACTERS = Pattern.compile("[^0-9.]");

    public Money {
        currency = Ensure.notNull("money.currency", currency);
    }

    public Money(long amount) {
        this(amount, DEFAULT_CURRENCY);
    }

    public static Money of(long amount) {
        return new Money(amount);
    }

    /// Accepts integral boxed types only; floating point and decimal values are rejected.
    public static Money of(Number amount) {
        return new Money(Operands.integralAmount(amount));
    }

    /**
     * Converts a major-unit amount by flooring {@code amount * 100}. This truncates toward
     * negative infinity, so {@code fromFloat(-0.001)} is one cent below zero and the result
     * can differ from a half-even rounding of the same value.
     */
    public static Money fromFloat(double amount) {
        if (!Double.isFinite(amount)) {
            throw new InvalidAmountException("amount MUST be finite, got " + amount);
        }
        var minorUnits = Math.floor(amount * MINOR_UNITS_PER_MAJOR_UNIT);
        if (!Operands.fitsLong(minorUnits)) {
            throw new InvalidAmountException("amount exceeds minor unit range: " + amount);
        }
        return new Money((long) minorUnits);
    }

    public static Money fromFloat(Number amount) {
        if (!Operands.isFloating(amount)) {
            throw new InvalidAmountException("amount MUST be a floating point value");
        }
        return fromFloat(amount.doubleValue());
    }

    /**
     * Parses a display string such as {@code "$6,150,593.22"}. Everything but ASCII digits and
     * {@code '.'} is discarded before the remainder is read as an exact decimal, which also
     * discards a leading minus sign: {@code "-$5.00"} parses as five dollars.
     */
    public static Money fromString(String text) {
        if (text == null) {
            throw new InvalidAmountException("amount MUST be a string");
        }
        var digits = NON_DECIMAL_CHARACTERS.matcher(text).replaceAll("");
        BigDecimal value;
        try {
            value = new BigDecimal(digits);
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Unparsable currency string: " + text, e);
        }
        return fromFloat(value.doubleValue());
    }

    public Money instance(long amount) {
        return new Money(amount, currency);
    }

    public Money instance(Number amount) {
        return instance(Operands.integralAmount(amount));
    }

    public Money add(Money other) {
        return add(requireMoney("add", other).amount);
    }

    public Money add(long other) {
        return instance(Math.addExact(amount, other));
    }

    public Money add(Number other) {
        return add(Operands.integral("add", other));
    }

    public Money subtract(Money other) {
        return subtract(requireMoney("subtract", other).amount);
    }

    public Money subtract(long other) {
        return instance(Math.subtractExact(amount, other));
    }

    public Money subtract(Number other) {
        return subtract(Operands.integral("subtract", other));
    }

    /// Reflected subtraction: minuend - this.
    public Money subtractFrom(long minuend) {
        return instance(Math.subtractExact(minuend, amount));
    }

    public Money subtractFrom(Number minuend) {
        return subtractFrom(Operands.integral("subtract", minuend));
    }

    public Money multiply(long factor) {
        return instance(Math.multiplyExact(amount, factor));
    }

    /// Rounds the binary product half-even: of(1000).multiply(1.0009) is 1001.
    public Money multiply(double factor) {
        Operands.finite("multiply", factor);
        return instance(Operands.minorUnits("multiply", Math.rint(amount * factor)));
    }

    public Money multiply(Number factor) {
        if (Operands.isIntegral(factor)) {
            return multiply(Operands.integral("multiply", factor));
        }
        if (Operands.isFloating(factor)) {
            return multiply(factor.doubleValue());
        }
        throw new InvalidOperandException("multiply", factor);
    }

    /**
     * Ratio of two amounts, rounded half-even to a plain number. Unlike
     * {@link #floorDivide(Money)} the result is not a {@code Money}.
     */
    public long divide(Money divisor) {
        var other = requireMoney("divide", divisor).amount;
        if (other == 0) {
            throw new DivisionByZeroException("divide");
        }
        return halfEvenQuotient(amount, other);
    }

    public Money divide(long divisor) {
        if (divisor == 0) {
            throw new DivisionByZeroException("divide");
        }
        return instance(halfEvenQuotient(amount, divisor));
    }

    public Money divide(double divisor) {
        if (divisor == 0.0) {
            throw new DivisionByZeroException("divide");
        }
        Operands.finite("divide", divisor);
        return instance(Operands.minorUnits("divide", Math.rint(amount / divisor)));
    }

    public Money divide(Number divisor) {
        if (Operands.isIntegral(divisor)) {
            return divide(Operands.integral("divide", divisor));
        }
        if (Operands.isFloating(divisor)) {
            return divide(divisor.doubleValue());
        }
        throw new InvalidOperandException("divide", divisor);
    }

    /// Floor quotient of two amounts wrapped as a Money, where divide(Money) returns a plain long.
    public Money floorDivide(Money divisor) {
        var other = requireMoney("floorDivide", divisor).amount;
        if (other == 0) {
            throw new DivisionByZeroException("floorDivide");
        }
        return instance(floorQuotient(amount, other));
    }

    public Money floorDivide(long divisor) {
        if (divisor == 0) {
            throw new DivisionByZeroException("floorDivide");
        }
        return instance(floorQuotient(amount, divisor));
    }

    public Money floorDivide(double divisor) {
        if (divisor == 0.0) {
            throw new DivisionByZeroException("floorDivide");
        }
        Operands.finite("floorDivide", divisor);
        return instance(Operands.minorUnits("floorDivide", Math.floor(amount / divisor)));
    }

    public Money floorDivide(Number divisor) {
        if (Operands.isIntegral(divisor)) {
            return floorDivide(Operands.integral("floorDivide", divisor));
        }
        if (Operands.isFloating(divisor)) {
            return floorDivide(divisor.doubleValue());
        }
        throw new InvalidOperandException("floorDivide", divisor);
    }

    public Money negate() {
        return instance(Math.negateExact(amount));
    }

    public Money plus() {
        return instance(amount);
    }

    public Money abs() {
        return instance(Math.absExact(amount));
    }

    /// Rounds to a whole major unit, ties to even: 10.50 becomes 10.00, 11.50 becomes 12.00.
    public Money round() {
        var wholeUnits = toMajorUnits().setScale(0, RoundingMode.HALF_EVEN).longValueExact();
        return instance(Math.multiplyExact(wholeUnits, MINOR_UNITS_PER_MAJOR_UNIT));
    }

    public long toLong() {
        return amount;
    }

    /// Display approximation only; the minor-unit amount stays the source of truth.
    public double toDouble() {
        return toMajorUnits().doubleValue();
    }

    public BigDecimal toMajorUnits() {
        return BigDecimal.valueOf(amount, MINOR_UNIT_SCALE);
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(amount, other.amount);
    }

    public boolean isEqualTo(Money other) {
        return amount == requireMoney("isEqualTo", other).amount;
    }

    public boolean isEqualTo(long other) {
        return amount == other;
    }

    public boolean isEqualTo(Number other) {
        return isEqualTo(Operands.integral("isEqualTo", other));
    }

    public boolean isGreaterThan(Money other) {
        return amount > requireMoney("isGreaterThan", other).amount;
    }

    public boolean isGreaterThan(long other) {
        return amount > other;
    }

    public boolean isGreaterThan(Number other) {
        return isGreaterThan(Operands.integral("isGreaterThan", other));
    }

    public boolean isGreaterThanOrEqualTo(Money other) {
        return amount >= requireMoney("isGreaterThanOrEqualTo", other).amount;
    }

    public boolean isGreaterThanOrEqualTo(long other) {
        return amount >= other;
    }

    public boolean isGreaterThanOrEqualTo(Number other) {
        return isGreaterThanOrEqualTo(Operands.integral("isGreaterThanOrEqualTo", other));
    }

    public boolean isLessThan(Money other) {
        return amount < requireMoney("isLessThan", other).amount;
    }

    public boolean isLessThan(long other) {
        return amount < other;
    }

    public boolean isLessThan(Number other) {
        return isLessThan(Operands.integral("isLessThan", other));
    }

    public boolean isLessThanOrEqualTo(Money other) {
        return amount <= requireMoney("isLessThanOrEqualTo", other).amount;
    }

    public boolean isLessThanOrEqualTo(long other) {
        return amount <= other;
    }

    public boolean isLessThanOrEqualTo(Number other) {
        return isLessThanOrEqualTo(Operands.integral("isLessThanOrEqualTo", other));
    }

    public String format(MoneyFormatter formatter) {
        return Ensure.notNull("money.formatter", formatter).format(toMajorUnits(), currency, DISPLAY_LOCALE);
    }

    // Amount-only; two currencies with the same minor units compare equal.
    @Override
    public boolean equals(Object o) {
        return o instanceof Money other && amount == other.amount;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(amount);
    }

    @Override
    public String toString() {
        return format(LocaleCurrencyFormatter.INSTANCE);
    }

    private static Money requireMoney(String operation, Money operand) {
        if (operand == null) {
            throw new InvalidOperandException(operation, null);
        }
        return operand;
    }

    private static long halfEvenQuotient(long dividend, long divisor) {
        return BigDecimal.valueOf(dividend)
                .divide(BigDecimal.valueOf(divisor), 0, RoundingMode.HALF_EVEN)
                .longValueExact();
    }

    private static long floorQuotient(long dividend, long divisor) {
        if (dividend == Long.MIN_VALUE && divisor == -1) {
            throw new ArithmeticException("long overflow");
        }
        return Math.floorDiv(dividend, divisor);
    }
}
