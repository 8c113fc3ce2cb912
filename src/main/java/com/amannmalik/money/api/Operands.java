package com.amannmalik.money.api;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/// Nominal type checks for boxed amounts and operands.
final class Operands {
    private static final double LONG_RANGE_LIMIT = 0x1p63;

    private Operands() {
    }

    static boolean isIntegral(Number value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof AtomicLong
                || value instanceof AtomicInteger
                || value instanceof BigInteger;
    }

    static boolean isFloating(Number value) {
        return value instanceof Double || value instanceof Float;
    }

    static long integralAmount(Number amount) {
        if (!isIntegral(amount)) {
            throw new InvalidAmountException("amount MUST be an integer, got " + typeOf(amount));
        }
        if (amount instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new InvalidAmountException("amount exceeds minor unit range: " + big, e);
            }
        }
        return amount.longValue();
    }

    static long integral(String operation, Number operand) {
        if (!isIntegral(operand)) {
            throw new InvalidOperandException(operation, operand);
        }
        if (operand instanceof BigInteger big && big.bitLength() > 63) {
            throw new InvalidOperandException(operation, operand);
        }
        return operand.longValue();
    }

    static double finite(String operation, double operand) {
        if (!Double.isFinite(operand)) {
            throw new InvalidOperandException(operation, operand);
        }
        return operand;
    }

    static boolean fitsLong(double value) {
        return Double.isFinite(value) && value >= -LONG_RANGE_LIMIT && value < LONG_RANGE_LIMIT;
    }

    /// Narrows an already integral double; overflow is reported like Math.*Exact does.
    static long minorUnits(String operation, double value) {
        if (!fitsLong(value)) {
            throw new ArithmeticException(operation + " result exceeds minor unit range: " + value);
        }
        return (long) value;
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
