package com.amannmalik.money.api;

public final class DivisionByZeroException extends MoneyException {
    public DivisionByZeroException(String operation) {
        super(operation + " divisor MUST NOT be zero");
    }
}
