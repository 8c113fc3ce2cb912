package com.amannmalik.money.api;

public class MoneyException extends RuntimeException {
    public MoneyException(String message) {
        super(message);
    }

    public MoneyException(String message, Throwable cause) {
        super(message, cause);
    }
}
