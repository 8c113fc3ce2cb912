package com.amannmalik.money.api;

/// Raised when a factory receives a value of the wrong nominal type or one it cannot parse.
public final class InvalidAmountException extends MoneyException {
    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
