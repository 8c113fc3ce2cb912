package com.amannmalik.money.api;

/// Raised when an arithmetic or comparison operation receives an operand type it does not permit.
public final class InvalidOperandException extends MoneyException {
    private final String operation;

    public InvalidOperandException(String operation, Object operand) {
        super(operation + " does not accept operand " + describe(operand));
        this.operation = operation;
    }

    private static String describe(Object operand) {
        return operand == null ? "null" : operand + " (" + operand.getClass().getSimpleName() + ")";
    }

    public String operation() {
        return operation;
    }
}
