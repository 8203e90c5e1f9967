package com.ralphdemo.targetapp;

import java.util.Locale;

/**
 * Calculator operations that can be selected by name at runtime.
 */
public enum Operation {
    ADD("+") {
        @Override
        public int apply(Calculator calculator, int a, int b) {
            return calculator.add(a, b);
        }
    },
    MULTIPLY("*") {
        @Override
        public int apply(Calculator calculator, int a, int b) {
            return calculator.multiply(a, b);
        }
    };

    private final String symbol;

    Operation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Applies this operation to the two operands.
     *
     * @param calculator calculator to delegate to
     * @param a first operand
     * @param b second operand
     * @return the result of the operation
     */
    public abstract int apply(Calculator calculator, int a, int b);

    /**
     * Resolves an operation from its name ({@code add}, {@code multiply}, any case)
     * or its symbol ({@code +}, {@code *}).
     *
     * @throws IllegalArgumentException if the name matches no operation
     */
    public static Operation fromName(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (Operation operation : values()) {
                if (operation.symbol.equals(trimmed)
                        || operation.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                    return operation;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + name);
    }
}
