package com.optmodeler.core.model;

/**
 * Comparison of a constraint. {@link #RANGE} means {@code lower <= body <= upper}.
 */
public enum RelationalOperator {
    LE("<="),
    GE(">="),
    EQ("="),
    RANGE("<=");

    private final String symbol;

    RelationalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
