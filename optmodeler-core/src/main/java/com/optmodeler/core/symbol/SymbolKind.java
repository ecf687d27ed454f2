package com.optmodeler.core.symbol;

/**
 * Kinds of named components, each with its own prefix for synthesized names.
 */
public enum SymbolKind {
    SET("set"),
    PARAMETER("param"),
    VARIABLE("var"),
    IMPLICIT_VARIABLE("impvar"),
    CONSTRAINT("con"),
    OBJECTIVE("obj"),
    PROBLEM("problem");

    private final String prefix;

    SymbolKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
