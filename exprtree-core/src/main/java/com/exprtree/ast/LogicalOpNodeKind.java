package com.exprtree.ast;

import java.util.Optional;

/**
 * Logical binary operators; {@code &&} and {@code ||}.
 */
public enum LogicalOpNodeKind {
    AND("&&"),
    OR("||");

    private final String symbol;

    LogicalOpNodeKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<LogicalOpNodeKind> fromSymbol(String symbol) {
        for (LogicalOpNodeKind kind : values()) {
            if (kind.symbol.equals(symbol)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
