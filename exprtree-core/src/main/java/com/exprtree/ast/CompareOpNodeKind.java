package com.exprtree.ast;

import java.util.Optional;

/**
 * Comparison operators; {@code <}, {@code <=}, {@code >}, {@code >=}, {@code ==} and {@code !=}.
 */
public enum CompareOpNodeKind {
    LESS("<"),
    LESS_EQ("<="),
    GREATER(">"),
    GREATER_EQ(">="),
    EQ("=="),
    NOT_EQ("!=");

    private final String symbol;

    CompareOpNodeKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns true for {@code ==} and {@code !=}.
     */
    public boolean isEqualityOp() {
        return this == EQ || this == NOT_EQ;
    }

    public static Optional<CompareOpNodeKind> fromSymbol(String symbol) {
        for (CompareOpNodeKind kind : values()) {
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
