package com.exprtree;

/**
 * Kinds of tokens produced by the expression lexer.
 */
public enum TokenType {
    UNKNOWN("UNKNOWN"),
    END("END"),
    IDENT("IDENT"),
    STRING("STRING"),
    INT("INTEGER"),
    FLOAT("FLOAT"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    DOT("."),
    NOT("!"),
    LESS("<"),
    LESS_EQ("<="),
    GREATER(">"),
    GREATER_EQ(">="),
    EQ("=="),
    NOT_EQ("!="),
    AND("&&"),
    OR("||"),
    STAR("*"),
    COMMA(",");

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /**
     * Text shown for this kind in debug output, e.g. {@code "IDENT"} or {@code "<="}.
     */
    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
