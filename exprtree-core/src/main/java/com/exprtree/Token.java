package com.exprtree;

/**
 * A lexical token of an expression.
 *
 * @param type   kind of the token
 * @param lexeme source text of the token
 * @param offset 0-based character offset in the expression source
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record Token(
    TokenType type,
    String lexeme,
    int offset,
    int line,
    int column
) {
    public Token {
        if (type == null) {
            throw new IllegalArgumentException("token type must not be null");
        }
        if (lexeme == null) {
            throw new IllegalArgumentException("token lexeme must not be null");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0 but was " + offset);
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("position must be 1-based but was " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return type.name() + ":" + line + ":" + column + ":\"" + lexeme + "\"";
    }
}
