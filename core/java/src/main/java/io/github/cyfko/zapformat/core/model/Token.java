package io.github.cyfko.zapformat.core.model;

import java.util.Objects;

/**
 * A single lexical token of a Zap source text.
 * <p>
 * Tokens are immutable. {@code line} and {@code column} are 1-based and point at the first
 * character of the token. For string literals {@code value} keeps the surrounding quotes;
 * for comments it keeps the leading {@code --}.
 * </p>
 *
 * @param kind   the token kind
 * @param value  the token text
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String value, int line, int column) {

    public Token {
        Objects.requireNonNull(kind, "Token kind cannot be null");
        Objects.requireNonNull(value, "Token value cannot be null");
    }

    /**
     * Tests whether this token has the given kind.
     *
     * @param expected the kind to compare with
     * @return {@code true} if this token is of kind {@code expected}
     */
    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return kind + "('" + value.replace("\n", "\\n") + "')@" + line + ":" + column;
    }
}
