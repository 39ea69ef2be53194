package io.github.cyfko.zapformat.core.exception;

/**
 * Lexing failure: an unterminated string literal or a character that cannot start any token.
 * <p>
 * Always carries the 1-based line and column of the offending position. For an unterminated
 * string the position is the opening quote.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ZapLexException extends ZapSyntaxException {

    private final int line;
    private final int column;

    /**
     * @param message description of the failure, already including the position
     * @param line    1-based line
     * @param column  1-based column
     */
    public ZapLexException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
