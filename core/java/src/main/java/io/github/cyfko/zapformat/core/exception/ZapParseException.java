package io.github.cyfko.zapformat.core.exception;

import io.github.cyfko.zapformat.core.model.Token;
import io.github.cyfko.zapformat.core.model.TokenKind;

/**
 * Parsing failure: a token that does not fit the grammar at the current position.
 * <p>
 * The message has the shape {@code "<description>. Got '<KIND>' at line <n>"}, where
 * {@code KIND} is the symbolic name of the offending token kind.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ZapParseException extends ZapSyntaxException {

    private final TokenKind tokenKind;
    private final int line;

    /**
     * Creates an exception describing an unexpected token.
     *
     * @param description what the parser expected or why the token is rejected
     * @param offending   the token found at the failure position
     */
    public ZapParseException(String description, Token offending) {
        super(String.format("%s. Got '%s' at line %d", description, offending.kind().name(), offending.line()));
        this.tokenKind = offending.kind();
        this.line = offending.line();
    }

    /**
     * @return the kind of the token found at the failure position
     */
    public TokenKind getTokenKind() {
        return tokenKind;
    }

    /**
     * @return the 1-based line of the offending token
     */
    public int getLine() {
        return line;
    }
}
