package io.github.cyfko.zapformat.core.exception;

import io.github.cyfko.zapformat.core.api.ZapParser;
import io.github.cyfko.zapformat.core.lexing.ZapLexer;

/**
 * Exception thrown when a Zap source text cannot be tokenized or parsed.
 * <p>
 * This is the common supertype of {@link ZapLexException} (raised by {@link ZapLexer}) and
 * {@link ZapParseException} (raised by {@link ZapParser} implementations). Both are fatal:
 * the first error aborts the whole operation and no partial result is produced.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // 1. Unterminated string literal
 * ZapLexer.tokenize("opt x = \"abc");
 * // -> "Unterminated string literal at line 1, column 9"
 *
 * // 2. Unexpected character
 * ZapLexer.tokenize("opt x = @");
 * // -> "Unexpected character '@' at line 1, column 9"
 *
 * // 3. Missing event name
 * parser.parse(ZapLexer.tokenize("event = {}"));
 * // -> "Expected event name. Got 'EQUALS' at line 1"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     ZapConfiguration config = parser.parse(ZapLexer.tokenize(source));
 * } catch (ZapSyntaxException e) {
 *     // report e.getMessage() and leave the file untouched
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ZapLexException
 * @see ZapParseException
 */
public class ZapSyntaxException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the syntax error, including its position when known
     */
    public ZapSyntaxException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public ZapSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
