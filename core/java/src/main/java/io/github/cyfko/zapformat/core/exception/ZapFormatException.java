package io.github.cyfko.zapformat.core.exception;

/**
 * Exception thrown when formatting cannot produce output.
 * <p>
 * Two situations raise it:
 * </p>
 * <ul>
 *   <li>the facade wraps a {@link ZapSyntaxException} with the prefix
 *       {@code "Zap formatting error: "}, keeping the original as cause;</li>
 *   <li>the formatter meets a malformed AST (a node whose discriminant does not match its
 *       shape). This is a programming error, user input cannot trigger it.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ZapFormatException extends RuntimeException {

    public ZapFormatException(String message) {
        super(message);
    }

    public ZapFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
