package io.github.cyfko.zapformat.core.utils;

/**
 * Outcome of validating a Zap source text.
 * <p>
 * Either the text lexes and parses, or validation failed with the message of the first
 * syntax error. Validation never throws: failures are carried by this value.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = ZapFormat.defaults().validate(source);
 * if (!result.isValid()) {
 *     System.out.println("Invalid net.zap: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    private final boolean valid;
    private final String errorMessage;

    private ValidationResult(boolean valid, String errorMessage) {
        this.valid = valid;
        this.errorMessage = errorMessage;
    }

    /**
     * @return the shared successful result
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result carrying the message
     */
    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }

    /**
     * Builds a failure from an exception, falling back to its string form when it has no message.
     *
     * @param error the exception raised while lexing or parsing
     * @return an invalid result
     */
    public static ValidationResult failure(Throwable error) {
        String message = error.getMessage();
        return failure(message != null ? message : error.toString());
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + errorMessage + "]";
    }
}
