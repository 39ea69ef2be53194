package io.github.cyfko.zapformat.core.ast;

import java.util.Objects;

/**
 * {@code opt <key> = <value>}
 * <p>
 * The value keeps the type it was written with:
 * </p>
 * <ul>
 *   <li>{@link Boolean} for {@code true}/{@code false};</li>
 *   <li>{@link Double} for number literals;</li>
 *   <li>{@link String} for string literals (quotes kept) and bare identifiers (raw text).</li>
 * </ul>
 *
 * @param key   the option key
 * @param value the option value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OptionNode(String key, Object value) {

    public OptionNode {
        Objects.requireNonNull(key, "Option key cannot be null");
        if (!(value instanceof Boolean || value instanceof Double || value instanceof String)) {
            throw new IllegalArgumentException(
                    "Option value must be a Boolean, a Double or a String, got: " + value);
        }
    }
}
