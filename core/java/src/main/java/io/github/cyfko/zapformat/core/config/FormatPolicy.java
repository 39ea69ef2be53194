package io.github.cyfko.zapformat.core.config;

/**
 * Layout settings of the Zap formatter.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>indentUnit</strong>: text emitted once per nesting level (default: one tab)</li>
 *   <li><strong>maxInlineWidth</strong>: longest single-line rendering a struct, tuple or enum may
 *       have before it is broken over several lines (default: 120)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Canonical layout
 * FormatPolicy policy = FormatPolicy.defaults();
 *
 * // Custom
 * FormatPolicy policy = FormatPolicy.builder()
 *     .indentUnit("    ")
 *     .maxInlineWidth(100)
 *     .build();
 * }</pre>
 *
 * <p>Only {@link #defaults()} yields the canonical form; other settings produce output that
 * still parses to the same configuration.</p>
 *
 * @param policyName     name reported in diagnostics
 * @param indentUnit     text of one indentation level, non-empty and made of spaces or tabs
 * @param maxInlineWidth inline width threshold, inclusive
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormatPolicy(
    String policyName,
    String indentUnit,
    int maxInlineWidth
) {

    public static final String DEFAULT_INDENT_UNIT = "\t";
    public static final int DEFAULT_MAX_INLINE_WIDTH = 120;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any setting is invalid
     */
    public FormatPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (indentUnit == null || indentUnit.isEmpty()) {
            throw new IllegalArgumentException("indentUnit is required");
        }
        if (!indentUnit.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("indentUnit must contain only spaces or tabs");
        }
        if (maxInlineWidth <= 0) {
            throw new IllegalArgumentException("maxInlineWidth must be positive, got: " + maxInlineWidth);
        }
    }

    /**
     * Canonical Zap layout: tab indentation, 120 character inline threshold.
     *
     * @return default configuration
     */
    public static FormatPolicy defaults() {
        return new FormatPolicy(PolicyName.DEFAULT_POLICY.name(), DEFAULT_INDENT_UNIT, DEFAULT_MAX_INLINE_WIDTH);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private String _indentUnit = DEFAULT_INDENT_UNIT;
        private int _maxInlineWidth = DEFAULT_MAX_INLINE_WIDTH;

        private Builder() {}

        public FormatPolicy build() {
            return new FormatPolicy(_policyName, _indentUnit, _maxInlineWidth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder indentUnit(String indentUnit) { this._indentUnit = indentUnit; return this; }
        public Builder maxInlineWidth(int maxInlineWidth) { this._maxInlineWidth = maxInlineWidth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        CUSTOM_POLICY
    }
}
