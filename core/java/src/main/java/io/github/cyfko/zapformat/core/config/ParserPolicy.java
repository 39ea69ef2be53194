package io.github.cyfko.zapformat.core.config;

/**
 * Complexity limits of the Zap parser.
 * <p>
 * Type expressions are parsed recursively, so a deeply nested expression such as
 * {@code ((((u8))))} repeated thousands of times would exhaust the thread stack. The parser
 * rejects such input with a regular syntax error instead.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxNestingDepth</strong>: deepest nesting of type expressions; the type of a
 *       declaration is level 1 and every parenthesized group, tuple element, struct field, map
 *       key or value, set element and vector component opens one more level (default: 128)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Untrusted input
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Generated configurations
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxNestingDepth(64)
 *     .build();
 * }</pre>
 *
 * @param policyName      name reported in diagnostics
 * @param maxNestingDepth deepest accepted type nesting, inclusive
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxNestingDepth
) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration, far above any hand-written configuration.
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Strict configuration for configurations received from untrusted sources.
     * <ul>
     *   <li>Max Nesting Depth: 32</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 32);
    }

    /**
     * Relaxed configuration for machine-generated configurations.
     * <ul>
     *   <li>Max Nesting Depth: 512</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 512);
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
        private int _maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
