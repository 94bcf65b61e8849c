package io.github.cyfko.logictree.core.config;

/**
 * Limits applied by the parser to untrusted expressions.
 * <p>
 * Limits are opt-in: the parser built with no arguments uses {@link #unlimited()}, so only a
 * caller-chosen policy rejects well-formed input.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression (default: 5000)</li>
 *   <li><strong>maxVariables</strong>: Maximum number of distinct variables (default: 16). A truth table
 *       has 2^n rows, so this bounds the cost of every table built from a parsed tree.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ParserPolicy policy = ParserPolicy.unlimited();
 * ParserPolicy policy = ParserPolicy.defaults();
 * ParserPolicy policy = ParserPolicy.strict();   // public inputs
 * ParserPolicy policy = ParserPolicy.relaxed();  // trusted batch work
 *
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxExpressionLength(2000)
 *     .maxVariables(8)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violations
 * @param maxExpressionLength maximum character length of the expression
 * @param maxVariables        maximum number of distinct variables
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxVariables
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxVariables <= 0) {
            throw new IllegalArgumentException("maxVariables must be positive, got: " + maxVariables);
        }
    }

    /**
     * No limits: every expression the grammar accepts is parsed.
     *
     * @return unlimited configuration, used by the shared default parser
     */
    public static ParserPolicy unlimited() {
        return new ParserPolicy(PolicyName.UNLIMITED_POLICY.name(), Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    /**
     * Balanced limits: 5000 characters, 16 variables.
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 16);
    }

    /**
     * Limits for untrusted input: 1000 characters, 10 variables.
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 10);
    }

    /**
     * Limits for trusted input: 10000 characters, 24 variables.
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 24);
    }

    /**
     * Builder initialized with the default limits.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxVariables = 16;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxVariables);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
    }

    public enum PolicyName {
        UNLIMITED_POLICY,
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
