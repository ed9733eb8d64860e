package io.github.cyfko.veracity.core.config;

/**
 * Configuration of formula parsing and solving.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: Maximum character length of a formula. Solving is
 *       exponential in the number of disjunctions, so unbounded input is rejected.</li>
 *   <li><strong>strictSyntax</strong>: Report malformed structure (unmatched parentheses,
 *       dangling operators, surplus operands) instead of repairing it silently.</li>
 *   <li><strong>simplifyBeforeSolve</strong>: Run the constant-folding simplifier on the parsed
 *       tree before solving it.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (permissive, as the formula language is specified)
 * FormulaPolicy policy = FormulaPolicy.defaults();
 *
 * // Strict (for formulas typed by users who expect feedback)
 * FormulaPolicy policy = FormulaPolicy.strict();
 *
 * // Relaxed (larger formulas from trusted generators)
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * // Custom
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxFormulaLength(200)
 *     .simplifyBeforeSolve(true)
 *     .build();
 * }</pre>
 *
 * @param policyName name reported in error messages
 * @param maxFormulaLength maximum character length of a formula
 * @param strictSyntax whether malformed structure raises an error
 * @param simplifyBeforeSolve whether solving works on the simplified tree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    boolean strictSyntax,
    boolean simplifyBeforeSolve
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the length is not positive
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Formula Length: 5000 characters</li>
     *   <li>Strict Syntax: DISABLED</li>
     *   <li>Simplify Before Solve: DISABLED</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, false, false);
    }

    /**
     * Strict configuration.
     * <ul>
     *   <li>Max Formula Length: 1000 characters</li>
     *   <li>Strict Syntax: ENABLED</li>
     *   <li>Simplify Before Solve: DISABLED</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, true, false);
    }

    /**
     * Relaxed configuration.
     * <ul>
     *   <li>Max Formula Length: 10000 characters</li>
     *   <li>Strict Syntax: DISABLED</li>
     *   <li>Simplify Before Solve: DISABLED</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 10000, false, false);
    }

    /**
     * Creates a custom configuration, starting from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 5000;
        private boolean _strictSyntax = false;
        private boolean _simplifyBeforeSolve = false;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxFormulaLength, _strictSyntax, _simplifyBeforeSolve);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder strictSyntax(boolean strictSyntax) { this._strictSyntax = strictSyntax; return this; }
        public Builder simplifyBeforeSolve(boolean simplify) { this._simplifyBeforeSolve = simplify; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
