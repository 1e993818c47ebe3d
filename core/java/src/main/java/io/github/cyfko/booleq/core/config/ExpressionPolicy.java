package io.github.cyfko.booleq.core.config;

import java.util.regex.Pattern;

/**
 * Configuration of expression construction, rendering and truth-table enumeration.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>negationPrefix</strong>: prefix marking a negated variable in string shorthand (default: {@code "~"})</li>
 *   <li><strong>identifierPattern</strong>: pattern names are checked against when {@code validateIdentifiers} is set</li>
 *   <li><strong>validateIdentifiers</strong>: whether names must match {@code identifierPattern} (default: false)</li>
 *   <li><strong>maxTableVariables</strong>: maximum distinct variables of a truth table (default: 20)</li>
 *   <li><strong>symbolSet</strong>: symbols used for infix rendering (default: {@link SymbolSet#UNICODE})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (any well-formed name, tables up to 20 variables)
 * ExpressionPolicy policy = ExpressionPolicy.defaults();
 *
 * // Strict (simple identifiers only, tables up to 12 variables)
 * ExpressionPolicy policy = ExpressionPolicy.strict();
 *
 * // Relaxed (tables up to 24 variables)
 * ExpressionPolicy policy = ExpressionPolicy.relaxed();
 *
 * // Custom
 * ExpressionPolicy policy = ExpressionPolicy.builder()
 *     .negationPrefix("!")
 *     .symbolSet(SymbolSet.ASCII)
 *     .build();
 * }</pre>
 *
 * @param policyName          name of the policy, for diagnostics
 * @param negationPrefix      prefix of negated names in string shorthand
 * @param identifierPattern   pattern applied to names when validation is enabled
 * @param validateIdentifiers whether names are checked against {@code identifierPattern}
 * @param maxTableVariables   maximum number of distinct variables enumerated by a truth table
 * @param symbolSet           symbols used for infix rendering
 * @author Frank KOSSI
 * @since 1.0
 */
public record ExpressionPolicy(
    String policyName,
    String negationPrefix,
    Pattern identifierPattern,
    boolean validateIdentifiers,
    int maxTableVariables,
    SymbolSet symbolSet
) {

    /**
     * Upper bound of {@code maxTableVariables}: row indices are enumerated as {@code int} bit patterns.
     */
    public static final int TABLE_VARIABLES_LIMIT = 30;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any setting is invalid
     */
    public ExpressionPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (negationPrefix == null || !PatternConfig.VARIABLE_NAME_PATTERN.matcher(negationPrefix).matches()) {
            throw new IllegalArgumentException(
                "negationPrefix must be non-empty without whitespace, quotes or '=', got: " + negationPrefix);
        }
        if (identifierPattern == null) {
            throw new IllegalArgumentException("identifierPattern is required");
        }
        if (maxTableVariables <= 0 || maxTableVariables > TABLE_VARIABLES_LIMIT) {
            throw new IllegalArgumentException(String.format(
                "maxTableVariables must be between 1 and %d, got: %d", TABLE_VARIABLES_LIMIT, maxTableVariables));
        }
        if (symbolSet == null) {
            throw new IllegalArgumentException("symbolSet is required");
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Negation Prefix: {@code "~"}</li>
     *   <li>Identifier Validation: DISABLED (only the basic name rules apply)</li>
     *   <li>Max Table Variables: 20</li>
     *   <li>Symbols: UNICODE</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ExpressionPolicy defaults() {
        return new ExpressionPolicy(PolicyName.DEFAULT_POLICY.name(), "~",
            PatternConfig.SIMPLE_IDENTIFIER_PATTERN, false, 20, SymbolSet.UNICODE);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Negation Prefix: {@code "~"}</li>
     *   <li>Identifier Validation: ENABLED ({@link PatternConfig#SIMPLE_IDENTIFIER_PATTERN})</li>
     *   <li>Max Table Variables: 12</li>
     *   <li>Symbols: ASCII</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ExpressionPolicy strict() {
        return new ExpressionPolicy(PolicyName.STRICT_POLICY.name(), "~",
            PatternConfig.SIMPLE_IDENTIFIER_PATTERN, true, 12, SymbolSet.ASCII);
    }

    /**
     * Relaxed configuration for larger interactive sessions.
     * <ul>
     *   <li>Negation Prefix: {@code "~"}</li>
     *   <li>Identifier Validation: DISABLED</li>
     *   <li>Max Table Variables: 24</li>
     *   <li>Symbols: UNICODE</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ExpressionPolicy relaxed() {
        return new ExpressionPolicy(PolicyName.RELAXED_POLICY.name(), "~",
            PatternConfig.SIMPLE_IDENTIFIER_PATTERN, false, 24, SymbolSet.UNICODE);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are default initialized exactly as if created with the default mode.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private String _negationPrefix = "~";
        private Pattern _identifierPattern = PatternConfig.SIMPLE_IDENTIFIER_PATTERN;
        private boolean _validateIdentifiers = false;
        private int _maxTableVariables = 20;
        private SymbolSet _symbolSet = SymbolSet.UNICODE;

        private Builder() {}

        public ExpressionPolicy build() {
            return new ExpressionPolicy(_policyName, _negationPrefix, _identifierPattern,
                _validateIdentifiers, _maxTableVariables, _symbolSet);
        }

        public Builder policyName(String policyName){ this._policyName = policyName; return this; }
        public Builder negationPrefix(String negationPrefix){ this._negationPrefix = negationPrefix; return this; }
        public Builder identifierPattern(Pattern identifierPattern){ this._identifierPattern = identifierPattern; return this; }
        public Builder validateIdentifiers(boolean validate){ this._validateIdentifiers = validate; return this; }
        public Builder maxTableVariables(int maxTableVariables){ this._maxTableVariables = maxTableVariables; return this; }
        public Builder symbolSet(SymbolSet symbolSet){ this._symbolSet = symbolSet; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
