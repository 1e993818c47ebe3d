package io.github.cyfko.booleq.core.utils;

import io.github.cyfko.booleq.core.config.ExpressionPolicy;
import io.github.cyfko.booleq.core.config.PatternConfig;

/**
 * Validation rules for variable names.
 * <p>
 * Basic rules apply to every variable: a name is non-empty and contains no whitespace, no quote and no
 * {@code '='}. A policy adds two rules on top: the name may not start with the policy's negation
 * prefix, and, when identifier validation is enabled, it must match the policy's identifier pattern.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class VariableNames {

    private VariableNames() {
        // Utility class
    }

    /**
     * Validates a name against the basic rules.
     *
     * @param name the candidate name
     * @return the validation result
     */
    public static ValidationResult validate(String name) {
        if (name == null || name.isEmpty()) {
            return ValidationResult.failure("Variable name cannot be null or empty");
        }
        if (!PatternConfig.VARIABLE_NAME_PATTERN.matcher(name).matches()) {
            return ValidationResult.failure(String.format(
                "Invalid variable name '%s': whitespace, quotes and '=' are not allowed", name));
        }
        return ValidationResult.success();
    }

    /**
     * Validates a name against the basic rules and the rules of a policy.
     *
     * @param name   the candidate name
     * @param policy the policy in effect
     * @return the validation result
     */
    public static ValidationResult validate(String name, ExpressionPolicy policy) {
        ValidationResult basic = validate(name);
        if (!basic.isValid()) {
            return basic;
        }
        if (name.startsWith(policy.negationPrefix())) {
            return ValidationResult.failure(String.format(
                "Invalid variable name '%s': names cannot start with the negation prefix '%s'",
                name, policy.negationPrefix()));
        }
        if (policy.validateIdentifiers() && !policy.identifierPattern().matcher(name).matches()) {
            return ValidationResult.failure(String.format(
                "Invalid variable name '%s': does not match identifier pattern %s (policy %s)",
                name, policy.identifierPattern().pattern(), policy.policyName()));
        }
        return ValidationResult.success();
    }
}
