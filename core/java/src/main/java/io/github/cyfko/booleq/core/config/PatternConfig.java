package io.github.cyfko.booleq.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for validating variable names.
 * <p>
 * Every variable name must satisfy {@link #VARIABLE_NAME_PATTERN}. Policies that enable identifier
 * validation additionally check names against their own pattern, {@link #SIMPLE_IDENTIFIER_PATTERN}
 * by default.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public abstract class PatternConfig {
    private PatternConfig () {}

    private static final String SIMPLE_FORM = "[a-zA-Z_][a-zA-Z0-9_]{0,29}";

    /**
     * Pattern for simple identifiers.
     * <p>
     * Matches identifiers that start with a letter or underscore, followed by alphanumerics/underscores, max 30 chars.
     * Example valid: "x", "door_open", "_tmp1"
     * Example invalid: "1x", "door-open", "x.y"
     * </p>
     */
    public static final Pattern SIMPLE_IDENTIFIER_PATTERN = Pattern.compile("^" + SIMPLE_FORM + "$");

    /**
     * Pattern every variable name must match: at least one character, no whitespace, no quotes, no {@code '='}.
     * <p>
     * The {@code '='} sign is reserved for the {@code name=value} rendering of variables.
     * </p>
     */
    public static final Pattern VARIABLE_NAME_PATTERN = Pattern.compile("^[^\\s\"'=]+$");
}
