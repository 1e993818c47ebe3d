package io.github.cyfko.booleq.core.utils;

import io.github.cyfko.booleq.core.config.ExpressionPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class VariableNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"x", "door_open", "A1", "x.y", "état"})
    @DisplayName("Should accept well-formed names")
    void shouldAcceptWellFormedNames(String name) {
        assertTrue(VariableNames.validate(name).isValid());
    }

    @ParameterizedTest
    @ValueSource(strings = {"a b", "a\tb", "a=b", "\"a\"", "'a'"})
    @DisplayName("Should reject whitespace, quotes and '='")
    void shouldRejectForbiddenCharacters(String name) {
        ValidationResult result = VariableNames.validate(name);

        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().contains("whitespace, quotes and '='"));
    }

    @Test
    @DisplayName("Should reject null and empty names")
    void shouldRejectNullAndEmptyNames() {
        assertEquals("Variable name cannot be null or empty", VariableNames.validate(null).getErrorMessage());
        assertEquals("Variable name cannot be null or empty", VariableNames.validate("").getErrorMessage());
    }

    @Test
    @DisplayName("Should reject names starting with the negation prefix of the policy")
    void shouldRejectNegationPrefix() {
        assertTrue(VariableNames.validate("~x").isValid());

        ValidationResult result = VariableNames.validate("~x", ExpressionPolicy.defaults());

        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().contains("negation prefix '~'"));
    }

    @Test
    @DisplayName("Should apply the identifier pattern only when enabled")
    void shouldApplyIdentifierPatternWhenEnabled() {
        assertTrue(VariableNames.validate("x.y", ExpressionPolicy.defaults()).isValid());

        ValidationResult result = VariableNames.validate("x.y", ExpressionPolicy.strict());

        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().contains("STRICT_POLICY"));
        assertTrue(VariableNames.validate("x_y", ExpressionPolicy.strict()).isValid());
    }
}
