package io.github.cyfko.booleq.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    @DisplayName("Should share a single success instance")
    void shouldShareSuccessInstance() {
        ValidationResult result = ValidationResult.success();

        assertTrue(result.isValid());
        assertNull(result.getErrorMessage());
        assertSame(result, ValidationResult.success());
        assertEquals("ValidationResult{valid}", result.toString());
    }

    @Test
    @DisplayName("Should carry the failure message")
    void shouldCarryFailureMessage() {
        ValidationResult result = ValidationResult.failure("bad name");

        assertFalse(result.isValid());
        assertEquals("bad name", result.getErrorMessage());
        assertEquals("ValidationResult{invalid, message='bad name'}", result.toString());
    }
}
