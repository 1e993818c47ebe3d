package io.github.cyfko.booleq.core.exception;

import io.github.cyfko.booleq.core.node.Constant;
import io.github.cyfko.booleq.core.node.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogicStateExceptionTest {

    @Test
    @DisplayName("Should create UnknownStateException with message and node")
    void shouldCreateUnknownStateException() {
        // Given
        Variable x = new Variable("x");

        // When
        UnknownStateException exception = new UnknownStateException("x is unset", x);

        // Then
        assertEquals("x is unset", exception.getMessage());
        assertSame(x, exception.getNode());
        assertNull(exception.getCause());
        assertInstanceOf(LogicStateException.class, exception);
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    @DisplayName("Should create StateChangeUnableException with node and target")
    void shouldCreateStateChangeUnableException() {
        // When
        StateChangeUnableException exception =
            new StateChangeUnableException("Cannot change value of constant", Constant.FALSE, true);

        // Then
        assertEquals("Cannot change value of constant", exception.getMessage());
        assertSame(Constant.FALSE, exception.getNode());
        assertTrue(exception.getTarget());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should keep the cause of StateChangeUnableException")
    void shouldKeepCauseOfStateChangeUnableException() {
        // Given
        Variable x = new Variable("x", true);
        Throwable cause = new StateChangeUnableException("inner", x, false);

        // When
        StateChangeUnableException exception = new StateChangeUnableException("outer", x.not(), true, cause);

        // Then
        assertEquals("outer", exception.getMessage());
        assertSame(cause, exception.getCause());
        assertTrue(exception.getTarget());
    }

    @Test
    @DisplayName("Should create InvalidOperandException as IllegalArgumentException")
    void shouldCreateInvalidOperandException() {
        // Given
        Throwable cause = new IllegalStateException("Root cause");

        // When
        InvalidOperandException plain = new InvalidOperandException("bad operand");
        InvalidOperandException wrapped = new InvalidOperandException("bad operand", cause);

        // Then
        assertEquals("bad operand", plain.getMessage());
        assertNull(plain.getCause());
        assertSame(cause, wrapped.getCause());
        assertInstanceOf(IllegalArgumentException.class, plain);
    }
}
