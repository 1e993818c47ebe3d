package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.render.NodeRenderer;
import io.github.cyfko.booleq.core.utils.ValidationResult;
import io.github.cyfko.booleq.core.utils.VariableNames;

import java.util.List;
import java.util.Optional;

/**
 * A named variable holding a tri-state value: unset, {@code true} or {@code false}.
 * <p>
 * Variables are the only mutable part of an expression. They are compared by identity: two instances
 * sharing a name are distinct variables, although a truth table assigns them together.
 * </p>
 *
 * <h2>Mutation</h2>
 * <ul>
 *   <li>{@link #assign(boolean)} and {@link #unset()} change the state unconditionally; they are the
 *       caller's way of supplying information.</li>
 *   <li>{@link #setState(boolean)} is the constraint view inherited from {@link Node}: it fails with
 *       {@link io.github.cyfko.booleq.core.exception.StateChangeUnableException} if the variable
 *       already holds the opposite value.</li>
 * </ul>
 *
 * <pre>{@code
 * Variable x = new Variable("x");
 * x.isSet();            // false
 * x.setState(true);     // x = true
 * x.setState(false);    // throws StateChangeUnableException
 * x.assign(false);      // x = false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class Variable implements Node {

    private final String name;
    private Boolean value;

    /**
     * Creates an unset variable.
     *
     * @param name the variable name
     * @throws InvalidOperandException if the name is empty or contains whitespace, quotes or '='
     */
    public Variable(String name) {
        ValidationResult result = VariableNames.validate(name);
        if (!result.isValid()) {
            throw new InvalidOperandException(result.getErrorMessage());
        }
        this.name = name;
    }

    /**
     * Creates a variable with an initial state.
     *
     * @param name  the variable name
     * @param value the initial state
     * @throws InvalidOperandException if the name is empty or contains whitespace, quotes or '='
     */
    public Variable(String name, boolean value) {
        this(name);
        this.value = value;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the current state.
     *
     * @return the state, or empty if the variable is unset
     */
    public Optional<Boolean> value() {
        return Optional.ofNullable(value);
    }

    public boolean isSet() {
        return value != null;
    }

    /**
     * Sets the state, overwriting any previous one.
     *
     * @param value the new state
     */
    public void assign(boolean value) {
        this.value = value;
    }

    /**
     * Sets or clears the state.
     *
     * @param value the new state, empty to unset
     */
    public void assign(Optional<Boolean> value) {
        this.value = value.orElse(null);
    }

    /**
     * Clears the state.
     */
    public void unset() {
        this.value = null;
    }

    @Override
    public List<Node> operands() {
        return List.of();
    }

    @Override
    public String toString() {
        return NodeRenderer.infix(this);
    }
}
