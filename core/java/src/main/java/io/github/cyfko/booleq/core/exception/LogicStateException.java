package io.github.cyfko.booleq.core.exception;

import io.github.cyfko.booleq.core.node.Node;

/**
 * Base class for the runtime state errors raised while querying or constraining an expression.
 * <p>
 * Both subclasses describe <em>insufficient or contradictory information</em> held by the
 * variables of an expression, never an internal fault. They are recoverable: the caller supplies
 * more variable states, relaxes a constraint, or rebuilds the expression.
 * </p>
 *
 * <ul>
 *   <li>{@link UnknownStateException}: the expression cannot be decided yet</li>
 *   <li>{@link StateChangeUnableException}: the requested result cannot be reached</li>
 * </ul>
 *
 * <p>Malformed construction input is reported separately through {@link InvalidOperandException}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public abstract class LogicStateException extends RuntimeException {

    private final transient Node node;

    /**
     * @param message description of the failure
     * @param node    the node whose state could not be decided or changed, may be {@code null}
     */
    protected LogicStateException(String message, Node node) {
        super(message);
        this.node = node;
    }

    /**
     * @param message description of the failure
     * @param node    the node whose state could not be decided or changed, may be {@code null}
     * @param cause   the failure of a nested node that led to this one
     */
    protected LogicStateException(String message, Node node, Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    /**
     * Returns the node the failure was reported for.
     *
     * @return the offending node, or {@code null} if none was attached
     */
    public Node getNode() {
        return node;
    }
}
