package io.github.cyfko.booleq.core.exception;

import io.github.cyfko.booleq.core.node.Node;

/**
 * Thrown by the constraint solver when no assignment of the still unset variables can make an
 * expression reach the requested result.
 * <p>
 * Typical causes are a {@link io.github.cyfko.booleq.core.node.Constant} that contradicts the target
 * or a variable already fixed to the opposite value. There is no automatic retry: the caller decides
 * whether to unset variables and try again.
 * </p>
 *
 * <pre>{@code
 * Node impossible = Expressions.equivalent(true, false);
 * try {
 *     impossible.setState(true);
 * } catch (StateChangeUnableException e) {
 *     log.warning(e.getMessage());   // Cannot change value of constant Constant(false) to true
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see io.github.cyfko.booleq.core.eval.ConstraintSolver
 */
public class StateChangeUnableException extends LogicStateException {

    private final boolean target;

    /**
     * @param message description of the contradiction
     * @param node    the node that could not be forced
     * @param target  the requested result
     */
    public StateChangeUnableException(String message, Node node, boolean target) {
        super(message, node);
        this.target = target;
    }

    /**
     * @param message description of the contradiction
     * @param node    the node that could not be forced
     * @param target  the requested result
     * @param cause   the last failure met while searching for an assignment
     */
    public StateChangeUnableException(String message, Node node, boolean target, Throwable cause) {
        super(message, node, cause);
        this.target = target;
    }

    /**
     * Returns the result the solver was asked to reach.
     *
     * @return the requested result
     */
    public boolean getTarget() {
        return target;
    }
}
