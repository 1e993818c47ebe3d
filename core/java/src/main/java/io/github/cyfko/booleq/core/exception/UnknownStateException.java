package io.github.cyfko.booleq.core.exception;

import io.github.cyfko.booleq.core.node.Node;

/**
 * Thrown when the truth value of an expression cannot be decided from the states currently held by
 * its variables.
 * <p>
 * Evaluation short-circuits, so this is only raised when no decisive child is known, for instance an
 * AND whose known children are all true while at least one child is still unset.
 * </p>
 *
 * <pre>{@code
 * Variable x = new Variable("x", true);
 * Variable y = new Variable("y");
 * Node both = x.and(y);
 *
 * both.state();      // throws UnknownStateException
 * y.assign(false);
 * both.state();      // false
 * }</pre>
 *
 * <p>Callers probing for partial determinability usually use {@link Node#isUnknown()} instead of
 * catching this exception.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see io.github.cyfko.booleq.core.eval.Evaluator
 */
public class UnknownStateException extends LogicStateException {

    /**
     * @param message description of what could not be decided
     * @param node    the undecidable node
     */
    public UnknownStateException(String message, Node node) {
        super(message, node);
    }
}
