package io.github.cyfko.booleq.core.eval;

import io.github.cyfko.booleq.core.exception.UnknownStateException;
import io.github.cyfko.booleq.core.node.And;
import io.github.cyfko.booleq.core.node.Constant;
import io.github.cyfko.booleq.core.node.Equivalent;
import io.github.cyfko.booleq.core.node.Implication;
import io.github.cyfko.booleq.core.node.Node;
import io.github.cyfko.booleq.core.node.Not;
import io.github.cyfko.booleq.core.node.Or;
import io.github.cyfko.booleq.core.node.Variable;
import io.github.cyfko.booleq.core.node.Xor;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.Optional;

/**
 * Tri-state evaluation of expressions.
 * <p>
 * A node evaluates to {@code true} or {@code false}, or is <em>unknown</em> when the variables it
 * reaches do not hold enough information. Evaluation is bottom-up and short-circuits: a connective is
 * decided as soon as one decisive operand is known, whatever the state of the others.
 * </p>
 *
 * <h2>Rules</h2>
 * <table>
 *   <caption>Evaluation per node type</caption>
 *   <tr><th>Node</th><th>Result</th></tr>
 *   <tr><td>Constant</td><td>its value</td></tr>
 *   <tr><td>Variable</td><td>its state, unknown if unset</td></tr>
 *   <tr><td>Not(x)</td><td>negation of x</td></tr>
 *   <tr><td>And</td><td>false if any operand is false, true if all are true</td></tr>
 *   <tr><td>Or</td><td>true if any operand is true, false if all are false</td></tr>
 *   <tr><td>Xor(a, b)</td><td>a ≠ b, both required</td></tr>
 *   <tr><td>Implication(a, b)</td><td>true if a is false or b is true, false if a is true and b false</td></tr>
 *   <tr><td>Equivalent(a, b)</td><td>a = b, both required</td></tr>
 * </table>
 *
 * <p>This class is stateless. All methods are static.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see Node#state()
 */
public final class Evaluator {

    private Evaluator() {
        // Utility class - prevent instantiation
    }

    /**
     * Evaluates a node.
     *
     * @param node the node to evaluate
     * @return its truth value
     * @throws UnknownStateException if the value cannot be decided from the current variable states
     */
    public static boolean evaluate(Node node) {
        if (node instanceof Constant constant) {
            return constant.value();
        }
        if (node instanceof Variable variable) {
            return variable.value().orElseThrow(() -> new UnknownStateException(String.format(
                "Variable '%s' is unset, which prevents deciding the expression", variable.name()), variable));
        }
        if (node instanceof Not not) {
            return !evaluate(not.operand());
        }
        if (node instanceof And and) {
            return evaluateAnd(and);
        }
        if (node instanceof Or or) {
            return evaluateOr(or);
        }
        if (node instanceof Xor xor) {
            return evaluate(xor.left()) != evaluate(xor.right());
        }
        if (node instanceof Implication implication) {
            return evaluateImplication(implication);
        }
        if (node instanceof Equivalent equivalent) {
            return evaluate(equivalent.left()) == evaluate(equivalent.right());
        }
        throw new IllegalStateException("Unsupported node type: " + node.getClass().getName());
    }

    /**
     * Evaluates a node without throwing on undecidable input.
     *
     * @param node the node to evaluate
     * @return its truth value, or empty if it cannot be decided yet
     */
    public static Optional<Boolean> tryEvaluate(Node node) {
        try {
            return Optional.of(evaluate(node));
        } catch (UnknownStateException e) {
            return Optional.empty();
        }
    }

    /**
     * Tells whether a node cannot be decided from the current variable states.
     *
     * @param node the node to check
     * @return {@code true} if {@link #evaluate(Node)} would throw {@link UnknownStateException}
     */
    public static boolean isUnknown(Node node) {
        return tryEvaluate(node).isEmpty();
    }

    private static boolean evaluateAnd(And and) {
        boolean unknown = false;
        for (Node operand : and.operands()) {
            Optional<Boolean> value = tryEvaluate(operand);
            if (value.isEmpty()) {
                unknown = true;
            } else if (!value.get()) {
                return false;
            }
        }
        if (unknown) {
            throw new UnknownStateException("Cannot determine state of AND expression: " + NodeRenderer.canonical(and), and);
        }
        return true;
    }

    private static boolean evaluateOr(Or or) {
        boolean unknown = false;
        for (Node operand : or.operands()) {
            Optional<Boolean> value = tryEvaluate(operand);
            if (value.isEmpty()) {
                unknown = true;
            } else if (value.get()) {
                return true;
            }
        }
        if (unknown) {
            throw new UnknownStateException("Cannot determine state of OR expression: " + NodeRenderer.canonical(or), or);
        }
        return false;
    }

    private static boolean evaluateImplication(Implication implication) {
        Optional<Boolean> antecedent = tryEvaluate(implication.antecedent());
        if (antecedent.isPresent() && !antecedent.get()) {
            return true;
        }
        Optional<Boolean> consequent = tryEvaluate(implication.consequent());
        if (consequent.isPresent() && consequent.get()) {
            return true;
        }
        if (antecedent.isPresent() && consequent.isPresent()) {
            return false;
        }
        throw new UnknownStateException(
            "Cannot determine state of IMPLICATION expression: " + NodeRenderer.canonical(implication), implication);
    }
}
