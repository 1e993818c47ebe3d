package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.config.SymbolSet;
import io.github.cyfko.booleq.core.eval.ConstraintSolver;
import io.github.cyfko.booleq.core.eval.Evaluator;
import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.exception.StateChangeUnableException;
import io.github.cyfko.booleq.core.exception.UnknownStateException;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.List;

/**
 * A node of a boolean expression: a variable, a constant or a connective.
 * <p>
 * Nodes compose into a directed acyclic graph rather than a tree: the same instance, typically a
 * {@link Variable}, may be an operand of several parents. The structure of a node never changes after
 * construction; only the state of the variables it reaches does, and a variable mutated through one
 * expression is seen by every other expression holding it.
 * </p>
 *
 * <h2>Variants</h2>
 * <p>
 * The set of variants is closed. Operations such as evaluation, constraint solving and rendering are
 * implemented outside the node classes, by {@link Evaluator}, {@link ConstraintSolver} and
 * {@link NodeRenderer}, which dispatch over the permitted subtypes.
 * </p>
 * <ul>
 *   <li>Leaves: {@link Variable}, {@link Constant}</li>
 *   <li>Unary: {@link Not}</li>
 *   <li>Variadic, flattened on construction: {@link And}, {@link Or}</li>
 *   <li>Strictly binary: {@link Xor}, {@link Implication}, {@link Equivalent}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Variable rain = new Variable("rain");
 * Variable sprinkler = new Variable("sprinkler");
 * Node wet = rain.or(sprinkler);
 *
 * wet.isUnknown();        // true
 * wet.setState(true);     // assigns rain = true, leaves sprinkler unset
 * wet.state();            // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public sealed interface Node permits Variable, Constant, Not, And, Or, Xor, Implication, Equivalent {

    /**
     * Returns the direct operands of this node, in declaration order.
     *
     * @return an unmodifiable list, empty for leaves
     */
    List<Node> operands();

    /**
     * Evaluates this node from the states currently held by the variables it reaches.
     *
     * @return the truth value of this node
     * @throws UnknownStateException if the value cannot be decided yet
     * @see Evaluator#evaluate(Node)
     */
    default boolean state() {
        return Evaluator.evaluate(this);
    }

    /**
     * Assigns the unset variables reachable from this node so that it evaluates to {@code target}.
     * <p>
     * One solution is committed, found by a depth-first, first-success search. Variables already
     * holding a state are never changed.
     * </p>
     *
     * @param target the requested truth value
     * @throws StateChangeUnableException if {@code target} cannot be reached
     * @see ConstraintSolver#solve(Node, boolean)
     */
    default void setState(boolean target) {
        ConstraintSolver.solve(this, target);
    }

    /**
     * Tells whether the truth value of this node cannot be decided yet.
     *
     * @return {@code true} if {@link #state()} would throw {@link UnknownStateException}
     */
    default boolean isUnknown() {
        return Evaluator.isUnknown(this);
    }

    /**
     * Creates the conjunction of this node and {@code other}, flattened if either side already is an {@link And}.
     *
     * @param other the right-hand operand
     * @return a new {@link And}
     * @throws InvalidOperandException if {@code other} is null
     */
    default And and(Node other) {
        return new And(List.of(this, requireOperand(other, "and")));
    }

    /**
     * Creates the disjunction of this node and {@code other}, flattened if either side already is an {@link Or}.
     *
     * @param other the right-hand operand
     * @return a new {@link Or}
     * @throws InvalidOperandException if {@code other} is null
     */
    default Or or(Node other) {
        return new Or(List.of(this, requireOperand(other, "or")));
    }

    /**
     * Creates the negation of this node. A negation is never simplified away: {@code x.not().not()}
     * is a {@link Not} of a {@link Not}.
     *
     * @return a new {@link Not}
     */
    default Not not() {
        return new Not(this);
    }

    /**
     * Renders this node as the composition of constructors that rebuilds it, e.g.
     * {@code And(Variable("x", true), Not(Variable("y")))}.
     *
     * @return the canonical form
     */
    default String toCanonicalString() {
        return NodeRenderer.canonical(this);
    }

    /**
     * Renders this node in infix form with the state of each variable, e.g. {@code (x=1 ∧ ¬(y=?))}.
     *
     * @param symbols the symbols to use
     * @return the infix form
     */
    default String toInfixString(SymbolSet symbols) {
        return NodeRenderer.infix(this, symbols, true);
    }

    private static Node requireOperand(Node other, String operation) {
        if (other == null) {
            throw new InvalidOperandException("Cannot apply '" + operation + "' to a null operand");
        }
        return other;
    }
}
