package io.github.cyfko.booleq.core.eval;

import io.github.cyfko.booleq.core.exception.StateChangeUnableException;
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Backward constraint propagation: assigns unset variables so that an expression reaches a target value.
 * <p>
 * The search is depth-first and stops at the first success. It commits <em>one</em> solution, not the
 * best nor all of them, and never changes a variable that already holds a state.
 * </p>
 *
 * <h2>Algorithm</h2>
 * <p>
 * A node that already evaluates to the target is left alone. Otherwise:
 * </p>
 * <ul>
 *   <li><strong>Constant</strong>: succeeds only if its value equals the target</li>
 *   <li><strong>Variable</strong>: assigned the target, fails if it holds the opposite value</li>
 *   <li><strong>Not</strong>: the operand is forced to the negated target</li>
 *   <li><strong>And/true, Or/false</strong>: every operand is forced, in order; the first failure fails the node</li>
 *   <li><strong>And/false, Or/true</strong>: operands are tried in order; the first one that can be forced wins
 *       and the others are left untouched</li>
 *   <li><strong>Xor/true</strong> (operands differ): if one side is decided the other is forced to its opposite;
 *       if neither is, the default is {@code left = true, right = false}, then {@code left = false, right = true}</li>
 *   <li><strong>Xor/false</strong> (operands equal): same handling, default {@code left = right = true}, then both false</li>
 *   <li><strong>Equivalent</strong>: an {@code Xor} with the negated target</li>
 *   <li><strong>Implication/true</strong>: tries {@code consequent = true}, then {@code antecedent = false}</li>
 *   <li><strong>Implication/false</strong>: forces {@code antecedent = true} and {@code consequent = false}</li>
 * </ul>
 *
 * <h2>Trail</h2>
 * <p>
 * Every variable assigned during a call is pushed onto a trail. When an alternative of a choice point
 * fails, the variables it assigned are unset again before the next alternative is tried. Assignments of
 * operands that succeeded before a failing sibling of an And/true or Or/false are kept.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see Node#setState(boolean)
 */
public final class ConstraintSolver {

    private static final Logger log = Logger.getLogger(ConstraintSolver.class.getName());

    private final Deque<Variable> trail = new ArrayDeque<>();

    private ConstraintSolver() {
    }

    /**
     * Forces a node to a target value.
     *
     * @param node   the node to constrain
     * @param target the requested truth value
     * @throws StateChangeUnableException if no assignment of the unset variables reaches {@code target}
     */
    public static void solve(Node node, boolean target) {
        ConstraintSolver solver = new ConstraintSolver();
        solver.force(node, target);
        log.fine(() -> String.format("Forced %s to %s, %d variable(s) assigned",
            NodeRenderer.canonical(node), target, solver.trail.size()));
    }

    private void force(Node node, boolean target) {
        if (node instanceof Constant constant) {
            if (constant.value() != target) {
                throw new StateChangeUnableException(
                    String.format("Cannot change value of constant %s to %s", NodeRenderer.canonical(constant), target),
                    constant, target);
            }
            return;
        }
        if (node instanceof Variable variable) {
            forceVariable(variable, target);
            return;
        }

        Optional<Boolean> current = Evaluator.tryEvaluate(node);
        if (current.isPresent() && current.get() == target) {
            return;
        }

        if (node instanceof Not not) {
            force(not.operand(), !target);
        } else if (node instanceof And and) {
            if (target) {
                forceAll(and.operands(), true);
            } else {
                forceAny(and, false, alternativesFor(and.operands(), false));
            }
        } else if (node instanceof Or or) {
            if (target) {
                forceAny(or, true, alternativesFor(or.operands(), true));
            } else {
                forceAll(or.operands(), false);
            }
        } else if (node instanceof Xor xor) {
            forceParity(xor, target, xor.left(), xor.right(), target);
        } else if (node instanceof Equivalent equivalent) {
            forceParity(equivalent, target, equivalent.left(), equivalent.right(), !target);
        } else if (node instanceof Implication implication) {
            if (target) {
                forceAny(implication, true, List.of(
                    () -> force(implication.consequent(), true),
                    () -> force(implication.antecedent(), false)));
            } else {
                force(implication.antecedent(), true);
                force(implication.consequent(), false);
            }
        } else {
            throw new IllegalStateException("Unsupported node type: " + node.getClass().getName());
        }
    }

    private void forceVariable(Variable variable, boolean target) {
        Optional<Boolean> value = variable.value();
        if (value.isPresent()) {
            if (value.get() != target) {
                throw new StateChangeUnableException(String.format(
                    "Variable '%s' is already %s and cannot become %s", variable.name(), value.get(), target),
                    variable, target);
            }
            return;
        }
        variable.assign(target);
        trail.push(variable);
        log.finer(() -> String.format("Assigned %s = %s", variable.name(), target));
    }

    private void forceAll(List<Node> operands, boolean target) {
        for (Node operand : operands) {
            force(operand, target);
        }
    }

    /**
     * Makes {@code left} and {@code right} differ (or be equal) to satisfy {@code node} = {@code target}.
     */
    private void forceParity(Node node, boolean target, Node left, Node right, boolean differ) {
        Optional<Boolean> leftValue = Evaluator.tryEvaluate(left);
        if (leftValue.isPresent()) {
            force(right, differ != leftValue.get());
            return;
        }
        Optional<Boolean> rightValue = Evaluator.tryEvaluate(right);
        if (rightValue.isPresent()) {
            force(left, differ != rightValue.get());
            return;
        }
        forceAny(node, target, List.of(
            () -> {
                force(left, true);
                force(right, !differ);
            },
            () -> {
                force(left, false);
                force(right, differ);
            }));
    }

    /**
     * Runs the alternatives in order until one succeeds, undoing the assignments of each failed one.
     */
    private void forceAny(Node node, boolean target, List<Runnable> alternatives) {
        int mark = trail.size();
        StateChangeUnableException last = null;
        for (Runnable alternative : alternatives) {
            try {
                alternative.run();
                return;
            } catch (StateChangeUnableException e) {
                int undone = rollback(mark);
                log.finer(() -> String.format("Alternative failed (%s), %d assignment(s) undone", e.getMessage(), undone));
                last = e;
            }
        }
        throw new StateChangeUnableException(
            String.format("Cannot make %s equal %s", NodeRenderer.canonical(node), target), node, target, last);
    }

    private List<Runnable> alternativesFor(List<Node> operands, boolean target) {
        List<Runnable> alternatives = new ArrayList<>(operands.size());
        for (Node operand : operands) {
            alternatives.add(() -> force(operand, target));
        }
        return alternatives;
    }

    private int rollback(int mark) {
        int undone = 0;
        while (trail.size() > mark) {
            trail.pop().unset();
            undone++;
        }
        return undone;
    }
}
