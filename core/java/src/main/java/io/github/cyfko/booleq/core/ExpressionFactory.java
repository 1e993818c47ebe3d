package io.github.cyfko.booleq.core;

import io.github.cyfko.booleq.core.config.ExpressionPolicy;
import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.node.And;
import io.github.cyfko.booleq.core.node.Constant;
import io.github.cyfko.booleq.core.node.Equivalent;
import io.github.cyfko.booleq.core.node.Implication;
import io.github.cyfko.booleq.core.node.Node;
import io.github.cyfko.booleq.core.node.Not;
import io.github.cyfko.booleq.core.node.Or;
import io.github.cyfko.booleq.core.node.Variable;
import io.github.cyfko.booleq.core.node.Xor;
import io.github.cyfko.booleq.core.utils.ValidationResult;
import io.github.cyfko.booleq.core.utils.VariableNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds expressions from loosely typed operands, following an {@link ExpressionPolicy}.
 * <p>
 * Every connective accepts operands of three kinds, normalized before the node is built:
 * </p>
 * <ul>
 *   <li>a {@link Node}, used as is (never copied, so shared variables stay shared)</li>
 *   <li>a name {@code String}: {@code "x"} becomes {@code Variable("x")}, {@code "~x"} becomes
 *       {@code Not(Variable("x"))} with the default negation prefix</li>
 *   <li>a {@code Boolean}, which becomes a {@link Constant}</li>
 * </ul>
 * <p>
 * Each name string creates a new {@link Variable}. To share one variable between expressions, create it
 * once and pass the instance.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ExpressionFactory factory = ExpressionFactory.of(ExpressionPolicy.strict());
 *
 * Variable door = factory.variable("door");
 * Node alarm = factory.and(door, "~disarmed");         // And(door, Not(disarmed))
 * Node check = factory.implies(alarm, "siren");        // Implication(alarm, siren)
 * Node nope  = factory.nand(door, true);               // Not(And(door, Constant(true)))
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe; the nodes they build are not.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see Expressions
 */
public final class ExpressionFactory {

    private static final ExpressionFactory DEFAULT = new ExpressionFactory(ExpressionPolicy.defaults());

    private final ExpressionPolicy policy;

    private ExpressionFactory(ExpressionPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return the factory using {@link ExpressionPolicy#defaults()}
     */
    public static ExpressionFactory defaults() {
        return DEFAULT;
    }

    /**
     * @param policy the policy to follow
     * @return a factory following {@code policy}
     */
    public static ExpressionFactory of(ExpressionPolicy policy) {
        Objects.requireNonNull(policy, "Expression policy is required");
        return new ExpressionFactory(policy);
    }

    public ExpressionPolicy policy() {
        return policy;
    }

    /**
     * Creates an unset variable after validating its name against the policy.
     *
     * @param name the variable name
     * @return a new variable
     * @throws InvalidOperandException if the name is invalid
     */
    public Variable variable(String name) {
        return new Variable(requireValidName(name));
    }

    /**
     * Creates a variable with an initial state after validating its name against the policy.
     *
     * @param name  the variable name
     * @param value the initial state
     * @return a new variable
     * @throws InvalidOperandException if the name is invalid
     */
    public Variable variable(String name, boolean value) {
        return new Variable(requireValidName(name), value);
    }

    public Constant constant(boolean value) {
        return Constant.of(value);
    }

    public Not not(Object operand) {
        return new Not(operand(operand));
    }

    /**
     * @param operands two or more operands
     * @return the flattened conjunction
     * @throws InvalidOperandException if fewer than two operands are given or one cannot be normalized
     */
    public And and(Object... operands) {
        return new And(operands("And", 2, operands));
    }

    /**
     * @param operands two or more operands
     * @return the flattened disjunction
     * @throws InvalidOperandException if fewer than two operands are given or one cannot be normalized
     */
    public Or or(Object... operands) {
        return new Or(operands("Or", 2, operands));
    }

    /**
     * @param operands two or more operands
     * @return {@code Not(And(operands))}
     */
    public Not nand(Object... operands) {
        return new Not(new And(operands("Nand", 2, operands)));
    }

    /**
     * @param operands two or more operands
     * @return {@code Not(Or(operands))}
     */
    public Not nor(Object... operands) {
        return new Not(new Or(operands("Nor", 2, operands)));
    }

    /**
     * @param operands exactly two operands
     * @return the exclusive disjunction
     * @throws InvalidOperandException if not exactly two operands are given
     */
    public Xor xor(Object... operands) {
        List<Node> nodes = exactlyTwo("Xor", operands);
        return new Xor(nodes.get(0), nodes.get(1));
    }

    /**
     * @param operands exactly two operands: antecedent, consequent
     * @return the implication
     * @throws InvalidOperandException if not exactly two operands are given
     */
    public Implication implies(Object... operands) {
        List<Node> nodes = exactlyTwo("Implication", operands);
        return new Implication(nodes.get(0), nodes.get(1));
    }

    /**
     * @param operands exactly two operands
     * @return the equivalence
     * @throws InvalidOperandException if not exactly two operands are given
     */
    public Equivalent equivalent(Object... operands) {
        List<Node> nodes = exactlyTwo("Equivalent", operands);
        return new Equivalent(nodes.get(0), nodes.get(1));
    }

    /**
     * Normalizes a single operand.
     *
     * @param operand a {@link Node}, a (possibly negated) variable name or a {@link Boolean}
     * @return the corresponding node
     * @throws InvalidOperandException if the operand is null, of another type, or an invalid name
     */
    public Node operand(Object operand) {
        if (operand instanceof Node node) {
            return node;
        }
        if (operand instanceof Boolean value) {
            return Constant.of(value);
        }
        if (operand instanceof String name) {
            String prefix = policy.negationPrefix();
            if (name.startsWith(prefix)) {
                return new Not(variable(name.substring(prefix.length())));
            }
            return variable(name);
        }
        if (operand == null) {
            throw new InvalidOperandException("Operand cannot be null");
        }
        throw new InvalidOperandException(String.format(
            "Unsupported operand of type %s: %s", operand.getClass().getSimpleName(), operand));
    }

    private List<Node> operands(String connective, int minimum, Object[] operands) {
        int count = operands == null ? 0 : operands.length;
        if (count < minimum) {
            throw new InvalidOperandException(String.format(
                "%s requires at least %d operands, got %d", connective, minimum, count));
        }
        List<Node> nodes = new ArrayList<>(count);
        for (Object operand : operands) {
            nodes.add(operand(operand));
        }
        return nodes;
    }

    private List<Node> exactlyTwo(String connective, Object[] operands) {
        int count = operands == null ? 0 : operands.length;
        if (count != 2) {
            throw new InvalidOperandException(String.format(
                "%s requires exactly 2 operands, got %d", connective, count));
        }
        return operands(connective, 2, operands);
    }

    private String requireValidName(String name) {
        ValidationResult result = VariableNames.validate(name, policy);
        if (!result.isValid()) {
            throw new InvalidOperandException(result.getErrorMessage());
        }
        return name;
    }
}
