package io.github.cyfko.booleq.core;

import io.github.cyfko.booleq.core.node.And;
import io.github.cyfko.booleq.core.node.Equivalent;
import io.github.cyfko.booleq.core.node.Implication;
import io.github.cyfko.booleq.core.node.Not;
import io.github.cyfko.booleq.core.node.Or;
import io.github.cyfko.booleq.core.node.Xor;

/**
 * Static shortcuts over {@link ExpressionFactory#defaults()}.
 *
 * <pre>{@code
 * import static io.github.cyfko.booleq.core.Expressions.*;
 *
 * Node n = or(and("a", "~b"), xor("c", true));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class Expressions {

    private Expressions() {
        // Utility class - prevent instantiation
    }

    public static Not not(Object operand) {
        return ExpressionFactory.defaults().not(operand);
    }

    public static And and(Object... operands) {
        return ExpressionFactory.defaults().and(operands);
    }

    public static Or or(Object... operands) {
        return ExpressionFactory.defaults().or(operands);
    }

    public static Not nand(Object... operands) {
        return ExpressionFactory.defaults().nand(operands);
    }

    public static Not nor(Object... operands) {
        return ExpressionFactory.defaults().nor(operands);
    }

    public static Xor xor(Object... operands) {
        return ExpressionFactory.defaults().xor(operands);
    }

    public static Implication implies(Object... operands) {
        return ExpressionFactory.defaults().implies(operands);
    }

    public static Equivalent equivalent(Object... operands) {
        return ExpressionFactory.defaults().equivalent(operands);
    }
}
