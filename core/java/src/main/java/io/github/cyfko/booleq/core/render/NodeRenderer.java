package io.github.cyfko.booleq.core.render;

import io.github.cyfko.booleq.core.config.SymbolSet;
import io.github.cyfko.booleq.core.node.And;
import io.github.cyfko.booleq.core.node.Constant;
import io.github.cyfko.booleq.core.node.Equivalent;
import io.github.cyfko.booleq.core.node.Implication;
import io.github.cyfko.booleq.core.node.Node;
import io.github.cyfko.booleq.core.node.Not;
import io.github.cyfko.booleq.core.node.Or;
import io.github.cyfko.booleq.core.node.Variable;
import io.github.cyfko.booleq.core.node.Xor;

import java.util.stream.Collectors;

/**
 * Text forms of an expression.
 *
 * <h2>Canonical form</h2>
 * <p>
 * The full composition of constructors, with the current state of each variable:
 * </p>
 * <pre>{@code
 * And(Variable("x", true), Not(Variable("y")), Constant(false))
 * }</pre>
 *
 * <h2>Infix form</h2>
 * <p>
 * Operators between operands, every connective but {@code Not} parenthesized, each variable rendered
 * as {@code name=1}, {@code name=0} or {@code name=?}:
 * </p>
 * <pre>{@code
 * (x=1 ∧ ¬(y=?) ∧ ⊥)        // SymbolSet.UNICODE
 * (x=1 & ~(y=?) & 0)        // SymbolSet.ASCII
 * }</pre>
 * <p>
 * Without values, variables are rendered by name only: {@code (x ∧ ¬y ∧ ⊥)}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class NodeRenderer {

    private NodeRenderer() {
        // Utility class - prevent instantiation
    }

    /**
     * Renders the canonical constructor form of a node.
     *
     * @param node the node to render
     * @return the canonical form
     */
    public static String canonical(Node node) {
        if (node instanceof Variable variable) {
            return variable.value()
                .map(value -> String.format("Variable(\"%s\", %s)", variable.name(), value))
                .orElseGet(() -> String.format("Variable(\"%s\")", variable.name()));
        }
        if (node instanceof Constant constant) {
            return "Constant(" + constant.value() + ")";
        }
        return typeName(node) + node.operands().stream()
            .map(NodeRenderer::canonical)
            .collect(Collectors.joining(", ", "(", ")"));
    }

    /**
     * Renders the Unicode infix form of a node, with variable values.
     *
     * @param node the node to render
     * @return the infix form
     */
    public static String infix(Node node) {
        return infix(node, SymbolSet.UNICODE, true);
    }

    /**
     * Renders the infix form of a node.
     *
     * @param node       the node to render
     * @param symbols    the operator symbols
     * @param showValues whether variables are rendered as {@code name=value}
     * @return the infix form
     */
    public static String infix(Node node, SymbolSet symbols, boolean showValues) {
        if (node instanceof Variable variable) {
            return showValues ? variable.name() + "=" + variable.value().map(v -> v ? "1" : "0").orElse("?") : variable.name();
        }
        if (node instanceof Constant constant) {
            return symbols.constant(constant.value());
        }
        if (node instanceof Not not) {
            String operand = infix(not.operand(), symbols, showValues);
            return symbols.not() + (not.operand() instanceof Variable && showValues ? "(" + operand + ")" : operand);
        }
        String operator = operatorSymbol(node, symbols);
        return node.operands().stream()
            .map(operand -> infix(operand, symbols, showValues))
            .collect(Collectors.joining(" " + operator + " ", "(", ")"));
    }

    private static String operatorSymbol(Node node, SymbolSet symbols) {
        if (node instanceof And) {
            return symbols.and();
        }
        if (node instanceof Or) {
            return symbols.or();
        }
        if (node instanceof Xor) {
            return symbols.xor();
        }
        if (node instanceof Implication) {
            return symbols.implies();
        }
        if (node instanceof Equivalent) {
            return symbols.equivalent();
        }
        throw new IllegalStateException("Unsupported node type: " + node.getClass().getName());
    }

    private static String typeName(Node node) {
        return node.getClass().getSimpleName();
    }
}
