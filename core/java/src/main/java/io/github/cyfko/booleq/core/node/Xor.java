package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.List;

/**
 * Exclusive disjunction of exactly two operands: true when they differ. Never flattened.
 *
 * @param left  the first operand
 * @param right the second operand
 * @author Frank KOSSI
 * @since 1.0
 */
public record Xor(Node left, Node right) implements Node {

    public Xor {
        if (left == null || right == null) {
            throw new InvalidOperandException("Xor requires two non-null operands");
        }
    }

    @Override
    public List<Node> operands() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return NodeRenderer.infix(this);
    }
}
