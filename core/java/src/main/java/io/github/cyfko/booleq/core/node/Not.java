package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.List;

/**
 * Logical negation. Double negations are kept as built.
 *
 * @param operand the negated node
 * @author Frank KOSSI
 * @since 1.0
 */
public record Not(Node operand) implements Node {

    public Not {
        if (operand == null) {
            throw new InvalidOperandException("Not requires an operand");
        }
    }

    @Override
    public List<Node> operands() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return NodeRenderer.infix(this);
    }
}
