package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Logical conjunction of two or more operands.
 * <p>
 * Construction splices operands that are themselves an {@code And} into this one, so
 * {@code new And(List.of(new And(List.of(a, b)), c))} holds {@code [a, b, c]}. Splicing happens on every
 * construction, hence an {@code And} never has an {@code And} operand.
 * </p>
 *
 * <pre>{@code
 * And all = a.and(b).and(c);    // And[a, b, c], not And[And[a, b], c]
 * }</pre>
 *
 * @param operands the operands, in declaration order
 * @author Frank KOSSI
 * @since 1.0
 */
public record And(List<Node> operands) implements Node {

    public And {
        if (operands == null || operands.size() < 2) {
            throw new InvalidOperandException(String.format(
                "And requires at least 2 operands, got %d", operands == null ? 0 : operands.size()));
        }
        List<Node> flattened = new ArrayList<>(operands.size() + 2);
        for (Node operand : operands) {
            if (operand == null) {
                throw new InvalidOperandException("And operands cannot be null");
            }
            if (operand instanceof And nested) {
                flattened.addAll(nested.operands());
            } else {
                flattened.add(operand);
            }
        }
        operands = List.copyOf(flattened);
    }

    /**
     * @param operands two or more operands
     * @return the flattened node
     */
    public static And of(Node... operands) {
        if (operands == null) {
            throw new InvalidOperandException("And requires at least 2 operands, got 0");
        }
        return new And(Arrays.asList(operands));
    }

    @Override
    public String toString() {
        return NodeRenderer.infix(this);
    }
}
