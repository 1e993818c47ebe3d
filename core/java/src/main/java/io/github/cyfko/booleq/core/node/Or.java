package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Logical disjunction of two or more operands.
 * <p>
 * Same-type operands are spliced into this one on construction, exactly like {@link And}.
 * </p>
 *
 * @param operands the operands, in declaration order
 * @author Frank KOSSI
 * @since 1.0
 */
public record Or(List<Node> operands) implements Node {

    public Or {
        if (operands == null || operands.size() < 2) {
            throw new InvalidOperandException(String.format(
                "Or requires at least 2 operands, got %d", operands == null ? 0 : operands.size()));
        }
        List<Node> flattened = new ArrayList<>(operands.size() + 2);
        for (Node operand : operands) {
            if (operand == null) {
                throw new InvalidOperandException("Or operands cannot be null");
            }
            if (operand instanceof Or nested) {
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
    public static Or of(Node... operands) {
        if (operands == null) {
            throw new InvalidOperandException("Or requires at least 2 operands, got 0");
        }
        return new Or(Arrays.asList(operands));
    }

    @Override
    public String toString() {
        return NodeRenderer.infix(this);
    }
}
