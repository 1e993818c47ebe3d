package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.List;

/**
 * A fixed truth value. Constraining a constant to the opposite value fails.
 *
 * @param value the truth value
 * @author Frank KOSSI
 * @since 1.0
 */
public record Constant(boolean value) implements Node {

    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    /**
     * Returns the shared constant for {@code value}.
     *
     * @param value the truth value
     * @return {@link #TRUE} or {@link #FALSE}
     */
    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public List<Node> operands() {
        return List.of();
    }

    @Override
    public String toString() {
        return NodeRenderer.infix(this);
    }
}
