package io.github.cyfko.booleq.core.node;

import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.List;

/**
 * Material implication {@code antecedent → consequent}, with the semantics of
 * {@code Or(Not(antecedent), consequent)}.
 *
 * @param antecedent the condition
 * @param consequent the conclusion
 * @author Frank KOSSI
 * @since 1.0
 */
public record Implication(Node antecedent, Node consequent) implements Node {

    public Implication {
        if (antecedent == null || consequent == null) {
            throw new InvalidOperandException("Implication requires two non-null operands");
        }
    }

    @Override
    public List<Node> operands() {
        return List.of(antecedent, consequent);
    }

    @Override
    public String toString() {
        return NodeRenderer.infix(this);
    }
}
