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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NodeRenderer Tests")
class NodeRendererTest {

    private Variable x;
    private Variable y;
    private Node expression;

    @BeforeEach
    void setUp() {
        x = new Variable("x", true);
        y = new Variable("y");
        expression = And.of(x, new Not(y), Constant.FALSE);
    }

    @Test
    @DisplayName("Should render the canonical constructor form with variable states")
    void shouldRenderCanonicalForm() {
        assertEquals("And(Variable(\"x\", true), Not(Variable(\"y\")), Constant(false))", expression.toCanonicalString());
    }

    @Test
    @DisplayName("Should render every connective in canonical form")
    void shouldRenderEveryConnectiveInCanonicalForm() {
        Node node = Or.of(new Xor(x, y), new Implication(x, y), new Equivalent(y, Constant.TRUE));

        assertEquals("Or(Xor(Variable(\"x\", true), Variable(\"y\")), "
                + "Implication(Variable(\"x\", true), Variable(\"y\")), "
                + "Equivalent(Variable(\"y\"), Constant(true)))",
            NodeRenderer.canonical(node));
    }

    @Test
    @DisplayName("Should render Unicode infix form with values")
    void shouldRenderUnicodeInfix() {
        assertEquals("(x=1 ∧ ¬(y=?) ∧ ⊥)", expression.toString());
    }

    @Test
    @DisplayName("Should render ASCII infix form with values")
    void shouldRenderAsciiInfix() {
        assertEquals("(x=1 & ~(y=?) & 0)", expression.toInfixString(SymbolSet.ASCII));
    }

    @Test
    @DisplayName("Should render infix form without values")
    void shouldRenderInfixWithoutValues() {
        Node node = new Implication(new Not(And.of(x, y)), new Xor(x, new Equivalent(y, Constant.TRUE)));

        assertEquals("(¬(x ∧ y) → (x ⊕ (y ↔ ⊤)))", NodeRenderer.infix(node, SymbolSet.UNICODE, false));
        assertEquals("(~(x & y) -> (x ^ (y <-> 1)))", NodeRenderer.infix(node, SymbolSet.ASCII, false));
    }

    @Test
    @DisplayName("Should follow variable state changes")
    void shouldFollowVariableStateChanges() {
        y.assign(false);
        x.unset();

        assertEquals("(x=? ∧ ¬(y=0) ∧ ⊥)", expression.toString());
        assertEquals("y=0", y.toString());
    }
}
