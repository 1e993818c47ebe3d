package io.github.cyfko.booleq.core.table;

import io.github.cyfko.booleq.core.node.And;
import io.github.cyfko.booleq.core.node.Node;
import io.github.cyfko.booleq.core.node.Or;
import io.github.cyfko.booleq.core.node.Variable;
import io.github.cyfko.booleq.core.node.Xor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.cyfko.booleq.core.Expressions.and;
import static io.github.cyfko.booleq.core.Expressions.or;
import static org.junit.jupiter.api.Assertions.*;

class VariableIndexTest {

    @Test
    @DisplayName("Should list names in first-seen order across roots")
    void shouldListNamesInFirstSeenOrder() {
        VariableIndex index = VariableIndex.of(List.of(or("b", "a"), and("a", "~c")));

        assertEquals(List.of("b", "a", "c"), index.names());
        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("Should walk operands depth-first, left to right")
    void shouldWalkDepthFirst() {
        Node root = Or.of(And.of(new Variable("p"), new Xor(new Variable("q"), new Variable("r"))), new Variable("s"));

        assertEquals(List.of("p", "q", "r", "s"), VariableIndex.of(List.of(root)).names());
    }

    @Test
    @DisplayName("Should group distinct instances sharing a name and list shared instances once")
    void shouldGroupInstancesByName() {
        Variable shared = new Variable("x");
        Variable twin = new Variable("x");
        Node first = And.of(shared, new Variable("y"));
        Node second = Or.of(shared, twin, first);

        VariableIndex index = VariableIndex.of(List.of(first, second));

        assertEquals(List.of("x", "y"), index.names());
        assertEquals(List.of(shared, twin), index.variables("x"));
        assertTrue(index.variables("z").isEmpty());
    }
}
