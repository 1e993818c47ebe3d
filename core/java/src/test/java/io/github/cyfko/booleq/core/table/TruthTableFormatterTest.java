package io.github.cyfko.booleq.core.table;

import io.github.cyfko.booleq.core.config.ExpressionPolicy;
import io.github.cyfko.booleq.core.node.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TruthTableFormatter Tests")
class TruthTableFormatterTest {

    @Test
    @DisplayName("Should render De Morgan comparison with Unicode headers")
    void shouldRenderDeMorganComparison() {
        Variable x = new Variable("x");
        Variable y = new Variable("y");
        TruthTable table = TruthTableEnumerator.defaults().enumerate(x.and(y).not(), x.not().or(y.not()));

        String text = TruthTableFormatter.defaults().format(table);

        assertEquals(
            "x | y | ¬(x ∧ y) | (¬x ∨ ¬y)\n" +
            "--+---+----------+----------\n" +
            "0 | 0 | 1        | 1\n" +
            "0 | 1 | 1        | 1\n" +
            "1 | 0 | 1        | 1\n" +
            "1 | 1 | 0        | 0\n" +
            "All results identical: yes\n",
            text);
    }

    @Test
    @DisplayName("Should render a single expression with ASCII headers and no comparison line")
    void shouldRenderSingleExpressionInAscii() {
        Variable a = new Variable("a");
        Variable b = new Variable("b");
        TruthTable table = TruthTableEnumerator.defaults().enumerate(a.or(b));

        String text = TruthTableFormatter.of(ExpressionPolicy.strict()).format(table);

        assertEquals(
            "a | b | (a | b)\n" +
            "--+---+--------\n" +
            "0 | 0 | 0\n" +
            "0 | 1 | 1\n" +
            "1 | 0 | 1\n" +
            "1 | 1 | 1\n",
            text);
    }

    @Test
    @DisplayName("Should report differing expressions")
    void shouldReportDifferingExpressions() {
        Variable a = new Variable("a");
        TruthTable table = TruthTableEnumerator.defaults().enumerate(a, a.not());

        String text = TruthTableFormatter.defaults().format(table);

        assertTrue(text.endsWith("All results identical: no\n"));
    }
}
