package io.github.cyfko.booleq.core.table;

import io.github.cyfko.booleq.core.config.ExpressionPolicy;
import io.github.cyfko.booleq.core.config.SymbolSet;
import io.github.cyfko.booleq.core.node.Node;
import io.github.cyfko.booleq.core.render.NodeRenderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link TruthTable} as aligned text.
 * <p>
 * One column per variable name, then one column per expression headed by its infix form without
 * values. Cells are {@code 1} or {@code 0}. When more than one expression is compared, a closing line
 * tells whether all results are identical.
 * </p>
 *
 * <pre>
 * x | y | ¬(x ∧ y) | (¬x ∨ ¬y)
 * --+---+----------+----------
 * 0 | 0 | 1        | 1
 * 0 | 1 | 1        | 1
 * 1 | 0 | 1        | 1
 * 1 | 1 | 0        | 0
 * All results identical: yes
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class TruthTableFormatter {

    private final SymbolSet symbols;

    private TruthTableFormatter(SymbolSet symbols) {
        this.symbols = symbols;
    }

    /**
     * @param policy the policy whose symbol set is used for the headers
     * @return a formatter
     */
    public static TruthTableFormatter of(ExpressionPolicy policy) {
        Objects.requireNonNull(policy, "Expression policy is required");
        return new TruthTableFormatter(policy.symbolSet());
    }

    /**
     * @return a formatter using {@link SymbolSet#UNICODE}
     */
    public static TruthTableFormatter defaults() {
        return new TruthTableFormatter(SymbolSet.UNICODE);
    }

    /**
     * Renders the table.
     *
     * @param table the table to render
     * @return the text, lines separated by {@code '\n'}
     */
    public String format(TruthTable table) {
        List<String> headers = new ArrayList<>(table.names());
        for (Node root : table.roots()) {
            headers.add(NodeRenderer.infix(root, symbols, false));
        }
        int[] widths = headers.stream().mapToInt(String::length).toArray();

        StringBuilder out = new StringBuilder();
        appendLine(out, headers, widths);

        List<String> separator = new ArrayList<>(headers.size());
        for (int width : widths) {
            separator.add("-".repeat(width));
        }
        out.append(String.join("-+-", separator)).append('\n');

        for (TruthTableRow row : table.rows()) {
            List<String> cells = new ArrayList<>(headers.size());
            row.assignment().forEach(value -> cells.add(bit(value)));
            row.results().forEach(value -> cells.add(bit(value)));
            appendLine(out, cells, widths);
        }

        if (table.roots().size() > 1) {
            out.append("All results identical: ").append(table.allResultsIdentical() ? "yes" : "no").append('\n');
        }
        return out.toString();
    }

    private static void appendLine(StringBuilder out, List<String> cells, int[] widths) {
        List<String> padded = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            padded.add(pad(cells.get(i), widths[i]));
        }
        out.append(String.join(" | ", padded).stripTrailing()).append('\n');
    }

    private static String pad(String cell, int width) {
        return cell + " ".repeat(Math.max(0, width - cell.length()));
    }

    private static String bit(boolean value) {
        return value ? "1" : "0";
    }
}
