package io.github.cyfko.booleq.core.table;

import io.github.cyfko.booleq.core.node.Node;

import java.util.List;

/**
 * A complete truth table of one or more expressions.
 *
 * @param names the variable names, one column each, in first-seen order
 * @param roots the compared expressions, one result column each
 * @param rows  the {@code 2^n} rows, in ascending binary order
 * @author Frank KOSSI
 * @since 1.0
 */
public record TruthTable(List<String> names, List<Node> roots, List<TruthTableRow> rows) {

    public TruthTable {
        names = List.copyOf(names);
        roots = List.copyOf(roots);
        rows = List.copyOf(rows);
    }

    /**
     * Tells whether all roots agree on every row, i.e. are logically equivalent over the enumerated names.
     *
     * @return {@code true} if every row is uniform
     */
    public boolean allResultsIdentical() {
        return rows.stream().allMatch(TruthTableRow::isUniform);
    }

    /**
     * Returns the result column of one root.
     *
     * @param rootIndex the position of the root
     * @return its result on each row
     */
    public List<Boolean> results(int rootIndex) {
        return rows.stream().map(row -> row.results().get(rootIndex)).toList();
    }
}
