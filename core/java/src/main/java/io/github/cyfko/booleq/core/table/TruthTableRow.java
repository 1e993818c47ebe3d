package io.github.cyfko.booleq.core.table;

import java.util.List;

/**
 * One row of a truth table: a total assignment and the result of every root under it.
 *
 * @param index       position of the row; its bits are the assignment, the first name being the most significant
 * @param assignment  the value of each variable name, in the table's name order
 * @param results     the result of each root, in the order the roots were given
 * @author Frank KOSSI
 * @since 1.0
 */
public record TruthTableRow(int index, List<Boolean> assignment, List<Boolean> results) {

    public TruthTableRow {
        assignment = List.copyOf(assignment);
        results = List.copyOf(results);
    }

    /**
     * Tells whether every root produced the same result on this row.
     *
     * @return {@code true} if all results are equal, or if there is at most one root
     */
    public boolean isUniform() {
        return results.stream().distinct().count() <= 1;
    }
}
