package io.github.cyfko.booleq.core.table;

/**
 * Receives the rows of a truth table as they are enumerated.
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see TruthTableEnumerator#enumerate(TruthTableListener, io.github.cyfko.booleq.core.node.Node...)
 */
@FunctionalInterface
public interface TruthTableListener {

    /**
     * Called once per assignment, in ascending row order.
     *
     * @param row the enumerated row
     */
    void onRow(TruthTableRow row);
}
