package io.github.cyfko.booleq.core.table;

import io.github.cyfko.booleq.core.config.ExpressionPolicy;
import io.github.cyfko.booleq.core.exception.InvalidOperandException;
import io.github.cyfko.booleq.core.node.Node;
import io.github.cyfko.booleq.core.node.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Enumerates every total assignment of the variables reachable from one or more expressions.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Discover the distinct variable names of all roots, in first-seen order ({@link VariableIndex})</li>
 *   <li>Count from {@code 0} to {@code 2^n - 1}; bit {@code n-1-j} of the counter is the value of name {@code j},
 *       so the first row is all-false, the last all-true, and the first name is the most significant</li>
 *   <li>For each count, assign every variable instance carrying each name, then evaluate every root</li>
 *   <li>Restore each variable to the state it held before the enumeration</li>
 * </ol>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Variable x = new Variable("x");
 * Variable y = new Variable("y");
 *
 * TruthTable table = TruthTableEnumerator.defaults().enumerate(
 *     x.and(y).not(),
 *     x.not().or(y.not()));
 *
 * table.rows().size();          // 4
 * table.allResultsIdentical();  // true (De Morgan)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see TruthTableFormatter
 */
public final class TruthTableEnumerator {

    private static final Logger log = Logger.getLogger(TruthTableEnumerator.class.getName());

    private final ExpressionPolicy policy;

    private TruthTableEnumerator(ExpressionPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return an enumerator following {@link ExpressionPolicy#defaults()}
     */
    public static TruthTableEnumerator defaults() {
        return new TruthTableEnumerator(ExpressionPolicy.defaults());
    }

    /**
     * @param policy the policy bounding the number of variables
     * @return an enumerator following {@code policy}
     */
    public static TruthTableEnumerator of(ExpressionPolicy policy) {
        Objects.requireNonNull(policy, "Expression policy is required");
        return new TruthTableEnumerator(policy);
    }

    /**
     * Builds the complete truth table of the given roots.
     *
     * @param roots one or more expressions
     * @return the table
     * @throws InvalidOperandException if no root is given or the roots reach too many distinct names
     */
    public TruthTable enumerate(Node... roots) {
        List<TruthTableRow> rows = new ArrayList<>();
        List<String> names = enumerate(rows::add, roots);
        return new TruthTable(names, Arrays.asList(roots), rows);
    }

    /**
     * Streams the rows of the truth table of the given roots to a listener.
     *
     * @param listener receives each row, in ascending order
     * @param roots    one or more expressions
     * @return the variable names, in column order
     * @throws InvalidOperandException if no root is given or the roots reach too many distinct names
     */
    public List<String> enumerate(TruthTableListener listener, Node... roots) {
        Objects.requireNonNull(listener, "listener cannot be null");
        List<Node> rootList = requireRoots(roots);

        VariableIndex index = VariableIndex.of(rootList);
        int n = index.size();
        if (n > policy.maxTableVariables()) {
            throw new InvalidOperandException(String.format(
                "Truth table over %d variables exceeds the limit of %d (policy %s)",
                n, policy.maxTableVariables(), policy.policyName()));
        }

        List<String> names = index.names();
        List<List<Variable>> columns = new ArrayList<>(n);
        for (String name : names) {
            columns.add(index.variables(name));
        }

        log.fine(() -> String.format("Enumerating %d row(s) over %s for %d expression(s)", 1 << n, names, rootList.size()));

        Map<Variable, Optional<Boolean>> saved = snapshot(columns);
        try {
            for (int row = 0; row < (1 << n); row++) {
                List<Boolean> assignment = new ArrayList<>(n);
                for (int j = 0; j < n; j++) {
                    boolean value = ((row >> (n - 1 - j)) & 1) == 1;
                    assignment.add(value);
                    for (Variable variable : columns.get(j)) {
                        variable.assign(value);
                    }
                }
                List<Boolean> results = new ArrayList<>(rootList.size());
                for (Node root : rootList) {
                    results.add(root.state());
                }
                listener.onRow(new TruthTableRow(row, assignment, results));
            }
        } finally {
            saved.forEach((variable, value) -> variable.assign(value));
        }
        return names;
    }

    private static List<Node> requireRoots(Node[] roots) {
        if (roots == null || roots.length == 0) {
            throw new InvalidOperandException("A truth table requires at least one expression");
        }
        for (Node root : roots) {
            if (root == null) {
                throw new InvalidOperandException("Truth table expressions cannot be null");
            }
        }
        return List.of(roots);
    }

    private static Map<Variable, Optional<Boolean>> snapshot(List<List<Variable>> columns) {
        Map<Variable, Optional<Boolean>> saved = new IdentityHashMap<>();
        for (List<Variable> column : columns) {
            for (Variable variable : column) {
                saved.put(variable, variable.value());
            }
        }
        return saved;
    }
}
