package io.github.cyfko.booleq.core.table;

import io.github.cyfko.booleq.core.node.Node;
import io.github.cyfko.booleq.core.node.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The variables reachable from a set of root nodes, grouped by name.
 * <p>
 * Names are kept in first-seen order: roots are walked left to right, each depth-first with operands
 * in declaration order. A node shared by several parents or roots is walked once. Distinct variable
 * instances sharing a name are grouped under that name.
 * </p>
 *
 * <pre>{@code
 * VariableIndex index = VariableIndex.of(List.of(or("b", "a"), and("a", "c")));
 * index.names();    // [b, a, c]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class VariableIndex {

    private final Map<String, List<Variable>> variablesByName;

    private VariableIndex(Map<String, List<Variable>> variablesByName) {
        this.variablesByName = variablesByName;
    }

    /**
     * Collects the variables reachable from {@code roots}.
     *
     * @param roots the root nodes, in order
     * @return the index
     */
    public static VariableIndex of(List<? extends Node> roots) {
        Map<String, List<Variable>> byName = new LinkedHashMap<>();
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> stack = new ArrayDeque<>();

        for (Node root : roots) {
            stack.push(root);
            while (!stack.isEmpty()) {
                Node node = stack.pop();
                if (!visited.add(node)) {
                    continue;
                }
                if (node instanceof Variable variable) {
                    byName.computeIfAbsent(variable.name(), name -> new ArrayList<>()).add(variable);
                    continue;
                }
                List<Node> operands = node.operands();
                for (int i = operands.size() - 1; i >= 0; i--) {
                    stack.push(operands.get(i));
                }
            }
        }
        return new VariableIndex(byName);
    }

    /**
     * @return the distinct names, in first-seen order
     */
    public List<String> names() {
        return List.copyOf(variablesByName.keySet());
    }

    /**
     * @param name a variable name
     * @return every reachable variable instance with that name, empty if none
     */
    public List<Variable> variables(String name) {
        return Collections.unmodifiableList(variablesByName.getOrDefault(name, List.of()));
    }

    public int size() {
        return variablesByName.size();
    }
}
