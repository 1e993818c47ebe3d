package io.github.cyfko.booleq.core.exception;

/**
 * Exception thrown when an expression cannot be constructed from the given operands.
 * <p>
 * Construction fails fast, before any node is created or any variable mutated:
 * </p>
 * <ul>
 *   <li><strong>Operand type:</strong> an operand that is neither a node, a variable name nor a boolean</li>
 *   <li><strong>Operand count:</strong> a strictly binary connective given other than two operands,
 *       or an AND/OR given fewer than two</li>
 *   <li><strong>Variable name:</strong> empty names, whitespace, quotes, {@code '='} or a leading negation prefix</li>
 *   <li><strong>Missing operand:</strong> a {@code null} passed to {@code and()}/{@code or()}</li>
 *   <li><strong>Table size:</strong> more distinct variables than the policy allows in a truth table</li>
 * </ul>
 *
 * <pre>{@code
 * Expressions.xor("a");              // → "Xor requires exactly 2 operands, got 1"
 * Expressions.and("a", 3.5);         // → "Unsupported operand of type Double: 3.5"
 * new Variable("a b");               // → "Invalid variable name 'a b': whitespace is not allowed"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class InvalidOperandException extends IllegalArgumentException {

    /**
     * @param message the description of the invalid input
     */
    public InvalidOperandException(String message) {
        super(message);
    }

    /**
     * @param message the description of the invalid input
     * @param cause   the underlying cause
     */
    public InvalidOperandException(String message, Throwable cause) {
        super(message, cause);
    }
}
