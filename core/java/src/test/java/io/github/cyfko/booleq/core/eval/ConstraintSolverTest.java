package io.github.cyfko.booleq.core.eval;

import io.github.cyfko.booleq.core.exception.StateChangeUnableException;
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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link ConstraintSolver}.
 */
@DisplayName("ConstraintSolver Tests")
class ConstraintSolverTest {

    private Variable x;
    private Variable y;

    @BeforeEach
    void setUp() {
        x = new Variable("x");
        y = new Variable("y");
    }

    @Nested
    @DisplayName("Leaves")
    class Leaves {

        @Test
        @DisplayName("Should accept a constant matching the target")
        void shouldAcceptMatchingConstant() {
            assertDoesNotThrow(() -> Constant.TRUE.setState(true));
            assertDoesNotThrow(() -> Constant.FALSE.setState(false));
        }

        @Test
        @DisplayName("Should refuse to change a constant")
        void shouldRefuseToChangeConstant() {
            StateChangeUnableException exception =
                assertThrows(StateChangeUnableException.class, () -> Constant.TRUE.setState(false));

            assertSame(Constant.TRUE, exception.getNode());
            assertFalse(exception.getTarget());
        }

        @Test
        @DisplayName("Should assign an unset variable")
        void shouldAssignUnsetVariable() {
            x.setState(false);

            assertEquals(Optional.of(false), x.value());
        }

        @Test
        @DisplayName("Should refuse to flip a variable already set")
        void shouldRefuseToFlipVariable() {
            x.assign(true);

            assertDoesNotThrow(() -> x.setState(true));
            assertThrows(StateChangeUnableException.class, () -> x.setState(false));
            assertEquals(Optional.of(true), x.value());
        }

        @Test
        @DisplayName("Should force the operand of Not to the opposite value")
        void shouldForceNotOperand() {
            new Not(x).setState(true);

            assertEquals(Optional.of(false), x.value());
        }
    }

    @Nested
    @DisplayName("Junctions")
    class Junctions {

        @Test
        @DisplayName("Should set only the first operand of Or to reach true")
        void shouldSetOnlyFirstOperandOfOr() {
            Or or = Or.of(x, y);

            or.setState(true);

            assertEquals(Optional.of(true), x.value());
            assertFalse(y.isSet());
            assertTrue(or.state());
        }

        @Test
        @DisplayName("Should skip an Or operand that cannot become true")
        void shouldSkipOrOperandThatCannotBecomeTrue() {
            x.assign(false);

            Or.of(x, y).setState(true);

            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should set every And operand to reach true")
        void shouldSetEveryAndOperand() {
            And.of(x, y).setState(true);

            assertEquals(Optional.of(true), x.value());
            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should set only the first changeable And operand to reach false")
        void shouldSetFirstChangeableAndOperandToFalse() {
            Variable z = new Variable("z");
            x.assign(true);

            And.of(x, y, z).setState(false);

            assertEquals(Optional.of(false), y.value());
            assertFalse(z.isSet());
        }

        @Test
        @DisplayName("Should set every Or operand to reach false")
        void shouldSetEveryOrOperandToFalse() {
            Or.of(x, y.not()).setState(false);

            assertEquals(Optional.of(false), x.value());
            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should keep assignments of earlier operands when a later one fails")
        void shouldKeepEarlierAssignmentsOnFailure() {
            y.assign(true);

            assertThrows(StateChangeUnableException.class, () -> Or.of(x, y).setState(false));

            assertEquals(Optional.of(false), x.value());
        }

        @Test
        @DisplayName("Should leave the expression untouched when it already has the target value")
        void shouldLeaveExpressionUntouchedWhenAlreadyDecided() {
            x.assign(false);

            And.of(x, y).setState(false);

            assertFalse(y.isSet());
        }

        @Test
        @DisplayName("Should undo a failed alternative before trying the next one")
        void shouldUndoFailedAlternative() {
            Variable p = new Variable("p");
            Or or = Or.of(And.of(p, Constant.FALSE), y);

            or.setState(true);

            assertFalse(p.isSet());
            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should report the junction when every alternative fails")
        void shouldReportJunctionWhenEveryAlternativeFails() {
            Or or = Or.of(Constant.FALSE, Constant.FALSE);

            StateChangeUnableException exception =
                assertThrows(StateChangeUnableException.class, () -> or.setState(true));

            assertSame(or, exception.getNode());
            assertTrue(exception.getTarget());
            assertEquals("Cannot make Or(Constant(false), Constant(false)) equal true", exception.getMessage());
            assertInstanceOf(StateChangeUnableException.class, exception.getCause());
        }
    }

    @Nested
    @DisplayName("Binary connectives")
    class BinaryConnectives {

        @Test
        @DisplayName("Should default Xor to left true, right false")
        void shouldDefaultXorTrue() {
            new Xor(x, y).setState(true);

            assertEquals(Optional.of(true), x.value());
            assertEquals(Optional.of(false), y.value());
        }

        @Test
        @DisplayName("Should default Xor false to both true")
        void shouldDefaultXorFalse() {
            new Xor(x, y).setState(false);

            assertEquals(Optional.of(true), x.value());
            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should force the undecided Xor operand against the decided one")
        void shouldForceUndecidedXorOperand() {
            y.assign(true);

            new Xor(x, y).setState(true);

            assertEquals(Optional.of(false), x.value());
        }

        @Test
        @DisplayName("Should fall back to the other Xor polarity and undo the first attempt")
        void shouldFallBackToOtherXorPolarity() {
            Variable p = new Variable("p");
            Node contradiction = And.of(p, p.not());

            new Xor(contradiction, y).setState(true);

            assertEquals(Optional.of(false), p.value());
            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should default Equivalent true to both true and false to left true, right false")
        void shouldDefaultEquivalent() {
            new Equivalent(x, y).setState(true);
            assertEquals(Optional.of(true), x.value());
            assertEquals(Optional.of(true), y.value());

            Variable u = new Variable("u");
            Variable v = new Variable("v");
            new Equivalent(u, v).setState(false);
            assertEquals(Optional.of(true), u.value());
            assertEquals(Optional.of(false), v.value());
        }

        @Test
        @DisplayName("Should force the variable of Equivalent with a true constant")
        void shouldForceVariableOfEquivalentWithConstant() {
            new Equivalent(Constant.TRUE, x).setState(false);
            assertEquals(Optional.of(false), x.value());

            new Equivalent(Constant.TRUE, y).setState(true);
            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should fail on Equivalent of two different constants")
        void shouldFailOnEquivalentOfDifferentConstants() {
            Equivalent impossible = new Equivalent(Constant.TRUE, Constant.FALSE);

            assertThrows(StateChangeUnableException.class, () -> impossible.setState(true));
            assertDoesNotThrow(() -> impossible.setState(false));
        }

        @Test
        @DisplayName("Should prefer a true consequent for Implication")
        void shouldPreferTrueConsequent() {
            new Implication(x, y).setState(true);

            assertFalse(x.isSet());
            assertEquals(Optional.of(true), y.value());
        }

        @Test
        @DisplayName("Should fall back to a false antecedent for Implication")
        void shouldFallBackToFalseAntecedent() {
            y.assign(false);

            new Implication(x, y).setState(true);

            assertEquals(Optional.of(false), x.value());
        }

        @Test
        @DisplayName("Should force true antecedent and false consequent for a false Implication")
        void shouldForceFalseImplication() {
            new Implication(x, y).setState(false);

            assertEquals(Optional.of(true), x.value());
            assertEquals(Optional.of(false), y.value());
        }

        @Test
        @DisplayName("Should fail a false Implication whose antecedent is false")
        void shouldFailFalseImplicationWithFalseAntecedent() {
            x.assign(false);

            assertThrows(StateChangeUnableException.class, () -> new Implication(x, y).setState(false));
        }
    }

    // ========== Properties ==========

    static Stream<Arguments> expressions() {
        return Stream.<Supplier<Node>>of(
            () -> And.of(new Variable("a"), new Variable("b").not(), new Variable("c")),
            () -> Or.of(And.of(new Variable("a"), new Variable("b")), new Variable("c").not()),
            () -> new Xor(new Variable("a"), Or.of(new Variable("b"), new Variable("c"))),
            () -> new Implication(And.of(new Variable("a"), new Variable("b")), new Xor(new Variable("c"), new Variable("d"))),
            () -> new Equivalent(new Not(new Variable("a")), Or.of(new Variable("b"), Constant.FALSE)),
            () -> {
                Variable shared = new Variable("s");
                return And.of(Or.of(shared, new Variable("a")), new Implication(shared, new Variable("b")), shared.not().or(new Variable("c")));
            }
        ).flatMap(supplier -> Stream.of(Arguments.of(supplier, true), Arguments.of(supplier, false)));
    }

    @ParameterizedTest(name = "[{index}] target={1}")
    @MethodSource("expressions")
    @DisplayName("Should evaluate to the target after a successful solve")
    void shouldEvaluateToTargetAfterSolve(Supplier<Node> expression, boolean target) {
        Node node = expression.get();

        node.setState(target);

        assertEquals(target, node.state());
    }

    @Test
    @DisplayName("Should keep ancestors consistent with the solved sub-expression")
    void shouldKeepAncestorsConsistent() {
        Variable z = new Variable("z");
        Or child = Or.of(x, y);
        And parent = And.of(child, Constant.TRUE);
        Or grandParent = Or.of(parent, z);

        child.setState(true);

        assertTrue(parent.state());
        assertTrue(grandParent.state());
        assertFalse(z.isSet());
    }
}
