package com.featherplan.expression;

import com.featherplan.functions.FunctionRegistry;
import com.featherplan.test.TestBase;
import com.featherplan.test.TestCategories;
import com.featherplan.types.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.featherplan.expression.BinaryExpression.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for the expression model.
 *
 * <p>Covers literals, attribute identity, aliases, foldability and
 * determinism, reference sets and plan-time evaluation.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Expression Tests")
public class ExpressionTest extends TestBase {

    private final AttributeReference a = AttributeReference.of("a", IntegerType.get());
    private final AttributeReference b = AttributeReference.of("b", IntegerType.get());

    // ==================== Literal Tests ====================

    @Nested
    @DisplayName("Literal Tests")
    class LiteralTests {

        @Test
        @DisplayName("Factories pick the matching type")
        void testFactoryTypes() {
            assertThat(Literal.of(42).dataType()).isEqualTo(IntegerType.get());
            assertThat(Literal.of(42L).dataType()).isEqualTo(LongType.get());
            assertThat(Literal.of(2.5).dataType()).isEqualTo(DoubleType.get());
            assertThat(Literal.of("x").dataType()).isEqualTo(StringType.get());
            assertThat(Literal.of(true).dataType()).isEqualTo(BooleanType.get());
        }

        @Test
        @DisplayName("Boolean factory returns the shared constants")
        void testBooleanConstants() {
            assertThat(Literal.of(true)).isSameAs(Literal.TRUE);
            assertThat(Literal.of(false)).isSameAs(Literal.FALSE);
            assertThat(new Literal(true, BooleanType.get())).isEqualTo(Literal.TRUE);
        }

        @Test
        @DisplayName("Equality compares value and type")
        void testEquality() {
            assertThat(Literal.of(1)).isEqualTo(Literal.of(1));
            assertThat(Literal.of(1)).isNotEqualTo(Literal.of(1L));
            assertThat(Literal.of(1).hashCode()).isEqualTo(Literal.of(1).hashCode());
        }

        @Test
        @DisplayName("Null literal is nullable and keeps its type")
        void testNullLiteral() {
            Literal nullInt = Literal.nullValue(IntegerType.get());

            assertThat(nullInt.isNull()).isTrue();
            assertThat(nullInt.nullable()).isTrue();
            assertThat(nullInt.dataType()).isEqualTo(IntegerType.get());
            assertThat(Literal.nullValue().dataType()).isEqualTo(NullType.get());
            assertThat(Literal.of(1).nullable()).isFalse();
        }

        @Test
        @DisplayName("Literals are foldable leaves")
        void testFoldable() {
            assertThat(Literal.of(1).foldable()).isTrue();
            assertThat(Literal.nullValue().foldable()).isTrue();
            assertThat(Literal.of(1).children()).isEmpty();
            assertThat(Literal.of(1).references()).isEmpty();
        }

        @Test
        @DisplayName("toString renders SQL-like literals")
        void testToString() {
            assertThat(Literal.of(42)).hasToString("42");
            assertThat(Literal.of(42L)).hasToString("42L");
            assertThat(Literal.of("it's")).hasToString("'it''s'");
            assertThat(Literal.TRUE).hasToString("TRUE");
            assertThat(Literal.nullValue()).hasToString("NULL");
        }
    }

    // ==================== Attribute Tests ====================

    @Nested
    @DisplayName("Attribute Tests")
    class AttributeTests {

        @Test
        @DisplayName("Attributes with the same name but different ids differ")
        void testIdentityNotName() {
            AttributeReference other = AttributeReference.of("a", IntegerType.get());

            assertThat(other).isNotEqualTo(a);
            assertThat(other.exprId()).isNotEqualTo(a.exprId());
        }

        @Test
        @DisplayName("Same id means same column regardless of qualifier and nullability")
        void testSameIdSameColumn() {
            AttributeReference qualified = a.withQualifier("t");
            AttributeReference nullable = a.withNullability(false);

            assertThat(qualified).isEqualTo(a);
            assertThat(nullable).isEqualTo(a);
            assertThat(nullable.hashCode()).isEqualTo(a.hashCode());
            assertThat(nullable.nullable()).isFalse();
        }

        @Test
        @DisplayName("newInstance issues a fresh identity")
        void testNewInstance() {
            AttributeReference copy = a.newInstance();

            assertThat(copy.name()).isEqualTo("a");
            assertThat(copy).isNotEqualTo(a);
        }

        @Test
        @DisplayName("Attributes reference themselves and are not foldable")
        void testReferences() {
            assertThat(a.references()).containsExactly(a);
            assertThat(a.foldable()).isFalse();
            assertThat(a.toAttribute()).isSameAs(a);
        }

        @Test
        @DisplayName("Attributes cannot be evaluated")
        void testEvalFails() {
            assertThatThrownBy(() -> a.eval(Row.EMPTY))
                .isInstanceOf(EvaluationException.class);
        }

        @Test
        @DisplayName("toString includes qualifier and id")
        void testToString() {
            AttributeReference qualified = AttributeReference.qualified("t", "col", StringType.get());

            assertThat(qualified.toString()).isEqualTo("t.col#" + qualified.exprId());
            assertThat(a.toString()).isEqualTo("a#" + a.exprId());
        }
    }

    // ==================== Alias Tests ====================

    @Nested
    @DisplayName("Alias Tests")
    class AliasTests {

        @Test
        @DisplayName("toAttribute keeps the alias id and child type")
        void testToAttribute() {
            Alias alias = new Alias(add(a, Literal.of(1)), "y");
            AttributeReference attribute = alias.toAttribute();

            assertThat(attribute.exprId()).isEqualTo(alias.exprId());
            assertThat(attribute.name()).isEqualTo("y");
            assertThat(attribute.dataType()).isEqualTo(IntegerType.get());
            assertThat(attribute.nullable()).isTrue();
        }

        @Test
        @DisplayName("Aliases are never foldable, even over constants")
        void testAliasNotFoldable() {
            Alias alias = new Alias(Literal.of(1), "one");

            assertThat(alias.foldable()).isFalse();
            assertThat(alias.child().foldable()).isTrue();
        }

        @Test
        @DisplayName("withNewChildren keeps name and id")
        void testWithNewChildren() {
            Alias alias = new Alias(a, "y");
            Expression rebuilt = alias.withNewChildren(List.of(b));

            assertThat(rebuilt).isInstanceOf(Alias.class);
            assertThat(((Alias) rebuilt).exprId()).isEqualTo(alias.exprId());
            assertThat(((Alias) rebuilt).child()).isEqualTo(b);
        }
    }

    // ==================== Foldability Tests ====================

    @Nested
    @DisplayName("Foldability Tests")
    class FoldabilityTests {

        @Test
        @DisplayName("Composite of literals is foldable")
        void testCompositeFoldable() {
            assertThat(add(Literal.of(1), Literal.of(2)).foldable()).isTrue();
            assertThat(new Cast(Literal.of("1"), IntegerType.get()).foldable()).isTrue();
        }

        @Test
        @DisplayName("Anything reading a column is not foldable")
        void testColumnNotFoldable() {
            assertThat(add(a, Literal.of(2)).foldable()).isFalse();
            assertThat(new And(Literal.TRUE, greaterThan(a, Literal.of(1))).foldable()).isFalse();
        }

        @Test
        @DisplayName("Non-deterministic functions are not foldable")
        void testNonDeterministic() {
            FunctionCall rand = FunctionCall.of("rand", DoubleType.get());
            BinaryExpression sum = add(rand, Literal.of(1.0));

            assertThat(rand.deterministic()).isFalse();
            assertThat(rand.foldable()).isFalse();
            assertThat(sum.deterministic()).isFalse();
            assertThat(sum.foldable()).isFalse();
        }

        @Test
        @DisplayName("Unknown functions are treated as non-deterministic")
        void testUnknownFunction() {
            FunctionCall call = FunctionCall.of("my_udf", IntegerType.get(), Literal.of(1));

            assertThat(call.deterministic()).isFalse();
            assertThat(call.foldable()).isFalse();
        }

        @Test
        @DisplayName("Bound references are not foldable")
        void testBoundReference() {
            BoundReference ref = new BoundReference(0, IntegerType.get(), false);

            assertThat(ref.foldable()).isFalse();
            assertThat(ref.eval(Row.of(7))).isEqualTo(7);
        }
    }

    // ==================== References Tests ====================

    @Test
    @DisplayName("references collects every attribute in the tree")
    void testReferences() {
        Expression expr = new And(greaterThan(a, Literal.of(1)), equal(b, add(a, Literal.of(2))));

        assertThat(expr.references()).containsExactly(a, b);
    }

    // ==================== Evaluation Tests ====================

    @Nested
    @DisplayName("Evaluation Tests")
    class EvaluationTests {

        @ParameterizedTest(name = "{0} {1} {2} = {3}")
        @CsvSource({
            "7, +, 3, 10",
            "7, -, 3, 4",
            "7, *, 3, 21",
            "7, /, 3, 2",
        })
        @DisplayName("Integer arithmetic")
        void testIntegerArithmetic(int left, String op, int right, int expected) {
            Literal l = Literal.of(left);
            Literal r = Literal.of(right);
            Expression expr = switch (op) {
                case "+" -> add(l, r);
                case "-" -> subtract(l, r);
                case "*" -> multiply(l, r);
                default -> divide(l, r);
            };

            assertThat(expr.eval(Row.EMPTY)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Comparisons yield booleans")
        void testComparisons() {
            assertThat(greaterThan(Literal.of(2), Literal.of(1)).eval(Row.EMPTY)).isEqualTo(true);
            assertThat(lessThan(Literal.of(2), Literal.of(1)).eval(Row.EMPTY)).isEqualTo(false);
            assertThat(equal(Literal.of("x"), Literal.of("x")).eval(Row.EMPTY)).isEqualTo(true);
            assertThat(notEqual(Literal.of(1L), Literal.of(2L)).eval(Row.EMPTY)).isEqualTo(true);
        }

        @Test
        @DisplayName("Null operands propagate")
        void testNullPropagation() {
            Expression expr = add(Literal.nullValue(IntegerType.get()), Literal.of(1));

            assertThat(expr.eval(Row.EMPTY)).isNull();
            assertThat(expr.nullable()).isTrue();
        }

        @Test
        @DisplayName("Integer division by zero fails")
        void testDivisionByZero() {
            assertThatThrownBy(() -> divide(Literal.of(1), Literal.of(0)).eval(Row.EMPTY))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("Division by zero");
        }

        @Test
        @DisplayName("Double division by zero yields infinity")
        void testDoubleDivisionByZero() {
            assertThat(divide(Literal.of(1.0), Literal.of(0.0)).eval(Row.EMPTY))
                .isEqualTo(Double.POSITIVE_INFINITY);
        }

        @Test
        @DisplayName("AND and OR follow three-valued logic")
        void testThreeValuedLogic() {
            Literal nullBool = Literal.nullValue(BooleanType.get());

            assertThat(new And(nullBool, Literal.FALSE).eval(Row.EMPTY)).isEqualTo(false);
            assertThat(new And(nullBool, Literal.TRUE).eval(Row.EMPTY)).isNull();
            assertThat(new Or(nullBool, Literal.TRUE).eval(Row.EMPTY)).isEqualTo(true);
            assertThat(new Or(nullBool, Literal.FALSE).eval(Row.EMPTY)).isNull();
            assertThat(new And(Literal.TRUE, Literal.TRUE).eval(Row.EMPTY)).isEqualTo(true);
        }

        @Test
        @DisplayName("Unary operators")
        void testUnary() {
            assertThat(UnaryExpression.negate(Literal.of(5)).eval(Row.EMPTY)).isEqualTo(-5);
            assertThat(UnaryExpression.not(Literal.TRUE).eval(Row.EMPTY)).isEqualTo(false);
            assertThat(UnaryExpression.isNull(Literal.nullValue()).eval(Row.EMPTY)).isEqualTo(true);
            assertThat(UnaryExpression.isNotNull(Literal.of(1)).eval(Row.EMPTY)).isEqualTo(true);
            assertThat(UnaryExpression.isNull(a).nullable()).isFalse();
        }

        @Test
        @DisplayName("Casts convert between types")
        void testCast() {
            assertThat(new Cast(Literal.of("42"), IntegerType.get()).eval(Row.EMPTY)).isEqualTo(42);
            assertThat(new Cast(Literal.of(7), StringType.get()).eval(Row.EMPTY)).isEqualTo("7");
            assertThat(new Cast(Literal.of(3), DoubleType.get()).eval(Row.EMPTY)).isEqualTo(3.0);
            assertThat(new Cast(Literal.of("true"), BooleanType.get()).eval(Row.EMPTY)).isEqualTo(true);
            assertThat(new Cast(Literal.nullValue(StringType.get()), IntegerType.get()).eval(Row.EMPTY)).isNull();
        }

        @Test
        @DisplayName("Invalid cast raises an evaluation error")
        void testInvalidCast() {
            assertThatThrownBy(() -> new Cast(Literal.of("abc"), IntegerType.get()).eval(Row.EMPTY))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("abc");
        }

        @Test
        @DisplayName("String cast out of integer range raises an evaluation error")
        void testCastOutOfIntegerRange() {
            assertThatThrownBy(() -> new Cast(Literal.of("3000000000"), IntegerType.get()).eval(Row.EMPTY))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("3000000000");
            assertThat(new Cast(Literal.of("3000000000"), LongType.get()).eval(Row.EMPTY)).isEqualTo(3000000000L);
            assertThat(new Cast(Literal.of(" -7 "), IntegerType.get()).eval(Row.EMPTY)).isEqualTo(-7);
        }

        @Test
        @DisplayName("Built-in functions evaluate")
        void testFunctions() {
            assertThat(FunctionCall.of("UPPER", StringType.get(), Literal.of("abc")).eval(Row.EMPTY))
                .isEqualTo("ABC");
            assertThat(FunctionCall.of("length", IntegerType.get(), Literal.of("abcd")).eval(Row.EMPTY))
                .isEqualTo(4);
            assertThat(FunctionCall.of("abs", IntegerType.get(), Literal.of(-3)).eval(Row.EMPTY))
                .isEqualTo(3);
            assertThat(FunctionCall.of("coalesce", IntegerType.get(),
                Literal.nullValue(IntegerType.get()), Literal.of(5)).eval(Row.EMPTY)).isEqualTo(5);
        }

        @Test
        @DisplayName("Wrong arity and unknown functions fail")
        void testFunctionErrors() {
            assertThat(FunctionRegistry.isSupported("Upper")).isTrue();
            assertThat(FunctionRegistry.isSupported("nope")).isFalse();
            assertThatThrownBy(() -> FunctionCall.of("upper", StringType.get()).eval(Row.EMPTY))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("upper");
            assertThatThrownBy(() -> FunctionCall.of("nope", StringType.get()).eval(Row.EMPTY))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("Unknown function: nope");
        }

        @Test
        @DisplayName("Row access out of range fails")
        void testRowOutOfRange() {
            assertThatThrownBy(() -> Row.of(1).get(3))
                .isInstanceOf(EvaluationException.class);
        }
    }

    @Test
    @DisplayName("Structural equality of composite expressions")
    void testStructuralEquality() {
        Expression e1 = greaterThan(add(a, Literal.of(1)), Literal.of(5));
        Expression e2 = greaterThan(add(a, Literal.of(1)), Literal.of(5));
        Expression e3 = greaterThan(add(b, Literal.of(1)), Literal.of(5));

        assertThat(e1).isEqualTo(e2);
        assertThat(e1.hashCode()).isEqualTo(e2.hashCode());
        assertThat(e1).isNotEqualTo(e3);
        assertThat(e1.toString()).isEqualTo("((" + a + " + 1) > 5)");
    }
}
