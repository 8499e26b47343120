package com.featherplan.optimizer;

import com.featherplan.expression.And;
import com.featherplan.expression.Expression;
import com.featherplan.expression.Literal;
import com.featherplan.expression.Or;
import com.featherplan.logical.Filter;
import com.featherplan.logical.Join;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.logical.TableScan;
import com.featherplan.test.PlanTestBase;
import com.featherplan.test.TestCategories;
import com.featherplan.types.IntegerType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.featherplan.expression.BinaryExpression.*;
import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Optimizer
@DisplayName("PushPredicateThroughInnerJoin Tests")
public class PushPredicateThroughInnerJoinTest extends PlanTestBase {

    private final PushPredicateThroughInnerJoin rule = new PushPredicateThroughInnerJoin();

    private final Expression leftOnly = greaterThan(la, Literal.of(1));
    private final Expression rightOnly = greaterThan(rb, Literal.of(2));
    private final Expression both = equal(la, rc);

    @Test
    @DisplayName("Splits conjuncts to left, right and join condition")
    void testPartition() {
        LogicalPlan plan = new Filter(new Join(left, right, Join.JoinType.INNER),
            new And(new And(leftOnly, rightOnly), both));

        assertPlanEquals(rule.apply(plan), new Join(
            new Filter(left, leftOnly),
            new Filter(right, rightOnly),
            Join.JoinType.INNER,
            both));
    }

    @Test
    @DisplayName("Existing join condition is split along with the filter")
    void testMergesJoinCondition() {
        LogicalPlan plan = new Filter(
            new Join(left, right, Join.JoinType.INNER, new And(both, rightOnly)),
            leftOnly);

        assertPlanEquals(rule.apply(plan), new Join(
            new Filter(left, leftOnly),
            new Filter(right, rightOnly),
            Join.JoinType.INNER,
            both));
    }

    @Test
    @DisplayName("Conjuncts keep their relative order within a side")
    void testOrderPreserved() {
        Expression second = lessThan(lx, Literal.of(5));
        LogicalPlan plan = new Filter(new Join(left, right, Join.JoinType.INNER), new And(leftOnly, second));

        assertPlanEquals(rule.apply(plan), new Join(
            new Filter(left, new And(leftOnly, second)),
            right,
            Join.JoinType.INNER));
    }

    @Test
    @DisplayName("Cross-side predicates move into the join condition only")
    void testOnlyJoinCondition() {
        Expression disjunction = new Or(leftOnly, rightOnly);
        LogicalPlan plan = new Filter(new Join(left, right, Join.JoinType.INNER), disjunction);

        assertPlanEquals(rule.apply(plan), new Join(left, right, Join.JoinType.INNER, disjunction));
    }

    @Test
    @DisplayName("A join left with nothing to evaluate has no condition")
    void testNoJoinConditionLeft() {
        LogicalPlan plan = new Filter(new Join(left, right, Join.JoinType.INNER), leftOnly);

        Join result = (Join) rule.apply(plan);

        assertThat(result.condition()).isEmpty();
        assertThat(result.right()).isSameAs(right);
        assertPlanEquals(result.left(), new Filter(left, leftOnly));
    }

    @Test
    @DisplayName("Predicates without column references go to the right side")
    void testConstantConjunct() {
        Expression constant = equal(Literal.of(1), Literal.of(2));
        LogicalPlan plan = new Filter(new Join(left, right, Join.JoinType.INNER), constant);

        assertPlanEquals(rule.apply(plan),
            new Join(left, new Filter(right, constant), Join.JoinType.INNER));
    }

    @Test
    @DisplayName("Same-named columns of a self join are told apart by identity")
    void testSelfJoin() {
        TableScan t1 = TableScan.of("t", "id", IntegerType.get());
        TableScan t2 = TableScan.of("t", "id", IntegerType.get());
        Expression onFirst = greaterThan(t1.output().get(0), Literal.of(10));
        LogicalPlan plan = new Filter(new Join(t1, t2, Join.JoinType.INNER), onFirst);

        assertPlanEquals(rule.apply(plan), new Join(new Filter(t1, onFirst), t2, Join.JoinType.INNER));
    }

    @Test
    @DisplayName("Pushes through a chain of inner joins in one application")
    void testJoinChain() {
        TableScan third = TableScan.of("s", "d", IntegerType.get());
        Expression onThird = greaterThan(third.output().get(0), Literal.of(2));
        LogicalPlan plan = new Filter(
            new Join(new Join(left, right, Join.JoinType.INNER), third, Join.JoinType.INNER),
            new And(leftOnly, onThird));

        LogicalPlan once = rule.apply(plan);

        assertPlanEquals(once, new Join(
            new Join(new Filter(left, leftOnly), right, Join.JoinType.INNER),
            new Filter(third, onThird),
            Join.JoinType.INNER));
        assertThat(rule.apply(once)).isEqualTo(once);
        assertThat(once.output()).isEqualTo(plan.output());
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(value = Join.JoinType.class, names = "INNER", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Non-inner joins are untouched")
    void testNonInnerJoin(Join.JoinType joinType) {
        LogicalPlan plan = new Filter(new Join(left, right, joinType, both), leftOnly);

        assertThat(rule.apply(plan)).isSameAs(plan);
    }

    @Test
    @DisplayName("Output is preserved and the rule is idempotent")
    void testOutputAndIdempotence() {
        LogicalPlan plan = new Filter(new Join(left, right, Join.JoinType.INNER),
            new And(new And(leftOnly, rightOnly), both));

        LogicalPlan once = rule.apply(plan);

        assertThat(once.output()).isEqualTo(plan.output());
        assertThat(rule.apply(once)).isSameAs(once);
    }
}
