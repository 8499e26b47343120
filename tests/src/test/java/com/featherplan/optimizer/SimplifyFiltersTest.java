package com.featherplan.optimizer;

import com.featherplan.expression.Literal;
import com.featherplan.logical.Filter;
import com.featherplan.logical.LocalRelation;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.logical.Project;
import com.featherplan.test.PlanTestBase;
import com.featherplan.test.TestCategories;
import com.featherplan.types.BooleanType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.featherplan.expression.BinaryExpression.*;
import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Optimizer
@DisplayName("SimplifyFilters Tests")
public class SimplifyFiltersTest extends PlanTestBase {

    private final SimplifyFilters rule = new SimplifyFilters();

    @Test
    @DisplayName("An always-true filter is replaced by its child")
    void testTrueFilterRemoved() {
        LogicalPlan plan = new Filter(testRelation, Literal.TRUE);

        assertThat(rule.apply(plan)).isSameAs(testRelation);
    }

    @Test
    @DisplayName("An always-false filter becomes an empty relation with the same output")
    void testFalseFilterEmpty() {
        LogicalPlan plan = new Filter(testRelation, Literal.FALSE);

        LogicalPlan result = rule.apply(plan);

        assertPlanEquals(result, new LocalRelation(testRelation.output()));
        assertThat(result.output()).isEqualTo(plan.output());
    }

    @Test
    @DisplayName("A NULL filter becomes an empty relation")
    void testNullFilterEmpty() {
        assertPlanEquals(rule.apply(new Filter(testRelation, Literal.nullValue(BooleanType.get()))),
            new LocalRelation(testRelation.output()));
        assertPlanEquals(rule.apply(new Filter(testRelation, Literal.nullValue())),
            new LocalRelation(testRelation.output()));
    }

    @Test
    @DisplayName("Filters with non-literal conditions are kept")
    void testNonLiteralKept() {
        LogicalPlan plan = new Filter(testRelation, greaterThan(a, Literal.of(1)));

        assertThat(rule.apply(plan)).isSameAs(plan);
    }

    @Test
    @DisplayName("Filters below other operators are simplified")
    void testNestedFilter() {
        LogicalPlan plan = new Project(new Filter(testRelation, Literal.FALSE), List.of(a));

        assertPlanEquals(rule.apply(plan), new Project(new LocalRelation(testRelation.output()), List.of(a)));
    }

    @Test
    @DisplayName("Stacked true filters all disappear")
    void testStackedTrueFilters() {
        LogicalPlan plan = new Filter(new Filter(testRelation, Literal.TRUE), Literal.TRUE);

        assertThat(rule.apply(plan)).isSameAs(testRelation);
    }

    @Test
    @DisplayName("Output is preserved and the rule is idempotent")
    void testOutputAndIdempotence() {
        LogicalPlan plan = new Project(
            new Filter(new Filter(new Filter(testRelation, greaterThan(a, Literal.of(1))), Literal.TRUE), Literal.FALSE),
            List.of(a, c));

        LogicalPlan once = rule.apply(plan);

        assertPlanEquals(once, new Project(new LocalRelation(testRelation.output()), List.of(a, c)));
        assertThat(once.output()).isEqualTo(plan.output());
        assertPlanEquals(rule.apply(once), once);
    }
}
