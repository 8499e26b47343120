package com.featherplan.optimizer;

import com.featherplan.expression.And;
import com.featherplan.expression.Expression;
import com.featherplan.expression.Literal;
import com.featherplan.expression.Or;
import com.featherplan.logical.Filter;
import com.featherplan.logical.Join;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.test.PlanTestBase;
import com.featherplan.test.TestCategories;
import com.featherplan.types.BooleanType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.featherplan.expression.BinaryExpression.*;
import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Optimizer
@DisplayName("BooleanSimplification Tests")
public class BooleanSimplificationTest extends PlanTestBase {

    private final BooleanSimplification rule = new BooleanSimplification();

    private final Expression x = greaterThan(a, Literal.of(1));
    private final Expression y = lessThan(b, Literal.of(5));

    private Expression simplified(Expression condition) {
        LogicalPlan result = rule.apply(new Filter(testRelation, condition));
        return ((Filter) result).condition();
    }

    @Test
    @DisplayName("TRUE is the identity of AND")
    void testAndTrue() {
        assertThat(simplified(new And(Literal.TRUE, x))).isSameAs(x);
        assertThat(simplified(new And(x, Literal.TRUE))).isSameAs(x);
    }

    @Test
    @DisplayName("FALSE absorbs AND")
    void testAndFalse() {
        assertThat(simplified(new And(Literal.FALSE, x))).isEqualTo(Literal.FALSE);
        assertThat(simplified(new And(x, Literal.FALSE))).isEqualTo(Literal.FALSE);
    }

    @Test
    @DisplayName("TRUE absorbs OR")
    void testOrTrue() {
        assertThat(simplified(new Or(Literal.TRUE, x))).isEqualTo(Literal.TRUE);
        assertThat(simplified(new Or(x, Literal.TRUE))).isEqualTo(Literal.TRUE);
    }

    @Test
    @DisplayName("FALSE is the identity of OR")
    void testOrFalse() {
        assertThat(simplified(new Or(Literal.FALSE, x))).isSameAs(x);
        assertThat(simplified(new Or(x, Literal.FALSE))).isSameAs(x);
    }

    @Test
    @DisplayName("Simplification cascades bottom-up")
    void testCascade() {
        Expression condition = new And(new Or(Literal.FALSE, x), new And(Literal.TRUE, y));

        assertThat(simplified(condition)).isEqualTo(new And(x, y));
        assertThat(simplified(new Or(x, new And(Literal.TRUE, Literal.TRUE)))).isEqualTo(Literal.TRUE);
    }

    @Test
    @DisplayName("NULL operands are left alone")
    void testNullNotSimplified() {
        Expression condition = new And(Literal.nullValue(BooleanType.get()), x);

        assertThat(simplified(condition)).isSameAs(condition);
    }

    @Test
    @DisplayName("Simplifies join conditions too")
    void testJoinCondition() {
        Join join = new Join(left, right, Join.JoinType.INNER, new And(equal(la, rc), Literal.TRUE));

        assertPlanEquals(rule.apply(join), new Join(left, right, Join.JoinType.INNER, equal(la, rc)));
    }

    @Test
    @DisplayName("Plans without boolean literals are returned unchanged")
    void testUnchanged() {
        LogicalPlan plan = new Filter(testRelation, new And(x, y));

        assertThat(rule.apply(plan)).isSameAs(plan);
    }

    @Test
    @DisplayName("Output is preserved and the rule is idempotent")
    void testOutputAndIdempotence() {
        LogicalPlan plan = new Filter(
            new Join(left, right, Join.JoinType.INNER, new And(equal(la, rc), new Or(Literal.FALSE, Literal.TRUE))),
            new Or(new And(Literal.TRUE, greaterThan(lx, Literal.of(1))), Literal.FALSE));

        LogicalPlan once = rule.apply(plan);

        assertPlanEquals(once, new Filter(
            new Join(left, right, Join.JoinType.INNER, equal(la, rc)),
            greaterThan(lx, Literal.of(1))));
        assertThat(once.output()).isEqualTo(plan.output());
        assertPlanEquals(rule.apply(once), once);
    }
}
