package com.optmodeler.core.expression;

import com.optmodeler.core.container.Model;
import com.optmodeler.core.entity.Parameter;
import com.optmodeler.core.entity.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link Expressions}.
 */
class ExpressionsTest {

    private Variable x;
    private Variable y;
    private Parameter c;

    @BeforeEach
    void setUp() {
        Model model = new Model("algebra");
        x = model.addVariable("x");
        y = model.addVariable("y");
        c = model.addParameter("c", 3);
    }

    @Test
    void add_likeTerms_mergesCoefficients() {
        Expression result = Expressions.add(Expressions.scale(x, 2), Expressions.scale(x, 3));

        assertThat(result).isInstanceOf(Sum.class);
        Sum sum = (Sum) result;
        assertThat(sum.terms()).hasSize(1);
        assertThat(sum.coefficientOf(x.toExpression())).isEqualTo(5.0);
        assertThat(sum.constant()).isZero();
    }

    @Test
    void subtract_sameOperand_returnsZero() {
        assertThat(Expressions.subtract(x, x)).isEqualTo(Constant.ZERO);
    }

    @Test
    void add_singleUnitTerm_returnsBareReference() {
        Expression result = Expressions.add(x, 0);

        assertThat(result).isEqualTo(Expressions.ref(x));
    }

    @Test
    void sum_keepsFirstInsertionOrder() {
        Sum sum = (Sum) Expressions.sum(y, x, y);

        assertThat(sum.terms().keySet()).containsExactly(y.toExpression(), x.toExpression());
        assertThat(sum.coefficientOf(y.toExpression())).isEqualTo(2.0);
    }

    @Test
    void weightedSum_mismatchedSizes_throwsException() {
        assertThatThrownBy(() -> Expressions.weightedSum(List.of(x, y), List.of(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void multiply_constantFactor_scalesTerms() {
        Sum sum = (Sum) Expressions.multiply(Expressions.add(x, 1), 2);

        assertThat(sum.coefficientOf(x.toExpression())).isEqualTo(2.0);
        assertThat(sum.constant()).isEqualTo(2.0);
    }

    @Test
    void multiply_twoDecisionVariables_isNonlinear() {
        assertThat(Expressions.multiply(x, y).isLinear()).isFalse();
        assertThat(Expressions.multiply(c, x).isLinear()).isTrue();
    }

    @Test
    void multiply_scaledOperands_pullsFactorsOut() {
        Sum sum = (Sum) Expressions.multiply(Expressions.scale(x, 2), Expressions.scale(y, 3));

        assertThat(sum.terms()).hasSize(1);
        assertThat(sum.terms().values()).containsExactly(6.0);
        assertThat(sum.terms().keySet().iterator().next()).isInstanceOf(Product.class);
    }

    @Test
    void divide_byConstantZero_throwsException() {
        assertThatThrownBy(() -> Expressions.divide(x, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("zero");
    }

    @Test
    void divide_byConstant_scales() {
        Sum sum = (Sum) Expressions.divide(x, 4);

        assertThat(sum.coefficientOf(x.toExpression())).isEqualTo(0.25);
    }

    @Test
    void power_foldsTrivialExponents() {
        assertThat(Expressions.power(x, 1)).isEqualTo(Expressions.ref(x));
        assertThat(Expressions.power(x, 0)).isEqualTo(Constant.ONE);
        assertThat(Expressions.power(Expressions.constant(2), 3)).isEqualTo(Expressions.constant(8));
        assertThat(Expressions.power(x, 2)).isInstanceOf(Power.class);
    }

    @Test
    void function_constantArguments_areFolded() {
        assertThat(Expressions.sqrt(Expressions.constant(16))).isEqualTo(Expressions.constant(4));
        assertThat(Expressions.max(Expressions.constant(1), Expressions.constant(7))).isEqualTo(Expressions.constant(7));
    }

    @Test
    void function_symbolicArguments_buildsCall() {
        Expression call = Expressions.function("ABS", x);

        assertThat(call).isInstanceOf(FunctionCall.class);
        assertThat(((FunctionCall) call).name()).isEqualTo("abs");
        assertThat(call.isLinear()).isFalse();
    }

    @Test
    void constant_nan_throwsException() {
        assertThatThrownBy(() -> Expressions.constant(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evaluate_withAssignedValues_computesResult() {
        x.assignValue(3);
        y.assignValue(0.5);

        double value = Expressions.evaluate(Expressions.add(Expressions.scale(x, 2), Expressions.multiply(y, c)));

        assertThat(value).isCloseTo(7.5, within(1e-12));
    }

    @Test
    void evaluate_withoutValue_throwsException() {
        assertThatThrownBy(() -> Expressions.evaluate(Expressions.add(x, 1)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void symbols_collectsReferencedSymbols() {
        Expression expression = Expressions.add(Expressions.multiply(x, c), y);

        assertThat(expression.symbols()).containsExactlyInAnyOrder(x, c, y);
        assertThat(expression.involvesDecision()).isTrue();
        assertThat(c.toExpression().involvesDecision()).isFalse();
    }
}
