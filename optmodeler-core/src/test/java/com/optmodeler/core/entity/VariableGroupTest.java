package com.optmodeler.core.entity;

import com.optmodeler.core.container.Model;
import com.optmodeler.core.exception.IndexArityException;
import com.optmodeler.core.exception.UnboundReferenceException;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Sum;
import com.optmodeler.core.model.OverrideField;
import com.optmodeler.core.model.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link VariableGroup} and {@link VariableMember}.
 */
class VariableGroupTest {

    private Model model;
    private VariableGroup x;

    @BeforeEach
    void setUp() {
        model = new Model("groups");
        x = model.addVariableGroup("x", VariableType.CONTINUOUS, 0.0, 10.0, IndexSet.of("a", "b"), IndexSet.range(2));
    }

    @Test
    void get_wrongArity_throwsException() {
        assertThatThrownBy(() -> x.get("a"))
            .isInstanceOf(IndexArityException.class)
            .satisfies(e -> {
                IndexArityException arity = (IndexArityException) e;
                assertThat(arity.getExpected()).isEqualTo(2);
                assertThat(arity.getActual()).isEqualTo(1);
            });
    }

    @Test
    void get_keyOutsideConcreteSet_throwsException() {
        assertThatThrownBy(() -> x.get("c", 0)).isInstanceOf(UnboundReferenceException.class);
    }

    @Test
    void get_tupleSetKeyNotAMember_throwsException() {
        VariableGroup pairs = model.addVariableGroup("pairs", IndexSet.of(List.of("a", 1), List.of("a", 2)));

        assertThat(pairs.get("a", 2).getKey()).isEqualTo(IndexKey.of("a", 2));
        assertThatThrownBy(() -> pairs.get("b", 1)).isInstanceOf(UnboundReferenceException.class);
        assertThatThrownBy(() -> pairs.get("a")).isInstanceOf(IndexArityException.class);
    }

    @Test
    void get_keyOfAbstractGroup_isAccepted() {
        OptSet items = model.addSet("I");
        VariableGroup y = model.addVariableGroup("y", IndexSet.over(items));

        assertThat(y.get(42).getKey()).isEqualTo(IndexKey.of(42));
    }

    @Test
    void get_sameKeyTwice_returnsSameMember() {
        assertThat(x.get("a", 1)).isSameAs(x.get("a", 1L));
        assertThat(x.get("a", 1.0)).isSameAs(x.get("a", 1));
    }

    @Test
    void getMembers_enumeratesCartesianProductInOrder() {
        assertThat(x.getMembers()).extracting(VariableMember::getKey).containsExactly(
            IndexKey.of("a", 0), IndexKey.of("a", 1), IndexKey.of("b", 0), IndexKey.of("b", 1));
    }

    @Test
    void sum_withWildcard_sumsMatchingMembers() {
        Expression sum = x.sum("*", 1);

        assertThat(sum).isInstanceOf(Sum.class);
        assertThat(((Sum) sum).terms().keySet())
            .containsExactly(x.get("a", 1).toExpression(), x.get("b", 1).toExpression());
    }

    @Test
    void sum_overAbstractGroup_throwsException() {
        VariableGroup y = model.addVariableGroup("y", IndexSet.over(model.addSet("I")));

        assertThatThrownBy(y::sum).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void mult_buildsWeightedSum() {
        Sum sum = (Sum) x.mult(Map.of(List.of("a", 0), 3));

        assertThat(sum.coefficientOf(x.get("a", 0).toExpression())).isEqualTo(3.0);
    }

    @Test
    void member_inheritsGroupBoundsUntilOverridden() {
        VariableMember member = x.get("b", 0);
        assertThat(member.getLowerBound()).isEqualTo(0.0);
        assertThat(member.getUpperBound()).isEqualTo(10.0);

        member.setUpperBound(4);

        assertThat(member.getUpperBound()).isEqualTo(4.0);
        assertThat(x.get("a", 0).getUpperBound()).isEqualTo(10.0);
        assertThat(model.getOverrides(x)).singleElement()
            .satisfies(o -> {
                assertThat(o.field()).isEqualTo(OverrideField.UPPER_BOUND);
                assertThat(o.key()).isEqualTo(IndexKey.of("b", 0));
            });
    }

    @Test
    void member_boundBelowLower_throwsWithoutRecording() {
        VariableMember member = x.get("a", 0);

        assertThatThrownBy(() -> member.setUpperBound(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(model.getOverrides()).isEmpty();
    }

    @Test
    void member_symbolicKey_cannotBeOverridden() {
        OptSet items = model.addSet("I");
        VariableGroup y = model.addVariableGroup("y", IndexSet.over(items));
        SetIterator i = items.iterator("i");

        assertThatThrownBy(() -> y.get(i).setUpperBound(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void find_unknownKey_returnsNull() {
        assertThat(x.find(IndexKey.of("z", 0))).isNull();
        assertThat(x.find(IndexKey.of("a"))).isNull();
        assertThat(x.find(IndexKey.of("a", 1))).isSameAs(x.get("a", 1));
    }

    @Test
    void binaryGroup_defaultsToUnitBounds() {
        VariableGroup b = model.addVariableGroup("b", VariableType.BINARY, null, null, IndexSet.range(1));

        assertThat(b.get(0).getLowerBound()).isEqualTo(0.0);
        assertThat(b.get(0).getUpperBound()).isEqualTo(1.0);
    }

    @Test
    void getValues_returnsIngestedValues() {
        x.get("a", 1).assignValue(2.5);

        assertThat(x.getValues()).containsExactly(Map.entry(IndexKey.of("a", 1), 2.5));
        assertThat(x.valueAt(IndexKey.of("a", 1))).isEqualTo(2.5);
    }
}
