package com.optmodeler.core.entity;

import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.Reference;
import com.optmodeler.core.model.OverrideField;
import com.optmodeler.core.model.VariableType;

/**
 * One member of a {@link VariableGroup}. Bound and initial value changes are recorded
 * as overrides on the owning container and rendered after the declarations.
 */
public final class VariableMember implements Operand {

    private final VariableGroup group;
    private final IndexKey key;
    private Double lowerBound;
    private Double upperBound;
    private Double init;
    private Double value;
    private Double dual;

    VariableMember(VariableGroup group, IndexKey key) {
        this.group = group;
        this.key = key;
    }

    public VariableGroup getGroup() {
        return group;
    }

    public IndexKey getKey() {
        return key;
    }

    /**
     * Returns the effective lower bound: the member override, else the group bound,
     * else the type default.
     *
     * @return lower bound or null when unbounded
     */
    public Double getLowerBound() {
        if (lowerBound != null) {
            return lowerBound;
        }
        if (group.getLowerBound() != null) {
            return group.getLowerBound();
        }
        return group.getType() == VariableType.BINARY ? Double.valueOf(0) : null;
    }

    public Double getUpperBound() {
        if (upperBound != null) {
            return upperBound;
        }
        if (group.getUpperBound() != null) {
            return group.getUpperBound();
        }
        return group.getType() == VariableType.BINARY ? Double.valueOf(1) : null;
    }

    public Double getInit() {
        return init != null ? init : group.getInit();
    }

    public VariableMember setLowerBound(double lowerBound) {
        Variable.checkBounds(lowerBound, getUpperBound());
        record(OverrideField.LOWER_BOUND, lowerBound);
        this.lowerBound = lowerBound;
        return this;
    }

    public VariableMember setUpperBound(double upperBound) {
        Variable.checkBounds(getLowerBound(), upperBound);
        record(OverrideField.UPPER_BOUND, upperBound);
        this.upperBound = upperBound;
        return this;
    }

    public VariableMember setInit(double init) {
        record(OverrideField.INIT, init);
        this.init = init;
        return this;
    }

    public Double getValue() {
        return value;
    }

    public Double getDual() {
        return dual;
    }

    public void assignValue(double value) {
        this.value = value;
    }

    public void assignDual(double dual) {
        this.dual = dual;
    }

    @Override
    public Expression toExpression() {
        return new Reference(group, key);
    }

    @Override
    public String toString() {
        return group.getName() + key;
    }

    private void record(OverrideField field, double newValue) {
        group.getOwner().ensureMutable();
        if (Double.isNaN(newValue)) {
            throw new IllegalArgumentException("Override value must not be NaN");
        }
        if (key.isSymbolic()) {
            throw new IllegalStateException("Cannot override attributes of symbolic member " + this);
        }
        group.getOwner().recordOverride(new BoundOverride(group, key, field, newValue));
    }
}
