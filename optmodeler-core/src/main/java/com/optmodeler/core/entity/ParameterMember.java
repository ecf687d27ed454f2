package com.optmodeler.core.entity;

import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.Reference;

/**
 * Handle on one member of a {@link ParameterGroup}.
 */
public final class ParameterMember implements Operand {

    private final ParameterGroup group;
    private final IndexKey key;

    ParameterMember(ParameterGroup group, IndexKey key) {
        this.group = group;
        this.key = key;
    }

    public ParameterGroup getGroup() {
        return group;
    }

    public IndexKey getKey() {
        return key;
    }

    /**
     * Assigns this member a value, rendered as {@code p[key] = value;}.
     *
     * @param value number, string or operand
     * @return this member
     */
    public ParameterMember setValue(Object value) {
        group.assign(key, value);
        return this;
    }

    public Double getValue() {
        return group.valueAt(key);
    }

    @Override
    public Expression toExpression() {
        return new Reference(group, key);
    }

    @Override
    public String toString() {
        return group.getName() + key;
    }
}
