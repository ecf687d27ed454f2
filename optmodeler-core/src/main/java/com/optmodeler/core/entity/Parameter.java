package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.expression.Constant;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.Reference;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A scalar data symbol: {@code num N;}, {@code num N init 4;}, {@code num N = 2 * M;}
 * or {@code str s init 'abc';}.
 */
public class Parameter extends AbstractEntity implements Symbol, Operand {

    private final ValueType type;
    private Object init;
    private Object fixedValue;
    private Double value;

    public Parameter(Container owner, RegisteredName name, ValueType type) {
        super(owner, name);
        this.type = type == null ? ValueType.NUM : type;
    }

    public ValueType getType() {
        return type;
    }

    /**
     * Returns the initial value.
     *
     * @return an {@link Expression}, a {@link String} or null
     */
    public Object getInit() {
        return init;
    }

    /**
     * Returns the fixed definition written with {@code =}.
     *
     * @return an {@link Expression}, a {@link String} or null
     */
    public Object getFixedValue() {
        return fixedValue;
    }

    /**
     * Sets the initial value, which the solver side may later replace.
     *
     * @param init number, string or operand
     * @return this parameter
     */
    public Parameter setInit(Object init) {
        checkMutable();
        this.init = normalizeValue(init);
        return this;
    }

    /**
     * Defines the parameter as a fixed value or expression.
     *
     * @param fixedValue number, string or operand
     * @return this parameter
     */
    public Parameter setFixedValue(Object fixedValue) {
        checkMutable();
        this.fixedValue = normalizeValue(fixedValue);
        return this;
    }

    /**
     * Returns the best known numeric value: an ingested value, else a constant definition.
     *
     * @return value or null when unknown
     */
    public Double getValue() {
        if (value != null) {
            return value;
        }
        if (fixedValue instanceof Constant c) {
            return c.value();
        }
        if (init instanceof Constant c) {
            return c.value();
        }
        return null;
    }

    public void assignValue(double value) {
        this.value = value;
    }

    @Override
    public int getArity() {
        return 0;
    }

    @Override
    public Double valueAt(IndexKey key) {
        return key.isEmpty() ? getValue() : null;
    }

    @Override
    public Expression toExpression() {
        return new Reference(this);
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = new LinkedHashSet<>();
        if (init instanceof Expression e) {
            Dependencies.addTo(e, out);
        }
        if (fixedValue instanceof Expression e) {
            Dependencies.addTo(e, out);
        }
        return out;
    }
}
