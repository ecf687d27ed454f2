package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.expression.Constant;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.model.OverrideField;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Indexed data symbol: {@code num cost {I} init 5;}. Per-member values are rendered as
 * assignments ({@code cost['a'] = 3;}) after the declarations.
 */
public class ParameterGroup extends AbstractEntity implements Symbol {

    private final IndexSpace space;
    private final ValueType type;
    private Object init;
    private final Map<IndexKey, Object> assigned = new LinkedHashMap<>();
    private final Map<IndexKey, Double> ingested = new LinkedHashMap<>();

    public ParameterGroup(Container owner, RegisteredName name, IndexSpace space, ValueType type) {
        super(owner, name);
        this.space = space;
        this.type = type == null ? ValueType.NUM : type;
    }

    public IndexSpace getSpace() {
        return space;
    }

    public ValueType getType() {
        return type;
    }

    public Object getInit() {
        return init;
    }

    /**
     * Sets the default value of every member.
     *
     * @param init number, string or operand
     * @return this group
     */
    public ParameterGroup setInit(Object init) {
        checkMutable();
        this.init = normalizeValue(init);
        return this;
    }

    public ParameterMember get(Object... key) {
        IndexKey indexKey = IndexKey.of(key);
        space.validate(indexKey, getName());
        return new ParameterMember(this, indexKey);
    }

    /**
     * Returns the values assigned to individual members, in first-assignment order.
     *
     * @return assigned values by key
     */
    public Map<IndexKey, Object> getAssignedValues() {
        return Collections.unmodifiableMap(assigned);
    }

    void assign(IndexKey key, Object value) {
        checkMutable();
        if (key.isSymbolic()) {
            throw new IllegalStateException("Cannot assign a value to symbolic member " + getName() + key);
        }
        Object normalized = normalizeValue(value);
        if (normalized == null) {
            throw new IllegalArgumentException("Member value must not be null");
        }
        assigned.put(key, normalized);
        owner.recordOverride(new BoundOverride(this, key, OverrideField.VALUE, normalized));
    }

    /**
     * Stores a value read back from the solver.
     *
     * @param key literal member key
     * @param value solver value
     * @return false, storing nothing, if the key is not a member of this group
     */
    public boolean assignValue(IndexKey key, double value) {
        if (!space.contains(key)) {
            return false;
        }
        ingested.put(key, value);
        return true;
    }

    @Override
    public int getArity() {
        return space.arity();
    }

    @Override
    public Double valueAt(IndexKey key) {
        Double value = ingested.get(key);
        if (value != null) {
            return value;
        }
        Object explicit = assigned.get(key);
        if (explicit instanceof Constant c) {
            return c.value();
        }
        if (explicit == null && init instanceof Constant c) {
            return c.value();
        }
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = new LinkedHashSet<>(space.getSets());
        if (init instanceof Expression e) {
            Dependencies.addTo(e, out);
        }
        return out;
    }
}
