package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.exception.IndexArityException;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Expressions;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.SumBuilder;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An indexed family of variables declared with one statement, such as
 * {@code var x {I, {1,2}} integer >= 0;}.
 *
 * <p>Members are created on first access and keep per-member state: bound and initial value
 * overrides, and ingested values. For a group over literal index sets only keys inside the
 * sets are accepted; a group over a solver-side set accepts any key of the right arity.
 *
 * <pre>{@code
 * VariableGroup x = model.addVariableGroup("x", VariableType.CONTINUOUS, 0.0, null,
 *         IndexSet.of(List.of("a", 1), List.of("a", 2)));
 * x.get("a", 2).setUpperBound(5.0);     // x['a', 2].ub = 5;
 * Expression total = x.sum("a", "*");   // x['a', 1] + x['a', 2]
 * }</pre>
 */
public class VariableGroup extends AbstractEntity implements Symbol {

    private final IndexSpace space;
    private final VariableType type;
    private Double lowerBound;
    private Double upperBound;
    private Double init;
    private final Map<IndexKey, VariableMember> members = new LinkedHashMap<>();

    public VariableGroup(Container owner, RegisteredName name, IndexSpace space, VariableType type,
                         Double lowerBound, Double upperBound, Double init) {
        super(owner, name);
        this.space = space;
        this.type = type == null ? VariableType.CONTINUOUS : type;
        Variable.checkBounds(lowerBound, upperBound);
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.init = init;
    }

    public IndexSpace getSpace() {
        return space;
    }

    public VariableType getType() {
        return type;
    }

    public Double getLowerBound() {
        return lowerBound;
    }

    public Double getUpperBound() {
        return upperBound;
    }

    public Double getInit() {
        return init;
    }

    /**
     * Changes the group-wide bounds written in the declaration.
     *
     * @param lowerBound lower bound, null for the type default
     * @param upperBound upper bound, null for the type default
     * @return this group
     */
    public VariableGroup setBounds(Double lowerBound, Double upperBound) {
        checkMutable();
        Variable.checkBounds(lowerBound, upperBound);
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        return this;
    }

    public VariableGroup setInit(Double init) {
        checkMutable();
        this.init = init;
        return this;
    }

    /**
     * Returns the member at a key, creating it on first access.
     *
     * @param key key elements; tuples are flattened
     * @return member
     */
    public VariableMember get(Object... key) {
        IndexKey indexKey = IndexKey.of(key);
        space.validate(indexKey, getName());
        if (indexKey.isSymbolic()) {
            return new VariableMember(this, indexKey);
        }
        return members.computeIfAbsent(indexKey, k -> new VariableMember(this, k));
    }

    /**
     * Looks up a member for result ingestion without failing on unknown keys.
     *
     * @param key literal key
     * @return member, or null if the key is outside a concrete group or of the wrong arity
     */
    public VariableMember find(IndexKey key) {
        VariableMember existing = members.get(key);
        if (existing != null) {
            return existing;
        }
        if (!space.contains(key)) {
            return null;
        }
        return members.computeIfAbsent(key, k -> new VariableMember(this, k));
    }

    /**
     * Returns all members. Concrete groups enumerate every key of their index sets; groups over
     * solver-side sets return only the members accessed so far.
     *
     * @return members in key order
     */
    public List<VariableMember> getMembers() {
        if (!space.isAbstract()) {
            for (IndexKey key : space.keys()) {
                members.computeIfAbsent(key, k -> new VariableMember(this, k));
            }
        }
        return new ArrayList<>(members.values());
    }

    /**
     * Sums the members whose keys match a pattern, where {@code "*"} matches any element.
     * With no pattern every member is summed.
     *
     * @param pattern key pattern
     * @return linear expression
     * @throws IllegalStateException for groups over solver-side sets
     */
    public Expression sum(Object... pattern) {
        if (space.isAbstract()) {
            throw new IllegalStateException("Group '" + getName()
                    + "' is indexed by a solver-side set; use Expressions.sumOver with iterators");
        }
        IndexKey filter = pattern.length == 0 ? null : IndexKey.of(pattern);
        if (filter != null && filter.arity() != space.arity()) {
            throw new IndexArityException(getName(), space.arity(), filter.arity());
        }
        SumBuilder builder = Expressions.newSumBuilder();
        for (VariableMember member : getMembers()) {
            if (filter == null || member.getKey().matches(filter)) {
                builder.add(member);
            }
        }
        return builder.build();
    }

    /**
     * Builds {@code sum(coefficient[k] * x[k])} over the given keys.
     *
     * @param coefficients coefficient per member key; tuple keys may be given as lists
     * @return linear expression
     */
    public Expression mult(Map<?, ? extends Number> coefficients) {
        SumBuilder builder = Expressions.newSumBuilder();
        coefficients.forEach((key, coefficient) -> builder.addTerm(get(key), coefficient.doubleValue()));
        return builder.build();
    }

    /**
     * Returns the ingested solution values of all members that have one.
     *
     * @return values by key, in member order
     */
    public Map<IndexKey, Double> getValues() {
        Map<IndexKey, Double> values = new LinkedHashMap<>();
        members.forEach((key, member) -> {
            if (member.getValue() != null) {
                values.put(key, member.getValue());
            }
        });
        return values;
    }

    @Override
    public int getArity() {
        return space.arity();
    }

    @Override
    public boolean isDecision() {
        return true;
    }

    @Override
    public Double valueAt(IndexKey key) {
        VariableMember member = members.get(key);
        return member == null ? null : member.getValue();
    }

    @Override
    public Set<Entity> getDependencies() {
        return space.getSets();
    }
}
