package com.optmodeler.core.statement;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.SetIterator;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A family of constraints sharing one name.
 *
 * <p>An abstract group is one solver-side statement over iterators:
 * {@code con c {i in I} : x[i] <= a[i];}. A concrete group holds client-built members keyed
 * by literal keys, each rendered as its own constraint named {@code c_<key>}.
 */
public class ConstraintGroup implements Statement {

    private final Container owner;
    private final RegisteredName name;
    private final List<SetIterator> iterators;
    private final Relation relation;
    private final Map<IndexKey, Constraint> members;

    private ConstraintGroup(Container owner, RegisteredName name, List<SetIterator> iterators,
                            Relation relation, Map<IndexKey, Constraint> members) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.iterators = iterators;
        this.relation = relation;
        this.members = members;
    }

    public static ConstraintGroup overIterators(Container owner, RegisteredName name,
                                                List<SetIterator> iterators, Relation relation) {
        if (iterators == null || iterators.isEmpty()) {
            throw new IllegalArgumentException("An indexed constraint needs at least one iterator");
        }
        Objects.requireNonNull(relation, "relation must not be null");
        return new ConstraintGroup(owner, name, List.copyOf(iterators), relation, Map.of());
    }

    public static ConstraintGroup ofMembers(Container owner, RegisteredName name, Map<IndexKey, Constraint> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A constraint group needs at least one member");
        }
        return new ConstraintGroup(owner, name, List.of(), null,
                Collections.unmodifiableMap(new LinkedHashMap<>(members)));
    }

    @Override
    public String getName() {
        return name.name();
    }

    public Container getOwner() {
        return owner;
    }

    public boolean isAbstract() {
        return relation != null;
    }

    public List<SetIterator> getIterators() {
        return iterators;
    }

    /**
     * Returns the shared relation of an abstract group.
     *
     * @return relation over the iterators, null for concrete groups
     */
    public Relation getRelation() {
        return relation;
    }

    public Map<IndexKey, Constraint> getMembers() {
        return members;
    }

    public Constraint get(Object... key) {
        return members.get(IndexKey.of(key));
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = new LinkedHashSet<>();
        if (isAbstract()) {
            Dependencies.addIterators(iterators, out);
            out.addAll(relation.dependencies());
        } else {
            members.values().forEach(member -> out.addAll(member.getDependencies()));
        }
        return out;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitConstraintGroup(this);
    }

    @Override
    public String toString() {
        return getName();
    }
}
