package com.optmodeler.core.statement;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.Objects;
import java.util.Set;

/**
 * A named relation, rendered as {@code con name : body op rhs;}.
 *
 * <p>Constraints are immutable apart from the ingested dual value; to change one, replace
 * it through {@link Container#replaceConstraint(Constraint, Relation)}.
 */
public class Constraint implements Statement {

    private final Container owner;
    private final RegisteredName name;
    private final Relation relation;
    private Double dual;

    public Constraint(Container owner, RegisteredName name, Relation relation) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.relation = Objects.requireNonNull(relation, "relation must not be null");
    }

    @Override
    public String getName() {
        return name.name();
    }

    public RegisteredName getRegisteredName() {
        return name;
    }

    public Container getOwner() {
        return owner;
    }

    public Relation getRelation() {
        return relation;
    }

    public Double getDual() {
        return dual;
    }

    public void assignDual(double dual) {
        this.dual = dual;
    }

    @Override
    public Set<Entity> getDependencies() {
        return relation.dependencies();
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitConstraint(this);
    }

    @Override
    public String toString() {
        return getName();
    }
}
