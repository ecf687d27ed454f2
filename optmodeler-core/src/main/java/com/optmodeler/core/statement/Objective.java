package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.model.ObjectiveSense;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.Objects;
import java.util.Set;

/**
 * Named objective, rendered as {@code min name = expr;} or {@code max name = expr;}.
 */
public class Objective implements Statement {

    private final RegisteredName name;
    private final ObjectiveSense sense;
    private final Expression expression;
    private final boolean primary;
    private Double value;

    public Objective(RegisteredName name, ObjectiveSense sense, Expression expression, boolean primary) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.sense = Objects.requireNonNull(sense, "sense must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.primary = primary;
    }

    @Override
    public String getName() {
        return name.name();
    }

    public RegisteredName getRegisteredName() {
        return name;
    }

    public ObjectiveSense getSense() {
        return sense;
    }

    public Expression getExpression() {
        return expression;
    }

    /**
     * Returns whether this is the container's primary objective, the one replaced by
     * {@code setObjective}.
     *
     * @return true for the primary objective
     */
    public boolean isPrimary() {
        return primary;
    }

    public Double getValue() {
        return value;
    }

    public void assignValue(double value) {
        this.value = value;
    }

    @Override
    public Set<Entity> getDependencies() {
        return Dependencies.of(expression);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitObjective(this);
    }

    @Override
    public String toString() {
        return getName();
    }
}
