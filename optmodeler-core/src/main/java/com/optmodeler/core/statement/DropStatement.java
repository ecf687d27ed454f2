package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Entity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Solver-side deactivation of constraints: {@code drop c1 c2;}. With {@code restore} set the
 * statement renders as {@code restore c1 c2;} instead.
 *
 * @param constraints constraints or constraint groups
 * @param restore true to reactivate rather than drop
 */
public record DropStatement(List<Statement> constraints, boolean restore) implements Statement {

    public DropStatement {
        if (constraints == null || constraints.isEmpty()) {
            throw new IllegalArgumentException("drop needs at least one constraint");
        }
        for (Statement s : constraints) {
            if (!(s instanceof Constraint || s instanceof ConstraintGroup)) {
                throw new IllegalArgumentException("Only constraints can be dropped, got " + s);
            }
        }
        constraints = List.copyOf(constraints);
    }

    public static DropStatement drop(Statement... constraints) {
        return new DropStatement(List.of(constraints), false);
    }

    public static DropStatement restore(Statement... constraints) {
        return new DropStatement(List.of(constraints), true);
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        return Set.of();
    }

    @Override
    public Set<Statement> getStatementDependencies() {
        return new LinkedHashSet<>(constraints);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDrop(this);
    }
}
