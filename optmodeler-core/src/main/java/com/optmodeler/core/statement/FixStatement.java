package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Operand;

import java.util.Objects;
import java.util.Set;

/**
 * {@code fix x = 3;} or {@code unfix x;}.
 *
 * @param target variable or variable member
 * @param value fixed value, null for unfix
 */
public record FixStatement(Expression target, Expression value) implements Statement {

    public FixStatement {
        Objects.requireNonNull(target, "target must not be null");
        if (!target.involvesDecision()) {
            throw new IllegalArgumentException("Only variables can be fixed: " + target);
        }
    }

    public static FixStatement fix(Operand target, Operand value) {
        return new FixStatement(target.toExpression(), value.toExpression());
    }

    public static FixStatement unfix(Operand target) {
        return new FixStatement(target.toExpression(), null);
    }

    public boolean isUnfix() {
        return value == null;
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = Dependencies.of(target);
        Dependencies.addTo(value, out);
        return out;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFix(this);
    }
}
