package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.expression.Constant;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Expressions;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.model.RelationalOperator;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A comparison between two expressions, the content of a constraint.
 *
 * <p>For {@link RelationalOperator#RANGE} the relation reads {@code rhs <= lhs <= upper};
 * {@code lhs} is the body and {@code rhs} the lower bound. For the other operators
 * {@code upper} is null.
 *
 * @param lhs left-hand side, or body of a range
 * @param operator comparison
 * @param rhs right-hand side, or lower bound of a range
 * @param upper upper bound of a range, else null
 */
public record Relation(Expression lhs, RelationalOperator operator, Expression rhs, Expression upper) {

    public Relation {
        Objects.requireNonNull(lhs, "lhs must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(rhs, "rhs must not be null");
        if ((operator == RelationalOperator.RANGE) != (upper != null)) {
            throw new IllegalArgumentException("upper is required for ranges and only for ranges");
        }
    }

    public static Relation le(Operand lhs, Operand rhs) {
        return new Relation(lhs.toExpression(), RelationalOperator.LE, rhs.toExpression(), null);
    }

    public static Relation le(Operand lhs, double rhs) {
        return le(lhs, new Constant(rhs));
    }

    public static Relation ge(Operand lhs, Operand rhs) {
        return new Relation(lhs.toExpression(), RelationalOperator.GE, rhs.toExpression(), null);
    }

    public static Relation ge(Operand lhs, double rhs) {
        return ge(lhs, new Constant(rhs));
    }

    public static Relation eq(Operand lhs, Operand rhs) {
        return new Relation(lhs.toExpression(), RelationalOperator.EQ, rhs.toExpression(), null);
    }

    public static Relation eq(Operand lhs, double rhs) {
        return eq(lhs, new Constant(rhs));
    }

    public static Relation of(Operand lhs, RelationalOperator operator, Operand rhs) {
        return new Relation(lhs.toExpression(), operator, rhs.toExpression(), null);
    }

    /**
     * Builds {@code lower <= body <= upper}.
     *
     * @param lower lower bound
     * @param body constrained expression
     * @param upper upper bound
     * @return range relation
     */
    public static Relation range(Operand lower, Operand body, Operand upper) {
        return new Relation(body.toExpression(), RelationalOperator.RANGE, lower.toExpression(), upper.toExpression());
    }

    public static Relation range(double lower, Operand body, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("Range lower bound " + lower + " exceeds upper bound " + upper);
        }
        return range(new Constant(lower), body, new Constant(upper));
    }

    public boolean isRange() {
        return operator == RelationalOperator.RANGE;
    }

    /**
     * Returns {@code lhs - rhs}, the canonical body of a non-range relation.
     *
     * @return difference
     */
    public Expression difference() {
        if (isRange()) {
            throw new IllegalStateException("A range has no single difference");
        }
        return Expressions.subtract(lhs, rhs);
    }

    public boolean isLinear() {
        return lhs.isLinear() && rhs.isLinear() && (upper == null || upper.isLinear());
    }

    public Set<Entity> dependencies() {
        Set<Entity> out = new LinkedHashSet<>();
        Dependencies.addTo(lhs, out);
        Dependencies.addTo(rhs, out);
        Dependencies.addTo(upper, out);
        return out;
    }
}
