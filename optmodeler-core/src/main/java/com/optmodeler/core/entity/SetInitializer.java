package com.optmodeler.core.entity;

import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Operand;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Contents of a set declaration: either a numeric range {@code from..to} or literal members.
 *
 * @param from range start, null for literal sets
 * @param to range end (inclusive), null for literal sets
 * @param members literal members, empty for ranges
 */
public record SetInitializer(Expression from, Expression to, List<IndexKey> members) {

    public SetInitializer {
        if ((from == null) != (to == null)) {
            throw new IllegalArgumentException("A range needs both ends");
        }
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static SetInitializer range(Operand from, Operand to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        return new SetInitializer(from.toExpression(), to.toExpression(), List.of());
    }

    public static SetInitializer of(Object... members) {
        return of(Arrays.asList(members));
    }

    public static SetInitializer of(Collection<?> members) {
        List<IndexKey> keys = new ArrayList<>(members.size());
        for (Object member : members) {
            keys.add(IndexKey.of(member));
        }
        return new SetInitializer(null, null, keys);
    }

    public boolean isRange() {
        return from != null;
    }
}
