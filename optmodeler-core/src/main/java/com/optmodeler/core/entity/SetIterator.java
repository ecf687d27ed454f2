package com.optmodeler.core.entity;

import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.Reference;
import com.optmodeler.core.expression.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * Dummy index bound by a set, the {@code i} in {@code {i in I}}.
 *
 * <p>Iterators created together by {@link OptSet#iterators(String...)} share a tuple and
 * render as {@code <i, j> in S}.
 */
public final class SetIterator implements Symbol, Operand {

    private final OptSet set;
    private final String name;
    private final List<SetIterator> tuple;
    private final int position;

    SetIterator(OptSet set, String name, List<SetIterator> tuple, int position) {
        this.set = Objects.requireNonNull(set, "set must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("iterator name must not be blank");
        }
        this.name = name.trim();
        this.tuple = tuple;
        this.position = position;
    }

    public OptSet getSet() {
        return set;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return 0;
    }

    /**
     * Returns the iterators bound together with this one, or a singleton list.
     *
     * @return tuple members in position order
     */
    public List<SetIterator> getTuple() {
        return tuple == null ? List.of(this) : tuple;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public Expression toExpression() {
        return new Reference(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
