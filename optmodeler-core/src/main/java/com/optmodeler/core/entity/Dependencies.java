package com.optmodeler.core.entity;

import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Symbol;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves the entities behind the symbols of expressions.
 */
public final class Dependencies {

    private Dependencies() {
    }

    /**
     * Maps a symbol to the entity that declares it. Iterators resolve to their set.
     *
     * @param symbol symbol to resolve
     * @return declaring entity, or null if the symbol has none
     */
    public static Entity entityOf(Symbol symbol) {
        if (symbol instanceof Entity entity) {
            return entity;
        }
        if (symbol instanceof SetIterator iterator) {
            return iterator.getSet();
        }
        return null;
    }

    public static Set<Entity> of(Expression expression) {
        Set<Entity> out = new LinkedHashSet<>();
        addTo(expression, out);
        return out;
    }

    public static void addTo(Expression expression, Set<Entity> out) {
        if (expression == null) {
            return;
        }
        for (Symbol symbol : expression.symbols()) {
            Entity entity = entityOf(symbol);
            if (entity != null) {
                out.add(entity);
            }
        }
    }

    public static void addIterators(Collection<? extends Symbol> iterators, Set<Entity> out) {
        for (Symbol iterator : iterators) {
            Entity entity = entityOf(iterator);
            if (entity != null) {
                out.add(entity);
            }
        }
    }
}
