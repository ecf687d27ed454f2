package com.optmodeler.core.generator.impl;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.SetIterator;
import com.optmodeler.core.expression.Symbol;

import java.util.Map;

/**
 * Resolves the rendered name of symbols and statements. Inside a workspace, names owned by
 * a sub-model carry the {@code <model>_} prefix.
 */
final class NameScope {

    private final Container current;
    private final Map<Container, String> prefixes;

    NameScope(Container current, Map<Container, String> prefixes) {
        this.current = current;
        this.prefixes = prefixes;
    }

    Container current() {
        return current;
    }

    NameScope enter(Container container) {
        return new NameScope(container, prefixes);
    }

    String symbol(Symbol symbol) {
        if (symbol instanceof SetIterator iterator) {
            return iterator.getName();
        }
        if (symbol instanceof Entity entity) {
            return entity(entity);
        }
        return symbol.getName();
    }

    String entity(Entity entity) {
        return prefixes.getOrDefault(entity.getOwner(), "") + entity.getName();
    }

    /**
     * Name of a statement declared in the current container.
     *
     * @param name registered statement name
     * @return rendered name
     */
    String local(String name) {
        return prefixes.getOrDefault(current, "") + name;
    }
}
