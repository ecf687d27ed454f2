package com.optmodeler.core.expression;

import java.util.Objects;
import java.util.Set;

/**
 * Reference to a symbol, scalar or indexed.
 *
 * <p>Equality is symbol identity plus key equality, so two references fetched
 * independently for the same member merge as like terms.
 *
 * @param symbol referenced symbol
 * @param key index key, {@link IndexKey#EMPTY} for scalars
 */
public record Reference(Symbol symbol, IndexKey key) implements Expression {

    public Reference {
        Objects.requireNonNull(symbol, "symbol must not be null");
        key = key == null ? IndexKey.EMPTY : key;
    }

    public Reference(Symbol symbol) {
        this(symbol, IndexKey.EMPTY);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        out.add(symbol);
        for (Object element : key.elements()) {
            if (element instanceof Symbol s) {
                out.add(s);
            } else if (element instanceof Expression e) {
                e.collectSymbols(out);
            }
        }
    }

    @Override
    public boolean isLinear() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Reference other && symbol == other.symbol && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(symbol) + key.hashCode();
    }

    @Override
    public String toString() {
        return key.isEmpty() ? symbol.getName() : symbol.getName() + key;
    }
}
