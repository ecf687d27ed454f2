package com.optmodeler.core.expression;

/**
 * A named atom an expression can refer to.
 *
 * <p>Scalar symbols have arity 0; groups report the number of index elements a key
 * must carry. Set iterators are symbols as well, bound by the index set they iterate.
 */
public interface Symbol {

    String getName();

    /**
     * Returns the number of index elements a reference to this symbol carries.
     *
     * @return key arity, 0 for scalars
     */
    int getArity();

    /**
     * Returns whether this symbol is a decision quantity (a variable or an implicit variable)
     * rather than data.
     *
     * @return true for decision symbols
     */
    default boolean isDecision() {
        return false;
    }

    /**
     * Returns the known numeric value at a key, if any.
     *
     * @param key index key, {@link IndexKey#EMPTY} for scalars
     * @return current value or null when none is known
     */
    default Double valueAt(IndexKey key) {
        return null;
    }
}
