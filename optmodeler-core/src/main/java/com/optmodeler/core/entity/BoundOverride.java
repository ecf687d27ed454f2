package com.optmodeler.core.entity;

import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.model.OverrideField;

import java.util.Objects;

/**
 * A per-member attribute change applied after a group's declaration.
 *
 * @param target group whose member is changed
 * @param key member key
 * @param field attribute being set
 * @param value new value: a {@link Double} for bounds and initial values, an expression or
 *     string for parameter values
 */
public record BoundOverride(Symbol target, IndexKey key, OverrideField field, Object value) {

    public BoundOverride {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Identity of the slot this override writes; a later override of the same slot replaces
     * the value but keeps the first position.
     *
     * @return slot identity
     */
    public Slot slot() {
        return new Slot(target, key, field);
    }

    /**
     * Override slot identity.
     *
     * @param target group, compared by identity
     * @param key member key
     * @param field attribute
     */
    public record Slot(Symbol target, IndexKey key, OverrideField field) {

        @Override
        public boolean equals(Object o) {
            return o instanceof Slot other && target == other.target
                    && key.equals(other.key) && field == other.field;
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(target), key, field);
        }
    }
}
