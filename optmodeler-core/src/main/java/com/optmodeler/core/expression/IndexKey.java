package com.optmodeler.core.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ordered tuple of index elements identifying one member of a group.
 *
 * <p>Elements are strings, numbers, set iterators or expressions over iterators. Integral
 * numbers are normalized to {@link Long} so that {@code 1}, {@code 1L} and {@code 1.0}
 * produce equal keys. Nested tuples are flattened.
 *
 * @param elements normalized key elements
 */
public record IndexKey(List<Object> elements) {

    /** Wildcard element accepted by pattern matching. */
    public static final String WILDCARD = "*";

    public static final IndexKey EMPTY = new IndexKey(List.of());

    public IndexKey {
        Objects.requireNonNull(elements, "elements must not be null");
        List<Object> normalized = new ArrayList<>(elements.size());
        for (Object element : elements) {
            flatten(element, normalized);
        }
        elements = List.copyOf(normalized);
    }

    public static IndexKey of(Object... elements) {
        return new IndexKey(elements.length == 1 && elements[0] instanceof IndexKey key
                ? key.elements()
                : List.of(elements));
    }

    public int arity() {
        return elements.size();
    }

    public Object get(int position) {
        return elements.get(position);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Returns whether any element is symbolic (an iterator or an expression over iterators).
     *
     * @return true if the key cannot be resolved to a concrete member
     */
    public boolean isSymbolic() {
        return elements.stream().anyMatch(e -> e instanceof Symbol || e instanceof Expression);
    }

    /**
     * Matches this key against a pattern where {@link #WILDCARD} matches any element.
     *
     * @param pattern key pattern of the same arity
     * @return true if every non-wildcard element is equal
     */
    public boolean matches(IndexKey pattern) {
        if (pattern.arity() != arity()) {
            return false;
        }
        for (int i = 0; i < arity(); i++) {
            Object p = pattern.get(i);
            if (!WILDCARD.equals(p) && !p.equals(get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return elements.toString();
    }

    private static void flatten(Object element, List<Object> out) {
        if (element == null) {
            throw new IllegalArgumentException("Index elements must not be null");
        }
        if (element instanceof IndexKey key) {
            out.addAll(key.elements());
        } else if (element instanceof Collection<?> tuple) {
            for (Object nested : tuple) {
                flatten(nested, out);
            }
        } else if (element instanceof Number number) {
            out.add(normalizeNumber(number));
        } else if (element instanceof CharSequence text) {
            out.add(text.toString());
        } else if (element instanceof Symbol || element instanceof Expression) {
            out.add(element);
        } else if (element instanceof Operand operand) {
            out.add(operand.toExpression());
        } else {
            throw new IllegalArgumentException("Unsupported index element type: " + element.getClass().getName());
        }
    }

    private static Object normalizeNumber(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Index elements must be finite numbers: " + value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }
}
