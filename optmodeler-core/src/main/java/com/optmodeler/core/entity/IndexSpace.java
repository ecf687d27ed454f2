package com.optmodeler.core.entity;

import com.optmodeler.core.exception.IndexArityException;
import com.optmodeler.core.exception.UnboundReferenceException;
import com.optmodeler.core.expression.IndexKey;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The full index signature of a group: the ordered product of its {@link IndexSet}s.
 */
public final class IndexSpace {

    private final List<IndexSet> dimensions;
    private final int arity;

    public IndexSpace(List<IndexSet> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("A group needs at least one index set");
        }
        this.dimensions = List.copyOf(dimensions);
        this.arity = this.dimensions.stream().mapToInt(IndexSet::arity).sum();
    }

    public List<IndexSet> getDimensions() {
        return dimensions;
    }

    public int arity() {
        return arity;
    }

    /**
     * Returns whether any dimension is a solver-side set.
     *
     * @return true if member keys cannot be enumerated on the client
     */
    public boolean isAbstract() {
        return dimensions.stream().anyMatch(IndexSet::isAbstract);
    }

    /**
     * Checks a key against this signature.
     *
     * <p>The arity must always match. Literal keys must also fall inside every concrete
     * dimension; abstract dimensions and symbolic keys are resolved by the solver.
     *
     * @param key key to check
     * @param groupName group name for error messages
     * @throws IndexArityException if the key has the wrong number of elements
     * @throws UnboundReferenceException if a literal key lies outside a concrete dimension
     */
    public void validate(IndexKey key, String groupName) {
        if (key.arity() != arity) {
            throw new IndexArityException(groupName, arity, key.arity());
        }
        if (!key.isSymbolic() && !contains(key)) {
            throw new UnboundReferenceException("Key " + key + " is not a member of group '" + groupName + "'");
        }
    }

    /**
     * Returns whether a literal key of the right arity lies inside every concrete dimension.
     *
     * @param key literal key
     * @return false for a wrong arity or a key outside a concrete dimension
     */
    public boolean contains(IndexKey key) {
        if (key.arity() != arity) {
            return false;
        }
        int offset = 0;
        for (IndexSet dimension : dimensions) {
            IndexKey slice = new IndexKey(key.elements().subList(offset, offset + dimension.arity()));
            if (!dimension.contains(slice)) {
                return false;
            }
            offset += dimension.arity();
        }
        return true;
    }

    /**
     * Enumerates all keys of a fully concrete signature in lexicographic dimension order.
     *
     * @return keys in declaration order
     * @throws IllegalStateException if any dimension is abstract
     */
    public List<IndexKey> keys() {
        if (isAbstract()) {
            throw new IllegalStateException("Keys of a group over a solver-side set cannot be enumerated");
        }
        List<IndexKey> keys = new ArrayList<>();
        keys.add(IndexKey.EMPTY);
        for (IndexSet dimension : dimensions) {
            List<IndexKey> next = new ArrayList<>(keys.size() * dimension.getMembers().size());
            for (IndexKey prefix : keys) {
                for (IndexKey member : dimension.getMembers()) {
                    List<Object> elements = new ArrayList<>(prefix.elements());
                    elements.addAll(member.elements());
                    next.add(new IndexKey(elements));
                }
            }
            keys = next;
        }
        return keys;
    }

    public Set<Entity> getSets() {
        Set<Entity> sets = new LinkedHashSet<>();
        for (IndexSet dimension : dimensions) {
            if (dimension.isAbstract()) {
                sets.add(dimension.getSet());
            }
        }
        return sets;
    }
}
