package com.optmodeler.core.entity;

import com.optmodeler.core.expression.IndexKey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One dimension of a group's index: either a literal list of members (concrete) or a
 * solver-side {@link OptSet} (abstract).
 *
 * <p>Tuple members contribute several key positions, so a dimension over
 * {@code {('a', 1), ('a', 2)}} has arity 2.
 */
public final class IndexSet {

    private final OptSet set;
    private final List<IndexKey> members;
    private final int arity;

    private IndexSet(OptSet set, List<IndexKey> members, int arity) {
        this.set = set;
        this.members = members;
        this.arity = arity;
    }

    public static IndexSet over(OptSet set) {
        Objects.requireNonNull(set, "set must not be null");
        return new IndexSet(set, List.of(), set.getArity());
    }

    public static IndexSet of(Object... members) {
        return of(Arrays.asList(members));
    }

    public static IndexSet of(Collection<?> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A concrete index set needs at least one member");
        }
        Set<IndexKey> keys = new LinkedHashSet<>();
        int arity = -1;
        for (Object member : members) {
            IndexKey key = IndexKey.of(member);
            if (key.isSymbolic()) {
                throw new IllegalArgumentException("Concrete index set members must be literals: " + key);
            }
            if (arity >= 0 && key.arity() != arity) {
                throw new IllegalArgumentException("Mixed tuple sizes in index set: " + arity + " and " + key.arity());
            }
            arity = key.arity();
            keys.add(key);
        }
        return new IndexSet(null, List.copyOf(keys), arity);
    }

    /**
     * Returns the members {@code 0 .. count - 1}.
     *
     * @param count number of members
     * @return concrete index set
     */
    public static IndexSet range(int count) {
        return range(0, count - 1L);
    }

    /**
     * Returns the members {@code from .. to}, both inclusive.
     *
     * @param from first member
     * @param to last member
     * @return concrete index set
     */
    public static IndexSet range(long from, long to) {
        List<Object> members = new ArrayList<>();
        for (long i = from; i <= to; i++) {
            members.add(i);
        }
        return of(members);
    }

    public boolean isAbstract() {
        return set != null;
    }

    public OptSet getSet() {
        return set;
    }

    public List<IndexKey> getMembers() {
        return members;
    }

    public int arity() {
        return arity;
    }

    public boolean contains(IndexKey slice) {
        return isAbstract() || members.contains(slice);
    }

    @Override
    public String toString() {
        return isAbstract() ? set.getName() : members.toString();
    }
}
