package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A solver-side index set, declared as {@code set I;}, {@code set <str> J;} or
 * {@code set <num, num> S = {...};}.
 *
 * <p>Sets are abstract: their members live on the solver side unless an initializer is given.
 * Groups indexed by an abstract set accept any key of the right arity.
 */
public class OptSet extends AbstractEntity {

    private final List<ValueType> elementTypes;
    private SetInitializer initializer;
    private boolean fixed;

    public OptSet(Container owner, RegisteredName name, List<ValueType> elementTypes) {
        super(owner, name);
        this.elementTypes = elementTypes == null || elementTypes.isEmpty()
                ? List.of(ValueType.NUM)
                : List.copyOf(elementTypes);
    }

    public List<ValueType> getElementTypes() {
        return elementTypes;
    }

    public int getArity() {
        return elementTypes.size();
    }

    public SetInitializer getInitializer() {
        return initializer;
    }

    /**
     * Returns whether the initializer is a fixed definition ({@code =}) rather than an
     * initial value ({@code init}).
     *
     * @return true for {@code set S = ...;}
     */
    public boolean isFixed() {
        return fixed;
    }

    public OptSet setInit(SetInitializer initializer) {
        return define(initializer, false);
    }

    public OptSet setValue(SetInitializer initializer) {
        return define(initializer, true);
    }

    /**
     * Returns an iterator over this set for use in indexed statements and sums.
     *
     * @param name iterator name, such as {@code i}
     * @return new iterator
     */
    public SetIterator iterator(String name) {
        if (getArity() != 1) {
            throw new IllegalArgumentException("Set '" + getName() + "' has tuples of " + getArity()
                    + " elements, use iterators(...) with as many names");
        }
        return new SetIterator(this, name, null, 0);
    }

    /**
     * Returns a tuple of iterators, bound together as {@code <i, j> in S}.
     *
     * @param names one name per tuple position
     * @return iterators in position order
     */
    public List<SetIterator> iterators(String... names) {
        if (names.length != getArity()) {
            throw new IllegalArgumentException("Set '" + getName() + "' needs " + getArity()
                    + " iterator names, got " + names.length);
        }
        if (names.length == 1) {
            return List.of(iterator(names[0]));
        }
        List<SetIterator> tuple = new ArrayList<>(names.length);
        List<SetIterator> view = Collections.unmodifiableList(tuple);
        for (int i = 0; i < names.length; i++) {
            tuple.add(new SetIterator(this, names[i], view, i));
        }
        return view;
    }

    @Override
    public Set<Entity> getDependencies() {
        if (initializer == null || !initializer.isRange()) {
            return Set.of();
        }
        Set<Entity> out = new LinkedHashSet<>();
        Dependencies.addTo(initializer.from(), out);
        Dependencies.addTo(initializer.to(), out);
        return out;
    }

    private OptSet define(SetInitializer initializer, boolean fixed) {
        Objects.requireNonNull(initializer, "initializer must not be null");
        checkMutable();
        if (initializer.isRange()) {
            owner.bind(initializer.from());
            owner.bind(initializer.to());
        }
        this.initializer = initializer;
        this.fixed = fixed;
        return this;
    }
}
