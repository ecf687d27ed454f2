package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.expression.Constant;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.symbol.RegisteredName;
import com.optmodeler.core.symbol.SymbolKind;

import java.util.Objects;

/**
 * Base class holding the owner and registered name shared by all entities.
 */
public abstract class AbstractEntity implements Entity {

    protected final Container owner;
    private final RegisteredName registeredName;

    protected AbstractEntity(Container owner, RegisteredName registeredName) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.registeredName = Objects.requireNonNull(registeredName, "registeredName must not be null");
    }

    @Override
    public String getName() {
        return registeredName.name();
    }

    @Override
    public SymbolKind getKind() {
        return registeredName.kind();
    }

    @Override
    public long getCreationIndex() {
        return registeredName.creationIndex();
    }

    @Override
    public Container getOwner() {
        return owner;
    }

    /**
     * Fails if the owning container has been sealed by rendering.
     */
    protected void checkMutable() {
        owner.ensureMutable();
    }

    /**
     * Converts a user-supplied value into an expression bound to the owner, or keeps a string.
     *
     * @param value number, string, operand or null
     * @return a bound expression, a string or null
     */
    protected Object normalizeValue(Object value) {
        if (value == null || value instanceof String) {
            return value;
        }
        if (value instanceof Number number) {
            return new Constant(number.doubleValue());
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        if (value instanceof Operand operand) {
            return owner.bind(operand);
        }
        throw new IllegalArgumentException("Unsupported value type for '" + getName() + "': "
                + value.getClass().getName());
    }

    @Override
    public String toString() {
        return getName();
    }
}
