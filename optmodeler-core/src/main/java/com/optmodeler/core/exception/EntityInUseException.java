package com.optmodeler.core.exception;

import java.util.List;

/**
 * Thrown when dropping an entity that other statements or entities still reference.
 */
public class EntityInUseException extends ModelingException {

    private final List<String> dependents;

    public EntityInUseException(String entityName, List<String> dependents) {
        super("Cannot drop '" + entityName + "': still referenced by " + dependents);
        this.dependents = List.copyOf(dependents);
    }

    /**
     * Returns the names of the components that reference the entity.
     *
     * @return dependent component names
     */
    public List<String> getDependents() {
        return dependents;
    }
}
