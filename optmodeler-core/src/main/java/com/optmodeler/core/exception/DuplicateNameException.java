package com.optmodeler.core.exception;

/**
 * Thrown when a name is already taken by a live entity or statement of the same container.
 */
public class DuplicateNameException extends ModelingException {

    private final String name;

    public DuplicateNameException(String name, String containerName) {
        super("Name '" + name + "' is already registered in container '" + containerName + "'");
        this.name = name;
    }

    /**
     * Returns the name that collided.
     *
     * @return duplicate name
     */
    public String getName() {
        return name;
    }
}
