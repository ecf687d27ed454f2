package com.optmodeler.core.exception;

/**
 * Thrown when a declarative model definition cannot be read or refers to unknown components.
 */
public class DefinitionException extends ModelingException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
