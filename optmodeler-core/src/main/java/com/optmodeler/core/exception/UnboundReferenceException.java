package com.optmodeler.core.exception;

/**
 * Thrown when an expression refers to a symbol that is not bound to the container using it,
 * or to a concrete group member outside the group's index set.
 */
public class UnboundReferenceException extends ModelingException {

    public UnboundReferenceException(String message) {
        super(message);
    }
}
