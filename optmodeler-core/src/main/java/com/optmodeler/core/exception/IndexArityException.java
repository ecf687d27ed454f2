package com.optmodeler.core.exception;

/**
 * Thrown when a group is indexed with a key whose arity differs from the group's index signature.
 */
public class IndexArityException extends ModelingException {

    private final int expected;
    private final int actual;

    public IndexArityException(String groupName, int expected, int actual) {
        super("Group '" + groupName + "' expects " + expected + " index element(s) but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
