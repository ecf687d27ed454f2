package com.optmodeler.core.model;

/**
 * Domain of a decision variable.
 */
public enum VariableType {
    /** Real-valued */
    CONTINUOUS,

    /** Integer-valued */
    INTEGER,

    /** Integer restricted to {0, 1} */
    BINARY
}
