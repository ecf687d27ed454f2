package com.optmodeler.core.model;

/**
 * Per-member attribute that can be overridden after a group is declared.
 */
public enum OverrideField {
    /** Lower bound, rendered as {@code x[k].lb = v;} */
    LOWER_BOUND,

    /** Upper bound, rendered as {@code x[k].ub = v;} */
    UPPER_BOUND,

    /** Initial value, rendered as {@code x[k] = v;} */
    INIT,

    /** Parameter member value, rendered as {@code p[k] = v;} */
    VALUE
}
