package com.optmodeler.core.generator;

/**
 * Phases of rendering one container, always passed in this order.
 */
public enum RenderPhase {
    /** All declarations written */
    DECLARED,

    /** All member overrides written */
    OVERRIDES_EMITTED,

    /** All statements written */
    STATEMENTS_EMITTED,

    /** Container sealed, text final */
    SEALED
}
