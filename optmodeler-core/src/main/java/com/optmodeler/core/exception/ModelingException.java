package com.optmodeler.core.exception;

/**
 * Base type for structural errors detected while building or rendering a model.
 *
 * <p>All structural problems (naming, indexing, sealing, dangling references) are raised
 * on the client side, at construction or render time, before any text reaches a solver.
 * Transport and solver-status failures are reported through
 * {@link com.optmodeler.core.session.SolverSessionException} instead.
 */
public class ModelingException extends RuntimeException {

    public ModelingException(String message) {
        super(message);
    }

    public ModelingException(String message, Throwable cause) {
        super(message, cause);
    }
}
