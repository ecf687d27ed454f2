package com.optmodeler.core.session;

/**
 * Failure reported by a {@link SolverSession}: transport errors or a solver-side error status.
 *
 * <p>The modeling layer never retries; these exceptions reach the caller unchanged.
 */
public class SolverSessionException extends RuntimeException {

    public SolverSessionException(String message) {
        super(message);
    }

    public SolverSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
