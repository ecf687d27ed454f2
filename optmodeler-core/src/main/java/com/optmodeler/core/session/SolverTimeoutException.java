package com.optmodeler.core.session;

import java.time.Duration;

/**
 * Thrown when a submission does not complete within the requested time.
 */
public class SolverTimeoutException extends SolverSessionException {

    private final Duration timeout;

    public SolverTimeoutException(Duration timeout, Throwable cause) {
        super("Solver did not respond within " + timeout, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
