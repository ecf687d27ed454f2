package com.optmodeler.core.session;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Connection to a remote solver that accepts OPTMODEL program text.
 *
 * <p>The transport (HTTP, socket, batch queue) is up to the implementation. The modeling
 * layer only hands over finished text and reads back a {@link ResponseTable}.
 *
 * <pre>{@code
 * SolverSession session = code -> remoteClient.run(code);
 * ResponseTable table = session.submitAndWait(program.content(), Duration.ofMinutes(5));
 * }</pre>
 */
@FunctionalInterface
public interface SolverSession {

    /**
     * Submits program text and blocks until the solver answers.
     *
     * @param code complete program text
     * @return response rows
     * @throws SolverSessionException on transport failure or solver error status
     */
    ResponseTable submit(String code);

    /**
     * Submits program text and waits at most {@code timeout} for the answer.
     *
     * @param code complete program text
     * @param timeout maximum time to wait
     * @return response rows
     * @throws SolverTimeoutException if the timeout elapses
     * @throws SolverSessionException on transport failure or interruption
     */
    default ResponseTable submitAndWait(String code, Duration timeout) {
        CompletableFuture<ResponseTable> future = CompletableFuture.supplyAsync(() -> submit(code));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SolverTimeoutException(timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SolverSessionException("Interrupted while waiting for the solver", e);
        } catch (CancellationException e) {
            throw new SolverSessionException("Submission was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SolverSessionException("Submission failed", cause);
        }
    }
}
