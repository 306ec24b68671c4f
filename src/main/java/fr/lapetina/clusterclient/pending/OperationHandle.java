package fr.lapetina.clusterclient.pending;

import fr.lapetina.clusterclient.domain.model.OperationResult;

import java.util.concurrent.CompletableFuture;

/**
 * Caller-side view of an accepted operation.
 *
 * The result future completes exactly once: with a result, or exceptionally with an
 * {@link fr.lapetina.clusterclient.domain.exception.OperationException} whose error type is
 * {@code REQUEST_CANCELED}, {@code TIMEOUT} or a terminal failure.
 */
public interface OperationHandle {

    String requestId();

    /**
     * Cancels the operation. Safe to call any number of times from any thread;
     * a no-op once the operation settled.
     *
     * @return true if this call settled the operation
     */
    boolean cancel();

    /**
     * Completion of the operation. Cancelling the returned future does not cancel
     * the operation; use {@link #cancel()}.
     */
    CompletableFuture<OperationResult> result();

    boolean isSettled();
}
