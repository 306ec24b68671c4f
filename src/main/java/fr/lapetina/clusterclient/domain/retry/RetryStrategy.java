package fr.lapetina.clusterclient.domain.retry;

import fr.lapetina.clusterclient.domain.model.OperationRequest;

/**
 * Pluggable retry policy.
 *
 * Implementations must be thread-safe and free of I/O: they are called from
 * transport completion threads for every failed attempt.
 */
public interface RetryStrategy {

    /**
     * Returns the name of this strategy for configuration and logs.
     */
    String getName();

    /**
     * Decides how to retry a failed attempt.
     * Deadline and idempotency checks are applied by the caller afterwards.
     *
     * @param request the failed operation
     * @param attempt 1-based number of the attempt that just failed
     * @param reason  classification of the failure
     * @return the retry action, {@link RetryAction#doNotRetry()} to give up
     */
    RetryAction retryAfter(OperationRequest request, int attempt, RetryReason reason);
}
