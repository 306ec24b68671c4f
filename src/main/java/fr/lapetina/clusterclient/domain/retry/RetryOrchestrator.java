package fr.lapetina.clusterclient.domain.retry;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.OperationRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether, when and where a failed attempt is retried.
 *
 * Pure: it reads the clock but performs no I/O and keeps no per-operation state.
 * The decision order is:
 * <ol>
 *   <li>failures without a retry reason are terminal</li>
 *   <li>non-idempotent requests only retry on reasons that prove the request did not take effect</li>
 *   <li>{@link RetryReason#alwaysRetry()} reasons bypass the strategy: a stale topology waits
 *       for the next refresh, local saturation backs off on a fixed schedule</li>
 *   <li>everything else is delegated to the request's strategy, or the default one</li>
 *   <li>a retry that could not start before the deadline becomes a timeout</li>
 * </ol>
 * There is no attempt ceiling: the deadline is the only hard stop.
 */
public final class RetryOrchestrator {

    private static final Duration[] CONTROLLED_BACKOFF = {
            Duration.ofMillis(1),
            Duration.ofMillis(10),
            Duration.ofMillis(50),
            Duration.ofMillis(100),
            Duration.ofMillis(500),
            Duration.ofMillis(1000)
    };

    private final RetryStrategy defaultStrategy;
    private final Clock clock;

    public RetryOrchestrator(RetryStrategy defaultStrategy, Clock clock) {
        this.defaultStrategy = defaultStrategy;
        this.clock = clock;
    }

    public RetryOrchestrator(RetryStrategy defaultStrategy) {
        this(defaultStrategy, Clock.systemUTC());
    }

    /**
     * Classifies a failed attempt.
     *
     * @param request the operation
     * @param attempt 1-based number of the attempt that failed
     * @param error   the attempt's failure
     */
    public RetryAction classify(OperationRequest request, int attempt, OperationException error) {
        RetryReason reason = error.getRetryReason();
        if (reason == null) {
            return RetryAction.doNotRetry();
        }
        if (!request.idempotent() && !reason.allowsNonIdempotentRetry()) {
            return RetryAction.doNotRetry();
        }

        RetryAction action;
        if (reason.alwaysRetry()) {
            action = reason == RetryReason.TOPOLOGY_STALE
                    ? RetryAction.retryOnNewTopology()
                    : RetryAction.retryAfter(controlledBackoff(attempt));
        } else {
            RetryStrategy strategy = request.retryStrategy() != null ? request.retryStrategy() : defaultStrategy;
            action = strategy.retryAfter(request, attempt, reason);
        }

        if (!action.shouldRetry()) {
            return action;
        }
        if (reason.implicatesNode()) {
            action = action.withPreserveTarget(false);
        }

        Instant earliestRetry = clock.instant().plus(action.delay());
        if (!earliestRetry.isBefore(request.deadline())) {
            return RetryAction.exhausted();
        }
        return action;
    }

    public RetryStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    static Duration controlledBackoff(int attempt) {
        int index = Math.max(0, Math.min(attempt - 1, CONTROLLED_BACKOFF.length - 1));
        return CONTROLLED_BACKOFF[index];
    }
}
