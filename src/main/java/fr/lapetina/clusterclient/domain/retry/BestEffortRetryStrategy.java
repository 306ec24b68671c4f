package fr.lapetina.clusterclient.domain.retry;

import fr.lapetina.clusterclient.domain.model.OperationRequest;

/**
 * Retries every transient failure with exponential backoff until the deadline.
 */
public final class BestEffortRetryStrategy implements RetryStrategy {

    private final BackoffCalculator backoff;
    private final boolean preserveTarget;

    public BestEffortRetryStrategy(BackoffCalculator backoff, boolean preserveTarget) {
        this.backoff = backoff;
        this.preserveTarget = preserveTarget;
    }

    public BestEffortRetryStrategy(BackoffCalculator backoff) {
        this(backoff, false);
    }

    @Override
    public String getName() {
        return "best-effort";
    }

    @Override
    public RetryAction retryAfter(OperationRequest request, int attempt, RetryReason reason) {
        return RetryAction.retryAfter(backoff.backoff(attempt)).withPreserveTarget(preserveTarget);
    }
}
