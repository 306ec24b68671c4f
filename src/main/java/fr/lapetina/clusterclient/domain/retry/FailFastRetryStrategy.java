package fr.lapetina.clusterclient.domain.retry;

import fr.lapetina.clusterclient.domain.model.OperationRequest;

/**
 * Never retries by policy. Reasons flagged {@link RetryReason#alwaysRetry()} are still retried.
 */
public final class FailFastRetryStrategy implements RetryStrategy {

    @Override
    public String getName() {
        return "fail-fast";
    }

    @Override
    public RetryAction retryAfter(OperationRequest request, int attempt, RetryReason reason) {
        return RetryAction.doNotRetry();
    }
}
