package fr.lapetina.clusterclient.disruptor;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.retry.RetryAction;
import fr.lapetina.clusterclient.domain.retry.RetryOrchestrator;
import fr.lapetina.clusterclient.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.clusterclient.infrastructure.topology.TopologyManager;
import fr.lapetina.clusterclient.pending.OperationTimer;
import fr.lapetina.clusterclient.pending.PendingOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a failed attempt into its consequence: settle, re-publish now, re-publish
 * after a delay, or re-publish once the next topology refresh completed.
 *
 * Every delay and wait is bound to the operation, so settling it (deadline,
 * cancellation) cancels whatever is pending.
 */
public final class RetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final RetryOrchestrator orchestrator;
    private final OperationTimer timer;
    private final TopologyManager topologyManager;
    private final MetricsRegistry metricsRegistry;
    private final AttemptPublisher publisher;

    public RetryCoordinator(
            RetryOrchestrator orchestrator,
            OperationTimer timer,
            TopologyManager topologyManager,
            MetricsRegistry metricsRegistry,
            AttemptPublisher publisher
    ) {
        this.orchestrator = orchestrator;
        this.timer = timer;
        this.topologyManager = topologyManager;
        this.metricsRegistry = metricsRegistry;
        this.publisher = publisher;
    }

    /**
     * @param failedNodeId node of the failed attempt, null when no node was selected
     */
    public void onAttemptFailed(PendingOperation operation, String failedNodeId, OperationException error) {
        operation.recordFailure(error);
        if (operation.isSettled()) {
            return;
        }

        int failedAttempts = Math.max(1, operation.getRetryReasons().size());
        RetryAction action = orchestrator.classify(operation.getRequest(), failedAttempts, error);
        String requestId = operation.requestId();

        if (!action.shouldRetry()) {
            if (action.deadlineExhausted()) {
                log.debug("No time left for a retry: requestId={}, reason={}", requestId, error.getRetryReason());
                operation.timeout();
            } else {
                log.warn("Operation failed: requestId={}, service={}, node={}, attempts={}, errorType={}, error={}",
                        requestId, operation.getRequest().service(), failedNodeId, operation.getAttempts(),
                        error.getErrorType(), error.getMessage());
                operation.fail(error);
            }
            return;
        }

        metricsRegistry.incrementRetryCount(operation.getRequest().service(), error.getRetryReason());
        String preferred = action.preserveTarget() ? failedNodeId : null;
        String avoid = action.preserveTarget() ? null : failedNodeId;

        log.debug("Retrying: requestId={}, kind={}, delayMs={}, reason={}, node={}",
                requestId, action.kind(), action.delay().toMillis(), error.getRetryReason(), failedNodeId);

        switch (action.kind()) {
            case RETRY_NOW -> publisher.publishAttempt(operation, preferred, avoid);
            case RETRY_AFTER -> operation.armRetry(
                    timer.schedule(() -> publisher.publishAttempt(operation, preferred, avoid), action.delay()));
            case RETRY_ON_NEW_TOPOLOGY -> {
                CompletableFuture<?> refresh = topologyManager.awaitNextRefresh();
                if (operation.bindTopologyWait(refresh)) {
                    refresh.whenComplete((snapshot, refreshError) -> {
                        if (refreshError == null) {
                            publisher.publishAttempt(operation, preferred, avoid);
                        } else if (!operation.isSettled()) {
                            log.warn("No topology refresh to wait for: requestId={}, error={}",
                                    requestId, refreshError.getMessage());
                            operation.fail(refreshError instanceof OperationException refreshFailure
                                    ? refreshFailure
                                    : new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE,
                                            "Topology refresh failed: " + refreshError.getMessage(), refreshError));
                        }
                    });
                    topologyManager.requestRefresh();
                }
            }
            default -> operation.fail(error);
        }
    }
}
