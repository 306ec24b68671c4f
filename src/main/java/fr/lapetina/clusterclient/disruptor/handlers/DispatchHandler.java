package fr.lapetina.clusterclient.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.clusterclient.disruptor.RetryCoordinator;
import fr.lapetina.clusterclient.domain.event.EventState;
import fr.lapetina.clusterclient.domain.event.OperationEvent;
import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.OperationResult;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.circuit.CircuitBreakerRegistry;
import fr.lapetina.clusterclient.infrastructure.circuit.CircuitOutcome;
import fr.lapetina.clusterclient.infrastructure.tracing.RequestSpan;
import fr.lapetina.clusterclient.infrastructure.tracing.RequestTracer;
import fr.lapetina.clusterclient.infrastructure.transport.InFlightExchange;
import fr.lapetina.clusterclient.infrastructure.transport.Transport;
import fr.lapetina.clusterclient.infrastructure.transport.TransportResponse;
import fr.lapetina.clusterclient.pending.PendingOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Second stage handler: sends the attempt to the selected node.
 *
 * The exchange is bound to the operation before its callbacks are attached, so a
 * settlement racing with the dispatch aborts it. Outcomes are reported to the
 * circuit breaker of the node; failures go to the retry coordinator.
 *
 * IMPORTANT: the response is handled in the exchange callbacks, which only use
 * locals captured here. The event is reused as soon as onEvent returns.
 */
public final class DispatchHandler implements EventHandler<OperationEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final Transport transport;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryCoordinator retryCoordinator;
    private final RequestTracer tracer;

    public DispatchHandler(
            Transport transport,
            CircuitBreakerRegistry circuitBreakers,
            RetryCoordinator retryCoordinator,
            RequestTracer tracer
    ) {
        this.transport = transport;
        this.circuitBreakers = circuitBreakers;
        this.retryCoordinator = retryCoordinator;
        this.tracer = tracer;
    }

    @Override
    public void onEvent(OperationEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }

        PendingOperation operation = event.getOperation();
        if (event.getState() == EventState.NO_NODE_AVAILABLE) {
            retryCoordinator.onAttemptFailed(operation, null,
                    OperationException.retryable(event.getRoutingFailure(), event.getErrorMessage()));
            return;
        }

        if (event.getState() != EventState.ROUTED) {
            log.warn("Invalid state for dispatch: requestId={}, state={}", operation.requestId(), event.getState());
            return;
        }

        dispatch(event, operation, event.getSelectedNode());
    }

    private void dispatch(OperationEvent event, PendingOperation operation, ClusterNode node) {
        OperationRequest request = operation.getRequest();
        if (operation.isSettled()) {
            // Settled between routing and dispatch; give back the admission taken by routing
            circuitBreakers.report(node.getId(), request.service(), CircuitOutcome.CANCELED);
            event.markAbandoned();
            return;
        }
        int attempt = operation.nextAttempt();

        RequestSpan span = tracer.requestSpan("attempt", operation.getSpan());
        span.setAttribute("node.id", node.getId());
        span.setAttribute("attempt", String.valueOf(attempt));

        InFlightExchange exchange;
        try {
            exchange = transport.send(node, request, operation.remaining());
        } catch (RuntimeException e) {
            span.end();
            circuitBreakers.report(node.getId(), request.service(), CircuitOutcome.FAILURE);
            log.error("Dispatch failed: requestId={}, nodeId={}, attempt={}", request.requestId(), node.getId(), attempt, e);
            event.markFailed(attempt, e.getMessage());
            retryCoordinator.onAttemptFailed(operation, node.getId(),
                    new OperationException(ErrorType.TRANSPORT_FAILURE, "Dispatch to " + node.getId() + " failed: " + e.getMessage(), e));
            return;
        }
        event.markDispatched(attempt);

        log.debug("Dispatched attempt: requestId={}, service={}, nodeId={}, attempt={}, remainingMs={}",
                request.requestId(), request.service(), node.getId(), attempt, operation.remaining().toMillis());

        if (!operation.bindExchange(exchange)) {
            circuitBreakers.report(node.getId(), request.service(), CircuitOutcome.CANCELED);
            span.setAttribute("outcome", "abandoned");
            span.end();
            return;
        }

        String nodeId = node.getId();
        exchange.response().whenComplete((response, error) -> {
            try {
                if (error == null) {
                    onSuccess(operation, nodeId, attempt, response);
                } else {
                    onError(operation, nodeId, attempt, unwrap(error));
                }
            } finally {
                span.end();
            }
        });
    }

    private void onSuccess(PendingOperation operation, String nodeId, int attempt, TransportResponse response) {
        OperationRequest request = operation.getRequest();
        circuitBreakers.report(nodeId, request.service(), CircuitOutcome.SUCCESS);

        OperationResult result = new OperationResult(
                request.requestId(),
                request.service(),
                nodeId,
                attempt,
                response.status(),
                response.body(),
                response.rows(),
                operation.getRetryReasons(),
                operation.elapsed()
        );
        if (operation.succeed(result)) {
            log.debug("Operation succeeded: requestId={}, nodeId={}, attempts={}, latencyMs={}",
                    request.requestId(), nodeId, attempt, result.latency().toMillis());
        } else {
            response.discard();
        }
    }

    private void onError(PendingOperation operation, String nodeId, int attempt, Throwable error) {
        OperationRequest request = operation.getRequest();

        if (operation.isSettled()) {
            // Exchange aborted by the settlement
            ErrorType settledWith = operation.getSettlementError().map(OperationException::getErrorType).orElse(null);
            if (settledWith == ErrorType.TIMEOUT) {
                circuitBreakers.report(nodeId, request.service(), CircuitOutcome.FAILURE);
            } else if (settledWith == ErrorType.REQUEST_CANCELED) {
                circuitBreakers.report(nodeId, request.service(), CircuitOutcome.CANCELED);
            }
            return;
        }

        OperationException failure = toOperationException(nodeId, error);
        circuitBreakers.report(nodeId, request.service(), circuitOutcome(failure));

        log.debug("Attempt failed: requestId={}, nodeId={}, attempt={}, errorType={}, reason={}, error={}",
                request.requestId(), nodeId, attempt, failure.getErrorType(), failure.getRetryReason(), failure.getMessage());
        retryCoordinator.onAttemptFailed(operation, nodeId, failure);
    }

    /**
     * A node that answered, even with an error status, is healthy from the breaker's point of view.
     */
    private static CircuitOutcome circuitOutcome(OperationException failure) {
        if (failure.isServerResponse()
                || failure.getErrorType() == ErrorType.SERVICE_ERROR
                || failure.getErrorType() == ErrorType.SERVICE_UNAVAILABLE) {
            return CircuitOutcome.SUCCESS;
        }
        return CircuitOutcome.FAILURE;
    }

    private static OperationException toOperationException(String nodeId, Throwable error) {
        if (error instanceof OperationException operationException) {
            return operationException;
        }
        if (error instanceof CancellationException) {
            return OperationException.retryable(RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT,
                    "Exchange with " + nodeId + " was aborted", error);
        }
        return new OperationException(ErrorType.TRANSPORT_FAILURE,
                "Unexpected failure from " + nodeId + ": " + error.getMessage(), error);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
