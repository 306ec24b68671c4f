package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.KvCommand;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.transport.InFlightExchange;
import fr.lapetina.clusterclient.infrastructure.transport.Transport;
import fr.lapetina.clusterclient.infrastructure.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Key/value transport over pooled binary connections.
 *
 * An endpoint with {@code maxQueueSize} requests already in flight rejects new
 * ones with PIPELINE_SATURATED instead of queueing them.
 */
public final class BinaryTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(BinaryTransport.class);

    private final BinaryConnectionPool pool;
    private final int maxQueueSize;

    public BinaryTransport(BinaryConnectionPool pool, int maxQueueSize) {
        this.pool = pool;
        this.maxQueueSize = maxQueueSize;
    }

    @Override
    public InFlightExchange send(ClusterNode node, OperationRequest request, Duration remaining) {
        if (!(request.payload() instanceof KvCommand command)) {
            return BinaryExchange.failed(new OperationException(ErrorType.CONFIGURATION_ERROR,
                    "Binary transport requires a KvCommand payload, got: " + request.payload().describe()));
        }

        String endpoint = node.endpoint(ServiceType.KEY_VALUE);
        int inFlight = pool.inFlight(endpoint);
        if (inFlight >= maxQueueSize) {
            log.debug("Endpoint saturated: endpoint={}, inFlight={}, requestId={}",
                    endpoint, inFlight, request.requestId());
            return BinaryExchange.failed(OperationException.retryable(RetryReason.PIPELINE_SATURATED,
                    "Endpoint " + endpoint + " has " + inFlight + " requests in flight"));
        }

        BinaryExchange exchange = new BinaryExchange();
        // The acquisition future is shared by the pool slot, so it is never cancelled here
        pool.acquire(node.getHostname(), node.getPort(ServiceType.KEY_VALUE)).whenComplete((conn, connectError) -> {
            if (connectError != null) {
                exchange.fail(unwrap(connectError));
                return;
            }
            if (exchange.isDone()) {
                return;
            }
            CompletableFuture<BinaryFrame> frame = conn.send(BinaryFrame.fromCommand(command));
            exchange.track(frame);
            frame.whenComplete((response, error) -> {
                if (error != null) {
                    exchange.fail(unwrap(error));
                } else if (BinaryStatus.isSuccess(response.status())) {
                    exchange.complete(TransportResponse.of(response.status(), response.value()));
                } else {
                    exchange.fail(BinaryStatus.toException(response.status(), endpoint, command.describe()));
                }
            });
        });
        return exchange;
    }

    @Override
    public void close() {
        pool.close();
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Exchange whose abort cancels the frame awaiting its response, which
     * deregisters its opaque from the connection.
     */
    static final class BinaryExchange implements InFlightExchange {
        private final CompletableFuture<TransportResponse> response = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<?>> pendingStage = new AtomicReference<>();

        static BinaryExchange failed(Throwable error) {
            BinaryExchange exchange = new BinaryExchange();
            exchange.fail(error);
            return exchange;
        }

        void track(CompletableFuture<?> stage) {
            pendingStage.set(stage);
            if (response.isDone()) {
                stage.cancel(false);
            }
        }

        boolean isDone() {
            return response.isDone();
        }

        void complete(TransportResponse value) {
            response.complete(value);
        }

        void fail(Throwable error) {
            response.completeExceptionally(error);
        }

        @Override
        public CompletableFuture<TransportResponse> response() {
            return response;
        }

        @Override
        public void abort() {
            if (response.completeExceptionally(new CancellationException("Exchange aborted"))) {
                CompletableFuture<?> stage = pendingStage.get();
                if (stage != null) {
                    stage.cancel(false);
                }
            }
        }
    }
}
