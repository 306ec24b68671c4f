package fr.lapetina.clusterclient.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.clusterclient.disruptor.exception.BackpressureException;
import fr.lapetina.clusterclient.disruptor.handlers.CompletionHandler;
import fr.lapetina.clusterclient.disruptor.handlers.DispatchHandler;
import fr.lapetina.clusterclient.disruptor.handlers.MetricsHandler;
import fr.lapetina.clusterclient.disruptor.handlers.RoutingHandler;
import fr.lapetina.clusterclient.domain.event.OperationEvent;
import fr.lapetina.clusterclient.domain.event.OperationEventFactory;
import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.OperationResult;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.domain.retry.RetryOrchestrator;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.circuit.CircuitBreakerRegistry;
import fr.lapetina.clusterclient.infrastructure.config.ClientConfig;
import fr.lapetina.clusterclient.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.clusterclient.infrastructure.topology.TopologyManager;
import fr.lapetina.clusterclient.infrastructure.tracing.NoopTracer;
import fr.lapetina.clusterclient.infrastructure.tracing.RequestTracer;
import fr.lapetina.clusterclient.infrastructure.transport.Transport;
import fr.lapetina.clusterclient.pending.OperationHandle;
import fr.lapetina.clusterclient.pending.OperationTimer;
import fr.lapetina.clusterclient.pending.PendingOperation;
import fr.lapetina.clusterclient.pending.PendingOperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Entry point of the client: accepts operations and runs their attempts through
 * a Disruptor ring.
 *
 * Every attempt of an operation, the first and each retry, is one event:
 * Routing -> Dispatch -> Metrics -> Completion. Dispatch only starts the exchange;
 * its outcome is handled in the exchange callbacks, which settle the operation
 * or hand it to the {@link RetryCoordinator} for another attempt.
 *
 * PRODUCER TYPE CHOICE: MULTI
 *
 * Callers submit from any thread, and retries are published from timer threads,
 * topology poller threads and transport callback threads.
 *
 * Publishing never blocks: a full ring rejects a submission with
 * {@link BackpressureException} and turns a retry into a PIPELINE_SATURATED failure,
 * which backs off on its own schedule.
 */
public final class OperationPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OperationPipeline.class);

    private final Disruptor<OperationEvent> disruptor;
    private final RingBuffer<OperationEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final PendingOperationRegistry registry;
    private final TopologyManager topologyManager;
    private final MetricsRegistry metricsRegistry;
    private final RetryCoordinator retryCoordinator;

    private OperationPipeline(Builder builder) {
        this.registry = builder.registry;
        this.topologyManager = builder.topologyManager;
        this.metricsRegistry = builder.metricsRegistry;
        this.retryCoordinator = new RetryCoordinator(
                builder.orchestrator,
                builder.timer,
                builder.topologyManager,
                builder.metricsRegistry,
                this::publishAttempt
        );

        ThreadFactory threadFactory = new DisruptorThreadFactory("operation-pipeline");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new OperationEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        RoutingHandler routingHandler = new RoutingHandler(
                builder.topologyManager, builder.circuitBreakers, builder.metricsRegistry);
        DispatchHandler dispatchHandler = new DispatchHandler(
                builder.transport, builder.circuitBreakers, retryCoordinator, builder.tracer);
        MetricsHandler metricsHandler = new MetricsHandler(builder.metricsRegistry);
        CompletionHandler completionHandler = new CompletionHandler();

        // Order: Routing -> Dispatch -> Metrics -> Completion
        disruptor
                .handleEventsWith(routingHandler)
                .then(dispatchHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        registry.addSettlementListener(this::recordSettlement);
        metricsRegistry.registerPendingOperations(registry::size);

        log.info("OperationPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("OperationPipeline started");
        }
    }

    /**
     * Accepts an operation.
     *
     * @return handle completing once the operation settled; already settled as a
     *         timeout if the deadline passed before submission
     * @throws OperationException    CONFIGURATION_ERROR for an invalid request, TOPOLOGY_UNAVAILABLE
     *                               before the first topology unless the request waits for it,
     *                               SERVICE_UNAVAILABLE if no node serves the request's service
     * @throws BackpressureException if the ring buffer is full
     * @throws IllegalStateException if the pipeline is not running
     */
    public OperationHandle submit(OperationRequest request) {
        if (!running.get()) {
            throw new IllegalStateException("Pipeline not running");
        }
        RequestValidator.validate(request);

        if (registry.isExpired(request)) {
            // Settles as a timeout right away, before any topology check or routing
            return registry.register(request);
        }

        TopologySnapshot snapshot = topologyManager.current();
        if (snapshot == null && !request.waitForTopology()) {
            throw new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE,
                    "No cluster topology available yet: requestId=" + request.requestId());
        }
        if (snapshot != null && !snapshot.hasService(request.service())) {
            throw new OperationException(ErrorType.SERVICE_UNAVAILABLE,
                    "No node serves " + request.service() + " in topology rev=" + snapshot.revision());
        }

        if (snapshot == null) {
            return submitAfterFirstTopology(request);
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Rejecting operation, ring buffer full: requestId={}, service={}",
                    request.requestId(), request.service());
            throw new BackpressureException(request.requestId(), ringBuffer.remainingCapacity());
        }

        PendingOperation operation;
        OperationEvent event = ringBuffer.get(sequence);
        try {
            event.clear();
            operation = registry.register(request);
            event.initialize(operation, null, null);
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Operation submitted: requestId={}, service={}, sequence={}",
                request.requestId(), request.service(), sequence);
        return operation;
    }

    /**
     * Accepts an operation and attaches a callback receiving either the result or the
     * settlement error. The callback runs exactly once.
     */
    public OperationHandle submit(OperationRequest request, BiConsumer<OperationResult, Throwable> callback) {
        OperationHandle handle = submit(request);
        handle.result().whenComplete((result, error) ->
                callback.accept(result, error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error));
        return handle;
    }

    private OperationHandle submitAfterFirstTopology(OperationRequest request) {
        PendingOperation operation = registry.register(request);
        CompletableFuture<TopologySnapshot> first = topologyManager.awaitFirstTopology();
        if (operation.bindTopologyWait(first)) {
            log.debug("Operation waiting for the first topology: requestId={}", request.requestId());
            first.thenRun(() -> publishAttempt(operation, null, null));
        }
        return operation;
    }

    /**
     * Publishes the next attempt of an accepted operation. Never blocks.
     */
    void publishAttempt(PendingOperation operation, String preferredNodeId, String avoidNodeId) {
        if (operation.isSettled()) {
            return;
        }
        if (!running.get()) {
            operation.cancel("client closed");
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            retryCoordinator.onAttemptFailed(operation, avoidNodeId, OperationException.retryable(
                    RetryReason.PIPELINE_SATURATED, "Ring buffer full, attempt could not be published"));
            return;
        }

        try {
            ringBuffer.get(sequence).initialize(operation, preferredNodeId, avoidNodeId);
        } finally {
            ringBuffer.publish(sequence);
        }
        log.debug("Attempt published: requestId={}, preferred={}, avoid={}, sequence={}",
                operation.requestId(), preferredNodeId, avoidNodeId, sequence);
    }

    private void recordSettlement(PendingOperation operation) {
        String outcome = operation.getSettlementError()
                .map(error -> error.getErrorType().name().toLowerCase(Locale.ROOT))
                .orElse("success");
        metricsRegistry.incrementOperationCount(operation.getRequest().service(), outcome);
        metricsRegistry.recordLatency(operation.getRequest().service(), outcome, operation.elapsed());
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public PendingOperationRegistry getRegistry() {
        return registry;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Cancels every outstanding operation, then drains and stops the ring.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down OperationPipeline...");
            registry.cancelAll("client closed");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("OperationPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("OperationPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor. A handler failure fails the operation
     * instead of leaving it to its deadline.
     */
    private static class DisruptorExceptionHandler implements ExceptionHandler<OperationEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, OperationEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            PendingOperation operation = event.getOperation();
            if (operation != null) {
                operation.fail(new OperationException(ErrorType.TRANSPORT_FAILURE,
                        "Unexpected error while processing attempt: " + ex.getMessage(), ex));
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for OperationPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private PendingOperationRegistry registry;
        private TopologyManager topologyManager;
        private CircuitBreakerRegistry circuitBreakers = CircuitBreakerRegistry.disabled();
        private Transport transport;
        private RetryOrchestrator orchestrator;
        private OperationTimer timer;
        private MetricsRegistry metricsRegistry;
        private RequestTracer tracer = NoopTracer.INSTANCE;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder registry(PendingOperationRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder topologyManager(TopologyManager topologyManager) {
            this.topologyManager = topologyManager;
            return this;
        }

        public Builder circuitBreakers(CircuitBreakerRegistry circuitBreakers) {
            this.circuitBreakers = circuitBreakers;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder orchestrator(RetryOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        public Builder timer(OperationTimer timer) {
            this.timer = timer;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder tracer(RequestTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder fromConfig(ClientConfig config) {
            return ringBufferSize(config.getDisruptor().getRingBufferSize())
                    .waitStrategy(config.getDisruptor().getWaitStrategy());
        }

        public OperationPipeline build() {
            if (registry == null) {
                throw new IllegalStateException("PendingOperationRegistry is required");
            }
            if (topologyManager == null) {
                throw new IllegalStateException("TopologyManager is required");
            }
            if (transport == null) {
                throw new IllegalStateException("Transport is required");
            }
            if (orchestrator == null) {
                throw new IllegalStateException("RetryOrchestrator is required");
            }
            if (timer == null) {
                throw new IllegalStateException("OperationTimer is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new OperationPipeline(this);
        }
    }
}
