package fr.lapetina.clusterclient.infrastructure.metrics;

import fr.lapetina.clusterclient.domain.event.EventState;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Operation counters and latency per service and outcome
 * - Attempt counters per node and routing state
 * - Retry counters by reason, circuit rejections
 * - Pending operation, topology revision and ring buffer gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> operationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> circuitRejections = new ConcurrentHashMap<>();

    // Global gauges
    private final AtomicLong topologyRevision = new AtomicLong(-1);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    /**
     * @param bindJvmMetrics also register the JVM and processor binders
     */
    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_topology_revision", topologyRevision, AtomicLong::get)
                .description("Revision of the published cluster topology")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("cluster_client", true);
    }

    /**
     * Counts a settled operation. Outcome is "success" or an error type name.
     */
    public void incrementOperationCount(ServiceType service, String outcome) {
        String key = service.name() + ":" + outcome;
        operationCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_operations_total")
                        .description("Total number of settled operations")
                        .tag("service", service.getConfigKey())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the accept-to-settle latency of an operation.
     */
    public void recordLatency(ServiceType service, String outcome, Duration latency) {
        String key = service.name() + ":" + outcome;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_operation_latency")
                        .description("Operation latency from acceptance to settlement")
                        .tag("service", service.getConfigKey())
                        .tag("outcome", outcome)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementAttemptCount(ServiceType service, String nodeId, EventState state) {
        String key = service.name() + ":" + nodeId + ":" + state.name();
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Attempts that went through the ring buffer")
                        .tag("service", service.getConfigKey())
                        .tag("node", nodeId)
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRetryCount(ServiceType service, RetryReason reason) {
        String key = service.name() + ":" + reason.name();
        retryCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_retries_total")
                        .description("Retries scheduled, by reason")
                        .tag("service", service.getConfigKey())
                        .tag("reason", reason.name())
                        .register(registry)
        ).increment();
    }

    public void incrementCircuitRejection(ServiceType service) {
        circuitRejections.computeIfAbsent(service.name(), k ->
                Counter.builder(prefix + "_circuit_rejections_total")
                        .description("Routing attempts rejected because every candidate breaker was open")
                        .tag("service", service.getConfigKey())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for the number of pending operations.
     */
    public void registerPendingOperations(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_pending_operations", valueSupplier, s -> s.get().doubleValue())
                .description("Accepted operations not yet settled")
                .register(registry);
    }

    public void setTopologyRevision(long revision) {
        topologyRevision.set(revision);
    }

    /**
     * Updates the ring buffer remaining capacity.
     */
    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
