package fr.lapetina.clusterclient;

import fr.lapetina.clusterclient.disruptor.OperationPipeline;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.domain.retry.BackoffCalculator;
import fr.lapetina.clusterclient.domain.retry.RetryOrchestrator;
import fr.lapetina.clusterclient.domain.retry.RetryStrategy;
import fr.lapetina.clusterclient.domain.retry.RetryStrategyFactory;
import fr.lapetina.clusterclient.domain.strategy.NodeSelectionStrategy;
import fr.lapetina.clusterclient.domain.strategy.RoundRobinStrategy;
import fr.lapetina.clusterclient.domain.strategy.StrategyFactory;
import fr.lapetina.clusterclient.infrastructure.auth.Authenticator;
import fr.lapetina.clusterclient.infrastructure.auth.PasswordAuthenticator;
import fr.lapetina.clusterclient.infrastructure.circuit.CircuitBreakerRegistry;
import fr.lapetina.clusterclient.infrastructure.config.ClientConfig;
import fr.lapetina.clusterclient.infrastructure.config.ConfigLoader;
import fr.lapetina.clusterclient.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.clusterclient.infrastructure.topology.BinaryConfigProvider;
import fr.lapetina.clusterclient.infrastructure.topology.ClusterConfigParser;
import fr.lapetina.clusterclient.infrastructure.topology.HttpConfigProvider;
import fr.lapetina.clusterclient.infrastructure.topology.SeedNode;
import fr.lapetina.clusterclient.infrastructure.topology.TopologyManager;
import fr.lapetina.clusterclient.infrastructure.topology.TopologyProvider;
import fr.lapetina.clusterclient.infrastructure.tracing.NoopTracer;
import fr.lapetina.clusterclient.infrastructure.tracing.RequestTracer;
import fr.lapetina.clusterclient.infrastructure.transport.ServiceTransports;
import fr.lapetina.clusterclient.infrastructure.transport.Transport;
import fr.lapetina.clusterclient.infrastructure.transport.binary.BinaryConnectionPool;
import fr.lapetina.clusterclient.infrastructure.transport.binary.BinaryTransport;
import fr.lapetina.clusterclient.infrastructure.transport.http.HttpServiceTransport;
import fr.lapetina.clusterclient.pending.OperationTimer;
import fr.lapetina.clusterclient.pending.PendingOperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Factory for creating a fully-wired client from configuration.
 * This is the primary entry point for obtaining a configured OperationPipeline.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ClusterClientFactory factory = ClusterClientFactory.create("client-config.yaml").start()) {
 *     OperationHandle handle = factory.getPipeline().submit(request);
 *     OperationResult result = handle.result().join();
 * }
 * }</pre>
 */
public class ClusterClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterClientFactory.class);

    private final ClientConfig config;
    private final MetricsRegistry metricsRegistry;
    private final BinaryConnectionPool connectionPool;
    private final Transport transport;
    private final TopologyManager topologyManager;
    private final CircuitBreakerRegistry circuitBreakers;
    private final OperationTimer timer;
    private final PendingOperationRegistry registry;
    private final OperationPipeline pipeline;

    protected ClusterClientFactory(
            ClientConfig config,
            Transport transportOverride,
            TopologyProvider providerOverride,
            RequestTracer tracer
    ) {
        this.config = config;
        Clock clock = Clock.systemUTC();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix(), config.getMetrics().isEnabled());

        Authenticator authenticator = new PasswordAuthenticator(
                config.getCredentials().getUsername(), config.getCredentials().getPassword());
        Duration connectTimeout = Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs());

        this.connectionPool = new BinaryConnectionPool(
                config.getPool().getKvPoolSize(), connectTimeout, authenticator, config.getBucket());

        // Initialize transports (allow override for testing)
        this.transport = transportOverride != null ? transportOverride : new ServiceTransports(
                new BinaryTransport(connectionPool, config.getPool().getMaxQueueSize()),
                new HttpServiceTransport(connectTimeout, authenticator, config.getPool().getRowBufferSize()));

        NodeSelectionStrategy strategy = StrategyFactory.createOrDefault(
                config.getStrategy().getType(), new RoundRobinStrategy());
        log.info("Using node selection strategy: {}", strategy.getName());

        List<TopologyProvider> providers = providerOverride != null
                ? List.of(providerOverride)
                : createProviders(authenticator, connectTimeout, clock);
        this.topologyManager = new TopologyManager(
                providers,
                strategy,
                Duration.ofMillis(config.getTopology().getPollPeriodMs()),
                Duration.ofMillis(config.getTopology().getPollTimeoutMs()),
                Duration.ofMillis(config.getTopology().getMinRefreshIntervalMs())
        );

        this.circuitBreakers = CircuitBreakerRegistry.fromConfig(config.getCircuitBreaker(), clock);
        this.timer = new OperationTimer();
        this.registry = new PendingOperationRegistry(timer, tracer != null ? tracer : NoopTracer.INSTANCE, clock);

        this.pipeline = OperationPipeline.builder()
                .fromConfig(config)
                .registry(registry)
                .topologyManager(topologyManager)
                .circuitBreakers(circuitBreakers)
                .transport(transport)
                .orchestrator(new RetryOrchestrator(createRetryStrategy(), clock))
                .timer(timer)
                .metricsRegistry(metricsRegistry)
                .tracer(tracer != null ? tracer : NoopTracer.INSTANCE)
                .build();

        topologyManager.addListener(this::onTopologyChanged);

        log.info("ClusterClientFactory initialized: bucket={}, bootstrapMode={}, providers={}",
                config.getBucket(), config.getBootstrap().getMode(),
                providers.stream().map(TopologyProvider::getName).toList());
    }

    protected ClusterClientFactory(String configPath) {
        this(loadConfig(configPath), null, null, null);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ClusterClientFactory create(String configPath) {
        return new ClusterClientFactory(configPath);
    }

    /**
     * Creates a factory from the default configuration (client-config.yaml).
     */
    public static ClusterClientFactory create() {
        return create("client-config.yaml");
    }

    private static ClientConfig loadConfig(String configPath) {
        log.info("Initializing ClusterClientFactory from config: {}", configPath);
        return new ConfigLoader(configPath).load();
    }

    /**
     * Starts the pipeline and the topology polling.
     */
    public ClusterClientFactory start() {
        pipeline.start();
        topologyManager.start();
        log.info("Cluster client started");
        return this;
    }

    /**
     * Timeout applied by convention to requests of the service: the key/value timeout
     * for KEY_VALUE, the query timeout for every HTTP service.
     */
    public Duration defaultTimeout(ServiceType service) {
        return service.usesBinaryProtocol()
                ? Duration.ofMillis(config.getTimeouts().getKvTimeoutMs())
                : Duration.ofMillis(config.getTimeouts().getQueryTimeoutMs());
    }

    public OperationPipeline getPipeline() {
        return pipeline;
    }

    public TopologyManager getTopologyManager() {
        return topologyManager;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public PendingOperationRegistry getRegistry() {
        return registry;
    }

    public OperationTimer getTimer() {
        return timer;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ClientConfig getConfig() {
        return config;
    }

    private List<TopologyProvider> createProviders(Authenticator authenticator, Duration connectTimeout, Clock clock) {
        ClientConfig.BootstrapConfig bootstrap = config.getBootstrap();
        ClusterConfigParser parser = new ClusterConfigParser(clock);
        String mode = bootstrap.getMode();
        List<TopologyProvider> providers = new ArrayList<>();

        if (!"http".equals(mode)) {
            providers.add(new BinaryConfigProvider(
                    connectionPool,
                    SeedNode.parseAll(bootstrap.getKvNodes(), bootstrap.getDefaultKvPort()),
                    parser));
        }
        if (!"cccp".equals(mode)) {
            providers.add(new HttpConfigProvider(
                    authenticator,
                    config.getBucket(),
                    SeedNode.parseAll(bootstrap.getHttpNodes(), bootstrap.getDefaultHttpPort()),
                    connectTimeout,
                    Duration.ofMillis(config.getTopology().getPollTimeoutMs()),
                    parser));
        }
        return providers;
    }

    private RetryStrategy createRetryStrategy() {
        ClientConfig.RetryConfig retry = config.getRetry();
        BackoffCalculator backoff = new BackoffCalculator(
                Duration.ofMillis(retry.getInitialBackoffMs()),
                Duration.ofMillis(retry.getMaxBackoffMs()),
                retry.getBackoffMultiplier(),
                retry.getJitter());
        return RetryStrategyFactory.create(retry.getStrategy(), backoff, retry.isPreserveTarget())
                .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                        "Unknown retry strategy: " + retry.getStrategy()));
    }

    private void onTopologyChanged(TopologySnapshot previous, TopologySnapshot current) {
        circuitBreakers.retainNodes(current.nodeIds());

        Set<String> kvEndpoints = current.nodesFor(ServiceType.KEY_VALUE).stream()
                .map(node -> node.endpoint(ServiceType.KEY_VALUE))
                .collect(Collectors.toSet());
        connectionPool.retainEndpoints(kvEndpoints);

        metricsRegistry.setTopologyRevision(current.revision());
        if (previous != null) {
            Set<String> departed = previous.nodeIds().stream()
                    .filter(id -> !current.nodeIds().contains(id))
                    .collect(Collectors.toSet());
            if (!departed.isEmpty()) {
                log.info("Nodes left the topology: rev={}, departed={}", current.revision(), departed);
            }
        }
    }

    @Override
    public void close() {
        log.info("Shutting down ClusterClientFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            topologyManager.close();
        } catch (Exception e) {
            log.warn("Error closing topology manager", e);
        }

        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing transport", e);
        }

        try {
            connectionPool.close();
        } catch (Exception e) {
            log.warn("Error closing connection pool", e);
        }

        try {
            timer.close();
        } catch (Exception e) {
            log.warn("Error closing operation timer", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ClusterClientFactory shut down");
    }
}
