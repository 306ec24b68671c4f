package fr.lapetina.clusterclient.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the cluster client.
 * Designed to be populated from YAML; treated as read-only once loaded.
 */
public class ClientConfig {

    private String bucket = "default";
    private CredentialsConfig credentials = new CredentialsConfig();
    private BootstrapConfig bootstrap = new BootstrapConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private TopologyConfig topology = new TopologyConfig();
    private PoolConfig pool = new PoolConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private StrategyConfig strategy = new StrategyConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public String getBucket() { return bucket; }
    public void setBucket(String bucket) { this.bucket = bucket; }

    public CredentialsConfig getCredentials() { return credentials; }
    public void setCredentials(CredentialsConfig credentials) { this.credentials = credentials; }

    public BootstrapConfig getBootstrap() { return bootstrap; }
    public void setBootstrap(BootstrapConfig bootstrap) { this.bootstrap = bootstrap; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public TopologyConfig getTopology() { return topology; }
    public void setTopology(TopologyConfig topology) { this.topology = topology; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Credentials handed to the password authenticator.
     */
    public static class CredentialsConfig {
        private String username = "";
        private String password = "";

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    /**
     * Seed nodes and how the first configuration is fetched.
     *
     * mode:
     * - cccp: binary protocol only, needs kvNodes
     * - http: management REST endpoint only, needs httpNodes
     * - both: binary first, HTTP as fallback
     */
    public static class BootstrapConfig {
        private String mode = "both";
        private List<String> kvNodes = new ArrayList<>();
        private List<String> httpNodes = new ArrayList<>();
        private int defaultKvPort = 11210;
        private int defaultHttpPort = 8091;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public List<String> getKvNodes() { return kvNodes; }
        public void setKvNodes(List<String> kvNodes) { this.kvNodes = kvNodes; }

        public List<String> getHttpNodes() { return httpNodes; }
        public void setHttpNodes(List<String> httpNodes) { this.httpNodes = httpNodes; }

        public int getDefaultKvPort() { return defaultKvPort; }
        public void setDefaultKvPort(int defaultKvPort) { this.defaultKvPort = defaultKvPort; }

        public int getDefaultHttpPort() { return defaultHttpPort; }
        public void setDefaultHttpPort(int defaultHttpPort) { this.defaultHttpPort = defaultHttpPort; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long kvTimeoutMs = 2500;
        private long queryTimeoutMs = 75000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getKvTimeoutMs() { return kvTimeoutMs; }
        public void setKvTimeoutMs(long kvTimeoutMs) { this.kvTimeoutMs = kvTimeoutMs; }

        public long getQueryTimeoutMs() { return queryTimeoutMs; }
        public void setQueryTimeoutMs(long queryTimeoutMs) { this.queryTimeoutMs = queryTimeoutMs; }
    }

    /**
     * Default retry strategy and its backoff.
     */
    public static class RetryConfig {
        private String strategy = "best-effort";
        private long initialBackoffMs = 1;
        private long maxBackoffMs = 500;
        private double backoffMultiplier = 2.0;
        private double jitter = 0.0;
        private boolean preserveTarget = false;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }

        public boolean isPreserveTarget() { return preserveTarget; }
        public void setPreserveTarget(boolean preserveTarget) { this.preserveTarget = preserveTarget; }
    }

    /**
     * Per (node, service) circuit breaker configuration.
     *
     * type:
     * - consecutive: opens after failureThreshold consecutive failures
     * - rolling-window: opens when errorThresholdPercentage of at least volumeThreshold
     *   outcomes within rollingWindowMs failed
     */
    public static class CircuitBreakerConfig {
        private boolean enabled = true;
        private String type = "consecutive";
        private int failureThreshold = 5;
        private int volumeThreshold = 20;
        private int errorThresholdPercentage = 50;
        private long rollingWindowMs = 60000;
        private long sleepWindowMs = 5000;
        private double cooldownBackoffMultiplier = 1.0;
        private long maxCooldownMs = 60000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getVolumeThreshold() { return volumeThreshold; }
        public void setVolumeThreshold(int volumeThreshold) { this.volumeThreshold = volumeThreshold; }

        public int getErrorThresholdPercentage() { return errorThresholdPercentage; }
        public void setErrorThresholdPercentage(int percentage) { this.errorThresholdPercentage = percentage; }

        public long getRollingWindowMs() { return rollingWindowMs; }
        public void setRollingWindowMs(long rollingWindowMs) { this.rollingWindowMs = rollingWindowMs; }

        public long getSleepWindowMs() { return sleepWindowMs; }
        public void setSleepWindowMs(long sleepWindowMs) { this.sleepWindowMs = sleepWindowMs; }

        public double getCooldownBackoffMultiplier() { return cooldownBackoffMultiplier; }
        public void setCooldownBackoffMultiplier(double multiplier) { this.cooldownBackoffMultiplier = multiplier; }

        public long getMaxCooldownMs() { return maxCooldownMs; }
        public void setMaxCooldownMs(long maxCooldownMs) { this.maxCooldownMs = maxCooldownMs; }
    }

    /**
     * Topology polling configuration.
     */
    public static class TopologyConfig {
        private long pollPeriodMs = 2500;
        private long pollTimeoutMs = 2000;
        private long minRefreshIntervalMs = 10;

        public long getPollPeriodMs() { return pollPeriodMs; }
        public void setPollPeriodMs(long pollPeriodMs) { this.pollPeriodMs = pollPeriodMs; }

        public long getPollTimeoutMs() { return pollTimeoutMs; }
        public void setPollTimeoutMs(long pollTimeoutMs) { this.pollTimeoutMs = pollTimeoutMs; }

        public long getMinRefreshIntervalMs() { return minRefreshIntervalMs; }
        public void setMinRefreshIntervalMs(long ms) { this.minRefreshIntervalMs = ms; }
    }

    /**
     * Connection pooling and buffering.
     */
    public static class PoolConfig {
        private int kvPoolSize = 1;
        private int maxQueueSize = 2048;
        private int rowBufferSize = 128;

        public int getKvPoolSize() { return kvPoolSize; }
        public void setKvPoolSize(int kvPoolSize) { this.kvPoolSize = kvPoolSize; }

        public int getMaxQueueSize() { return maxQueueSize; }
        public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }

        public int getRowBufferSize() { return rowBufferSize; }
        public void setRowBufferSize(int rowBufferSize) { this.rowBufferSize = rowBufferSize; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Node selection strategy configuration.
     */
    public static class StrategyConfig {
        private String type = "round-robin";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "cluster_client";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
