package fr.lapetina.clusterclient.infrastructure.config;

import fr.lapetina.clusterclient.domain.retry.RetryStrategyFactory;
import fr.lapetina.clusterclient.domain.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Loads and validates the client configuration.
 *
 * Supports loading from the file system, falling back to the classpath.
 * The configuration is read once; the client never reloads it.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> BOOTSTRAP_MODES = Set.of("cccp", "http", "both");
    private static final Set<String> BREAKER_TYPES = Set.of("consecutive", "rolling-window");
    private static final Set<String> WAIT_STRATEGIES = Set.of("blocking", "sleeping", "yielding", "busy-spin");

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ClientConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ClientConfig load() {
        ClientConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private ClientConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ClientConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public ClientConfig loadFromStream(InputStream inputStream) {
        ClientConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private ClientConfig parse(InputStream is, String origin) {
        try {
            ClientConfig config = yaml.load(is);
            return config != null ? config : new ClientConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks cross-field rules SnakeYAML cannot enforce.
     *
     * @throws ConfigurationException listing every violation
     */
    public static void validate(ClientConfig config) {
        List<String> errors = new ArrayList<>();

        ClientConfig.BootstrapConfig bootstrap = config.getBootstrap();
        String mode = bootstrap.getMode() == null ? "" : bootstrap.getMode().toLowerCase();
        if (!BOOTSTRAP_MODES.contains(mode)) {
            errors.add("bootstrap.mode must be one of " + BOOTSTRAP_MODES + ", got: " + bootstrap.getMode());
        } else if (mode.equals("cccp") && bootstrap.getKvNodes().isEmpty()) {
            errors.add("bootstrap.mode=cccp requires at least one kvNodes entry");
        } else if (mode.equals("http") && bootstrap.getHttpNodes().isEmpty()) {
            errors.add("bootstrap.mode=http requires at least one httpNodes entry");
        } else if (bootstrap.getKvNodes().isEmpty() && bootstrap.getHttpNodes().isEmpty()) {
            errors.add("bootstrap requires at least one kvNodes or httpNodes entry");
        }

        if (config.getBucket() == null || config.getBucket().isBlank()) {
            errors.add("bucket is required");
        }

        ClientConfig.RetryConfig retry = config.getRetry();
        if (!RetryStrategyFactory.isRegistered(retry.getStrategy())) {
            errors.add("Unknown retry.strategy: " + retry.getStrategy());
        }
        if (retry.getInitialBackoffMs() < 0 || retry.getMaxBackoffMs() < retry.getInitialBackoffMs()) {
            errors.add("retry backoff must satisfy 0 <= initialBackoffMs <= maxBackoffMs");
        }
        if (retry.getBackoffMultiplier() < 1.0) {
            errors.add("retry.backoffMultiplier must be >= 1.0");
        }
        if (retry.getJitter() < 0.0 || retry.getJitter() > 1.0) {
            errors.add("retry.jitter must be between 0.0 and 1.0");
        }

        ClientConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        if (!BREAKER_TYPES.contains(breaker.getType())) {
            errors.add("circuitBreaker.type must be one of " + BREAKER_TYPES + ", got: " + breaker.getType());
        }
        if (breaker.getFailureThreshold() < 1) {
            errors.add("circuitBreaker.failureThreshold must be >= 1");
        }
        if (breaker.getErrorThresholdPercentage() < 1 || breaker.getErrorThresholdPercentage() > 100) {
            errors.add("circuitBreaker.errorThresholdPercentage must be between 1 and 100");
        }
        if (breaker.getSleepWindowMs() <= 0) {
            errors.add("circuitBreaker.sleepWindowMs must be > 0");
        }

        if (config.getTopology().getPollPeriodMs() <= 0) {
            errors.add("topology.pollPeriodMs must be > 0");
        }

        ClientConfig.PoolConfig pool = config.getPool();
        if (pool.getKvPoolSize() < 1) {
            errors.add("pool.kvPoolSize must be >= 1");
        }
        if (pool.getMaxQueueSize() < 1) {
            errors.add("pool.maxQueueSize must be >= 1");
        }
        if (pool.getRowBufferSize() < 1) {
            errors.add("pool.rowBufferSize must be >= 1");
        }

        int ringSize = config.getDisruptor().getRingBufferSize();
        if (ringSize < 1 || Integer.bitCount(ringSize) != 1) {
            errors.add("disruptor.ringBufferSize must be a power of 2, got: " + ringSize);
        }
        if (!WAIT_STRATEGIES.contains(config.getDisruptor().getWaitStrategy())) {
            errors.add("Unknown disruptor.waitStrategy: " + config.getDisruptor().getWaitStrategy());
        }

        if (StrategyFactory.create(config.getStrategy().getType()).isEmpty()) {
            errors.add("Unknown strategy.type: " + config.getStrategy().getType());
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ClientConfig createDefault() {
        return new ClientConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
