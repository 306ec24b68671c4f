package fr.lapetina.clusterclient.infrastructure.circuit;

import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.infrastructure.config.ClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds one lazily created breaker per (node, service).
 *
 * A disabled registry admits everything and records nothing.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentHashMap<CircuitKey, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Function<CircuitKey, CircuitBreaker> breakerFactory;
    private final boolean enabled;

    public CircuitBreakerRegistry(Function<CircuitKey, CircuitBreaker> breakerFactory, boolean enabled) {
        this.breakerFactory = breakerFactory;
        this.enabled = enabled;
    }

    public static CircuitBreakerRegistry disabled() {
        return new CircuitBreakerRegistry(key -> {
            throw new IllegalStateException("Circuit breakers are disabled");
        }, false);
    }

    public static CircuitBreakerRegistry fromConfig(ClientConfig.CircuitBreakerConfig config, Clock clock) {
        Duration cooldown = Duration.ofMillis(config.getSleepWindowMs());
        Duration maxCooldown = Duration.ofMillis(config.getMaxCooldownMs());
        Function<CircuitKey, CircuitBreaker> factory = switch (config.getType()) {
            case "rolling-window" -> key -> new RollingWindowCircuitBreaker(
                    key.toString(),
                    config.getVolumeThreshold(),
                    config.getErrorThresholdPercentage(),
                    Duration.ofMillis(config.getRollingWindowMs()),
                    cooldown,
                    config.getCooldownBackoffMultiplier(),
                    maxCooldown,
                    clock);
            default -> key -> new ConsecutiveFailuresCircuitBreaker(
                    key.toString(),
                    config.getFailureThreshold(),
                    cooldown,
                    config.getCooldownBackoffMultiplier(),
                    maxCooldown,
                    clock);
        };
        log.info("Circuit breakers: enabled={}, type={}, sleepWindowMs={}",
                config.isEnabled(), config.getType(), config.getSleepWindowMs());
        return new CircuitBreakerRegistry(factory, config.isEnabled());
    }

    /**
     * Admission check for one attempt. A true answer from a half-open breaker
     * consumes its trial slot, so every admitted attempt must be reported.
     */
    public boolean allow(String nodeId, ServiceType service) {
        if (!enabled) {
            return true;
        }
        return breaker(nodeId, service).allowRequest();
    }

    /**
     * Records the outcome of an attempt, creating the breaker of the pair if it is
     * not tracked yet.
     */
    public void report(String nodeId, ServiceType service, CircuitOutcome outcome) {
        if (!enabled) {
            return;
        }
        breaker(nodeId, service).record(outcome);
    }

    public CircuitBreaker.State state(String nodeId, ServiceType service) {
        if (!enabled) {
            return CircuitBreaker.State.CLOSED;
        }
        CircuitBreaker breaker = breakers.get(new CircuitKey(nodeId, service));
        return breaker != null ? breaker.getState() : CircuitBreaker.State.CLOSED;
    }

    public Optional<CircuitBreaker> find(String nodeId, ServiceType service) {
        return Optional.ofNullable(breakers.get(new CircuitKey(nodeId, service)));
    }

    /**
     * Drops the breakers of nodes absent from the latest topology.
     */
    public void retainNodes(Set<String> nodeIds) {
        breakers.keySet().removeIf(key -> {
            boolean departed = !nodeIds.contains(key.nodeId());
            if (departed) {
                log.debug("Dropping circuit breaker of departed node: key={}", key);
            }
            return departed;
        });
    }

    public Map<CircuitKey, CircuitState> snapshot() {
        Map<CircuitKey, CircuitState> result = new ConcurrentHashMap<>();
        breakers.forEach((key, breaker) -> result.put(key, breaker.snapshot()));
        return result;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int size() {
        return breakers.size();
    }

    private CircuitBreaker breaker(String nodeId, ServiceType service) {
        return breakers.computeIfAbsent(new CircuitKey(nodeId, service), breakerFactory);
    }
}
