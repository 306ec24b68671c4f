package fr.lapetina.clusterclient.domain.retry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates retry strategies by configuration name.
 */
public final class RetryStrategyFactory {

    @FunctionalInterface
    public interface StrategySupplier {
        RetryStrategy create(BackoffCalculator backoff, boolean preserveTarget);
    }

    private static final Map<String, StrategySupplier> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("best-effort", BestEffortRetryStrategy::new);
        register("fail-fast", (backoff, preserveTarget) -> new FailFastRetryStrategy());
    }

    private RetryStrategyFactory() {
        // Utility class
    }

    public static void register(String name, StrategySupplier supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    public static Optional<RetryStrategy> create(String name, BackoffCalculator backoff, boolean preserveTarget) {
        StrategySupplier supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.create(backoff, preserveTarget));
    }

    public static boolean isRegistered(String name) {
        return name != null && REGISTRY.containsKey(name.toLowerCase());
    }
}
