package fr.lapetina.clusterclient.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for node selection strategies, looked up by configuration name.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<NodeSelectionStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("round-robin", RoundRobinStrategy::new);
        register("random", RandomStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<NodeSelectionStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @param name Strategy name from configuration
     * @return Strategy instance, or empty if not found
     */
    public static Optional<NodeSelectionStrategy> create(String name) {
        Supplier<NodeSelectionStrategy> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, with default fallback.
     */
    public static NodeSelectionStrategy createOrDefault(String name, NodeSelectionStrategy defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
