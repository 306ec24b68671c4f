package fr.lapetina.clusterclient.domain.strategy;

import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ServiceType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Round-robin selection with one cursor per service.
 *
 * Cycles through candidates in order, skipping the ones the admission
 * gate rejects. Thread-safe via atomic counters.
 */
public final class RoundRobinStrategy implements NodeSelectionStrategy {

    private final Map<ServiceType, AtomicInteger> counters = new EnumMap<>(ServiceType.class);

    public RoundRobinStrategy() {
        for (ServiceType service : ServiceType.values()) {
            counters.put(service, new AtomicInteger(0));
        }
    }

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<ClusterNode> selectNode(List<ClusterNode> candidates, ServiceType service, Predicate<ClusterNode> admission) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int size = candidates.size();
        int startIndex = Math.floorMod(counters.get(service).getAndIncrement(), size);

        for (int i = 0; i < size; i++) {
            ClusterNode node = candidates.get((startIndex + i) % size);
            if (admission.test(node)) {
                return Optional.of(node);
            }
        }

        return Optional.empty();
    }

    @Override
    public void reset() {
        counters.values().forEach(c -> c.set(0));
    }
}
