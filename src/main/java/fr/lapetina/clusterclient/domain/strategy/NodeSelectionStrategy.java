package fr.lapetina.clusterclient.domain.strategy;

import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ServiceType;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Strategy interface for spreading operations across the nodes of a service.
 *
 * Implementations must be thread-safe as they will be called from
 * multiple Disruptor consumer threads concurrently.
 */
public interface NodeSelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects a node among the candidates.
     *
     * The admission predicate may have side effects (a half-open circuit breaker
     * hands out its single trial slot), so implementations must test it at most
     * once per candidate and return the first candidate it accepted.
     *
     * @param candidates nodes advertising the service
     * @param service    the requested service
     * @param admission  gate consulted before a node is chosen
     * @return Selected node, or empty if no candidate was admitted
     */
    Optional<ClusterNode> selectNode(List<ClusterNode> candidates, ServiceType service, Predicate<ClusterNode> admission);

    /**
     * Resets any internal state. Called when a new topology is published.
     */
    default void reset() {
        // Default no-op
    }
}
