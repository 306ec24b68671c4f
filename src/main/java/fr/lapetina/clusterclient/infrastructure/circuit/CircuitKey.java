package fr.lapetina.clusterclient.infrastructure.circuit;

import fr.lapetina.clusterclient.domain.model.ServiceType;

import java.util.Objects;

/**
 * Identity of a breaker: one per node and service.
 */
public record CircuitKey(String nodeId, ServiceType service) {

    public CircuitKey {
        Objects.requireNonNull(nodeId, "Node ID is required");
        Objects.requireNonNull(service, "Service is required");
    }

    @Override
    public String toString() {
        return nodeId + "/" + service.getConfigKey();
    }
}
