package fr.lapetina.clusterclient.infrastructure.transport;

import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.OperationRequest;

import java.time.Duration;

/**
 * Performs one exchange with one node. Never blocks the calling thread on I/O.
 */
public interface Transport extends AutoCloseable {

    /**
     * Starts an exchange.
     *
     * @param node      target node, advertising the request's service
     * @param request   the operation
     * @param remaining time left until the operation's deadline
     * @return the in-flight exchange; failures to even start are reported through its future
     */
    InFlightExchange send(ClusterNode node, OperationRequest request, Duration remaining);

    @Override
    default void close() {
        // Default no-op
    }
}
