package fr.lapetina.clusterclient.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.clusterclient.domain.event.OperationEvent;
import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.circuit.CircuitBreakerRegistry;
import fr.lapetina.clusterclient.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.clusterclient.infrastructure.topology.TopologyManager;
import fr.lapetina.clusterclient.pending.PendingOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * First stage handler: picks the target node of an attempt.
 *
 * Candidates come from the current topology, admission from the circuit
 * breaker of each candidate. Attempts of operations that already settled
 * are abandoned here.
 */
public final class RoutingHandler implements EventHandler<OperationEvent> {

    private static final Logger log = LoggerFactory.getLogger(RoutingHandler.class);

    private final TopologyManager topologyManager;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MetricsRegistry metricsRegistry;

    public RoutingHandler(
            TopologyManager topologyManager,
            CircuitBreakerRegistry circuitBreakers,
            MetricsRegistry metricsRegistry
    ) {
        this.topologyManager = topologyManager;
        this.circuitBreakers = circuitBreakers;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(OperationEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        PendingOperation operation = event.getOperation();
        if (operation == null) {
            return;
        }
        if (operation.isSettled()) {
            log.debug("Abandoning attempt of settled operation: requestId={}", operation.requestId());
            event.markAbandoned();
            return;
        }

        OperationRequest request = operation.getRequest();
        ServiceType service = request.service();
        String preferred = event.getPreferredNodeId();
        if (preferred == null && operation.getAttempts() == 0) {
            preferred = request.routingHint();
        }

        Optional<ClusterNode> selected = topologyManager.selectNode(
                service,
                preferred,
                event.getAvoidNodeId(),
                node -> circuitBreakers.allow(node.getId(), service)
        );

        if (selected.isPresent()) {
            event.markRouted(selected.get());
            log.debug("Routed attempt: requestId={}, service={}, nodeId={}",
                    request.requestId(), service, selected.get().getId());
            return;
        }

        TopologySnapshot snapshot = topologyManager.current();
        if (snapshot != null && snapshot.hasService(service)) {
            metricsRegistry.incrementCircuitRejection(service);
            event.markNoNodeAvailable(RetryReason.CIRCUIT_BREAKER_OPEN,
                    "All " + service + " nodes are behind an open circuit breaker");
        } else {
            event.markNoNodeAvailable(RetryReason.SERVICE_NOT_AVAILABLE,
                    "No node serves " + service + " in topology rev=" + (snapshot != null ? snapshot.revision() : "none"));
        }
        log.debug("No node available: requestId={}, service={}, reason={}",
                request.requestId(), service, event.getRoutingFailure());
    }
}
