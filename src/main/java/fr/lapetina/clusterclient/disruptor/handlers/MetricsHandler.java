package fr.lapetina.clusterclient.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.clusterclient.domain.event.OperationEvent;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Third stage handler: records attempt metrics.
 *
 * Records:
 * - Attempt count by service, node and routing outcome
 * - Sets MDC context for structured logging
 */
public final class MetricsHandler implements EventHandler<OperationEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(OperationEvent event, long sequence, boolean endOfBatch) {
        if (event.getOperation() == null) {
            return;
        }
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(OperationEvent event) {
        OperationRequest request = event.getOperation().getRequest();
        MDC.put("requestId", request.requestId());
        MDC.put("correlationId", request.correlationId());
        MDC.put("service", request.service().name());
        if (event.getSelectedNode() != null) {
            MDC.put("nodeId", event.getSelectedNode().getId());
        }
        MDC.put("attempt", String.valueOf(event.getAttempt()));
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("correlationId");
        MDC.remove("service");
        MDC.remove("nodeId");
        MDC.remove("attempt");
    }

    private void recordMetrics(OperationEvent event) {
        OperationRequest request = event.getOperation().getRequest();
        String nodeId = event.getSelectedNode() != null ? event.getSelectedNode().getId() : "none";
        metricsRegistry.incrementAttemptCount(request.service(), nodeId, event.getState());

        if (event.getErrorMessage() != null) {
            log.debug("Attempt not dispatched: state={}, reason={}, message={}",
                    event.getState(), event.getRoutingFailure(), event.getErrorMessage());
        }
    }
}
