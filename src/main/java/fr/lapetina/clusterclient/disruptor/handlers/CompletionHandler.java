package fr.lapetina.clusterclient.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.clusterclient.domain.event.OperationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Final stage handler: logs the attempt summary and clears the event for reuse.
 *
 * Settlement happens in the exchange callbacks, never here.
 */
public final class CompletionHandler implements EventHandler<OperationEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(OperationEvent event, long sequence, boolean endOfBatch) {
        try {
            logAttemptSummary(event);
        } finally {
            // Clear event for reuse (drops the reference to the operation)
            event.clear();
        }
    }

    private void logAttemptSummary(OperationEvent event) {
        if (event.getOperation() == null || !log.isDebugEnabled()) {
            return;
        }
        long queuedMs = event.getPublishedAt() != null && event.getRoutedAt() != null
                ? Duration.between(event.getPublishedAt(), event.getRoutedAt()).toMillis()
                : -1;
        log.debug("Attempt processed: requestId={}, state={}, node={}, attempt={}, queuedMs={}",
                event.getOperation().requestId(),
                event.getState(),
                event.getSelectedNode() != null ? event.getSelectedNode().getId() : "none",
                event.getAttempt(),
                queuedMs);
    }
}
