package fr.lapetina.clusterclient.domain.event;

import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.pending.PendingOperation;

import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer: one attempt of one operation.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the Disruptor pipeline handlers, and never
 * from the completion callbacks of a transport exchange.
 */
public final class OperationEvent {

    private PendingOperation operation;
    private String preferredNodeId;
    private String avoidNodeId;

    // Mutable state tracking
    private EventState state;
    private ClusterNode selectedNode;
    private int attempt;
    private RetryReason routingFailure;
    private String errorMessage;

    // Timing
    private Instant publishedAt;
    private Instant routedAt;
    private Instant dispatchedAt;

    // Sequence number (set by Disruptor)
    private long sequence;

    /**
     * Clears the event for reuse.
     * Called by the EventFactory and at the end of processing.
     */
    public void clear() {
        this.operation = null;
        this.preferredNodeId = null;
        this.avoidNodeId = null;
        this.state = null;
        this.selectedNode = null;
        this.attempt = 0;
        this.routingFailure = null;
        this.errorMessage = null;
        this.publishedAt = null;
        this.routedAt = null;
        this.dispatchedAt = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with the next attempt of an operation.
     *
     * @param preferredNodeId node to try first, null for none
     * @param avoidNodeId     node that failed the previous attempt, null for none
     */
    public void initialize(PendingOperation operation, String preferredNodeId, String avoidNodeId) {
        clear();
        this.operation = operation;
        this.preferredNodeId = preferredNodeId;
        this.avoidNodeId = avoidNodeId;
        this.state = EventState.CREATED;
        this.publishedAt = Instant.now();
    }

    public PendingOperation getOperation() {
        return operation;
    }

    public String getPreferredNodeId() {
        return preferredNodeId;
    }

    public String getAvoidNodeId() {
        return avoidNodeId;
    }

    public EventState getState() {
        return state;
    }

    public ClusterNode getSelectedNode() {
        return selectedNode;
    }

    public int getAttempt() {
        return attempt;
    }

    public RetryReason getRoutingFailure() {
        return routingFailure;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Instant getRoutedAt() {
        return routedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markRouted(ClusterNode node) {
        this.state = EventState.ROUTED;
        this.selectedNode = node;
        this.routedAt = Instant.now();
    }

    public void markNoNodeAvailable(RetryReason reason, String message) {
        this.state = EventState.NO_NODE_AVAILABLE;
        this.routingFailure = reason;
        this.errorMessage = message;
    }

    public void markDispatched(int attempt) {
        this.state = EventState.DISPATCHED;
        this.attempt = attempt;
        this.dispatchedAt = Instant.now();
    }

    public void markAbandoned() {
        this.state = EventState.ABANDONED;
    }

    public void markFailed(int attempt, String message) {
        this.state = EventState.FAILED;
        this.attempt = attempt;
        this.errorMessage = message;
    }

    /**
     * Checks if processing should skip the remaining handlers.
     */
    public boolean shouldSkip() {
        return operation == null || state == EventState.ABANDONED;
    }

    @Override
    public String toString() {
        return "OperationEvent{" +
                "requestId=" + (operation != null ? operation.requestId() : "null") +
                ", state=" + state +
                ", node=" + (selectedNode != null ? selectedNode.getId() : "null") +
                ", attempt=" + attempt +
                ", seq=" + sequence +
                '}';
    }
}
