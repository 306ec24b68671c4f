package fr.lapetina.clusterclient.domain.retry;

import fr.lapetina.clusterclient.domain.model.ErrorType;

/**
 * Classification attached to every failed attempt.
 *
 * Each reason carries three pieces of policy data:
 * <ul>
 *   <li>{@code allowsNonIdempotentRetry}: the request provably did not take effect,
 *       so even a non-idempotent operation may be sent again</li>
 *   <li>{@code alwaysRetry}: retried regardless of the configured strategy</li>
 *   <li>{@code implicatesNode}: the failure is a property of the target node, so a
 *       retry must not stick to it</li>
 * </ul>
 */
public enum RetryReason {
    /** No connection to the node could be established */
    SOCKET_NOT_AVAILABLE(true, false, true, ErrorType.TRANSPORT_FAILURE),

    /** The node is not part of the current topology any more */
    NODE_NOT_AVAILABLE(true, false, true, ErrorType.SERVICE_UNAVAILABLE),

    /** No node currently serves the requested service */
    SERVICE_NOT_AVAILABLE(true, false, false, ErrorType.SERVICE_UNAVAILABLE),

    /** Every candidate node is behind an open circuit breaker */
    CIRCUIT_BREAKER_OPEN(true, false, true, ErrorType.CIRCUIT_OPEN),

    /** The request could not be queued locally */
    PIPELINE_SATURATED(true, true, false, ErrorType.TRANSPORT_FAILURE),

    /** The node is not responsible for the request in its current configuration */
    TOPOLOGY_STALE(true, true, true, ErrorType.SERVICE_ERROR),

    /** The node asked the client to back off */
    NODE_OVERLOADED(true, false, true, ErrorType.SERVICE_ERROR),

    /** The connection dropped after the request was written */
    SOCKET_CLOSED_WHILE_IN_FLIGHT(false, false, true, ErrorType.TRANSPORT_FAILURE),

    /** The node sent a response that could not be decoded */
    MALFORMED_RESPONSE(false, false, true, ErrorType.PROTOCOL_FAILURE),

    /** Another mutation holds the document; the request was rejected */
    CONFLICT_IN_PROGRESS(true, false, false, ErrorType.SERVICE_ERROR);

    private final boolean allowsNonIdempotentRetry;
    private final boolean alwaysRetry;
    private final boolean implicatesNode;
    private final ErrorType errorType;

    RetryReason(boolean allowsNonIdempotentRetry, boolean alwaysRetry, boolean implicatesNode, ErrorType errorType) {
        this.allowsNonIdempotentRetry = allowsNonIdempotentRetry;
        this.alwaysRetry = alwaysRetry;
        this.implicatesNode = implicatesNode;
        this.errorType = errorType;
    }

    public boolean allowsNonIdempotentRetry() {
        return allowsNonIdempotentRetry;
    }

    public boolean alwaysRetry() {
        return alwaysRetry;
    }

    public boolean implicatesNode() {
        return implicatesNode;
    }

    /**
     * Error kind reported when a failure with this reason is not retried.
     */
    public ErrorType errorType() {
        return errorType;
    }
}
