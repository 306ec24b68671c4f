package fr.lapetina.clusterclient.domain.model;

/**
 * Error taxonomy for cluster operations.
 * Every failed operation settles with exactly one of these kinds.
 */
public enum ErrorType {
    /** Caller or internal cancellation won the settlement race */
    REQUEST_CANCELED,

    /** Deadline elapsed before the operation settled */
    TIMEOUT,

    /** Target rejected by its circuit breaker */
    CIRCUIT_OPEN,

    /** No topology snapshot yet and the caller did not opt into waiting */
    TOPOLOGY_UNAVAILABLE,

    /** No node in the topology advertises the requested service */
    SERVICE_UNAVAILABLE,

    /** Connection-level error */
    TRANSPORT_FAILURE,

    /** Malformed or truncated response */
    PROTOCOL_FAILURE,

    /** The server answered with an error status */
    SERVICE_ERROR,

    /** Invalid request or configuration, reported at submission */
    CONFIGURATION_ERROR
}
