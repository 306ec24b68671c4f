package fr.lapetina.clusterclient.infrastructure.circuit;

/**
 * Outcome of an admitted attempt, as seen by the breaker.
 */
public enum CircuitOutcome {
    /** The node answered, whatever the answer */
    SUCCESS,

    /** Transport or protocol failure, or the deadline expired while in flight */
    FAILURE,

    /** The caller cancelled; says nothing about the node */
    CANCELED
}
