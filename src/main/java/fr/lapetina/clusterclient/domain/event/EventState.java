package fr.lapetina.clusterclient.domain.event;

/**
 * Lifecycle state of one attempt in the Disruptor pipeline.
 */
public enum EventState {
    /** Attempt published, awaiting routing */
    CREATED,

    /** Node selected for this attempt */
    ROUTED,

    /** No node admitted (service absent or every breaker open) */
    NO_NODE_AVAILABLE,

    /** Handed to the transport */
    DISPATCHED,

    /** Operation settled before the attempt could be dispatched */
    ABANDONED,

    /** Transport rejected the attempt synchronously */
    FAILED
}
