package fr.lapetina.clusterclient.disruptor;

import fr.lapetina.clusterclient.pending.PendingOperation;

/**
 * Publishes the next attempt of an already accepted operation.
 */
@FunctionalInterface
public interface AttemptPublisher {

    /**
     * @param preferredNodeId node to try first, null to let the strategy choose
     * @param avoidNodeId     node that failed the previous attempt, null for none
     */
    void publishAttempt(PendingOperation operation, String preferredNodeId, String avoidNodeId);
}
