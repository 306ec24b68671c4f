package fr.lapetina.clusterclient.infrastructure.circuit;

/**
 * Admission gate for one (node, service) pair.
 *
 * States:
 * - CLOSED: requests pass, failures are counted
 * - OPEN: failures exceeded the policy's threshold, requests are rejected without dispatch
 * - HALF_OPEN: the cooldown elapsed, a single trial request is let through
 *
 * A successful trial closes the breaker, a failed one re-opens it with a
 * (possibly longer) cooldown, a cancelled one frees the trial slot.
 */
public interface CircuitBreaker {

    enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    /**
     * Checks if a request may be sent. In half-open state a {@code true} answer
     * hands out the single trial slot, so callers must dispatch and report an outcome.
     */
    boolean allowRequest();

    void recordSuccess();

    void recordFailure();

    /**
     * The admitted request was cancelled before an outcome was known.
     */
    void recordCanceled();

    State getState();

    CircuitState snapshot();

    /**
     * Forces the breaker into a state. For testing/admin use.
     */
    void forceState(State state);

    default void record(CircuitOutcome outcome) {
        switch (outcome) {
            case SUCCESS -> recordSuccess();
            case FAILURE -> recordFailure();
            case CANCELED -> recordCanceled();
        }
    }
}
