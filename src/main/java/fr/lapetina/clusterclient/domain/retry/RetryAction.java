package fr.lapetina.clusterclient.domain.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Decision produced by the retry orchestrator for one failed attempt.
 *
 * @param preserveTarget    send the retry to the same node instead of re-resolving
 * @param deadlineExhausted the retry would start at or after the deadline; settle as timeout
 */
public record RetryAction(
        Kind kind,
        Duration delay,
        boolean preserveTarget,
        boolean deadlineExhausted
) {
    public enum Kind {
        RETRY_NOW,
        RETRY_AFTER,
        RETRY_ON_NEW_TOPOLOGY,
        DO_NOT_RETRY
    }

    private static final RetryAction NOW = new RetryAction(Kind.RETRY_NOW, Duration.ZERO, false, false);
    private static final RetryAction NEVER = new RetryAction(Kind.DO_NOT_RETRY, Duration.ZERO, false, false);
    private static final RetryAction EXHAUSTED = new RetryAction(Kind.DO_NOT_RETRY, Duration.ZERO, false, true);
    private static final RetryAction NEW_TOPOLOGY =
            new RetryAction(Kind.RETRY_ON_NEW_TOPOLOGY, Duration.ZERO, false, false);

    public RetryAction {
        Objects.requireNonNull(kind, "Kind is required");
        delay = delay != null ? delay : Duration.ZERO;
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Retry delay must not be negative: " + delay);
        }
    }

    public static RetryAction retryNow() {
        return NOW;
    }

    /**
     * Retry after the given delay. A zero delay is the same as {@link #retryNow()}.
     */
    public static RetryAction retryAfter(Duration delay) {
        if (delay.isZero()) {
            return NOW;
        }
        return new RetryAction(Kind.RETRY_AFTER, delay, false, false);
    }

    public static RetryAction retryOnNewTopology() {
        return NEW_TOPOLOGY;
    }

    public static RetryAction doNotRetry() {
        return NEVER;
    }

    public static RetryAction exhausted() {
        return EXHAUSTED;
    }

    public RetryAction withPreserveTarget(boolean preserve) {
        if (preserve == preserveTarget) {
            return this;
        }
        return new RetryAction(kind, delay, preserve, deadlineExhausted);
    }

    public boolean shouldRetry() {
        return kind != Kind.DO_NOT_RETRY;
    }
}
