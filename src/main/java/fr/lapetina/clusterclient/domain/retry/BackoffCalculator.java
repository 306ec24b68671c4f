package fr.lapetina.clusterclient.domain.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter, capped at a ceiling.
 *
 * The raw delay is {@code initial * multiplier^(attempt - 1)}, capped at {@code max}.
 * A jitter of {@code j} keeps {@code (1 - j)} of that delay and randomizes the rest.
 */
public final class BackoffCalculator {

    private final Duration initial;
    private final Duration max;
    private final double multiplier;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffCalculator(Duration initial, Duration max, double multiplier, double jitter, DoubleSupplier random) {
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1: " + multiplier);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("Jitter must be within [0, 1]: " + jitter);
        }
        this.initial = initial;
        this.max = max;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
    }

    public BackoffCalculator(Duration initial, Duration max, double multiplier, double jitter) {
        this(initial, max, multiplier, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Delay before the retry that follows the given failed attempt.
     *
     * @param attempt 1-based attempt number
     */
    public Duration backoff(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double raw = initial.toNanos() * Math.pow(multiplier, exponent);
        double capped = Math.min(raw, (double) max.toNanos());
        double jittered = capped * (1.0 - jitter) + capped * jitter * random.getAsDouble();
        return Duration.ofNanos((long) jittered);
    }

    public Duration getMax() {
        return max;
    }
}
