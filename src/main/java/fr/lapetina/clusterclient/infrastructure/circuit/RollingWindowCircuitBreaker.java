package fr.lapetina.clusterclient.infrastructure.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Breaker that opens when the failure ratio over a rolling window crosses a threshold.
 *
 * The window restarts once {@code rollingWindow} elapsed since its first outcome.
 * Nothing trips until the window counted at least {@code volumeThreshold} outcomes.
 */
public final class RollingWindowCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(RollingWindowCircuitBreaker.class);

    private final String key;
    private final int volumeThreshold;
    private final int errorThresholdPercentage;
    private final Duration rollingWindow;
    private final Duration baseCooldown;
    private final double cooldownMultiplier;
    private final Duration maxCooldown;
    private final Clock clock;

    private State state = State.CLOSED;
    private Instant windowStart;
    private long total;
    private long failed;
    private boolean trialInFlight;
    private Instant openedAt;
    private Duration cooldown;

    public RollingWindowCircuitBreaker(
            String key,
            int volumeThreshold,
            int errorThresholdPercentage,
            Duration rollingWindow,
            Duration cooldown,
            double cooldownMultiplier,
            Duration maxCooldown,
            Clock clock
    ) {
        if (errorThresholdPercentage < 1 || errorThresholdPercentage > 100) {
            throw new IllegalArgumentException("errorThresholdPercentage must be between 1 and 100");
        }
        this.key = key;
        this.volumeThreshold = Math.max(1, volumeThreshold);
        this.errorThresholdPercentage = errorThresholdPercentage;
        this.rollingWindow = rollingWindow;
        this.baseCooldown = cooldown;
        this.cooldownMultiplier = Math.max(1.0, cooldownMultiplier);
        this.maxCooldown = maxCooldown.compareTo(cooldown) < 0 ? cooldown : maxCooldown;
        this.clock = clock;
        this.cooldown = cooldown;
    }

    @Override
    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;

            case OPEN:
                if (!cooldownElapsed()) {
                    return false;
                }
                state = State.HALF_OPEN;
                log.info("Circuit breaker transitioning to HALF_OPEN: key={}", key);
                return acquireTrial();

            case HALF_OPEN:
                return acquireTrial();

            default:
                return true;
        }
    }

    @Override
    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN) {
            close();
            log.info("Circuit breaker CLOSED after successful trial: key={}", key);
            return;
        }
        if (state == State.CLOSED) {
            rollWindowIfNeeded();
            total++;
        }
    }

    @Override
    public synchronized void recordFailure() {
        if (state == State.HALF_OPEN) {
            cooldown = multiply(cooldown);
            open();
            log.warn("Circuit breaker OPENED (trial failed): key={}, cooldownMs={}", key, cooldown.toMillis());
            return;
        }
        if (state != State.CLOSED) {
            return;
        }

        rollWindowIfNeeded();
        total++;
        failed++;
        if (total >= volumeThreshold && failed * 100 >= (long) errorThresholdPercentage * total) {
            long seen = total;
            long failures = failed;
            open();
            log.warn("Circuit breaker OPENED: key={}, failures={}, total={}", key, failures, seen);
        }
    }

    @Override
    public synchronized void recordCanceled() {
        if (state == State.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    @Override
    public synchronized State getState() {
        if (state == State.OPEN && cooldownElapsed()) {
            return State.HALF_OPEN;
        }
        return state;
    }

    @Override
    public synchronized CircuitState snapshot() {
        State current = getState();
        Instant nextTrialAt = current == State.OPEN ? openedAt.plus(cooldown) : null;
        return new CircuitState(current, failed, total, nextTrialAt, cooldown);
    }

    @Override
    public synchronized void forceState(State newState) {
        State old = state;
        if (newState == State.CLOSED) {
            close();
        } else if (newState == State.OPEN) {
            open();
        } else {
            state = newState;
            trialInFlight = false;
        }
        log.info("Circuit breaker forced from {} to {}: key={}", old, newState, key);
    }

    public String getKey() {
        return key;
    }

    private boolean acquireTrial() {
        if (trialInFlight) {
            return false;
        }
        trialInFlight = true;
        return true;
    }

    private void open() {
        state = State.OPEN;
        openedAt = clock.instant();
        trialInFlight = false;
        resetWindow();
    }

    private void close() {
        state = State.CLOSED;
        cooldown = baseCooldown;
        trialInFlight = false;
        resetWindow();
    }

    private void rollWindowIfNeeded() {
        Instant now = clock.instant();
        if (windowStart == null || !now.isBefore(windowStart.plus(rollingWindow))) {
            windowStart = now;
            total = 0;
            failed = 0;
        }
    }

    private void resetWindow() {
        windowStart = null;
        total = 0;
        failed = 0;
    }

    private boolean cooldownElapsed() {
        return openedAt == null || !clock.instant().isBefore(openedAt.plus(cooldown));
    }

    private Duration multiply(Duration current) {
        Duration next = Duration.ofMillis((long) Math.ceil(current.toMillis() * cooldownMultiplier));
        return next.compareTo(maxCooldown) > 0 ? maxCooldown : next;
    }

    @Override
    public synchronized String toString() {
        return "RollingWindowCircuitBreaker{" +
                "key='" + key + '\'' +
                ", state=" + state +
                ", failed=" + failed +
                ", total=" + total +
                '}';
    }
}
