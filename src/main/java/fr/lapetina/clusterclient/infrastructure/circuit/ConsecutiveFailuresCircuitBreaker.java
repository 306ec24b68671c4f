package fr.lapetina.clusterclient.infrastructure.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Breaker that opens after a fixed number of consecutive failures.
 *
 * Each failed trial multiplies the cooldown by {@code cooldownMultiplier}, up to
 * {@code maxCooldown}. Closing the breaker resets the cooldown.
 *
 * Thread-safe via atomic operations.
 */
public final class ConsecutiveFailuresCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailuresCircuitBreaker.class);

    private final String key;
    private final int failureThreshold;
    private final Duration baseCooldown;
    private final double cooldownMultiplier;
    private final Duration maxCooldown;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicBoolean trialInFlight = new AtomicBoolean(false);
    private volatile Instant openedAt;
    private volatile Duration cooldown;

    public ConsecutiveFailuresCircuitBreaker(
            String key,
            int failureThreshold,
            Duration cooldown,
            double cooldownMultiplier,
            Duration maxCooldown,
            Clock clock
    ) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.key = key;
        this.failureThreshold = failureThreshold;
        this.baseCooldown = cooldown;
        this.cooldownMultiplier = Math.max(1.0, cooldownMultiplier);
        this.maxCooldown = maxCooldown.compareTo(cooldown) < 0 ? cooldown : maxCooldown;
        this.clock = clock;
        this.cooldown = cooldown;
    }

    public ConsecutiveFailuresCircuitBreaker(String key, int failureThreshold, Duration cooldown, Clock clock) {
        this(key, failureThreshold, cooldown, 1.0, cooldown, clock);
    }

    @Override
    public boolean allowRequest() {
        switch (state.get()) {
            case CLOSED:
                return true;

            case OPEN:
                if (!cooldownElapsed()) {
                    return false;
                }
                if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                    log.info("Circuit breaker transitioning to HALF_OPEN: key={}", key);
                }
                return trialInFlight.compareAndSet(false, true);

            case HALF_OPEN:
                return trialInFlight.compareAndSet(false, true);

            default:
                return true;
        }
    }

    @Override
    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.CLOSED) {
            failureCount.set(0);
            return;
        }

        if (currentState == State.HALF_OPEN && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            failureCount.set(0);
            cooldown = baseCooldown;
            trialInFlight.set(false);
            log.info("Circuit breaker CLOSED after successful trial: key={}", key);
        }
    }

    @Override
    public void recordFailure() {
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            Duration next = multiply(cooldown);
            openedAt = clock.instant();
            cooldown = next;
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                log.warn("Circuit breaker OPENED (trial failed): key={}, cooldownMs={}", key, next.toMillis());
            }
            trialInFlight.set(false);
            return;
        }

        if (currentState == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold) {
                openedAt = clock.instant();
                if (state.compareAndSet(State.CLOSED, State.OPEN)) {
                    log.warn("Circuit breaker OPENED: key={}, failures={}", key, failures);
                }
            }
        }
    }

    @Override
    public void recordCanceled() {
        if (state.get() == State.HALF_OPEN) {
            trialInFlight.set(false);
        }
    }

    /**
     * Reports HALF_OPEN once the cooldown of an open breaker elapsed, without transitioning.
     */
    @Override
    public State getState() {
        State current = state.get();
        if (current == State.OPEN && cooldownElapsed()) {
            return State.HALF_OPEN;
        }
        return current;
    }

    @Override
    public CircuitState snapshot() {
        State current = getState();
        Instant opened = openedAt;
        Duration currentCooldown = cooldown;
        Instant nextTrialAt = current == State.OPEN && opened != null ? opened.plus(currentCooldown) : null;
        int failures = failureCount.get();
        return new CircuitState(current, failures, failures, nextTrialAt, currentCooldown);
    }

    @Override
    public void forceState(State newState) {
        State old = state.getAndSet(newState);
        trialInFlight.set(false);
        if (newState == State.CLOSED) {
            failureCount.set(0);
            cooldown = baseCooldown;
        }
        if (newState == State.OPEN) {
            openedAt = clock.instant();
        }
        log.info("Circuit breaker forced from {} to {}: key={}", old, newState, key);
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public String getKey() {
        return key;
    }

    private boolean cooldownElapsed() {
        Instant opened = openedAt;
        return opened == null || !clock.instant().isBefore(opened.plus(cooldown));
    }

    private Duration multiply(Duration current) {
        long nextMs = (long) Math.ceil(current.toMillis() * cooldownMultiplier);
        Duration next = Duration.ofMillis(nextMs);
        return next.compareTo(maxCooldown) > 0 ? maxCooldown : next;
    }

    @Override
    public String toString() {
        return "ConsecutiveFailuresCircuitBreaker{" +
                "key='" + key + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
