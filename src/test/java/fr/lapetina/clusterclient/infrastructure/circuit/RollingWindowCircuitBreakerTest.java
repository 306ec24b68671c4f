package fr.lapetina.clusterclient.infrastructure.circuit;

import fr.lapetina.clusterclient.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollingWindowCircuitBreakerTest {

    private MutableClock clock;
    private RollingWindowCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        // 4 outcomes minimum, 50% failures, 1s window, 100ms cooldown
        breaker = new RollingWindowCircuitBreaker(
                "node-1/kv", 4, 50, Duration.ofSeconds(1), Duration.ofMillis(100), 1.0, Duration.ofMillis(100), clock);
    }

    @Test
    @DisplayName("should not open below the volume threshold")
    void shouldNotOpenBelowVolume() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.snapshot().total()).isEqualTo(3);
    }

    @Test
    @DisplayName("should open once the failure ratio reaches the threshold")
    void shouldOpenOnFailureRatio() {
        breaker.recordSuccess();
        breaker.recordSuccess();
        breaker.recordFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.allowRequest()).isFalse();
    }

    @Test
    @DisplayName("should forget outcomes older than the rolling window")
    void shouldRollWindow() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();

        clock.advance(Duration.ofSeconds(1));
        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.snapshot().total()).isEqualTo(1);
    }

    @Test
    @DisplayName("should close after a successful trial")
    void shouldCloseAfterTrial() {
        breaker.forceState(CircuitBreaker.State.OPEN);
        clock.advance(Duration.ofMillis(100));

        assertThat(breaker.allowRequest()).isTrue();
        assertThat(breaker.allowRequest()).isFalse();
        breaker.recordSuccess();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.snapshot().total()).isZero();
    }

    @Test
    @DisplayName("should reject an out of range percentage")
    void shouldRejectInvalidPercentage() {
        assertThatThrownBy(() -> new RollingWindowCircuitBreaker(
                "k", 1, 0, Duration.ofSeconds(1), Duration.ofMillis(1), 1.0, Duration.ofMillis(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
