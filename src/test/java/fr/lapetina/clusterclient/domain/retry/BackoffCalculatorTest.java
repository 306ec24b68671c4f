package fr.lapetina.clusterclient.domain.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffCalculatorTest {

    @Test
    @DisplayName("should grow by the multiplier and stop at the ceiling")
    void shouldGrowAndCap() {
        BackoffCalculator calculator = new BackoffCalculator(Duration.ofMillis(1), Duration.ofMillis(500), 2.0, 0.0);

        assertThat(calculator.backoff(1)).isEqualTo(Duration.ofMillis(1));
        assertThat(calculator.backoff(2)).isEqualTo(Duration.ofMillis(2));
        assertThat(calculator.backoff(5)).isEqualTo(Duration.ofMillis(16));
        assertThat(calculator.backoff(20)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("should keep the jittered delay within its bounds")
    void shouldApplyJitter() {
        BackoffCalculator low = new BackoffCalculator(Duration.ofMillis(100), Duration.ofMillis(100), 1.0, 0.5, () -> 0.0);
        BackoffCalculator high = new BackoffCalculator(Duration.ofMillis(100), Duration.ofMillis(100), 1.0, 0.5, () -> 1.0);

        assertThat(low.backoff(1)).isEqualTo(Duration.ofMillis(50));
        assertThat(high.backoff(1)).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    @DisplayName("should reject a shrinking multiplier")
    void shouldRejectInvalidMultiplier() {
        assertThatThrownBy(() -> new BackoffCalculator(Duration.ofMillis(1), Duration.ofMillis(10), 0.5, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
