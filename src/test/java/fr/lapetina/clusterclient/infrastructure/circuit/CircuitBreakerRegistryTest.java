package fr.lapetina.clusterclient.infrastructure.circuit;

import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.infrastructure.config.ClientConfig;
import fr.lapetina.clusterclient.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerRegistryTest {

    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        ClientConfig.CircuitBreakerConfig config = new ClientConfig.CircuitBreakerConfig();
        config.setFailureThreshold(2);
        config.setSleepWindowMs(1000);
        registry = CircuitBreakerRegistry.fromConfig(config, new MutableClock());
    }

    @Test
    @DisplayName("should keep one breaker per node and service")
    void shouldIsolateNodeAndService() {
        registry.allow("node-1", ServiceType.KEY_VALUE);
        registry.report("node-1", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);
        registry.report("node-1", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);

        assertThat(registry.allow("node-1", ServiceType.KEY_VALUE)).isFalse();
        assertThat(registry.allow("node-1", ServiceType.QUERY)).isTrue();
        assertThat(registry.allow("node-2", ServiceType.KEY_VALUE)).isTrue();
        assertThat(registry.state("node-1", ServiceType.KEY_VALUE)).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("should count server responses as successes")
    void shouldResetOnSuccess() {
        registry.allow("node-1", ServiceType.KEY_VALUE);
        registry.report("node-1", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);
        registry.report("node-1", ServiceType.KEY_VALUE, CircuitOutcome.SUCCESS);
        registry.report("node-1", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);

        assertThat(registry.allow("node-1", ServiceType.KEY_VALUE)).isTrue();
    }

    @Test
    @DisplayName("should track outcomes reported before any admission check")
    void shouldTrackOutcomesWithoutPriorAdmission() {
        registry.report("node-3", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);
        registry.report("node-3", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);

        assertThat(registry.find("node-3", ServiceType.KEY_VALUE)).isPresent();
        assertThat(registry.state("node-3", ServiceType.KEY_VALUE)).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(registry.allow("node-3", ServiceType.KEY_VALUE)).isFalse();
    }

    @Test
    @DisplayName("should track outcomes of a breaker dropped after admission")
    void shouldTrackOutcomesAfterDrop() {
        registry.allow("node-2", ServiceType.KEY_VALUE);
        registry.retainNodes(Set.of("node-1"));

        registry.report("node-2", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);

        assertThat(registry.find("node-2", ServiceType.KEY_VALUE)).isPresent();
    }

    @Test
    @DisplayName("should drop breakers of nodes that left the topology")
    void shouldRetainOnlyCurrentNodes() {
        registry.allow("node-1", ServiceType.KEY_VALUE);
        registry.allow("node-2", ServiceType.KEY_VALUE);
        registry.allow("node-2", ServiceType.QUERY);

        registry.retainNodes(Set.of("node-1"));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.find("node-2", ServiceType.QUERY)).isEmpty();
        assertThat(registry.snapshot()).containsOnlyKeys(new CircuitKey("node-1", ServiceType.KEY_VALUE));
    }

    @Test
    @DisplayName("should always allow when disabled")
    void shouldAlwaysAllowWhenDisabled() {
        CircuitBreakerRegistry disabled = CircuitBreakerRegistry.disabled();

        disabled.report("node-1", ServiceType.KEY_VALUE, CircuitOutcome.FAILURE);

        assertThat(disabled.allow("node-1", ServiceType.KEY_VALUE)).isTrue();
        assertThat(disabled.size()).isZero();
        assertThat(disabled.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("should build rolling window breakers when configured")
    void shouldBuildRollingWindowBreakers() {
        ClientConfig.CircuitBreakerConfig config = new ClientConfig.CircuitBreakerConfig();
        config.setType("rolling-window");
        CircuitBreakerRegistry rolling = CircuitBreakerRegistry.fromConfig(config, new MutableClock());

        rolling.allow("node-1", ServiceType.SEARCH);

        assertThat(rolling.find("node-1", ServiceType.SEARCH)).containsInstanceOf(RollingWindowCircuitBreaker.class);
    }
}
