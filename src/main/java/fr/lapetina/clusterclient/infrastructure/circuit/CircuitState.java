package fr.lapetina.clusterclient.infrastructure.circuit;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a breaker.
 *
 * @param failures    failures counted by the policy in the current window
 * @param total       outcomes counted by the policy in the current window
 * @param nextTrialAt earliest trial time while open, null otherwise
 * @param cooldown    cooldown applied the last time the breaker opened
 */
public record CircuitState(
        CircuitBreaker.State state,
        long failures,
        long total,
        Instant nextTrialAt,
        Duration cooldown
) {
}
