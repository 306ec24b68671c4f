package fr.lapetina.clusterclient.domain.retry;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.HttpCommand;
import fr.lapetina.clusterclient.domain.model.KvCommand;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryOrchestratorTest {

    private MutableClock clock;
    private RetryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        BackoffCalculator backoff = new BackoffCalculator(Duration.ofMillis(10), Duration.ofMillis(80), 2.0, 0.0);
        orchestrator = new RetryOrchestrator(new BestEffortRetryStrategy(backoff), clock);
    }

    private OperationRequest request(Duration timeout, boolean idempotent) {
        return OperationRequest.builder()
                .service(ServiceType.KEY_VALUE)
                .payload(KvCommand.of(0x00, "doc"))
                .deadline(clock.instant().plus(timeout))
                .idempotent(idempotent)
                .build();
    }

    @Test
    @DisplayName("should back off exponentially for transient failures")
    void shouldBackOffExponentially() {
        OperationRequest request = request(Duration.ofSeconds(10), true);
        OperationException error = OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE, "refused");

        RetryAction first = orchestrator.classify(request, 1, error);
        RetryAction third = orchestrator.classify(request, 3, error);
        RetryAction tenth = orchestrator.classify(request, 10, error);

        assertThat(first.kind()).isEqualTo(RetryAction.Kind.RETRY_AFTER);
        assertThat(first.delay()).isEqualTo(Duration.ofMillis(10));
        assertThat(third.delay()).isEqualTo(Duration.ofMillis(40));
        assertThat(tenth.delay()).isEqualTo(Duration.ofMillis(80));
    }

    @Test
    @DisplayName("should not retry failures without a retry reason")
    void shouldNotRetryTerminalFailures() {
        OperationException error = new OperationException(ErrorType.SERVICE_ERROR, "key not found");

        RetryAction action = orchestrator.classify(request(Duration.ofSeconds(10), true), 1, error);

        assertThat(action.shouldRetry()).isFalse();
        assertThat(action.deadlineExhausted()).isFalse();
    }

    @Test
    @DisplayName("should settle as timeout when the backoff would end after the deadline")
    void shouldStopAtDeadline() {
        // 50 ms left, the strategy asks for 80 ms
        OperationRequest request = request(Duration.ofMillis(50), true);
        OperationException error = OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE, "refused");

        RetryAction action = orchestrator.classify(request, 4, error);

        assertThat(action.shouldRetry()).isFalse();
        assertThat(action.deadlineExhausted()).isTrue();
    }

    @Test
    @DisplayName("should treat a retry starting exactly at the deadline as exhausted")
    void shouldExhaustAtDeadline() {
        OperationRequest request = request(Duration.ofMillis(10), true);

        RetryAction action = orchestrator.classify(request, 1,
                OperationException.retryable(RetryReason.NODE_OVERLOADED, "busy"));

        assertThat(action.deadlineExhausted()).isTrue();
    }

    @Test
    @DisplayName("should build an exhausted action that never retries")
    void shouldBuildExhaustedAction() {
        RetryAction action = RetryAction.exhausted();

        assertThat(action.deadlineExhausted()).isTrue();
        assertThat(action.shouldRetry()).isFalse();
        assertThat(action.kind()).isEqualTo(RetryAction.doNotRetry().kind());
    }

    @Nested
    @DisplayName("non-idempotent requests")
    class NonIdempotent {

        @Test
        @DisplayName("should not retry when the request may have taken effect")
        void shouldNotRetryAmbiguousFailure() {
            OperationException error = OperationException.retryable(
                    RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT, "connection reset");

            RetryAction action = orchestrator.classify(request(Duration.ofSeconds(10), false), 1, error);

            assertThat(action.shouldRetry()).isFalse();
        }

        @Test
        @DisplayName("should retry when the request was never sent")
        void shouldRetryWhenNeverSent() {
            OperationException error = OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE, "refused");

            RetryAction action = orchestrator.classify(request(Duration.ofSeconds(10), false), 1, error);

            assertThat(action.shouldRetry()).isTrue();
        }
    }

    @Nested
    @DisplayName("reasons that always retry")
    class AlwaysRetry {

        @BeforeEach
        void useFailFast() {
            orchestrator = new RetryOrchestrator(new FailFastRetryStrategy(), clock);
        }

        @Test
        @DisplayName("should wait for a new topology on a stale routing table")
        void shouldWaitForTopology() {
            RetryAction action = orchestrator.classify(request(Duration.ofSeconds(10), true), 1,
                    OperationException.retryable(RetryReason.TOPOLOGY_STALE, "not my vbucket"));

            assertThat(action.kind()).isEqualTo(RetryAction.Kind.RETRY_ON_NEW_TOPOLOGY);
            assertThat(action.preserveTarget()).isFalse();
        }

        @Test
        @DisplayName("should follow the controlled backoff schedule on local saturation")
        void shouldUseControlledBackoff() {
            OperationException error = OperationException.retryable(RetryReason.PIPELINE_SATURATED, "full");
            OperationRequest request = request(Duration.ofSeconds(10), true);

            assertThat(orchestrator.classify(request, 1, error).delay()).isEqualTo(Duration.ofMillis(1));
            assertThat(orchestrator.classify(request, 2, error).delay()).isEqualTo(Duration.ofMillis(10));
            assertThat(orchestrator.classify(request, 3, error).delay()).isEqualTo(Duration.ofMillis(50));
            assertThat(orchestrator.classify(request, 6, error).delay()).isEqualTo(Duration.ofMillis(1000));
            assertThat(orchestrator.classify(request, 42, error).delay()).isEqualTo(Duration.ofMillis(1000));
        }

        @Test
        @DisplayName("should let fail-fast give up on ordinary transient failures")
        void shouldGiveUpOtherwise() {
            RetryAction action = orchestrator.classify(request(Duration.ofSeconds(10), true), 1,
                    OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE, "refused"));

            assertThat(action.shouldRetry()).isFalse();
        }
    }

    @Nested
    @DisplayName("target preservation")
    class PreserveTarget {

        @BeforeEach
        void preserveTargets() {
            BackoffCalculator backoff = new BackoffCalculator(Duration.ofMillis(1), Duration.ofMillis(1), 1.0, 0.0);
            orchestrator = new RetryOrchestrator(new BestEffortRetryStrategy(backoff, true), clock);
        }

        @Test
        @DisplayName("should keep the target when the failure is not the node's fault")
        void shouldKeepTarget() {
            RetryAction action = orchestrator.classify(request(Duration.ofSeconds(10), true), 1,
                    OperationException.retryable(RetryReason.CONFLICT_IN_PROGRESS, "locked"));

            assertThat(action.preserveTarget()).isTrue();
        }

        @Test
        @DisplayName("should re-resolve the target when the failure implicates the node")
        void shouldDropTarget() {
            RetryAction action = orchestrator.classify(request(Duration.ofSeconds(10), true), 1,
                    OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE, "refused"));

            assertThat(action.preserveTarget()).isFalse();
        }
    }

    @Test
    @DisplayName("should prefer the request's own strategy over the default")
    void shouldUseRequestStrategy() {
        OperationRequest request = OperationRequest.builder()
                .service(ServiceType.QUERY)
                .payload(HttpCommand.get("/query/service"))
                .deadline(clock.instant().plusSeconds(10))
                .retryStrategy(new FailFastRetryStrategy())
                .build();

        RetryAction action = orchestrator.classify(request, 1,
                OperationException.retryable(RetryReason.SERVICE_NOT_AVAILABLE, "no query node"));

        assertThat(action.shouldRetry()).isFalse();
    }
}
