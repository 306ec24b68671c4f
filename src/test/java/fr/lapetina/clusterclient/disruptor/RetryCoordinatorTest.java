package fr.lapetina.clusterclient.disruptor;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.KvCommand;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.domain.retry.BackoffCalculator;
import fr.lapetina.clusterclient.domain.retry.BestEffortRetryStrategy;
import fr.lapetina.clusterclient.domain.retry.RetryOrchestrator;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.domain.strategy.RoundRobinStrategy;
import fr.lapetina.clusterclient.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.clusterclient.infrastructure.topology.TopologyManager;
import fr.lapetina.clusterclient.infrastructure.topology.TopologyProvider;
import fr.lapetina.clusterclient.infrastructure.tracing.NoopTracer;
import fr.lapetina.clusterclient.pending.OperationTimer;
import fr.lapetina.clusterclient.pending.PendingOperation;
import fr.lapetina.clusterclient.pending.PendingOperationRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class RetryCoordinatorTest {

    private OperationTimer timer;
    private PendingOperationRegistry registry;
    private TopologyManager topologyManager;
    private MetricsRegistry metricsRegistry;
    private final List<String> published = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        timer = new OperationTimer("retry-test-timer");
        registry = new PendingOperationRegistry(timer, NoopTracer.INSTANCE, Clock.systemUTC());
        // Polls never answer, so refresh waiters stay pending until the operation lets go of them
        topologyManager = new TopologyManager(
                List.of(new TopologyProvider() {
                    @Override
                    public String getName() {
                        return "silent";
                    }

                    @Override
                    public CompletableFuture<TopologySnapshot> fetch(TopologySnapshot current) {
                        return new CompletableFuture<>();
                    }
                }),
                new RoundRobinStrategy(), Duration.ofHours(1), Duration.ofMinutes(1), Duration.ZERO);
        metricsRegistry = new MetricsRegistry("retry_test", false);
    }

    @AfterEach
    void tearDown() {
        registry.cancelAll("test finished");
        topologyManager.close();
        metricsRegistry.close();
        timer.close();
    }

    private RetryCoordinator coordinator(Duration backoff) {
        RetryOrchestrator orchestrator = new RetryOrchestrator(
                new BestEffortRetryStrategy(new BackoffCalculator(backoff, backoff, 1.0, 0.0)));
        return new RetryCoordinator(orchestrator, timer, topologyManager, metricsRegistry,
                (operation, preferred, avoid) -> published.add(preferred + "/" + avoid));
    }

    private PendingOperation register(Duration timeout) {
        return registry.register(OperationRequest.kv(KvCommand.of(0x00, "route_5"), timeout));
    }

    private static OperationException transientFailure() {
        return OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE, "connection refused");
    }

    @Test
    @DisplayName("should re-publish at once away from the failed node")
    void shouldRetryNow() {
        PendingOperation operation = register(Duration.ofSeconds(5));

        coordinator(Duration.ZERO).onAttemptFailed(operation, "node-1", transientFailure());

        assertThat(published).containsExactly("null/node-1");
        assertThat(operation.isSettled()).isFalse();
        assertThat(operation.getRetryReasons()).containsExactly(RetryReason.SOCKET_NOT_AVAILABLE);
    }

    @Test
    @DisplayName("should fail with the error itself when it cannot be retried")
    void shouldFailTerminalError() {
        PendingOperation operation = register(Duration.ofSeconds(5));
        OperationException error = new OperationException(ErrorType.SERVICE_ERROR, "document not found");

        coordinator(Duration.ZERO).onAttemptFailed(operation, "node-1", error);

        assertThat(operation.getSettlementError()).containsSame(error);
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("should settle as timeout with the last failure as cause when no retry fits before the deadline")
    void shouldTimeOutWhenDeadlineExhausted() {
        PendingOperation operation = register(Duration.ofMillis(50));
        OperationException error = transientFailure();

        coordinator(Duration.ofMillis(80)).onAttemptFailed(operation, "node-1", error);

        assertThat(operation.getSettlementError()).hasValueSatisfying(settled -> {
            assertThat(settled.getErrorType()).isEqualTo(ErrorType.TIMEOUT);
            assertThat(settled.getCause()).isSameAs(error);
        });
        assertThat(operation.result()).isCompletedExceptionally();
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("should ignore failures of an operation that already settled")
    void shouldIgnoreSettled() {
        PendingOperation operation = register(Duration.ofSeconds(5));
        operation.cancel();

        coordinator(Duration.ZERO).onAttemptFailed(operation, "node-1", transientFailure());

        assertThat(published).isEmpty();
        assertThat(operation.getSettlementError()).map(OperationException::getErrorType)
                .contains(ErrorType.REQUEST_CANCELED);
    }

    @Nested
    @DisplayName("pending retries")
    class PendingRetries {

        @Test
        @DisplayName("should drop the retry timer when the operation is cancelled")
        void shouldCancelDelayedRetry() {
            PendingOperation operation = register(Duration.ofMinutes(1));
            int withDeadline = timer.scheduledTaskCount();

            coordinator(Duration.ofSeconds(10)).onAttemptFailed(operation, "node-1", transientFailure());
            assertThat(timer.scheduledTaskCount()).isEqualTo(withDeadline + 1);

            operation.cancel();

            assertThat(timer.scheduledTaskCount()).isZero();
            assertThat(published).isEmpty();
        }

        @Test
        @DisplayName("should drop the topology wait when the operation is cancelled")
        void shouldCancelTopologyWait() {
            topologyManager.start();
            PendingOperation operation = register(Duration.ofMinutes(1));

            coordinator(Duration.ZERO).onAttemptFailed(operation, "node-1",
                    OperationException.retryable(RetryReason.TOPOLOGY_STALE, "not my vbucket"));
            assertThat(topologyManager.waiterCount()).isEqualTo(1);
            assertThat(published).isEmpty();

            operation.cancel();

            assertThat(topologyManager.waiterCount()).isZero();
            assertThat(published).isEmpty();
        }

        @Test
        @DisplayName("should fail the operation at once when the topology manager is stopped")
        void shouldNotWaitOnStoppedManager() {
            PendingOperation operation = register(Duration.ofMinutes(1));

            coordinator(Duration.ZERO).onAttemptFailed(operation, "node-1",
                    OperationException.retryable(RetryReason.TOPOLOGY_STALE, "not my vbucket"));

            assertThat(operation.getSettlementError()).map(OperationException::getErrorType)
                    .contains(ErrorType.TOPOLOGY_UNAVAILABLE);
            assertThat(topologyManager.waiterCount()).isZero();
            assertThat(published).isEmpty();
        }
    }
}
