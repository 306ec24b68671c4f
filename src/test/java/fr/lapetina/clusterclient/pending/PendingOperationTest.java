package fr.lapetina.clusterclient.pending;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.KvCommand;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.OperationResult;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.tracing.NoopTracer;
import fr.lapetina.clusterclient.infrastructure.transport.InFlightExchange;
import fr.lapetina.clusterclient.infrastructure.transport.TransportResponse;
import fr.lapetina.clusterclient.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingOperationTest {

    private MutableClock clock;
    private AtomicInteger settledCount;
    private PendingOperation operation;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        settledCount = new AtomicInteger();
        operation = newOperation();
    }

    private PendingOperation newOperation() {
        OperationRequest request = OperationRequest.builder()
                .service(ServiceType.KEY_VALUE)
                .payload(KvCommand.of(0x00, "airline_10"))
                .deadline(clock.instant().plusSeconds(2))
                .idempotent(true)
                .build();
        return new PendingOperation(1, request, clock, NoopTracer.INSTANCE.requestSpan("operation", null),
                op -> settledCount.incrementAndGet());
    }

    private OperationResult result() {
        return new OperationResult(operation.requestId(), ServiceType.KEY_VALUE, "node-1", 1, 0,
                new byte[0], null, List.of(), Duration.ZERO);
    }

    @Test
    @DisplayName("should keep the first settlement and ignore later ones")
    void shouldSettleOnce() {
        assertThat(operation.succeed(result())).isTrue();
        assertThat(operation.cancel()).isFalse();
        assertThat(operation.timeout()).isFalse();
        assertThat(operation.fail(new OperationException(ErrorType.SERVICE_ERROR, "late"))).isFalse();

        assertThat(operation.result()).isCompleted();
        assertThat(operation.result().join().nodeId()).isEqualTo("node-1");
        assertThat(settledCount).hasValue(1);
    }

    @Test
    @DisplayName("should settle exactly once when completion, cancellation and timeout race")
    void shouldSettleOnceUnderRace() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            for (int round = 0; round < 200; round++) {
                operation = newOperation();
                settledCount.set(0);
                CountDownLatch start = new CountDownLatch(1);
                AtomicInteger winners = new AtomicInteger();
                PendingOperation current = operation;

                List<Runnable> contenders = List.of(
                        () -> { if (current.succeed(result())) winners.incrementAndGet(); },
                        () -> { if (current.cancel()) winners.incrementAndGet(); },
                        () -> { if (current.timeout()) winners.incrementAndGet(); }
                );
                CountDownLatch done = new CountDownLatch(contenders.size());
                for (Runnable contender : contenders) {
                    executor.submit(() -> {
                        try {
                            start.await();
                            contender.run();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                start.countDown();
                assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();

                assertThat(winners).hasValue(1);
                assertThat(settledCount).hasValue(1);
                assertThat(current.result()).isDone();
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("should report a cancellation as REQUEST_CANCELED")
    void shouldFailWithCanceled() {
        operation.cancel();

        assertThatThrownBy(() -> operation.result().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(OperationException.class)
                .satisfies(e -> assertThat(((OperationException) e.getCause()).getErrorType())
                        .isEqualTo(ErrorType.REQUEST_CANCELED));
    }

    @Test
    @DisplayName("should attach the last transient failure to a timeout")
    void shouldCarryLastErrorOnTimeout() {
        OperationException lastFailure = OperationException.retryable(RetryReason.NODE_OVERLOADED, "tmpfail");
        operation.recordFailure(lastFailure);

        operation.timeout();

        OperationException error = operation.getSettlementError().orElseThrow();
        assertThat(error.getErrorType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(error.getCause()).isSameAs(lastFailure);
        assertThat(operation.getRetryReasons()).containsExactly(RetryReason.NODE_OVERLOADED);
    }

    @Test
    @DisplayName("should not cancel the operation when the caller cancels its future")
    void shouldIsolateCallerFuture() {
        operation.result().cancel(true);

        assertThat(operation.isSettled()).isFalse();
        assertThat(operation.succeed(result())).isTrue();
    }

    @Nested
    @DisplayName("resource binding")
    class Binding {

        @Test
        @DisplayName("should cancel the retry timer on settlement")
        void shouldCancelRetryTimer() {
            CompletableFuture<Void> timer = new CompletableFuture<>();
            assertThat(operation.armRetry(timer)).isTrue();

            operation.cancel();

            assertThat(timer).isCancelled();
        }

        @Test
        @DisplayName("should cancel a topology wait bound after settlement")
        void shouldRejectLateTopologyWait() {
            operation.timeout();
            CompletableFuture<Void> wait = new CompletableFuture<>();

            assertThat(operation.bindTopologyWait(wait)).isFalse();
            assertThat(wait).isCancelled();
        }

        @Test
        @DisplayName("should abort the in-flight exchange when the operation fails")
        void shouldAbortExchange() {
            RecordingExchange exchange = new RecordingExchange();
            assertThat(operation.bindExchange(exchange)).isTrue();

            operation.cancel();

            assertThat(exchange.aborted).isTrue();
        }

        @Test
        @DisplayName("should leave the exchange alone on success")
        void shouldNotAbortOnSuccess() {
            RecordingExchange exchange = new RecordingExchange();
            operation.bindExchange(exchange);

            operation.succeed(result());

            assertThat(exchange.aborted).isFalse();
        }

        @Test
        @DisplayName("should abort an exchange bound after settlement")
        void shouldAbortLateExchange() {
            operation.cancel();
            RecordingExchange exchange = new RecordingExchange();

            assertThat(operation.bindExchange(exchange)).isFalse();
            assertThat(exchange.aborted).isTrue();
        }
    }

    @Test
    @DisplayName("should compute the remaining time from the clock")
    void shouldComputeRemaining() {
        clock.advance(Duration.ofMillis(1500));

        assertThat(operation.remaining()).isEqualTo(Duration.ofMillis(500));
        assertThat(operation.elapsed()).isEqualTo(Duration.ofMillis(1500));
    }

    private static final class RecordingExchange implements InFlightExchange {
        private final CompletableFuture<TransportResponse> response = new CompletableFuture<>();
        private volatile boolean aborted;

        @Override
        public CompletableFuture<TransportResponse> response() {
            return response;
        }

        @Override
        public void abort() {
            aborted = true;
        }
    }
}
