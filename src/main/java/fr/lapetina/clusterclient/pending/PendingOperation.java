package fr.lapetina.clusterclient.pending;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.OperationResult;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.tracing.RequestSpan;
import fr.lapetina.clusterclient.infrastructure.transport.InFlightExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Tracking record of one accepted operation.
 *
 * <p>Settlement is gated by a three-phase state: the first of success, failure,
 * cancellation or deadline expiry to move {@code PENDING -> SETTLING} wins, every
 * later attempt is a no-op. The winner releases everything bound to the operation
 * (deadline timer, retry timer, topology wait, in-flight exchange), moves to
 * {@code SETTLED}, deregisters, and only then completes the future.
 *
 * <p>Resources are bound with a write-then-check protocol: a resource bound
 * after settlement started is released by the binder itself.
 */
public final class PendingOperation implements OperationHandle {

    private static final Logger log = LoggerFactory.getLogger(PendingOperation.class);

    enum Phase {
        PENDING,
        SETTLING,
        SETTLED
    }

    private final long id;
    private final OperationRequest request;
    private final Clock clock;
    private final Instant acceptedAt;
    private final RequestSpan span;
    private final Consumer<PendingOperation> onSettled;

    private final CompletableFuture<OperationResult> future = new CompletableFuture<>();
    private final CompletableFuture<OperationResult> callerView = future.copy();
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.PENDING);
    private final AtomicInteger attempts = new AtomicInteger(0);
    private final List<RetryReason> retryReasons = new CopyOnWriteArrayList<>();

    private volatile Future<?> deadlineTimer;
    private volatile Future<?> retryTimer;
    private volatile Future<?> topologyWait;
    private volatile InFlightExchange exchange;
    private volatile OperationException lastError;
    private volatile OperationException settlementError;

    PendingOperation(
            long id,
            OperationRequest request,
            Clock clock,
            RequestSpan span,
            Consumer<PendingOperation> onSettled
    ) {
        this.id = id;
        this.request = request;
        this.clock = clock;
        this.acceptedAt = clock.instant();
        this.span = span;
        this.onSettled = onSettled;
        span.setAttribute("request.id", request.requestId());
        span.setAttribute("service", request.service().name());
    }

    public long getId() {
        return id;
    }

    public OperationRequest getRequest() {
        return request;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public RequestSpan getSpan() {
        return span;
    }

    @Override
    public String requestId() {
        return request.requestId();
    }

    @Override
    public CompletableFuture<OperationResult> result() {
        return callerView;
    }

    @Override
    public boolean isSettled() {
        return phase.get() != Phase.PENDING;
    }

    /**
     * Time left until the deadline; zero or negative once it passed.
     */
    public Duration remaining() {
        return Duration.between(clock.instant(), request.deadline());
    }

    public Duration elapsed() {
        return Duration.between(acceptedAt, clock.instant());
    }

    /**
     * Starts a new attempt and returns its 1-based number.
     */
    public int nextAttempt() {
        return attempts.incrementAndGet();
    }

    public int getAttempts() {
        return attempts.get();
    }

    public void recordFailure(OperationException error) {
        this.lastError = error;
        if (error.getRetryReason() != null) {
            retryReasons.add(error.getRetryReason());
        }
    }

    public List<RetryReason> getRetryReasons() {
        return List.copyOf(retryReasons);
    }

    public Optional<OperationException> getLastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Error the operation settled (or is settling) with. Empty while pending or after success.
     */
    public Optional<OperationException> getSettlementError() {
        return Optional.ofNullable(settlementError);
    }

    // Resource binding

    void armDeadline(Future<?> timer) {
        this.deadlineTimer = timer;
        if (isSettled()) {
            timer.cancel(false);
        }
    }

    /**
     * Binds the delay timer of a scheduled retry.
     *
     * @return false if the operation already settled; the timer has been cancelled
     */
    public boolean armRetry(Future<?> timer) {
        this.retryTimer = timer;
        if (isSettled()) {
            timer.cancel(false);
            return false;
        }
        return true;
    }

    /**
     * Binds a wait for a topology refresh.
     *
     * @return false if the operation already settled; the wait has been cancelled
     */
    public boolean bindTopologyWait(Future<?> wait) {
        this.topologyWait = wait;
        if (isSettled()) {
            wait.cancel(false);
            return false;
        }
        return true;
    }

    /**
     * Binds the exchange of the current attempt.
     *
     * @return false if the operation already settled; the exchange has been aborted
     */
    public boolean bindExchange(InFlightExchange exchange) {
        this.exchange = exchange;
        if (isSettled()) {
            exchange.abort();
            return false;
        }
        return true;
    }

    // Settlement

    public boolean succeed(OperationResult result) {
        return settle(result, null);
    }

    public boolean fail(OperationException error) {
        return settle(null, error);
    }

    @Override
    public boolean cancel() {
        return cancel("canceled by caller");
    }

    public boolean cancel(String reason) {
        return settle(null, new OperationException(
                ErrorType.REQUEST_CANCELED,
                "Operation " + reason + ": requestId=" + request.requestId() + ", attempts=" + attempts.get()));
    }

    /**
     * Settles as a timeout. The last transient failure, if any, becomes the cause.
     */
    public boolean timeout() {
        OperationException last = lastError;
        String message = "Operation timed out: requestId=" + request.requestId()
                + ", elapsedMs=" + elapsed().toMillis()
                + ", attempts=" + attempts.get()
                + (last != null ? ", lastError=" + last.getMessage() : "");
        return settle(null, new OperationException(ErrorType.TIMEOUT, message, last));
    }

    private boolean settle(OperationResult result, OperationException error) {
        if (!phase.compareAndSet(Phase.PENDING, Phase.SETTLING)) {
            return false;
        }
        this.settlementError = error;

        releaseResources(error != null);
        phase.set(Phase.SETTLED);

        span.setAttribute("outcome", error == null ? "success" : error.getErrorType().name());
        span.setAttribute("attempts", String.valueOf(attempts.get()));
        span.end();

        try {
            onSettled.accept(this);
        } catch (RuntimeException e) {
            log.error("Settlement listener failed: requestId={}", request.requestId(), e);
        }

        if (error == null) {
            future.complete(result);
        } else {
            future.completeExceptionally(error);
        }
        return true;
    }

    private void releaseResources(boolean abortExchange) {
        cancelTask(deadlineTimer);
        cancelTask(retryTimer);
        cancelTask(topologyWait);

        InFlightExchange current = exchange;
        if (abortExchange && current != null) {
            try {
                current.abort();
            } catch (RuntimeException e) {
                log.warn("Failed to abort exchange: requestId={}", request.requestId(), e);
            }
        }
    }

    private static void cancelTask(Future<?> f) {
        if (f != null) {
            f.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "PendingOperation{" +
                "id=" + id +
                ", requestId=" + request.requestId() +
                ", service=" + request.service() +
                ", phase=" + phase.get() +
                ", attempts=" + attempts.get() +
                '}';
    }
}
