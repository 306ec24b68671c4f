package fr.lapetina.clusterclient.pending;

import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.infrastructure.tracing.RequestTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Tracks every accepted operation until it settles.
 *
 * Registration allocates the tracking record and arms its deadline timer. An
 * operation whose deadline already passed settles as a timeout immediately,
 * before any routing or I/O. Settled operations remove themselves, so
 * {@link #size()} counts exactly the operations still pending.
 */
public final class PendingOperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(PendingOperationRegistry.class);

    private final ConcurrentHashMap<Long, PendingOperation> pending = new ConcurrentHashMap<>();
    private final List<Consumer<PendingOperation>> settlementListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong idGenerator = new AtomicLong(0);

    private final OperationTimer timer;
    private final RequestTracer tracer;
    private final Clock clock;

    public PendingOperationRegistry(OperationTimer timer, RequestTracer tracer, Clock clock) {
        this.timer = timer;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Accepts an operation and arms its deadline.
     *
     * @return the tracking record, already settled as a timeout if the deadline passed
     */
    public PendingOperation register(OperationRequest request) {
        long id = idGenerator.incrementAndGet();
        PendingOperation operation = new PendingOperation(
                id, request, clock, tracer.requestSpan("operation", null), this::onSettled);
        pending.put(id, operation);

        Duration remaining = operation.remaining();
        if (remaining.isNegative() || remaining.isZero()) {
            log.debug("Deadline already passed at submission: requestId={}, overdueMs={}",
                    request.requestId(), remaining.negated().toMillis());
            operation.timeout();
            return operation;
        }

        operation.armDeadline(timer.schedule(operation::timeout, remaining));
        log.debug("Operation registered: id={}, requestId={}, service={}, remainingMs={}",
                id, request.requestId(), request.service(), remaining.toMillis());
        return operation;
    }

    public boolean isExpired(OperationRequest request) {
        return !clock.instant().isBefore(request.deadline());
    }

    public Optional<PendingOperation> find(long id) {
        return Optional.ofNullable(pending.get(id));
    }

    /**
     * Number of operations not yet settled.
     */
    public int size() {
        return pending.size();
    }

    /**
     * Called for every settled operation, before its future completes.
     */
    public void addSettlementListener(Consumer<PendingOperation> listener) {
        settlementListeners.add(listener);
    }

    /**
     * Cancels every pending operation.
     *
     * @return number of operations this call settled
     */
    public int cancelAll(String reason) {
        List<PendingOperation> snapshot = new ArrayList<>(pending.values());
        int canceled = 0;
        for (PendingOperation operation : snapshot) {
            if (operation.cancel(reason)) {
                canceled++;
            }
        }
        if (canceled > 0) {
            log.info("Canceled pending operations: count={}, reason={}", canceled, reason);
        }
        return canceled;
    }

    public Instant now() {
        return clock.instant();
    }

    private void onSettled(PendingOperation operation) {
        pending.remove(operation.getId(), operation);
        for (Consumer<PendingOperation> listener : settlementListeners) {
            try {
                listener.accept(operation);
            } catch (Exception e) {
                log.error("Error notifying settlement listener: requestId={}", operation.requestId(), e);
            }
        }
    }
}
