package fr.lapetina.clusterclient.infrastructure.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Forward-only, non-restartable sequence of decoded rows.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RowReader rows = result.rows()) {
 *     Optional<byte[]> row;
 *     while ((row = rows.next()).isPresent()) {
 *         handle(row.get());
 *     }
 *     rows.err().ifPresent(e -> { throw e; });
 * }
 * }</pre>
 *
 * The buffer is bounded: once it holds {@code capacity} rows the upstream is
 * not asked for more body until the consumer has caught up. A failing stream
 * still yields the rows decoded before the failure; callers must check
 * {@link #err()} after end of stream.
 */
public final class RowReader implements RowSink, AutoCloseable {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Source of body chunks, typically an HTTP response subscription.
     */
    public interface Upstream {
        void request(long n);

        void cancel();
    }

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<byte[]> rows = new ArrayDeque<>();

    private Upstream upstream;
    private boolean finished;
    private boolean closed;
    private boolean demandPending;
    private OperationException error;
    private byte[] metadata;

    public RowReader(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Row buffer capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * Attaches the body source. Cancels it right away if the reader was already closed.
     */
    public void bindUpstream(Upstream upstream) {
        boolean cancel;
        lock.lock();
        try {
            this.upstream = upstream;
            cancel = closed;
        } finally {
            lock.unlock();
        }
        if (cancel) {
            upstream.cancel();
        }
    }

    /**
     * Asks the upstream for the next chunk, or defers the request until the
     * consumer drained the buffer below capacity.
     */
    public void requestMore() {
        Upstream target = null;
        lock.lock();
        try {
            if (finished || closed) {
                return;
            }
            if (rows.size() < capacity) {
                target = upstream;
            } else {
                demandPending = true;
            }
        } finally {
            lock.unlock();
        }
        if (target != null) {
            target.request(1);
        }
    }

    /**
     * Returns the next row, blocking until one is decoded or the stream ends.
     * Empty means end of stream; every later call returns empty as well.
     *
     * @throws OperationException with {@link ErrorType#REQUEST_CANCELED} if the thread is interrupted
     */
    public Optional<byte[]> next() {
        byte[] row;
        Upstream resume = null;
        lock.lock();
        try {
            while (rows.isEmpty() && !finished) {
                changed.await();
            }
            row = rows.poll();
            if (row != null && demandPending && rows.size() < capacity) {
                demandPending = false;
                resume = upstream;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationException(ErrorType.REQUEST_CANCELED, "Interrupted while waiting for rows", e);
        } finally {
            lock.unlock();
        }
        if (resume != null) {
            resume.request(1);
        }
        return Optional.ofNullable(row);
    }

    /**
     * Terminal error of the stream. Only meaningful once {@link #next()} returned empty.
     */
    public Optional<OperationException> err() {
        lock.lock();
        try {
            return finished ? Optional.ofNullable(error) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-row fields of the response (metrics, status, signature...) once the stream completed cleanly.
     */
    public Optional<JsonNode> metadata() {
        byte[] raw;
        lock.lock();
        try {
            raw = metadata;
        } finally {
            lock.unlock();
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readTree(raw));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read response metadata", e);
        }
    }

    public boolean isFinished() {
        lock.lock();
        try {
            return finished;
        } finally {
            lock.unlock();
        }
    }

    public int bufferedRows() {
        lock.lock();
        try {
            return rows.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onRow(byte[] row) {
        lock.lock();
        try {
            if (finished) {
                return;
            }
            rows.add(row);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onComplete(byte[] metadata) {
        lock.lock();
        try {
            if (finished) {
                return;
            }
            this.metadata = metadata;
            finished = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onError(OperationException error) {
        lock.lock();
        try {
            if (finished) {
                return;
            }
            this.error = error;
            finished = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the stream. Buffered rows are dropped and the upstream is cancelled
     * if the body was still being received.
     */
    @Override
    public void close() {
        Upstream cancel = null;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (!finished) {
                finished = true;
                cancel = upstream;
            }
            rows.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (cancel != null) {
            cancel.cancel();
        }
    }
}
