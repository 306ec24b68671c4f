package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One multiplexed binary protocol connection.
 *
 * Requests are correlated to responses by their opaque value. Writes are
 * serialized through a queue, reads run as a continuous completion-handler loop,
 * so no thread is held per request. Cancelling the future returned by
 * {@link #send(BinaryFrame)} deregisters the request; a response arriving
 * afterwards is dropped as orphaned and the connection stays usable.
 */
public final class BinaryConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BinaryConnection.class);

    private static final int READ_BUFFER_SIZE = 16 * 1024;

    private final AsynchronousSocketChannel channel;
    private final String endpoint;
    private final ConcurrentHashMap<Integer, CompletableFuture<BinaryFrame>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger opaqueGenerator = new AtomicInteger(0);
    private final Queue<ByteBuffer> writeQueue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean writing = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger orphaned = new AtomicInteger(0);

    private ByteBuffer readBuffer = ByteBuffer.allocate(READ_BUFFER_SIZE);

    BinaryConnection(AsynchronousSocketChannel channel, String endpoint) {
        this.channel = channel;
        this.endpoint = endpoint;
    }

    /**
     * Opens a connection and starts its read loop.
     * Fails with SOCKET_NOT_AVAILABLE if the endpoint cannot be reached in time.
     */
    public static CompletableFuture<BinaryConnection> connect(String hostname, int port, Duration timeout) {
        String endpoint = hostname + ":" + port;
        CompletableFuture<BinaryConnection> future = new CompletableFuture<>();
        AsynchronousSocketChannel channel;
        try {
            channel = AsynchronousSocketChannel.open();
            channel.connect(new InetSocketAddress(hostname, port), null, new CompletionHandler<Void, Void>() {
                @Override
                public void completed(Void result, Void attachment) {
                    BinaryConnection connection = new BinaryConnection(channel, endpoint);
                    if (future.complete(connection)) {
                        log.debug("Binary connection established: endpoint={}", endpoint);
                        connection.readLoop();
                    } else {
                        connection.close();
                    }
                }

                @Override
                public void failed(Throwable exc, Void attachment) {
                    future.completeExceptionally(OperationException.retryable(
                            RetryReason.SOCKET_NOT_AVAILABLE, "Failed to connect to " + endpoint + ": " + exc.getMessage(), exc));
                }
            });
        } catch (IOException | RuntimeException e) {
            future.completeExceptionally(OperationException.retryable(
                    RetryReason.SOCKET_NOT_AVAILABLE, "Failed to connect to " + endpoint + ": " + e.getMessage(), e));
            return future;
        }

        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((connection, error) -> {
                    if (error instanceof TimeoutException) {
                        closeQuietly(channel);
                    }
                })
                .exceptionallyCompose(error -> CompletableFuture.failedFuture(error instanceof TimeoutException
                        ? OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE,
                                "Connect to " + endpoint + " timed out after " + timeout.toMillis() + "ms", error)
                        : error));
    }

    /**
     * Sends a request. The returned future completes with the response frame,
     * whatever its status, or fails with SOCKET_CLOSED_WHILE_IN_FLIGHT.
     */
    public CompletableFuture<BinaryFrame> send(BinaryFrame request) {
        CompletableFuture<BinaryFrame> future = new CompletableFuture<>();
        if (closed.get()) {
            future.completeExceptionally(OperationException.retryable(
                    RetryReason.SOCKET_NOT_AVAILABLE, "Connection to " + endpoint + " is closed"));
            return future;
        }

        int opaque = opaqueGenerator.incrementAndGet();
        inFlight.put(opaque, future);
        future.whenComplete((frame, error) -> inFlight.remove(opaque, future));

        // close() may have drained the map before our put
        if (closed.get()) {
            future.completeExceptionally(OperationException.retryable(
                    RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT, "Connection to " + endpoint + " closed"));
            return future;
        }

        writeQueue.offer(BinaryFrameCodec.encode(request.withOpaque(opaque)));
        if (writing.compareAndSet(false, true)) {
            writeNext();
        }
        return future;
    }

    private void writeNext() {
        ByteBuffer next = writeQueue.poll();
        if (next == null) {
            writing.set(false);
            // A producer may have enqueued between poll and set
            if (!writeQueue.isEmpty() && writing.compareAndSet(false, true)) {
                writeNext();
            }
            return;
        }
        write(next);
    }

    private void write(ByteBuffer buffer) {
        try {
            channel.write(buffer, buffer, new CompletionHandler<Integer, ByteBuffer>() {
                @Override
                public void completed(Integer written, ByteBuffer attachment) {
                    if (attachment.hasRemaining()) {
                        write(attachment);
                    } else {
                        writeNext();
                    }
                }

                @Override
                public void failed(Throwable exc, ByteBuffer attachment) {
                    closeWithError("Write failed: " + exc.getMessage(), exc);
                }
            });
        } catch (RuntimeException e) {
            closeWithError("Write failed: " + e.getMessage(), e);
        }
    }

    private void readLoop() {
        try {
            channel.read(readBuffer, null, new CompletionHandler<Integer, Void>() {
                @Override
                public void completed(Integer read, Void attachment) {
                    if (read < 0) {
                        closeWithError("Connection closed by peer", null);
                        return;
                    }
                    try {
                        drainFrames();
                    } catch (OperationException e) {
                        closeWithError("Undecodable response: " + e.getMessage(), e);
                        return;
                    }
                    if (!closed.get()) {
                        readLoop();
                    }
                }

                @Override
                public void failed(Throwable exc, Void attachment) {
                    closeWithError("Read failed: " + exc.getMessage(), exc);
                }
            });
        } catch (RuntimeException e) {
            closeWithError("Read failed: " + e.getMessage(), e);
        }
    }

    private void drainFrames() {
        readBuffer.flip();
        Optional<BinaryFrame> frame;
        while ((frame = BinaryFrameCodec.decode(readBuffer)).isPresent()) {
            dispatch(frame.get());
        }
        readBuffer.compact();

        // Grow for packets larger than the buffer
        if (!readBuffer.hasRemaining()) {
            ByteBuffer larger = ByteBuffer.allocate(readBuffer.capacity() * 2);
            readBuffer.flip();
            larger.put(readBuffer);
            readBuffer = larger;
        }
    }

    private void dispatch(BinaryFrame frame) {
        CompletableFuture<BinaryFrame> future = inFlight.remove(frame.opaque());
        if (future == null) {
            orphaned.incrementAndGet();
            log.debug("Dropping orphaned response: endpoint={}, opaque={}, opcode=0x{}",
                    endpoint, frame.opaque(), Integer.toHexString(frame.opcode()));
            return;
        }
        future.complete(frame);
    }

    private void closeWithError(String reason, Throwable cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!inFlight.isEmpty()) {
            log.warn("Binary connection lost with requests in flight: endpoint={}, inFlight={}, reason={}",
                    endpoint, inFlight.size(), reason);
        } else {
            log.debug("Binary connection closed: endpoint={}, reason={}", endpoint, reason);
        }
        closeQuietly(channel);
        failInFlight(OperationException.retryable(RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT,
                "Connection to " + endpoint + " lost: " + reason, cause));
    }

    private void failInFlight(OperationException error) {
        List<CompletableFuture<BinaryFrame>> pending = new ArrayList<>(inFlight.values());
        inFlight.clear();
        for (CompletableFuture<BinaryFrame> future : pending) {
            future.completeExceptionally(error);
        }
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public int orphanedCount() {
        return orphaned.get();
    }

    public boolean isOpen() {
        return !closed.get() && channel.isOpen();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeQuietly(channel);
        failInFlight(OperationException.retryable(RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT,
                "Connection to " + endpoint + " closed"));
        log.debug("Binary connection closed: endpoint={}", endpoint);
    }

    private static void closeQuietly(AsynchronousSocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Error closing channel", e);
        }
    }
}
