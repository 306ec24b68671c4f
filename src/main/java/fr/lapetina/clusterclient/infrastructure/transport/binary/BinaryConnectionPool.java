package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.infrastructure.auth.Authenticator;
import fr.lapetina.clusterclient.infrastructure.auth.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fixed number of binary connections per endpoint, opened lazily.
 *
 * A new connection authenticates with SASL PLAIN (credentials fetched from the
 * authenticator every time) and selects the bucket before it is handed out.
 * A slot whose connection failed or closed is reopened on next use.
 */
public final class BinaryConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BinaryConnectionPool.class);

    private final int connectionsPerEndpoint;
    private final Duration connectTimeout;
    private final Authenticator authenticator;
    private final String bucket;
    private final ConcurrentHashMap<String, EndpointSlots> endpoints = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    public BinaryConnectionPool(int connectionsPerEndpoint, Duration connectTimeout, Authenticator authenticator, String bucket) {
        this.connectionsPerEndpoint = Math.max(1, connectionsPerEndpoint);
        this.connectTimeout = connectTimeout;
        this.authenticator = authenticator;
        this.bucket = bucket;
    }

    /**
     * Returns a ready connection to the endpoint, opening it if needed.
     */
    public CompletableFuture<BinaryConnection> acquire(String hostname, int port) {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new OperationException(ErrorType.REQUEST_CANCELED, "Connection pool is closed"));
        }
        String endpoint = hostname + ":" + port;
        return endpoints.computeIfAbsent(endpoint, e -> new EndpointSlots(hostname, port)).next();
    }

    /**
     * Requests currently in flight towards the endpoint, over all its connections.
     */
    public int inFlight(String endpoint) {
        EndpointSlots slots = endpoints.get(endpoint);
        return slots != null ? slots.inFlight() : 0;
    }

    /**
     * Closes the connections of endpoints that left the topology.
     */
    public void retainEndpoints(Set<String> activeEndpoints) {
        endpoints.entrySet().removeIf(entry -> {
            if (activeEndpoints.contains(entry.getKey())) {
                return false;
            }
            log.info("Closing connections to departed endpoint: endpoint={}", entry.getKey());
            entry.getValue().close();
            return true;
        });
    }

    public int endpointCount() {
        return endpoints.size();
    }

    @Override
    public void close() {
        closed = true;
        endpoints.values().forEach(EndpointSlots::close);
        endpoints.clear();
    }

    private CompletableFuture<BinaryConnection> open(String hostname, int port) {
        String endpoint = hostname + ":" + port;
        return BinaryConnection.connect(hostname, port, connectTimeout)
                .thenCompose(connection -> authenticate(connection, endpoint)
                        .thenCompose(authenticated -> selectBucket(authenticated, endpoint))
                        .whenComplete((ready, error) -> {
                            if (error != null) {
                                connection.close();
                            }
                        }));
    }

    private CompletableFuture<BinaryConnection> authenticate(BinaryConnection connection, String endpoint) {
        Credentials credentials = authenticator.credentials(ServiceType.KEY_VALUE, endpoint);
        BinaryFrame request = BinaryFrame.request(BinaryOpcodes.SASL_AUTH, "PLAIN", credentials.saslPlain());
        return connection.send(request).thenApply(response -> {
            if (!BinaryStatus.isSuccess(response.status())) {
                throw new OperationException(ErrorType.CONFIGURATION_ERROR, null, response.status(),
                        "Authentication failed on " + endpoint + " for user " + credentials.username(), null);
            }
            return connection;
        });
    }

    private CompletableFuture<BinaryConnection> selectBucket(BinaryConnection connection, String endpoint) {
        BinaryFrame request = BinaryFrame.request(BinaryOpcodes.SELECT_BUCKET, bucket, null);
        return connection.send(request).thenApply(response -> {
            if (!BinaryStatus.isSuccess(response.status())) {
                throw new OperationException(ErrorType.CONFIGURATION_ERROR, null, response.status(),
                        "Bucket " + bucket + " not accessible on " + endpoint, null);
            }
            log.info("Binary connection ready: endpoint={}, bucket={}", endpoint, bucket);
            return connection;
        });
    }

    private final class EndpointSlots {
        private final String hostname;
        private final int port;
        private final AtomicReferenceArray<CompletableFuture<BinaryConnection>> slots =
                new AtomicReferenceArray<>(connectionsPerEndpoint);
        private final AtomicInteger cursor = new AtomicInteger(0);

        EndpointSlots(String hostname, int port) {
            this.hostname = hostname;
            this.port = port;
        }

        CompletableFuture<BinaryConnection> next() {
            int index = Math.floorMod(cursor.getAndIncrement(), slots.length());
            synchronized (this) {
                CompletableFuture<BinaryConnection> slot = slots.get(index);
                if (slot == null || isBroken(slot)) {
                    slot = open(hostname, port);
                    slots.set(index, slot);
                }
                return slot;
            }
        }

        synchronized int inFlight() {
            int total = 0;
            for (int i = 0; i < slots.length(); i++) {
                CompletableFuture<BinaryConnection> slot = slots.get(i);
                if (slot != null && slot.isDone() && !slot.isCompletedExceptionally()) {
                    total += slot.join().inFlightCount();
                }
            }
            return total;
        }

        synchronized void close() {
            for (int i = 0; i < slots.length(); i++) {
                CompletableFuture<BinaryConnection> slot = slots.getAndSet(i, null);
                if (slot != null) {
                    slot.thenAccept(BinaryConnection::close);
                }
            }
        }

        private boolean isBroken(CompletableFuture<BinaryConnection> slot) {
            if (!slot.isDone()) {
                return false;
            }
            return slot.isCompletedExceptionally() || !slot.join().isOpen();
        }
    }
}
