package fr.lapetina.clusterclient.infrastructure.transport;

import java.util.concurrent.CompletableFuture;

/**
 * A request that has been handed to a transport.
 *
 * The response future completes with a {@link TransportResponse} or exceptionally
 * with an {@link fr.lapetina.clusterclient.domain.exception.OperationException}.
 */
public interface InFlightExchange {

    CompletableFuture<TransportResponse> response();

    /**
     * Aborts the exchange and releases what it holds: the pending slot on a
     * multiplexed connection, or the HTTP exchange and its body stream.
     * Idempotent and safe to call from any thread, also after completion.
     */
    void abort();
}
