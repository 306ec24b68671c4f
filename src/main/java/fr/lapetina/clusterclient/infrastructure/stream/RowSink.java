package fr.lapetina.clusterclient.infrastructure.stream;

import fr.lapetina.clusterclient.domain.exception.OperationException;

/**
 * Receives decoded rows in wire order.
 * After {@link #onComplete} or {@link #onError} no further calls are made.
 */
public interface RowSink {

    void onRow(byte[] row);

    /**
     * End of a well-formed response.
     *
     * @param metadata the non-row fields of the response, as a JSON object
     */
    void onComplete(byte[] metadata);

    void onError(OperationException error);
}
