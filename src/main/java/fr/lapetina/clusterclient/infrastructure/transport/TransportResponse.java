package fr.lapetina.clusterclient.infrastructure.transport;

import fr.lapetina.clusterclient.infrastructure.stream.RowReader;

/**
 * Successful outcome of one exchange.
 *
 * @param status binary protocol status or HTTP status code
 * @param body   full payload, empty when {@code rows} is set
 * @param rows   row stream of a query-style response, may be null
 */
public record TransportResponse(int status, byte[] body, RowReader rows) {

    public TransportResponse {
        body = body != null ? body : new byte[0];
    }

    public static TransportResponse of(int status, byte[] body) {
        return new TransportResponse(status, body, null);
    }

    public static TransportResponse streaming(int status, RowReader rows) {
        return new TransportResponse(status, null, rows);
    }

    /**
     * Releases the row stream of a response nobody is going to consume.
     */
    public void discard() {
        if (rows != null) {
            rows.close();
        }
    }
}
