package fr.lapetina.clusterclient.domain.model;

import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.stream.RowReader;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Successful settlement of an operation.
 *
 * For streamed query services {@code rows} carries the row reader and
 * {@code body} is empty. For key/value and management calls the body holds the
 * full response payload.
 *
 * @param status       binary protocol status or HTTP status code
 * @param attempts     number of dispatch attempts, including the successful one
 * @param retryReasons reasons of the failed attempts, in order
 */
public record OperationResult(
        String requestId,
        ServiceType service,
        String nodeId,
        int attempts,
        int status,
        byte[] body,
        RowReader rows,
        List<RetryReason> retryReasons,
        Duration latency
) {
    public OperationResult {
        body = body != null ? body : new byte[0];
        retryReasons = retryReasons != null ? List.copyOf(retryReasons) : List.of();
    }

    public boolean hasRows() {
        return rows != null;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "OperationResult{" +
                "requestId=" + requestId +
                ", service=" + service +
                ", node=" + nodeId +
                ", attempts=" + attempts +
                ", status=" + status +
                ", bodyBytes=" + body.length +
                ", streamed=" + hasRows() +
                ", latencyMs=" + (latency != null ? latency.toMillis() : -1) +
                '}';
    }
}
