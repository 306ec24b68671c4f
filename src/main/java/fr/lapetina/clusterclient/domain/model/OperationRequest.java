package fr.lapetina.clusterclient.domain.model;

import fr.lapetina.clusterclient.domain.retry.RetryStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One logical call to dispatch against the cluster.
 * Immutable and thread-safe.
 *
 * <p>Structural checks (service, payload kind, deadline) are performed at
 * submission so that an invalid request fails synchronously instead of
 * entering the pending operation registry.
 *
 * @param deadline        absolute point in time after which the operation settles as a timeout
 * @param retryStrategy   per-request override of the default strategy, may be null
 * @param idempotent      whether the operation may be re-sent after it possibly reached the server
 * @param routingHint     id of the node to prefer for the first attempt, may be null
 * @param waitForTopology wait (bounded by the deadline) for the first topology instead of failing fast
 */
public record OperationRequest(
        String requestId,
        ServiceType service,
        ServicePayload payload,
        Instant deadline,
        RetryStrategy retryStrategy,
        boolean idempotent,
        String routingHint,
        boolean waitForTopology,
        Instant createdAt,
        String correlationId
) {
    public OperationRequest {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
    }

    /**
     * Creates an idempotent key/value request with a relative timeout.
     */
    public static OperationRequest kv(KvCommand command, Duration timeout) {
        return builder()
                .service(ServiceType.KEY_VALUE)
                .payload(command)
                .timeout(timeout)
                .idempotent(true)
                .build();
    }

    /**
     * Creates an idempotent HTTP request with a relative timeout.
     */
    public static OperationRequest http(ServiceType service, HttpCommand command, Duration timeout) {
        return builder()
                .service(service)
                .payload(command)
                .timeout(timeout)
                .idempotent(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private ServiceType service;
        private ServicePayload payload;
        private Instant deadline;
        private RetryStrategy retryStrategy;
        private boolean idempotent;
        private String routingHint;
        private boolean waitForTopology;
        private Instant createdAt;
        private String correlationId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder service(ServiceType service) {
            this.service = service;
            return this;
        }

        public Builder payload(ServicePayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.deadline = Instant.now().plus(timeout);
            return this;
        }

        public Builder retryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        public Builder idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public Builder routingHint(String nodeId) {
            this.routingHint = nodeId;
            return this;
        }

        public Builder waitForTopology(boolean waitForTopology) {
            this.waitForTopology = waitForTopology;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public OperationRequest build() {
            return new OperationRequest(
                    requestId, service, payload, deadline, retryStrategy, idempotent,
                    routingHint, waitForTopology, createdAt, correlationId
            );
        }
    }
}
