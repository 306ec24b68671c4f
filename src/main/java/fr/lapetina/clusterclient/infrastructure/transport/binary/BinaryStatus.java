package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;

/**
 * Response status codes and their mapping onto operation failures.
 */
public final class BinaryStatus {

    public static final int SUCCESS = 0x00;
    public static final int KEY_NOT_FOUND = 0x01;
    public static final int KEY_EXISTS = 0x02;
    public static final int NOT_MY_VBUCKET = 0x07;
    public static final int LOCKED = 0x09;
    public static final int AUTH_ERROR = 0x20;
    public static final int UNKNOWN_COMMAND = 0x81;
    public static final int NOT_SUPPORTED = 0x83;
    public static final int BUSY = 0x85;
    public static final int TEMPORARY_FAILURE = 0x86;
    public static final int SYNC_WRITE_IN_PROGRESS = 0xa2;

    private BinaryStatus() {
        // Constants
    }

    public static boolean isSuccess(int status) {
        return status == SUCCESS;
    }

    /**
     * Whether the node does not serve cluster configurations over this protocol.
     */
    public static boolean isUnsupported(int status) {
        return status == UNKNOWN_COMMAND || status == NOT_SUPPORTED;
    }

    /**
     * Maps a non-success status to the failure of the attempt.
     */
    public static OperationException toException(int status, String endpoint, String detail) {
        String message = String.format("Status 0x%02x from %s: %s", status, endpoint, detail);
        RetryReason reason = switch (status) {
            case NOT_MY_VBUCKET -> RetryReason.TOPOLOGY_STALE;
            case TEMPORARY_FAILURE, BUSY -> RetryReason.NODE_OVERLOADED;
            case LOCKED, SYNC_WRITE_IN_PROGRESS -> RetryReason.CONFLICT_IN_PROGRESS;
            default -> null;
        };
        if (reason != null) {
            return new OperationException(reason.errorType(), reason, status, message, null);
        }
        return new OperationException(ErrorType.SERVICE_ERROR, null, status, message, null);
    }
}
