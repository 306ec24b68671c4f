package fr.lapetina.clusterclient.domain.exception;

import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;

/**
 * Failure of an operation or of one of its attempts.
 *
 * A failed attempt carries a {@link RetryReason} when it is transient; the
 * retry orchestrator uses it to decide what happens next. Failures without a
 * reason are terminal.
 */
public class OperationException extends RuntimeException {

    /** Status value when no server status applies */
    public static final int NO_STATUS = -1;

    private final ErrorType errorType;
    private final RetryReason retryReason;
    private final int status;

    public OperationException(ErrorType errorType, RetryReason retryReason, int status, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.retryReason = retryReason;
        this.status = status;
    }

    public OperationException(ErrorType errorType, String message) {
        this(errorType, null, NO_STATUS, message, null);
    }

    public OperationException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, null, NO_STATUS, message, cause);
    }

    /**
     * A transient failure; the error kind is derived from the reason.
     */
    public static OperationException retryable(RetryReason reason, String message) {
        return new OperationException(reason.errorType(), reason, NO_STATUS, message, null);
    }

    public static OperationException retryable(RetryReason reason, String message, Throwable cause) {
        return new OperationException(reason.errorType(), reason, NO_STATUS, message, cause);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Classification for the retry orchestrator, or null for a terminal failure.
     */
    public RetryReason getRetryReason() {
        return retryReason;
    }

    public boolean isRetryable() {
        return retryReason != null;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Whether the failure means the server answered, as opposed to a broken exchange.
     */
    public boolean isServerResponse() {
        return status != NO_STATUS;
    }
}
