package fr.lapetina.clusterclient.disruptor.exception;

/**
 * Thrown synchronously by submit when the ring buffer has no free slot.
 * The operation was not registered; the caller may resubmit it later.
 */
public final class BackpressureException extends RuntimeException {

    private final String requestId;
    private final long remainingCapacity;

    public BackpressureException(String requestId, long remainingCapacity) {
        super("Ring buffer full, operation rejected: requestId=" + requestId
                + ", remainingCapacity=" + remainingCapacity);
        this.requestId = requestId;
        this.remainingCapacity = remainingCapacity;
    }

    public String getRequestId() {
        return requestId;
    }

    public long getRemainingCapacity() {
        return remainingCapacity;
    }
}
