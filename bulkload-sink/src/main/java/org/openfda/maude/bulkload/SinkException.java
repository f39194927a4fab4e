package org.openfda.maude.bulkload;

/**
 * Failure reported by the search cluster. Propagated to the caller of the load stage and never retried here.
 */
public class SinkException extends RuntimeException {
    private final int statusCode;

    public SinkException(String message) {
        this(message, -1);
    }

    public SinkException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed request, or -1 when the failure happened before a response. */
    public int getStatusCode() {
        return statusCode;
    }
}
