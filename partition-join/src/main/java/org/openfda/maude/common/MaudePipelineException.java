package org.openfda.maude.common;

public class MaudePipelineException extends RuntimeException {
    public MaudePipelineException(String message) {
        super(message);
    }

    public MaudePipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
