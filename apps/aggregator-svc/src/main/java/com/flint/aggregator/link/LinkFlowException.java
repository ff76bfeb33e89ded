package com.flint.aggregator.link;

public class LinkFlowException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        SUPERSEDED,
        CANCELLED,
        TRANSPORT_ERROR
    }

    private final Reason reason;

    public LinkFlowException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LinkFlowException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
