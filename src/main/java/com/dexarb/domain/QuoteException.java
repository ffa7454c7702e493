package com.dexarb.domain;

import lombok.Getter;

/**
 * A router or pricing step could not produce a number. Never retried at the layer that catches it.
 */
@Getter
public class QuoteException extends RuntimeException {

    private final FailureReason reason;

    public QuoteException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public QuoteException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
