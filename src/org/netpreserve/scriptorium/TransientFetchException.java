package org.netpreserve.scriptorium;

/**
 * Timeout, connection failure or server-side unavailability.
 */
public class TransientFetchException extends FetchException {
    public TransientFetchException(String errorClass, String message) {
        this(errorClass, message, null);
    }

    public TransientFetchException(String errorClass, String message, Throwable cause) {
        super(errorClass, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
