package org.netpreserve.scriptorium;

public class PermanentFetchException extends FetchException {
    public PermanentFetchException(String errorClass, String message) {
        this(errorClass, message, null);
    }

    public PermanentFetchException(String errorClass, String message, Throwable cause) {
        super(errorClass, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
