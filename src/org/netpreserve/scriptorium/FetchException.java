package org.netpreserve.scriptorium;

/**
 * A request that did not produce a usable response.
 */
public abstract class FetchException extends ScriptoriumException {
    private final String errorClass;

    protected FetchException(String errorClass, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
    }

    @Override
    public String errorClass() {
        return errorClass;
    }

    /**
     * Whether the same request may succeed if repeated later.
     */
    public abstract boolean isTransient();
}
