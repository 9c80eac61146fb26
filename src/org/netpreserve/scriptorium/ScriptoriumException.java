package org.netpreserve.scriptorium;

/**
 * Base of the checked errors. {@link #errorClass()} is the short stable name written to the ledger.
 */
public abstract class ScriptoriumException extends Exception {
    protected ScriptoriumException(String message) {
        super(message);
    }

    protected ScriptoriumException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorClass();
}
