package org.netpreserve.scriptorium;

/**
 * Invalid configuration or unreadable input. Aborts the run before anything is fetched.
 */
public class ConfigurationException extends ScriptoriumException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorClass() {
        return "configuration";
    }
}
