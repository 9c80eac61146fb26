package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;

/**
 * The payload is not plausibly the intended document. Never retried for the same URL.
 */
public class VerificationException extends ScriptoriumException {
    private final String errorClass;
    private final String checksum;
    private final long size;
    private final @Nullable ContentKind kind;

    public VerificationException(String errorClass, String message, String checksum, long size,
                                 @Nullable ContentKind kind) {
        super(message);
        this.errorClass = errorClass;
        this.checksum = checksum;
        this.size = size;
        this.kind = kind;
    }

    @Override
    public String errorClass() {
        return errorClass;
    }

    public String checksum() {
        return checksum;
    }

    public long size() {
        return size;
    }

    public @Nullable ContentKind kind() {
        return kind;
    }
}
