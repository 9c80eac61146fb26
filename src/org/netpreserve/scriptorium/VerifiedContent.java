package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;

/**
 * A payload that passed verification.
 *
 * @param checksum  lower-case hex SHA-256 of {@code payload}
 * @param pages     page count, null if it could not be determined
 * @param textStats text statistics, null if they could not be extracted
 * @param bareScan  no usable text layer, accepted because the run accepts scan-only material
 */
public record VerifiedContent(
        byte[] payload,
        String checksum,
        ContentKind kind,
        @Nullable Integer pages,
        @Nullable TextStats textStats,
        boolean bareScan) {

    public long size() {
        return payload.length;
    }
}
