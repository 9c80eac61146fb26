package org.netpreserve.scriptorium.config;

/**
 * Storage configuration.
 *
 * @param warc       also record each archived exchange as WARC request/response records
 * @param prefix     WARC filename prefix
 * @param quarantine keep payloads that failed verification for inspection
 */
public record StorageConfig(
        boolean warc,
        String prefix,
        boolean quarantine
) {
}
