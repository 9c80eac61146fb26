package org.netpreserve.scriptorium.config;

import org.netpreserve.scriptorium.ConfigurationException;
import org.netpreserve.scriptorium.TrustedHost;

/**
 * Root configuration for an archive run.
 *
 * @param source  how the candidate source is read
 * @param fetch   worker pool, timeouts and retry discipline
 * @param trust   allow-listed hosts and the legal assumptions the run accepts
 * @param verify  what a payload must look like to be archived
 * @param storage where archived content goes
 */
public record JobConfig(
        SourceConfig source,
        FetchConfig fetch,
        TrustConfig trust,
        VerifyConfig verify,
        StorageConfig storage
) {
    public void validate() throws ConfigurationException {
        if (source == null || fetch == null || trust == null || verify == null || storage == null) {
            throw new ConfigurationException("Missing configuration section");
        }
        if (source.delimiter() == null || source.delimiter().length() != 1) {
            throw new ConfigurationException("source.delimiter must be a single character");
        }
        if (source.bibcodeHints() != null) {
            for (String template : source.bibcodeHints()) {
                if (template == null || !template.contains(SourceConfig.BIBCODE)) {
                    throw new ConfigurationException("source.bibcodeHints entries must contain " + SourceConfig.BIBCODE);
                }
            }
        }
        if (fetch.workers() < 1) throw new ConfigurationException("fetch.workers must be at least 1");
        if (fetch.retries() < 0) throw new ConfigurationException("fetch.retries must not be negative");
        if (fetch.maxRedirects() < 0) throw new ConfigurationException("fetch.maxRedirects must not be negative");
        if (fetch.maxCandidates() < 0) throw new ConfigurationException("fetch.maxCandidates must not be negative");
        if (fetch.timeout() == null || fetch.timeout().isNegative() || fetch.timeout().isZero()) {
            throw new ConfigurationException("fetch.timeout must be positive");
        }
        if (fetch.delay() == null || fetch.delay().isNegative()) {
            throw new ConfigurationException("fetch.delay must not be negative");
        }
        var backoff = fetch.backoff();
        if (backoff == null || backoff.base() == null || backoff.max() == null || backoff.base().isNegative()
            || backoff.max().compareTo(backoff.base()) < 0 || backoff.multiplier() < 1.0) {
            throw new ConfigurationException("fetch.backoff needs base <= max and multiplier >= 1");
        }
        if (trust.hosts() == null || trust.hosts().isEmpty()) {
            throw new ConfigurationException("trust.hosts must list at least one trusted host");
        }
        for (TrustedHost host : trust.hosts()) {
            if (host.host() == null || host.host().isBlank()) {
                throw new ConfigurationException("trust.hosts entries need a host name");
            }
        }
        if (verify.accept() == null || verify.accept().isEmpty()) {
            throw new ConfigurationException("verify.accept must list at least one content kind");
        }
        if (verify.minSize() == null || verify.minSize() < 1) {
            throw new ConfigurationException("verify.minSize must be at least 1 byte");
        }
    }
}
