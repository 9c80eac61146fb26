package org.netpreserve.scriptorium.config;

import org.netpreserve.scriptorium.TrustedHost;

import java.util.List;

/**
 * Trust policy configuration. The flags are the caller's statement of what the run may legally fetch;
 * nothing tries to infer licensing from content.
 *
 * @param allowLicensed  permit hosts whose material is under licence
 * @param acceptScanOnly permit scan-only hosts and archive documents without a text layer
 * @param hosts          exact host names that may be fetched
 */
public record TrustConfig(
        boolean allowLicensed,
        boolean acceptScanOnly,
        List<TrustedHost> hosts) {
}
