package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.config.TrustConfig;
import org.netpreserve.scriptorium.util.Url;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Decides whether a URL may be fetched. Hosts match exactly: no wildcards and no subdomain inference, so
 * trusting {@code archive.org} says nothing about {@code www.archive.org}.
 */
public class TrustPolicy implements Predicate<Url> {
    private final Map<String, TrustedHost> hosts = new HashMap<>();
    private final boolean allowLicensed;
    private final boolean acceptScanOnly;

    public TrustPolicy(TrustConfig config) {
        this.allowLicensed = config.allowLicensed();
        this.acceptScanOnly = config.acceptScanOnly();
        for (TrustedHost host : config.hosts()) {
            // later entries win so command line additions can override the configured flags
            hosts.put(host.host(), host);
        }
    }

    public Verdict isTrusted(@Nullable Url url) {
        if (url == null) return Verdict.reject("unparseable-url", null);
        String host = url.host();
        if (host == null) return Verdict.reject("unparseable-url", null);
        if (!url.isHttp()) return Verdict.reject("unsupported-scheme", host);
        TrustedHost trustedHost = hosts.get(host);
        if (trustedHost == null) return Verdict.reject("untrusted-host", host);
        if (trustedHost.licensed() && !allowLicensed) return Verdict.reject("licensed-not-accepted", host);
        if (trustedHost.scanOnly() && !acceptScanOnly) return Verdict.reject("scan-only-not-accepted", host);
        return new Verdict(true, "trusted", host);
    }

    public Verdict isTrusted(String url) {
        return isTrusted(Url.orNull(url));
    }

    @Override
    public boolean test(Url url) {
        return isTrusted(url).allowed();
    }

    public boolean acceptsScanOnly() {
        return acceptScanOnly;
    }

    /**
     * @param reason short machine readable reason, recorded in the ledger on rejection
     * @param host   normalized host, when one could be extracted
     */
    public record Verdict(boolean allowed, String reason, @Nullable String host) {
        static Verdict reject(String reason, @Nullable String host) {
            return new Verdict(false, reason, host);
        }
    }
}
