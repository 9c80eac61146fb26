package org.netpreserve.scriptorium;

import java.util.Locale;

/**
 * An allow-listed host.
 *
 * @param host     exact host name
 * @param licensed material is under licence; fetched only when the run allows licensed hosts
 * @param scanOnly host serves bare scans; fetched only when the run accepts scan-only material
 */
public record TrustedHost(String host, boolean licensed, boolean scanOnly) {
    public TrustedHost {
        if (host != null) host = normalize(host);
    }

    public static TrustedHost of(String host) {
        return new TrustedHost(host, false, false);
    }

    static String normalize(String host) {
        String lower = host.strip().toLowerCase(Locale.ROOT);
        return lower.endsWith(".") ? lower.substring(0, lower.length() - 1) : lower;
    }
}
