package org.netpreserve.scriptorium.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * URL type which caches parsing.
 */
public class Url {
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = Objects.requireNonNull(url, "url").strip();
    }

    public static Url orNull(String url) {
        if (url == null || url.isBlank()) return null;
        return new Url(url);
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    /**
     * Lower-cased host name without any trailing dot, or null when the URL has no parseable host.
     */
    public @Nullable String host() {
        String host;
        try {
            host = toURI().getHost();
        } catch (URISyntaxException e) {
            return null;
        }
        if (host == null) return null;
        host = host.toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        return host.isEmpty() ? null : host;
    }

    public @Nullable String scheme() {
        try {
            String scheme = toURI().getScheme();
            return scheme == null ? null : scheme.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    /**
     * Resolves a redirect target (which may be relative) against this URL.
     */
    public Url resolve(String location) throws URISyntaxException {
        try {
            return new Url(toURI().resolve(location.strip()).toString()).withoutFragment();
        } catch (IllegalArgumentException e) {
            throw new URISyntaxException(location, e.getMessage());
        }
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
