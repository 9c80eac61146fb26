package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.util.Url;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A single HTTP exchange. Redirects are not followed, so a 3xx status is returned as is with its Location header.
 *
 * @param headers  response headers, names lower-cased
 * @param date     when the response headers arrived
 * @param protocol "h2" for HTTP/2, null for HTTP/1.1
 */
public record Download(
        Url url,
        int status,
        @Nullable String contentType,
        Map<String, List<String>> headers,
        byte[] body,
        Instant date,
        long fetchTimeMs,
        @Nullable String protocol) {

    public boolean isRedirect() {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        if (values == null || values.isEmpty()) return Optional.empty();
        return Optional.of(values.get(0));
    }
}
