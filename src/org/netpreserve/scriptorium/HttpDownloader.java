package org.netpreserve.scriptorium;

import org.netpreserve.scriptorium.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Downloader} backed by the JDK HTTP client.
 */
public class HttpDownloader implements Downloader {
    private static final Logger log = LoggerFactory.getLogger(HttpDownloader.class);
    private final HttpClient httpClient;
    private final String userAgent;

    public HttpDownloader(String userAgent, Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(connectTimeout)
                .build(), userAgent);
    }

    HttpDownloader(HttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    @Override
    public Download fetch(Url url, Duration timeout) throws FetchException, InterruptedException {
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new PermanentFetchException("unparseable-url", "Invalid URL: " + url, e);
        }
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/pdf,image/vnd.djvu,image/*;q=0.9,*/*;q=0.5")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new PermanentFetchException("unparseable-url", "Unsupported URL: " + url, e);
        }

        var responseTimeRef = new AtomicReference<Instant>();
        long fetchStart = System.currentTimeMillis();
        CompletableFuture<HttpResponse<byte[]>> future = httpClient.sendAsync(request, responseInfo -> {
            responseTimeRef.set(Instant.now());
            return HttpResponse.BodySubscribers.ofByteArray();
        });
        HttpResponse<byte[]> response;
        try {
            // the request timeout only covers the headers, this bounds the body too
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientFetchException("timeout", "No complete response within " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw classify(url, e.getCause());
        }
        long fetchTimeMs = System.currentTimeMillis() - fetchStart;

        log.atDebug().addKeyValue("url", url)
                .addKeyValue("status", response.statusCode())
                .addKeyValue("fetchTimeMs", fetchTimeMs)
                .log("Fetched");

        Instant date = responseTimeRef.get() != null ? responseTimeRef.get() : Instant.now();
        return new Download(url, response.statusCode(),
                response.headers().firstValue("Content-Type").orElse(null),
                lowerCaseHeaders(response.headers()),
                response.body(),
                date,
                fetchTimeMs,
                response.version() == HttpClient.Version.HTTP_2 ? "h2" : null);
    }

    static FetchException classify(Url url, Throwable cause) {
        if (cause instanceof HttpConnectTimeoutException) {
            return new TransientFetchException("connect-timeout", "Connect timed out: " + url, cause);
        } else if (cause instanceof HttpTimeoutException) {
            return new TransientFetchException("timeout", "Timed out: " + url, cause);
        } else if (cause instanceof UnknownHostException) {
            return new TransientFetchException("dns", "Unknown host: " + url.host(), cause);
        } else if (cause instanceof ConnectException) {
            return new TransientFetchException("connect", "Connection failed: " + url, cause);
        } else if (cause instanceof SSLException) {
            return new PermanentFetchException("tls", "TLS failure: " + cause.getMessage(), cause);
        } else if (cause instanceof IOException) {
            return new TransientFetchException("io", "I/O error: " + cause.getMessage(), cause);
        } else if (cause instanceof IllegalArgumentException) {
            return new PermanentFetchException("unparseable-url", "Rejected URL: " + url, cause);
        }
        return new PermanentFetchException("internal", String.valueOf(cause), cause);
    }

    private static Map<String, List<String>> lowerCaseHeaders(HttpHeaders headers) {
        var map = new LinkedHashMap<String, List<String>>();
        headers.map().forEach((name, values) -> {
            if (name.startsWith(":")) return;
            map.put(name.toLowerCase(Locale.ROOT), values);
        });
        return map;
    }
}
