package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tries one URL hint for one candidate. Driven as an explicit state machine so that cancellation can end it
 * from any state:
 * <pre>
 * PENDING -> IN_FLIGHT -> SUCCEEDED
 *                      -> TRANSIENT_FAILURE -> BACKOFF_WAIT -> IN_FLIGHT
 *                                           -> TERMINAL_FAILURE (retries exhausted)
 *                      -> TERMINAL_FAILURE | REJECTED | CANCELLED
 * </pre>
 */
class Attempt {
    private static final Logger log = LoggerFactory.getLogger(Attempt.class);

    enum State {
        PENDING, IN_FLIGHT, TRANSIENT_FAILURE, BACKOFF_WAIT, SUCCEEDED, TERMINAL_FAILURE, REJECTED, CANCELLED;

        boolean isTerminal() {
            return this == SUCCEEDED || this == TERMINAL_FAILURE || this == REJECTED || this == CANCELLED;
        }
    }

    private final Candidate candidate;
    private final Url hint;
    private final FetchContext context;
    private State state = State.PENDING;
    private @Nullable String host;
    private int retries;
    private @Nullable Integer status;
    private @Nullable String error;
    private @Nullable String checksum;
    private @Nullable Long size;
    private @Nullable Duration retryAfter;
    private @Nullable ArchivedRecord archived;

    Attempt(Candidate candidate, Url hint, FetchContext context) {
        this.candidate = candidate;
        this.hint = hint;
        this.context = context;
    }

    Result run() {
        Instant date = Instant.now();
        long start = System.nanoTime();
        while (!state.isTerminal()) {
            if (context.cancelled().getAsBoolean()) {
                state = State.CANCELLED;
                break;
            }
            switch (state) {
                case PENDING -> state = checkTrust(hint);
                case IN_FLIGHT -> state = request();
                case TRANSIENT_FAILURE -> state = retries < context.config().retries() ?
                        State.BACKOFF_WAIT : State.TERMINAL_FAILURE;
                case BACKOFF_WAIT -> state = backoff();
                default -> throw new IllegalStateException(state.toString());
            }
        }
        if (state == State.CANCELLED) error = "cancelled";
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        var attempt = new FetchAttempt(candidate.identifier(), hint, host, date, outcome(), status,
                state == State.SUCCEEDED ? null : error, elapsedMs, retries, checksum, size);
        log.atInfo().addKeyValue("id", candidate.identifier())
                .addKeyValue("url", hint)
                .addKeyValue("state", state)
                .addKeyValue("status", status)
                .addKeyValue("error", error)
                .addKeyValue("retries", retries)
                .addKeyValue("elapsedMs", elapsedMs)
                .log("Attempt finished");
        return new Result(attempt, archived);
    }

    private Outcome outcome() {
        return switch (state) {
            case SUCCEEDED -> Outcome.SUCCESS;
            case REJECTED -> Outcome.REJECTED;
            case CANCELLED -> Outcome.CANCELLED;
            default -> Outcome.FAILURE;
        };
    }

    private State checkTrust(Url url) {
        TrustPolicy.Verdict verdict = context.trust().isTrusted(url);
        if (host == null) host = verdict.host();
        if (!verdict.allowed()) {
            error = verdict.reason();
            return State.REJECTED;
        }
        return State.IN_FLIGHT;
    }

    private State backoff() {
        retries++;
        Duration delay = context.backoff().delay(retries);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter.compareTo(context.backoff().max()) > 0 ? context.backoff().max() : retryAfter;
        }
        retryAfter = null;
        log.debug("Retry {} of {} for {} in {}ms", retries, context.config().retries(), hint, delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return State.CANCELLED;
        }
        return State.IN_FLIGHT;
    }

    /**
     * One request, plus any redirect hops it leads to. Every hop is trust checked and made under its host's
     * permit.
     */
    private State request() {
        Url url = hint;
        int redirects = 0;
        while (true) {
            TrustPolicy.Verdict verdict = context.trust().isTrusted(url);
            if (!verdict.allowed()) {
                error = redirects > 0 ? "redirect-" + verdict.reason() : verdict.reason();
                return State.REJECTED;
            }
            Download download;
            try (var permit = context.limiter().acquire(verdict.host())) {
                download = context.downloader().fetch(url, context.config().timeout());
            } catch (FetchException e) {
                error = e.errorClass();
                log.debug("Fetch of {} failed: {}", url, e.getMessage());
                return e.isTransient() ? State.TRANSIENT_FAILURE : State.TERMINAL_FAILURE;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return State.CANCELLED;
            }
            status = download.status();

            if (download.isRedirect()) {
                Optional<String> location = download.header("Location");
                if (location.isEmpty()) {
                    error = "redirect-without-location";
                    return State.TERMINAL_FAILURE;
                }
                if (++redirects > context.config().maxRedirects()) {
                    error = "too-many-redirects";
                    return State.TERMINAL_FAILURE;
                }
                try {
                    url = url.resolve(location.get());
                } catch (URISyntaxException e) {
                    error = "bad-redirect";
                    return State.TERMINAL_FAILURE;
                }
                log.debug("Redirected from {} to {}", download.url(), url);
                continue;
            }
            return handleResponse(download, verdict.host());
        }
    }

    private State handleResponse(Download download, String finalHost) {
        int code = download.status();
        if (code >= 200 && code < 300) {
            return verifyAndStore(download, finalHost);
        }
        if (code == 408 || code == 429 || code >= 500) {
            error = "http-" + code;
            retryAfter = parseRetryAfter(download.header("Retry-After").orElse(null));
            return State.TRANSIENT_FAILURE;
        }
        error = code == 401 || code == 403 ? "access-refused" : "http-" + code;
        return State.TERMINAL_FAILURE;
    }

    private State verifyAndStore(Download download, String finalHost) {
        VerifiedContent content;
        try {
            content = context.verifier().verify(download.body(), download.contentType());
        } catch (VerificationException e) {
            error = e.errorClass();
            checksum = e.checksum();
            size = e.size();
            log.atWarn().addKeyValue("id", candidate.identifier())
                    .addKeyValue("url", download.url())
                    .addKeyValue("checksum", e.checksum())
                    .log("Verification failed: {}", e.getMessage());
            try {
                context.storage().quarantine(download.body(), e.checksum(), e.kind());
            } catch (IOException ioe) {
                log.warn("Unable to quarantine payload {}", e.checksum(), ioe);
            }
            return State.TERMINAL_FAILURE;
        }
        checksum = content.checksum();
        size = content.size();
        if (interrupted()) return State.CANCELLED;
        try {
            String path = context.storage().store(content, download);
            archived = new ArchivedRecord(candidate.identifier(), download.url(), path, content.checksum(),
                    content.size(), content.pages(), content.textStats(), finalHost, download.date());
        } catch (ClosedByInterruptException e) {
            return State.CANCELLED;
        } catch (IOException e) {
            if (interrupted()) return State.CANCELLED;
            log.error("Unable to store {} for {}", content.checksum(), candidate.identifier(), e);
            error = "storage";
            return State.TERMINAL_FAILURE;
        }
        return State.SUCCEEDED;
    }

    private boolean interrupted() {
        return context.cancelled().getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    static @Nullable Duration parseRetryAfter(@Nullable String value) {
        if (value == null) return null;
        try {
            long seconds = Long.parseLong(value.strip());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // HTTP-date form is rare enough to fall back to the normal curve
            return null;
        }
    }

    record Result(FetchAttempt attempt, @Nullable ArchivedRecord archived) {
    }
}
