package org.netpreserve.scriptorium;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.scriptorium.config.FetchConfig;
import org.netpreserve.scriptorium.config.StorageConfig;
import org.netpreserve.scriptorium.util.Checksums;
import org.netpreserve.scriptorium.util.Url;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AttemptTest {
    private static final String PAPER = "https://trusted.example/paper.pdf";

    @TempDir
    Path dir;

    private ScriptedDownloader downloader;
    private Storage storage;
    private boolean cancelled;

    @BeforeEach
    public void setUp() throws Exception {
        downloader = new ScriptedDownloader();
        storage = new Storage(dir, new StorageConfig(false, "test", true), 1);
        cancelled = false;
    }

    private Attempt.Result attempt(String url, int retries) {
        FetchConfig config = TestConfigs.fetch(1, retries);
        var context = new FetchContext(config, downloader, new HostLimiter(Duration.ZERO),
                new TrustPolicy(TestConfigs.trust(false, false)), new ContentVerifier(TestConfigs.verify(), false),
                storage, new Backoff(config.backoff()), () -> cancelled);
        var candidate = new Candidate("2020ApJ...900....1A", "A paper", 2020, null, List.of(new Url(url)));
        return new Attempt(candidate, new Url(url), context).run();
    }

    @Test
    public void successStoresTheDocument() throws Exception {
        byte[] pdf = TestDocuments.textPdf();
        downloader.ok(PAPER, "application/pdf", pdf);

        var result = attempt(PAPER, 2);
        var attempt = result.attempt();
        assertEquals(Outcome.SUCCESS, attempt.outcome());
        assertEquals(200, attempt.status());
        assertNull(attempt.error());
        assertEquals(0, attempt.retries());
        assertEquals(Checksums.sha256Hex(pdf), attempt.checksum());
        assertEquals(TestConfigs.TRUSTED, attempt.host());

        var archived = result.archived();
        assertNotNull(archived);
        assertEquals(attempt.checksum(), archived.checksum());
        assertEquals(2, archived.pages());
        assertArrayEquals(pdf, Files.readAllBytes(dir.resolve(archived.path())));
    }

    @Test
    public void transientFailuresAreRetriedAtMostRTimes() {
        downloader.timeout(PAPER);
        var attempt = attempt(PAPER, 3).attempt();
        assertEquals(Outcome.FAILURE, attempt.outcome());
        assertEquals("timeout", attempt.error());
        assertEquals(3, attempt.retries());
        assertEquals(4, downloader.requestCount());
    }

    @Test
    public void zeroRetriesMeansOneRequest() {
        downloader.status(PAPER, 503);
        var attempt = attempt(PAPER, 0).attempt();
        assertEquals("http-503", attempt.error());
        assertEquals(503, attempt.status());
        assertEquals(1, downloader.requestCount());
    }

    @Test
    public void recoversAfterServerError() {
        byte[] pdf = TestDocuments.textPdf();
        var calls = new AtomicInteger();
        downloader.on(PAPER, url -> calls.getAndIncrement() == 0
                ? ScriptedDownloader.response(url, 503, "text/html", new byte[0], Map.of("retry-after", List.of("0")))
                : ScriptedDownloader.response(url, 200, "application/pdf", pdf, Map.of()));

        var attempt = attempt(PAPER, 2).attempt();
        assertEquals(Outcome.SUCCESS, attempt.outcome());
        assertEquals(1, attempt.retries());
        assertEquals(2, downloader.requestCount());
    }

    @Test
    public void permanentFailuresAreNotRetried() {
        downloader.status(PAPER, 404);
        var attempt = attempt(PAPER, 3).attempt();
        assertEquals(Outcome.FAILURE, attempt.outcome());
        assertEquals("http-404", attempt.error());
        assertEquals(0, attempt.retries());
        assertEquals(1, downloader.requestCount());
    }

    @Test
    public void forbiddenIsAccessRefused() {
        downloader.status(PAPER, 403);
        assertEquals("access-refused", attempt(PAPER, 3).attempt().error());
        assertEquals(1, downloader.requestCount());
    }

    @Test
    public void followsRedirectsWithinTrustedHosts() {
        byte[] pdf = TestDocuments.textPdf();
        downloader.redirect(PAPER, "https://mirror.example/copy.pdf")
                .ok("https://mirror.example/copy.pdf", "application/pdf", pdf);

        var result = attempt(PAPER, 0);
        assertEquals(Outcome.SUCCESS, result.attempt().outcome());
        assertEquals(new Url(PAPER), result.attempt().url());
        assertEquals(new Url("https://mirror.example/copy.pdf"), result.archived().url());
        assertEquals(TestConfigs.MIRROR, result.archived().host());
    }

    @Test
    public void redirectToUntrustedHostIsRejectedBeforeRequestingIt() {
        downloader.redirect(PAPER, "https://untrusted.example/paper.pdf");

        var attempt = attempt(PAPER, 2).attempt();
        assertEquals(Outcome.REJECTED, attempt.outcome());
        assertEquals("redirect-untrusted-host", attempt.error());
        assertEquals(0, downloader.requestsTo(TestConfigs.UNTRUSTED));
        assertEquals(1, downloader.requestCount());
    }

    @Test
    public void redirectLoopsAreCut() {
        downloader.redirect(PAPER, "/loop").redirect("https://trusted.example/loop", PAPER);
        var attempt = attempt(PAPER, 0).attempt();
        assertEquals("too-many-redirects", attempt.error());
        assertEquals(4, downloader.requestCount());
    }

    @Test
    public void nonDocumentIsQuarantined() throws Exception {
        byte[] html = TestDocuments.html();
        downloader.ok(PAPER, "application/pdf", html);

        var result = attempt(PAPER, 2);
        var attempt = result.attempt();
        assertEquals(Outcome.FAILURE, attempt.outcome());
        assertEquals("unsupported-kind", attempt.error());
        assertEquals(Checksums.sha256Hex(html), attempt.checksum());
        assertEquals(html.length, attempt.size());
        assertNull(result.archived());
        assertEquals(1, downloader.requestCount(), "verification failures are not retried");
        assertTrue(Files.exists(dir.resolve("quarantine").resolve(attempt.checksum() + ".html")));
    }

    @Test
    public void untrustedHintIsNeverRequested() {
        var attempt = attempt("https://untrusted.example/paper.pdf", 2).attempt();
        assertEquals(Outcome.REJECTED, attempt.outcome());
        assertEquals("untrusted-host", attempt.error());
        assertEquals(0, downloader.requestCount());
    }

    @Test
    public void cancelledBeforeStartMakesNoRequest() {
        downloader.ok(PAPER, "application/pdf", TestDocuments.textPdf());
        cancelled = true;
        var attempt = attempt(PAPER, 2).attempt();
        assertEquals(Outcome.CANCELLED, attempt.outcome());
        assertEquals("cancelled", attempt.error());
        assertEquals(0, downloader.requestCount());
    }

    @Test
    public void parseRetryAfter() {
        assertEquals(Duration.ofSeconds(7), Attempt.parseRetryAfter(" 7 "));
        assertNull(Attempt.parseRetryAfter("0"));
        assertNull(Attempt.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
        assertNull(Attempt.parseRetryAfter(null));
    }
}
