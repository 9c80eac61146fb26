package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.config.JobConfig;
import org.netpreserve.scriptorium.ledger.Ledger;
import org.netpreserve.scriptorium.ledger.LedgerExporter;
import org.netpreserve.scriptorium.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One archive run: loads candidates, filters them through the ledger and the trust policy, fans them out to
 * the fetch pool and records every result. This thread is the only one that writes to the ledger.
 */
public class ArchiveJob implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ArchiveJob.class);
    private static final long POLL_MILLIS = 500;
    private final Path dataDir;
    private final JobConfig config;
    private final Ledger ledger;
    private final Storage storage;
    private final Downloader downloader;
    private final TrustPolicy trust;
    private final ContentVerifier verifier;
    private final CandidateLoader loader;
    private final LedgerExporter exporter = new LedgerExporter();
    private final Lock runLock = new ReentrantLock();
    private volatile FetchPool pool;
    private volatile boolean cancelRequested;

    public ArchiveJob(Path dataDir, JobConfig config) throws IOException {
        this(dataDir, config, new HttpDownloader(config.fetch().userAgent(), config.fetch().timeout()));
    }

    ArchiveJob(Path dataDir, JobConfig config, Downloader downloader) throws IOException {
        this.dataDir = dataDir;
        this.config = config;
        this.downloader = downloader;
        Files.createDirectories(dataDir);
        this.ledger = Ledger.open(dataDir);
        this.storage = new Storage(dataDir, config.storage(), config.fetch().workers());
        this.trust = new TrustPolicy(config.trust());
        this.verifier = new ContentVerifier(config.verify(), config.trust().acceptScanOnly());
        this.loader = new CandidateLoader(config.source());
    }

    /**
     * Archives the candidates in {@code source}. Candidates that already have an archived record are skipped
     * unless {@code force} is set.
     *
     * @throws ConfigurationException if the source cannot be read, before anything is written to the ledger
     */
    public RunSummary run(Path source, boolean force) throws ConfigurationException, IOException {
        if (!runLock.tryLock()) throw new IllegalStateException("A run is already in progress");
        try {
            List<Candidate> candidates = loader.load(source);
            int max = config.fetch().maxCandidates();
            if (max > 0 && candidates.size() > max) {
                log.info("Limiting run to the first {} of {} candidates", max, candidates.size());
                candidates = candidates.subList(0, max);
            }

            ledger.startRun(force);
            var positions = new HashMap<String, Integer>();
            var summary = RunSummary.EMPTY.withCandidates(candidates.size());
            var dispatch = new ArrayList<Candidate>();
            for (int i = 0; i < candidates.size(); i++) {
                Candidate candidate = candidates.get(i);
                int position = i + 1;
                positions.put(candidate.identifier(), position);
                Outcome outcome = screen(candidate, position, force);
                if (outcome == null) {
                    dispatch.add(candidate.withUrls(trustedUrls(candidate)));
                } else {
                    summary = summary.plus(outcome);
                }
            }

            summary = summary.withAttempted(dispatch.size());
            if (!dispatch.isEmpty()) {
                summary = fetch(dispatch, positions, summary);
            }
            ledger.finishRun(summary);
            exporter.export(ledger.entries(), dataDir);
            return summary;
        } finally {
            pool = null;
            runLock.unlock();
        }
    }

    /**
     * Decides a candidate's fate before any network request, recording the decision.
     *
     * @return the outcome, or null if the candidate should be fetched
     */
    private @Nullable Outcome screen(Candidate candidate, int position, boolean force) {
        String id = candidate.identifier();
        if (cancelRequested) {
            ledger.record(FetchAttempt.cancelled(id, null, null), position);
            return Outcome.CANCELLED;
        }
        if (!force) {
            Optional<ArchivedRecord> active = ledger.activeRecord(id);
            if (active.isPresent()) {
                log.atInfo().addKeyValue("id", id).addKeyValue("path", active.get().path())
                        .log("Already archived, skipping");
                ledger.record(FetchAttempt.skipped(active.get()), position);
                return Outcome.SKIPPED;
            }
        }
        if (candidate.urls().isEmpty()) {
            log.atWarn().addKeyValue("id", id).log("No URL hints");
            ledger.record(FetchAttempt.rejected(id, null, null, "no-url-hints"), position);
            return Outcome.REJECTED;
        }
        boolean anyTrusted = false;
        for (Url url : candidate.urls()) {
            TrustPolicy.Verdict verdict = trust.isTrusted(url);
            if (verdict.allowed()) {
                anyTrusted = true;
            } else {
                log.atInfo().addKeyValue("id", id).addKeyValue("url", url).addKeyValue("reason", verdict.reason())
                        .log("Rejected by trust policy");
                ledger.record(FetchAttempt.rejected(id, url, verdict.host(), verdict.reason()), position);
            }
        }
        return anyTrusted ? null : Outcome.REJECTED;
    }

    private List<Url> trustedUrls(Candidate candidate) {
        return candidate.urls().stream().filter(trust).toList();
    }

    private RunSummary fetch(List<Candidate> dispatch, Map<String, Integer> positions, RunSummary summary) {
        BlockingQueue<FetchPool.Event> events = new LinkedBlockingQueue<>();
        Duration runTimeout = config.fetch().runTimeout();
        long deadline = runTimeout == null ? Long.MAX_VALUE : System.nanoTime() + runTimeout.toNanos();
        var unfinished = new LinkedHashMap<String, Candidate>();
        dispatch.forEach(candidate -> unfinished.put(candidate.identifier(), candidate));
        boolean interrupted = false;

        try (FetchPool fetchPool = new FetchPool(config.fetch(), downloader, trust, verifier, storage, events)) {
            pool = fetchPool;
            fetchPool.start(dispatch);
            if (cancelRequested) fetchPool.cancel();

            while (true) {
                if (!fetchPool.isCancelled() && System.nanoTime() - deadline >= 0) {
                    log.warn("Run timeout of {} reached", runTimeout);
                    fetchPool.cancel();
                }
                FetchPool.Event event;
                try {
                    event = events.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                    fetchPool.cancel();
                    continue;
                }
                if (event == null) continue;
                if (event instanceof FetchPool.Event.Attempted attempted) {
                    FetchAttempt attempt = attempted.attempt();
                    ledger.record(attempt, positions.get(attempt.identifier()));
                } else if (event instanceof FetchPool.Event.Finished finished) {
                    Candidate candidate = finished.candidate();
                    if (finished.archived() != null) {
                        ledger.record(finished.archived(), positions.get(candidate.identifier()));
                    }
                    unfinished.remove(candidate.identifier());
                    summary = summary.plus(finished.outcome());
                    log.atInfo().addKeyValue("id", candidate.identifier())
                            .addKeyValue("outcome", finished.outcome())
                            .addKeyValue("remaining", unfinished.size())
                            .log("Candidate finished");
                } else if (event instanceof FetchPool.Event.Drained) {
                    break;
                }
            }
        }

        // workers always finish what they take, anything left here never left the queue
        for (Candidate candidate : unfinished.values()) {
            ledger.record(FetchAttempt.cancelled(candidate.identifier(), null, null),
                    positions.get(candidate.identifier()));
            summary = summary.plus(Outcome.CANCELLED);
        }
        if (interrupted) Thread.currentThread().interrupt();
        return summary;
    }

    /**
     * Cancels the current run, if any. Unstarted candidates and interrupted attempts are recorded as cancelled
     * and {@link #run} returns normally. Safe to call from any thread.
     */
    public void cancel() {
        cancelRequested = true;
        FetchPool fetchPool = pool;
        if (fetchPool != null) fetchPool.cancel();
    }

    public Ledger ledger() {
        return ledger;
    }

    public JobConfig config() {
        return config;
    }

    @Override
    public void close() {
        try {
            storage.close();
        } catch (Exception e) {
            log.error("Failed to close storage", e);
        }
        try {
            downloader.close();
        } catch (Exception e) {
            log.error("Failed to close downloader", e);
        }
        try {
            ledger.close();
        } catch (Exception e) {
            log.error("Failed to close ledger", e);
        }
    }
}
