package org.netpreserve.scriptorium;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.config.FetchConfig;
import org.netpreserve.scriptorium.util.NamedThreadFactory;
import org.netpreserve.scriptorium.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads that take candidates in input order and try their URL hints one after another.
 * Workers never touch the ledger: every outcome is posted to the event queue, and each candidate taken from the
 * queue produces exactly one {@link Event.Finished}.
 */
public class FetchPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchPool.class);
    private final Queue<Candidate> pending = new ConcurrentLinkedQueue<>();
    private final BlockingQueue<Event> events;
    private final ExecutorService executor;
    private final FetchContext context;
    private final int workers;
    private final AtomicInteger running = new AtomicInteger();
    private volatile boolean cancelled;

    public FetchPool(FetchConfig config, Downloader downloader, TrustPolicy trust, ContentVerifier verifier,
                     Storage storage, BlockingQueue<Event> events) {
        this.workers = config.workers();
        this.events = events;
        this.context = new FetchContext(config, downloader, new HostLimiter(config.delay()), trust, verifier,
                storage, new Backoff(config.backoff()), () -> cancelled);
        this.executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("worker"));
    }

    /**
     * Queues the candidates in order and starts the workers. A {@link Event.Drained} is posted once they have all
     * exited.
     */
    public void start(List<Candidate> candidates) {
        pending.addAll(candidates);
        running.set(workers);
        for (int i = 0; i < workers; i++) {
            String id = String.valueOf(i + 1);
            executor.execute(() -> {
                try {
                    work(id);
                } finally {
                    if (running.decrementAndGet() == 0) events.offer(new Event.Drained());
                }
            });
        }
        log.info("Started {} workers for {} candidates", workers, candidates.size());
    }

    private void work(String id) {
        while (true) {
            Candidate candidate = pending.poll();
            if (candidate == null) return;
            if (cancelled) {
                events.offer(new Event.Attempted(FetchAttempt.cancelled(candidate.identifier(), null, null)));
                finish(candidate, Outcome.CANCELLED, null);
                continue;
            }
            log.atDebug().addKeyValue("worker", id).addKeyValue("id", candidate.identifier()).log("Taking candidate");
            try {
                process(candidate);
            } catch (Throwable t) {
                log.error("Worker {} crashed on {}", id, candidate.identifier(), t);
                events.offer(new Event.Attempted(new FetchAttempt(candidate.identifier(), null, null,
                        Instant.now(), Outcome.FAILURE, null, "internal", 0, 0, null, null)));
                finish(candidate, Outcome.FAILURE, null);
            }
        }
    }

    private void process(Candidate candidate) {
        boolean anyFailure = false;
        for (Url url : candidate.urls()) {
            var result = new Attempt(candidate, url, context).run();
            events.offer(new Event.Attempted(result.attempt()));
            switch (result.attempt().outcome()) {
                case SUCCESS -> {
                    finish(candidate, Outcome.SUCCESS, result.archived());
                    return;
                }
                case CANCELLED -> {
                    finish(candidate, Outcome.CANCELLED, null);
                    return;
                }
                case REJECTED -> {
                }
                default -> anyFailure = true;
            }
        }
        finish(candidate, anyFailure || candidate.urls().isEmpty() ? Outcome.FAILURE : Outcome.REJECTED, null);
    }

    private void finish(Candidate candidate, Outcome outcome, @Nullable ArchivedRecord archived) {
        events.offer(new Event.Finished(candidate, outcome, archived));
    }

    /**
     * Stops the run: queued candidates are finished as cancelled and in-flight requests and backoff sleeps are
     * interrupted.
     */
    public void cancel() {
        if (cancelled) return;
        cancelled = true;
        log.warn("Cancelling fetch pool");
        executor.shutdownNow();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Messages from the workers to the single ledger writer.
     */
    public sealed interface Event {
        record Attempted(FetchAttempt attempt) implements Event {
        }

        record Finished(Candidate candidate, Outcome outcome, @Nullable ArchivedRecord archived) implements Event {
        }

        /**
         * Every worker has exited, no further events follow.
         */
        record Drained() implements Event {
        }
    }
}
