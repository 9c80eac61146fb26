package org.netpreserve.scriptorium;

/**
 * Per-outcome candidate counts for one run.
 *
 * @param candidates candidates loaded from the source
 * @param attempted  candidates handed to the worker pool
 * @param skipped    candidates that already had an active archived record
 */
public record RunSummary(
        int candidates,
        int attempted,
        int succeeded,
        int skipped,
        int rejected,
        int failed,
        int cancelled) {

    public static final RunSummary EMPTY = new RunSummary(0, 0, 0, 0, 0, 0, 0);

    public RunSummary plus(Outcome outcome) {
        return switch (outcome) {
            case SUCCESS -> new RunSummary(candidates, attempted, succeeded + 1, skipped, rejected, failed, cancelled);
            case SKIPPED -> new RunSummary(candidates, attempted, succeeded, skipped + 1, rejected, failed, cancelled);
            case REJECTED -> new RunSummary(candidates, attempted, succeeded, skipped, rejected + 1, failed, cancelled);
            case FAILURE -> new RunSummary(candidates, attempted, succeeded, skipped, rejected, failed + 1, cancelled);
            case CANCELLED -> new RunSummary(candidates, attempted, succeeded, skipped, rejected, failed, cancelled + 1);
        };
    }

    public RunSummary withCandidates(int candidates) {
        return new RunSummary(candidates, attempted, succeeded, skipped, rejected, failed, cancelled);
    }

    public RunSummary withAttempted(int attempted) {
        return new RunSummary(candidates, attempted, succeeded, skipped, rejected, failed, cancelled);
    }

    @Override
    public String toString() {
        return String.format("%d candidates: %d attempted, %d succeeded, %d skipped, %d rejected, %d failed, " +
                             "%d cancelled", candidates, attempted, succeeded, skipped, rejected, failed, cancelled);
    }
}
