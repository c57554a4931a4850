package ac.tiercache.warming;

import java.time.Duration;
import java.time.Instant;

/**
 * Accumulated runs of a single warmer. Instances are immutable; each run produces a new one.
 */
public class WarmerStats {
    private final long totalWarmed;
    private final int runs;
    private final Duration totalDuration;
    private final Instant lastRun;

    WarmerStats(long totalWarmed, int runs, Duration totalDuration, Instant lastRun) {
        this.totalWarmed = totalWarmed;
        this.runs = runs;
        this.totalDuration = totalDuration;
        this.lastRun = lastRun;
    }

    static WarmerStats first(WarmingResult result, Instant at) {
        return new WarmerStats(result.getWarmedCount(), 1, result.getDuration(), at);
    }

    WarmerStats plus(WarmingResult result, Instant at) {
        return new WarmerStats(totalWarmed + result.getWarmedCount(), runs + 1,
                totalDuration.plus(result.getDuration()), at);
    }

    public long getTotalWarmed() { return totalWarmed; }
    public int getRuns() { return runs; }
    public Duration getTotalDuration() { return totalDuration; }
    public Instant getLastRun() { return lastRun; }

    public Duration getAverageDuration() {
        return runs == 0 ? Duration.ZERO : totalDuration.dividedBy(runs);
    }
}
