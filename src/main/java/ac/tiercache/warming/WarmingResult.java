package ac.tiercache.warming;

import java.time.Duration;

/**
 * Outcome of one warmer run.
 */
public class WarmingResult {
    private final String warmer;
    private final int warmedCount;
    private final Duration duration;

    public WarmingResult(String warmer, int warmedCount, Duration duration) {
        this.warmer = warmer;
        this.warmedCount = warmedCount;
        this.duration = duration;
    }

    public String getWarmer() { return warmer; }
    public int getWarmedCount() { return warmedCount; }
    public Duration getDuration() { return duration; }

    public boolean isSuccess() {
        return warmedCount > 0;
    }

    @Override
    public String toString() {
        return String.format("WarmingResult{warmer=%s, warmedCount=%d, duration=%dms}",
                warmer, warmedCount, duration.toMillis());
    }
}
