package ac.tiercache.stats;

import ac.tiercache.Tier;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache statistics for the tiered engine: overall request counters plus hits, misses, writes
 * and errors per tier. Thread-safe implementation using atomic operations.
 */
public class CacheStatistics {
    // Overall statistics
    private final AtomicLong requests = new AtomicLong(0);
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong promotions = new AtomicLong(0);
    private final AtomicLong sets = new AtomicLong(0);
    private final AtomicLong rejectedSets = new AtomicLong(0);
    private final AtomicLong deletes = new AtomicLong(0);

    // Per tier statistics
    private final Map<Tier, TierCounters> tiers = new EnumMap<>(Tier.class);

    // Timing
    private volatile LocalDateTime createdAt = LocalDateTime.now();
    private volatile LocalDateTime lastResetAt = LocalDateTime.now();

    public CacheStatistics() {
        for (Tier tier : Tier.values()) {
            tiers.put(tier, new TierCounters());
        }
    }

    // ==================== REQUEST TRACKING ====================

    public void incrementRequests() {
        requests.incrementAndGet();
    }

    public void incrementHits() {
        hits.incrementAndGet();
    }

    public void incrementMisses() {
        misses.incrementAndGet();
    }

    public void incrementPromotions() {
        promotions.incrementAndGet();
    }

    public void incrementSets() {
        sets.incrementAndGet();
    }

    public void incrementRejectedSets() {
        rejectedSets.incrementAndGet();
    }

    public void incrementDeletes() {
        deletes.incrementAndGet();
    }

    public long getRequests() { return requests.get(); }
    public long getHits() { return hits.get(); }
    public long getMisses() { return misses.get(); }
    public long getPromotions() { return promotions.get(); }
    public long getSets() { return sets.get(); }
    public long getRejectedSets() { return rejectedSets.get(); }
    public long getDeletes() { return deletes.get(); }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }

    public double getMissRate() {
        return 1.0 - getHitRate();
    }

    // ==================== TIER STATISTICS ====================

    public void recordTierHit(Tier tier) {
        tiers.get(tier).hits.incrementAndGet();
    }

    public void recordTierMiss(Tier tier) {
        tiers.get(tier).misses.incrementAndGet();
    }

    public void recordTierWrite(Tier tier) {
        tiers.get(tier).writes.incrementAndGet();
    }

    public void recordTierError(Tier tier) {
        tiers.get(tier).errors.incrementAndGet();
    }

    public long getTierHits(Tier tier) { return tiers.get(tier).hits.get(); }
    public long getTierMisses(Tier tier) { return tiers.get(tier).misses.get(); }
    public long getTierWrites(Tier tier) { return tiers.get(tier).writes.get(); }
    public long getTierErrors(Tier tier) { return tiers.get(tier).errors.get(); }

    public double getTierHitRate(Tier tier) {
        TierCounters counters = tiers.get(tier);
        long total = counters.hits.get() + counters.misses.get();
        return total == 0 ? 0.0 : (double) counters.hits.get() / total;
    }

    // ==================== TIMING ====================

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getLastResetAt() {
        return lastResetAt;
    }

    // ==================== UTILITY METHODS ====================

    /**
     * Resets all counters to zero and updates the lastResetAt timestamp.
     */
    public void reset() {
        requests.set(0);
        hits.set(0);
        misses.set(0);
        promotions.set(0);
        sets.set(0);
        rejectedSets.set(0);
        deletes.set(0);
        tiers.values().forEach(TierCounters::reset);
        lastResetAt = LocalDateTime.now();
    }

    public CacheStatisticsSnapshot getSnapshot() {
        Map<Tier, TierStatisticsSnapshot> perTier = new EnumMap<>(Tier.class);
        tiers.forEach((tier, counters) -> perTier.put(tier, counters.snapshot()));
        return new CacheStatisticsSnapshot(
            getRequests(),
            getHits(),
            getMisses(),
            getPromotions(),
            getSets(),
            getRejectedSets(),
            getDeletes(),
            perTier,
            getCreatedAt(),
            getLastResetAt()
        );
    }

    @Override
    public String toString() {
        return String.format(
            "CacheStatistics{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, promotions=%d, sets=%d, " +
            "rejectedSets=%d, deletes=%d, createdAt=%s, lastResetAt=%s}",
            getRequests(), getHits(), getMisses(), getHitRate() * 100, getPromotions(), getSets(),
            getRejectedSets(), getDeletes(), getCreatedAt(), getLastResetAt()
        );
    }

    /**
     * Formatted report with one line per tier that saw any traffic.
     */
    public String getDetailedReport() {
        StringBuilder report = new StringBuilder(String.format("""
            Cache Statistics Report
            =======================
            Overall Performance:
            - Total Requests: %d
            - Cache Hits: %d
            - Cache Misses: %d
            - Hit Rate: %.2f%%
            - Promotions: %d
            - Sets: %d (rejected: %d)
            - Deletes: %d

            Tiers:
            """,
            getRequests(), getHits(), getMisses(), getHitRate() * 100, getPromotions(),
            getSets(), getRejectedSets(), getDeletes()));
        tiers.forEach((tier, counters) -> {
            if (counters.isEmpty()) {
                return;
            }
            report.append(String.format("- %s: hits=%d, misses=%d, writes=%d, errors=%d, hitRate=%.2f%%%n",
                tier.id(), counters.hits.get(), counters.misses.get(), counters.writes.get(),
                counters.errors.get(), getTierHitRate(tier) * 100));
        });
        return report.toString();
    }

    private static final class TierCounters {
        private final AtomicLong hits = new AtomicLong(0);
        private final AtomicLong misses = new AtomicLong(0);
        private final AtomicLong writes = new AtomicLong(0);
        private final AtomicLong errors = new AtomicLong(0);

        void reset() {
            hits.set(0);
            misses.set(0);
            writes.set(0);
            errors.set(0);
        }

        boolean isEmpty() {
            return hits.get() == 0 && misses.get() == 0 && writes.get() == 0 && errors.get() == 0;
        }

        TierStatisticsSnapshot snapshot() {
            return new TierStatisticsSnapshot(hits.get(), misses.get(), writes.get(), errors.get());
        }
    }

    /**
     * Immutable per-tier counters.
     */
    public static class TierStatisticsSnapshot {
        private final long hits;
        private final long misses;
        private final long writes;
        private final long errors;

        public TierStatisticsSnapshot(long hits, long misses, long writes, long errors) {
            this.hits = hits;
            this.misses = misses;
            this.writes = writes;
            this.errors = errors;
        }

        public long getHits() { return hits; }
        public long getMisses() { return misses; }
        public long getWrites() { return writes; }
        public long getErrors() { return errors; }
        public double getHitRate() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0.0;
        }
    }

    /**
     * Immutable snapshot of cache statistics at a point in time.
     */
    public static class CacheStatisticsSnapshot {
        private final long requests;
        private final long hits;
        private final long misses;
        private final long promotions;
        private final long sets;
        private final long rejectedSets;
        private final long deletes;
        private final Map<Tier, TierStatisticsSnapshot> tiers;
        private final LocalDateTime createdAt;
        private final LocalDateTime lastResetAt;
        private final LocalDateTime snapshotAt;

        public CacheStatisticsSnapshot(long requests, long hits, long misses, long promotions, long sets,
                                       long rejectedSets, long deletes, Map<Tier, TierStatisticsSnapshot> tiers,
                                       LocalDateTime createdAt, LocalDateTime lastResetAt) {
            this.requests = requests;
            this.hits = hits;
            this.misses = misses;
            this.promotions = promotions;
            this.sets = sets;
            this.rejectedSets = rejectedSets;
            this.deletes = deletes;
            this.tiers = Collections.unmodifiableMap(tiers);
            this.createdAt = createdAt;
            this.lastResetAt = lastResetAt;
            this.snapshotAt = LocalDateTime.now();
        }

        // Getters
        public long getRequests() { return requests; }
        public long getHits() { return hits; }
        public long getMisses() { return misses; }
        public long getPromotions() { return promotions; }
        public long getSets() { return sets; }
        public long getRejectedSets() { return rejectedSets; }
        public long getDeletes() { return deletes; }
        public double getHitRate() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0.0;
        }
        public TierStatisticsSnapshot getTier(Tier tier) { return tiers.get(tier); }
        public Map<Tier, TierStatisticsSnapshot> getTiers() { return tiers; }
        public LocalDateTime getCreatedAt() { return createdAt; }
        public LocalDateTime getLastResetAt() { return lastResetAt; }
        public LocalDateTime getSnapshotAt() { return snapshotAt; }

        @Override
        public String toString() {
            return String.format(
                "CacheStatisticsSnapshot{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, promotions=%d, " +
                "sets=%d, rejectedSets=%d, deletes=%d, snapshotAt=%s}",
                requests, hits, misses, getHitRate() * 100, promotions, sets, rejectedSets, deletes, snapshotAt
            );
        }
    }
}
