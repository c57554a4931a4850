package ac.tiercache;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Engine-wide settings. Built once and handed to {@link TieredCacheEngine}; per-tier options
 * may still be adjusted on the engine until tier discovery has run.
 */
public class CacheSettings {
    public static final String DEFAULT_PREFIX = "TIERCACHE:";
    public static final long DEFAULT_TTL_SECONDS = 3600L;
    public static final long DEFAULT_PROMOTION_TTL_SECONDS = 3600L;

    private final Path cachePath;
    private final String prefix;
    private final long defaultTtlSeconds;
    private final long promotionTtlSeconds;
    private final boolean connectionPooling;
    private final Set<Tier> enabledTiers;
    private final Map<Tier, TierSettings> tierSettings;
    private final List<Path> fallbackCachePaths;
    private final Clock clock;

    public static class Builder {
        private Path cachePath;
        private String prefix = DEFAULT_PREFIX;
        private long defaultTtlSeconds = DEFAULT_TTL_SECONDS;
        private long promotionTtlSeconds = DEFAULT_PROMOTION_TTL_SECONDS;
        private boolean connectionPooling = true;
        private EnumSet<Tier> enabledTiers;
        private final Map<Tier, TierSettings> tierSettings = new EnumMap<>(Tier.class);
        private List<Path> fallbackCachePaths;
        private Clock clock = Clock.systemUTC();

        public Builder cachePath(Path path) {
            this.cachePath = path;
            return this;
        }

        public Builder cachePath(String path) {
            this.cachePath = path != null ? Paths.get(path) : null;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix != null ? prefix : "";
            return this;
        }

        public Builder defaultTtl(long seconds) {
            this.defaultTtlSeconds = seconds;
            return this;
        }

        public Builder promotionTtl(long seconds) {
            this.promotionTtlSeconds = seconds;
            return this;
        }

        public Builder connectionPooling(boolean enable) {
            this.connectionPooling = enable;
            return this;
        }

        public Builder enabledTiers(Set<Tier> tiers) {
            this.enabledTiers = EnumSet.noneOf(Tier.class);
            this.enabledTiers.addAll(tiers);
            return this;
        }

        public Builder enabledTiers(Tier first, Tier... rest) {
            this.enabledTiers = EnumSet.of(first, rest);
            return this;
        }

        public Builder tier(Tier tier, Map<String, ?> options) {
            TierSettings base = tierSettings.getOrDefault(tier, TierSettings.defaultsFor(tier));
            tierSettings.put(tier, base.merge(options));
            return this;
        }

        /**
         * Directories tried, in order, when the filesystem tier cannot use {@link #cachePath}.
         */
        public Builder fallbackCachePaths(List<Path> paths) {
            this.fallbackCachePaths = List.copyOf(paths);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CacheSettings build() {
            if (defaultTtlSeconds <= 0) {
                throw new CacheConfigurationException("Default TTL must be positive: " + defaultTtlSeconds);
            }
            if (promotionTtlSeconds <= 0) {
                throw new CacheConfigurationException("Promotion TTL must be positive: " + promotionTtlSeconds);
            }
            return new CacheSettings(this);
        }
    }

    private CacheSettings(Builder builder) {
        this.cachePath = builder.cachePath != null ? builder.cachePath : defaultCachePath();
        this.prefix = builder.prefix;
        this.defaultTtlSeconds = builder.defaultTtlSeconds;
        this.promotionTtlSeconds = builder.promotionTtlSeconds;
        this.connectionPooling = builder.connectionPooling;
        this.enabledTiers = builder.enabledTiers != null
                ? Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledTiers))
                : Collections.unmodifiableSet(defaultEnabledTiers(builder.tierSettings));
        this.tierSettings = Collections.unmodifiableMap(new EnumMap<>(builder.tierSettings));
        this.fallbackCachePaths = builder.fallbackCachePaths;
        this.clock = builder.clock;
    }

    private static Set<Tier> defaultEnabledTiers(Map<Tier, TierSettings> configured) {
        Set<Tier> tiers = Tier.coreTiers();
        TierSettings sql = configured.get(Tier.SQL_TABLE);
        if (sql != null && sql.getJdbcUrl() != null) {
            tiers.add(Tier.SQL_TABLE);
        }
        TierSettings embedded = configured.get(Tier.EMBEDDED_DATABASE);
        if (embedded != null && embedded.getDbPath() != null) {
            tiers.add(Tier.EMBEDDED_DATABASE);
        }
        return tiers;
    }

    public static Path defaultCachePath() {
        return Paths.get(System.getProperty("java.io.tmpdir"), "tiercache");
    }

    // Getters
    public Path getCachePath() { return cachePath; }
    public String getPrefix() { return prefix; }
    public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
    public long getPromotionTtlSeconds() { return promotionTtlSeconds; }
    public boolean isConnectionPooling() { return connectionPooling; }
    public Set<Tier> getEnabledTiers() { return enabledTiers; }
    public Clock getClock() { return clock; }

    /**
     * Explicit fallback directories, or {@code null} to use the built-in candidates.
     */
    public List<Path> getFallbackCachePaths() { return fallbackCachePaths; }

    public TierSettings getTierSettings(Tier tier) {
        TierSettings settings = tierSettings.get(tier);
        return settings != null ? settings : TierSettings.defaultsFor(tier);
    }

    public Map<Tier, TierSettings> getConfiguredTierSettings() {
        return tierSettings;
    }

    public static Builder builder() {
        return new Builder();
    }
}
