package ac.tiercache.spring;

import ac.tiercache.CacheSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Boot properties under {@code tiercache.*}. Tier options are keyed by tier id, for example
 * {@code tiercache.tiers.redis.host}; kebab-case option names are accepted in place of the
 * snake_case ones.
 */
@ConfigurationProperties(prefix = "tiercache")
public class TieredCacheProperties {

    private String cachePath;
    private String prefix = CacheSettings.DEFAULT_PREFIX;
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration defaultTtl = Duration.ofSeconds(CacheSettings.DEFAULT_TTL_SECONDS);
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration promotionTtl = Duration.ofSeconds(CacheSettings.DEFAULT_PROMOTION_TTL_SECONDS);
    private boolean connectionPooling = true;
    private List<String> enabledTiers = new ArrayList<>();
    private Map<String, Map<String, Object>> tiers = new LinkedHashMap<>();

    // Getters and setters
    public String getCachePath() { return cachePath; }
    public void setCachePath(String cachePath) { this.cachePath = cachePath; }

    public String getPrefix() { return prefix; }
    public void setPrefix(String prefix) { this.prefix = prefix; }

    public Duration getDefaultTtl() { return defaultTtl; }
    public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }

    public Duration getPromotionTtl() { return promotionTtl; }
    public void setPromotionTtl(Duration promotionTtl) { this.promotionTtl = promotionTtl; }

    public boolean isConnectionPooling() { return connectionPooling; }
    public void setConnectionPooling(boolean connectionPooling) { this.connectionPooling = connectionPooling; }

    public List<String> getEnabledTiers() { return enabledTiers; }
    public void setEnabledTiers(List<String> enabledTiers) { this.enabledTiers = enabledTiers; }

    public Map<String, Map<String, Object>> getTiers() { return tiers; }
    public void setTiers(Map<String, Map<String, Object>> tiers) { this.tiers = tiers; }
}
