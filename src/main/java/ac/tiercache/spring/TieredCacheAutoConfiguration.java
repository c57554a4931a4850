package ac.tiercache.spring;

import ac.tiercache.CacheConfigurationException;
import ac.tiercache.CacheSettings;
import ac.tiercache.Tier;
import ac.tiercache.TieredCacheEngine;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

@AutoConfiguration
@EnableConfigurationProperties(TieredCacheProperties.class)
public class TieredCacheAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CacheSettings tieredCacheSettings(TieredCacheProperties properties) {
        CacheSettings.Builder builder = CacheSettings.builder()
                .cachePath(properties.getCachePath())
                .prefix(properties.getPrefix())
                .defaultTtl(properties.getDefaultTtl().getSeconds())
                .promotionTtl(properties.getPromotionTtl().getSeconds())
                .connectionPooling(properties.isConnectionPooling());

        if (!properties.getEnabledTiers().isEmpty()) {
            EnumSet<Tier> enabled = EnumSet.noneOf(Tier.class);
            for (String id : properties.getEnabledTiers()) {
                enabled.add(tier(id));
            }
            builder.enabledTiers(enabled);
        }
        properties.getTiers().forEach((id, options) -> builder.tier(tier(id), snakeCase(options)));
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TieredCacheEngine tieredCacheEngine(CacheSettings tieredCacheSettings) {
        return new TieredCacheEngine(tieredCacheSettings);
    }

    @Bean
    @ConditionalOnMissingBean(CacheManager.class)
    public TieredCacheManager cacheManager(TieredCacheEngine tieredCacheEngine) {
        return new TieredCacheManager(tieredCacheEngine);
    }

    private static Tier tier(String id) {
        return Tier.fromId(id.trim())
                .orElseThrow(() -> new CacheConfigurationException("Unknown cache tier: " + id));
    }

    private static Map<String, Object> snakeCase(Map<String, Object> options) {
        Map<String, Object> converted = new LinkedHashMap<>();
        options.forEach((key, value) -> converted.put(key.replace('-', '_'), value));
        return converted;
    }
}
