package ac.tiercache.registry;

import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.tier.CacheTier;
import ac.tiercache.tier.CompiledFileTier;
import ac.tiercache.tier.FileTier;
import ac.tiercache.tier.LocalCacheTier;
import ac.tiercache.tier.MappedFileTier;
import ac.tiercache.tier.MemcachedTier;
import ac.tiercache.tier.RedisTier;
import ac.tiercache.tier.RelationalTier;
import ac.tiercache.tier.SharedMemoryTier;
import ac.tiercache.tier.SlotCacheTier;
import ac.tiercache.tier.TierContext;

import java.nio.file.Path;
import java.nio.file.Paths;

public class DefaultTierFactory implements TierFactory {

    @Override
    public CacheTier create(Tier tier, TierSettings settings, TierContext context, Path cachePath) {
        switch (tier) {
            case OPCODE_CACHE:
                return new CompiledFileTier(settings, context, baseDirectory(settings, cachePath, "compiled"));
            case SHARED_MEMORY:
                return new SharedMemoryTier(settings, context);
            case LOCAL_PROCESS_CACHE:
                return new LocalCacheTier(settings, context);
            case LOCAL_PROCESS_CACHE_ALT:
                return new SlotCacheTier(settings, context);
            case MEMORY_MAPPED_FILE:
                return new MappedFileTier(settings, context, baseDirectory(settings, cachePath, "mmap"));
            case NETWORK_KV_STORE:
                return new RedisTier(settings, context);
            case NETWORK_CACHE_CLUSTER:
                return new MemcachedTier(settings, context);
            case FILESYSTEM:
                return new FileTier(settings, context, cachePath);
            case SQL_TABLE:
            case EMBEDDED_DATABASE:
                return new RelationalTier(tier, settings, context);
            default:
                throw new IllegalArgumentException("Unknown tier: " + tier);
        }
    }

    private static Path baseDirectory(TierSettings settings, Path cachePath, String subdirectory) {
        return settings.getBasePath() != null ? Paths.get(settings.getBasePath()) : cachePath.resolve(subdirectory);
    }
}
