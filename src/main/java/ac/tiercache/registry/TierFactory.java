package ac.tiercache.registry;

import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.tier.CacheTier;
import ac.tiercache.tier.TierContext;

import java.nio.file.Path;

/**
 * Builds the backend for a tier. Construction must not touch the backend; reachability is
 * decided later by the tier's probe.
 */
@FunctionalInterface
public interface TierFactory {

    CacheTier create(Tier tier, TierSettings settings, TierContext context, Path cachePath);
}
