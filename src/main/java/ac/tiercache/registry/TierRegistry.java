package ac.tiercache.registry;

import ac.tiercache.CacheSettings;
import ac.tiercache.LastError;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.tier.CacheTier;
import ac.tiercache.tier.FileTier;
import ac.tiercache.tier.TierContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides once which tiers are usable and keeps them in priority order. Every enabled tier is
 * probed with a real round trip; the filesystem tier first has its directory provisioned.
 * The outcome never changes afterwards.
 */
public class TierRegistry implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TierRegistry.class);

    static final String DIRECTORY_FAILURE = "Unable to create writable cache directory";

    private final CacheSettings settings;
    private final TierFactory factory;
    private final TierContext context;
    private final LastError lastError;
    private final CacheDirectoryProvisioner provisioner;
    private final Map<Tier, TierSettings> tierSettings = new EnumMap<>(Tier.class);
    private final Map<Tier, TierAvailability> availability = new EnumMap<>(Tier.class);

    private volatile List<CacheTier> available = List.of();
    private volatile boolean discovered;
    private volatile Path cachePath;

    public TierRegistry(CacheSettings settings, TierFactory factory, TierContext context,
                        CacheDirectoryProvisioner provisioner) {
        this.settings = settings;
        this.factory = factory;
        this.context = context;
        this.lastError = context.getLastError();
        this.provisioner = provisioner;
        this.cachePath = settings.getCachePath();
        this.tierSettings.putAll(settings.getConfiguredTierSettings());
    }

    // ==================== CONFIGURATION ====================

    /**
     * Merges options into a tier's settings. Refused once discovery has run.
     */
    public synchronized boolean configure(Tier tier, Map<String, ?> options) {
        if (discovered) {
            logger.warn("Ignoring settings for {}: tiers already discovered", tier);
            return false;
        }
        tierSettings.put(tier, settingsFor(tier).merge(options));
        return true;
    }

    public synchronized TierSettings settingsFor(Tier tier) {
        TierSettings configured = tierSettings.get(tier);
        return configured != null ? configured : TierSettings.defaultsFor(tier);
    }

    /**
     * A tier takes part when it is enabled in the engine settings or, for the relational
     * tiers, when a connection target is configured. An explicit {@code enabled} option wins.
     */
    public boolean isEnabled(Tier tier) {
        TierSettings options = settingsFor(tier);
        boolean byDefault = settings.getEnabledTiers().contains(tier)
                || (tier == Tier.SQL_TABLE && options.getJdbcUrl() != null)
                || (tier == Tier.EMBEDDED_DATABASE && options.getDbPath() != null);
        return options.isEnabled(byDefault);
    }

    public Path getCachePath() {
        return cachePath;
    }

    /**
     * Points the filesystem tier at another directory after making sure it is writable.
     */
    public boolean relocateCachePath(Path path) {
        if (!provisioner.ensureWritable(path)) {
            lastError.record("Cache path not writable: " + path);
            return false;
        }
        cachePath = path;
        find(Tier.FILESYSTEM)
                .filter(FileTier.class::isInstance)
                .map(FileTier.class::cast)
                .ifPresent(fileTier -> fileTier.relocate(path));
        return true;
    }

    // ==================== DISCOVERY ====================

    public boolean isDiscovered() {
        return discovered;
    }

    public List<CacheTier> tiers() {
        if (!discovered) {
            discoverTiers();
        }
        return available;
    }

    public synchronized List<CacheTier> discoverTiers() {
        if (discovered) {
            return available;
        }
        List<CacheTier> found = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            if (!isEnabled(tier)) {
                record(tier, false, "disabled");
                continue;
            }
            CacheTier candidate;
            try {
                candidate = factory.create(tier, settingsFor(tier), context, cachePath);
            } catch (RuntimeException e) {
                lastError.record("Failed to initialize " + tier.id() + " tier: " + e.getMessage());
                record(tier, false, e.getMessage());
                continue;
            }

            if (tier == Tier.FILESYSTEM && !provisionDirectory(candidate)) {
                candidate.close();
                record(tier, false, DIRECTORY_FAILURE);
                continue;
            }

            if (candidate.probe()) {
                found.add(candidate);
                record(tier, true, null);
            } else {
                candidate.close();
                record(tier, false, "probe failed");
            }
        }
        available = Collections.unmodifiableList(found);
        discovered = true;
        logger.info("Cache tiers available: {}", found.stream()
                .map(t -> t.tier().id())
                .collect(Collectors.joining(", ", "[", "]")));
        return available;
    }

    private boolean provisionDirectory(CacheTier candidate) {
        Optional<Path> directory = provisioner.provision(cachePath);
        if (directory.isEmpty()) {
            logger.warn("{}; filesystem tier disabled", DIRECTORY_FAILURE);
            lastError.record(DIRECTORY_FAILURE);
            return false;
        }
        cachePath = directory.get();
        if (candidate instanceof FileTier && !directory.get().equals(((FileTier) candidate).getDirectory())) {
            ((FileTier) candidate).relocate(directory.get());
        }
        return true;
    }

    private void record(Tier tier, boolean usable, String reason) {
        availability.put(tier, new TierAvailability(tier, usable, context.getClock().instant(), reason));
        if (!usable) {
            logger.debug("Tier {} not used: {}", tier, reason);
        }
    }

    // ==================== LOOKUP ====================

    public Optional<CacheTier> find(Tier tier) {
        for (CacheTier candidate : tiers()) {
            if (candidate.tier() == tier) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public synchronized Map<Tier, TierAvailability> availability() {
        return Collections.unmodifiableMap(new EnumMap<>(availability));
    }

    @Override
    public synchronized void close() {
        for (CacheTier tier : available) {
            try {
                tier.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing tier {}: {}", tier.tier(), e.getMessage());
            }
        }
    }
}
