package ac.tiercache.registry;

import ac.tiercache.Tier;

import java.time.Instant;

/**
 * Result of probing one tier during discovery.
 */
public final class TierAvailability {
    private final Tier tier;
    private final boolean available;
    private final Instant probedAt;
    private final String reason;

    TierAvailability(Tier tier, boolean available, Instant probedAt, String reason) {
        this.tier = tier;
        this.available = available;
        this.probedAt = probedAt;
        this.reason = reason;
    }

    public Tier getTier() { return tier; }
    public boolean isAvailable() { return available; }
    public Instant getProbedAt() { return probedAt; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return tier + (available ? " available" : " unavailable (" + reason + ")");
    }
}
