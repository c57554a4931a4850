package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.KeyHasher;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fixed-size, lock-free slot table. Each key hashes to one slot and a newer key simply
 * replaces whatever occupied the slot, so entries may disappear before they expire.
 * Probe canaries use a reserved slot past the end of the table. Payloads are copied on the
 * way in and out so callers never share a mutable value with the table.
 */
public class SlotCacheTier extends AbstractCacheTier {
    private final AtomicReferenceArray<Slot> slots;
    private final int mask;

    public SlotCacheTier(TierSettings settings, TierContext context) {
        super(Tier.LOCAL_PROCESS_CACHE_ALT, settings, context);
        int size = Integer.highestOneBit(Math.max(16, settings.getSlots()));
        this.slots = new AtomicReferenceArray<>(size + 1);
        this.mask = size - 1;
    }

    int capacity() {
        return mask + 1;
    }

    int occupied() {
        int count = 0;
        for (int i = 0; i < capacity(); i++) {
            if (slots.get(i) != null) {
                count++;
            }
        }
        return count;
    }

    private int indexFor(String key) {
        if (isProbeKey(key)) {
            return mask + 1;
        }
        return KeyHasher.narrowHash(key) & mask;
    }

    @Override
    protected Optional<CacheEntry> read(String key) throws CorruptEntryException {
        Slot slot = slots.get(indexFor(key));
        if (slot == null || !slot.key.equals(key)) {
            return Optional.empty();
        }
        return Optional.of(detached(slot.entry));
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws CorruptEntryException {
        slots.set(indexFor(key), new Slot(key, detached(entry)));
        return true;
    }

    /**
     * The table lives on the heap and cannot fail once built, so health needs no round trip.
     */
    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    protected void remove(String key) {
        int index = indexFor(key);
        Slot slot = slots.get(index);
        while (slot != null && slot.key.equals(key)) {
            if (slots.compareAndSet(index, slot, null)) {
                return;
            }
            slot = slots.get(index);
        }
    }

    @Override
    protected void removeAll() {
        for (int i = 0; i < slots.length(); i++) {
            slots.set(i, null);
        }
    }

    private static final class Slot {
        final String key;
        final CacheEntry entry;

        Slot(String key, CacheEntry entry) {
            this.key = key;
            this.entry = entry;
        }
    }
}
