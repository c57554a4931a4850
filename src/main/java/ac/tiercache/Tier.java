package ac.tiercache;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Storage tiers in priority order. Lower ordinal means faster and is tried first on reads.
 * The eight core tiers are always candidates; the two relational tiers only take part when
 * they have been configured.
 */
public enum Tier {
    OPCODE_CACHE("compiled", Kind.BYTES),
    SHARED_MEMORY("shared_memory", Kind.BYTES),
    LOCAL_PROCESS_CACHE("local", Kind.MEMORY),
    LOCAL_PROCESS_CACHE_ALT("local_alt", Kind.MEMORY),
    MEMORY_MAPPED_FILE("mmap", Kind.BYTES),
    NETWORK_KV_STORE("redis", Kind.NETWORK),
    NETWORK_CACHE_CLUSTER("memcached", Kind.NETWORK),
    FILESYSTEM("file", Kind.BYTES),
    SQL_TABLE("sql", Kind.RELATIONAL),
    EMBEDDED_DATABASE("embedded_db", Kind.RELATIONAL);

    public enum Kind {
        MEMORY,
        BYTES,
        NETWORK,
        RELATIONAL
    }

    private static final Set<Tier> CORE = EnumSet.range(OPCODE_CACHE, FILESYSTEM);

    private final String id;
    private final Kind kind;

    Tier(String id, Kind kind) {
        this.id = id;
        this.kind = kind;
    }

    public String id() {
        return id;
    }

    public Kind kind() {
        return kind;
    }

    public int rank() {
        return ordinal();
    }

    public boolean isCore() {
        return CORE.contains(this);
    }

    public boolean isNetwork() {
        return kind == Kind.NETWORK;
    }

    public boolean isFasterThan(Tier other) {
        return rank() < other.rank();
    }

    public static Set<Tier> coreTiers() {
        return EnumSet.copyOf(CORE);
    }

    /**
     * Resolves a tier from its identifier or its constant name, case-insensitively.
     */
    public static Optional<Tier> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(normalized) || t.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
