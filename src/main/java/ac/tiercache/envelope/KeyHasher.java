package ac.tiercache.envelope;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Key derivations used to name stored objects.
 */
public final class KeyHasher {
    private static final HashFunction WIDE = Hashing.murmur3_128();
    private static final HashFunction NARROW = Hashing.murmur3_32_fixed();

    private KeyHasher() {
    }

    /**
     * 32 lowercase hex characters, safe to use as a file name.
     */
    public static String fileName(String key) {
        return WIDE.hashString(key, StandardCharsets.UTF_8).toString();
    }

    /**
     * 64-bit tag stored next to the payload so a reader can tell its own key from a colliding one.
     */
    public static long keyTag(String key) {
        return WIDE.hashString(key, StandardCharsets.UTF_8).asLong();
    }

    public static int narrowHash(String key) {
        return NARROW.hashString(key, StandardCharsets.UTF_8).asInt();
    }
}
