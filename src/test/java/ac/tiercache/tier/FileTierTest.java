package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.LastError;
import ac.tiercache.MutableClock;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.KeyHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileTierTest {

    @TempDir
    Path cacheDir;

    private MutableClock clock;
    private LastError lastError;
    private FileTier tier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        lastError = new LastError();
        tier = new FileTier(new TierSettings(), TierContexts.create(clock, lastError), cacheDir);
    }

    @Test
    void testProbeSucceedsOnWritableDirectory() throws Exception {
        assertThat(tier.probe()).isTrue();
        try (var files = Files.list(cacheDir)) {
            assertThat(files.count()).isZero();
        }
    }

    @Test
    void testRoundTrip() {
        // Arrange
        Map<String, Object> value = new HashMap<>();
        value.put("name", "Ada");

        // Act
        TierResult<Void> put = tier.put("user:42", CacheEntry.of(value, 60, clock));
        TierResult<CacheEntry> result = tier.get("user:42");

        // Assert
        assertThat(put.isSuccess()).isTrue();
        assertThat(result.isHit()).isTrue();
        assertThat(result.value().getPayload()).isEqualTo(value);
    }

    @Test
    void testFileIsNamedAfterPrefixedKeyHash() throws Exception {
        tier.put("user:42", CacheEntry.of("Ada", 60, clock));

        Path expected = cacheDir.resolve(KeyHasher.fileName("TIERCACHE:user:42"));
        assertThat(expected).exists();
        String header = new String(Files.readAllBytes(expected), 0, 10, StandardCharsets.US_ASCII);
        assertThat(header).isEqualTo(String.valueOf(clock.epochSecond() + 60));
    }

    @Test
    void testExpiredEntryIsDeletedOnReadAndCountedByCleanup() {
        // Arrange
        tier.put("short", CacheEntry.of("value", 1, clock));
        clock.advanceSeconds(2);

        // Act
        TierResult<CacheEntry> result = tier.get("short");

        // Assert
        assertThat(result.isHit()).isFalse();
        assertThat(result.isSuccess()).isTrue();
        assertThat(tier.fileFor("short")).doesNotExist();
        assertThat(tier.cleanup()).isEqualTo(1);
        assertThat(tier.cleanup()).isZero();
    }

    @Test
    void testCleanupSweepsExpiredFilesOnly() {
        tier.put("old-1", CacheEntry.of("a", 10, clock));
        tier.put("old-2", CacheEntry.of("b", 10, clock));
        tier.put("fresh", CacheEntry.of("c", 1000, clock));
        clock.advanceSeconds(11);

        int removed = tier.cleanup();

        assertThat(removed).isEqualTo(2);
        assertThat(tier.get("fresh").isHit()).isTrue();
    }

    @Test
    void testCorruptFileIsTreatedAsMissAndRemoved() throws Exception {
        Path file = tier.fileFor("broken");
        Files.write(file, "not-a-cache-entry".getBytes(StandardCharsets.US_ASCII));

        TierResult<CacheEntry> result = tier.get("broken");

        assertThat(result.isHit()).isFalse();
        assertThat(result.isFailure()).isFalse();
        assertThat(file).doesNotExist();
    }

    @Test
    void testClearOnlyRemovesCacheFiles() throws Exception {
        tier.put("a", CacheEntry.of("1", 60, clock));
        tier.put("b", CacheEntry.of("2", 60, clock));
        Path foreign = Files.writeString(cacheDir.resolve("README.txt"), "keep me");

        assertThat(tier.clear().isSuccess()).isTrue();

        assertThat(tier.get("a").isHit()).isFalse();
        assertThat(tier.get("b").isHit()).isFalse();
        assertThat(foreign).exists();
    }

    @Test
    void testDeleteOfMissingKeySucceeds() {
        assertThat(tier.delete("never-written").isSuccess()).isTrue();
    }

    @Test
    void testRelocateMovesSubsequentWrites(@TempDir Path other) {
        tier.relocate(other);

        tier.put("moved", CacheEntry.of("value", 60, clock));

        assertThat(other.resolve(KeyHasher.fileName("TIERCACHE:moved"))).exists();
        assertThat(tier.getDirectory()).isEqualTo(other);
    }

    @Test
    void testWriteIntoMissingDirectoryFailsAndRecordsLastError() {
        tier.relocate(cacheDir.resolve("gone").resolve("deeper"));

        TierResult<Void> result = tier.put("key", CacheEntry.of("value", 60, clock));

        assertThat(result.isFailure()).isTrue();
        assertThat(lastError.get()).hasValueSatisfying(message -> assertThat(message).contains("file put failed"));
    }
}
