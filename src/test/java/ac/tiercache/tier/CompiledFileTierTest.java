package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.MutableClock;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.EnvelopeCodec;
import ac.tiercache.envelope.KeyHasher;
import ac.tiercache.envelope.PayloadCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompiledFileTierTest {

    @TempDir
    Path baseDir;

    private MutableClock clock;
    private CompiledFileTier tier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tier = new CompiledFileTier(new TierSettings(), TierContexts.create(clock), baseDir.resolve("compiled"));
    }

    @Test
    void testReadKeepsDecodedEntryInHeap() {
        // Arrange
        assertThat(tier.probe()).isTrue();
        tier.put("config", CacheEntry.of("value", 60, clock));

        // Act
        tier.get("config");
        tier.get("config");

        // Assert
        assertThat(tier.compiledEntries()).isEqualTo(1);
        assertThat(tier.fileFor("config").getFileName().toString()).endsWith(".entry");
    }

    @Test
    void testMutatingReadValueDoesNotChangeHeapCopy() {
        List<String> tags = new ArrayList<>();
        tags.add("a");
        tier.put("tags", CacheEntry.of(tags, 60, clock));

        @SuppressWarnings("unchecked")
        List<String> first = (List<String>) tier.get("tags").value().getPayload();
        first.add("mutated-after-get");

        assertThat(tier.get("tags").value().getPayload()).isEqualTo(List.of("a"));
        assertThat(tier.compiledEntries()).isEqualTo(1);
    }

    @Test
    void testWriteInvalidatesCompiledEntry() {
        tier.put("config", CacheEntry.of("v1", 60, clock));
        assertThat(tier.get("config").value().getPayload()).isEqualTo("v1");

        tier.put("config", CacheEntry.of("v2", 60, clock));

        assertThat(tier.get("config").value().getPayload()).isEqualTo("v2");
    }

    @Test
    void testChangeOnDiskForcesRecompile() throws Exception {
        // Arrange
        tier.put("config", CacheEntry.of("original", 60, clock));
        assertThat(tier.get("config").value().getPayload()).isEqualTo("original");

        // Act: another process rewrites the file
        EnvelopeCodec codec = new EnvelopeCodec(new PayloadCodec());
        byte[] replacement = codec.encodeBinary(CacheEntry.of("rewritten elsewhere", 60, clock),
                KeyHasher.keyTag("TIERCACHE:config"));
        Files.write(tier.fileFor("config"), replacement);

        // Assert
        assertThat(tier.get("config").value().getPayload()).isEqualTo("rewritten elsewhere");
    }

    @Test
    void testClearResetsHeapTable() {
        tier.put("a", CacheEntry.of("1", 60, clock));
        tier.get("a");

        tier.clear();

        assertThat(tier.compiledEntries()).isZero();
        assertThat(tier.get("a").isHit()).isFalse();
    }

    @Test
    void testCleanupRemovesExpiredFiles() {
        tier.put("a", CacheEntry.of("1", 1, clock));
        tier.put("b", CacheEntry.of("2", 100, clock));
        clock.advanceSeconds(3);

        assertThat(tier.cleanup()).isEqualTo(1);
        assertThat(tier.fileFor("a")).doesNotExist();
    }
}
