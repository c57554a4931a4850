package ac.tiercache.warming;

import ac.tiercache.CacheSettings;
import ac.tiercache.MutableClock;
import ac.tiercache.Tier;
import ac.tiercache.TieredCacheEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileCacheWarmerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private TieredCacheEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        engine = new TieredCacheEngine(CacheSettings.builder()
                .cachePath(tempDir.resolve("cache"))
                .fallbackCachePaths(List.of())
                .enabledTiers(Tier.LOCAL_PROCESS_CACHE)
                .clock(clock)
                .build());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void testWarmsRawJsonAndLineFiles() throws Exception {
        // Arrange
        Path raw = Files.writeString(tempDir.resolve("banner.txt"), "Welcome!");
        Path json = Files.writeString(tempDir.resolve("config.json"), "{\"theme\":\"dark\",\"size\":3}");
        Path lines = Files.writeString(tempDir.resolve("hosts.txt"), "alpha\nbeta\n");
        List<FileCacheWarmer.Entry> entries = new ArrayList<>();
        entries.add(FileCacheWarmer.Entry.raw(raw, "banner"));
        entries.add(new FileCacheWarmer.Entry(json, "config", 0, FileCacheWarmer.Parser.JSON));
        entries.add(new FileCacheWarmer.Entry(lines, "hosts", 0, FileCacheWarmer.Parser.LINES));
        FileCacheWarmer warmer = new FileCacheWarmer("static-files", entries);

        // Act
        int warmed = warmer.warm(engine);

        // Assert
        assertThat(warmed).isEqualTo(3);
        assertThat(engine.get("banner")).contains("Welcome!");
        assertThat(engine.get("config", Map.class)).hasValueSatisfying(config -> {
            assertThat(config.get("theme")).isEqualTo("dark");
            assertThat(config.get("size")).isEqualTo(3);
        });
        assertThat(engine.get("hosts", List.class)).hasValueSatisfying(hosts ->
                assertThat(hosts).containsExactly("alpha", "beta"));
    }

    @Test
    void testMissingAndMalformedFilesAreSkipped() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.json"), "{not json");
        List<FileCacheWarmer.Entry> entries = new ArrayList<>();
        entries.add(FileCacheWarmer.Entry.raw(tempDir.resolve("absent.txt"), "absent"));
        entries.add(new FileCacheWarmer.Entry(broken, "broken", 0, FileCacheWarmer.Parser.JSON));
        FileCacheWarmer warmer = new FileCacheWarmer("static-files", entries);

        assertThat(warmer.warm(engine)).isZero();
        assertThat(engine.get("absent")).isEmpty();
        assertThat(engine.get("broken")).isEmpty();
    }

    @Test
    void testEntryTtlOverridesDefault() throws Exception {
        Path shortLived = Files.writeString(tempDir.resolve("short.txt"), "short");
        Path longLived = Files.writeString(tempDir.resolve("long.txt"), "long");
        List<FileCacheWarmer.Entry> entries = new ArrayList<>();
        entries.add(new FileCacheWarmer.Entry(shortLived, "short", 10, FileCacheWarmer.Parser.RAW));
        entries.add(FileCacheWarmer.Entry.raw(longLived, "long"));
        FileCacheWarmer warmer = new FileCacheWarmer("static-files", entries, 600, new ObjectMapper());

        warmer.warm(engine);
        clock.advanceSeconds(11);

        assertThat(engine.get("short")).isEmpty();
        assertThat(engine.get("long")).contains("long");
    }

    @Test
    void testWarmerWithoutEntriesIsNotApplicable() {
        assertThat(new FileCacheWarmer("empty", new ArrayList<>()).isApplicable()).isFalse();
    }
}
