package ac.tiercache.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheDirectoryProvisionerTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesMissingDirectory() {
        CacheDirectoryProvisioner provisioner = new CacheDirectoryProvisioner(List.of(), Duration.ZERO);
        Path target = tempDir.resolve("a").resolve("b");

        assertThat(provisioner.provision(target)).contains(target);
        assertThat(target).isDirectory();
    }

    @Test
    void testFallsBackWhenPreferredPathIsUnusable() throws IOException {
        // Given a preferred path below a regular file
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        Path fallback = tempDir.resolve("fallback");
        CacheDirectoryProvisioner provisioner = new CacheDirectoryProvisioner(List.of(fallback), Duration.ZERO);

        // When
        var chosen = provisioner.provision(blocker.resolve("cache"));

        // Then
        assertThat(chosen).contains(fallback);
        assertThat(fallback).isDirectory();
    }

    @Test
    void testReportsFailureWhenNoCandidateWorks() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        CacheDirectoryProvisioner provisioner = new CacheDirectoryProvisioner(
                List.of(blocker.resolve("other")), Duration.ZERO);

        assertThat(provisioner.provision(blocker.resolve("cache"))).isEmpty();
        assertThat(provisioner.ensureWritable(blocker)).isFalse();
    }

    @Test
    void testDefaultFallbacksStartWithProcessTempDirectory() {
        List<Path> fallbacks = CacheDirectoryProvisioner.defaultFallbacks();

        assertThat(fallbacks).isNotEmpty();
        assertThat(fallbacks.get(0).getFileName().toString())
                .isEqualTo("tiercache_" + ProcessHandle.current().pid());
    }
}
