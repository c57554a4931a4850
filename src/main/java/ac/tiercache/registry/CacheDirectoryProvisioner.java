package ac.tiercache.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.CodeSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds a writable directory for the filesystem tier. Each candidate gets up to three attempts;
 * between attempts an existing directory has its permissions repaired, first to 0755 and
 * then to 0777.
 */
public class CacheDirectoryProvisioner {
    private static final Logger logger = LoggerFactory.getLogger(CacheDirectoryProvisioner.class);

    static final int MAX_ATTEMPTS = 3;
    private static final Set<PosixFilePermission> OWNER_WRITABLE = PosixFilePermissions.fromString("rwxr-xr-x");
    private static final Set<PosixFilePermission> WORLD_WRITABLE = PosixFilePermissions.fromString("rwxrwxrwx");

    private final List<Path> fallbacks;
    private final Duration retryDelay;

    public CacheDirectoryProvisioner(List<Path> fallbacks, Duration retryDelay) {
        this.fallbacks = List.copyOf(fallbacks);
        this.retryDelay = retryDelay;
    }

    public CacheDirectoryProvisioner(List<Path> fallbacks) {
        this(fallbacks, Duration.ofMillis(100));
    }

    /**
     * Process temp directory, working directory and the directory holding this library.
     */
    public static List<Path> defaultFallbacks() {
        List<Path> candidates = new ArrayList<>();
        candidates.add(Paths.get(System.getProperty("java.io.tmpdir"), "tiercache_" + ProcessHandle.current().pid()));
        candidates.add(Paths.get(System.getProperty("user.dir"), "cache"));
        libraryDirectory().ifPresent(dir -> candidates.add(dir.resolve("cache")));
        return candidates;
    }

    private static Optional<Path> libraryDirectory() {
        try {
            CodeSource source = CacheDirectoryProvisioner.class.getProtectionDomain().getCodeSource();
            if (source == null || source.getLocation() == null) {
                return Optional.empty();
            }
            Path location = Paths.get(source.getLocation().toURI());
            return Optional.ofNullable(Files.isDirectory(location) ? location : location.getParent());
        } catch (URISyntaxException | IllegalArgumentException | SecurityException e) {
            logger.debug("Library location unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns the first candidate that is, or can be made, a writable directory.
     */
    public Optional<Path> provision(Path preferred) {
        List<Path> candidates = new ArrayList<>();
        if (preferred != null) {
            candidates.add(preferred);
        }
        candidates.addAll(fallbacks);
        for (Path candidate : candidates) {
            if (ensureWritable(candidate)) {
                if (!candidate.equals(preferred)) {
                    logger.info("Using fallback cache directory {}", candidate);
                }
                return Optional.of(candidate);
            }
            logger.warn("Cache directory {} is not usable", candidate);
        }
        return Optional.empty();
    }

    public boolean ensureWritable(Path directory) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                if (!Files.exists(directory)) {
                    createDirectory(directory);
                }
                if (Files.isDirectory(directory) && Files.isWritable(directory)) {
                    return true;
                }
                if (Files.isDirectory(directory)) {
                    repairPermissions(directory, attempt == 1 ? OWNER_WRITABLE : WORLD_WRITABLE);
                    if (Files.isWritable(directory)) {
                        return true;
                    }
                }
            } catch (IOException | UnsupportedOperationException | SecurityException e) {
                logger.debug("Attempt {}/{} to prepare {} failed: {}", attempt, MAX_ATTEMPTS, directory, e.getMessage());
            }
            if (attempt < MAX_ATTEMPTS && !pause()) {
                return false;
            }
        }
        return false;
    }

    private static void createDirectory(Path directory) throws IOException {
        if (supportsPosix()) {
            Files.createDirectories(directory, PosixFilePermissions.asFileAttribute(OWNER_WRITABLE));
        } else {
            Files.createDirectories(directory);
        }
    }

    private static void repairPermissions(Path directory, Set<PosixFilePermission> permissions) throws IOException {
        if (supportsPosix()) {
            logger.debug("Setting permissions {} on {}", PosixFilePermissions.toString(permissions), directory);
            Files.setPosixFilePermissions(directory, permissions);
        } else if (!directory.toFile().setWritable(true, false)) {
            throw new IOException("Unable to make " + directory + " writable");
        }
    }

    private static boolean supportsPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }

    private boolean pause() {
        if (retryDelay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
