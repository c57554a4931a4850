package ac.tiercache;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Per-tier options. Options arrive as loosely typed maps with snake_case keys and are
 * bound with Jackson; keys a tier does not know about are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TierSettings {
    public static final long DEFAULT_SEGMENT_SIZE = 1_048_576L;
    public static final long DEFAULT_BASE_KEY = 0x12345000L;
    public static final long DEFAULT_FILE_SIZE = 1_048_576L;
    public static final String DEFAULT_TABLE = "tiercache";

    private static final ObjectMapper BINDER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonProperty("enabled")
    private Boolean enabled;

    // Network tiers
    @JsonProperty("host")
    private String host = "localhost";
    @JsonProperty("port")
    private int port;
    @JsonProperty("database")
    private int database;
    @JsonProperty("password")
    private String password;
    @JsonProperty("prefix")
    private String prefix;
    @JsonProperty("persistent")
    private boolean persistent = true;
    @JsonProperty("connect_timeout")
    private double connectTimeout = 2.0;
    @JsonProperty("retry_attempts")
    private int retryAttempts = 2;
    @JsonProperty("retry_delay")
    private long retryDelay = 100;
    @JsonProperty("min_connections")
    private int minConnections;
    @JsonProperty("max_connections")
    private int maxConnections;
    @JsonProperty("idle_timeout")
    private long idleTimeout = 300;

    // Shared memory and mapped file tiers
    @JsonProperty("segment_size")
    private long segmentSize = DEFAULT_SEGMENT_SIZE;
    @JsonProperty("base_key")
    private long baseKey = DEFAULT_BASE_KEY;
    @JsonProperty("file_size")
    private long fileSize = DEFAULT_FILE_SIZE;
    @JsonProperty("base_path")
    private String basePath;

    // In-process tiers
    @JsonProperty("max_entries")
    private long maxEntries = 10_000L;
    @JsonProperty("slots")
    private int slots = 16_384;

    // Relational tiers
    @JsonProperty("jdbc_url")
    private String jdbcUrl;
    @JsonProperty("username")
    private String username;
    @JsonProperty("table_name")
    @JsonAlias("table")
    private String tableName = DEFAULT_TABLE;
    @JsonProperty("db_path")
    private String dbPath;

    public TierSettings() {
    }

    private TierSettings(TierSettings other) {
        this.enabled = other.enabled;
        this.host = other.host;
        this.port = other.port;
        this.database = other.database;
        this.password = other.password;
        this.prefix = other.prefix;
        this.persistent = other.persistent;
        this.connectTimeout = other.connectTimeout;
        this.retryAttempts = other.retryAttempts;
        this.retryDelay = other.retryDelay;
        this.minConnections = other.minConnections;
        this.maxConnections = other.maxConnections;
        this.idleTimeout = other.idleTimeout;
        this.segmentSize = other.segmentSize;
        this.baseKey = other.baseKey;
        this.fileSize = other.fileSize;
        this.basePath = other.basePath;
        this.maxEntries = other.maxEntries;
        this.slots = other.slots;
        this.jdbcUrl = other.jdbcUrl;
        this.username = other.username;
        this.tableName = other.tableName;
        this.dbPath = other.dbPath;
    }

    /**
     * Default options for a tier, matching what the tier expects with no user input.
     */
    public static TierSettings defaultsFor(Tier tier) {
        TierSettings settings = new TierSettings();
        switch (tier) {
            case NETWORK_KV_STORE:
                settings.port = 6379;
                settings.minConnections = 2;
                settings.maxConnections = 10;
                break;
            case NETWORK_CACHE_CLUSTER:
                settings.port = 11211;
                settings.minConnections = 1;
                settings.maxConnections = 5;
                break;
            default:
                break;
        }
        return settings;
    }

    /**
     * Returns a copy of these settings with the given options merged over them.
     *
     * @throws CacheConfigurationException if an option has a value of the wrong shape
     */
    public TierSettings merge(Map<String, ?> options) {
        TierSettings copy = new TierSettings(this);
        if (options == null || options.isEmpty()) {
            return copy;
        }
        try {
            return BINDER.updateValue(copy, options);
        } catch (JsonMappingException | IllegalArgumentException e) {
            throw new CacheConfigurationException("Invalid tier options " + options.keySet() + ": " + e.getMessage(), e);
        }
    }

    // Getters
    public boolean isEnabled(boolean defaultValue) { return enabled != null ? enabled : defaultValue; }
    public Boolean getEnabled() { return enabled; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public int getDatabase() { return database; }
    public String getPassword() { return password; }
    public String getPrefix() { return prefix; }
    public boolean isPersistent() { return persistent; }
    public double getConnectTimeout() { return connectTimeout; }
    public int getRetryAttempts() { return retryAttempts; }
    public long getRetryDelay() { return retryDelay; }
    public int getMinConnections() { return minConnections; }
    public int getMaxConnections() { return maxConnections; }
    public long getIdleTimeout() { return idleTimeout; }
    public long getSegmentSize() { return segmentSize; }
    public long getBaseKey() { return baseKey; }
    public long getFileSize() { return fileSize; }
    public String getBasePath() { return basePath; }
    public long getMaxEntries() { return maxEntries; }
    public int getSlots() { return slots; }
    public String getJdbcUrl() { return jdbcUrl; }
    public String getUsername() { return username; }
    public String getTableName() { return tableName; }
    public String getDbPath() { return dbPath; }

    public long getConnectTimeoutMillis() {
        return Math.max(1L, Math.round(connectTimeout * 1000));
    }
}
