package ac.tiercache.tier;

import ac.tiercache.CacheConfigurationException;
import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.KeyHasher;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cache table in a relational database, reached through a HikariCP pool. Serves both the
 * external SQL tier (any JDBC URL) and the embedded tier (an H2 file at {@code db_path}).
 */
public class RelationalTier extends AbstractCacheTier {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");
    static final int MAX_KEY_LENGTH = 255;

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS %s (
            cache_key VARCHAR(255) NOT NULL PRIMARY KEY,
            cache_value BLOB NOT NULL,
            expires_at BIGINT,
            created_at BIGINT NOT NULL
        )
        """;
    private static final String CREATE_INDEX = "CREATE INDEX IF NOT EXISTS idx_%1$s_expires_at ON %1$s (expires_at)";
    private static final String SELECT_ENTRY = "SELECT cache_value, expires_at FROM %s WHERE cache_key = ?";
    private static final String DELETE_ENTRY = "DELETE FROM %s WHERE cache_key = ?";
    private static final String INSERT_ENTRY = "INSERT INTO %s (cache_key, cache_value, expires_at, created_at) VALUES (?, ?, ?, ?)";
    private static final String DELETE_ALL = "DELETE FROM %s";
    private static final String DELETE_EXPIRED = "DELETE FROM %s WHERE expires_at IS NOT NULL AND expires_at <= ?";

    private final String table;
    private final String jdbcUrl;
    private volatile HikariDataSource dataSource;

    public RelationalTier(Tier tier, TierSettings settings, TierContext context) {
        super(tier, settings, context);
        this.table = validateIdentifier(settings.getTableName());
        this.jdbcUrl = resolveJdbcUrl(tier, settings);
    }

    static String resolveJdbcUrl(Tier tier, TierSettings settings) {
        if (tier == Tier.EMBEDDED_DATABASE) {
            if (settings.getDbPath() == null) {
                throw new CacheConfigurationException("Embedded database tier requires db_path");
            }
            return "jdbc:h2:file:" + settings.getDbPath();
        }
        if (tier == Tier.SQL_TABLE) {
            if (settings.getJdbcUrl() == null) {
                throw new CacheConfigurationException("SQL tier requires jdbc_url");
            }
            return settings.getJdbcUrl();
        }
        throw new IllegalArgumentException("Not a relational tier: " + tier);
    }

    private static String validateIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new CacheConfigurationException("Invalid cache table name: " + name);
        }
        return name;
    }

    @Override
    protected boolean prepare() throws SQLException {
        HikariDataSource ds = dataSource();
        try (Connection conn = ds.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(String.format(CREATE_TABLE, table));
            try {
                stmt.execute(String.format(CREATE_INDEX, table));
            } catch (SQLException e) {
                logger.debug("Expiry index on {} not created: {}", table, e.getMessage());
            }
        }
        return true;
    }

    private HikariDataSource dataSource() {
        HikariDataSource ds = dataSource;
        if (ds == null) {
            synchronized (this) {
                ds = dataSource;
                if (ds == null) {
                    HikariConfig config = new HikariConfig();
                    config.setJdbcUrl(jdbcUrl);
                    config.setUsername(settings.getUsername());
                    config.setPassword(settings.getPassword());
                    config.setMaximumPoolSize(Math.max(1, settings.getMaxConnections() > 0 ? settings.getMaxConnections() : 5));
                    config.setMinimumIdle(Math.max(0, settings.getMinConnections()));
                    config.setConnectionTimeout(Math.max(250L, settings.getConnectTimeoutMillis()));
                    config.setIdleTimeout(Math.max(10_000L, settings.getIdleTimeout() * 1000));
                    config.setPoolName("tiercache-" + tier().id());
                    ds = new HikariDataSource(config);
                    dataSource = ds;
                }
            }
        }
        return ds;
    }

    /**
     * Keys longer than the column are stored under their hash.
     */
    String storageKey(String key) {
        return key.length() <= MAX_KEY_LENGTH ? key : "h:" + KeyHasher.fileName(key);
    }

    @Override
    protected Optional<CacheEntry> read(String key) throws SQLException, CorruptEntryException {
        try (Connection conn = dataSource().getConnection();
             PreparedStatement stmt = conn.prepareStatement(String.format(SELECT_ENTRY, table))) {
            stmt.setString(1, storageKey(key));
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                byte[] bytes = rs.getBytes("cache_value");
                long expiresAt = rs.getLong("expires_at");
                if (rs.wasNull()) {
                    expiresAt = CacheEntry.NEVER;
                }
                Object payload = context.getCodec().payloadCodec().decode(bytes);
                return Optional.of(new CacheEntry(payload, expiresAt));
            }
        }
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws SQLException {
        byte[] bytes = context.getCodec().payloadCodec().encode(entry.getPayload());
        String storageKey = storageKey(key);
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement delete = conn.prepareStatement(String.format(DELETE_ENTRY, table))) {
                    delete.setString(1, storageKey);
                    delete.executeUpdate();
                }
                try (PreparedStatement insert = conn.prepareStatement(String.format(INSERT_ENTRY, table))) {
                    insert.setString(1, storageKey);
                    insert.setBytes(2, bytes);
                    if (entry.hasExpiry()) {
                        insert.setLong(3, entry.getExpiresAt());
                    } else {
                        insert.setNull(3, Types.BIGINT);
                    }
                    insert.setLong(4, context.now());
                    insert.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        return true;
    }

    @Override
    protected void remove(String key) throws SQLException {
        try (Connection conn = dataSource().getConnection();
             PreparedStatement stmt = conn.prepareStatement(String.format(DELETE_ENTRY, table))) {
            stmt.setString(1, storageKey(key));
            stmt.executeUpdate();
        }
    }

    @Override
    protected void removeAll() throws SQLException {
        try (Connection conn = dataSource().getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(String.format(DELETE_ALL, table));
        }
    }

    @Override
    protected int sweepExpired() throws SQLException {
        try (Connection conn = dataSource().getConnection();
             PreparedStatement stmt = conn.prepareStatement(String.format(DELETE_EXPIRED, table))) {
            stmt.setLong(1, context.now());
            return stmt.executeUpdate();
        }
    }

    @Override
    public void close() {
        HikariDataSource ds = dataSource;
        if (ds != null) {
            ds.close();
            dataSource = null;
        }
    }
}
