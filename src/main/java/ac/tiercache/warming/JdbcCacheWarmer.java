package ac.tiercache.warming;

import ac.tiercache.CacheSettings;
import ac.tiercache.TieredCacheEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs queries and caches each result set as a list of rows, one map per row keyed by column
 * label. A failing query is logged and skipped.
 */
public class JdbcCacheWarmer implements CacheWarmer {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCacheWarmer.class);

    private final String name;
    private final DataSource dataSource;
    private final List<Query> queries;
    private final long defaultTtlSeconds;

    public JdbcCacheWarmer(String name, DataSource dataSource, List<Query> queries) {
        this(name, dataSource, queries, CacheSettings.DEFAULT_TTL_SECONDS);
    }

    public JdbcCacheWarmer(String name, DataSource dataSource, List<Query> queries, long defaultTtlSeconds) {
        this.name = name;
        this.dataSource = dataSource;
        this.queries = List.copyOf(queries);
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isApplicable() {
        return dataSource != null && !queries.isEmpty();
    }

    @Override
    public int warm(TieredCacheEngine engine) {
        int warmed = 0;
        try (Connection connection = dataSource.getConnection()) {
            for (Query query : queries) {
                try {
                    List<Map<String, Object>> rows = execute(connection, query);
                    long ttl = query.getTtlSeconds() > 0 ? query.getTtlSeconds() : defaultTtlSeconds;
                    if (engine.set(query.getCacheKey(), rows, ttl)) {
                        warmed++;
                    }
                } catch (SQLException e) {
                    logger.warn("Cache warming query for {} failed: {}", query.getCacheKey(), e.getMessage());
                }
            }
        } catch (SQLException e) {
            logger.error("Cache warming {} could not connect: {}", name, e.getMessage());
        }
        return warmed;
    }

    private List<Map<String, Object>> execute(Connection connection, Query query) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(query.getSql())) {
            List<Object> params = query.getParams();
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int column = 1; column <= meta.getColumnCount(); column++) {
                        row.put(meta.getColumnLabel(column), rs.getObject(column));
                    }
                    rows.add(row);
                }
                return rows;
            }
        }
    }

    /**
     * A query and the key its rows are cached under. A ttl of zero means the warmer's default.
     */
    public static class Query {
        private final String sql;
        private final String cacheKey;
        private final long ttlSeconds;
        private final List<Object> params;

        public Query(String sql, String cacheKey, long ttlSeconds, List<Object> params) {
            this.sql = sql;
            this.cacheKey = cacheKey;
            this.ttlSeconds = ttlSeconds;
            this.params = params != null ? new ArrayList<>(params) : new ArrayList<>();
        }

        public Query(String sql, String cacheKey) {
            this(sql, cacheKey, 0, null);
        }

        public String getSql() { return sql; }
        public String getCacheKey() { return cacheKey; }
        public long getTtlSeconds() { return ttlSeconds; }
        public List<Object> getParams() { return params; }
    }
}
