package ac.tiercache.tier;

import ac.tiercache.TierSettings;
import ac.tiercache.pool.ConnectionFactory;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.codec.Kryo5Codec;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Opens single-connection Redisson clients so that the tier's own provider decides how many
 * connections exist.
 */
class RedisConnectionFactory implements ConnectionFactory<RedissonClient> {
    private static final Logger logger = LoggerFactory.getLogger(RedisConnectionFactory.class);

    private final TierSettings settings;

    RedisConnectionFactory(TierSettings settings) {
        this.settings = settings;
    }

    @Override
    public RedissonClient create() {
        int timeout = (int) Math.min(Integer.MAX_VALUE, settings.getConnectTimeoutMillis());
        Config config = new Config();
        config.setCodec(new Kryo5Codec());
        config.setThreads(1);
        config.setNettyThreads(2);
        SingleServerConfig server = config.useSingleServer()
                .setAddress("redis://" + settings.getHost() + ":" + settings.getPort())
                .setDatabase(settings.getDatabase())
                .setConnectTimeout(timeout)
                .setTimeout(timeout)
                .setRetryAttempts(0)
                .setConnectionPoolSize(1)
                .setConnectionMinimumIdleSize(1)
                .setSubscriptionConnectionPoolSize(1)
                .setSubscriptionConnectionMinimumIdleSize(0);
        if (settings.getPassword() != null && !settings.getPassword().isEmpty()) {
            server.setPassword(settings.getPassword());
        }
        return Redisson.create(config);
    }

    @Override
    public boolean validate(RedissonClient client) {
        try {
            return !client.isShutdown() && client.getRedisNodes(RedisNodes.SINGLE).pingAll();
        } catch (RuntimeException e) {
            logger.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close(RedissonClient client) {
        try {
            client.shutdown(0, 2, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.warn("Error shutting down Redis client: {}", e.getMessage());
        }
    }

    @Override
    public String describe() {
        return "redis://" + settings.getHost() + ":" + settings.getPort() + "/" + settings.getDatabase();
    }
}
