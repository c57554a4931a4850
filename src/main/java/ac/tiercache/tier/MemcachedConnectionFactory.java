package ac.tiercache.tier;

import ac.tiercache.TierSettings;
import ac.tiercache.pool.ConnectionFactory;
import net.spy.memcached.AddrUtil;
import net.spy.memcached.ConnectionFactoryBuilder;
import net.spy.memcached.FailureMode;
import net.spy.memcached.MemcachedClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Map;
import java.util.concurrent.TimeUnit;

class MemcachedConnectionFactory implements ConnectionFactory<MemcachedClient> {
    private static final Logger logger = LoggerFactory.getLogger(MemcachedConnectionFactory.class);

    private final TierSettings settings;

    MemcachedConnectionFactory(TierSettings settings) {
        this.settings = settings;
    }

    @Override
    public MemcachedClient create() throws IOException {
        return new MemcachedClient(
                new ConnectionFactoryBuilder()
                        .setProtocol(ConnectionFactoryBuilder.Protocol.BINARY)
                        .setOpTimeout(settings.getConnectTimeoutMillis())
                        .setFailureMode(FailureMode.Cancel)
                        .setDaemon(true)
                        .build(),
                AddrUtil.getAddresses(settings.getHost() + ":" + settings.getPort()));
    }

    /**
     * A client counts as healthy when at least one server answers a stats request.
     */
    @Override
    public boolean validate(MemcachedClient client) {
        try {
            Map<SocketAddress, Map<String, String>> stats = client.getStats();
            return stats.values().stream().anyMatch(serverStats -> !serverStats.isEmpty());
        } catch (RuntimeException e) {
            logger.debug("Memcached stats request failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close(MemcachedClient client) {
        try {
            client.shutdown(2, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.warn("Error shutting down memcached client: {}", e.getMessage());
        }
    }

    @Override
    public String describe() {
        return "memcached://" + settings.getHost() + ":" + settings.getPort();
    }
}
