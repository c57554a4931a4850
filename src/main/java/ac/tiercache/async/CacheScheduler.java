package ac.tiercache.async;

/**
 * Runs deferred cache operations. Plug in an event loop, an executor, or the
 * {@link CooperativeScheduler}.
 */
@FunctionalInterface
public interface CacheScheduler {

    void defer(Runnable task);
}
