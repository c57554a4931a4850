package ac.tiercache.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Single-threaded FIFO tick queue. Deferred tasks run only when the owner calls
 * {@link #tick()} or {@link #runUntilIdle()}.
 */
public class CooperativeScheduler implements CacheScheduler {
    private static final Logger logger = LoggerFactory.getLogger(CooperativeScheduler.class);

    private final Queue<Runnable> queue = new ArrayDeque<>();

    @Override
    public synchronized void defer(Runnable task) {
        queue.add(task);
    }

    public synchronized int pending() {
        return queue.size();
    }

    /**
     * Runs the tasks queued before this call. Tasks they defer wait for the next tick.
     *
     * @return number of tasks run
     */
    public int tick() {
        int batch;
        synchronized (this) {
            batch = queue.size();
        }
        int ran = 0;
        for (int i = 0; i < batch; i++) {
            Runnable task;
            synchronized (this) {
                task = queue.poll();
            }
            if (task == null) {
                break;
            }
            run(task);
            ran++;
        }
        return ran;
    }

    public int runUntilIdle() {
        int total = 0;
        int ran;
        while ((ran = tick()) > 0) {
            total += ran;
        }
        return total;
    }

    private static void run(Runnable task) {
        try {
            task.run();
        } catch (Throwable e) {
            logger.error("Deferred cache task failed", e);
        }
    }
}
