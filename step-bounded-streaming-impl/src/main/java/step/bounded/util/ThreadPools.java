package step.bounded.util;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class ThreadPools {

    private static final int SCHEDULER_POOL_SIZE = 2;

    // lazily created on first use, see Holder
    private static final class Holder {
        static final ScheduledExecutorService SHARED_SCHEDULER = createScheduler("bounded-stream-timer", SCHEDULER_POOL_SIZE);
    }

    /**
     * Returns the scheduler used by default for inactivity checks. Its threads are daemons,
     * so it never needs to be shut down.
     *
     * @return the shared scheduler
     */
    public static ScheduledExecutorService sharedScheduler() {
        return Holder.SHARED_SCHEDULER;
    }

    public static ScheduledExecutorService createScheduler(String threadPrefix, int poolSize) {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(poolSize, namedDaemon(threadPrefix));
        // cancelled checks would otherwise stay in the queue until their (possibly far) due time
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    public static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
