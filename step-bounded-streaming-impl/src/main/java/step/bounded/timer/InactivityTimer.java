package step.bounded.timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import step.bounded.util.ThreadPools;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * A timer detecting inactivity without reading the clock on every activity signal.
 * <p>
 * Callers signal activity using {@link #touch()}, which merely sets a flag. Two scheduled checks do the rest:
 * <ul>
 *     <li>a tick every {@code interval} milliseconds, which advances the last-activity timestamp to the current time
 *     if the flag was set since the previous tick, then clears the flag;</li>
 *     <li>a deadline check scheduled {@code timeout} milliseconds after the last known activity. It recomputes the
 *     elapsed time; if it reached {@code timeout}, the callback is invoked with the elapsed time and the timer
 *     destroys itself. Otherwise, the check is rescheduled for the remaining time.</li>
 * </ul>
 * Because activity is only timestamped at tick granularity, an idle period is detected at the latest
 * {@code timeout + interval} milliseconds after the last activity. Callers needing tighter bounds must use a
 * smaller interval, at the cost of more frequent ticks.
 * <p>
 * A timeout of 0 disables the timer entirely: nothing is scheduled and the callback never fires.
 * An interval of 0 (with a positive timeout) means that every {@link #touch()} reads the clock.
 * <p>
 * The callback fires at most once; afterward the timer is dead, just as after {@link #destroy()}.
 */
public class InactivityTimer {
    private static final Logger logger = LoggerFactory.getLogger(InactivityTimer.class);

    public static final long DEFAULT_TIMEOUT_MILLIS = 30000;
    public static final long DEFAULT_INTERVAL_MILLIS = 1000;

    private final long timeoutMillis;
    private final long intervalMillis;
    private final LongConsumer onTimeout;
    private final ScheduledExecutorService scheduler;

    private volatile boolean activitySinceCheckpoint = false;
    private volatile long lastActivity;
    private volatile boolean alive = true;
    private volatile long timedOutAfter = -1;

    private ScheduledFuture<?> tickTask;
    private ScheduledFuture<?> deadlineTask;

    /**
     * Creates and starts a new timer using the shared scheduler.
     *
     * @param timeoutMillis  the idle time after which the callback is invoked; 0 to disable
     * @param intervalMillis the check granularity (must not exceed the timeout)
     * @param onTimeout      the callback, receiving the elapsed idle time in milliseconds
     * @return the started timer
     * @throws IllegalArgumentException if a value is negative, or the interval exceeds the timeout
     */
    public static InactivityTimer start(long timeoutMillis, long intervalMillis, LongConsumer onTimeout) {
        return new InactivityTimer(timeoutMillis, intervalMillis, onTimeout, ThreadPools.sharedScheduler());
    }

    public static InactivityTimer start(long timeoutMillis, long intervalMillis, LongConsumer onTimeout, ScheduledExecutorService scheduler) {
        return new InactivityTimer(timeoutMillis, intervalMillis, onTimeout, scheduler);
    }

    /**
     * Creates and starts a new timer with the default timeout and interval.
     *
     * @param onTimeout the callback, receiving the elapsed idle time in milliseconds
     * @return the started timer
     */
    public static InactivityTimer start(LongConsumer onTimeout) {
        return start(DEFAULT_TIMEOUT_MILLIS, DEFAULT_INTERVAL_MILLIS, onTimeout);
    }

    private InactivityTimer(long timeoutMillis, long intervalMillis, LongConsumer onTimeout, ScheduledExecutorService scheduler) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("\"" + timeoutMillis + "\" is an invalid timeout!");
        }
        if (intervalMillis < 0) {
            throw new IllegalArgumentException("\"" + intervalMillis + "\" is an invalid interval!");
        }
        if (intervalMillis > timeoutMillis) {
            throw new IllegalArgumentException("interval (" + intervalMillis + ") exceeds timeout (" + timeoutMillis + ")!");
        }
        this.timeoutMillis = timeoutMillis;
        this.intervalMillis = intervalMillis;
        this.onTimeout = Objects.requireNonNull(onTimeout, "onTimeout must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.lastActivity = System.currentTimeMillis();

        if (timeoutMillis > 0) {
            synchronized (this) {
                if (intervalMillis > 0) {
                    tickTask = scheduler.scheduleAtFixedRate(this::onTick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
                }
                deadlineTask = scheduler.schedule(this::onDeadline, timeoutMillis, TimeUnit.MILLISECONDS);
            }
        }
    }

    /**
     * Records that activity occurred.
     *
     * @throws IllegalStateException if the timer was already destroyed (explicitly, or by firing)
     */
    public void touch() {
        if (!touchIfAlive()) {
            throw new IllegalStateException("timer has already been destroyed!");
        }
    }

    /**
     * Records that activity occurred, unless the timer is dead. Unlike {@link #touch()}, this never throws,
     * so it can be used by callers racing with the timeout callback.
     *
     * @return {@code false} if the timer was already destroyed (explicitly, or by firing)
     */
    public boolean touchIfAlive() {
        if (!alive) {
            return false;
        }
        if (intervalMillis == 0) {
            lastActivity = System.currentTimeMillis();
        } else {
            activitySinceCheckpoint = true;
        }
        return true;
    }

    private void onTick() {
        if (activitySinceCheckpoint) {
            lastActivity = System.currentTimeMillis();
            activitySinceCheckpoint = false;
        }
    }

    private void onDeadline() {
        long elapsed;
        synchronized (this) {
            if (!alive) {
                return;
            }
            // account for activity since the last tick
            onTick();
            elapsed = System.currentTimeMillis() - lastActivity;
            if (elapsed < timeoutMillis) {
                deadlineTask = scheduler.schedule(this::onDeadline, timeoutMillis - elapsed, TimeUnit.MILLISECONDS);
                return;
            }
            timedOutAfter = elapsed;
            destroy();
        }
        logger.debug("Inactivity timeout after {} ms (timeout={} ms, interval={} ms)", elapsed, timeoutMillis, intervalMillis);
        try {
            onTimeout.accept(elapsed);
        } catch (Exception e) {
            logger.error("Timeout callback failed", e);
        }
    }

    /**
     * Cancels all pending checks. Calling this method more than once has no further effect.
     */
    public synchronized void destroy() {
        if (!alive) {
            return;
        }
        alive = false;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (deadlineTask != null) {
            deadlineTask.cancel(false);
            deadlineTask = null;
        }
    }

    public boolean isAlive() {
        return alive;
    }

    /**
     * Returns the idle time that made the timer fire. It is set before the timer is marked dead, so a caller
     * seeing a dead timer can tell a timeout from an explicit {@link #destroy()} before the callback ran.
     *
     * @return the elapsed idle time in milliseconds, or -1 if the timer did not fire
     */
    public long getTimedOutAfter() {
        return timedOutAfter;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public long getIntervalMillis() {
        return intervalMillis;
    }

    /**
     * @return the timestamp (epoch millis) of the last activity known to the timer; may lag behind by up to one interval
     */
    public long getLastActivity() {
        return lastActivity;
    }

    @Override
    public String toString() {
        return "InactivityTimer{" +
                "timeoutMillis=" + timeoutMillis +
                ", intervalMillis=" + intervalMillis +
                ", alive=" + alive +
                '}';
    }
}
