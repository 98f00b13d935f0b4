package peroxo.chat.connection;

import lombok.extern.slf4j.Slf4j;
import peroxo.chat.event.Cancellable;
import peroxo.chat.event.EventLoop;

import java.time.Duration;

/**
 * Exponential backoff with at most one pending reconnect timer.
 * <p>
 * Attempt {@code n} (counted from zero) waits {@code base * 2^n}. Once {@code maxAttempts} timers have
 * been scheduled without a successful connection, {@link #scheduleNext} refuses until {@link #reset}.
 */
@Slf4j
public class ReconnectScheduler {

    private final EventLoop eventLoop;
    private final Duration baseInterval;
    private final int maxAttempts;

    private int attempts;
    private Cancellable pending;

    public ReconnectScheduler(EventLoop eventLoop, Duration baseInterval, int maxAttempts) {
        this.eventLoop = eventLoop;
        this.baseInterval = baseInterval;
        this.maxAttempts = maxAttempts;
    }

    public Duration delayFor(int attempt) {
        return baseInterval.multipliedBy(1L << Math.min(attempt, 30));
    }

    /**
     * Counts a failed connection and schedules {@code reconnect} after the backoff delay.
     *
     * @return {@code false} if the attempt cap is reached; no timer is scheduled then
     */
    public boolean scheduleNext(Runnable reconnect) {
        cancel();
        int attempt = attempts;
        attempts = attempt + 1;
        if (attempts > maxAttempts) {
            return false;
        }
        Duration delay = delayFor(attempt);
        log.info("Reconnecting in {} ms (attempt {}/{})", delay.toMillis(), attempts, maxAttempts);
        pending = eventLoop.schedule(() -> {
            pending = null;
            reconnect.run();
        }, delay);
        return true;
    }

    public void cancel() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public void reset() {
        cancel();
        attempts = 0;
    }

    public boolean isScheduled() {
        return pending != null;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
