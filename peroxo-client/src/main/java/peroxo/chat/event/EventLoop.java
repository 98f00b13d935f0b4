package peroxo.chat.event;

import java.time.Clock;
import java.time.Duration;

/**
 * The single logical thread every messaging component runs on.
 * <p>
 * Socket callbacks, timers and deferred writes are all posted here, so the connection manager,
 * the cache and the session never need locks. Tasks run one at a time in submission order.
 */
public interface EventLoop {

    void execute(Runnable task);

    Cancellable schedule(Runnable task, Duration delay);

    Clock clock();
}
