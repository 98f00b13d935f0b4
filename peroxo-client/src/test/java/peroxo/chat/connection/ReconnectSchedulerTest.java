package peroxo.chat.connection;

import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import peroxo.chat.support.ManualEventLoop;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class ReconnectSchedulerTest {

    private final ManualEventLoop loop = new ManualEventLoop();

    @Property
    void delayDoublesPerAttempt(@ForAll @IntRange(min = 1, max = 5000) int baseMillis,
                                @ForAll @IntRange(min = 0, max = 20) int attempt) {
        ReconnectScheduler scheduler = new ReconnectScheduler(loop, Duration.ofMillis(baseMillis), 5);

        assertThat(scheduler.delayFor(attempt + 1)).isEqualTo(scheduler.delayFor(attempt).multipliedBy(2));
        assertThat(scheduler.delayFor(0)).isEqualTo(Duration.ofMillis(baseMillis));
    }

    @Example
    void refusesOnceCapIsReached() {
        ReconnectScheduler scheduler = new ReconnectScheduler(loop, Duration.ofSeconds(1), 2);
        AtomicInteger runs = new AtomicInteger();

        assertThat(scheduler.scheduleNext(runs::incrementAndGet)).isTrue();
        loop.advance(Duration.ofSeconds(1));
        assertThat(scheduler.scheduleNext(runs::incrementAndGet)).isTrue();
        loop.advance(Duration.ofSeconds(2));

        assertThat(scheduler.scheduleNext(runs::incrementAndGet)).isFalse();
        assertThat(scheduler.isScheduled()).isFalse();
        assertThat(runs.get()).isEqualTo(2);
        assertThat(loop.scheduledDelays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Example
    void keepsAtMostOneTimer() {
        ReconnectScheduler scheduler = new ReconnectScheduler(loop, Duration.ofSeconds(1), 5);
        AtomicInteger runs = new AtomicInteger();

        scheduler.scheduleNext(runs::incrementAndGet);
        scheduler.scheduleNext(runs::incrementAndGet);
        loop.advance(Duration.ofMinutes(1));

        assertThat(runs.get()).isEqualTo(1);
        assertThat(scheduler.isScheduled()).isFalse();
    }

    @Example
    void resetCancelsAndRestartsCounting() {
        ReconnectScheduler scheduler = new ReconnectScheduler(loop, Duration.ofSeconds(1), 5);
        AtomicInteger runs = new AtomicInteger();
        scheduler.scheduleNext(runs::incrementAndGet);
        scheduler.scheduleNext(runs::incrementAndGet);

        scheduler.reset();
        loop.advance(Duration.ofMinutes(1));

        assertThat(runs.get()).isZero();
        assertThat(scheduler.getAttempts()).isZero();
        scheduler.scheduleNext(runs::incrementAndGet);
        assertThat(loop.scheduledDelays()).last().isEqualTo(Duration.ofSeconds(1));
    }
}
