package peroxo.chat.session;

import lombok.extern.slf4j.Slf4j;
import peroxo.chat.event.Cancellable;
import peroxo.chat.event.EventLoop;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One delivery timer per sent message id, each remembering the conversation the message belongs to.
 * After a timeout the conversation is still remembered, so a late ack can find its message.
 */
@Slf4j
class DeliveryTracker {
    static final int MAX_EXPIRED = 256;

    private final EventLoop eventLoop;
    private final Duration timeout;
    private final Map<String, Delivery> deliveries = new HashMap<>();
    // conversation of each timed out message, oldest dropped first
    private final Map<String, String> expired = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
            return size() > MAX_EXPIRED;
        }
    };

    DeliveryTracker(EventLoop eventLoop, Duration timeout) {
        this.eventLoop = eventLoop;
        this.timeout = timeout;
    }

    /**
     * Starts the timer of {@code messageId}, replacing a timer already running for it.
     */
    void arm(String conversationId, String messageId, Runnable onTimeout) {
        resolve(messageId);
        Delivery delivery = new Delivery(conversationId);
        delivery.timer = eventLoop.schedule(() -> {
            if (deliveries.get(messageId) == delivery) {
                deliveries.remove(messageId);
                expired.put(messageId, conversationId);
                log.warn("Message timeout - no ack received: {}", messageId);
                onTimeout.run();
            }
        }, timeout);
        deliveries.put(messageId, delivery);
    }

    /**
     * Stops the timer of {@code messageId}.
     *
     * @return the conversation of the message, or {@code null} if it was neither awaited nor timed out
     */
    String resolve(String messageId) {
        String timedOut = expired.remove(messageId);
        Delivery delivery = deliveries.remove(messageId);
        if (delivery == null) {
            return timedOut;
        }
        delivery.timer.cancel();
        return delivery.conversationId;
    }

    void cancelAll() {
        for (String messageId : new ArrayList<>(deliveries.keySet())) {
            resolve(messageId);
        }
        expired.clear();
    }

    boolean isTracking(String messageId) {
        return deliveries.containsKey(messageId);
    }

    int size() {
        return deliveries.size();
    }

    private static final class Delivery {
        private final String conversationId;
        private Cancellable timer = Cancellable.NOOP;

        private Delivery(String conversationId) {
            this.conversationId = conversationId;
        }
    }
}
