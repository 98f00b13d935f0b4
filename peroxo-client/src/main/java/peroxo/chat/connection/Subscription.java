package peroxo.chat.connection;

/**
 * Registration of a handler. Cancelling twice is harmless.
 */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
