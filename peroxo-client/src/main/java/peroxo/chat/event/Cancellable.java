package peroxo.chat.event;

/**
 * Handle of a scheduled task. Cancelling a task that already ran is a no-op.
 */
@FunctionalInterface
public interface Cancellable {

    Cancellable NOOP = () -> false;

    /**
     * @return {@code true} if this call stopped the task from running
     */
    boolean cancel();
}
