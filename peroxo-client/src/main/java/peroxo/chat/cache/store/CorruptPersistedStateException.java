package peroxo.chat.cache.store;

/**
 * Persisted cache content that can no longer be parsed.
 */
public class CorruptPersistedStateException extends StorageException {

    public CorruptPersistedStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
