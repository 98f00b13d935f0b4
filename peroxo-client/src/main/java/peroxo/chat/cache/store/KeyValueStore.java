package peroxo.chat.cache.store;

import java.util.Optional;
import java.util.Set;

/**
 * Durable string key/value store backing the message cache.
 * Implementations throw {@link StorageException} on failure and
 * {@link StorageQuotaExceededException} when a write does not fit.
 */
public interface KeyValueStore extends AutoCloseable {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);

    Set<String> keys(String prefix);

    /**
     * Bytes taken by all entries whose key starts with {@code prefix}, counting keys and values.
     */
    long sizeInBytes(String prefix);

    @Override
    void close();
}
