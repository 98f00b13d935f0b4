package peroxo.chat.cache.store;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Non-persistent store, used when no durable store is configured and in tests.
 * An optional capacity makes writes fail the way a full disk would.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> entries = new LinkedHashMap<>();
    private final long capacityBytes;

    public InMemoryKeyValueStore() {
        this(0);
    }

    /**
     * @param capacityBytes maximum total size, {@code 0} for unlimited
     */
    public InMemoryKeyValueStore(long capacityBytes) {
        this.capacityBytes = capacityBytes;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        if (capacityBytes > 0) {
            long current = sizeInBytes("");
            String previous = entries.get(key);
            long after = current - (previous == null ? 0 : entrySize(key, previous)) + entrySize(key, value);
            if (after > capacityBytes) {
                throw new StorageQuotaExceededException("Store capacity of " + capacityBytes + " bytes exceeded by " + key);
            }
        }
        entries.put(key, value);
    }

    @Override
    public synchronized void remove(String key) {
        entries.remove(key);
    }

    @Override
    public synchronized Set<String> keys(String prefix) {
        Set<String> result = new TreeSet<>();
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix)) {
                result.add(key);
            }
        }
        return result;
    }

    @Override
    public synchronized long sizeInBytes(String prefix) {
        long total = 0;
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                total += entrySize(entry.getKey(), entry.getValue());
            }
        }
        return total;
    }

    @Override
    public void close() {
        // nothing to release
    }

    private static long entrySize(String key, String value) {
        return key.getBytes(StandardCharsets.UTF_8).length + value.getBytes(StandardCharsets.UTF_8).length;
    }
}
