package peroxo.chat.cache.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import peroxo.chat.cache.ConversationMetadata;
import peroxo.chat.cache.ConversationRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the message cache's entries in the {@code msgcache_} namespace of a {@link KeyValueStore}.
 * <p>
 * One entry per conversation ({@code msgcache_chat_<id>}) and one entry holding the metadata of all
 * conversations ({@code msgcache_chat_metadata}).
 */
@Slf4j
public class CacheStorage {
    public static final String NAMESPACE = "msgcache_";
    static final String METADATA_KEY = NAMESPACE + "chat_metadata";
    static final String CHAT_PREFIX = NAMESPACE + "chat_";

    private static final TypeReference<LinkedHashMap<String, ConversationMetadata>> METADATA_TYPE = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public CacheStorage(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a conversation entry. An entry that cannot be parsed is removed and reported as absent.
     */
    public Optional<ConversationRecord> loadConversation(String chatId) {
        String key = chatKey(chatId);
        Optional<String> json = store.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), ConversationRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            store.remove(key);
            return Optional.empty();
        }
    }

    public void saveConversation(ConversationRecord record) {
        store.put(chatKey(record.getChatId()), write(record));
    }

    public void removeConversation(String chatId) {
        store.remove(chatKey(chatId));
    }

    /**
     * @throws CorruptPersistedStateException if the metadata entry exists but cannot be parsed
     */
    public Map<String, ConversationMetadata> loadMetadata() {
        Optional<String> json = store.get(METADATA_KEY);
        if (json.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, ConversationMetadata> metadata = objectMapper.readValue(json.get(), METADATA_TYPE);
            return metadata == null ? new LinkedHashMap<>() : metadata;
        } catch (JsonProcessingException e) {
            throw new CorruptPersistedStateException("Chat metadata is unreadable", e);
        }
    }

    public void saveMetadata(Map<String, ConversationMetadata> metadata) {
        store.put(METADATA_KEY, write(metadata));
    }

    public long usageBytes() {
        return store.sizeInBytes(NAMESPACE);
    }

    /**
     * Removes every entry of the namespace.
     */
    public void wipe() {
        for (String key : store.keys(NAMESPACE)) {
            store.remove(key);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize cache entry", e);
        }
    }

    private static String chatKey(String chatId) {
        return CHAT_PREFIX + chatId;
    }
}
