package peroxo.chat.cache;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import peroxo.chat.cache.store.CacheStorage;
import peroxo.chat.cache.store.CorruptPersistedStateException;
import peroxo.chat.cache.store.StorageException;
import peroxo.chat.cache.store.StorageQuotaExceededException;
import peroxo.chat.event.EventLoop;
import peroxo.chat.model.ChatMessage;
import peroxo.chat.model.MessagePatch;
import peroxo.chat.model.MessageStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Per-conversation message store with a hot in-memory tier and a durable tier.
 * <p>
 * Each conversation holds three buckets: confirmed, pending and failed. A message id lives in at most
 * one bucket of a conversation. Durable writes are deferred to the event loop and never block or fail
 * the call that caused them; in-memory state stays authoritative when the durable tier misbehaves.
 * <p>
 * All methods must be called on the client event loop.
 */
@Slf4j
public class MessageCache {
    private static final Comparator<ChatMessage> BY_CREATED_AT =
            Comparator.comparing(ChatMessage::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()));
    private static final double EMERGENCY_EVICTION_SHARE = 0.25;

    private final CacheStorage storage;
    private final EventLoop eventLoop;
    private final Clock clock;
    private final CacheOptions options;

    // access ordered, eldest first
    private final LinkedHashMap<String, ConversationRecord> memoryCache = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<String, ConversationMetadata> chatMetadata = new LinkedHashMap<>();
    private final Set<String> scheduledSaves = new HashSet<>();
    private boolean metadataSaveScheduled;
    private final List<CacheListener> listeners = new CopyOnWriteArrayList<>();

    public MessageCache(@NotNull CacheStorage storage, @NotNull EventLoop eventLoop, @NotNull CacheOptions options) {
        this.storage = requireNonNull(storage, "storage");
        this.eventLoop = requireNonNull(eventLoop, "eventLoop");
        this.clock = eventLoop.clock();
        this.options = requireNonNull(options, "options");
        initialize();
    }

    private void initialize() {
        try {
            chatMetadata.putAll(storage.loadMetadata());
            cleanupOldChats();
        } catch (CorruptPersistedStateException e) {
            log.error("Cached chat data is corrupted, starting with an empty cache", e);
            clearCorruptedData();
        } catch (StorageException e) {
            log.error("Failed to initialize message cache, continuing in memory only", e);
        }
    }

    public Runnable addListener(CacheListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ---- reads ----

    /**
     * Confirmed messages of a conversation, oldest first. Refreshes the conversation's access time.
     */
    public List<ChatMessage> getMessages(String chatId) {
        if (isBlank(chatId)) {
            return List.of();
        }
        ConversationRecord record = hot(chatId);
        if (record == null) {
            return List.of();
        }
        updateChatAccess(chatId);
        return copies(record.getMessages());
    }

    public MessageBuckets getAllMessages(String chatId) {
        if (isBlank(chatId)) {
            return MessageBuckets.EMPTY;
        }
        ConversationRecord record = hot(chatId);
        if (record == null) {
            return MessageBuckets.EMPTY;
        }
        return new MessageBuckets(
                copies(record.getMessages()),
                copies(record.getPendingMessages()),
                copies(record.getFailedMessages()));
    }

    public PaginationState getPaginationState(String chatId) {
        ConversationRecord record = memoryCache.get(chatId);
        if (record == null) {
            record = loadChatFromStorage(chatId);
        }
        ConversationMetadata metadata = getChatMetadata(chatId);

        boolean hasMore = record != null && record.getHasMore() != null ? record.getHasMore() : metadata.isHasMore();
        String nextCursor = record != null && record.getNextCursor() != null ? record.getNextCursor() : metadata.getNextCursor();
        boolean loading = record != null && record.isLoadingHistory();
        return new PaginationState(hasMore, nextCursor, loading);
    }

    public ConversationMetadata getChatMetadata(String chatId) {
        ConversationMetadata metadata = chatMetadata.get(chatId);
        return metadata != null ? metadata.copy() : ConversationMetadata.fresh(clock.instant());
    }

    public CacheStats getStats() {
        long bytes = 0;
        try {
            bytes = storage.usageBytes();
        } catch (StorageException e) {
            log.warn("Failed to measure cache storage: {}", e.getMessage());
        }
        Instant oldest = null;
        Instant newest = null;
        for (ConversationMetadata metadata : chatMetadata.values()) {
            Instant accessed = metadata.getLastAccessed();
            if (accessed == null) {
                continue;
            }
            if (oldest == null || accessed.isBefore(oldest)) {
                oldest = accessed;
            }
            if (newest == null || accessed.isAfter(newest)) {
                newest = accessed;
            }
        }
        return new CacheStats(memoryCache.size(), chatMetadata.size(), bytes,
                String.format("%.2f", bytes / (1024.0 * 1024.0)), oldest, newest);
    }

    // ---- writes ----

    /**
     * Adds one message to the bucket matching its status.
     *
     * @return {@code true} when the message is stored, including when its id was already present
     */
    public boolean addMessage(String chatId, ChatMessage message) {
        if (isBlank(chatId) || message == null) {
            return false;
        }
        ChatMessage toStore = withDefaults(message);
        ConversationRecord record = getOrCreate(chatId);

        if (record.containsId(toStore.getId())) {
            log.debug("Message already exists in cache: chatId={}, messageId={}", chatId, toStore.getId());
            return true;
        }

        insertIntoBucket(record, toStore);

        updateChatMetadata(chatId, metadata -> {
            metadata.setMessageCount(record.getMessages().size());
            metadata.setLastMessageTime(later(metadata.getLastMessageTime(), toStore.getCreatedAt()));
            if (toStore.isIncoming()) {
                metadata.setHasUnread(true);
                metadata.setUnreadCount(metadata.getUnreadCount() + 1);
            }
        });

        scheduleSave(chatId);
        notifyListeners(chatId);
        return true;
    }

    /**
     * Merges a page of confirmed messages, typically history. Ids already present in any bucket are skipped.
     *
     * @param prepend {@code true} for older pages
     */
    public boolean addMessages(String chatId, List<ChatMessage> messages, boolean prepend) {
        if (isBlank(chatId) || messages == null || messages.isEmpty()) {
            return false;
        }
        ConversationRecord record = getOrCreate(chatId);

        Set<String> seen = new HashSet<>();
        List<ChatMessage> unique = new ArrayList<>();
        Instant latest = null;
        for (ChatMessage message : messages) {
            if (message == null) {
                continue;
            }
            ChatMessage normalized = withDefaults(message);
            latest = later(latest, normalized.getCreatedAt());
            if (record.containsId(normalized.getId()) || !seen.add(normalized.getId())) {
                continue;
            }
            unique.add(normalized);
        }

        if (unique.isEmpty()) {
            return true;
        }

        List<ChatMessage> merged = new ArrayList<>(record.getMessages().size() + unique.size());
        if (prepend) {
            merged.addAll(unique);
            merged.addAll(record.getMessages());
        } else {
            merged.addAll(record.getMessages());
            merged.addAll(unique);
        }
        merged.sort(BY_CREATED_AT);

        int backfillLimit = options.getMaxMessagesPerChat() * 2;
        if (merged.size() > backfillLimit) {
            merged = new ArrayList<>(merged.subList(merged.size() - backfillLimit, merged.size()));
        }
        record.setMessages(merged);

        Instant pageLatest = latest;
        updateChatMetadata(chatId, metadata -> {
            metadata.setMessageCount(record.getMessages().size());
            metadata.setLastMessageTime(later(metadata.getLastMessageTime(), pageLatest));
        });

        scheduleSave(chatId);
        notifyListeners(chatId);
        return true;
    }

    /**
     * Moves a pending or failed message into the bucket of {@code newStatus} and applies {@code patch}.
     *
     * @return {@code false} if the id is not pending or failed in this conversation; nothing changes then
     */
    public boolean updateMessageStatus(String chatId, String messageId, MessageStatus newStatus, MessagePatch patch) {
        if (isBlank(chatId) || isBlank(messageId) || newStatus == null) {
            return false;
        }
        ConversationRecord record = hot(chatId);
        if (record == null) {
            return false;
        }

        ChatMessage message = take(record.getPendingMessages(), messageId);
        if (message == null) {
            message = take(record.getFailedMessages(), messageId);
        }
        if (message == null) {
            log.debug("No pending or failed message {} in chat {}", messageId, chatId);
            return false;
        }

        message.setStatus(newStatus);
        if (patch != null) {
            patch.applyTo(message);
        }
        insertIntoBucket(record, message);

        updateChatMetadata(chatId, metadata -> metadata.setMessageCount(record.getMessages().size()));
        scheduleSave(chatId);
        notifyListeners(chatId);
        return true;
    }

    public void setHistoryLoadingState(String chatId, boolean loading) {
        if (isBlank(chatId)) {
            return;
        }
        ConversationRecord record = getOrCreate(chatId);
        if (record.isLoadingHistory() != loading) {
            record.setLoadingHistory(loading);
            notifyListeners(chatId);
        }
    }

    public void updatePaginationState(String chatId, boolean hasMore, String nextCursor) {
        if (isBlank(chatId)) {
            return;
        }
        ConversationRecord record = getOrCreate(chatId);
        record.setHasMore(hasMore);
        record.setNextCursor(nextCursor);

        updateChatMetadata(chatId, metadata -> {
            metadata.setHasMore(hasMore);
            metadata.setNextCursor(nextCursor);
            metadata.setHistoryLoaded(!hasMore);
        });

        scheduleSave(chatId);
        notifyListeners(chatId);
    }

    public void markChatAsRead(String chatId) {
        if (isBlank(chatId)) {
            return;
        }
        updateChatMetadata(chatId, metadata -> {
            metadata.setHasUnread(false);
            metadata.setUnreadCount(0);
        });
        notifyListeners(chatId);
    }

    public void setPinned(String chatId, boolean pinned) {
        if (isBlank(chatId)) {
            return;
        }
        updateChatMetadata(chatId, metadata -> metadata.setPinned(pinned));
    }

    /**
     * Applies {@code changes} to the conversation's metadata and stamps its access time.
     */
    public void updateChatMetadata(String chatId, Consumer<ConversationMetadata> changes) {
        ConversationMetadata updated = getChatMetadata(chatId);
        changes.accept(updated);
        updated.setLastAccessed(clock.instant());
        chatMetadata.put(chatId, updated);
        scheduleMetadataSave();
    }

    // ---- hot tier management ----

    /**
     * Writes the conversation to durable storage and drops it from memory.
     */
    public void clearChatMemory(String chatId) {
        if (!memoryCache.containsKey(chatId)) {
            return;
        }
        saveChatToStorage(chatId);
        scheduledSaves.remove(chatId);
        memoryCache.remove(chatId);
        log.debug("Cleared chat {} from memory", chatId);
    }

    /**
     * Loads the conversation into memory without changing its metadata other than the access time.
     */
    public void preloadChat(String chatId) {
        if (isBlank(chatId)) {
            return;
        }
        if (hot(chatId) != null) {
            updateChatAccess(chatId);
        }
    }

    /**
     * Removes conversations not accessed within the retention threshold, pinned ones excepted.
     */
    public void cleanup() {
        cleanupOldChats();
    }

    /**
     * Writes all hot conversations and the metadata synchronously.
     */
    public void flush() {
        for (String chatId : new ArrayList<>(memoryCache.keySet())) {
            saveChatToStorage(chatId);
        }
        scheduledSaves.clear();
        saveMetadataToStorage();
    }

    public void clearAll() {
        Set<String> known = new LinkedHashSet<>(memoryCache.keySet());
        known.addAll(chatMetadata.keySet());

        memoryCache.clear();
        chatMetadata.clear();
        scheduledSaves.clear();
        try {
            storage.wipe();
        } catch (StorageException e) {
            log.error("Failed to clear persisted chat cache", e);
        }
        known.forEach(this::notifyListeners);
    }

    // ---- internals ----

    private ConversationRecord hot(String chatId) {
        ConversationRecord record = memoryCache.get(chatId);
        if (record != null) {
            return record;
        }
        record = loadChatFromStorage(chatId);
        if (record != null) {
            memoryCache.put(chatId, record);
            trimHotTier(chatId);
        }
        return record;
    }

    private ConversationRecord getOrCreate(String chatId) {
        ConversationRecord record = hot(chatId);
        if (record == null) {
            record = ConversationRecord.empty(chatId);
            memoryCache.put(chatId, record);
            trimHotTier(chatId);
        }
        return record;
    }

    private void trimHotTier(String keep) {
        int limit = Math.max(1, options.getMaxCachedChats());
        Iterator<String> eldest = new ArrayList<>(memoryCache.keySet()).iterator();
        while (memoryCache.size() > limit && eldest.hasNext()) {
            String chatId = eldest.next();
            if (chatId.equals(keep)) {
                continue;
            }
            saveChatToStorage(chatId);
            scheduledSaves.remove(chatId);
            memoryCache.remove(chatId);
            log.debug("Flushed chat {} out of the memory cache", chatId);
        }
    }

    private void insertIntoBucket(ConversationRecord record, ChatMessage message) {
        MessageStatus status = message.getStatus();
        if (status == MessageStatus.PENDING) {
            insertSorted(record.getPendingMessages(), message);
        } else if (status == MessageStatus.FAILED) {
            insertSorted(record.getFailedMessages(), message);
        } else {
            List<ChatMessage> confirmed = record.getMessages();
            insertSorted(confirmed, message);
            int overflow = confirmed.size() - options.getMaxMessagesPerChat();
            if (overflow > 0) {
                confirmed.subList(0, overflow).clear();
            }
        }
    }

    // after any equal timestamps, so ties keep insertion order
    private static void insertSorted(List<ChatMessage> bucket, ChatMessage message) {
        int index = bucket.size();
        while (index > 0 && BY_CREATED_AT.compare(bucket.get(index - 1), message) > 0) {
            index--;
        }
        bucket.add(index, message);
    }

    private static ChatMessage take(List<ChatMessage> bucket, String messageId) {
        int index = ConversationRecord.indexOf(bucket, messageId);
        return index >= 0 ? bucket.remove(index) : null;
    }

    private ChatMessage withDefaults(ChatMessage message) {
        ChatMessage copy = message.copy();
        if (isBlank(copy.getId())) {
            copy.setId(generateMessageId());
        }
        if (copy.getCreatedAt() == null) {
            copy.setCreatedAt(clock.instant());
        }
        if (copy.getStatus() == null) {
            copy.setStatus(MessageStatus.SENT);
        }
        return copy;
    }

    private void updateChatAccess(String chatId) {
        updateChatMetadata(chatId, metadata -> { });
    }

    private ConversationRecord loadChatFromStorage(String chatId) {
        try {
            Optional<ConversationRecord> stored = storage.loadConversation(chatId);
            stored.ifPresent(record -> record.normalize(chatId));
            return stored.orElse(null);
        } catch (StorageException e) {
            log.error("Failed to load chat {} from storage", chatId, e);
            return null;
        }
    }

    private void scheduleSave(String chatId) {
        if (scheduledSaves.add(chatId)) {
            eventLoop.execute(() -> {
                if (scheduledSaves.remove(chatId)) {
                    saveChatToStorage(chatId);
                }
            });
        }
    }

    private void scheduleMetadataSave() {
        if (!metadataSaveScheduled) {
            metadataSaveScheduled = true;
            eventLoop.execute(() -> {
                metadataSaveScheduled = false;
                saveMetadataToStorage();
            });
        }
    }

    private void saveChatToStorage(String chatId) {
        ConversationRecord record = memoryCache.get(chatId);
        if (record == null) {
            return;
        }
        try {
            if (isStorageQuotaExceeded()) {
                performEmergencyCleanup(chatId);
            }
            storage.saveConversation(record);
        } catch (StorageQuotaExceededException e) {
            log.warn("Storage quota exceeded while saving chat {}, evicting old chats and retrying", chatId);
            performEmergencyCleanup(chatId);
            try {
                storage.saveConversation(record);
            } catch (StorageException retryFailure) {
                log.error("Dropping write of chat {} after emergency cleanup", chatId, retryFailure);
            }
        } catch (StorageException e) {
            log.error("Failed to save chat {}", chatId, e);
        }
    }

    private void saveMetadataToStorage() {
        try {
            storage.saveMetadata(chatMetadata);
        } catch (StorageException e) {
            log.error("Failed to save chat metadata", e);
        }
    }

    private boolean isStorageQuotaExceeded() {
        try {
            return storage.usageBytes() > options.getMaxStorageBytes();
        } catch (StorageException e) {
            log.warn("Failed to measure cache storage: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Drops the least recently accessed quarter of conversations from durable storage.
     * Conversations still in memory are written again on their next save.
     */
    private void performEmergencyCleanup(String writing) {
        List<String> candidates = chatMetadata.entrySet().stream()
                .filter(entry -> !entry.getKey().equals(writing))
                .sorted(Comparator.comparing(
                        (Map.Entry<String, ConversationMetadata> entry) -> entry.getValue().getLastAccessed(),
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        int toRemove = (int) Math.ceil(candidates.size() * EMERGENCY_EVICTION_SHARE);
        log.warn("Performing emergency cache cleanup, evicting {} of {} chats", toRemove, candidates.size());
        for (int i = 0; i < toRemove; i++) {
            removeChatFromStorage(candidates.get(i));
        }
        saveMetadataToStorage();
    }

    private void cleanupOldChats() {
        Instant cutoff = clock.instant().minus(options.getCleanupThreshold());
        List<String> expired = chatMetadata.entrySet().stream()
                .filter(entry -> !entry.getValue().isPinned())
                .filter(entry -> entry.getValue().getLastAccessed() == null || entry.getValue().getLastAccessed().isBefore(cutoff))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        for (String chatId : expired) {
            removeChatFromStorage(chatId);
            memoryCache.remove(chatId);
            scheduledSaves.remove(chatId);
        }
        if (!expired.isEmpty()) {
            log.info("Removed {} chats not accessed since {}", expired.size(), cutoff);
            saveMetadataToStorage();
        }
    }

    private void removeChatFromStorage(String chatId) {
        chatMetadata.remove(chatId);
        try {
            storage.removeConversation(chatId);
        } catch (StorageException e) {
            log.error("Failed to remove chat {} from storage", chatId, e);
        }
    }

    private void clearCorruptedData() {
        log.warn("Clearing corrupted cache data");
        memoryCache.clear();
        chatMetadata.clear();
        scheduledSaves.clear();
        try {
            storage.wipe();
        } catch (StorageException e) {
            log.error("Failed to wipe corrupted cache data", e);
        }
    }

    private void notifyListeners(String chatId) {
        for (CacheListener listener : listeners) {
            try {
                listener.onConversationChanged(chatId);
            } catch (Exception e) {
                log.error("Error in cache listener for chat {}", chatId, e);
            }
        }
    }

    private static List<ChatMessage> copies(List<ChatMessage> bucket) {
        List<ChatMessage> result = new ArrayList<>(bucket.size());
        for (ChatMessage message : bucket) {
            result.add(message.copy());
        }
        return List.copyOf(result);
    }

    private static Instant later(Instant current, Instant candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null) {
            return current;
        }
        return candidate.isAfter(current) ? candidate : current;
    }

    private static String generateMessageId() {
        return "msg_" + UUID.randomUUID();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
