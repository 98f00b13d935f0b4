package peroxo.chat.cache;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import peroxo.chat.cache.store.CacheStorage;
import peroxo.chat.cache.store.InMemoryKeyValueStore;
import peroxo.chat.model.ChatMessage;
import peroxo.chat.model.MessageDirection;
import peroxo.chat.model.MessagePatch;
import peroxo.chat.model.MessageStatus;
import peroxo.chat.shared.frame.FrameCodec;
import peroxo.chat.support.ManualEventLoop;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

public class MessageCacheTest {
    private static final String CHAT = "1_2";
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final ManualEventLoop loop = new ManualEventLoop(T0);
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    private final CacheOptions options = CacheOptions.builder().maxMessagesPerChat(5).build();
    private final MessageCache cache = newCache(store, options);

    private MessageCache newCache(InMemoryKeyValueStore backing, CacheOptions cacheOptions) {
        return new MessageCache(new CacheStorage(backing, FrameCodec.defaultObjectMapper()), loop, cacheOptions);
    }

    private static ChatMessage message(String id, MessageStatus status, long second) {
        return ChatMessage.builder()
                .id(id)
                .senderId("1")
                .receiverId("2")
                .content("text " + id)
                .direction(MessageDirection.OUTGOING)
                .createdAt(T0.plusSeconds(second))
                .status(status)
                .build();
    }

    private static ChatMessage incoming(String id, long second) {
        return message(id, MessageStatus.SENT, second).toBuilder()
                .senderId("2")
                .receiverId("1")
                .direction(MessageDirection.INCOMING)
                .build();
    }

    private static List<String> ids(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::getId).collect(Collectors.toList());
    }

    // ---- dedup ----

    @Property(tries = 50)
    void addingAnIdTwiceKeepsOneCopy(@ForAll MessageStatus first, @ForAll MessageStatus second) {
        MessageCache fresh = newCache(new InMemoryKeyValueStore(), options);

        assertThat(fresh.addMessage(CHAT, message("m1", first, 1))).isTrue();
        assertThat(fresh.addMessage(CHAT, message("m1", second, 2))).isTrue();

        MessageBuckets buckets = fresh.getAllMessages(CHAT);
        assertThat(buckets.total()).isEqualTo(1);
        assertThat(buckets.merged().get(0).getStatus()).isEqualTo(first);
    }

    @Example
    void assignsIdWhenMissing() {
        cache.addMessage(CHAT, message(null, MessageStatus.SENT, 1));

        List<ChatMessage> messages = cache.getMessages(CHAT);
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).getId()).startsWith("msg_");
    }

    @Example
    void rejectsMissingConversationOrMessage() {
        assertThat(cache.addMessage("", message("m1", MessageStatus.SENT, 1))).isFalse();
        assertThat(cache.addMessage(CHAT, null)).isFalse();
        assertThat(cache.getMessages(null)).isEmpty();
    }

    @Example
    void routesMessagesByStatus() {
        cache.addMessage(CHAT, message("s", MessageStatus.SENT, 1));
        cache.addMessage(CHAT, message("p", MessageStatus.PENDING, 2));
        cache.addMessage(CHAT, message("f", MessageStatus.FAILED, 3));

        MessageBuckets buckets = cache.getAllMessages(CHAT);
        assertThat(ids(buckets.getConfirmed())).containsExactly("s");
        assertThat(ids(buckets.getPending())).containsExactly("p");
        assertThat(ids(buckets.getFailed())).containsExactly("f");
    }

    @Example
    void returnedMessagesAreCopies() {
        cache.addMessage(CHAT, message("m1", MessageStatus.SENT, 1));

        cache.getMessages(CHAT).get(0).setContent("changed");

        assertThat(cache.getMessages(CHAT).get(0).getContent()).isEqualTo("text m1");
    }

    // ---- status transitions ----

    @Example
    void pendingMessageMovesToConfirmedInSortedPosition() {
        cache.addMessage(CHAT, message("early", MessageStatus.SENT, 1));
        cache.addMessage(CHAT, message("late", MessageStatus.SENT, 10));
        cache.addMessage(CHAT, message("p", MessageStatus.PENDING, 5));

        boolean updated = cache.updateMessageStatus(CHAT, "p", MessageStatus.SENT, MessagePatch.EMPTY);

        assertThat(updated).isTrue();
        MessageBuckets buckets = cache.getAllMessages(CHAT);
        assertThat(buckets.getPending()).isEmpty();
        assertThat(ids(buckets.getConfirmed())).containsExactly("early", "p", "late");
        assertThat(buckets.getConfirmed().get(1).getStatus()).isEqualTo(MessageStatus.SENT);
    }

    @Example
    void failedMessageCanReturnToPending() {
        cache.addMessage(CHAT, message("f", MessageStatus.FAILED, 1));

        assertThat(cache.updateMessageStatus(CHAT, "f", MessageStatus.PENDING, MessagePatch.EMPTY)).isTrue();

        MessageBuckets buckets = cache.getAllMessages(CHAT);
        assertThat(buckets.getFailed()).isEmpty();
        assertThat(ids(buckets.getPending())).containsExactly("f");
    }

    @Example
    void confirmedOrUnknownMessagesCannotTransition() {
        cache.addMessage(CHAT, message("s", MessageStatus.SENT, 1));
        cache.addMessage(CHAT, message("p", MessageStatus.PENDING, 2));
        MessageBuckets before = cache.getAllMessages(CHAT);

        assertThat(cache.updateMessageStatus(CHAT, "s", MessageStatus.FAILED, MessagePatch.EMPTY)).isFalse();
        assertThat(cache.updateMessageStatus(CHAT, "nope", MessageStatus.SENT, MessagePatch.EMPTY)).isFalse();
        assertThat(cache.updateMessageStatus("9_9", "p", MessageStatus.SENT, MessagePatch.EMPTY)).isFalse();

        assertThat(cache.getAllMessages(CHAT)).isEqualTo(before);
    }

    @Example
    void appliesPatchOnTransition() {
        cache.addMessage(CHAT, message("p", MessageStatus.PENDING, 1));
        Instant serverTime = T0.plusSeconds(30);

        cache.updateMessageStatus(CHAT, "p", MessageStatus.SENT,
                MessagePatch.builder().createdAt(serverTime).attribute("ackStatus", "Persisted").build());

        ChatMessage confirmed = cache.getMessages(CHAT).get(0);
        assertThat(confirmed.getCreatedAt()).isEqualTo(serverTime);
        assertThat(confirmed.getAttributes()).containsEntry("ackStatus", "Persisted");
    }

    // ---- ordering and bounds ----

    @Provide
    Arbitrary<List<ChatMessage>> messageBatches() {
        Arbitrary<ChatMessage> single = Combinators.combine(
                Arbitraries.integers().between(0, 20),
                Arbitraries.of(MessageStatus.class),
                Arbitraries.integers().between(0, 1000)
        ).as((idNumber, status, second) -> message("m" + idNumber, status, second));
        return single.list().ofMaxSize(40);
    }

    @Property(tries = 100)
    void mergedViewIsOrderedByCreationTime(@ForAll("messageBatches") List<ChatMessage> batch) {
        MessageCache fresh = newCache(new InMemoryKeyValueStore(), CacheOptions.builder().maxMessagesPerChat(10).build());
        batch.forEach(m -> fresh.addMessage(CHAT, m));

        MessageBuckets buckets = fresh.getAllMessages(CHAT);

        assertThat(buckets.merged()).isSortedAccordingTo((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
        assertThat(buckets.getConfirmed()).isSortedAccordingTo((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
        assertThat(ids(buckets.merged())).doesNotHaveDuplicates();
    }

    @Property(tries = 30)
    void confirmedBucketKeepsMostRecent(@ForAll @IntRange(min = 1, max = 30) int count) {
        MessageCache fresh = newCache(new InMemoryKeyValueStore(), options);
        for (int i = 1; i <= count; i++) {
            fresh.addMessage(CHAT, message("m" + i, MessageStatus.SENT, i));
        }

        List<String> expected = IntStream.rangeClosed(Math.max(1, count - 5 + 1), count)
                .mapToObj(i -> "m" + i)
                .collect(Collectors.toList());
        assertThat(ids(fresh.getMessages(CHAT))).isEqualTo(expected);
    }

    @Example
    void pendingAndFailedAreNeverTrimmed() {
        for (int i = 0; i < 8; i++) {
            cache.addMessage(CHAT, message("p" + i, MessageStatus.PENDING, i));
            cache.addMessage(CHAT, message("f" + i, MessageStatus.FAILED, i));
        }

        MessageBuckets buckets = cache.getAllMessages(CHAT);
        assertThat(buckets.getPending()).hasSize(8);
        assertThat(buckets.getFailed()).hasSize(8);
    }

    @Example
    void historyPageIsMergedWithoutDuplicatesAndBounded() {
        cache.addMessage(CHAT, message("m20", MessageStatus.SENT, 20));
        List<ChatMessage> page = new ArrayList<>();
        for (int i = 1; i <= 14; i++) {
            page.add(message("m" + i, MessageStatus.SENT, i));
        }
        page.add(message("m20", MessageStatus.SENT, 20));
        page.add(message("m3", MessageStatus.SENT, 3));

        assertThat(cache.addMessages(CHAT, page, true)).isTrue();

        List<String> confirmed = ids(cache.getMessages(CHAT));
        assertThat(confirmed).hasSize(10).doesNotHaveDuplicates();
        assertThat(confirmed.get(0)).isEqualTo("m6");
        assertThat(confirmed.get(confirmed.size() - 1)).isEqualTo("m20");
    }

    @Example
    void emptyHistoryPageIsRejected() {
        assertThat(cache.addMessages(CHAT, List.of(), true)).isFalse();
    }

    // ---- pagination and read state ----

    @Example
    void paginationStateSurvivesRestart() {
        cache.updatePaginationState(CHAT, false, "cursor-7");
        loop.runPending();

        MessageCache restarted = newCache(store, options);
        PaginationState state = restarted.getPaginationState(CHAT);

        assertThat(state.isHasMore()).isFalse();
        assertThat(state.getNextCursor()).isEqualTo("cursor-7");
        assertThat(restarted.getChatMetadata(CHAT).isHistoryLoaded()).isTrue();
    }

    @Example
    void newConversationHasMoreHistory() {
        PaginationState state = cache.getPaginationState("5_6");

        assertThat(state.isHasMore()).isTrue();
        assertThat(state.getNextCursor()).isNull();
        assertThat(state.isLoading()).isFalse();
    }

    @Example
    void loadingFlagIsTransient() {
        cache.setHistoryLoadingState(CHAT, true);
        assertThat(cache.getPaginationState(CHAT).isLoading()).isTrue();
        cache.flush();

        assertThat(newCache(store, options).getPaginationState(CHAT).isLoading()).isFalse();
    }

    @Example
    void incomingMessagesCountAsUnreadUntilRead() {
        cache.addMessage(CHAT, incoming("a", 1));
        cache.addMessage(CHAT, incoming("b", 2));
        cache.addMessage(CHAT, message("c", MessageStatus.SENT, 3));

        ConversationMetadata metadata = cache.getChatMetadata(CHAT);
        assertThat(metadata.isHasUnread()).isTrue();
        assertThat(metadata.getUnreadCount()).isEqualTo(2);
        assertThat(metadata.getMessageCount()).isEqualTo(3);
        assertThat(metadata.getLastMessageTime()).isEqualTo(T0.plusSeconds(3));

        cache.markChatAsRead(CHAT);

        assertThat(cache.getChatMetadata(CHAT).isHasUnread()).isFalse();
        assertThat(cache.getChatMetadata(CHAT).getUnreadCount()).isZero();
    }

    @Example
    void readingRefreshesAccessTime() {
        cache.addMessage(CHAT, message("m1", MessageStatus.SENT, 1));
        loop.advance(Duration.ofHours(2));

        cache.getMessages(CHAT);

        assertThat(cache.getChatMetadata(CHAT).getLastAccessed()).isEqualTo(T0.plus(Duration.ofHours(2)));
    }

    // ---- durable tier ----

    @Example
    void writesAreDeferredToTheEventLoop() {
        cache.addMessage(CHAT, message("m1", MessageStatus.SENT, 1));
        assertThat(store.get("msgcache_chat_" + CHAT)).isEmpty();

        loop.runPending();

        assertThat(store.get("msgcache_chat_" + CHAT)).isPresent();
        assertThat(ids(newCache(store, options).getMessages(CHAT))).containsExactly("m1");
    }

    @Example
    void repeatedChangesAreWrittenOnce() {
        CountingStore counting = new CountingStore();
        MessageCache counted = newCache(counting, options);

        counted.addMessage(CHAT, message("m1", MessageStatus.SENT, 1));
        counted.addMessage(CHAT, message("m2", MessageStatus.SENT, 2));
        counted.addMessage(CHAT, message("m3", MessageStatus.SENT, 3));
        loop.runPending();

        assertThat(counting.writes("msgcache_chat_" + CHAT)).isEqualTo(1);
        assertThat(counting.writes("msgcache_chat_metadata")).isEqualTo(1);
    }

    @Example
    void clearChatMemoryKeepsDurableCopy() {
        cache.addMessage(CHAT, message("m1", MessageStatus.PENDING, 1));

        cache.clearChatMemory(CHAT);

        assertThat(cache.getStats().getMemoryCacheSize()).isZero();
        assertThat(store.get("msgcache_chat_" + CHAT)).isPresent();
        assertThat(ids(cache.getAllMessages(CHAT).getPending())).containsExactly("m1");
    }

    @Example
    void preloadDoesNotTouchUnreadState() {
        cache.addMessage(CHAT, incoming("a", 1));
        cache.clearChatMemory(CHAT);

        cache.preloadChat(CHAT);

        assertThat(cache.getStats().getMemoryCacheSize()).isEqualTo(1);
        assertThat(cache.getChatMetadata(CHAT).getUnreadCount()).isEqualTo(1);
    }

    @Example
    void hotTierIsBounded() {
        MessageCache bounded = newCache(store, CacheOptions.builder().maxCachedChats(2).build());

        bounded.addMessage("1_2", message("a", MessageStatus.SENT, 1));
        bounded.addMessage("1_3", message("b", MessageStatus.SENT, 2));
        bounded.addMessage("1_4", message("c", MessageStatus.SENT, 3));

        assertThat(bounded.getStats().getMemoryCacheSize()).isEqualTo(2);
        assertThat(store.get("msgcache_chat_1_2")).isPresent();
        assertThat(ids(bounded.getMessages("1_2"))).containsExactly("a");
    }

    @Example
    void cleanupRemovesStaleUnpinnedConversations() {
        cache.addMessage("1_2", message("a", MessageStatus.SENT, 1));
        cache.addMessage("1_3", message("b", MessageStatus.SENT, 1));
        cache.setPinned("1_3", true);
        loop.runPending();

        loop.setTime(T0.plus(Duration.ofDays(31)));
        cache.addMessage("1_4", message("c", MessageStatus.SENT, 1));
        cache.cleanup();
        loop.runPending();

        assertThat(cache.getStats().getTotalChats()).isEqualTo(2);
        assertThat(store.get("msgcache_chat_1_2")).isEmpty();
        assertThat(store.get("msgcache_chat_1_3")).isPresent();
        assertThat(store.get("msgcache_chat_1_4")).isPresent();
    }

    @Example
    void staleConversationsAreRemovedAtStartup() {
        cache.addMessage(CHAT, message("a", MessageStatus.SENT, 1));
        loop.runPending();

        loop.setTime(T0.plus(Duration.ofDays(45)));
        MessageCache restarted = newCache(store, options);

        assertThat(restarted.getStats().getTotalChats()).isZero();
        assertThat(store.get("msgcache_chat_" + CHAT)).isEmpty();
    }

    @Example
    void corruptedMetadataWipesTheNamespace() {
        store.put("msgcache_chat_metadata", "{not json");
        store.put("msgcache_chat_1_2", "{}");
        store.put("other_key", "kept");

        MessageCache recovered = newCache(store, options);

        assertThat(store.keys("msgcache_")).isEmpty();
        assertThat(store.get("other_key")).contains("kept");
        assertThat(recovered.addMessage(CHAT, message("m1", MessageStatus.SENT, 1))).isTrue();
    }

    @Example
    void unreadableConversationIsTreatedAsAbsent() {
        store.put("msgcache_chat_" + CHAT, "[[[");

        assertThat(cache.getMessages(CHAT)).isEmpty();
        assertThat(store.get("msgcache_chat_" + CHAT)).isEmpty();
    }

    @Example
    void overBudgetEvictsLeastRecentlyUsedFromStorage() {
        MessageCache tight = newCache(store, CacheOptions.builder().maxStorageBytes(1).build());

        tight.addMessage("1_2", message("a", MessageStatus.SENT, 1));
        loop.runPending();
        loop.advance(Duration.ofMinutes(1));
        tight.addMessage("1_3", message("b", MessageStatus.SENT, 2));
        loop.runPending();

        assertThat(store.get("msgcache_chat_1_2")).isEmpty();
        assertThat(store.get("msgcache_chat_1_3")).isPresent();
        // memory stays authoritative
        assertThat(ids(tight.getMessages("1_2"))).containsExactly("a");
    }

    @Example
    void fullStoreTriggersEmergencyCleanupAndRetry() {
        InMemoryKeyValueStore small = new InMemoryKeyValueStore(1200);
        MessageCache limited = newCache(small, options);
        String longText = "x".repeat(300);

        limited.addMessage("1_2", message("a", MessageStatus.SENT, 1).toBuilder().content(longText).build());
        loop.runPending();
        loop.advance(Duration.ofMinutes(1));
        limited.addMessage("1_3", message("b", MessageStatus.SENT, 2).toBuilder().content(longText).build());
        loop.runPending();

        assertThat(small.get("msgcache_chat_1_2")).isEmpty();
        assertThat(small.get("msgcache_chat_1_3")).isPresent();
        assertThat(ids(limited.getMessages("1_3"))).containsExactly("b");
    }

    // ---- listeners, stats, reset ----

    @Example
    void listenersAreNotifiedAndIsolated() {
        List<String> changed = new ArrayList<>();
        cache.addListener(chatId -> {
            throw new IllegalStateException("boom");
        });
        Runnable remove = cache.addListener(changed::add);

        cache.addMessage(CHAT, message("m1", MessageStatus.SENT, 1));
        remove.run();
        cache.addMessage(CHAT, message("m2", MessageStatus.SENT, 2));

        assertThat(changed).containsExactly(CHAT);
    }

    @Example
    void statsDescribeBothTiers() {
        cache.addMessage("1_2", message("a", MessageStatus.SENT, 1));
        loop.advance(Duration.ofMinutes(5));
        cache.addMessage("1_3", message("b", MessageStatus.SENT, 2));
        loop.runPending();

        CacheStats stats = cache.getStats();

        assertThat(stats.getMemoryCacheSize()).isEqualTo(2);
        assertThat(stats.getTotalChats()).isEqualTo(2);
        assertThat(stats.getStorageBytes()).isPositive();
        assertThat(stats.getOldestChat()).isEqualTo(T0);
        assertThat(stats.getNewestChat()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
    }

    @Example
    void clearAllEmptiesEverything() {
        cache.addMessage(CHAT, message("m1", MessageStatus.SENT, 1));
        loop.runPending();

        cache.clearAll();
        loop.runPending();

        assertThat(cache.getMessages(CHAT)).isEmpty();
        assertThat(cache.getStats().getTotalChats()).isZero();
        assertThat(store.keys("msgcache_")).isEmpty();
    }

    @Property(tries = 20)
    void unreadCountMatchesIncomingMessages(@ForAll @Size(max = 15) List<@IntRange(min = 0, max = 1) Integer> directions) {
        MessageCache fresh = newCache(new InMemoryKeyValueStore(), CacheOptions.builder().maxMessagesPerChat(50).build());
        int expected = 0;
        for (int i = 0; i < directions.size(); i++) {
            if (directions.get(i) == 1) {
                fresh.addMessage(CHAT, incoming("m" + i, i));
                expected++;
            } else {
                fresh.addMessage(CHAT, message("m" + i, MessageStatus.SENT, i));
            }
        }

        assertThat(fresh.getChatMetadata(CHAT).getUnreadCount()).isEqualTo(expected);
    }

    private static class CountingStore extends InMemoryKeyValueStore {
        private final Map<String, Integer> writes = new HashMap<>();

        @Override
        public synchronized void put(String key, String value) {
            writes.merge(key, 1, Integer::sum);
            super.put(key, value);
        }

        int writes(String key) {
            return writes.getOrDefault(key, 0);
        }
    }
}
