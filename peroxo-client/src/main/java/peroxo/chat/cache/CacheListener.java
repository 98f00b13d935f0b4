package peroxo.chat.cache;

/**
 * Notified after any mutation of a conversation's buckets, pagination or read state.
 */
@FunctionalInterface
public interface CacheListener {

    void onConversationChanged(String conversationId);
}
