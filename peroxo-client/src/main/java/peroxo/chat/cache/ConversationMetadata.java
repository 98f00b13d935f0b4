package peroxo.chat.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-conversation summary kept apart from the message bodies so conversations can be listed cheaply.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMetadata {
    private Instant lastAccessed;
    private Instant lastMessageTime;
    private int messageCount;
    private int unreadCount;
    private boolean hasUnread;
    private boolean pinned;
    @Builder.Default
    private boolean hasMore = true;
    private String nextCursor;
    private boolean historyLoaded;

    public static ConversationMetadata fresh(Instant now) {
        return ConversationMetadata.builder()
                .lastAccessed(now)
                .lastMessageTime(now)
                .build();
    }

    public ConversationMetadata copy() {
        return toBuilder().build();
    }
}
