package peroxo.chat.session;

import lombok.Builder;
import lombok.Value;
import peroxo.chat.model.ChatMessage;

import java.util.List;

/**
 * What a chat view renders for the active conversation.
 */
@Value
@Builder
public class SessionSnapshot {
    public static final SessionSnapshot EMPTY = SessionSnapshot.builder().build();

    String conversationId;
    String peerId;
    @Builder.Default
    List<ChatMessage> confirmed = List.of();
    @Builder.Default
    List<ChatMessage> pending = List.of();
    @Builder.Default
    List<ChatMessage> failed = List.of();
    // all three buckets merged by creation time
    @Builder.Default
    List<ChatMessage> all = List.of();
    boolean loading;
    String error;
    boolean hasMore;
    boolean loadingHistory;

    public int getConfirmedCount() {
        return confirmed.size();
    }

    public int getPendingCount() {
        return pending.size();
    }

    public int getFailedCount() {
        return failed.size();
    }

    public int getTotalCount() {
        return confirmed.size() + pending.size() + failed.size();
    }

    public boolean isEmpty() {
        return getTotalCount() == 0;
    }
}
