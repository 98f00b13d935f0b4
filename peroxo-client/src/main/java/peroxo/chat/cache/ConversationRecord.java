package peroxo.chat.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import peroxo.chat.model.ChatMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Message buckets and pagination cursor of one conversation, persisted as one store entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationRecord {
    private String chatId;
    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();
    @Builder.Default
    private List<ChatMessage> pendingMessages = new ArrayList<>();
    @Builder.Default
    private List<ChatMessage> failedMessages = new ArrayList<>();
    private Boolean hasMore;
    private String nextCursor;
    @JsonIgnore
    private boolean loadingHistory;

    public static ConversationRecord empty(String chatId) {
        return ConversationRecord.builder().chatId(chatId).build();
    }

    /**
     * Replaces buckets missing from older persisted entries with empty ones.
     */
    void normalize(String expectedChatId) {
        if (chatId == null) {
            chatId = expectedChatId;
        }
        if (messages == null) {
            messages = new ArrayList<>();
        }
        if (pendingMessages == null) {
            pendingMessages = new ArrayList<>();
        }
        if (failedMessages == null) {
            failedMessages = new ArrayList<>();
        }
    }

    boolean containsId(String messageId) {
        return indexOf(messages, messageId) >= 0
                || indexOf(pendingMessages, messageId) >= 0
                || indexOf(failedMessages, messageId) >= 0;
    }

    static int indexOf(List<ChatMessage> bucket, String messageId) {
        for (int i = 0; i < bucket.size(); i++) {
            if (messageId.equals(bucket.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }
}
