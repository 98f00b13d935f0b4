package peroxo.chat.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A chat message as held by the local cache.
 * Identity is {@link #id}: two messages with the same id in one conversation are the same message.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ChatMessage {
    private String id;
    private String senderId;
    private String receiverId;
    private String content;
    private MessageDirection direction;
    private Instant createdAt;
    private MessageStatus status;
    // Server assigned extras merged in by status updates
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isIncoming() {
        return direction == MessageDirection.INCOMING;
    }

    public ChatMessage copy() {
        return toBuilder()
                .attributes(attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes))
                .build();
    }
}
