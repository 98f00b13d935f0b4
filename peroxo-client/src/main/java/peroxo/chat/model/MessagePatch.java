package peroxo.chat.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields merged into a message when its status changes, e.g. the server timestamp from an acknowledgment.
 */
@Value
@Builder
public class MessagePatch {
    public static final MessagePatch EMPTY = MessagePatch.builder().build();

    Instant createdAt;
    @Singular
    Map<String, String> attributes;

    public void applyTo(ChatMessage message) {
        if (createdAt != null) {
            message.setCreatedAt(createdAt);
        }
        if (!attributes.isEmpty()) {
            Map<String, String> merged = message.getAttributes() == null
                    ? new LinkedHashMap<>()
                    : new LinkedHashMap<>(message.getAttributes());
            merged.putAll(attributes);
            message.setAttributes(merged);
        }
    }
}
