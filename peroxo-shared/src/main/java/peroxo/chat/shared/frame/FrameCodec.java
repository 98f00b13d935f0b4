package peroxo.chat.shared.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Iterator;
import java.util.Map;

/**
 * Converts frames to and from the JSON text carried by the socket.
 * <p>
 * Every frame is externally tagged: {@code {"DirectMessage": {...}}}. Numeric timestamps are
 * read as epoch milliseconds, timestamps are written as ISO-8601 strings.
 */
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec() {
        this(defaultObjectMapper());
    }

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(OutboundFrame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("Frame must not be null");
        }
        ObjectNode root = objectMapper.createObjectNode();
        root.set(frame.tag(), objectMapper.valueToTree(frame));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + frame.tag() + " frame", e);
        }
    }

    public InboundFrame decode(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidFrameException("Empty frame");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidFrameException("Frame is not valid JSON", e);
        }

        if (root == null || !root.isObject() || root.size() != 1) {
            throw new InvalidFrameException("Frame must be an object with exactly one tag");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        Map.Entry<String, JsonNode> entry = fields.next();
        String tag = entry.getKey();
        JsonNode body = entry.getValue();
        if (body == null || !body.isObject()) {
            throw new InvalidFrameException("Body of " + tag + " frame must be an object");
        }

        return switch (tag) {
            case DirectMessage.TAG -> read(body, DirectMessage.class, tag);
            case ChatHistory.TAG -> read(body, ChatHistory.class, tag);
            case MessageAck.TAG -> read(body, MessageAck.class, tag);
            default -> throw new InvalidFrameException("Unknown frame tag: " + tag);
        };
    }

    private <T extends InboundFrame> T read(JsonNode body, Class<T> type, String tag) {
        try {
            return objectMapper.treeToValue(body, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidFrameException("Malformed " + tag + " frame", e);
        }
    }
}
