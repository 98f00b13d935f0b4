package peroxo.chat.shared.frame;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Request for the next older page of a conversation")
public class ChatHistoryRequest implements OutboundFrame {

    public static final String TAG = "ChatHistoryRequest";

    @Schema(description = "Canonical conversation id", example = "12_34")
    @JsonProperty("conversation_id")
    private String conversationId;

    @Schema(description = "Pagination cursor, omitted for the newest page", nullable = true)
    @JsonProperty("message_id")
    private String messageId;

    @Override
    public String tag() {
        return TAG;
    }
}
