package peroxo.chat.shared.frame;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One page of older messages, answer to a ChatHistoryRequest")
public class ChatHistory implements InboundFrame {

    public static final String TAG = "ChatHistory";

    @Schema(description = "Messages of the page, oldest first")
    @JsonProperty("messages")
    @Builder.Default
    private List<DirectMessage> messages = new ArrayList<>();

    @Schema(description = "Whether an older page exists")
    @JsonProperty("has_more")
    private boolean hasMore;

    @Schema(description = "Cursor to request the next older page with", nullable = true)
    @JsonProperty("next_cursor")
    private String nextCursor;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public <R> R accept(FrameVisitor<R> visitor) {
        return visitor.visitChatHistory(this);
    }
}
