package peroxo.chat.shared.frame;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Chat message between two users, sent by the client and delivered by the server")
public class DirectMessage implements InboundFrame, OutboundFrame {

    public static final String TAG = "DirectMessage";

    @Schema(description = "Sender user id", example = "12")
    @JsonProperty("from")
    @JsonSerialize(using = IdentitySerializer.class)
    private String from;

    @Schema(description = "Receiver user id", example = "34")
    @JsonProperty("to")
    @JsonSerialize(using = IdentitySerializer.class)
    private String to;

    @Schema(description = "Message text")
    @JsonProperty("content")
    private String content;

    @Schema(description = "Client generated message id, reused on retries")
    @JsonProperty("message_id")
    private String messageId;

    @Schema(description = "Server timestamp, absent on outgoing frames")
    @JsonProperty("timestamp")
    private Instant timestamp;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public <R> R accept(FrameVisitor<R> visitor) {
        return visitor.visitDirectMessage(this);
    }
}
