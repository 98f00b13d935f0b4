package peroxo.chat.shared.frame;

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
@Schema(description = "Server confirmation that a sent message was stored")
public class MessageAck implements InboundFrame {

    public static final String TAG = "MessageAck";
    public static final String STATUS_PERSISTED = "Persisted";

    @Schema(description = "Id of the acknowledged message")
    @JsonProperty("message_id")
    private String messageId;

    @Schema(description = "Delivery status", example = STATUS_PERSISTED)
    @JsonProperty("status")
    private String status;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public <R> R accept(FrameVisitor<R> visitor) {
        return visitor.visitMessageAck(this);
    }
}
