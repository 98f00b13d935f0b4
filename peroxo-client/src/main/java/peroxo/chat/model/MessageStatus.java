package peroxo.chat.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageStatus {
    @JsonProperty("sent")
    SENT,
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("failed")
    FAILED
}
