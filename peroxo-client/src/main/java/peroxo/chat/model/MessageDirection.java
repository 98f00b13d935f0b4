package peroxo.chat.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageDirection {
    @JsonProperty("incoming")
    INCOMING,
    @JsonProperty("outgoing")
    OUTGOING
}
