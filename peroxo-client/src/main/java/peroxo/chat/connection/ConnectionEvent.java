package peroxo.chat.connection;

import lombok.Builder;
import lombok.Value;

/**
 * A connection state change. Close code and reason are set only for transitions caused by the socket closing.
 */
@Value
@Builder
public class ConnectionEvent {
    ConnectionState state;
    Integer closeCode;
    String reason;
    String error;
    int reconnectAttempts;
}
