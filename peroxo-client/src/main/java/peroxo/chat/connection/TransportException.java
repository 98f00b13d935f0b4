package peroxo.chat.connection;

/**
 * Failure of the socket: connect failure, abnormal close, or a send attempted while not connected.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
