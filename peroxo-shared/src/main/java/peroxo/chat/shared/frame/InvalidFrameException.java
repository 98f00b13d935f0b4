package peroxo.chat.shared.frame;

/**
 * Inbound text that cannot be turned into a known frame.
 */
public class InvalidFrameException extends RuntimeException {

    public InvalidFrameException(String message) {
        super(message);
    }

    public InvalidFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
