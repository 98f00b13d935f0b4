package peroxo.chat.shared.frame;

/**
 * A frame received from the message server.
 * Dispatch goes through {@link FrameVisitor} so every frame kind has to be handled.
 */
public interface InboundFrame {

    String tag();

    <R> R accept(FrameVisitor<R> visitor);
}
