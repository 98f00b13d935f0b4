package peroxo.chat.shared.frame;

/**
 * A frame sent by the client. The tag becomes the single top-level key of the JSON text.
 */
public interface OutboundFrame {

    String tag();
}
