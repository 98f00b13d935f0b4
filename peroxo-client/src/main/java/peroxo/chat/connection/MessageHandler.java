package peroxo.chat.connection;

import peroxo.chat.shared.frame.InboundFrame;

@FunctionalInterface
public interface MessageHandler {

    void onFrame(InboundFrame frame);
}
