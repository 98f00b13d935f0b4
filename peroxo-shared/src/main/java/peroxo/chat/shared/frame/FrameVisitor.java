package peroxo.chat.shared.frame;

public interface FrameVisitor<R> {

    R visitDirectMessage(DirectMessage message);

    R visitChatHistory(ChatHistory history);

    R visitMessageAck(MessageAck ack);
}
