package peroxo.chat.cache;

import lombok.Value;
import peroxo.chat.model.ChatMessage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Snapshot of the three buckets of a conversation.
 */
@Value
public class MessageBuckets {
    public static final MessageBuckets EMPTY = new MessageBuckets(List.of(), List.of(), List.of());

    List<ChatMessage> confirmed;
    List<ChatMessage> pending;
    List<ChatMessage> failed;

    /**
     * All buckets merged, ascending by creation time. Equal timestamps keep bucket order.
     */
    public List<ChatMessage> merged() {
        List<ChatMessage> all = new ArrayList<>(confirmed.size() + pending.size() + failed.size());
        all.addAll(confirmed);
        all.addAll(pending);
        all.addAll(failed);
        all.sort(Comparator.comparing(ChatMessage::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return all;
    }

    public int total() {
        return confirmed.size() + pending.size() + failed.size();
    }

    public boolean isEmpty() {
        return total() == 0;
    }
}
