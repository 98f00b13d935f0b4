package peroxo.chat.session;

import lombok.Getter;

/**
 * Marks one in-flight history request. Once aborted, its response must not touch the cache.
 */
@Getter
public class LoadToken {
    private final String conversationId;
    private boolean aborted;

    public LoadToken(String conversationId) {
        this.conversationId = conversationId;
    }

    public void abort() {
        aborted = true;
    }

    public boolean isStaleFor(String activeConversationId) {
        return aborted || !conversationId.equals(activeConversationId);
    }
}
