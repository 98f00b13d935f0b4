package peroxo.chat.session;

import lombok.extern.slf4j.Slf4j;
import peroxo.chat.cache.MessageBuckets;
import peroxo.chat.cache.MessageCache;
import peroxo.chat.cache.PaginationState;
import peroxo.chat.connection.ConnectionManager;
import peroxo.chat.connection.Subscription;
import peroxo.chat.connection.TransportException;
import peroxo.chat.event.Cancellable;
import peroxo.chat.event.EventLoop;
import peroxo.chat.model.ChatMessage;
import peroxo.chat.model.MessageDirection;
import peroxo.chat.model.MessagePatch;
import peroxo.chat.model.MessageStatus;
import peroxo.chat.shared.frame.ChatHistory;
import peroxo.chat.shared.frame.ChatHistoryRequest;
import peroxo.chat.shared.frame.DirectMessage;
import peroxo.chat.shared.frame.FrameVisitor;
import peroxo.chat.shared.frame.InboundFrame;
import peroxo.chat.shared.frame.MessageAck;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connects one signed-in user's chat view to the connection and the cache.
 * <p>
 * Exactly one conversation is active at a time. Inbound messages are cached for every conversation,
 * but snapshots are published only for the active one. Must be used from the event loop.
 */
@Slf4j
public class ConversationSession implements AutoCloseable {
    static final String ATTRIBUTE_ACK_STATUS = "ackStatus";

    private final String selfId;
    private final ConnectionManager connection;
    private final MessageCache cache;
    private final EventLoop eventLoop;
    private final Duration readDebounce;
    private final Duration historyTimeout;
    private final DeliveryTracker deliveryTracker;
    private final FrameDispatcher dispatcher = new FrameDispatcher();

    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final Subscription frameSubscription;
    private final Runnable cacheSubscription;

    private String activeConversationId;
    private String activePeerId;
    private boolean loading;
    private String error;
    private LoadToken historyToken;
    private Cancellable historyTimer = Cancellable.NOOP;
    private Cancellable readTimer = Cancellable.NOOP;
    private boolean closed;

    public ConversationSession(String selfId, ConnectionManager connection, MessageCache cache, EventLoop eventLoop,
                               Duration deliveryTimeout, Duration readDebounce) {
        if (selfId == null || selfId.isBlank()) {
            throw new IllegalArgumentException("User ID is required for a conversation session");
        }
        this.selfId = selfId;
        this.connection = connection;
        this.cache = cache;
        this.eventLoop = eventLoop;
        this.readDebounce = readDebounce;
        this.historyTimeout = deliveryTimeout;
        this.deliveryTracker = new DeliveryTracker(eventLoop, deliveryTimeout);

        this.frameSubscription = connection.addMessageHandler(this::onFrame);
        this.cacheSubscription = cache.addListener(this::onConversationChanged);
    }

    public Subscription addListener(SessionListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Makes the conversation with {@code peerId} the active one.
     * The previous conversation is written to storage and dropped from memory.
     */
    public void switchTo(String peerId) {
        ensureOpen();
        String conversationId = ConversationIds.canonical(selfId, peerId);
        if (conversationId.equals(activeConversationId)) {
            return;
        }

        abortHistoryLoad();
        readTimer.cancel();

        String previous = activeConversationId;
        activeConversationId = conversationId;
        activePeerId = peerId;
        if (previous != null) {
            log.debug("Chat changed, clearing {} from memory", previous);
            cache.clearChatMemory(previous);
        }

        loading = true;
        error = null;
        try {
            cache.preloadChat(conversationId);
        } catch (RuntimeException e) {
            log.error("Failed to load messages for {}", conversationId, e);
            error = "Failed to load messages";
        } finally {
            loading = false;
        }
        publish();
        scheduleMarkAsRead();

        MessageBuckets buckets = cache.getAllMessages(conversationId);
        if (buckets.isEmpty() && cache.getPaginationState(conversationId).isHasMore()) {
            loadMoreHistory();
        }
    }

    /**
     * Sends {@code content} to the active peer.
     *
     * @return the client generated message id, or empty for blank content
     */
    public Optional<String> send(String content) {
        ensureOpen();
        String conversationId = requireActive();
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }

        ChatMessage message = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .senderId(selfId)
                .receiverId(activePeerId)
                .content(content.trim())
                .direction(MessageDirection.OUTGOING)
                .createdAt(eventLoop.clock().instant())
                .status(MessageStatus.PENDING)
                .build();

        log.debug("Sending message {} to user {}", message.getId(), activePeerId);
        if (!cache.addMessage(conversationId, message)) {
            log.error("Failed to add message to cache");
            return Optional.empty();
        }
        transmit(conversationId, message);
        return Optional.of(message.getId());
    }

    /**
     * Sends a failed message of the active conversation again with the same id.
     *
     * @return {@code false} if no failed message has this id
     */
    public boolean retry(String messageId) {
        ensureOpen();
        String conversationId = requireActive();
        ChatMessage failed = null;
        for (ChatMessage candidate : cache.getAllMessages(conversationId).getFailed()) {
            if (candidate.getId().equals(messageId)) {
                failed = candidate;
                break;
            }
        }
        if (failed == null) {
            log.warn("Failed message not found: {}", messageId);
            return false;
        }

        log.debug("Retrying failed message {}", messageId);
        cache.updateMessageStatus(conversationId, messageId, MessageStatus.PENDING, MessagePatch.EMPTY);
        return transmit(conversationId, failed);
    }

    /**
     * Requests the next older page of the active conversation.
     *
     * @return {@code false} if a page is already loading, there is nothing more, or the request could not be sent
     */
    public boolean loadMoreHistory() {
        ensureOpen();
        String conversationId = activeConversationId;
        if (conversationId == null) {
            return false;
        }
        PaginationState pagination = cache.getPaginationState(conversationId);
        if (pagination.isLoading() || !pagination.isHasMore()) {
            return false;
        }

        LoadToken token = new LoadToken(conversationId);
        historyToken = token;
        cache.setHistoryLoadingState(conversationId, true);
        try {
            connection.sendMessage(ChatHistoryRequest.builder()
                    .conversationId(conversationId)
                    .messageId(pagination.getNextCursor())
                    .build());
        } catch (TransportException e) {
            log.warn("Failed to request history of {}: {}", conversationId, e.getMessage());
            historyToken = null;
            cache.setHistoryLoadingState(conversationId, false);
            return false;
        }
        historyTimer = eventLoop.schedule(() -> {
            if (historyToken == token) {
                log.warn("No history page received for {}", conversationId);
                abortHistoryLoad();
            }
        }, historyTimeout);
        return true;
    }

    public void markAsRead() {
        if (activeConversationId != null) {
            cache.markChatAsRead(activeConversationId);
        }
    }

    public void clearFromMemory() {
        if (activeConversationId != null) {
            cache.clearChatMemory(activeConversationId);
        }
    }

    public SessionSnapshot snapshot() {
        String conversationId = activeConversationId;
        if (conversationId == null) {
            return SessionSnapshot.EMPTY;
        }
        MessageBuckets buckets = cache.getAllMessages(conversationId);
        PaginationState pagination = cache.getPaginationState(conversationId);
        return SessionSnapshot.builder()
                .conversationId(conversationId)
                .peerId(activePeerId)
                .confirmed(buckets.getConfirmed())
                .pending(buckets.getPending())
                .failed(buckets.getFailed())
                .all(buckets.merged())
                .loading(loading)
                .error(error)
                .hasMore(pagination.isHasMore())
                .loadingHistory(pagination.isLoading())
                .build();
    }

    public String getActiveConversationId() {
        return activeConversationId;
    }

    public String getSelfId() {
        return selfId;
    }

    /**
     * Stops listening, aborts the page load and cancels every delivery timer.
     * Messages still waiting for an ack stay pending.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        abortHistoryLoad();
        readTimer.cancel();
        deliveryTracker.cancelAll();
        frameSubscription.cancel();
        cacheSubscription.run();
        listeners.clear();
        log.debug("Conversation session of {} closed", selfId);
    }

    boolean isAwaitingAck(String messageId) {
        return deliveryTracker.isTracking(messageId);
    }

    private boolean transmit(String conversationId, ChatMessage message) {
        DirectMessage frame = DirectMessage.builder()
                .from(message.getSenderId())
                .to(message.getReceiverId())
                .content(message.getContent())
                .messageId(message.getId())
                .build();
        try {
            connection.sendMessage(frame);
        } catch (TransportException e) {
            log.error("WebSocket send error for message {}: {}", message.getId(), e.getMessage());
            deliveryTracker.resolve(message.getId());
            cache.updateMessageStatus(conversationId, message.getId(), MessageStatus.FAILED, MessagePatch.EMPTY);
            return false;
        }
        deliveryTracker.arm(conversationId, message.getId(), () ->
                cache.updateMessageStatus(conversationId, message.getId(), MessageStatus.FAILED, MessagePatch.EMPTY));
        return true;
    }

    private void onFrame(InboundFrame frame) {
        if (!closed) {
            frame.accept(dispatcher);
        }
    }

    private void onConversationChanged(String conversationId) {
        if (!closed && conversationId.equals(activeConversationId)) {
            publish();
        }
    }

    private void publish() {
        if (listeners.isEmpty()) {
            return;
        }
        SessionSnapshot snapshot = snapshot();
        for (SessionListener listener : listeners) {
            try {
                listener.onSnapshot(snapshot);
            } catch (Exception e) {
                log.error("Error in session listener", e);
            }
        }
    }

    private void scheduleMarkAsRead() {
        readTimer.cancel();
        String conversationId = activeConversationId;
        readTimer = eventLoop.schedule(() -> {
            if (conversationId.equals(activeConversationId)) {
                cache.markChatAsRead(conversationId);
            }
        }, readDebounce);
    }

    private void abortHistoryLoad() {
        historyTimer.cancel();
        LoadToken token = historyToken;
        if (token != null) {
            token.abort();
            historyToken = null;
            cache.setHistoryLoadingState(token.getConversationId(), false);
        }
    }

    private String requireActive() {
        if (activeConversationId == null) {
            throw new IllegalStateException("No active conversation");
        }
        return activeConversationId;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Conversation session is closed");
        }
    }

    private ChatMessage toChatMessage(DirectMessage dm) {
        boolean incoming = !selfId.equals(dm.getFrom());
        Instant createdAt = dm.getTimestamp() != null ? dm.getTimestamp() : eventLoop.clock().instant();
        return ChatMessage.builder()
                .id(dm.getMessageId())
                .senderId(dm.getFrom())
                .receiverId(dm.getTo())
                .content(dm.getContent())
                .direction(incoming ? MessageDirection.INCOMING : MessageDirection.OUTGOING)
                .createdAt(createdAt)
                .status(MessageStatus.SENT)
                .build();
    }

    /**
     * Conversation of a direct message involving this user, or {@code null} for anything else.
     */
    private String conversationOf(DirectMessage dm) {
        if (dm.getMessageId() == null || dm.getFrom() == null || dm.getTo() == null) {
            return null;
        }
        if (!selfId.equals(dm.getFrom()) && !selfId.equals(dm.getTo())) {
            return null;
        }
        String otherId = selfId.equals(dm.getFrom()) ? dm.getTo() : dm.getFrom();
        return ConversationIds.canonical(selfId, otherId);
    }

    private class FrameDispatcher implements FrameVisitor<Void> {

        @Override
        public Void visitDirectMessage(DirectMessage dm) {
            String conversationId = conversationOf(dm);
            if (conversationId == null) {
                log.debug("Ignoring direct message not addressed to {}", selfId);
                return null;
            }
            ChatMessage message = toChatMessage(dm);
            cache.addMessage(conversationId, message);
            if (message.isIncoming() && conversationId.equals(activeConversationId)) {
                scheduleMarkAsRead();
            }
            return null;
        }

        @Override
        public Void visitChatHistory(ChatHistory history) {
            LoadToken token = historyToken;
            if (token == null) {
                log.debug("Dropping history page nobody asked for");
                return null;
            }
            historyToken = null;
            historyTimer.cancel();
            String conversationId = token.getConversationId();
            try {
                applyHistoryPage(token, history);
            } finally {
                cache.setHistoryLoadingState(conversationId, false);
            }
            return null;
        }

        private void applyHistoryPage(LoadToken token, ChatHistory history) {
            String conversationId = token.getConversationId();
            List<DirectMessage> received = history.getMessages() == null ? List.of() : history.getMessages();

            List<ChatMessage> page = new ArrayList<>();
            for (DirectMessage dm : received) {
                if (dm == null) {
                    continue;
                }
                if (!conversationId.equals(conversationOf(dm))) {
                    log.debug("Dropping history page for {} holding a message of another conversation", conversationId);
                    return;
                }
                page.add(toChatMessage(dm));
            }

            if (token.isStaleFor(activeConversationId)) {
                log.debug("Dropping stale history page for {}", conversationId);
                return;
            }

            cache.addMessages(conversationId, page, true);
            cache.updatePaginationState(conversationId, history.isHasMore(), history.getNextCursor());
        }

        @Override
        public Void visitMessageAck(MessageAck ack) {
            String messageId = ack.getMessageId();
            if (messageId == null) {
                return null;
            }
            String conversationId = deliveryTracker.resolve(messageId);
            if (conversationId == null) {
                conversationId = activeConversationId;
            }
            if (conversationId == null) {
                return null;
            }
            if (!MessageAck.STATUS_PERSISTED.equals(ack.getStatus())) {
                log.debug("Ack for {} has status {}, treating it as delivered", messageId, ack.getStatus());
            }
            MessagePatch patch = ack.getStatus() == null
                    ? MessagePatch.EMPTY
                    : MessagePatch.builder().attribute(ATTRIBUTE_ACK_STATUS, ack.getStatus()).build();
            if (!cache.updateMessageStatus(conversationId, messageId, MessageStatus.SENT, patch)) {
                log.debug("Ack for {} matched no pending message", messageId);
            }
            return null;
        }
    }

    @Override
    public String toString() {
        return "ConversationSession{self=" + selfId + ", active=" + Objects.toString(activeConversationId, "none") + "}";
    }
}
