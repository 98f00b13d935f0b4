package peroxo.chat;

import lombok.extern.slf4j.Slf4j;
import peroxo.chat.cache.CacheOptions;
import peroxo.chat.cache.CacheStats;
import peroxo.chat.cache.MessageCache;
import peroxo.chat.cache.store.CacheStorage;
import peroxo.chat.cache.store.InMemoryKeyValueStore;
import peroxo.chat.cache.store.KeyValueStore;
import peroxo.chat.cache.store.SqliteKeyValueStore;
import peroxo.chat.cache.store.StorageException;
import peroxo.chat.config.ClientConfig;
import peroxo.chat.connection.ConnectionHandler;
import peroxo.chat.connection.ConnectionManager;
import peroxo.chat.connection.SpringWebSocketTransport;
import peroxo.chat.connection.Subscription;
import peroxo.chat.connection.Transport;
import peroxo.chat.event.EventLoop;
import peroxo.chat.event.ExecutorEventLoop;
import peroxo.chat.session.ConversationSession;
import peroxo.chat.session.SessionListener;
import peroxo.chat.session.SessionSnapshot;
import peroxo.chat.shared.frame.FrameCodec;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Application context of the messaging client.
 * <p>
 * Builds the connection, the per-user cache and the conversation session, and runs every call on the
 * event loop. Methods may be called from any thread; results are delivered through futures.
 */
@Slf4j
public class ChatClient implements AutoCloseable {
    static final String STORE_MEMORY = "memory";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ClientConfig config;
    private final EventLoop eventLoop;
    private final FrameCodec codec;
    private final ConnectionManager connection;
    private final List<SessionListener> sessionListeners = new CopyOnWriteArrayList<>();

    private KeyValueStore store;
    private MessageCache cache;
    private ConversationSession session;

    public ChatClient(ClientConfig config) {
        this(config, new ExecutorEventLoop(), new SpringWebSocketTransport());
    }

    public ChatClient(ClientConfig config, EventLoop eventLoop, Transport transport) {
        this.config = config;
        this.eventLoop = eventLoop;
        this.codec = new FrameCodec();
        this.connection = new ConnectionManager(transport, codec, eventLoop, config.getSocketUrl(),
                config.getReconnectBaseInterval(), config.getMaxReconnectAttempts());
    }

    /**
     * Opens the user's message cache and connects as {@code userId}. Signs out a previous user first.
     */
    public CompletableFuture<Void> signIn(String userId) {
        return run(() -> {
            if (userId == null || userId.isBlank()) {
                throw new IllegalArgumentException("User ID is required to sign in");
            }
            if (session != null && session.getSelfId().equals(userId)) {
                return;
            }
            closeUserScope();

            store = openStore(userId);
            try {
                cache = new MessageCache(new CacheStorage(store, FrameCodec.defaultObjectMapper()), eventLoop, cacheOptions());
                session = new ConversationSession(userId, connection, cache, eventLoop,
                        config.getDeliveryTimeout(), config.getReadDebounce());
            } catch (RuntimeException e) {
                log.error("Failed to open the message cache of {}", userId, e);
                cache = null;
                store.close();
                store = null;
                throw e;
            }
            session.addListener(this::forwardSnapshot);
            log.info("Signed in as {}", userId);
            connection.setIdentity(userId);
        });
    }

    public CompletableFuture<Void> signOut() {
        return run(() -> {
            connection.setIdentity(null);
            closeUserScope();
        });
    }

    public CompletableFuture<Void> openConversation(String peerId) {
        return run(() -> requireSession().switchTo(peerId));
    }

    public CompletableFuture<Optional<String>> send(String content) {
        return call(() -> requireSession().send(content));
    }

    public CompletableFuture<Boolean> retry(String messageId) {
        return call(() -> requireSession().retry(messageId));
    }

    public CompletableFuture<Boolean> loadMoreHistory() {
        return call(() -> requireSession().loadMoreHistory());
    }

    public CompletableFuture<Void> markAsRead() {
        return run(() -> requireSession().markAsRead());
    }

    public CompletableFuture<SessionSnapshot> snapshot() {
        return call(() -> session == null ? SessionSnapshot.EMPTY : session.snapshot());
    }

    public CompletableFuture<CacheStats> stats() {
        return call(() -> requireCache().getStats());
    }

    public CompletableFuture<Void> cleanup() {
        return run(() -> requireCache().cleanup());
    }

    public CompletableFuture<Void> clearCache() {
        return run(() -> requireCache().clearAll());
    }

    public CompletableFuture<Void> reconnect() {
        return run(connection::reconnect);
    }

    public CompletableFuture<Void> disconnect() {
        return run(connection::disconnect);
    }

    public CompletableFuture<Void> networkOnline() {
        return run(connection::networkOnline);
    }

    public CompletableFuture<Void> networkOffline() {
        return run(connection::networkOffline);
    }

    public CompletableFuture<Void> visibilityChanged(boolean visible) {
        return run(() -> connection.visibilityChanged(visible));
    }

    /**
     * Registers a listener for snapshots of the active conversation, kept across sign-ins.
     * Snapshots are delivered on the event loop.
     */
    public Subscription addSessionListener(SessionListener listener) {
        sessionListeners.add(listener);
        return () -> sessionListeners.remove(listener);
    }

    public CompletableFuture<Subscription> addConnectionHandler(ConnectionHandler handler) {
        return call(() -> connection.addConnectionHandler(handler));
    }

    ConnectionManager connection() {
        return connection;
    }

    @Override
    public void close() {
        CompletableFuture<Void> shutdown = run(() -> {
            connection.disconnect();
            closeUserScope();
        });
        try {
            shutdown.get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.error("Error while shutting down chat client", e);
        }
        if (eventLoop instanceof AutoCloseable) {
            try {
                ((AutoCloseable) eventLoop).close();
            } catch (Exception e) {
                log.warn("Error stopping event loop: {}", e.getMessage());
            }
        }
    }

    private KeyValueStore openStore(String userId) {
        if (STORE_MEMORY.equalsIgnoreCase(config.getStoreType())) {
            log.info("Using in-memory message cache store");
            return new InMemoryKeyValueStore();
        }
        try {
            return new SqliteKeyValueStore(SqliteKeyValueStore.databaseFileFor(config.getStorePath(), userId));
        } catch (StorageException e) {
            log.error("Cannot open cache database, falling back to memory only", e);
            return new InMemoryKeyValueStore();
        }
    }

    private CacheOptions cacheOptions() {
        return CacheOptions.builder()
                .maxMessagesPerChat(config.getMaxMessagesPerChat())
                .maxCachedChats(config.getMaxCachedChats())
                .maxStorageBytes(config.getMaxStorageBytes())
                .cleanupThreshold(config.getCleanupThreshold())
                .build();
    }

    private void forwardSnapshot(SessionSnapshot snapshot) {
        for (SessionListener listener : sessionListeners) {
            try {
                listener.onSnapshot(snapshot);
            } catch (Exception e) {
                log.error("Error in session listener", e);
            }
        }
    }

    private void closeUserScope() {
        if (session != null) {
            session.close();
            session = null;
        }
        if (cache != null) {
            cache.flush();
            cache = null;
        }
        if (store != null) {
            store.close();
            store = null;
        }
    }

    private ConversationSession requireSession() {
        if (session == null) {
            throw new IllegalStateException("Not signed in");
        }
        return session;
    }

    private MessageCache requireCache() {
        if (cache == null) {
            throw new IllegalStateException("Not signed in");
        }
        return cache;
    }

    private CompletableFuture<Void> run(Runnable action) {
        return call(() -> {
            action.run();
            return null;
        });
    }

    private <T> CompletableFuture<T> call(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        eventLoop.execute(() -> {
            try {
                result.complete(action.get());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }
}
