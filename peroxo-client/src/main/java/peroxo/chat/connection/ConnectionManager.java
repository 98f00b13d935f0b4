package peroxo.chat.connection;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import peroxo.chat.event.EventLoop;
import peroxo.chat.shared.frame.FrameCodec;
import peroxo.chat.shared.frame.InboundFrame;
import peroxo.chat.shared.frame.InvalidFrameException;
import peroxo.chat.shared.frame.OutboundFrame;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Owns the single socket of the signed-in user.
 * <p>
 * Opens it, reopens it with exponential backoff after abnormal closes, decodes inbound frames
 * and fans frames and state changes out to the registered handlers. Must be used from the event loop;
 * transport callbacks are posted back onto it.
 */
@Slf4j
public class ConnectionManager {
    public static final int NORMAL_CLOSURE = 1000;

    static final String ERROR_IDENTITY_REQUIRED = "User ID is required for connection";
    static final String ERROR_MAX_ATTEMPTS = "Maximum reconnection attempts reached";
    static final String ERROR_SOCKET = "WebSocket connection error";
    static final String ERROR_CREATE = "Failed to create WebSocket connection";

    private final Transport transport;
    private final FrameCodec codec;
    private final EventLoop eventLoop;
    private final String serverUrl;
    private final ReconnectScheduler reconnectScheduler;

    private final List<MessageHandler> messageHandlers = new CopyOnWriteArrayList<>();
    private final List<ConnectionHandler> connectionHandlers = new CopyOnWriteArrayList<>();

    private String identity;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private String lastError;
    private TransportConnection connection;
    // bumped whenever a socket is dropped so its late callbacks are ignored
    private long generation;
    private boolean manualDisconnect;

    public ConnectionManager(@NotNull Transport transport, @NotNull FrameCodec codec, @NotNull EventLoop eventLoop,
                             @NotNull String serverUrl, Duration reconnectBaseInterval, int maxReconnectAttempts) {
        this.transport = requireNonNull(transport, "transport");
        this.codec = requireNonNull(codec, "codec");
        this.eventLoop = requireNonNull(eventLoop, "eventLoop");
        this.serverUrl = requireNonNull(serverUrl, "serverUrl");
        this.reconnectScheduler = new ReconnectScheduler(eventLoop, reconnectBaseInterval, maxReconnectAttempts);
    }

    /**
     * Sets the signed-in user. A new identity connects right away; {@code null} drops the connection.
     */
    public void setIdentity(String newIdentity) {
        String normalized = newIdentity == null || newIdentity.isBlank() ? null : newIdentity.trim();
        if (Objects.equals(normalized, identity)) {
            return;
        }
        String previous = identity;
        identity = normalized;

        if (normalized == null) {
            log.info("Identity cleared, closing connection");
            teardown();
            reconnectScheduler.reset();
            setState(ConnectionState.DISCONNECTED);
            return;
        }
        if (previous != null || state != ConnectionState.DISCONNECTED) {
            // the socket is bound to the identity it was opened with
            reconnect();
        } else {
            connect();
        }
    }

    public void connect() {
        if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED) {
            log.debug("Connect ignored, connection is already {}", state);
            return;
        }
        if (identity == null) {
            lastError = ERROR_IDENTITY_REQUIRED;
            setState(ConnectionState.DISCONNECTED);
            return;
        }

        manualDisconnect = false;
        teardown();
        lastError = null;
        setState(ConnectionState.CONNECTING);

        long socketGeneration = ++generation;
        try {
            connection = transport.open(socketUri(), new SocketListener(socketGeneration));
        } catch (RuntimeException e) {
            log.error("Failed to create WebSocket connection", e);
            connection = null;
            generation++;
            lastError = ERROR_CREATE;
            scheduleReconnect();
            setState(ConnectionState.ERROR);
        }
    }

    public void disconnect() {
        manualDisconnect = true;
        teardown();
        reconnectScheduler.reset();
        setState(ConnectionState.DISCONNECTED);
    }

    /**
     * Drops any socket and connects again immediately, with a fresh attempt counter.
     */
    public void reconnect() {
        manualDisconnect = false;
        teardown();
        reconnectScheduler.reset();
        setState(ConnectionState.DISCONNECTED);
        connect();
    }

    public void networkOnline() {
        if (state == ConnectionState.DISCONNECTED && identity != null) {
            log.info("Network is back, reconnecting");
            reconnect();
        }
    }

    public void networkOffline() {
        log.info("Network went offline");
        teardown();
        setState(ConnectionState.DISCONNECTED);
    }

    public void visibilityChanged(boolean visible) {
        if (visible && state == ConnectionState.DISCONNECTED && identity != null) {
            reconnect();
        }
    }

    public void sendMessage(OutboundFrame frame) {
        sendMessage(codec.encode(frame));
    }

    /**
     * @throws TransportException if not connected; nothing is queued
     */
    public void sendMessage(String text) {
        if (state != ConnectionState.CONNECTED || connection == null) {
            throw new TransportException("WebSocket is not connected");
        }
        connection.send(text);
    }

    public Subscription addMessageHandler(MessageHandler handler) {
        messageHandlers.add(handler);
        return () -> messageHandlers.remove(handler);
    }

    public Subscription addConnectionHandler(ConnectionHandler handler) {
        connectionHandlers.add(handler);
        return () -> connectionHandlers.remove(handler);
    }

    public ConnectionState getState() {
        return state;
    }

    public String getLastError() {
        return lastError;
    }

    public int getReconnectAttempts() {
        return reconnectScheduler.getAttempts();
    }

    public String getIdentity() {
        return identity;
    }

    public boolean isReconnectScheduled() {
        return reconnectScheduler.isScheduled();
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public boolean isConnecting() {
        return state == ConnectionState.CONNECTING;
    }

    public boolean isDisconnected() {
        return state == ConnectionState.DISCONNECTED;
    }

    URI socketUri() {
        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        String token = URLEncoder.encode(identity, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(base + "/ws?token=" + token);
    }

    private void teardown() {
        reconnectScheduler.cancel();
        generation++;
        TransportConnection current = connection;
        connection = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Error closing WebSocket: {}", e.getMessage());
            }
        }
    }

    private void handleOpen() {
        log.info("Connected to {}", serverUrl);
        reconnectScheduler.reset();
        lastError = null;
        setState(ConnectionState.CONNECTED);
    }

    private void handleText(String text) {
        InboundFrame frame;
        try {
            frame = codec.decode(text);
        } catch (InvalidFrameException e) {
            log.warn("Dropping invalid frame: {}", e.getMessage());
            return;
        }
        log.debug("Received {} frame", frame.tag());
        for (MessageHandler handler : messageHandlers) {
            try {
                handler.onFrame(frame);
            } catch (Exception e) {
                log.error("Error in message handler", e);
            }
        }
    }

    private void handleError(Throwable error) {
        log.warn("WebSocket error: {}", error == null ? "unknown" : error.getMessage());
        lastError = ERROR_SOCKET;
        setState(ConnectionState.ERROR);
    }

    private void handleClose(int code, String reason) {
        connection = null;
        generation++;
        log.info("WebSocket closed: code={}, reason={}", code, reason);
        setState(ConnectionState.DISCONNECTED, code, reason);

        if (manualDisconnect || code == NORMAL_CLOSURE || identity == null) {
            return;
        }
        if (!scheduleReconnect()) {
            setState(ConnectionState.ERROR);
        }
    }

    /**
     * @return {@code false} if the attempt cap is reached; {@link #lastError} says so then
     */
    private boolean scheduleReconnect() {
        if (reconnectScheduler.scheduleNext(this::reconnectAfterBackoff)) {
            return true;
        }
        log.warn("Giving up after {} reconnection attempts", reconnectScheduler.getMaxAttempts());
        lastError = ERROR_MAX_ATTEMPTS;
        return false;
    }

    private void reconnectAfterBackoff() {
        if (connection == null && !manualDisconnect) {
            connect();
        }
    }

    private void setState(ConnectionState newState) {
        setState(newState, null, null);
    }

    private void setState(ConnectionState newState, Integer closeCode, String reason) {
        if (state == newState && closeCode == null) {
            return;
        }
        state = newState;
        ConnectionEvent event = ConnectionEvent.builder()
                .state(newState)
                .closeCode(closeCode)
                .reason(reason)
                .error(lastError)
                .reconnectAttempts(reconnectScheduler.getAttempts())
                .build();
        for (ConnectionHandler handler : connectionHandlers) {
            try {
                handler.onConnectionChanged(event);
            } catch (Exception e) {
                log.error("Error in connection handler", e);
            }
        }
    }

    private class SocketListener implements TransportListener {
        private final long socketGeneration;

        SocketListener(long socketGeneration) {
            this.socketGeneration = socketGeneration;
        }

        @Override
        public void onOpen() {
            post(ConnectionManager.this::handleOpen);
        }

        @Override
        public void onText(String text) {
            post(() -> handleText(text));
        }

        @Override
        public void onError(Throwable error) {
            post(() -> handleError(error));
        }

        @Override
        public void onClose(int code, String reason) {
            post(() -> handleClose(code, reason));
        }

        private void post(Runnable callback) {
            eventLoop.execute(() -> {
                if (socketGeneration != generation) {
                    log.debug("Ignoring callback from a replaced socket");
                    return;
                }
                callback.run();
            });
        }
    }
}
