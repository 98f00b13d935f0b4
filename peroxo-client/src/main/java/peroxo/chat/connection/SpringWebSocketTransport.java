package peroxo.chat.connection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over the Spring WebSocket client, carrying JSON frames as text messages.
 */
@Slf4j
public class SpringWebSocketTransport implements Transport {
    static final int ABNORMAL_CLOSURE = 1006;

    private final WebSocketClient client;

    public SpringWebSocketTransport() {
        this(new StandardWebSocketClient());
    }

    public SpringWebSocketTransport(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public TransportConnection open(URI uri, TransportListener listener) {
        SocketHandler handler = new SocketHandler(listener);
        log.debug("Opening WebSocket to {}", uri.getHost());
        client.execute(handler, new WebSocketHttpHeaders(), uri)
                .whenComplete((session, ex) -> {
                    if (ex != null) {
                        handler.connectFailed(ex);
                    }
                });
        return handler;
    }

    static class SocketHandler extends TextWebSocketHandler implements TransportConnection {
        private final TransportListener listener;
        private final AtomicBoolean closeReported = new AtomicBoolean();
        private volatile WebSocketSession session;
        private volatile boolean closeRequested;

        SocketHandler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) throws Exception {
            this.session = session;
            if (closeRequested) {
                session.close(CloseStatus.NORMAL);
                return;
            }
            listener.onOpen();
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onText(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            if (closeReported.compareAndSet(false, true)) {
                listener.onClose(status.getCode(), status.getReason());
            }
        }

        void connectFailed(Throwable cause) {
            listener.onError(cause);
            if (closeReported.compareAndSet(false, true)) {
                listener.onClose(ABNORMAL_CLOSURE, cause.getMessage());
            }
        }

        @Override
        public void send(String text) {
            WebSocketSession current = session;
            if (current == null || !current.isOpen()) {
                throw new TransportException("WebSocket is not connected");
            }
            try {
                synchronized (this) {
                    current.sendMessage(new TextMessage(text));
                }
            } catch (IOException e) {
                throw new TransportException("Failed to send frame", e);
            }
        }

        @Override
        public void close() {
            closeRequested = true;
            WebSocketSession current = session;
            if (current != null && current.isOpen()) {
                try {
                    current.close(CloseStatus.NORMAL);
                } catch (IOException e) {
                    log.warn("Error closing WebSocket: {}", e.getMessage());
                }
            }
        }
    }
}
