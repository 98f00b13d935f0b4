package peroxo.chat;

import lombok.extern.slf4j.Slf4j;
import peroxo.chat.config.ClientConfig;
import peroxo.chat.connection.ConnectionState;
import peroxo.chat.model.ChatMessage;
import peroxo.chat.session.SessionSnapshot;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Plain text front end.
 * <p>
 * Usage: {@code Main <userId>}, then {@code /chat <peerId>} to open a conversation and any other line to send it.
 */
@Slf4j
public class Main {
    private static final String HELP = String.join(System.lineSeparator(),
            "Commands:",
            "  /chat <peerId>   open the conversation with a user",
            "  /retry <id>      send a failed message again",
            "  /more            load older messages",
            "  /stats           show cache statistics",
            "  /reconnect       reconnect now",
            "  /quit            exit",
            "Any other line is sent to the open conversation.");

    private final ChatClient client;
    private final PrintStream out;
    // last status printed per message id
    private final Map<String, String> printed = new HashMap<>();
    private String renderedConversation;

    Main(ChatClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String userId = args.length > 0 ? args[0] : prompt(in, "User ID: ");
        if (userId == null || userId.isBlank()) {
            System.err.println("A user ID is required");
            return;
        }

        try (ChatClient client = new ChatClient(ClientConfig.load())) {
            Main console = new Main(client, System.out);
            console.start(userId.trim());
            console.readCommands(in);
        }
    }

    void start(String userId) {
        client.addSessionListener(this::render);
        client.addConnectionHandler(event -> {
            if (event.getState() == ConnectionState.CONNECTED) {
                out.println("* connected");
            } else if (event.getState() == ConnectionState.ERROR && event.getError() != null) {
                out.println("* " + event.getError());
            } else if (event.getState() == ConnectionState.DISCONNECTED && event.getCloseCode() != null) {
                out.println("* disconnected, reconnecting...");
            }
        });
        client.signIn(userId).join();
        out.println("Signed in as " + userId + ". Type /help for commands.");
    }

    void readCommands(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (!handle(line.trim())) {
                return;
            }
        }
    }

    /**
     * @return {@code false} when the user asked to quit
     */
    boolean handle(String line) {
        if (line.isEmpty()) {
            return true;
        }
        try {
            if (line.equals("/quit")) {
                return false;
            } else if (line.equals("/help")) {
                out.println(HELP);
            } else if (line.startsWith("/chat ")) {
                client.openConversation(line.substring("/chat ".length()).trim()).join();
            } else if (line.startsWith("/retry ")) {
                boolean retried = client.retry(line.substring("/retry ".length()).trim()).join();
                if (!retried) {
                    out.println("* no failed message with that id");
                }
            } else if (line.equals("/more")) {
                if (!client.loadMoreHistory().join()) {
                    out.println("* no older messages to load");
                }
            } else if (line.equals("/stats")) {
                out.println(client.stats().join());
            } else if (line.equals("/reconnect")) {
                client.reconnect().join();
            } else {
                send(line);
            }
        } catch (RuntimeException e) {
            log.debug("Command failed: {}", line, e);
            out.println("* " + rootMessage(e));
        }
        return true;
    }

    private void send(String content) {
        CompletableFuture<Optional<String>> sent = client.send(content);
        if (sent.join().isEmpty()) {
            out.println("* nothing sent");
        }
    }

    private void render(SessionSnapshot snapshot) {
        if (snapshot.getConversationId() == null) {
            return;
        }
        if (!snapshot.getConversationId().equals(renderedConversation)) {
            renderedConversation = snapshot.getConversationId();
            printed.clear();
            out.println("--- conversation with " + snapshot.getPeerId() + " ---");
        }
        for (ChatMessage message : snapshot.getAll()) {
            String status = message.getStatus().name();
            if (status.equals(printed.get(message.getId()))) {
                continue;
            }
            printed.put(message.getId(), status);
            String who = message.isIncoming() ? message.getSenderId() : "me";
            String marker = switch (message.getStatus()) {
                case PENDING -> " (sending)";
                case FAILED -> " (failed, /retry " + message.getId() + ")";
                case SENT -> "";
            };
            out.println("[" + message.getCreatedAt() + "] " + who + ": " + message.getContent() + marker);
        }
    }

    private static String prompt(BufferedReader in, String label) throws IOException {
        System.out.print(label);
        System.out.flush();
        return in.readLine();
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
