package peroxo.chat.connection;

@FunctionalInterface
public interface ConnectionHandler {

    void onConnectionChanged(ConnectionEvent event);
}
