package peroxo.chat.connection;

/**
 * Handle of one socket opened by a {@link Transport}.
 */
public interface TransportConnection {

    /**
     * @throws TransportException if the socket is not open or the write fails
     */
    void send(String text);

    /**
     * Closes with the normal closure code. Closing an already closed socket does nothing.
     */
    void close();
}
