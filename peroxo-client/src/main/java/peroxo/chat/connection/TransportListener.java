package peroxo.chat.connection;

/**
 * Socket callbacks. They may arrive on any thread.
 */
public interface TransportListener {

    void onOpen();

    void onText(String text);

    void onError(Throwable error);

    void onClose(int code, String reason);
}
