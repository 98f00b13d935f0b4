package peroxo.chat.connection;

import java.net.URI;

/**
 * Opens sockets. Opening is asynchronous: the returned handle exists immediately,
 * and the outcome is reported to the listener as {@code onOpen} or {@code onError} followed by {@code onClose}.
 */
public interface Transport {

    TransportConnection open(URI uri, TransportListener listener);
}
