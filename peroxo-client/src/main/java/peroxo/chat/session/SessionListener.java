package peroxo.chat.session;

@FunctionalInterface
public interface SessionListener {

    void onSnapshot(SessionSnapshot snapshot);
}
