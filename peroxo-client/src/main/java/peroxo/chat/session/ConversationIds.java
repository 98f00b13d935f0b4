package peroxo.chat.session;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;

/**
 * Derives the key both participants of a direct conversation agree on.
 */
public final class ConversationIds {
    private static final String SEPARATOR = "_";

    private ConversationIds() {
    }

    /**
     * Joins the two identities smaller first, e.g. {@code canonical("42", "7")} is {@code "7_42"}.
     * Identities made of digits compare numerically, anything else lexicographically.
     * A conversation with oneself is {@code "a_a"}.
     */
    public static String canonical(@NotNull String a, @NotNull String b) {
        if (a == null || a.isBlank() || b == null || b.isBlank()) {
            throw new IllegalArgumentException("Both participants are required");
        }
        return compare(a, b) <= 0 ? a + SEPARATOR + b : b + SEPARATOR + a;
    }

    static int compare(String a, String b) {
        if (isDigits(a) && isDigits(b)) {
            int byValue = new BigInteger(a).compareTo(new BigInteger(b));
            if (byValue != 0) {
                return byValue;
            }
        }
        return a.compareTo(b);
    }

    private static boolean isDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return !value.isEmpty();
    }
}
