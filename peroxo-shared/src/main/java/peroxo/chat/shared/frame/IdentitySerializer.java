package peroxo.chat.shared.frame;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes purely numeric user identities as JSON numbers, anything else as a string.
 * The socket server keys users by integer id.
 */
public class IdentitySerializer extends StdSerializer<String> {

    public IdentitySerializer() {
        super(String.class);
    }

    @Override
    public void serialize(String value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (isNumeric(value)) {
            gen.writeNumber(Long.parseLong(value));
        } else {
            gen.writeString(value);
        }
    }

    static boolean isNumeric(String value) {
        if (value == null || value.isEmpty() || value.length() > 18) {
            return false;
        }
        // "007" must stay a string, otherwise the id changes on the wire
        if (value.length() > 1 && value.charAt(0) == '0') {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
