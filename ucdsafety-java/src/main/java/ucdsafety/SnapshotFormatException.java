package ucdsafety;

import java.io.IOException;

/**
 * A table snapshot could be read but its content is not a valid set of tables.
 */
public class SnapshotFormatException extends IOException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
