package ucdsafety;

import java.util.Objects;

/**
 * One IdentifierStatus.txt line: a code point range and its status.
 */
public record IdentifierStatusRange(int first, int last, IdentifierStatus status) implements Ranged {

    public IdentifierStatusRange {
        Objects.requireNonNull(status, "status");
        CodePoints.checkRange(first, last);
    }
}
