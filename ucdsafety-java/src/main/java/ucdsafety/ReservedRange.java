package ucdsafety;

import java.util.Objects;

/**
 * Reserved, surrogate or noncharacter code point range.
 */
public record ReservedRange(ReservedType type, int first, int last) implements Ranged {

    public ReservedRange {
        Objects.requireNonNull(type, "type");
        CodePoints.checkRange(first, last);
    }
}
