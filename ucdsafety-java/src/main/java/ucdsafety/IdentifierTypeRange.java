package ucdsafety;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One IdentifierType.txt line: a code point range and its set of type flags.
 */
public record IdentifierTypeRange(int first, int last, Set<IdentifierType> types) implements Ranged {

    public IdentifierTypeRange {
        Objects.requireNonNull(types, "types");
        CodePoints.checkRange(first, last);
        types = types.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(IdentifierType.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(types));
    }

    public boolean has(IdentifierType type) {
        return types.contains(type);
    }

    public boolean isAllowed() {
        return types.contains(IdentifierType.ALLOWED);
    }
}
