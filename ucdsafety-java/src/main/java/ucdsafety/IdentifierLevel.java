package ucdsafety;

import java.util.Locale;

/**
 * Policy levels for {@link SafetyPolicy#isSafeIdentifier}.
 */
public enum IdentifierLevel {
    /** Every character is ASCII. */
    ASCII,
    /** First character is XID_Start, the rest XID_Continue. */
    PROGRAMMING,
    /** Every character has Identifier_Status Allowed (UTS #39 section 3.1). */
    IDMOD;

    /**
     * Level by its lower-case name ({@code ascii}, {@code programming}, {@code idmod}).
     *
     * @throws IllegalArgumentException for any other name
     */
    public static IdentifierLevel fromName(String name) {
        for (IdentifierLevel level : values()) {
            if (level.levelName().equals(name)) return level;
        }
        throw new IllegalArgumentException("Unsupported identifier level: " + name);
    }

    public String levelName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
