package ucdsafety;

import java.util.Locale;

/**
 * Policy levels for {@link SafetyPolicy#isSafeString}.
 */
public enum StringLevel {
    /** Any character. */
    UNRESTRICTED,
    /** ASCII characters only. */
    ASCII,
    /** Characters of the ASCII and Latin blocks. */
    LATIN,
    /** Characters whose identifier type is allowed. */
    ALLOWED;

    /**
     * Level by its lower-case name ({@code unrestricted}, {@code ascii}, {@code latin}, {@code allowed}).
     *
     * @throws IllegalArgumentException for any other name
     */
    public static StringLevel fromName(String name) {
        for (StringLevel level : values()) {
            if (level.levelName().equals(name)) return level;
        }
        throw new IllegalArgumentException("Unrecognized string level: " + name);
    }

    public String levelName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
