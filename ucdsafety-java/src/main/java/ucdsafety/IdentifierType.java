package ucdsafety;

/**
 * The twelve UTS #39 Identifier_Type flags. {@link #ALLOWED} is not a value of the data file; it is derived
 * as {@link #INCLUSION} or {@link #RECOMMENDED}.
 */
public enum IdentifierType {
    ALLOWED("Allowed"),
    DEPRECATED("Deprecated"),
    TECHNICAL("Technical"),
    OBSOLETE("Obsolete"),
    INCLUSION("Inclusion"),
    EXCLUSION("Exclusion"),
    LIMITED_USE("Limited_Use"),
    UNCOMMON_USE("Uncommon_Use"),
    NOT_NFKC("Not_NFKC"),
    NOT_XID("Not_XID"),
    RECOMMENDED("Recommended"),
    DEFAULT_IGNORABLE("Default_Ignorable");

    private final String fileName;

    IdentifierType(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Value as written in IdentifierType.txt.
     */
    public String fileName() {
        return fileName;
    }

    public static IdentifierType fromFileName(String name) {
        for (IdentifierType t : values()) {
            if (t.fileName().equals(name)) return t;
        }
        throw new IllegalArgumentException("Unknown identifier type: " + name);
    }
}
