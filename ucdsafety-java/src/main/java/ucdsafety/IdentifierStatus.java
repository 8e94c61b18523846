package ucdsafety;

/**
 * UTS #39 Identifier_Status value.
 */
public enum IdentifierStatus {
    ALLOWED("Allowed"),
    RESTRICTED("Restricted");

    private final String fileName;

    IdentifierStatus(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Value as written in IdentifierStatus.txt.
     */
    public String fileName() {
        return fileName;
    }

    public static IdentifierStatus fromFileName(String name) {
        for (IdentifierStatus s : values()) {
            if (s.fileName().equals(name)) return s;
        }
        throw new IllegalArgumentException("Unknown identifier status: " + name);
    }
}
