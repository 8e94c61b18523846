package ucdsafety;

/**
 * Thrown when a code point has no entry in a table that is required to contain it.
 */
public class UnknownCodePointException extends RuntimeException {

    private final int codePoint;
    private final String table;

    public UnknownCodePointException(String table, int codePoint) {
        super(CodePoints.format(codePoint) + " not found in " + table + " table");
        this.codePoint = codePoint;
        this.table = table;
    }

    public int getCodePoint() {
        return codePoint;
    }

    public String getTable() {
        return table;
    }
}
