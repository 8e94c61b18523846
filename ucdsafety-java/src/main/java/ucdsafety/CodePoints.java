package ucdsafety;

/**
 * Code point constants and range checks shared by the classifiers.
 */
public final class CodePoints {

    private CodePoints() {} // Utility class

    public static final int MIN_CODE_POINT = 0x0000;
    public static final int MAX_CODE_POINT = 0x10FFFF;

    // Basic Latin (ASCII) range
    public static final int ASCII_START = 0x0000;
    public static final int ASCII_END = 0x007F;

    // Block alias of Basic Latin; all other Latin blocks have aliases starting with LATIN_ALIAS_PREFIX
    public static final String ASCII_BLOCK_ALIAS = "ASCII";
    public static final String LATIN_ALIAS_PREFIX = "Latin";

    /**
     * Check if codepoint is in the ASCII range (U+0000 - U+007F).
     */
    public static boolean isAscii(int cp) {
        return cp >= ASCII_START && cp <= ASCII_END;
    }

    /**
     * Check if a block alias names ASCII or one of the Latin blocks (Latin_1_Sup, Latin_Ext_A, ...).
     */
    public static boolean isLatinBlockAlias(String alias) {
        return ASCII_BLOCK_ALIAS.equals(alias) || alias.startsWith(LATIN_ALIAS_PREFIX);
    }

    /**
     * Check if value is a valid Unicode code point (U+0000 - U+10FFFF).
     */
    public static boolean isValid(int cp) {
        return cp >= MIN_CODE_POINT && cp <= MAX_CODE_POINT;
    }

    /**
     * Return the code point unchanged, or throw if it is outside U+0000 - U+10FFFF.
     */
    public static int checkValid(int cp) {
        if (!isValid(cp)) {
            throw new IllegalArgumentException("Not a Unicode code point: " + cp);
        }
        return cp;
    }

    /**
     * Check that {@code [first, last]} is a valid inclusive range of code points.
     */
    public static void checkRange(int first, int last) {
        checkValid(first);
        checkValid(last);
        if (last < first) {
            throw new IllegalArgumentException("Range end " + format(last) + " precedes start " + format(first));
        }
    }

    /**
     * Format as U+XXXX (at least four hex digits).
     */
    public static String format(int cp) {
        return String.format("U+%04X", cp);
    }

    /**
     * Parse a hex code point as written in the Unicode data files ("0041", "1F600").
     */
    public static int parseHex(String hex) {
        int cp = Integer.parseInt(hex.trim(), 16);
        return checkValid(cp);
    }
}
