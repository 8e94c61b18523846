package ucdsafety;

import java.util.Objects;

/**
 * Repertoire entry: the UCD attributes kept for one character, or for a range of characters that share them
 * (CJK ideographs, Hangul syllables, private use). Range entries are keyed by their first code point only.
 *
 * @param block block alias as written in the UCD {@code blk} attribute, e.g. {@code Latin_1_Sup}
 */
public record CharInfo(
    String name,
    boolean isRange,
    int codePoint,
    int lastCodePoint,
    boolean alpha,
    boolean math,
    boolean nonChar,
    boolean deprecated,
    boolean xidStart,
    boolean xidContinue,
    String block) {

    public CharInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(block, "block");
        CodePoints.checkValid(codePoint);
        CodePoints.checkValid(lastCodePoint);
        if (!isRange && lastCodePoint != codePoint) {
            throw new IllegalArgumentException("Single character entry " + CodePoints.format(codePoint)
                + " has last code point " + CodePoints.format(lastCodePoint));
        }
        if (lastCodePoint < codePoint) {
            throw new IllegalArgumentException("Repertoire range " + CodePoints.format(codePoint)
                + " ends before it starts");
        }
    }
}
