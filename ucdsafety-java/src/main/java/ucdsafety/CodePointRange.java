package ucdsafety;

/**
 * Inclusive code point range. An absent end in the source data becomes a single-point range.
 */
public record CodePointRange(int first, int last) implements Ranged {

    public CodePointRange {
        CodePoints.checkRange(first, last);
    }

    public static CodePointRange single(int cp) {
        return new CodePointRange(cp, cp);
    }

    /**
     * Range from {@code first} to {@code last}, or a single point when {@code last} is null.
     */
    public static CodePointRange of(int first, Integer last) {
        return new CodePointRange(first, last == null ? first : last);
    }

    @Override
    public String toString() {
        return isSingle() ? CodePoints.format(first) : CodePoints.format(first) + ".." + CodePoints.format(last);
    }
}
