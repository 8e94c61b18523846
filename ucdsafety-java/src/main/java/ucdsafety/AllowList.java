package ucdsafety;

import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Extra code points a caller permits regardless of the policy level being checked.
 */
public final class AllowList {

    public static final AllowList NONE = new AllowList(new int[0]);

    // Sorted, distinct
    private final int[] codePoints;

    private AllowList(int[] codePoints) {
        this.codePoints = codePoints;
    }

    /**
     * Allow every code point of {@code chars}.
     */
    public static AllowList of(CharSequence chars) {
        return ofCodePoints(chars.codePoints().toArray());
    }

    /**
     * Allow each string's code points; convenient when the allowed characters come as a list.
     */
    public static AllowList of(Collection<String> chars) {
        return of(String.join("", chars));
    }

    public static AllowList ofCodePoints(int... cps) {
        if (cps.length == 0) return NONE;
        for (int cp : cps) {
            CodePoints.checkValid(cp);
        }
        return new AllowList(Arrays.stream(cps).sorted().distinct().toArray());
    }

    /**
     * Null-tolerant accessor used by the predicates: a missing allow list allows nothing extra.
     */
    static AllowList orNone(AllowList allowList) {
        return allowList == null ? NONE : allowList;
    }

    public boolean contains(int cp) {
        return Arrays.binarySearch(codePoints, cp) >= 0;
    }

    public boolean isEmpty() {
        return codePoints.length == 0;
    }

    public int size() {
        return codePoints.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AllowList && Arrays.equals(codePoints, ((AllowList) o).codePoints);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(codePoints);
    }

    @Override
    public String toString() {
        return Arrays.stream(codePoints).mapToObj(CodePoints::format).collect(Collectors.joining(", ", "AllowList[", "]"));
    }
}
