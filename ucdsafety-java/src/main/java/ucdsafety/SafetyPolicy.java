package ucdsafety;

import java.util.Objects;
import java.util.PrimitiveIterator;

/**
 * String-level safety predicates composed from the per-character classifiers.
 * Based on the restriction levels of Unicode Security Mechanisms (UTS #39). Mixed-script, bidi and
 * whole-script confusable checks are not covered.
 */
public class SafetyPolicy {

    private final CharClassifier classifier;

    public SafetyPolicy(CharClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public boolean isSafeIdentifier(String s, IdentifierLevel level) {
        return isSafeIdentifier(s, level, AllowList.NONE);
    }

    /**
     * True if {@code s} is a safe identifier at the given level. Allow-listed characters always pass.
     *
     * @throws IllegalArgumentException if {@code s} is empty
     */
    public boolean isSafeIdentifier(String s, IdentifierLevel level, AllowList allowList) {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(level, "level");
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Empty identifier");
        }
        AllowList allowed = AllowList.orNone(allowList);

        return switch (level) {
            case ASCII -> classifier.allAscii(s, allowed);
            case PROGRAMMING -> isProgrammingIdentifier(s, allowed);
            case IDMOD -> s.codePoints().allMatch(cp -> allowed.contains(cp) || classifier.isIdentifierAllowed(cp));
        };
    }

    public boolean isSafeString(String s, StringLevel level) {
        return isSafeString(s, level, AllowList.NONE);
    }

    /**
     * True if every character of {@code s} passes the given level. The empty string passes every level.
     */
    public boolean isSafeString(String s, StringLevel level, AllowList allowList) {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(level, "level");
        AllowList allowed = AllowList.orNone(allowList);

        return switch (level) {
            case UNRESTRICTED -> true;
            case ASCII -> classifier.allAscii(s, allowed);
            case LATIN -> classifier.allLatin(s, allowed);
            case ALLOWED -> classifier.allAllowed(s, allowed);
        };
    }

    // XID_Start for the first code point, XID_Continue after it; unknown code points fail
    private boolean isProgrammingIdentifier(String s, AllowList allowed) {
        PrimitiveIterator.OfInt it = s.codePoints().iterator();
        boolean first = true;
        while (it.hasNext()) {
            int cp = it.nextInt();
            boolean start = first;
            first = false;
            if (allowed.contains(cp)) continue;

            CharInfo info = classifier.charInfo(cp).orElse(null);
            if (info == null) return false;
            if (start ? !info.xidStart() : !info.xidContinue()) return false;
        }
        return true;
    }
}
