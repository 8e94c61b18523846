package ucdsafety;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detection and correction of intentionally confusable characters (UTS #39 intentional.txt).
 * Lookups are direct key membership; the confusables list is a finite set of code points, not ranges.
 */
public class Confusables {

    private final Map<Integer, Confusable> confusables;

    public Confusables(UnicodeTables tables) {
        this.confusables = Objects.requireNonNull(tables, "tables").confusables();
    }

    public boolean isConfusable(int cp) {
        return confusables.containsKey(cp);
    }

    /**
     * True if any character of {@code s} is on the intentional confusables list.
     */
    public boolean isIntentionalConfusion(String s) {
        return s.codePoints().anyMatch(confusables::containsKey);
    }

    /**
     * Copy of {@code s} with each confusable character replaced by the character it impersonates.
     * Applying this to its own result changes nothing.
     */
    public String fixIntentionalConfusion(String s) {
        // Common case: nothing to replace
        if (!isIntentionalConfusion(s)) return s;

        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> {
            Confusable c = confusables.get(cp);
            sb.appendCodePoint(c == null ? cp : c.canonical());
        });
        return sb.toString();
    }

    /**
     * Every confusable character of {@code s}, in string order. Empty if there are none.
     */
    public List<ConfusableFinding> showIntentionalConfusion(String s) {
        List<ConfusableFinding> findings = new ArrayList<>();
        int index = 0;
        int charIndex = 0;
        int n = s.length();

        while (charIndex < n) {
            int cp = s.codePointAt(charIndex);
            Confusable c = confusables.get(cp);
            if (c != null) {
                findings.add(new ConfusableFinding(index, charIndex, cp, c.canonical(), c.confusingName(), c.canonicalName()));
            }
            charIndex += Character.charCount(cp);
            index++;
        }
        return Collections.unmodifiableList(findings);
    }
}
