package ucdsafety;

/**
 * One intentionally confusable character found in a string.
 *
 * @param index     position of the character counted in code points
 * @param charIndex position of the character counted in UTF-16 units, for use with {@link String#substring}
 */
public record ConfusableFinding(
    int index,
    int charIndex,
    int confusing,
    int canonical,
    String confusingName,
    String canonicalName) {

    public String confusingCharacter() {
        return Character.toString(confusing);
    }

    public String canonicalCharacter() {
        return Character.toString(canonical);
    }

    @Override
    public String toString() {
        return String.format("%d: %s %s (%s) ~ %s (%s)", index, CodePoints.format(confusing), confusingCharacter(),
            confusingName, canonicalCharacter(), canonicalName);
    }
}
