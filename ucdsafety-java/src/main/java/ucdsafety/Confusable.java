package ucdsafety;

import java.util.Objects;

/**
 * Intentionally confusable character and the character it impersonates.
 */
public record Confusable(int confusing, int canonical, String confusingName, String canonicalName) {

    public Confusable {
        CodePoints.checkValid(confusing);
        CodePoints.checkValid(canonical);
        Objects.requireNonNull(confusingName, "confusingName");
        Objects.requireNonNull(canonicalName, "canonicalName");
        if (confusing == canonical) {
            throw new IllegalArgumentException(CodePoints.format(confusing) + " is mapped to itself");
        }
    }
}
