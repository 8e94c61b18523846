package ucdsafety;

import java.util.Objects;

/**
 * A contiguous Unicode block.
 *
 * @param alias short property-value alias ({@code ASCII}, {@code Latin_1_Sup}); the key blocks are looked up by
 * @param name  long display name ({@code Basic Latin}, {@code Latin-1 Supplement})
 */
public record Block(String alias, String name, int first, int last) implements Ranged {

    public Block {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(name, "name");
        CodePoints.checkRange(first, last);
    }
}
