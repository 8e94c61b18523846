package ucdsafety;

/**
 * An entry that covers the inclusive code point range {@code [first(), last()]}.
 * Single code point entries have {@code first() == last()}.
 */
public interface Ranged {

    int first();

    int last();

    default boolean contains(int cp) {
        return cp >= first() && cp <= last();
    }

    default boolean isSingle() {
        return first() == last();
    }
}
