package ucdsafety;

import java.util.Locale;

/**
 * Kind of unassigned range, named after the UCD XML element that lists it.
 */
public enum ReservedType {
    RESERVED,
    SURROGATE,
    NONCHARACTER;

    public static ReservedType fromName(String name) {
        for (ReservedType t : values()) {
            if (t.xmlName().equalsIgnoreCase(name)) return t;
        }
        throw new IllegalArgumentException("Unknown reserved type: " + name);
    }

    public String xmlName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
