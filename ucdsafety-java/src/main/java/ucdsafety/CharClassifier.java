package ucdsafety;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PrimitiveIterator;
import java.util.Set;

/**
 * Per-character classification against the Unicode tables: block membership, reservedness,
 * identifier status and type, and the string-level ASCII / Latin / allowed folds built on them.
 * Stateless apart from the shared read-only tables.
 */
public class CharClassifier {

    private final UnicodeTables tables;
    private final Map<Integer, CharInfo> repertoire;

    public CharClassifier(UnicodeTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.repertoire = tables.repertoire();
    }

    // ---------------------------------------------------------------------
    // Repertoire and blocks
    // ---------------------------------------------------------------------

    /**
     * Repertoire entry stored under exactly this code point.
     */
    public Optional<CharInfo> charInfo(int cp) {
        return Optional.ofNullable(repertoire.get(CodePoints.checkValid(cp)));
    }

    /**
     * True if every code point of {@code s} lies in the block with the given alias.
     *
     * @throws IllegalArgumentException if no block has that alias
     */
    public boolean inBlock(String s, String blockAlias) {
        Block block = tables.blocks().get(blockAlias);
        if (block == null) {
            throw new IllegalArgumentException("Unknown block: " + blockAlias);
        }
        return s.codePoints().allMatch(block::contains);
    }

    /**
     * Block aliases of the characters of {@code s}, taken from their repertoire entries, in order of first occurrence.
     *
     * @throws UnknownCodePointException if a code point has no repertoire entry
     */
    public Set<String> blocks(String s) {
        Set<String> result = new LinkedHashSet<>();
        PrimitiveIterator.OfInt it = s.codePoints().iterator();
        while (it.hasNext()) {
            int cp = it.nextInt();
            CharInfo info = repertoire.get(cp);
            if (info == null) {
                throw new UnknownCodePointException("repertoire", cp);
            }
            result.add(info.block());
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Block whose range contains {@code cp}, found in the block table rather than the repertoire.
     */
    public Optional<Block> blockOf(int cp) {
        return Optional.ofNullable(tables.blockRanges().find(CodePoints.checkValid(cp)));
    }

    // ---------------------------------------------------------------------
    // Reserved ranges
    // ---------------------------------------------------------------------

    /**
     * True if every code point of {@code s} is reserved, a surrogate or a noncharacter.
     */
    public boolean inReserved(String s) {
        IntervalTable<ReservedRange> reserved = tables.reserved();
        return s.codePoints().allMatch(reserved::covers);
    }

    public Optional<ReservedRange> reservedRange(int cp) {
        return Optional.ofNullable(tables.reserved().find(CodePoints.checkValid(cp)));
    }

    // ---------------------------------------------------------------------
    // Identifier status and type (UTS #39)
    // ---------------------------------------------------------------------

    /**
     * True if {@code cp} falls inside some IdentifierStatus range.
     */
    public boolean inIdentifierRange(int cp) {
        return tables.identifierStatus().covers(CodePoints.checkValid(cp));
    }

    /**
     * True if {@code cp} falls inside an IdentifierStatus range whose status is Allowed.
     * A Restricted range covers the code point but does not allow it.
     */
    public boolean isIdentifierAllowed(int cp) {
        IdentifierStatusRange range = tables.identifierStatus().find(CodePoints.checkValid(cp));
        return range != null && range.status() == IdentifierStatus.ALLOWED;
    }

    public Optional<IdentifierStatus> getIdentifierStatus(int cp) {
        IdentifierStatusRange range = tables.identifierStatus().find(CodePoints.checkValid(cp));
        return range == null ? Optional.empty() : Optional.of(range.status());
    }

    /**
     * IdentifierType range covering {@code cp}, or empty if the code point has no listed type.
     */
    public Optional<IdentifierTypeRange> getIdentifierType(int cp) {
        return Optional.ofNullable(tables.identifierTypes().find(CodePoints.checkValid(cp)));
    }

    // ---------------------------------------------------------------------
    // String folds
    // ---------------------------------------------------------------------

    public boolean allAscii(String s) {
        return allAscii(s, AllowList.NONE);
    }

    /**
     * True if every code point is ASCII or allow-listed.
     */
    public boolean allAscii(String s, AllowList allowList) {
        AllowList allowed = AllowList.orNone(allowList);
        return s.codePoints().allMatch(cp -> CodePoints.isAscii(cp) || allowed.contains(cp));
    }

    public boolean allLatin(String s) {
        return allLatin(s, AllowList.NONE);
    }

    /**
     * True if every code point that is not allow-listed has a repertoire entry in the ASCII block or a Latin block.
     * A code point missing from the repertoire makes the string non-Latin.
     */
    public boolean allLatin(String s, AllowList allowList) {
        AllowList allowed = AllowList.orNone(allowList);
        PrimitiveIterator.OfInt it = s.codePoints().iterator();
        while (it.hasNext()) {
            int cp = it.nextInt();
            if (allowed.contains(cp)) continue;

            CharInfo info = repertoire.get(cp);
            if (info == null || !CodePoints.isLatinBlockAlias(info.block())) {
                return false;
            }
        }
        return true;
    }

    public boolean allAllowed(String s) {
        return allAllowed(s, AllowList.NONE);
    }

    /**
     * True if every code point that is not allow-listed has an identifier type with the allowed flag set.
     */
    public boolean allAllowed(String s, AllowList allowList) {
        AllowList allowed = AllowList.orNone(allowList);
        IntervalTable<IdentifierTypeRange> types = tables.identifierTypes();
        PrimitiveIterator.OfInt it = s.codePoints().iterator();
        while (it.hasNext()) {
            int cp = it.nextInt();
            if (allowed.contains(cp)) continue;

            IdentifierTypeRange type = types.find(cp);
            if (type == null || !type.isAllowed()) {
                return false;
            }
        }
        return true;
    }
}
