package ucdsafety;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point: classifies code points and strings against one set of {@link UnicodeTables}.
 * Instances hold no mutable state and can be shared between threads.
 *
 * <pre>
 * UnicodeSafety safety = UnicodeSafety.load(Path.of("ucd_snapshot.json"));
 * safety.isSafeIdentifier("fa\u0441ebook", IdentifierLevel.ASCII);   // false, Cyrillic es
 * safety.fixIntentionalConfusion("fa\u0441ebook");                   // "facebook"
 * </pre>
 */
public class UnicodeSafety {

    private final UnicodeTables tables;
    private final CharClassifier classifier;
    private final Confusables confusables;
    private final SafetyPolicy policy;

    public UnicodeSafety(UnicodeTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.classifier = new CharClassifier(tables);
        this.confusables = new Confusables(tables);
        this.policy = new SafetyPolicy(classifier);
    }

    public static UnicodeSafety load(Path snapshot) throws IOException {
        return new UnicodeSafety(new SnapshotReader().read(snapshot));
    }

    public static UnicodeSafety loadResource(String resource) throws IOException {
        return new UnicodeSafety(new SnapshotReader().readResource(resource));
    }

    public UnicodeTables tables() {
        return tables;
    }

    // --- Confusables ---

    public boolean isIntentionalConfusion(String s) {
        return confusables.isIntentionalConfusion(s);
    }

    public String fixIntentionalConfusion(String s) {
        return confusables.fixIntentionalConfusion(s);
    }

    public List<ConfusableFinding> showIntentionalConfusion(String s) {
        return confusables.showIntentionalConfusion(s);
    }

    // --- Blocks and reserved ranges ---

    public boolean inBlock(String s, String blockAlias) {
        return classifier.inBlock(s, blockAlias);
    }

    public Set<String> blocks(String s) {
        return classifier.blocks(s);
    }

    public Optional<Block> blockOf(int cp) {
        return classifier.blockOf(cp);
    }

    public Optional<CharInfo> charInfo(int cp) {
        return classifier.charInfo(cp);
    }

    public boolean inReserved(String s) {
        return classifier.inReserved(s);
    }

    public Optional<ReservedRange> reservedRange(int cp) {
        return classifier.reservedRange(cp);
    }

    // --- Identifier status and type ---

    public boolean inIdentifierRange(int cp) {
        return classifier.inIdentifierRange(cp);
    }

    public boolean isIdentifierAllowed(int cp) {
        return classifier.isIdentifierAllowed(cp);
    }

    public Optional<IdentifierStatus> getIdentifierStatus(int cp) {
        return classifier.getIdentifierStatus(cp);
    }

    public Optional<IdentifierTypeRange> getIdentifierType(int cp) {
        return classifier.getIdentifierType(cp);
    }

    // --- Character class folds ---

    public boolean allAscii(String s, AllowList allowList) {
        return classifier.allAscii(s, allowList);
    }

    public boolean allLatin(String s, AllowList allowList) {
        return classifier.allLatin(s, allowList);
    }

    public boolean allAllowed(String s, AllowList allowList) {
        return classifier.allAllowed(s, allowList);
    }

    // --- Safety predicates ---

    public boolean isSafeIdentifier(String s, IdentifierLevel level) {
        return policy.isSafeIdentifier(s, level);
    }

    public boolean isSafeIdentifier(String s, IdentifierLevel level, AllowList allowList) {
        return policy.isSafeIdentifier(s, level, allowList);
    }

    /**
     * Level given by name, e.g. {@code "idmod"}.
     *
     * @throws IllegalArgumentException if the level name is not recognized
     */
    public boolean isSafeIdentifier(String s, String level, AllowList allowList) {
        return policy.isSafeIdentifier(s, IdentifierLevel.fromName(level), allowList);
    }

    public boolean isSafeString(String s, StringLevel level) {
        return policy.isSafeString(s, level);
    }

    public boolean isSafeString(String s, StringLevel level, AllowList allowList) {
        return policy.isSafeString(s, level, allowList);
    }

    /**
     * Level given by name, e.g. {@code "latin"}.
     *
     * @throws IllegalArgumentException if the level name is not recognized
     */
    public boolean isSafeString(String s, String level, AllowList allowList) {
        return policy.isSafeString(s, StringLevel.fromName(level), allowList);
    }
}
