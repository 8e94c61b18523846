package ucdsafety;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The five read-only tables the classifiers work on: repertoire, blocks, reserved ranges, identifier status,
 * identifier type, plus the intentional confusables list.
 * Built once through {@link Builder}; after {@link Builder#build()} nothing can change, so one instance may be
 * shared by any number of threads.
 */
public final class UnicodeTables {

    private static final Logger logger = LoggerFactory.getLogger(UnicodeTables.class);

    private final String unicodeVersion;
    private final Map<Integer, CharInfo> repertoire;
    private final Map<String, Block> blocksByAlias;
    private final IntervalTable<Block> blockRanges;
    private final IntervalTable<ReservedRange> reserved;
    private final IntervalTable<IdentifierStatusRange> identifierStatus;
    private final IntervalTable<IdentifierTypeRange> identifierTypes;
    private final Map<Integer, Confusable> confusables;

    private UnicodeTables(Builder b) {
        this.unicodeVersion = b.unicodeVersion;
        this.repertoire = Collections.unmodifiableMap(new HashMap<>(b.repertoire));
        this.blocksByAlias = Collections.unmodifiableMap(new LinkedHashMap<>(b.blocks));
        this.blockRanges = new IntervalTable<>("block", new ArrayList<>(b.blocks.values()));
        this.reserved = new IntervalTable<>("reserved", b.reserved);
        this.identifierStatus = new IntervalTable<>("identifier status", b.identifierStatus);
        this.identifierTypes = new IntervalTable<>("identifier type", b.identifierTypes);
        this.confusables = Collections.unmodifiableMap(resolveChains(b.confusables));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Version label of the Unicode data the tables were generated from, or "unknown".
     */
    public String unicodeVersion() {
        return unicodeVersion;
    }

    /**
     * Repertoire keyed by code point. Range entries appear under their first code point only.
     */
    public Map<Integer, CharInfo> repertoire() {
        return repertoire;
    }

    /**
     * Blocks keyed by alias, in insertion order.
     */
    public Map<String, Block> blocks() {
        return blocksByAlias;
    }

    public IntervalTable<Block> blockRanges() {
        return blockRanges;
    }

    public IntervalTable<ReservedRange> reserved() {
        return reserved;
    }

    public IntervalTable<IdentifierStatusRange> identifierStatus() {
        return identifierStatus;
    }

    public IntervalTable<IdentifierTypeRange> identifierTypes() {
        return identifierTypes;
    }

    /**
     * Confusables keyed by the confusing code point. Canonical targets never appear as keys.
     */
    public Map<Integer, Confusable> confusables() {
        return confusables;
    }

    /**
     * Follow mappings whose target is itself confusable until a non-confusable target is reached.
     */
    private static Map<Integer, Confusable> resolveChains(Map<Integer, Confusable> raw) {
        Map<Integer, Confusable> resolved = new HashMap<>(raw.size() * 2);
        int chained = 0;

        for (Confusable c : raw.values()) {
            Confusable last = c;
            Set<Integer> seen = new HashSet<>();
            seen.add(c.confusing());
            while (raw.containsKey(last.canonical())) {
                if (!seen.add(last.canonical())) {
                    throw new IllegalArgumentException("Confusable mapping cycle through " + CodePoints.format(last.canonical()));
                }
                last = raw.get(last.canonical());
            }
            if (last != c) {
                chained++;
                resolved.put(c.confusing(), new Confusable(c.confusing(), last.canonical(), c.confusingName(), last.canonicalName()));
            } else {
                resolved.put(c.confusing(), c);
            }
        }

        if (chained > 0) {
            logger.debug("Resolved {} chained confusable mappings", chained);
        }
        return resolved;
    }

    @Override
    public String toString() {
        return String.format("UnicodeTables[version=%s, chars=%d, blocks=%d, reserved=%d, status=%d, types=%d, confusables=%d]",
            unicodeVersion, repertoire.size(), blocksByAlias.size(), reserved.size(), identifierStatus.size(),
            identifierTypes.size(), confusables.size());
    }

    /**
     * Collects table entries in any order. Validation (ordering, overlaps, duplicates) happens on add and on build.
     */
    public static final class Builder {

        private String unicodeVersion = "unknown";
        private final Map<Integer, CharInfo> repertoire = new HashMap<>();
        private final Map<String, Block> blocks = new LinkedHashMap<>();
        private final List<ReservedRange> reserved = new ArrayList<>();
        private final List<IdentifierStatusRange> identifierStatus = new ArrayList<>();
        private final List<IdentifierTypeRange> identifierTypes = new ArrayList<>();
        private final Map<Integer, Confusable> confusables = new HashMap<>();

        private Builder() {}

        public Builder unicodeVersion(String version) {
            this.unicodeVersion = Objects.requireNonNull(version, "version");
            return this;
        }

        public Builder addChar(CharInfo info) {
            CharInfo prev = repertoire.putIfAbsent(info.codePoint(), info);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate repertoire entry for " + CodePoints.format(info.codePoint()));
            }
            return this;
        }

        public Builder addBlock(Block block) {
            Block prev = blocks.putIfAbsent(block.alias(), block);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate block alias: " + block.alias());
            }
            return this;
        }

        public Builder addReserved(ReservedRange range) {
            reserved.add(Objects.requireNonNull(range));
            return this;
        }

        public Builder addIdentifierStatus(IdentifierStatusRange range) {
            identifierStatus.add(Objects.requireNonNull(range));
            return this;
        }

        public Builder addIdentifierType(IdentifierTypeRange range) {
            identifierTypes.add(Objects.requireNonNull(range));
            return this;
        }

        public Builder addConfusable(Confusable confusable) {
            Confusable prev = confusables.putIfAbsent(confusable.confusing(), confusable);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate confusable entry for " + CodePoints.format(confusable.confusing()));
            }
            return this;
        }

        /**
         * @throws IllegalArgumentException if ranges in one table overlap or confusables form a cycle
         */
        public UnicodeTables build() {
            return new UnicodeTables(this);
        }
    }
}
