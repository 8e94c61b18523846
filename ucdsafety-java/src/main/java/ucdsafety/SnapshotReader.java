package ucdsafety;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a JSON table snapshot, as written by the offline UCD data generator, into {@link UnicodeTables}.
 *
 * <pre>
 * { "unicodeVersion": "14.0.0",
 *   "blocks":           [ {"alias": "ASCII", "name": "Basic Latin", "first": "0000", "last": "007F"} ],
 *   "repertoire":       [ {"cp": "0041", "name": "LATIN CAPITAL LETTER A", "block": "ASCII", "props": ["Alpha", "XIDS", "XIDC"]},
 *                         {"firstCp": "4E00", "lastCp": "9FFF", "name": "CJK UNIFIED IDEOGRAPH-#", "block": "CJK", "props": [...]} ],
 *   "reserved":         [ {"type": "reserved", "first": "0378", "last": "0379"} ],
 *   "identifierStatus": [ {"first": "0027", "status": "Allowed"} ],
 *   "identifierType":   [ {"first": "0030", "last": "0039", "types": ["Recommended"]} ],
 *   "confusables":      [ {"confusing": "0430", "canonical": "0061", "confusingName": "...", "canonicalName": "..."} ] }
 * </pre>
 *
 * Code points are hex strings; a missing {@code last} means a single code point.
 */
public class SnapshotReader {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotReader.class);

    // UCD XML attribute names of the repertoire flags
    private static final String PROP_ALPHA = "Alpha";
    private static final String PROP_MATH = "Math";
    private static final String PROP_NON_CHAR = "NChar";
    private static final String PROP_DEPRECATED = "Dep";
    private static final String PROP_XID_START = "XIDS";
    private static final String PROP_XID_CONTINUE = "XIDC";
    private static final Set<String> KNOWN_PROPS =
        Set.of(PROP_ALPHA, PROP_MATH, PROP_NON_CHAR, PROP_DEPRECATED, PROP_XID_START, PROP_XID_CONTINUE);

    private final Gson gson;

    public SnapshotReader() {
        this.gson = new Gson();
    }

    public UnicodeTables read(Path path) throws IOException {
        logger.info("Loading Unicode tables from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /**
     * Read a snapshot from the classpath.
     */
    public UnicodeTables readResource(String resource) throws IOException {
        logger.info("Loading Unicode tables from classpath:{}", resource);
        InputStream in = SnapshotReader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new FileNotFoundException("Snapshot resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(reader, resource);
        }
    }

    /**
     * @param source name used in log and error messages
     * @throws SnapshotFormatException if the document is not a valid snapshot
     */
    public UnicodeTables read(Reader reader, String source) throws IOException {
        Snapshot snapshot;
        try {
            snapshot = gson.fromJson(reader, Snapshot.class);
        } catch (JsonIOException e) {
            throw new IOException("Failed to read snapshot " + source, e);
        } catch (JsonParseException e) {
            throw new SnapshotFormatException("Malformed snapshot " + source + ": " + e.getMessage(), e);
        }
        if (snapshot == null) {
            throw new SnapshotFormatException("Empty snapshot " + source);
        }

        UnicodeTables tables = toTables(snapshot, source);
        logger.info("Loaded Unicode {} tables: {} characters, {} blocks, {} reserved ranges, "
                + "{} identifier status ranges, {} identifier type ranges, {} confusables",
            tables.unicodeVersion(), tables.repertoire().size(), tables.blocks().size(), tables.reserved().size(),
            tables.identifierStatus().size(), tables.identifierTypes().size(), tables.confusables().size());
        return tables;
    }

    private UnicodeTables toTables(Snapshot snapshot, String source) throws SnapshotFormatException {
        UnicodeTables.Builder builder = UnicodeTables.builder();
        if (snapshot.unicodeVersion != null) {
            builder.unicodeVersion(snapshot.unicodeVersion);
        }

        String section = "blocks";
        int i = 0;
        try {
            for (BlockEntry e : nonNull(snapshot.blocks)) {
                builder.addBlock(new Block(required(e.alias, "alias"), required(e.name, "name"),
                    hex(e.first, "first"), hex(e.last, "last")));
                i++;
            }

            section = "repertoire";
            i = 0;
            for (CharEntry e : nonNull(snapshot.repertoire)) {
                builder.addChar(toCharInfo(e));
                i++;
            }

            section = "reserved";
            i = 0;
            for (ReservedEntry e : nonNull(snapshot.reserved)) {
                CodePointRange r = range(e.first, e.last);
                builder.addReserved(new ReservedRange(ReservedType.fromName(required(e.type, "type")), r.first(), r.last()));
                i++;
            }

            section = "identifierStatus";
            i = 0;
            for (StatusEntry e : nonNull(snapshot.identifierStatus)) {
                CodePointRange r = range(e.first, e.last);
                builder.addIdentifierStatus(new IdentifierStatusRange(r.first(), r.last(),
                    IdentifierStatus.fromFileName(required(e.status, "status"))));
                i++;
            }

            section = "identifierType";
            i = 0;
            for (TypeEntry e : nonNull(snapshot.identifierType)) {
                CodePointRange r = range(e.first, e.last);
                builder.addIdentifierType(new IdentifierTypeRange(r.first(), r.last(), toTypes(required(e.types, "types"))));
                i++;
            }

            section = "confusables";
            i = 0;
            for (ConfusableEntry e : nonNull(snapshot.confusables)) {
                builder.addConfusable(new Confusable(hex(e.confusing, "confusing"), hex(e.canonical, "canonical"),
                    required(e.confusingName, "confusingName"), required(e.canonicalName, "canonicalName")));
                i++;
            }
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException(String.format("Invalid snapshot %s, %s[%d]: %s", source, section, i, e.getMessage()), e);
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException("Invalid snapshot " + source + ": " + e.getMessage(), e);
        }
    }

    private static CharInfo toCharInfo(CharEntry e) {
        List<String> props = nonNull(e.props);
        for (String p : props) {
            if (p == null || !KNOWN_PROPS.contains(p)) {
                throw new IllegalArgumentException("Unknown property: " + p);
            }
        }

        boolean isRange = e.firstCp != null;
        int first;
        int last;
        if (isRange) {
            first = hex(e.firstCp, "firstCp");
            last = hex(e.lastCp, "lastCp");
        } else {
            first = hex(e.cp, "cp");
            last = first;
        }

        return new CharInfo(required(e.name, "name"), isRange, first, last,
            props.contains(PROP_ALPHA), props.contains(PROP_MATH), props.contains(PROP_NON_CHAR),
            props.contains(PROP_DEPRECATED), props.contains(PROP_XID_START), props.contains(PROP_XID_CONTINUE),
            required(e.block, "block"));
    }

    /**
     * Type flags for one IdentifierType line. Allowed is derived: Inclusion or Recommended.
     */
    static Set<IdentifierType> toTypes(List<String> names) {
        Set<IdentifierType> types = EnumSet.noneOf(IdentifierType.class);
        for (String name : names) {
            types.add(IdentifierType.fromFileName(name));
        }
        if (types.contains(IdentifierType.INCLUSION) || types.contains(IdentifierType.RECOMMENDED)) {
            types.add(IdentifierType.ALLOWED);
        }
        return types;
    }

    private static CodePointRange range(String first, String last) {
        return CodePointRange.of(hex(first, "first"), last == null ? null : CodePoints.parseHex(last));
    }

    private static int hex(String value, String field) {
        return CodePoints.parseHex(required(value, field));
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }

    // JSON document shape, bound by Gson

    static class Snapshot {
        String unicodeVersion;
        List<BlockEntry> blocks;
        List<CharEntry> repertoire;
        List<ReservedEntry> reserved;
        List<StatusEntry> identifierStatus;
        List<TypeEntry> identifierType;
        List<ConfusableEntry> confusables;
    }

    static class BlockEntry {
        String alias;
        String name;
        String first;
        String last;
    }

    static class CharEntry {
        String cp;
        String firstCp;
        String lastCp;
        String name;
        String block;
        List<String> props;
    }

    static class ReservedEntry {
        String type;
        String first;
        String last;
    }

    static class StatusEntry {
        String first;
        String last;
        String status;
    }

    static class TypeEntry {
        String first;
        String last;
        List<String> types;
    }

    static class ConfusableEntry {
        String confusing;
        String canonical;
        String confusingName;
        String canonicalName;
    }
}
