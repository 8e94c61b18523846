package ucdsafety;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boundary behavior of the binary-search range lookup.
 */
public class IntervalTableTest {

    // [0x10..0x1F], [0x20] single, [0x30..0x3F], gap 0x21..0x2F, [0x40] single
    private static IntervalTable<CodePointRange> sample() {
        return new IntervalTable<>("sample", List.of(
            new CodePointRange(0x30, 0x3F),
            CodePointRange.single(0x40),
            new CodePointRange(0x10, 0x1F),
            CodePointRange.single(0x20)));
    }

    @Test
    void testEmptyTableFindsNothing() {
        IntervalTable<CodePointRange> table = IntervalTable.empty("empty");
        assertTrue(table.isEmpty());
        assertNull(table.find(0));
        assertNull(table.find(0x41));
        assertNull(table.find(CodePoints.MAX_CODE_POINT));
    }

    @Test
    void testBeforeFirstRange() {
        IntervalTable<CodePointRange> table = sample();
        assertNull(table.find(0x00));
        assertNull(table.find(0x0F));
    }

    @Test
    void testExactStartMatches() {
        IntervalTable<CodePointRange> table = sample();
        assertEquals(new CodePointRange(0x10, 0x1F), table.find(0x10));
        assertEquals(new CodePointRange(0x30, 0x3F), table.find(0x30));
        assertEquals(CodePointRange.single(0x40), table.find(0x40));
    }

    @Test
    void testInsideRange() {
        assertEquals(new CodePointRange(0x10, 0x1F), sample().find(0x17));
    }

    @Test
    void testLastMatchesAndLastPlusOneDoesNot() {
        IntervalTable<CodePointRange> table = sample();
        assertEquals(new CodePointRange(0x30, 0x3F), table.find(0x3F));
        // 0x40 is another range's start, so it must match that range and not its neighbor
        assertEquals(CodePointRange.single(0x40), table.find(0x40));
        assertNull(table.find(0x41));
    }

    @Test
    void testAdjacentRangesNeverBleed() {
        IntervalTable<CodePointRange> table = sample();
        assertEquals(new CodePointRange(0x10, 0x1F), table.find(0x1F));
        assertEquals(CodePointRange.single(0x20), table.find(0x20));
    }

    @Test
    void testSingleRangeMatchesOnlyItsStart() {
        IntervalTable<CodePointRange> table = sample();
        assertNull(table.find(0x21));
        assertNull(table.find(0x2F));
        assertFalse(table.covers(0x21));
    }

    @Test
    void testEveryCodePointAgainstLinearScan() {
        IntervalTable<CodePointRange> table = sample();
        for (int cp = 0; cp <= 0x50; cp++) {
            CodePointRange expected = null;
            for (CodePointRange r : table.entries()) {
                if (r.contains(cp)) expected = r;
            }
            assertEquals(expected, table.find(cp), "code point " + CodePoints.format(cp));
        }
    }

    @Test
    void testEntriesSortedByStart() {
        List<CodePointRange> entries = sample().entries();
        for (int i = 1; i < entries.size(); i++) {
            assertTrue(entries.get(i - 1).first() < entries.get(i).first());
        }
        assertThrows(UnsupportedOperationException.class, () -> entries.add(CodePointRange.single(0x99)));
    }

    @Test
    void testOverlappingRangesRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
            new IntervalTable<>("bad", List.of(new CodePointRange(0x10, 0x20), new CodePointRange(0x20, 0x30))));
        assertTrue(e.getMessage().contains("bad"));

        assertThrows(IllegalArgumentException.class, () ->
            new IntervalTable<>("dup", List.of(CodePointRange.single(0x10), CodePointRange.single(0x10))));
    }

    @Test
    void testInvalidRanges() {
        assertThrows(IllegalArgumentException.class, () -> new CodePointRange(0x20, 0x10));
        assertThrows(IllegalArgumentException.class, () -> new CodePointRange(-1, 0x10));
        assertThrows(IllegalArgumentException.class, () -> CodePointRange.single(CodePoints.MAX_CODE_POINT + 1));
        assertEquals(CodePointRange.single(0x41), CodePointRange.of(0x41, null));
    }

    @Test
    void testTopOfCodeSpace() {
        IntervalTable<CodePointRange> table = new IntervalTable<>("planes",
            List.of(new CodePointRange(0x10FFFE, CodePoints.MAX_CODE_POINT)));
        assertNotNull(table.find(CodePoints.MAX_CODE_POINT));
        assertNull(table.find(0x10FFFD));
    }
}
