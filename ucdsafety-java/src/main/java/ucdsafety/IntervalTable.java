package ucdsafety;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable table of non-overlapping code point ranges, searched by binary search over the range starts.
 * Every range-based classifier (reserved, identifier status, identifier type, blocks) is backed by one of these.
 *
 * @param <V> range payload
 */
public final class IntervalTable<V extends Ranged> {

    private final String name;
    // Sorted range starts, parallel to entries
    private final int[] starts;
    private final List<V> entries;

    /**
     * Build a table from entries in any order.
     *
     * @throws IllegalArgumentException if two entries overlap
     */
    public IntervalTable(String name, List<? extends V> ranges) {
        this.name = name;

        List<V> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingInt(Ranged::first));

        int n = sorted.size();
        this.starts = new int[n];
        for (int i = 0; i < n; i++) {
            V curr = sorted.get(i);
            if (i > 0) {
                V prev = sorted.get(i - 1);
                if (curr.first() <= prev.last()) {
                    throw new IllegalArgumentException(String.format(
                        "%s table: range starting at %s overlaps range %s..%s", name,
                        CodePoints.format(curr.first()), CodePoints.format(prev.first()), CodePoints.format(prev.last())));
                }
            }
            starts[i] = curr.first();
        }
        this.entries = List.copyOf(sorted);
    }

    public static <V extends Ranged> IntervalTable<V> empty(String name) {
        return new IntervalTable<>(name, List.of());
    }

    /**
     * Find the entry covering {@code cp}. Returns null if cp lies before the first range or in a gap.
     */
    public V find(int cp) {
        int n = starts.length;
        if (n == 0 || cp < starts[0]) return null;

        int idx = Arrays.binarySearch(starts, cp);
        if (idx >= 0) {
            // Exactly on a range start
            return entries.get(idx);
        }

        // Candidate is the range just before the insertion point; starts[0] <= cp so it exists
        V candidate = entries.get(-idx - 2);
        return cp <= candidate.last() ? candidate : null;
    }

    public boolean covers(int cp) {
        return find(cp) != null;
    }

    public String name() {
        return name;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Entries in ascending order of their first code point.
     */
    public List<V> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "IntervalTable[" + name + ", " + entries.size() + " ranges]";
    }
}
