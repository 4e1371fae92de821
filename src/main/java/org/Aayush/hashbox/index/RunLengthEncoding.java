package org.Aayush.hashbox.index;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Objects;

/**
 * Run-length directory over a grouped sequence: one (start, length) pair per maximal run of
 * equal consecutive elements.
 *
 * <p>Runs are contiguous, disjoint, and cover the whole source in order.</p>
 */
final class RunLengthEncoding {
    private final int[] starts;
    private final int[] lengths;

    private RunLengthEncoding(int[] starts, int[] lengths) {
        this.starts = starts;
        this.lengths = lengths;
    }

    /**
     * Encodes runs of equal {@code long} values.
     */
    static RunLengthEncoding of(long[] sorted) {
        IntArrayList starts = new IntArrayList();
        IntArrayList lengths = new IntArrayList();
        int i = 0;
        while (i < sorted.length) {
            int end = i + 1;
            while (end < sorted.length && sorted[end] == sorted[i]) {
                end++;
            }
            starts.add(i);
            lengths.add(end - i);
            i = end;
        }
        return new RunLengthEncoding(starts.toIntArray(), lengths.toIntArray());
    }

    /**
     * Encodes runs of values equal under {@link Objects#equals(Object, Object)}.
     */
    static RunLengthEncoding of(Object[] grouped) {
        IntArrayList starts = new IntArrayList();
        IntArrayList lengths = new IntArrayList();
        int i = 0;
        while (i < grouped.length) {
            int end = i + 1;
            while (end < grouped.length && Objects.equals(grouped[i], grouped[end])) {
                end++;
            }
            starts.add(i);
            lengths.add(end - i);
            i = end;
        }
        return new RunLengthEncoding(starts.toIntArray(), lengths.toIntArray());
    }

    int runCount() {
        return starts.length;
    }

    int start(int run) {
        return starts[run];
    }

    int length(int run) {
        return lengths[run];
    }

    /**
     * Exclusive end offset of one run.
     */
    int end(int run) {
        return starts[run] + lengths[run];
    }

    /**
     * Returns the first element of every run: the unique elements, in run order.
     */
    long[] uniqueElements(long[] source) {
        long[] unique = new long[starts.length];
        for (int run = 0; run < starts.length; run++) {
            unique[run] = source[starts[run]];
        }
        return unique;
    }

    /**
     * Copy of the run start offsets.
     */
    int[] starts() {
        return starts.clone();
    }

    /**
     * Copy of the run lengths.
     */
    int[] lengths() {
        return lengths.clone();
    }
}
