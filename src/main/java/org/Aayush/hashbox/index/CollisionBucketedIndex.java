package org.Aayush.hashbox.index;

import org.Aayush.hashbox.core.id.ObjectIdArray;
import org.Aayush.hashbox.core.id.ObjectIdWidth;

import java.util.Arrays;
import java.util.Objects;

/**
 * Hash-sorted storage for low and medium cardinality values.
 *
 * <p>Layout: parallel arrays {@code sortedObjIds} / {@code sortedValues} ordered by
 * (hash, value group, object id), plus a run-length directory over the hashes
 * ({@code uniqueHashes}, {@code hashStarts}, {@code hashRunLengths}).</p>
 *
 * <p>Lookup bisects the directory in O(log U) and then shrinks the bucket range from both ends
 * until it bounds exactly the requested value. Values are only compared with {@code equals}.
 * The result is a view into {@code sortedObjIds}, not a copy.</p>
 *
 * <p>Immutable after construction; safe for concurrent reads.</p>
 */
final class CollisionBucketedIndex {
    private final ObjectIdArray sortedObjIds;
    private final Object[] sortedValues;
    private final long[] uniqueHashes;
    private final int[] hashStarts;
    private final int[] hashRunLengths;
    private final int distinctValueCount;
    private final int collidingBucketCount;
    private final int maxBucketSize;

    private CollisionBucketedIndex(
            ObjectIdArray sortedObjIds,
            Object[] sortedValues,
            long[] uniqueHashes,
            int[] hashStarts,
            int[] hashRunLengths,
            int distinctValueCount,
            int collidingBucketCount,
            int maxBucketSize
    ) {
        this.sortedObjIds = sortedObjIds;
        this.sortedValues = sortedValues;
        this.uniqueHashes = uniqueHashes;
        this.hashStarts = hashStarts;
        this.hashRunLengths = hashRunLengths;
        this.distinctValueCount = distinctValueCount;
        this.collidingBucketCount = collidingBucketCount;
        this.maxBucketSize = maxBucketSize;
    }

    /**
     * Builds the directory over entries already sorted by hash and grouped by value.
     *
     * @param entries hash-sorted, value-grouped entries; must be non-empty.
     * @param width identifier width shared with the owning index.
     */
    static CollisionBucketedIndex build(HashSortedEntries entries, ObjectIdWidth width) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(width, "width");
        if (entries.length() == 0) {
            throw new IllegalArgumentException("bucketed region must hold at least one entry");
        }

        RunLengthEncoding hashRuns = RunLengthEncoding.of(entries.hashes);
        RunLengthEncoding valueRuns = RunLengthEncoding.of(entries.values);

        int maxBucketSize = 0;
        for (int run = 0; run < hashRuns.runCount(); run++) {
            maxBucketSize = Math.max(maxBucketSize, hashRuns.length(run));
        }
        // every value run lies inside one hash run, so surplus value runs are collisions
        int collidingBucketCount = countCollidingBuckets(hashRuns, valueRuns);

        return new CollisionBucketedIndex(
                width.encode(entries.objectIds),
                entries.values.clone(),
                hashRuns.uniqueElements(entries.hashes),
                hashRuns.starts(),
                hashRuns.lengths(),
                valueRuns.runCount(),
                collidingBucketCount,
                maxBucketSize
        );
    }

    private static int countCollidingBuckets(RunLengthEncoding hashRuns, RunLengthEncoding valueRuns) {
        int colliding = 0;
        int valueRun = 0;
        for (int hashRun = 0; hashRun < hashRuns.runCount(); hashRun++) {
            int hashEnd = hashRuns.end(hashRun);
            int valuesInBucket = 0;
            while (valueRun < valueRuns.runCount() && valueRuns.start(valueRun) < hashEnd) {
                valuesInBucket++;
                valueRun++;
            }
            if (valuesInBucket > 1) {
                colliding++;
            }
        }
        return colliding;
    }

    /**
     * Returns ids of objects whose value equals {@code value}, ascending within the match.
     *
     * @param value lookup value.
     * @param valueHash hash of {@code value} under the index's hasher.
     * @return matching ids, or the empty sequence when no object carries {@code value}.
     */
    ObjectIdArray get(Object value, long valueHash) {
        int bucket = Arrays.binarySearch(uniqueHashes, valueHash);
        if (bucket < 0) {
            return sortedObjIds.width().emptySequence();
        }
        int start = hashStarts[bucket];
        int end = start + hashRunLengths[bucket];

        // Usually the bucket holds only the requested value; on collision, narrow to its run.
        while (start < end && !Objects.equals(sortedValues[start], value)) {
            start++;
        }
        while (end > start && !Objects.equals(sortedValues[end - 1], value)) {
            end--;
        }
        if (end <= start) {
            return sortedObjIds.width().emptySequence();
        }
        return sortedObjIds.slice(start, end);
    }

    /**
     * Every id stored in this region, in (hash, value, id) order.
     */
    ObjectIdArray allObjectIds() {
        return sortedObjIds;
    }

    int size() {
        return sortedObjIds.size();
    }

    int uniqueHashCount() {
        return uniqueHashes.length;
    }

    int distinctValueCount() {
        return distinctValueCount;
    }

    int collidingBucketCount() {
        return collidingBucketCount;
    }

    int maxBucketSize() {
        return maxBucketSize;
    }
}
