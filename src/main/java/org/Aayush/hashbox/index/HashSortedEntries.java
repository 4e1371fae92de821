package org.Aayush.hashbox.index;

/**
 * Build-time parallel arrays of (hash, value, object id), one slot per indexed object.
 *
 * <p>Mutable scratch state owned by a single build. Never escapes {@link AttributeIndex#build}.</p>
 */
final class HashSortedEntries {
    final long[] hashes;
    final Object[] values;
    final int[] objectIds;

    HashSortedEntries(long[] hashes, Object[] values, int[] objectIds) {
        if (hashes.length != values.length || values.length != objectIds.length) {
            throw new IllegalArgumentException("parallel arrays must have equal length: "
                    + hashes.length + "/" + values.length + "/" + objectIds.length);
        }
        this.hashes = hashes;
        this.values = values;
        this.objectIds = objectIds;
    }

    int length() {
        return hashes.length;
    }

    /**
     * Copies the slots whose {@code keep} flag is set, preserving relative order.
     */
    HashSortedEntries compact(boolean[] keep, int keptCount) {
        long[] keptHashes = new long[keptCount];
        Object[] keptValues = new Object[keptCount];
        int[] keptIds = new int[keptCount];
        int cursor = 0;
        for (int i = 0; i < hashes.length; i++) {
            if (keep[i]) {
                keptHashes[cursor] = hashes[i];
                keptValues[cursor] = values[i];
                keptIds[cursor] = objectIds[i];
                cursor++;
            }
        }
        if (cursor != keptCount) {
            throw new IllegalStateException("expected " + keptCount + " kept slots, found " + cursor);
        }
        return new HashSortedEntries(keptHashes, keptValues, keptIds);
    }
}
