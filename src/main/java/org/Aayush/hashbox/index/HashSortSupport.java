package org.Aayush.hashbox.index;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenCustomHashMap;
import lombok.experimental.UtilityClass;
import org.Aayush.hashbox.core.attribute.AttributeExtractor;
import org.Aayush.hashbox.core.hash.ValueHasher;

import java.util.List;
import java.util.Objects;

/**
 * Build primitives: stable hash sort and in-bucket value grouping.
 *
 * <p>Only 64-bit hashes are ever compared for order. Values are compared with {@code equals}.</p>
 */
@UtilityClass
final class HashSortSupport {

    /**
     * Extracts and hashes every object's value, then stably sorts the triples by hash ascending.
     * Object id {@code i} is the position of the object in {@code objects}. Objects whose
     * extractor answers {@link AttributeExtractor#MISSING} are skipped; the others keep their id.
     *
     * @throws AttributeIndexException when extraction fails.
     * @throws UnhashableValueException when a value cannot be hashed.
     */
    static <T> HashSortedEntries hashSort(
            List<? extends T> objects,
            AttributeExtractor<? super T> extractor,
            ValueHasher hasher
    ) {
        int n = objects.size();
        long[] hashes = new long[n];
        Object[] values = new Object[n];
        int[] ids = new int[n];
        int present = 0;
        int id = 0;
        for (T object : objects) {
            Object value = extractValue(extractor, object, id);
            if (value != AttributeExtractor.MISSING) {
                hashes[present] = hashValue(hasher, value, id);
                values[present] = value;
                ids[present] = id;
                present++;
            }
            id++;
        }

        int[] order = new int[present];
        for (int i = 0; i < present; i++) {
            order[i] = i;
        }
        // merge sort is stable: equal hashes keep ascending object id order
        IntArrays.mergeSort(order, (left, right) -> Long.compare(hashes[left], hashes[right]));

        long[] sortedHashes = new long[present];
        Object[] sortedValues = new Object[present];
        for (int i = 0; i < present; i++) {
            int source = order[i];
            sortedHashes[i] = hashes[source];
            sortedValues[i] = values[source];
            order[i] = ids[source];
        }
        return new HashSortedEntries(sortedHashes, sortedValues, order);
    }

    /**
     * Regroups every run of equal hashes in place so equal values become contiguous.
     *
     * <p>Groups are ordered by first appearance inside the run and keep the relative order of
     * their entries. Runs holding a single distinct value are left untouched.</p>
     *
     * @param strategy the index's value strategy; groups are keyed on its hash, never on
     *                 {@link Object#hashCode()}.
     */
    static void groupByValue(HashSortedEntries entries, ValueHashStrategy strategy) {
        long[] hashes = entries.hashes;
        int start = 0;
        while (start < hashes.length) {
            int end = start + 1;
            while (end < hashes.length && hashes[end] == hashes[start]) {
                end++;
            }
            if (end - start > 1 && !allEqual(entries.values, start, end)) {
                regroup(entries, start, end, strategy);
            }
            start = end;
        }
    }

    private static boolean allEqual(Object[] values, int start, int end) {
        Object first = values[start];
        for (int i = start + 1; i < end; i++) {
            if (!Objects.equals(first, values[i])) {
                return false;
            }
        }
        return true;
    }

    private static void regroup(HashSortedEntries entries, int start, int end, ValueHashStrategy strategy) {
        Object2ObjectLinkedOpenCustomHashMap<Object, IntArrayList> positionsByValue =
                new Object2ObjectLinkedOpenCustomHashMap<>(end - start, strategy);
        for (int i = start; i < end; i++) {
            Object value = entries.values[i];
            IntArrayList positions = positionsByValue.get(value);
            if (positions == null) {
                positions = new IntArrayList();
                positionsByValue.put(value, positions);
            }
            positions.add(i);
        }

        int length = end - start;
        Object[] groupedValues = new Object[length];
        int[] groupedIds = new int[length];
        int cursor = 0;
        for (IntArrayList positions : positionsByValue.values()) {
            for (int p = 0; p < positions.size(); p++) {
                int position = positions.getInt(p);
                groupedValues[cursor] = entries.values[position];
                groupedIds[cursor] = entries.objectIds[position];
                cursor++;
            }
        }
        System.arraycopy(groupedValues, 0, entries.values, start, length);
        System.arraycopy(groupedIds, 0, entries.objectIds, start, length);
    }

    private static <T> Object extractValue(AttributeExtractor<? super T> extractor, T object, int objectId) {
        Object value;
        try {
            value = extractor.extract(object);
        } catch (RuntimeException e) {
            throw AttributeIndexException.extractionFailed(objectId, e);
        }
        if (value != null && value.getClass().isArray()) {
            throw new UnhashableValueException(objectId,
                    "array value of type " + value.getClass().getSimpleName() + " compares by identity", null);
        }
        return value;
    }

    private static long hashValue(ValueHasher hasher, Object value, int objectId) {
        try {
            return hasher.hash(value);
        } catch (RuntimeException e) {
            throw new UnhashableValueException(objectId, "hasher rejected the value: " + e.getMessage(), e);
        }
    }
}
