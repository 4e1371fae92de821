package org.Aayush.hashbox.core.id;

import it.unimi.dsi.fastutil.ints.IntIterator;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable sequence of object identifiers stored at a fixed {@link ObjectIdWidth}.
 *
 * <p>Instances are windows {@code [offset, offset + length)} over a primitive backing array.
 * {@link #slice(int, int)} narrows the window without copying, so many results can share
 * one buffer owned by the index that produced them. The backing array is never exposed.</p>
 *
 * <p>Thread Safety: immutable, safe for concurrent readers.</p>
 */
public abstract class ObjectIdArray {

    final int offset;
    final int length;

    private ObjectIdArray(int offset, int length) {
        this.offset = offset;
        this.length = length;
    }

    static ObjectIdArray emptyOf(ObjectIdWidth width) {
        if (width == ObjectIdWidth.UINT8) {
            return new ByteIds(new byte[0], 0, 0);
        }
        if (width == ObjectIdWidth.UINT16) {
            return new CharIds(new char[0], 0, 0);
        }
        return new IntIds(new int[0], 0, 0);
    }

    static ObjectIdArray encode(ObjectIdWidth width, int[] ids, int from, int to) {
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(ids, "ids");
        Objects.checkFromToIndex(from, to, ids.length);
        int count = to - from;
        if (count == 0) {
            return width.emptySequence();
        }
        int maxId = width.maxId();
        for (int i = from; i < to; i++) {
            int id = ids[i];
            if (id < 0 || id > maxId) {
                throw new IllegalArgumentException(
                        "Object id " + id + " does not fit width " + width + " (max " + maxId + ")");
            }
        }

        if (width == ObjectIdWidth.UINT8) {
            byte[] packed = new byte[count];
            for (int i = 0; i < count; i++) {
                packed[i] = (byte) ids[from + i];
            }
            return new ByteIds(packed, 0, count);
        }
        if (width == ObjectIdWidth.UINT16) {
            char[] packed = new char[count];
            for (int i = 0; i < count; i++) {
                packed[i] = (char) ids[from + i];
            }
            return new CharIds(packed, 0, count);
        }
        return new IntIds(Arrays.copyOfRange(ids, from, to), 0, count);
    }

    /**
     * Width this sequence is stored at.
     */
    public abstract ObjectIdWidth width();

    /**
     * Reads the raw backing slot at an absolute backing position.
     */
    abstract int idAtBackingPosition(int backingPosition);

    /**
     * Creates a window over the same backing array.
     */
    abstract ObjectIdArray window(int newOffset, int newLength);

    /**
     * Number of identifiers in this sequence.
     */
    public int size() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Returns the identifier at {@code index}, decoded as an unsigned value.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, size())}.
     */
    public int getInt(int index) {
        Objects.checkIndex(index, length);
        return idAtBackingPosition(offset + index);
    }

    /**
     * Returns a view of {@code [from, to)} that shares this sequence's backing array.
     *
     * @throws IndexOutOfBoundsException if the range is invalid.
     */
    public ObjectIdArray slice(int from, int to) {
        Objects.checkFromToIndex(from, to, length);
        if (from == 0 && to == length) {
            return this;
        }
        if (from == to) {
            return width().emptySequence();
        }
        return window(offset + from, to - from);
    }

    /**
     * Copies the identifiers out as plain ints.
     */
    public int[] toIntArray() {
        int[] out = new int[length];
        copyInto(out, 0);
        return out;
    }

    /**
     * Copies the identifiers into {@code target} starting at {@code targetOffset}.
     *
     * @return position in {@code target} right after the last copied id.
     */
    public int copyInto(int[] target, int targetOffset) {
        Objects.checkFromIndexSize(targetOffset, length, target.length);
        for (int i = 0; i < length; i++) {
            target[targetOffset + i] = idAtBackingPosition(offset + i);
        }
        return targetOffset + length;
    }

    /**
     * Returns true when ids are strictly ascending (which also rules out duplicates).
     */
    public boolean isStrictlyAscending() {
        for (int i = 1; i < length; i++) {
            if (idAtBackingPosition(offset + i - 1) >= idAtBackingPosition(offset + i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns this sequence when it is already strictly ascending, otherwise a sorted copy.
     */
    public ObjectIdArray sorted() {
        if (isStrictlyAscending()) {
            return this;
        }
        int[] ids = toIntArray();
        Arrays.sort(ids);
        return encode(width(), ids, 0, ids.length);
    }

    /**
     * Primitive iterator over the identifiers, in stored order.
     */
    public IntIterator iterator() {
        return new IntIterator() {
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < length;
            }

            @Override
            public int nextInt() {
                if (cursor >= length) {
                    throw new NoSuchElementException();
                }
                return idAtBackingPosition(offset + cursor++);
            }
        };
    }

    /**
     * Two sequences are equal when they hold the same ids in the same order, regardless of width.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ObjectIdArray)) {
            return false;
        }
        ObjectIdArray that = (ObjectIdArray) other;
        if (length != that.length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (idAtBackingPosition(offset + i) != that.idAtBackingPosition(that.offset + i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < length; i++) {
            result = 31 * result + idAtBackingPosition(offset + i);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(idAtBackingPosition(offset + i));
        }
        return sb.append(']').toString();
    }

    private static final class ByteIds extends ObjectIdArray {
        private final byte[] ids;

        ByteIds(byte[] ids, int offset, int length) {
            super(offset, length);
            this.ids = ids;
        }

        @Override
        public ObjectIdWidth width() {
            return ObjectIdWidth.UINT8;
        }

        @Override
        int idAtBackingPosition(int backingPosition) {
            return ids[backingPosition] & 0xFF;
        }

        @Override
        ObjectIdArray window(int newOffset, int newLength) {
            return new ByteIds(ids, newOffset, newLength);
        }
    }

    private static final class CharIds extends ObjectIdArray {
        private final char[] ids;

        CharIds(char[] ids, int offset, int length) {
            super(offset, length);
            this.ids = ids;
        }

        @Override
        public ObjectIdWidth width() {
            return ObjectIdWidth.UINT16;
        }

        @Override
        int idAtBackingPosition(int backingPosition) {
            return ids[backingPosition];
        }

        @Override
        ObjectIdArray window(int newOffset, int newLength) {
            return new CharIds(ids, newOffset, newLength);
        }
    }

    private static final class IntIds extends ObjectIdArray {
        private final int[] ids;

        IntIds(int[] ids, int offset, int length) {
            super(offset, length);
            this.ids = ids;
        }

        @Override
        public ObjectIdWidth width() {
            return ObjectIdWidth.INT32;
        }

        @Override
        int idAtBackingPosition(int backingPosition) {
            return ids[backingPosition];
        }

        @Override
        ObjectIdArray window(int newOffset, int newLength) {
            return new IntIds(ids, newOffset, newLength);
        }
    }
}
