package org.Aayush.hashbox.core.id;

/**
 * Storage width for dense object identifiers.
 *
 * <p>An index picks the narrowest width that can hold {@code objectCount - 1} and keeps
 * it for its whole lifetime. {@link #UINT8} and {@link #UINT16} are decoded as unsigned.</p>
 */
public enum ObjectIdWidth {
    UINT8(0xFF),
    UINT16(0xFFFF),
    INT32(Integer.MAX_VALUE);

    private static final ObjectIdArray[] EMPTY_BY_WIDTH;

    static {
        ObjectIdWidth[] widths = values();
        EMPTY_BY_WIDTH = new ObjectIdArray[widths.length];
        for (ObjectIdWidth width : widths) {
            EMPTY_BY_WIDTH[width.ordinal()] = ObjectIdArray.emptyOf(width);
        }
    }

    private final int maxId;

    ObjectIdWidth(int maxId) {
        this.maxId = maxId;
    }

    /**
     * Picks the smallest width able to address ids {@code [0, objectCount)}.
     *
     * @param objectCount number of objects in the collection.
     * @return narrowest suitable width.
     * @throws IllegalArgumentException if {@code objectCount} is negative.
     */
    public static ObjectIdWidth forObjectCount(int objectCount) {
        if (objectCount < 0) {
            throw new IllegalArgumentException("objectCount must be >= 0, got " + objectCount);
        }
        int maxId = objectCount - 1;
        if (maxId <= UINT8.maxId) {
            return UINT8;
        }
        if (maxId <= UINT16.maxId) {
            return UINT16;
        }
        return INT32;
    }

    /**
     * Largest identifier this width can store.
     */
    public int maxId() {
        return maxId;
    }

    /**
     * Returns true when every id in {@code [0, objectCount)} fits this width.
     */
    public boolean canRepresent(int objectCount) {
        return objectCount <= 0 || objectCount - 1 <= maxId;
    }

    /**
     * Zero-length id sequence of this width. Shared, allocation-free.
     */
    public ObjectIdArray emptySequence() {
        return EMPTY_BY_WIDTH[ordinal()];
    }

    /**
     * Encodes a copy of {@code ids[from, to)} at this width.
     *
     * @throws IllegalArgumentException if an id is negative or exceeds {@link #maxId()}.
     */
    public ObjectIdArray encode(int[] ids, int from, int to) {
        return ObjectIdArray.encode(this, ids, from, to);
    }

    /**
     * Encodes a copy of all of {@code ids} at this width.
     */
    public ObjectIdArray encode(int[] ids) {
        return ObjectIdArray.encode(this, ids, 0, ids.length);
    }
}
