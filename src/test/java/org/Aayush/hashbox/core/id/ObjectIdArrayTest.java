package org.Aayush.hashbox.core.id;

import it.unimi.dsi.fastutil.ints.IntIterator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ObjectIdArray Tests")
class ObjectIdArrayTest {

    @Test
    @DisplayName("UINT8 and UINT16 ids decode as unsigned")
    void testUnsignedDecoding() {
        ObjectIdArray bytes = ObjectIdWidth.UINT8.encode(new int[]{0, 127, 128, 255});
        assertArrayEquals(new int[]{0, 127, 128, 255}, bytes.toIntArray());
        assertEquals(255, bytes.getInt(3));

        ObjectIdArray chars = ObjectIdWidth.UINT16.encode(new int[]{1, 32_767, 32_768, 65_535});
        assertArrayEquals(new int[]{1, 32_767, 32_768, 65_535}, chars.toIntArray());
        assertEquals(65_535, chars.getInt(3));
    }

    @Test
    @DisplayName("Encoding copies its input")
    void testEncodeCopiesInput() {
        int[] source = {4, 5, 6};
        ObjectIdArray ids = ObjectIdWidth.INT32.encode(source);
        source[0] = 99;
        assertEquals(4, ids.getInt(0));
    }

    @Test
    @DisplayName("Slices are windows over the same ids")
    void testSlice() {
        ObjectIdArray ids = ObjectIdWidth.UINT16.encode(new int[]{10, 20, 30, 40, 50});

        ObjectIdArray middle = ids.slice(1, 4);
        assertArrayEquals(new int[]{20, 30, 40}, middle.toIntArray());
        assertArrayEquals(new int[]{30}, middle.slice(1, 2).toIntArray());
        assertSame(ids, ids.slice(0, 5));
        assertSame(ObjectIdWidth.UINT16.emptySequence(), ids.slice(2, 2));

        assertThrows(IndexOutOfBoundsException.class, () -> ids.slice(3, 6));
        assertThrows(IndexOutOfBoundsException.class, () -> middle.getInt(3));
        assertThrows(IndexOutOfBoundsException.class, () -> middle.getInt(-1));
    }

    @Test
    @DisplayName("Equality is by content, independent of width and backing window")
    void testEqualityAcrossWidths() {
        ObjectIdArray narrow = ObjectIdWidth.UINT8.encode(new int[]{1, 2, 3});
        ObjectIdArray wide = ObjectIdWidth.INT32.encode(new int[]{0, 1, 2, 3}).slice(1, 4);

        assertEquals(narrow, wide);
        assertEquals(narrow.hashCode(), wide.hashCode());
        assertNotEquals(narrow, ObjectIdWidth.UINT8.encode(new int[]{1, 2}));
        assertEquals("[1, 2, 3]", wide.toString());
    }

    @Test
    @DisplayName("sorted() returns the same instance when already strictly ascending")
    void testSorted() {
        ObjectIdArray ascending = ObjectIdWidth.UINT8.encode(new int[]{1, 4, 9});
        assertTrue(ascending.isStrictlyAscending());
        assertSame(ascending, ascending.sorted());

        ObjectIdArray shuffled = ObjectIdWidth.UINT8.encode(new int[]{9, 1, 4});
        assertFalse(shuffled.isStrictlyAscending());
        ObjectIdArray fixed = shuffled.sorted();
        assertArrayEquals(new int[]{1, 4, 9}, fixed.toIntArray());
        assertEquals(ObjectIdWidth.UINT8, fixed.width());
    }

    @Test
    @DisplayName("copyInto appends at the requested offset")
    void testCopyInto() {
        int[] target = new int[5];
        int next = ObjectIdWidth.UINT8.encode(new int[]{7, 8}).copyInto(target, 1);
        assertEquals(3, next);
        assertArrayEquals(new int[]{0, 7, 8, 0, 0}, target);
        assertThrows(IndexOutOfBoundsException.class,
                () -> ObjectIdWidth.UINT8.encode(new int[]{1, 2, 3}).copyInto(target, 4));
    }

    @Test
    @DisplayName("Iterator walks the window and then stops")
    void testIterator() {
        IntIterator iterator = ObjectIdWidth.INT32.encode(new int[]{3, 5, 8}).slice(1, 3).iterator();
        assertTrue(iterator.hasNext());
        assertEquals(5, iterator.nextInt());
        assertEquals(8, iterator.nextInt());
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::nextInt);
    }
}
