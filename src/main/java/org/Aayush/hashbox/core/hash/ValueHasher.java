package org.Aayush.hashbox.core.hash;

import java.util.Objects;

/**
 * Maps attribute values to 64-bit hashes used to order and bucket index entries.
 *
 * <p>Contract: values that are equal under {@link Object#equals(Object)} must hash equal, and a
 * value's hash must not change while an index built with it is alive. Unequal values may collide.
 * Violations are not detected at runtime; lookups silently miss.</p>
 */
@FunctionalInterface
public interface ValueHasher {

    /**
     * Default hasher: sign-extended {@link Objects#hashCode(Object)}, so {@code null} hashes to 0.
     */
    ValueHasher STANDARD = value -> Objects.hashCode(value);

    /**
     * Computes the hash for one value.
     *
     * @param value attribute value, possibly {@code null}.
     * @return 64-bit hash.
     */
    long hash(Object value);

    /**
     * Returns the default {@link #STANDARD} hasher.
     */
    static ValueHasher standard() {
        return STANDARD;
    }
}
