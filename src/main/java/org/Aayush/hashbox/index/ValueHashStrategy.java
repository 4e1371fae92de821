package org.Aayush.hashbox.index;

import it.unimi.dsi.fastutil.Hash;
import org.Aayush.hashbox.core.hash.ValueHasher;

import java.util.Objects;

/**
 * fastutil hash strategy that keys custom hash maps on the index's {@link ValueHasher}
 * instead of {@link Object#hashCode()}.
 *
 * <p>The 64-bit hash is folded to 32 bits. Equality is {@link Objects#equals(Object, Object)},
 * so {@code null} keys are supported.</p>
 */
final class ValueHashStrategy implements Hash.Strategy<Object> {
    private final ValueHasher hasher;

    ValueHashStrategy(ValueHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    @Override
    public int hashCode(Object value) {
        long hash = hasher.hash(value);
        return (int) (hash ^ (hash >>> 32));
    }

    @Override
    public boolean equals(Object left, Object right) {
        return Objects.equals(left, right);
    }
}
