package org.Aayush.hashbox.index;

import java.util.Objects;

/**
 * Test value whose hash is chosen by the test, so distinct keys can be forced to collide.
 */
final class CollidingKey {
    private final String name;
    private final int hash;

    CollidingKey(String name, int hash) {
        this.name = name;
        this.hash = hash;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CollidingKey)) {
            return false;
        }
        CollidingKey that = (CollidingKey) other;
        return hash == that.hash && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return name + "#" + hash;
    }

    static CollidingKey of(String name, int hash) {
        return new CollidingKey(Objects.requireNonNull(name), hash);
    }
}
