package org.Aayush.hashbox.index;

import lombok.Builder;
import lombok.Value;
import org.Aayush.hashbox.core.hash.ValueHasher;
import org.Aayush.hashbox.core.id.ObjectIdWidth;

import java.util.Objects;

/**
 * Build-time configuration for one {@link AttributeIndex}.
 */
@Value
@Builder(toBuilder = true)
public class AttributeIndexConfig {

    /**
     * Default cardinality threshold. Bounds the worst-case scan inside one hash bucket.
     */
    public static final int DEFAULT_CARDINALITY_THRESHOLD = 256;

    private static final AttributeIndexConfig DEFAULTS = AttributeIndexConfig.builder().build();

    /**
     * Values shared by more than this many objects get a direct lookup entry.
     * A value with exactly this many objects stays in the hash-bucketed region.
     */
    @Builder.Default
    int cardinalityThreshold = DEFAULT_CARDINALITY_THRESHOLD;

    /**
     * Hash function for attribute values.
     */
    @Builder.Default
    ValueHasher hasher = ValueHasher.standard();

    /**
     * Forced identifier width. {@code null} picks the narrowest width for the object count.
     */
    ObjectIdWidth idWidth;

    /**
     * Returns the all-defaults configuration.
     */
    public static AttributeIndexConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns defaults with a custom cardinality threshold.
     */
    public static AttributeIndexConfig withCardinalityThreshold(int cardinalityThreshold) {
        return DEFAULTS.toBuilder().cardinalityThreshold(cardinalityThreshold).build();
    }

    /**
     * Validates option ranges.
     *
     * @throws IllegalArgumentException when the threshold is negative.
     */
    void validate() {
        if (cardinalityThreshold < 0) {
            throw new IllegalArgumentException("cardinalityThreshold must be >= 0, got " + cardinalityThreshold);
        }
        Objects.requireNonNull(hasher, "hasher");
    }

    /**
     * Resolves the identifier width for a collection of {@code objectCount} objects.
     *
     * @throws IllegalArgumentException when a forced width cannot address every object.
     */
    ObjectIdWidth resolveIdWidth(int objectCount) {
        if (idWidth == null) {
            return ObjectIdWidth.forObjectCount(objectCount);
        }
        if (!idWidth.canRepresent(objectCount)) {
            throw new IllegalArgumentException(
                    "idWidth " + idWidth + " cannot address " + objectCount + " objects (max id " + idWidth.maxId() + ")");
        }
        return idWidth;
    }
}
