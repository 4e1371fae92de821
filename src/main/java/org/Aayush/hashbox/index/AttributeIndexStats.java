package org.Aayush.hashbox.index;

import lombok.Builder;
import lombok.Value;
import org.Aayush.hashbox.core.id.ObjectIdWidth;

/**
 * Immutable layout snapshot of one {@link AttributeIndex}.
 */
@Value
@Builder
public class AttributeIndexStats {

    /**
     * Number of objects the index was built over.
     */
    int objectCount;

    /**
     * Indexed (object, value) associations. Equals {@link AttributeIndex#size()}.
     */
    int size;

    /**
     * Distinct values across both storage regions.
     */
    int distinctValueCount;

    /**
     * Values held in the direct lookup mapping.
     */
    int highCardinalityValueCount;

    /**
     * Entries held in the hash-bucketed region.
     */
    int bucketedEntryCount;

    /**
     * Unique hashes in the bucket directory.
     */
    int uniqueHashCount;

    /**
     * Buckets holding more than one distinct value.
     */
    int collidingBucketCount;

    /**
     * Largest bucket length, the worst-case scan of one lookup.
     */
    int maxBucketSize;

    int cardinalityThreshold;

    ObjectIdWidth idWidth;
}
