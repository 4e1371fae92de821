package org.Aayush.hashbox.index;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenCustomHashMap;
import org.Aayush.hashbox.core.attribute.AttributeExtractor;
import org.Aayush.hashbox.core.hash.ValueHasher;
import org.Aayush.hashbox.core.id.ObjectIdArray;
import org.Aayush.hashbox.core.id.ObjectIdWidth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable lookup structure for one attribute over a frozen object collection.
 *
 * <p>Answers "which objects have value V?" for value types that only support hashing and
 * equality. Object ids are positions in the source list; the index keeps no reference to
 * the objects themselves.</p>
 *
 * <p>Storage is split once at build time:</p>
 * <ul>
 * <li>values shared by more than {@code cardinalityThreshold} objects get a direct
 * value-to-ids entry with ids pre-sorted;</li>
 * <li>everything else lives in a {@link CollisionBucketedIndex}, absent when empty.</li>
 * </ul>
 * <p>Lifting large values out of the buckets keeps a lookup for a rare value from scanning
 * through a popular value that happens to share its hash.</p>
 *
 * <p>Thread Safety: immutable after construction, safe for concurrent readers.</p>
 */
public final class AttributeIndex {
    public static final String REASON_EXTRACTION_FAILED = "ATTR_EXTRACTION_FAILED";
    public static final String REASON_UNHASHABLE_VALUE = "ATTR_UNHASHABLE_VALUE";

    private static final Logger log = LoggerFactory.getLogger(AttributeIndex.class);

    private final int objectCount;
    private final int cardinalityThreshold;
    private final ObjectIdWidth idWidth;
    private final ValueHasher hasher;
    private final Object2ObjectOpenCustomHashMap<Object, ObjectIdArray> idsByHighCardinalityValue;
    private final CollisionBucketedIndex bucketed; // null when every value is high-cardinality
    private final int size;

    private AttributeIndex(
            int objectCount,
            int cardinalityThreshold,
            ObjectIdWidth idWidth,
            ValueHasher hasher,
            Object2ObjectOpenCustomHashMap<Object, ObjectIdArray> idsByHighCardinalityValue,
            CollisionBucketedIndex bucketed
    ) {
        this.objectCount = objectCount;
        this.cardinalityThreshold = cardinalityThreshold;
        this.idWidth = idWidth;
        this.hasher = hasher;
        this.idsByHighCardinalityValue = idsByHighCardinalityValue;
        this.bucketed = bucketed;
        this.size = computeSize(idsByHighCardinalityValue, bucketed);
    }

    /**
     * Builds an index with {@link AttributeIndexConfig#defaults()}.
     *
     * @see #build(List, AttributeExtractor, AttributeIndexConfig)
     */
    public static <T> AttributeIndex build(List<? extends T> objects, AttributeExtractor<? super T> extractor) {
        return build(objects, extractor, AttributeIndexConfig.defaults());
    }

    /**
     * Builds an index over {@code objects}; object id {@code i} is {@code objects.get(i)}.
     *
     * @param objects frozen object collection.
     * @param extractor attribute extractor applied once per object.
     * @param config threshold, hasher and id width options.
     * @return immutable index.
     * @throws AttributeIndexException when a value cannot be extracted.
     * @throws UnhashableValueException when a value has no usable hash/equality contract.
     * @throws IllegalArgumentException on invalid configuration.
     */
    public static <T> AttributeIndex build(
            List<? extends T> objects,
            AttributeExtractor<? super T> extractor,
            AttributeIndexConfig config
    ) {
        Objects.requireNonNull(objects, "objects");
        Objects.requireNonNull(extractor, "extractor");
        Objects.requireNonNull(config, "config");
        config.validate();

        int n = objects.size();
        int threshold = config.getCardinalityThreshold();
        ObjectIdWidth width = config.resolveIdWidth(n);
        ValueHasher hasher = config.getHasher();

        ValueHashStrategy strategy = new ValueHashStrategy(hasher);

        HashSortedEntries entries = HashSortSupport.hashSort(objects, extractor, hasher);
        HashSortSupport.groupByValue(entries, strategy);
        RunLengthEncoding valueRuns = RunLengthEncoding.of(entries.values);

        // keyed on the configured hasher so direct hits agree with bucket lookups
        Object2ObjectOpenCustomHashMap<Object, ObjectIdArray> direct = new Object2ObjectOpenCustomHashMap<>(strategy);
        int present = entries.length();
        boolean[] remaining = new boolean[present];
        Arrays.fill(remaining, true);
        int remainingCount = present;
        for (int run = 0; run < valueRuns.runCount(); run++) {
            int length = valueRuns.length(run);
            if (length <= threshold) {
                continue;
            }
            int start = valueRuns.start(run);
            int end = valueRuns.end(run);
            int[] ids = Arrays.copyOfRange(entries.objectIds, start, end);
            Arrays.sort(ids);
            direct.put(entries.values[start], width.encode(ids));
            Arrays.fill(remaining, start, end, false);
            remainingCount -= length;
        }
        direct.trim();

        CollisionBucketedIndex bucketed;
        if (remainingCount == 0) {
            bucketed = null;
        } else if (remainingCount == present) {
            bucketed = CollisionBucketedIndex.build(entries, width);
        } else {
            bucketed = CollisionBucketedIndex.build(entries.compact(remaining, remainingCount), width);
        }

        AttributeIndex index = new AttributeIndex(n, threshold, width, hasher, direct, bucketed);
        if (log.isDebugEnabled()) {
            log.debug("Built attribute index: {}", index.stats());
        }
        if (present < n) {
            log.debug("{} of {} object(s) carry no value for the attribute and were not indexed", n - present, n);
        }
        if (bucketed != null && bucketed.collidingBucketCount() > 0) {
            log.debug("{} hash bucket(s) hold colliding values; largest bucket has {} entries",
                    bucketed.collidingBucketCount(), bucketed.maxBucketSize());
        }
        return index;
    }

    /**
     * Returns ids of objects whose attribute equals {@code value}.
     *
     * <p>Never throws for unknown values; absence yields an empty sequence. A value the
     * configured hasher rejects cannot be indexed either, so it is absent too.</p>
     *
     * @param value lookup value, may be {@code null}.
     * @return strictly ascending ids.
     */
    public ObjectIdArray get(Object value) {
        ObjectIdArray ids = lookup(value);
        return ids == null ? idWidth.emptySequence() : ids;
    }

    /**
     * Returns true when at least one object carries {@code value}.
     */
    public boolean contains(Object value) {
        ObjectIdArray ids = lookup(value);
        return ids != null && !ids.isEmpty();
    }

    private ObjectIdArray lookup(Object value) {
        long valueHash;
        try {
            valueHash = hasher.hash(value);
        } catch (RuntimeException e) {
            log.debug("Hasher rejected lookup value {}; treating it as absent", value, e);
            return null;
        }
        ObjectIdArray direct = idsByHighCardinalityValue.get(value);
        if (direct != null) {
            // stored sorted at build time
            return direct;
        }
        if (bucketed == null) {
            return null;
        }
        return bucketed.get(value, valueHash).sorted();
    }

    /**
     * Returns ids of every object with a value for this attribute.
     *
     * @return strictly ascending ids.
     */
    public ObjectIdArray getAll() {
        if (size == 0) {
            return idWidth.emptySequence();
        }
        int[] all = new int[size];
        int cursor = 0;
        if (bucketed != null) {
            cursor = bucketed.allObjectIds().copyInto(all, cursor);
        }
        for (ObjectIdArray ids : idsByHighCardinalityValue.values()) {
            cursor = ids.copyInto(all, cursor);
        }
        // the two regions are disjoint, so sorting the concatenation leaves no duplicates
        Arrays.sort(all);
        return idWidth.encode(all);
    }

    /**
     * Number of indexed (object, value) associations. Zero-safe when the bucketed region is absent.
     */
    public int size() {
        return size;
    }

    /**
     * Number of objects the index was built over, including objects without the attribute.
     */
    public int objectCount() {
        return objectCount;
    }

    public ObjectIdWidth idWidth() {
        return idWidth;
    }

    public int cardinalityThreshold() {
        return cardinalityThreshold;
    }

    /**
     * Number of values stored in the direct lookup mapping.
     */
    public int highCardinalityValueCount() {
        return idsByHighCardinalityValue.size();
    }

    /**
     * Returns true when at least one value lives in the hash-bucketed region.
     */
    public boolean hasBucketedRegion() {
        return bucketed != null;
    }

    /**
     * Type-consistent empty result for this index's id width.
     */
    public ObjectIdArray emptyIds() {
        return idWidth.emptySequence();
    }

    /**
     * Snapshot of the storage layout.
     */
    public AttributeIndexStats stats() {
        int bucketedDistinct = bucketed == null ? 0 : bucketed.distinctValueCount();
        return AttributeIndexStats.builder()
                .objectCount(objectCount)
                .size(size)
                .distinctValueCount(idsByHighCardinalityValue.size() + bucketedDistinct)
                .highCardinalityValueCount(idsByHighCardinalityValue.size())
                .bucketedEntryCount(bucketed == null ? 0 : bucketed.size())
                .uniqueHashCount(bucketed == null ? 0 : bucketed.uniqueHashCount())
                .collidingBucketCount(bucketed == null ? 0 : bucketed.collidingBucketCount())
                .maxBucketSize(bucketed == null ? 0 : bucketed.maxBucketSize())
                .cardinalityThreshold(cardinalityThreshold)
                .idWidth(idWidth)
                .build();
    }

    CollisionBucketedIndex bucketedRegion() {
        return bucketed;
    }

    private static int computeSize(
            Object2ObjectOpenCustomHashMap<Object, ObjectIdArray> idsByHighCardinalityValue,
            CollisionBucketedIndex bucketed
    ) {
        int total = bucketed == null ? 0 : bucketed.size();
        for (ObjectIdArray ids : idsByHighCardinalityValue.values()) {
            total += ids.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format("AttributeIndex[objects=%d, size=%d, highCardinality=%d, bucketed=%d, width=%s]",
                objectCount, size, idsByHighCardinalityValue.size(),
                bucketed == null ? 0 : bucketed.size(), idWidth);
    }
}
