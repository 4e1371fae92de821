package org.Aayush.hashbox.core.attribute;

/**
 * Marker returned by an {@link AttributeExtractor} when an object does not carry the attribute.
 *
 * <p>Distinct from {@code null}, which is an ordinary indexable value. Objects yielding this
 * marker are left out of the index but keep their object id.</p>
 */
public enum MissingAttribute {
    INSTANCE;

    @Override
    public String toString() {
        return "<missing>";
    }
}
