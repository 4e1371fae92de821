package org.Aayush.hashbox.core.attribute;

import java.util.Objects;
import java.util.function.Function;

/**
 * Produces the indexed attribute value for one object.
 *
 * <p>An attribute is either derived by a function or read by name. Returned values only need a
 * stable {@code equals}/{@code hashCode} pair; they are never ordered.</p>
 *
 * @param <T> object type.
 */
@FunctionalInterface
public interface AttributeExtractor<T> {

    /**
     * Value to return when the object has no such attribute. The object is then not indexed.
     */
    Object MISSING = MissingAttribute.INSTANCE;

    /**
     * Returns the attribute value of {@code object}, possibly {@code null}, or {@link #MISSING}
     * when the object does not carry the attribute.
     *
     * @throws AttributeExtractionException if the attribute exists but reading it fails.
     */
    Object extract(T object);

    /**
     * Wraps a derivation function.
     */
    static <T> AttributeExtractor<T> of(Function<? super T, ?> function) {
        Objects.requireNonNull(function, "function");
        return function::apply;
    }

    /**
     * Reads a named attribute.
     *
     * <p>Resolution order per object class: {@link java.util.Map} key, public no-arg accessor
     * {@code name()}, bean getter {@code getName()} / {@code isName()}, public field.
     * A {@code null} object, an absent map key or a class with none of these yields {@link #MISSING}.</p>
     *
     * @param name attribute name, non-blank.
     */
    static <T> AttributeExtractor<T> field(String name) {
        return new NamedAttributeExtractor<>(name);
    }
}
