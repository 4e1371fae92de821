package org.Aayush.hashbox.index;

/**
 * Thrown when an extracted value has no usable hash/equality contract.
 *
 * <p>Raised for Java arrays (identity equality) and for values the configured hasher rejects.</p>
 */
public final class UnhashableValueException extends AttributeIndexException {

    public UnhashableValueException(String message) {
        super(AttributeIndex.REASON_UNHASHABLE_VALUE, message);
    }

    public UnhashableValueException(String message, Throwable cause) {
        super(AttributeIndex.REASON_UNHASHABLE_VALUE, message, cause);
    }

    public UnhashableValueException(int objectId, String message, Throwable cause) {
        super(AttributeIndex.REASON_UNHASHABLE_VALUE, objectId, message, cause);
    }
}
