package org.Aayush.hashbox.index;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when an {@link AttributeIndex} cannot be built over its object collection.
 *
 * <p>Every failure names a reason code ({@link AttributeIndex#REASON_EXTRACTION_FAILED},
 * {@link AttributeIndex#REASON_UNHASHABLE_VALUE}) and, when one object is to blame, that
 * object's id. The message reads {@code [CODE] object <id>: details}. The build is aborted
 * on the first failing object, so no partial index is ever returned.</p>
 *
 * <p>An object that simply lacks the attribute is not a failure; extractors report it with
 * {@link org.Aayush.hashbox.core.attribute.AttributeExtractor#MISSING}.</p>
 */
@Getter
@Accessors(fluent = true)
public class AttributeIndexException extends RuntimeException {
    /** Object id reported when the failure is not tied to a single object. */
    public static final int NO_OBJECT = -1;

    private final String reasonCode;
    private final int objectId;

    public AttributeIndexException(String reasonCode, String message) {
        this(reasonCode, NO_OBJECT, message, null);
    }

    public AttributeIndexException(String reasonCode, String message, Throwable cause) {
        this(reasonCode, NO_OBJECT, message, cause);
    }

    /**
     * @param reasonCode non-blank reason code.
     * @param objectId id of the offending object, or {@link #NO_OBJECT}.
     * @param message details.
     * @param cause underlying failure, may be {@code null}.
     */
    public AttributeIndexException(String reasonCode, int objectId, String message, Throwable cause) {
        super(formatMessage(reasonCode, objectId, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
        this.objectId = objectId < 0 ? NO_OBJECT : objectId;
    }

    /**
     * Wraps an extractor failure for object {@code objectId}.
     */
    public static AttributeIndexException extractionFailed(int objectId, Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        return new AttributeIndexException(
                AttributeIndex.REASON_EXTRACTION_FAILED,
                objectId,
                "attribute extraction failed: " + cause.getMessage(),
                cause
        );
    }

    public boolean hasObjectId() {
        return objectId != NO_OBJECT;
    }

    private static String formatMessage(String reasonCode, int objectId, String message) {
        String details = Objects.requireNonNull(message, "message");
        String prefix = "[" + requireReasonCode(reasonCode) + "] ";
        return objectId < 0 ? prefix + details : prefix + "object " + objectId + ": " + details;
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
