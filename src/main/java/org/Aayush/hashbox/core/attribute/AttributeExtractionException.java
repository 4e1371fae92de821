package org.Aayush.hashbox.core.attribute;

import lombok.experimental.StandardException;

/**
 * Thrown when an attribute cannot be read from an object.
 */
@StandardException
public class AttributeExtractionException extends RuntimeException {
}
