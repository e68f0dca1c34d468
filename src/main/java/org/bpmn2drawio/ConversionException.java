package org.bpmn2drawio;

/**
 * Base of all fatal conversion failures. The message is meant to be shown to
 * the user as is.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
