package org.bpmn2drawio;

/**
 * The input is not well-formed XML or holds no process content.
 */
public class MalformedInputException extends ConversionException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
