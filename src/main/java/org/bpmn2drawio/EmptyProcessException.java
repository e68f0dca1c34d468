package org.bpmn2drawio;

public class EmptyProcessException extends ConversionException {

    public EmptyProcessException(String message) {
        super(message);
    }
}
