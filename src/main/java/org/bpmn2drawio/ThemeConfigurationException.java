package org.bpmn2drawio;

/**
 * Unknown theme name, or a theme override document that cannot be read or
 * does not match the override schema.
 */
public class ThemeConfigurationException extends ConversionException {

    public ThemeConfigurationException(String message) {
        super(message);
    }

    public ThemeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
