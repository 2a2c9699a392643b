package org.processdiagram.converter.bpmn;

/**
 * The source is not a BPMN 2.0 document the converter can work with.
 * This is the only error that stops a conversion.
 */
public class MalformedSourceException extends RuntimeException {

    public MalformedSourceException(String message) {
        super(message);
    }

    public MalformedSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
