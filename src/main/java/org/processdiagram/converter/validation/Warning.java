package org.processdiagram.converter.validation;

/**
 * A non-fatal finding produced anywhere in the pipeline.
 *
 * @param severity  how bad it is
 * @param code      machine readable category
 * @param elementId id of the element, container or flow concerned, or null for document level findings
 * @param message   human readable description
 */
public record Warning(Severity severity, WarningCode code, String elementId, String message) {

    public static Warning info(WarningCode code, String elementId, String message) {
        return new Warning(Severity.INFO, code, elementId, message);
    }

    public static Warning warning(WarningCode code, String elementId, String message) {
        return new Warning(Severity.WARNING, code, elementId, message);
    }

    public static Warning error(WarningCode code, String elementId, String message) {
        return new Warning(Severity.RECOVERABLE_ERROR, code, elementId, message);
    }
}
