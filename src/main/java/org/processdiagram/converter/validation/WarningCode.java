package org.processdiagram.converter.validation;

public enum WarningCode {
    UNRESOLVED_REFERENCE,
    ORPHAN_ELEMENT,
    MISSING_CONDITION,
    LAYOUT_DEGRADED,
    ROUTING_FALLBACK,
    PARTIAL_GEOMETRY,
    UNSUPPORTED_KIND,
    NO_START_EVENT,
    NO_END_EVENT,
    DISCONNECTED,
    MISSING_LABEL,
    SCHEMA_VIOLATION,
    GEOMETRY_CORRECTED,
    OVERLAP
}
