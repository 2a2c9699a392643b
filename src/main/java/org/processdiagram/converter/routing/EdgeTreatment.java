package org.processdiagram.converter.routing;

import org.processdiagram.converter.bpmn.models.FlowKind;

/**
 * Line treatment hint for the renderer.
 */
public enum EdgeTreatment {
    SOLID,
    MESSAGE,
    ASSOCIATION;

    public static EdgeTreatment of(FlowKind kind) {
        return switch (kind) {
            case SEQUENCE, CONDITIONAL, DEFAULT -> SOLID;
            case MESSAGE -> MESSAGE;
            case ASSOCIATION -> ASSOCIATION;
        };
    }
}
