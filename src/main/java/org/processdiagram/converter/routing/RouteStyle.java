package org.processdiagram.converter.routing;

public enum RouteStyle {
    ORTHOGONAL,
    SELF_LOOP,
    PRESERVED,
    STRAIGHT_FALLBACK
}
