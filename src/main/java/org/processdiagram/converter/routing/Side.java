package org.processdiagram.converter.routing;

import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.Point;

/**
 * Side of a shape a route leaves or enters through.
 */
public enum Side {
    TOP,
    RIGHT,
    BOTTOM,
    LEFT;

    /**
     * Routes through this side start or end with a horizontal segment.
     */
    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT;
    }

    public Point midpoint(Bounds bounds) {
        return switch (this) {
            case TOP -> new Point(bounds.centerX(), bounds.y());
            case RIGHT -> new Point(bounds.maxX(), bounds.centerY());
            case BOTTOM -> new Point(bounds.centerX(), bounds.maxY());
            case LEFT -> new Point(bounds.x(), bounds.centerY());
        };
    }

    /**
     * Side of {@code bounds} that faces {@code other}: left or right when the point lies beyond
     * the shape horizontally, otherwise top or bottom.
     */
    public static Side facing(Bounds bounds, Point other) {
        if (other.x() > bounds.maxX()) {
            return RIGHT;
        }
        if (other.x() < bounds.x()) {
            return LEFT;
        }
        return other.y() > bounds.centerY() ? BOTTOM : TOP;
    }
}
