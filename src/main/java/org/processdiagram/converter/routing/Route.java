package org.processdiagram.converter.routing;

import org.processdiagram.converter.bpmn.models.Point;

import java.util.List;

/**
 * Absolute waypoints of one flow, from the source boundary to the target boundary.
 */
public record Route(String flowId, List<Point> waypoints, RouteStyle style, EdgeTreatment treatment) {
}
