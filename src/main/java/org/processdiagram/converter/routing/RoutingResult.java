package org.processdiagram.converter.routing;

import org.processdiagram.converter.validation.Warning;

import java.util.List;

public record RoutingResult(List<Route> routes, List<Warning> warnings) {
}
