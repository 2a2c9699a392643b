package org.processdiagram.converter.routing;

import lombok.extern.slf4j.Slf4j;
import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.Container;
import org.processdiagram.converter.bpmn.models.Flow;
import org.processdiagram.converter.bpmn.models.NodeRef;
import org.processdiagram.converter.bpmn.models.Point;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.config.ConverterConfig;
import org.processdiagram.converter.config.RoutingSettings;
import org.processdiagram.converter.layout.LayoutMode;
import org.processdiagram.converter.validation.Warning;
import org.processdiagram.converter.validation.WarningCode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes orthogonal waypoints for every flow of a laid-out document.
 * <p>
 * Rendered pools and subprocesses are obstacles unless they contain one of the endpoints. Lanes and
 * individual shapes are not. A flow whose endpoints sit more than one container apart is routed in
 * pieces through gate points on the outermost container boundaries.
 */
@Slf4j
public class EdgeRouter {
    private static final double EPSILON = 0.5;
    private static final List<Side[]> ALTERNATIVE_SIDES = List.of(
            new Side[]{Side.RIGHT, Side.LEFT},
            new Side[]{Side.BOTTOM, Side.TOP},
            new Side[]{Side.TOP, Side.BOTTOM},
            new Side[]{Side.LEFT, Side.RIGHT});

    private final RoutingSettings settings;

    public EdgeRouter(ConverterConfig config) {
        this.settings = config.routing;
    }

    /**
     * Routes all flows in document order.
     *
     * @param document a document whose bounds have been resolved
     * @param mode     the layout mode that was applied; preserve keeps the source waypoints
     */
    public RoutingResult route(ProcessDocument document, LayoutMode mode) {
        List<Route> routes = new ArrayList<>();
        List<Warning> warnings = new ArrayList<>();
        for (Flow flow : document.flows()) {
            routes.add(routeFlow(document, flow, mode, warnings));
        }
        log.debug("Routed {} flows with {} fallbacks", routes.size(), warnings.size());
        return new RoutingResult(routes, warnings);
    }

    private Route routeFlow(ProcessDocument document, Flow flow, LayoutMode mode, List<Warning> warnings) {
        EdgeTreatment treatment = EdgeTreatment.of(flow.getKind());
        if (mode == LayoutMode.PRESERVE && flow.getSourceWaypoints().size() >= 2) {
            return new Route(flow.getId(), List.copyOf(flow.getSourceWaypoints()), RouteStyle.PRESERVED, treatment);
        }

        Bounds source = document.bounds(flow.getSource());
        Bounds target = document.bounds(flow.getTarget());
        if (flow.isSelfLoop()) {
            return new Route(flow.getId(), selfLoop(source), RouteStyle.SELF_LOOP, treatment);
        }

        List<Bounds> obstacles = obstaclesFor(document, flow.getSource(), flow.getTarget());
        List<Integer> sourceOnly = exclusiveContainers(document, flow.getSource(), flow.getTarget());
        List<Integer> targetOnly = exclusiveContainers(document, flow.getTarget(), flow.getSource());
        int[] attempts = {settings.maxAttempts};

        List<Point> path;
        if (sourceOnly.size() + targetOnly.size() > 1) {
            path = stitched(document, source, target, sourceOnly, targetOnly, obstacles, attempts);
        } else {
            path = routeBetween(source, target, obstacles, attempts);
        }

        if (path == null) {
            log.warn("No clear path for flow '{}' within {} attempts, drawing a straight line",
                    flow.getId(), settings.maxAttempts);
            warnings.add(Warning.warning(WarningCode.ROUTING_FALLBACK, flow.getId(),
                    "Flow '" + flow.getId() + "' could not be routed around obstacles and is drawn straight"));
            Point start = Side.facing(source, target.center()).midpoint(source);
            Point end = Side.facing(target, source.center()).midpoint(target);
            return new Route(flow.getId(), List.of(start, end), RouteStyle.STRAIGHT_FALLBACK, treatment);
        }
        return new Route(flow.getId(), simplify(path), RouteStyle.ORTHOGONAL, treatment);
    }

    /**
     * Leaves through the right side and comes back through the top, at a fixed offset.
     */
    List<Point> selfLoop(Bounds bounds) {
        double offset = settings.selfLoopOffset;
        return List.of(
                new Point(bounds.maxX(), bounds.centerY()),
                new Point(bounds.maxX() + offset, bounds.centerY()),
                new Point(bounds.maxX() + offset, bounds.y() - offset),
                new Point(bounds.centerX(), bounds.y() - offset),
                new Point(bounds.centerX(), bounds.y()));
    }

    /**
     * Routes source to gate, gate to gate, and gate to target, then joins the pieces.
     */
    private List<Point> stitched(ProcessDocument document, Bounds source, Bounds target,
                                 List<Integer> sourceOnly, List<Integer> targetOnly,
                                 List<Bounds> obstacles, int[] attempts) {
        List<Bounds> stops = new ArrayList<>();
        stops.add(source);
        if (!sourceOnly.isEmpty()) {
            Bounds outer = document.container(sourceOnly.get(sourceOnly.size() - 1)).getBounds();
            stops.add(gate(outer, source.center(), target.center()));
        }
        if (!targetOnly.isEmpty()) {
            Bounds outer = document.container(targetOnly.get(targetOnly.size() - 1)).getBounds();
            stops.add(gate(outer, target.center(), source.center()));
        }
        stops.add(target);

        List<Point> joined = new ArrayList<>();
        for (int i = 0; i + 1 < stops.size(); i++) {
            List<Point> piece = routeBetween(stops.get(i), stops.get(i + 1), obstacles, attempts);
            if (piece == null) {
                return null;
            }
            if (!joined.isEmpty()) {
                piece = piece.subList(1, piece.size());
            }
            joined.addAll(piece);
        }
        return joined;
    }

    /**
     * Zero-size box on the side of {@code container} facing {@code away}, aligned with {@code inside}
     * so the inner piece can leave straight.
     */
    private static Bounds gate(Bounds container, Point inside, Point away) {
        Side side = Side.facing(container, away);
        double x = clamp(inside.x(), container.x(), container.maxX());
        double y = clamp(inside.y(), container.y(), container.maxY());
        return switch (side) {
            case TOP -> new Bounds(x, container.y(), 0, 0);
            case BOTTOM -> new Bounds(x, container.maxY(), 0, 0);
            case LEFT -> new Bounds(container.x(), y, 0, 0);
            case RIGHT -> new Bounds(container.maxX(), y, 0, 0);
        };
    }

    /**
     * Tries the facing sides, then alternative side pairs, then detours around the obstacles in the way.
     *
     * @return the path, or null when every attempt is blocked or the attempts ran out
     */
    private List<Point> routeBetween(Bounds source, Bounds target, List<Bounds> obstacles, int[] attempts) {
        Set<List<Side>> pairs = new LinkedHashSet<>();
        pairs.add(List.of(Side.facing(source, target.center()), Side.facing(target, source.center())));
        for (Side[] pair : ALTERNATIVE_SIDES) {
            if (pairs.size() == 4) {
                break;
            }
            pairs.add(List.of(pair));
        }

        List<Point> preferred = null;
        for (List<Side> pair : pairs) {
            if (attempts[0]-- <= 0) {
                return null;
            }
            List<Point> path = orthogonal(source, pair.get(0), target, pair.get(1));
            if (preferred == null) {
                preferred = path;
            }
            if (blockers(path, obstacles).isEmpty()) {
                return path;
            }
        }

        // Detour around everything the preferred path ran into
        Set<Bounds> blocking = new LinkedHashSet<>(blockers(preferred, obstacles));
        while (attempts[0] > 0 && !blocking.isEmpty()) {
            Bounds area = union(blocking).inflate(settings.clearance);
            List<List<Point>> channels = new ArrayList<>(List.of(
                    horizontalChannel(source, target, area.y()),
                    horizontalChannel(source, target, area.maxY()),
                    verticalChannel(source, target, area.x()),
                    verticalChannel(source, target, area.maxX())));
            channels.sort(Comparator.comparingDouble(EdgeRouter::length));

            boolean grew = false;
            for (List<Point> channel : channels) {
                if (attempts[0]-- <= 0) {
                    return null;
                }
                List<Bounds> hit = blockers(channel, obstacles);
                if (hit.isEmpty()) {
                    return channel;
                }
                grew |= blocking.addAll(hit);
            }
            if (!grew) {
                return null;
            }
        }
        return null;
    }

    /**
     * Side midpoint to side midpoint with one bend (mixed sides) or two bends (parallel sides).
     */
    static List<Point> orthogonal(Bounds source, Side exit, Bounds target, Side entry) {
        Point start = exit.midpoint(source);
        Point end = entry.midpoint(target);
        if (start.x() == end.x() || start.y() == end.y()) {
            return List.of(start, end);
        }
        if (exit.isHorizontal() && entry.isHorizontal()) {
            double midX = (start.x() + end.x()) / 2;
            return List.of(start, new Point(midX, start.y()), new Point(midX, end.y()), end);
        }
        if (!exit.isHorizontal() && !entry.isHorizontal()) {
            double midY = (start.y() + end.y()) / 2;
            return List.of(start, new Point(start.x(), midY), new Point(end.x(), midY), end);
        }
        if (exit.isHorizontal()) {
            return List.of(start, new Point(end.x(), start.y()), end);
        }
        return List.of(start, new Point(start.x(), end.y()), end);
    }

    /**
     * Detour along the line {@code y}. An endpoint whose own span contains the line is left or entered
     * through its side wall, so the detour never runs through the endpoint itself.
     */
    static List<Point> horizontalChannel(Bounds source, Bounds target, double y) {
        List<Point> path = new ArrayList<>();
        if (y > source.y() && y < source.maxY()) {
            path.add(new Point(target.centerX() < source.centerX() ? source.x() : source.maxX(), y));
        } else {
            Point start = (y < source.centerY() ? Side.TOP : Side.BOTTOM).midpoint(source);
            path.add(start);
            path.add(new Point(start.x(), y));
        }
        if (y > target.y() && y < target.maxY()) {
            path.add(new Point(source.centerX() < target.centerX() ? target.x() : target.maxX(), y));
        } else {
            Point end = (y < target.centerY() ? Side.TOP : Side.BOTTOM).midpoint(target);
            path.add(new Point(end.x(), y));
            path.add(end);
        }
        return path;
    }

    /**
     * Detour along the line {@code x}, entering an endpoint through its top or bottom when its span contains the line.
     */
    static List<Point> verticalChannel(Bounds source, Bounds target, double x) {
        List<Point> path = new ArrayList<>();
        if (x > source.x() && x < source.maxX()) {
            path.add(new Point(x, target.centerY() < source.centerY() ? source.y() : source.maxY()));
        } else {
            Point start = (x < source.centerX() ? Side.LEFT : Side.RIGHT).midpoint(source);
            path.add(start);
            path.add(new Point(x, start.y()));
        }
        if (x > target.x() && x < target.maxX()) {
            path.add(new Point(x, source.centerY() < target.centerY() ? target.y() : target.maxY()));
        } else {
            Point end = (x < target.centerX() ? Side.LEFT : Side.RIGHT).midpoint(target);
            path.add(new Point(x, end.y()));
            path.add(end);
        }
        return path;
    }

    /**
     * Rendered pools and subprocesses that enclose neither endpoint and are not endpoints themselves.
     */
    private static List<Bounds> obstaclesFor(ProcessDocument document, NodeRef source, NodeRef target) {
        List<Integer> sourceAncestors = document.ancestors(source);
        List<Integer> targetAncestors = document.ancestors(target);
        List<Bounds> obstacles = new ArrayList<>();
        for (int i = 0; i < document.containers().size(); i++) {
            Container container = document.container(i);
            if (container.isSynthetic() || container.isLane() || container.getBounds() == null) {
                continue;
            }
            NodeRef ref = NodeRef.container(i);
            if (ref.equals(source) || ref.equals(target)
                    || sourceAncestors.contains(i) || targetAncestors.contains(i)) {
                continue;
            }
            obstacles.add(container.getBounds());
        }
        return obstacles;
    }

    /**
     * Rendered pools and subprocesses around {@code node} that do not also enclose {@code other},
     * nearest first.
     */
    static List<Integer> exclusiveContainers(ProcessDocument document, NodeRef node, NodeRef other) {
        List<Integer> otherAncestors = document.ancestors(other);
        List<Integer> result = new ArrayList<>();
        for (int ancestor : document.ancestors(node)) {
            Container container = document.container(ancestor);
            boolean boundary = !container.isSynthetic() && !container.isLane();
            boolean enclosesOther = otherAncestors.contains(ancestor)
                    || (other.isContainer() && other.index() == ancestor);
            if (boundary && !enclosesOther) {
                result.add(ancestor);
            }
        }
        return result;
    }

    private static List<Bounds> blockers(List<Point> path, List<Bounds> obstacles) {
        List<Bounds> hit = new ArrayList<>();
        for (Bounds obstacle : obstacles) {
            for (int i = 0; i + 1 < path.size(); i++) {
                if (crosses(path.get(i), path.get(i + 1), obstacle)) {
                    hit.add(obstacle);
                    break;
                }
            }
        }
        return hit;
    }

    /**
     * True when an axis-parallel segment passes through the interior of the box.
     */
    static boolean crosses(Point a, Point b, Bounds box) {
        double minX = Math.min(a.x(), b.x());
        double maxX = Math.max(a.x(), b.x());
        double minY = Math.min(a.y(), b.y());
        double maxY = Math.max(a.y(), b.y());
        return maxX > box.x() + EPSILON && minX < box.maxX() - EPSILON
                && maxY > box.y() + EPSILON && minY < box.maxY() - EPSILON;
    }

    /**
     * Drops repeated points and points in the middle of a straight run.
     */
    static List<Point> simplify(List<Point> path) {
        List<Point> result = new ArrayList<>();
        for (Point point : path) {
            if (!result.isEmpty() && result.get(result.size() - 1).equals(point)) {
                continue;
            }
            if (result.size() >= 2) {
                Point a = result.get(result.size() - 2);
                Point b = result.get(result.size() - 1);
                boolean collinear = (a.x() == b.x() && b.x() == point.x()) || (a.y() == b.y() && b.y() == point.y());
                if (collinear) {
                    result.set(result.size() - 1, point);
                    continue;
                }
            }
            result.add(point);
        }
        return result;
    }

    private static Bounds union(Set<Bounds> boxes) {
        Bounds result = null;
        for (Bounds box : boxes) {
            result = result == null ? box : result.union(box);
        }
        return result;
    }

    private static double length(List<Point> path) {
        double total = 0;
        for (int i = 0; i + 1 < path.size(); i++) {
            total += Math.abs(path.get(i + 1).x() - path.get(i).x()) + Math.abs(path.get(i + 1).y() - path.get(i).y());
        }
        return total;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
