package org.processdiagram.converter.generator;

import lombok.extern.slf4j.Slf4j;
import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.Container;
import org.processdiagram.converter.bpmn.models.Element;
import org.processdiagram.converter.bpmn.models.Flow;
import org.processdiagram.converter.bpmn.models.LoopType;
import org.processdiagram.converter.bpmn.models.NodeRef;
import org.processdiagram.converter.bpmn.models.Point;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.routing.Route;
import org.processdiagram.converter.validation.Warning;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a laid-out, routed document into an ordered list of cells.
 * <p>
 * Cells come in containment pre-order: a container before its children, decorations right after
 * their shape, and all edges last. Synthetic containers produce no cell; their children hang off the
 * nearest rendered ancestor instead.
 */
@Slf4j
public class DiagramGenerator {
    private static final double TASK_ICON_INSET = 5;
    private static final double LOOP_MARKER_INSET = 2;

    private final StyleLookup styles;
    private final String theme;

    public DiagramGenerator(StyleLookup styles, String theme) {
        this.styles = styles;
        this.theme = theme;
    }

    /**
     * @param document laid-out document
     * @param routes   one route per flow, in document flow order
     * @param warnings warnings to attach to the cells they name
     */
    public List<DiagramCell> generate(ProcessDocument document, List<Route> routes, List<Warning> warnings) {
        Map<String, List<Warning>> warningsById = new HashMap<>();
        for (Warning warning : warnings) {
            if (warning.elementId() != null) {
                warningsById.computeIfAbsent(warning.elementId(), id -> new ArrayList<>()).add(warning);
            }
        }

        List<DiagramCell> cells = new ArrayList<>();
        for (int pool : document.pools()) {
            emitContainer(document, pool, null, null, warningsById, cells);
        }

        Map<String, Flow> flowsById = new HashMap<>();
        for (Flow flow : document.flows()) {
            flowsById.put(flow.getId(), flow);
        }
        for (Route route : routes) {
            cells.add(edgeCell(document, flowsById.get(route.flowId()), route, warningsById));
        }

        log.debug("Generated {} cells", cells.size());
        return cells;
    }

    private void emitContainer(ProcessDocument document, int index, String parentId, Bounds parentBounds,
                               Map<String, List<Warning>> warningsById, List<DiagramCell> cells) {
        Container container = document.container(index);
        String childParentId = parentId;
        Bounds childParentBounds = parentBounds;

        if (!container.isSynthetic()) {
            cells.add(DiagramCell.builder()
                    .id(container.getId())
                    .type(CellType.CONTAINER)
                    .sourceId(container.isImplicit() ? null : container.getId())
                    .parentId(parentId)
                    .kind(container.getKind())
                    .label(container.getLabel())
                    .style(styles.styleFor(container.getKind(), theme))
                    .geometry(relative(container.getBounds(), parentBounds))
                    .warnings(warningsById.get(container.getId()))
                    .build());
            addLoopMarker(container.getId(), container.getLoopType(), container.getBounds(), cells);
            childParentId = container.getId();
            childParentBounds = container.getBounds();
        }

        for (NodeRef child : container.getChildren()) {
            if (child.isContainer()) {
                emitContainer(document, child.index(), childParentId, childParentBounds, warningsById, cells);
            } else {
                emitElement(document.element(child.index()), childParentId, childParentBounds, warningsById, cells);
            }
        }
    }

    private void emitElement(Element element, String parentId, Bounds parentBounds,
                             Map<String, List<Warning>> warningsById, List<DiagramCell> cells) {
        Bounds bounds = element.getBounds();
        cells.add(DiagramCell.builder()
                .id(element.getId())
                .type(CellType.SHAPE)
                .sourceId(element.getId())
                .parentId(parentId)
                .kind(element.getKind())
                .label(element.getLabel())
                .style(styles.styleFor(element.getKind(), theme))
                .geometry(relative(bounds, parentBounds))
                .warnings(warningsById.get(element.getId()))
                .build());

        // Symbol: gateways and events centred, task icons in the top left corner
        MarkerKind.symbolFor(element).ifPresent(marker -> {
            double x = marker.isTaskIcon() ? TASK_ICON_INSET : (bounds.width() - marker.width()) / 2;
            double y = marker.isTaskIcon() ? TASK_ICON_INSET : (bounds.height() - marker.height()) / 2;
            cells.add(decoration(element.getId() + "__marker", element.getId(), marker,
                    new Bounds(x, y, marker.width(), marker.height())));
        });
        addLoopMarker(element.getId(), element.getLoopType(), bounds, cells);
    }

    private void addLoopMarker(String ownerId, LoopType loopType, Bounds ownerBounds, List<DiagramCell> cells) {
        MarkerKind.loopMarkerFor(loopType).ifPresent(marker -> cells.add(decoration(ownerId + "__loop", ownerId, marker,
                new Bounds((ownerBounds.width() - marker.width()) / 2,
                        ownerBounds.height() - marker.height() - LOOP_MARKER_INSET,
                        marker.width(), marker.height()))));
    }

    private DiagramCell decoration(String id, String ownerId, MarkerKind marker, Bounds geometry) {
        return DiagramCell.builder()
                .id(id)
                .type(CellType.DECORATION)
                .sourceId(ownerId)
                .parentId(ownerId)
                .kind(marker)
                .style(styles.styleFor(marker, theme))
                .geometry(geometry)
                .build();
    }

    private DiagramCell edgeCell(ProcessDocument document, Flow flow, Route route,
                                 Map<String, List<Warning>> warningsById) {
        int parent = lowestCommonRenderedAncestor(document, flow.getSource(), flow.getTarget());
        Bounds parentBounds = parent == Container.NO_PARENT ? null : document.container(parent).getBounds();

        List<Point> waypoints = new ArrayList<>();
        for (Point point : route.waypoints()) {
            waypoints.add(parentBounds == null ? point : point.translate(-parentBounds.x(), -parentBounds.y()));
        }

        return DiagramCell.builder()
                .id(flow.getId())
                .type(CellType.EDGE)
                .sourceId(flow.getId())
                .parentId(parent == Container.NO_PARENT ? null : document.container(parent).getId())
                .kind(flow.getKind())
                .label(flow.getLabel())
                .style(styles.styleFor(flow.getKind(), theme))
                .waypoints(waypoints)
                .sourceCellId(document.id(flow.getSource()))
                .targetCellId(document.id(flow.getTarget()))
                .treatment(route.treatment())
                .warnings(warningsById.get(flow.getId()))
                .build();
    }

    /**
     * Deepest rendered container that encloses both endpoints, or {@link Container#NO_PARENT} for the root.
     */
    static int lowestCommonRenderedAncestor(ProcessDocument document, NodeRef source, NodeRef target) {
        List<Integer> targetAncestors = document.ancestors(target);
        for (int ancestor : document.ancestors(source)) {
            if (targetAncestors.contains(ancestor) && !document.container(ancestor).isSynthetic()) {
                return ancestor;
            }
        }
        return Container.NO_PARENT;
    }

    private static Bounds relative(Bounds bounds, Bounds parentBounds) {
        if (parentBounds == null) {
            return bounds;
        }
        return bounds.translate(-parentBounds.x(), -parentBounds.y());
    }
}
