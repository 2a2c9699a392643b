package org.processdiagram.converter.layout;

import lombok.extern.slf4j.Slf4j;
import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.Container;
import org.processdiagram.converter.bpmn.models.Element;
import org.processdiagram.converter.bpmn.models.Flow;
import org.processdiagram.converter.bpmn.models.FlowKind;
import org.processdiagram.converter.bpmn.models.NodeRef;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.config.ConverterConfig;
import org.processdiagram.converter.config.LayoutSettings;
import org.processdiagram.converter.validation.Warning;
import org.processdiagram.converter.validation.WarningCode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Resolves the bounds of every element and container.
 * <p>
 * In compute mode the work happens in rank coordinates: {@code p} runs along the rank direction and
 * {@code s} across it, so one code path serves all four directions. Subprocesses are laid out before
 * the nodes that contain them. All lanes of a pool share one set of rank columns.
 */
@Slf4j
public class ContainerLayoutEngine {
    private final LayoutSettings settings;
    private final Direction direction;

    public ContainerLayoutEngine(ConverterConfig config) {
        this.settings = config.layout;
        this.direction = config.direction;
    }

    /**
     * Assigns bounds to every element and container of the document.
     *
     * @param document  the parsed document; its bounds are overwritten
     * @param requested the layout mode asked for
     * @return the mode applied and any warnings
     */
    public LayoutResult layout(ProcessDocument document, LayoutMode requested) {
        List<Warning> warnings = new ArrayList<>();
        LayoutMode mode = requested;
        if (mode == LayoutMode.PRESERVE && !document.hasUsableGeometry()) {
            warnings.add(Warning.info(WarningCode.LAYOUT_DEGRADED, null,
                    "Source has no complete diagram geometry, computing the layout instead"));
            mode = LayoutMode.COMPUTE;
        }

        if (mode == LayoutMode.PRESERVE) {
            preserve(document, warnings);
        } else {
            new ComputeRun(document, warnings).run();
        }
        log.debug("Layout finished in {} mode with {} warnings", mode.value(), warnings.size());
        return new LayoutResult(mode, warnings);
    }

    /**
     * Copies the source geometry and grows any container that does not enclose its children.
     * Containers come after their parents in the arena, so walking it backwards visits children first.
     */
    private void preserve(ProcessDocument document, List<Warning> warnings) {
        for (Element element : document.elements()) {
            element.setBounds(element.getSourceBounds());
        }
        for (Container container : document.containers()) {
            container.setBounds(container.getSourceBounds());
        }

        for (int i = document.containers().size() - 1; i >= 0; i--) {
            Container container = document.container(i);
            Bounds children = null;
            for (NodeRef child : container.getChildren()) {
                Bounds bounds = document.bounds(child);
                if (bounds != null) {
                    children = children == null ? bounds : children.union(bounds);
                }
            }

            if (children == null) {
                // Empty and without geometry: resolved from the parent once the parents are final
                if (container.getBounds() != null) {
                    enforceMinimumSize(container, warnings);
                }
                continue;
            }
            double padding = container.isSynthetic() || container.hasLaneChildren() ? 0 : settings.containerMargin;
            if (container.getBounds() == null) {
                container.setBounds(children.inflate(padding));
            } else if (!container.getBounds().contains(children)) {
                container.setBounds(container.getBounds().union(children.inflate(padding)));
                warnings.add(Warning.info(WarningCode.GEOMETRY_CORRECTED, container.getId(),
                        "Container '" + container.getId() + "' was enlarged to enclose its children"));
            }
        }

        for (int i = 0; i < document.containers().size(); i++) {
            Container container = document.container(i);
            if (container.getBounds() == null) {
                container.setBounds(emptyContainerBounds(document, container));
            }
        }
    }

    /**
     * An empty lane or pool body without geometry covers its parent, so the parent never grows for it.
     * An empty root without geometry goes below everything else.
     */
    private Bounds emptyContainerBounds(ProcessDocument document, Container container) {
        if (!container.isRoot()) {
            Container parent = document.container(container.getParentIndex());
            Bounds body = parent.getBounds();
            if (!parent.isSynthetic() && parent.isRoot() && container.isLane() && body.width() > settings.poolHeaderSize) {
                body = new Bounds(body.x() + settings.poolHeaderSize, body.y(),
                        body.width() - settings.poolHeaderSize, body.height());
            }
            return body;
        }
        double bottom = settings.diagramMargin - settings.poolGap;
        for (Container other : document.containers()) {
            if (other.isRoot() && other.getBounds() != null) {
                bottom = Math.max(bottom, other.getBounds().maxY());
            }
        }
        return new Bounds(settings.diagramMargin, bottom + settings.poolGap, settings.minPoolLength, settings.minPoolDepth);
    }

    /**
     * Declared containers keep their origin; a degenerate source shape is widened to the minimum size.
     */
    private void enforceMinimumSize(Container container, List<Warning> warnings) {
        Bounds bounds = container.getBounds();
        if (bounds.width() > 0 && bounds.height() > 0) {
            return;
        }
        double minWidth;
        double minHeight;
        if (container.isSubprocess()) {
            minWidth = settings.minSubprocessWidth;
            minHeight = settings.minSubprocessHeight;
        } else if (container.isLane()) {
            minWidth = settings.minPoolLength - settings.poolHeaderSize;
            minHeight = settings.minLaneDepth;
        } else {
            minWidth = settings.minPoolLength;
            minHeight = settings.minPoolDepth;
        }
        container.setBounds(new Bounds(bounds.x(), bounds.y(),
                Math.max(bounds.width(), minWidth), Math.max(bounds.height(), minHeight)));
        warnings.add(Warning.info(WarningCode.GEOMETRY_CORRECTED, container.getId(),
                "Empty container '" + container.getId() + "' had no size and was given the minimum size"));
    }

    /**
     * Position and size in rank coordinates, relative to the enclosing pool or subprocess.
     */
    private static final class Box {
        double p;
        double s;
        final double length;
        final double depth;

        Box(double length, double depth) {
            this.length = length;
            this.depth = depth;
        }
    }

    private record DomainPlacement(double contentLength,
                                   double[] groupDepths,
                                   Map<NodeRef, Double> pOffsets,
                                   Map<NodeRef, Double> sOffsets) {
    }

    private final class ComputeRun {
        private final ProcessDocument document;
        private final List<Warning> warnings;
        private final Map<NodeRef, Box> boxes = new HashMap<>();
        private final Map<Integer, Double> laneDepths = new HashMap<>();

        ComputeRun(ProcessDocument document, List<Warning> warnings) {
            this.document = document;
            this.warnings = warnings;
        }

        void run() {
            // Pools stack across the rank direction
            double s = settings.diagramMargin;
            for (int pool : document.pools()) {
                Box box = layoutPool(pool);
                box.p = settings.diagramMargin;
                box.s = s;
                s += box.depth + settings.poolGap;
            }
            writeAbsoluteBounds();
        }

        private Box layoutPool(int poolIndex) {
            Container pool = document.container(poolIndex);
            double margin = settings.containerMargin;
            double header = pool.isSynthetic() ? 0 : settings.poolHeaderSize;

            List<Integer> leafLanes = new ArrayList<>();
            collectLeafLanes(poolIndex, leafLanes);

            // Content of every leaf lane starts at the same p so columns line up across lanes
            int laneLevels = 0;
            for (int lane : leafLanes) {
                laneLevels = Math.max(laneLevels, renderedLaneLevel(lane));
            }
            double contentStart = header + laneLevels * settings.laneHeaderSize + margin;

            List<List<NodeRef>> groups = new ArrayList<>();
            for (int lane : leafLanes) {
                groups.add(domainChildren(lane));
            }
            DomainPlacement placement = placeDomain(pool.getId(), groups);

            Map<Integer, Double> groupDepthOfLane = new HashMap<>();
            for (int i = 0; i < leafLanes.size(); i++) {
                groupDepthOfLane.put(leafLanes.get(i), placement.groupDepths()[i]);
            }

            List<Integer> topLanes = containerChildren(poolIndex);
            double bodyDepth = 0;
            for (int lane : topLanes) {
                bodyDepth += measureLane(lane, groupDepthOfLane);
            }
            double poolDepth = pool.isSynthetic() ? bodyDepth : Math.max(settings.minPoolDepth, bodyDepth);
            if (poolDepth > bodyDepth && !topLanes.isEmpty()) {
                growLastLane(topLanes.get(topLanes.size() - 1), poolDepth - bodyDepth);
            }
            double contentEnd = contentStart + placement.contentLength() + margin;
            double poolLength = pool.isSynthetic() ? contentEnd : Math.max(settings.minPoolLength, contentEnd);

            // Lanes tile the pool body
            double laneS = 0;
            for (int lane : topLanes) {
                placeLane(lane, header, laneS, poolLength, contentStart, placement, groupDepthOfLane);
                laneS += laneDepths.get(lane);
            }

            Box box = new Box(poolLength, poolDepth);
            boxes.put(NodeRef.container(poolIndex), box);
            return box;
        }

        private double measureLane(int laneIndex, Map<Integer, Double> groupDepthOfLane) {
            Container lane = document.container(laneIndex);
            double depth;
            if (lane.hasLaneChildren()) {
                depth = 0;
                for (int child : containerChildren(laneIndex)) {
                    depth += measureLane(child, groupDepthOfLane);
                }
            } else {
                double content = groupDepthOfLane.getOrDefault(laneIndex, 0.0) + 2 * settings.containerMargin;
                depth = lane.isSynthetic() ? content : Math.max(settings.minLaneDepth, content);
            }
            laneDepths.put(laneIndex, depth);
            return depth;
        }

        private void growLastLane(int laneIndex, double extra) {
            laneDepths.merge(laneIndex, extra, Double::sum);
            List<Integer> children = containerChildren(laneIndex);
            if (!children.isEmpty()) {
                growLastLane(children.get(children.size() - 1), extra);
            }
        }

        private void placeLane(int laneIndex, double pStart, double sStart, double poolLength, double contentStart,
                               DomainPlacement placement, Map<Integer, Double> groupDepthOfLane) {
            Container lane = document.container(laneIndex);
            Box box = new Box(poolLength - pStart, laneDepths.get(laneIndex));
            box.p = pStart;
            box.s = sStart;
            boxes.put(NodeRef.container(laneIndex), box);

            if (lane.hasLaneChildren()) {
                double childP = lane.isSynthetic() ? pStart : pStart + settings.laneHeaderSize;
                double childS = sStart;
                for (int child : containerChildren(laneIndex)) {
                    placeLane(child, childP, childS, poolLength, contentStart, placement, groupDepthOfLane);
                    childS += laneDepths.get(child);
                }
                return;
            }

            double margin = settings.containerMargin;
            double groupDepth = groupDepthOfLane.getOrDefault(laneIndex, 0.0);
            double centering = (box.depth - 2 * margin - groupDepth) / 2;
            for (NodeRef node : domainChildren(laneIndex)) {
                Box nodeBox = boxes.get(node);
                nodeBox.p = contentStart + placement.pOffsets().get(node);
                nodeBox.s = sStart + margin + centering + placement.sOffsets().get(node);
            }
        }

        private void layoutSubprocess(int index) {
            Container subprocess = document.container(index);
            double margin = settings.containerMargin;
            double header = settings.subprocessHeaderSize;
            List<NodeRef> nodes = domainChildren(index);

            DomainPlacement placement = placeDomain(subprocess.getId(), List.of(nodes));
            double groupDepth = placement.groupDepths()[0];

            double minLength = direction.isHorizontal() ? settings.minSubprocessWidth : settings.minSubprocessHeight;
            double minDepth = direction.isHorizontal() ? settings.minSubprocessHeight : settings.minSubprocessWidth;
            double length = Math.max(Math.max(minLength, header + margin + placement.contentLength() + margin),
                    boundaryRowLength(NodeRef.container(index)));
            double depth = Math.max(minDepth, margin + groupDepth + margin);
            boxes.put(NodeRef.container(index), new Box(length, depth));

            double centering = (depth - 2 * margin - groupDepth) / 2;
            for (NodeRef node : nodes) {
                Box nodeBox = boxes.get(node);
                nodeBox.p = header + margin + placement.pOffsets().get(node);
                nodeBox.s = margin + centering + placement.sOffsets().get(node);
            }
        }

        /**
         * Ranks the nodes of all groups together and stacks each group's rank members across the rank direction.
         * Nested subprocesses are sized first.
         */
        private DomainPlacement placeDomain(String domainId, List<List<NodeRef>> groups) {
            List<NodeRef> nodes = new ArrayList<>();
            groups.forEach(nodes::addAll);
            Map<NodeRef, Integer> index = new HashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                NodeRef node = nodes.get(i);
                index.put(node, i);
                if (node.isContainer()) {
                    layoutSubprocess(node.index());
                } else {
                    Element element = document.element(node.index());
                    boxes.put(node, new Box(Math.max(lengthOf(element), boundaryRowLength(node)), depthOf(element)));
                }
            }

            Ranking ranking;
            try {
                ranking = new RankAssigner(settings.maxRankingWork, direction).assign(nodes.size(), rankEdges(index));
            } catch (LayoutBudgetExceededException | IllegalStateException e) {
                log.warn("Ranking of '{}' abandoned, using a grid: {}", domainId, e.getMessage());
                warnings.add(Warning.warning(WarningCode.LAYOUT_DEGRADED, domainId,
                        "Layout of '" + domainId + "' fell back to a grid: " + e.getMessage()));
                ranking = Ranking.grid(nodes.size(), settings.gridColumns);
            }

            // Rank bands along p
            int rankCount = ranking.rankCount();
            double[] bandLength = new double[rankCount];
            for (int i = 0; i < nodes.size(); i++) {
                int rank = ranking.ranks()[i];
                bandLength[rank] = Math.max(bandLength[rank], boxes.get(nodes.get(i)).length);
            }
            double[] bandStart = new double[rankCount];
            double cursor = 0;
            for (int r = 0; r < rankCount; r++) {
                bandStart[r] = cursor;
                cursor += bandLength[r] + (r < rankCount - 1 ? settings.rankGap : 0);
            }
            double contentLength = cursor;

            Map<NodeRef, Double> pOffsets = new HashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                int rank = ranking.ranks()[i];
                double length = boxes.get(nodes.get(i)).length;
                double offset = bandStart[rank] + (bandLength[rank] - length) / 2;
                pOffsets.put(nodes.get(i), direction.isReversed() ? contentLength - offset - length : offset);
            }

            // Stacks across p, centred inside each group
            double[] groupDepths = new double[groups.size()];
            Map<NodeRef, Double> sOffsets = new HashMap<>();
            final Ranking finalRanking = ranking;
            for (int g = 0; g < groups.size(); g++) {
                Map<Integer, List<NodeRef>> byRank = new TreeMap<>();
                for (NodeRef node : groups.get(g)) {
                    byRank.computeIfAbsent(finalRanking.ranks()[index.get(node)], r -> new ArrayList<>()).add(node);
                }
                Map<Integer, Double> stackDepths = new HashMap<>();
                for (Map.Entry<Integer, List<NodeRef>> entry : byRank.entrySet()) {
                    entry.getValue().sort(Comparator
                            .<NodeRef>comparingInt(node -> finalRanking.order()[index.get(node)])
                            .thenComparingInt(index::get));
                    double stack = 0;
                    for (NodeRef node : entry.getValue()) {
                        stack += effectiveDepth(node);
                    }
                    stack += settings.nodeGap * (entry.getValue().size() - 1);
                    stackDepths.put(entry.getKey(), stack);
                    groupDepths[g] = Math.max(groupDepths[g], stack);
                }
                for (Map.Entry<Integer, List<NodeRef>> entry : byRank.entrySet()) {
                    double s = (groupDepths[g] - stackDepths.get(entry.getKey())) / 2;
                    for (NodeRef node : entry.getValue()) {
                        sOffsets.put(node, s);
                        s += effectiveDepth(node) + settings.nodeGap;
                    }
                }
            }
            return new DomainPlacement(contentLength, groupDepths, pOffsets, sOffsets);
        }

        /**
         * Sequence flows between domain nodes, plus associations that tie data objects and artifacts
         * to their activity. Endpoints nested in subprocesses count as the subprocess, boundary events as their host.
         */
        private List<int[]> rankEdges(Map<NodeRef, Integer> index) {
            List<int[]> edges = new ArrayList<>();
            for (Flow flow : document.flows()) {
                boolean rankable = flow.getKind().isSequenceLike()
                        || (flow.getKind() == FlowKind.ASSOCIATION
                        && (isPassive(flow.getSource()) || isPassive(flow.getTarget())));
                if (!rankable) {
                    continue;
                }
                Integer from = lift(flow.getSource(), index);
                Integer to = lift(flow.getTarget(), index);
                if (from != null && to != null && !from.equals(to)) {
                    edges.add(new int[]{from, to});
                }
            }
            return edges;
        }

        private Integer lift(NodeRef ref, Map<NodeRef, Integer> index) {
            NodeRef current = ref;
            if (current.isElement()) {
                Optional<NodeRef> host = document.hostOf(current.index());
                if (host.isPresent()) {
                    current = host.get();
                }
            }
            while (true) {
                Integer position = index.get(current);
                if (position != null) {
                    return position;
                }
                int parent = document.parentOf(current);
                if (parent == Container.NO_PARENT || !document.container(parent).isSubprocess()) {
                    return null;
                }
                current = NodeRef.container(parent);
            }
        }

        /**
         * Length a host needs so that its boundary events sit side by side with a free gap around each.
         */
        private double boundaryRowLength(NodeRef host) {
            List<Integer> events = document.boundaryEventsOf(host);
            if (events.isEmpty()) {
                return 0;
            }
            double step = boundaryEventLength(events) + settings.boundaryEventGap;
            return events.size() * step + settings.boundaryEventGap;
        }

        private double boundaryEventLength(List<Integer> events) {
            double length = 0;
            for (int event : events) {
                length = Math.max(length, lengthOf(document.element(event)));
            }
            return length;
        }

        /**
         * Depth including the half of any boundary event hanging below the node.
         */
        private double effectiveDepth(NodeRef node) {
            double overhang = 0;
            for (int event : document.boundaryEventsOf(node)) {
                overhang = Math.max(overhang, depthOf(document.element(event)) / 2);
            }
            return boxes.get(node).depth + overhang;
        }

        /**
         * Every container comes after its enclosing container in the arena, so one forward pass suffices.
         * Boundary events are placed last, on the edge of their host.
         */
        private void writeAbsoluteBounds() {
            Map<Integer, Box> absolute = new HashMap<>();
            for (int i = 0; i < document.containers().size(); i++) {
                NodeRef ref = NodeRef.container(i);
                Box box = toAbsolute(ref, boxes.get(ref), absolute);
                absolute.put(i, box);
                document.assignBounds(ref, toBounds(box));
            }
            for (int i = 0; i < document.elements().size(); i++) {
                NodeRef ref = NodeRef.element(i);
                if (document.hostOf(i).isPresent()) {
                    continue;
                }
                document.assignBounds(ref, toBounds(toAbsolute(ref, boxes.get(ref), absolute)));
            }
            for (int i = 0; i < document.elements().size(); i++) {
                Optional<NodeRef> host = document.hostOf(i);
                if (host.isPresent()) {
                    placeBoundaryEvent(i, host.get());
                }
            }
        }

        private Box toAbsolute(NodeRef ref, Box relative, Map<Integer, Box> absolute) {
            Box result = new Box(relative.length, relative.depth);
            result.p = relative.p;
            result.s = relative.s;
            int frame = frameOf(ref);
            if (frame != Container.NO_PARENT) {
                Box origin = absolute.get(frame);
                result.p += origin.p;
                result.s += origin.s;
            }
            return result;
        }

        /**
         * Boundary events are spread along the host's far side across the rank direction, centred on the host
         * and never closer than one event length plus the configured gap.
         */
        private void placeBoundaryEvent(int elementIndex, NodeRef host) {
            Element event = document.element(elementIndex);
            Bounds hostBounds = document.bounds(host);
            List<Integer> siblings = document.boundaryEventsOf(host);
            int position = siblings.indexOf(elementIndex);

            double hostP = direction.isHorizontal() ? hostBounds.x() : hostBounds.y();
            double hostS = direction.isHorizontal() ? hostBounds.y() : hostBounds.x();
            double hostLength = direction.isHorizontal() ? hostBounds.width() : hostBounds.height();
            double hostDepth = direction.isHorizontal() ? hostBounds.height() : hostBounds.width();

            double step = Math.max(hostLength / (siblings.size() + 1),
                    boundaryEventLength(siblings) + settings.boundaryEventGap);
            double center = hostP + hostLength / 2 + (position - (siblings.size() - 1) / 2.0) * step;

            Box box = new Box(lengthOf(event), depthOf(event));
            box.p = center - box.length / 2;
            box.s = hostS + hostDepth - box.depth / 2;
            document.assignBounds(NodeRef.element(elementIndex), toBounds(box));
        }

        /**
         * Nearest enclosing pool or subprocess, whose origin the node's box is relative to.
         */
        private int frameOf(NodeRef ref) {
            for (int ancestor : document.ancestors(ref)) {
                Container container = document.container(ancestor);
                if (container.isRoot() || container.isSubprocess()) {
                    return ancestor;
                }
            }
            return Container.NO_PARENT;
        }

        private void collectLeafLanes(int containerIndex, List<Integer> leaves) {
            for (int child : containerChildren(containerIndex)) {
                if (document.container(child).hasLaneChildren()) {
                    collectLeafLanes(child, leaves);
                } else {
                    leaves.add(child);
                }
            }
        }

        /**
         * Number of rendered lanes from the pool down to and including this lane.
         */
        private int renderedLaneLevel(int laneIndex) {
            int level = document.container(laneIndex).isSynthetic() ? 0 : 1;
            for (int ancestor : document.ancestors(NodeRef.container(laneIndex))) {
                Container container = document.container(ancestor);
                if (container.isLane() && !container.isSynthetic()) {
                    level++;
                }
            }
            return level;
        }

        private List<Integer> containerChildren(int containerIndex) {
            List<Integer> result = new ArrayList<>();
            for (NodeRef child : document.container(containerIndex).getChildren()) {
                if (child.isContainer() && document.container(child.index()).isLane()) {
                    result.add(child.index());
                }
            }
            return result;
        }

        /**
         * Flow nodes placed by ranking: everything except boundary events, which follow their host.
         */
        private List<NodeRef> domainChildren(int containerIndex) {
            List<NodeRef> result = new ArrayList<>();
            for (NodeRef child : document.container(containerIndex).getChildren()) {
                if (child.isElement() && document.hostOf(child.index()).isPresent()) {
                    continue;
                }
                if (child.isContainer() && document.container(child.index()).isLane()) {
                    continue;
                }
                result.add(child);
            }
            return result;
        }

        private boolean isPassive(NodeRef ref) {
            return ref.isElement() && document.element(ref.index()).getKind().isPassive();
        }
    }

    private double lengthOf(Element element) {
        return direction.isHorizontal() ? element.preferredWidth() : element.preferredHeight();
    }

    private double depthOf(Element element) {
        return direction.isHorizontal() ? element.preferredHeight() : element.preferredWidth();
    }

    private Bounds toBounds(Box box) {
        return direction.isHorizontal()
                ? new Bounds(box.p, box.s, box.length, box.depth)
                : new Bounds(box.s, box.p, box.depth, box.length);
    }
}
