package org.processdiagram.converter.bpmn.models;

import org.processdiagram.converter.validation.Warning;
import org.processdiagram.converter.validation.WarningCode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates parsed nodes and flows and produces a {@link ProcessDocument}.
 * Every structural rule of the model is checked here and reported as {@link IllegalStateException}.
 */
public class ProcessDocumentBuilder {
    private final List<Element> elements = new ArrayList<>();
    private final List<Container> containers = new ArrayList<>();
    private final List<Flow> flows = new ArrayList<>();
    private final List<Integer> pools = new ArrayList<>();
    private final Map<String, NodeRef> nodesById = new LinkedHashMap<>();
    private final Set<String> flowIds = new HashSet<>();
    private final List<Warning> diagnostics = new ArrayList<>();
    private int nextSequence = 0;

    /**
     * Adds a top-level pool.
     *
     * @return the container index of the pool
     */
    public int addPool(Container.ContainerBuilder pool) {
        Container container = pool
                .parentIndex(Container.NO_PARENT)
                .sequence(nextSequence++)
                .build();
        if (container.getKind() != ContainerKind.POOL) {
            throw new IllegalStateException("Top-level container '" + container.getId() + "' must be a pool");
        }
        int index = register(container);
        pools.add(index);
        return index;
    }

    /**
     * Adds a lane or subprocess under an existing container.
     *
     * @return the container index
     */
    public int addContainer(Container.ContainerBuilder child, int parentIndex) {
        Container parent = requireContainer(parentIndex);
        Container container = child
                .parentIndex(parentIndex)
                .sequence(nextSequence++)
                .build();
        if (container.getKind() == ContainerKind.POOL) {
            throw new IllegalStateException("Pool '" + container.getId() + "' cannot be nested");
        }
        if (container.isLane() && parent.isSubprocess()) {
            throw new IllegalStateException("Lane '" + container.getId() + "' cannot be placed inside a subprocess");
        }
        if (!container.isLane() && parent.getKind() == ContainerKind.POOL) {
            throw new IllegalStateException("Subprocess '" + container.getId() + "' must be placed in a lane of its pool");
        }
        int index = register(container);
        parent.addChild(NodeRef.container(index), container.isLane());
        return index;
    }

    /**
     * Adds a flow node or artifact to a lane or subprocess.
     *
     * @return the element index
     */
    public int addElement(Element.ElementBuilder draft, int containerIndex) {
        Container parent = requireContainer(containerIndex);
        if (parent.getKind() == ContainerKind.POOL) {
            throw new IllegalStateException("Pool '" + parent.getId() + "' holds lanes only, place elements in a lane");
        }
        Element element = draft
                .containerIndex(containerIndex)
                .sequence(nextSequence++)
                .build();
        requireUniqueId(element.getId());
        int index = elements.size();
        elements.add(element);
        nodesById.put(element.getId(), NodeRef.element(index));
        parent.addChild(NodeRef.element(index), false);
        return index;
    }

    /**
     * Queues a flow. Endpoints are resolved in {@link #build()} once every node is known.
     */
    public void addFlow(Flow.FlowBuilder draft) {
        Flow flow = draft.sequence(nextSequence++).build();
        if (!flowIds.add(flow.getId()) || nodesById.containsKey(flow.getId())) {
            throw new IllegalStateException("Duplicate id '" + flow.getId() + "'");
        }
        flows.add(flow);
    }

    public void addDiagnostic(Warning warning) {
        diagnostics.add(warning);
    }

    public boolean containsId(String id) {
        return nodesById.containsKey(id) || flowIds.contains(id);
    }

    public Container container(int index) {
        return requireContainer(index);
    }

    /**
     * Resolves flow endpoints, applies the all-or-nothing geometry rule and freezes the topology.
     *
     * @throws IllegalStateException when a sequence flow connects two different pools
     */
    public ProcessDocument build() {
        List<UnresolvedReference> unresolved = new ArrayList<>();
        List<Flow> resolved = new ArrayList<>();

        // Resolve endpoints
        for (Flow flow : flows) {
            NodeRef source = resolveEndpoint(flow.getKind(), flow.getSourceRef());
            NodeRef target = resolveEndpoint(flow.getKind(), flow.getTargetRef());
            if (source == null || target == null) {
                String missing = source == null ? flow.getSourceRef() : flow.getTargetRef();
                unresolved.add(new UnresolvedReference(flow.getId(), flow.getKind(), missing));
                continue;
            }
            if (flow.getKind().isSequenceLike() && poolOf(source) != poolOf(target)) {
                throw new IllegalStateException("Sequence flow '" + flow.getId() + "' connects '"
                        + flow.getSourceRef() + "' and '" + flow.getTargetRef() + "' in different pools");
            }
            flow.resolve(source, target);
            if (source.isElement()) {
                elements.get(source.index()).addOutgoing(flow.getId());
            }
            if (target.isElement()) {
                elements.get(target.index()).addIncoming(flow.getId());
            }
            resolved.add(flow);
        }

        boolean usableGeometry = applyGeometryRule();

        return new ProcessDocument(elements, containers, resolved, pools, nodesById, unresolved, diagnostics,
                usableGeometry);
    }

    private boolean applyGeometryRule() {
        int required = 0;
        int present = 0;
        for (Element element : elements) {
            required++;
            if (element.getSourceBounds() != null) {
                present++;
            }
        }
        for (Container container : containers) {
            if (container.isImplicit()) {
                continue;
            }
            required++;
            if (container.getSourceBounds() != null) {
                present++;
            }
        }

        if (required > 0 && present == required) {
            return true;
        }

        if (present > 0) {
            diagnostics.add(Warning.info(WarningCode.PARTIAL_GEOMETRY, null,
                    "Diagram geometry covers " + present + " of " + required
                            + " shapes, layout will be computed for the whole process"));
        }
        elements.forEach(Element::clearSourceBounds);
        containers.forEach(Container::clearSourceBounds);
        flows.forEach(Flow::clearSourceWaypoints);
        return false;
    }

    private NodeRef resolveEndpoint(FlowKind kind, String ref) {
        if (ref == null) {
            return null;
        }
        NodeRef node = nodesById.get(ref);
        if (node == null || node.isElement()) {
            return node;
        }
        ContainerKind containerKind = containers.get(node.index()).getKind();
        if (containerKind.isSubprocess()) {
            return node;
        }
        // only message flows may start or end at a pool
        return kind == FlowKind.MESSAGE && containerKind == ContainerKind.POOL ? node : null;
    }

    private int poolOf(NodeRef ref) {
        int current = ref.isElement()
                ? elements.get(ref.index()).getContainerIndex()
                : ref.index();
        while (!containers.get(current).isRoot()) {
            current = containers.get(current).getParentIndex();
        }
        return current;
    }

    private int register(Container container) {
        requireUniqueId(container.getId());
        int index = containers.size();
        containers.add(container);
        nodesById.put(container.getId(), NodeRef.container(index));
        return index;
    }

    private void requireUniqueId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("Every element and container needs an id");
        }
        if (containsId(id)) {
            throw new IllegalStateException("Duplicate id '" + id + "'");
        }
    }

    private Container requireContainer(int index) {
        if (index < 0 || index >= containers.size()) {
            throw new IllegalStateException("Unknown container index " + index);
        }
        return containers.get(index);
    }
}
