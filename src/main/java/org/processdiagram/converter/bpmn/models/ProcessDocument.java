package org.processdiagram.converter.bpmn.models;

import org.processdiagram.converter.validation.Warning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed process: arena tables of elements, containers and flows addressed by index.
 * Topology is fixed once built; only element and container bounds change afterwards.
 */
public class ProcessDocument {
    private final List<Element> elements;
    private final List<Container> containers;
    private final List<Flow> flows;
    private final List<Integer> pools;
    private final Map<String, NodeRef> nodesById;
    private final List<UnresolvedReference> unresolvedReferences;
    private final List<Warning> diagnostics;
    private final boolean usableGeometry;

    private final Map<NodeRef, List<Flow>> outgoing = new HashMap<>();
    private final Map<NodeRef, List<Flow>> incoming = new HashMap<>();
    private final Map<String, List<Integer>> boundaryEventsByHost = new HashMap<>();

    ProcessDocument(List<Element> elements,
                    List<Container> containers,
                    List<Flow> flows,
                    List<Integer> pools,
                    Map<String, NodeRef> nodesById,
                    List<UnresolvedReference> unresolvedReferences,
                    List<Warning> diagnostics,
                    boolean usableGeometry) {
        this.elements = List.copyOf(elements);
        this.containers = List.copyOf(containers);
        this.flows = List.copyOf(flows);
        this.pools = List.copyOf(pools);
        this.nodesById = Map.copyOf(nodesById);
        this.unresolvedReferences = List.copyOf(unresolvedReferences);
        this.diagnostics = List.copyOf(diagnostics);
        this.usableGeometry = usableGeometry;

        for (Flow flow : this.flows) {
            outgoing.computeIfAbsent(flow.getSource(), k -> new ArrayList<>()).add(flow);
            incoming.computeIfAbsent(flow.getTarget(), k -> new ArrayList<>()).add(flow);
        }
        for (int i = 0; i < this.elements.size(); i++) {
            Element element = this.elements.get(i);
            if (element.isBoundaryEvent() && nodesById.containsKey(element.getAttachedToRef())) {
                boundaryEventsByHost.computeIfAbsent(element.getAttachedToRef(), k -> new ArrayList<>()).add(i);
            }
        }
    }

    public List<Element> elements() {
        return elements;
    }

    public List<Container> containers() {
        return containers;
    }

    public List<Flow> flows() {
        return flows;
    }

    /**
     * Indices of top-level pools (declared participants and implicit pools) in source order.
     */
    public List<Integer> pools() {
        return pools;
    }

    public List<UnresolvedReference> unresolvedReferences() {
        return unresolvedReferences;
    }

    /**
     * Findings recorded while parsing (partial geometry, unsupported kinds, schema problems).
     */
    public List<Warning> diagnostics() {
        return diagnostics;
    }

    /**
     * True when every element and every declared container has source geometry.
     */
    public boolean hasUsableGeometry() {
        return usableGeometry;
    }

    public Element element(int index) {
        return elements.get(index);
    }

    public Container container(int index) {
        return containers.get(index);
    }

    public Optional<NodeRef> find(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public String id(NodeRef ref) {
        return ref.isElement() ? element(ref.index()).getId() : container(ref.index()).getId();
    }

    public String label(NodeRef ref) {
        return ref.isElement() ? element(ref.index()).getLabel() : container(ref.index()).getLabel();
    }

    public int sequence(NodeRef ref) {
        return ref.isElement() ? element(ref.index()).getSequence() : container(ref.index()).getSequence();
    }

    public Bounds bounds(NodeRef ref) {
        return ref.isElement() ? element(ref.index()).getBounds() : container(ref.index()).getBounds();
    }

    public Bounds sourceBounds(NodeRef ref) {
        return ref.isElement() ? element(ref.index()).getSourceBounds() : container(ref.index()).getSourceBounds();
    }

    public void assignBounds(NodeRef ref, Bounds bounds) {
        if (ref.isElement()) {
            element(ref.index()).setBounds(bounds);
        } else {
            container(ref.index()).setBounds(bounds);
        }
    }

    /**
     * @return index of the directly enclosing container, or {@link Container#NO_PARENT} for pools
     */
    public int parentOf(NodeRef ref) {
        return ref.isElement() ? element(ref.index()).getContainerIndex() : container(ref.index()).getParentIndex();
    }

    /**
     * Enclosing containers from the nearest outwards, ending with the pool.
     */
    public List<Integer> ancestors(NodeRef ref) {
        List<Integer> result = new ArrayList<>();
        int current = parentOf(ref);
        while (current != Container.NO_PARENT) {
            result.add(current);
            current = containers.get(current).getParentIndex();
        }
        return result;
    }

    public int poolOf(NodeRef ref) {
        if (ref.isContainer() && container(ref.index()).isRoot()) {
            return ref.index();
        }
        List<Integer> chain = ancestors(ref);
        return chain.get(chain.size() - 1);
    }

    public boolean isAncestor(int containerIndex, NodeRef ref) {
        return ancestors(ref).contains(containerIndex);
    }

    public List<Flow> outgoing(NodeRef ref) {
        return outgoing.getOrDefault(ref, Collections.emptyList());
    }

    public List<Flow> incoming(NodeRef ref) {
        return incoming.getOrDefault(ref, Collections.emptyList());
    }

    /**
     * Boundary events attached to the given activity, in source order.
     */
    public List<Integer> boundaryEventsOf(NodeRef host) {
        return boundaryEventsByHost.getOrDefault(id(host), Collections.emptyList());
    }

    /**
     * Resolved host of a boundary event, empty for any other element or a dangling attachment.
     */
    public Optional<NodeRef> hostOf(int elementIndex) {
        Element element = element(elementIndex);
        if (!element.isBoundaryEvent()) {
            return Optional.empty();
        }
        return find(element.getAttachedToRef());
    }

    /**
     * Nearest enclosing container that is rendered, or {@link Container#NO_PARENT}.
     */
    public int renderedParentOf(NodeRef ref) {
        for (int index : ancestors(ref)) {
            if (!container(index).isSynthetic()) {
                return index;
            }
        }
        return Container.NO_PARENT;
    }
}
