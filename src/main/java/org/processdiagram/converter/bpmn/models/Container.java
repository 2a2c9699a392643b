package org.processdiagram.converter.bpmn.models;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pool, lane or subprocess. Children are kept in source order and are either all lanes
 * or all flow nodes (elements and subprocesses), never a mix.
 */
@Getter
@Builder
public class Container {
    public static final int NO_PARENT = -1;

    private final String id;
    private final ContainerKind kind;
    private final String label;
    @Builder.Default
    private final int parentIndex = NO_PARENT;
    private final int sequence;

    // not declared in the source (implicit pool of a process, catch-all lane)
    private final boolean implicit;
    // not rendered; children are re-parented to the nearest rendered ancestor
    private final boolean synthetic;

    private final String processRef;  // pools only
    @Builder.Default
    private final LoopType loopType = LoopType.NONE;

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final List<NodeRef> children = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private ChildKinds childKinds = ChildKinds.NONE;

    private Bounds sourceBounds;

    /**
     * Resolved geometry. Written by the layout engine only.
     */
    @Setter
    private Bounds bounds;

    public List<NodeRef> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    public boolean isLane() {
        return kind == ContainerKind.LANE;
    }

    public boolean isSubprocess() {
        return kind.isSubprocess();
    }

    public boolean hasLaneChildren() {
        return childKinds == ChildKinds.LANES;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    void addChild(NodeRef child, boolean lane) {
        ChildKinds incoming = lane ? ChildKinds.LANES : ChildKinds.FLOW_NODES;
        if (childKinds != ChildKinds.NONE && childKinds != incoming) {
            throw new IllegalStateException("Container '" + id + "' cannot hold both lanes and flow nodes");
        }
        childKinds = incoming;
        children.add(child);
    }

    void clearSourceBounds() {
        sourceBounds = null;
    }

    enum ChildKinds {
        NONE,
        LANES,
        FLOW_NODES
    }
}
