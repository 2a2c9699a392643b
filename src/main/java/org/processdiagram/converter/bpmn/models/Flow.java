package org.processdiagram.converter.bpmn.models;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sequence, message or association flow. Endpoints are resolved by {@link ProcessDocumentBuilder#build()};
 * flows whose endpoints cannot be resolved never reach a {@link ProcessDocument}.
 */
@Getter
@Builder
public class Flow {
    private final String id;
    private final FlowKind kind;
    private final String sourceRef;
    private final String targetRef;
    private final String label;
    private final String condition;
    private final int sequence;

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private List<Point> sourceWaypoints = new ArrayList<>();

    private NodeRef source;
    private NodeRef target;

    /**
     * Waypoints from the source diagram, empty when absent or discarded.
     */
    public List<Point> getSourceWaypoints() {
        return Collections.unmodifiableList(sourceWaypoints);
    }

    public boolean isSelfLoop() {
        return source != null && source.equals(target);
    }

    public boolean hasLabelOrCondition() {
        return (label != null && !label.isBlank()) || (condition != null && !condition.isBlank());
    }

    void resolve(NodeRef source, NodeRef target) {
        this.source = source;
        this.target = target;
    }

    void clearSourceWaypoints() {
        sourceWaypoints = new ArrayList<>();
    }
}
