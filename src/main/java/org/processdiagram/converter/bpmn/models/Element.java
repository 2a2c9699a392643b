package org.processdiagram.converter.bpmn.models;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A flow node or artifact of the process. Subprocesses are {@link Container}s instead.
 * The owning container is referenced by index into {@link ProcessDocument#containers()}.
 */
@Getter
@Builder
public class Element {
    private final String id;
    private final ElementKind kind;
    private final String tag;  // BPMN local name as written in the source, e.g. "userTask"
    private final String label;
    private final int containerIndex;
    private final int sequence;  // parse order, used for deterministic tie breaks

    @Builder.Default
    private final EventDefinition eventDefinition = EventDefinition.NONE;
    private final String attachedToRef;  // boundary events only
    @Builder.Default
    private final boolean cancelActivity = true;
    @Builder.Default
    private final LoopType loopType = LoopType.NONE;
    private final String defaultFlowRef;

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final List<String> incoming = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final List<String> outgoing = new ArrayList<>();

    // DI bounds as read from the source, null when absent or discarded
    private Bounds sourceBounds;

    /**
     * Resolved geometry. Written by the layout engine only.
     */
    @Setter
    private Bounds bounds;

    public List<String> getIncoming() {
        return Collections.unmodifiableList(incoming);
    }

    public List<String> getOutgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    public boolean isBoundaryEvent() {
        return kind == ElementKind.BOUNDARY_EVENT && attachedToRef != null;
    }

    /**
     * Size taken from the source diagram when known, otherwise the kind's default size.
     */
    public double preferredWidth() {
        return sourceBounds != null ? sourceBounds.width() : kind.defaultWidth();
    }

    public double preferredHeight() {
        return sourceBounds != null ? sourceBounds.height() : kind.defaultHeight();
    }

    void addIncoming(String flowId) {
        incoming.add(flowId);
    }

    void addOutgoing(String flowId) {
        outgoing.add(flowId);
    }

    void clearSourceBounds() {
        sourceBounds = null;
    }
}
