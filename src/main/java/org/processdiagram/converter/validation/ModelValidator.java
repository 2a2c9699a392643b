package org.processdiagram.converter.validation;

import lombok.extern.slf4j.Slf4j;
import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.Container;
import org.processdiagram.converter.bpmn.models.ContainerKind;
import org.processdiagram.converter.bpmn.models.Element;
import org.processdiagram.converter.bpmn.models.ElementKind;
import org.processdiagram.converter.bpmn.models.Flow;
import org.processdiagram.converter.bpmn.models.FlowKind;
import org.processdiagram.converter.bpmn.models.NodeRef;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.bpmn.models.UnresolvedReference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a parsed process. Never modifies the document and never fails:
 * every finding is returned as a {@link Warning}, in a stable order.
 */
@Slf4j
public class ModelValidator {

    /**
     * Runs all checks.
     *
     * @param document the parsed document
     * @return parse diagnostics followed by the findings of each check
     */
    public static List<Warning> validate(ProcessDocument document) {
        List<Warning> warnings = new ArrayList<>(document.diagnostics());

        checkUnresolvedReferences(document, warnings);
        Set<NodeRef> orphans = checkOrphans(document, warnings);
        checkMissingConditions(document, warnings);
        checkStartAndEndEvents(document, warnings);
        checkReachability(document, orphans, warnings);
        checkMissingLabels(document, warnings);
        checkOverlaps(document, warnings);

        log.debug("Validation produced {} warnings", warnings.size());
        return warnings;
    }

    static void checkUnresolvedReferences(ProcessDocument document, List<Warning> warnings) {
        for (UnresolvedReference unresolved : document.unresolvedReferences()) {
            warnings.add(Warning.error(WarningCode.UNRESOLVED_REFERENCE, unresolved.flowId(),
                    "Flow '" + unresolved.flowId() + "' references '" + unresolved.missingRef()
                            + "' which is not a valid endpoint, the flow was dropped"));
        }
    }

    /**
     * Flags flow nodes without any attached flow. Start and end events, boundary events,
     * data objects, artifacts and event subprocesses legitimately stand alone.
     */
    static Set<NodeRef> checkOrphans(ProcessDocument document, List<Warning> warnings) {
        Set<NodeRef> orphans = new HashSet<>();
        for (int i = 0; i < document.elements().size(); i++) {
            Element element = document.element(i);
            ElementKind kind = element.getKind();
            if (kind == ElementKind.START_EVENT || kind == ElementKind.END_EVENT
                    || kind == ElementKind.BOUNDARY_EVENT || kind.isPassive()) {
                continue;
            }
            NodeRef ref = NodeRef.element(i);
            if (isUnconnected(document, ref)) {
                orphans.add(ref);
                warnings.add(Warning.warning(WarningCode.ORPHAN_ELEMENT, element.getId(),
                        "Element '" + element.getId() + "' has no incoming or outgoing flows"));
            }
        }
        for (int i = 0; i < document.containers().size(); i++) {
            Container container = document.container(i);
            if (!container.isSubprocess() || container.getKind() == ContainerKind.EVENT_SUBPROCESS) {
                continue;
            }
            NodeRef ref = NodeRef.container(i);
            if (isUnconnected(document, ref)) {
                orphans.add(ref);
                warnings.add(Warning.warning(WarningCode.ORPHAN_ELEMENT, container.getId(),
                        "Subprocess '" + container.getId() + "' has no incoming or outgoing flows"));
            }
        }
        return orphans;
    }

    /**
     * A decision gateway with several outgoing branches needs a label or condition on every
     * branch except the default one.
     */
    static void checkMissingConditions(ProcessDocument document, List<Warning> warnings) {
        for (int i = 0; i < document.elements().size(); i++) {
            Element gateway = document.element(i);
            if (!gateway.getKind().isDecisionGateway()) {
                continue;
            }
            List<Flow> branches = document.outgoing(NodeRef.element(i)).stream()
                    .filter(flow -> flow.getKind().isSequenceLike())
                    .toList();
            if (branches.size() < 2) {
                continue;
            }
            for (Flow branch : branches) {
                boolean isDefault = branch.getKind() == FlowKind.DEFAULT
                        || branch.getId().equals(gateway.getDefaultFlowRef());
                if (!isDefault && !branch.hasLabelOrCondition()) {
                    warnings.add(Warning.warning(WarningCode.MISSING_CONDITION, branch.getId(),
                            "Branch '" + branch.getId() + "' of gateway '" + gateway.getId()
                                    + "' has neither a label nor a condition"));
                }
            }
        }
    }

    static void checkStartAndEndEvents(ProcessDocument document, List<Warning> warnings) {
        boolean hasActiveNodes = document.elements().stream().anyMatch(e -> !e.getKind().isPassive());
        if (!hasActiveNodes) {
            return;
        }
        if (document.elements().stream().noneMatch(e -> e.getKind() == ElementKind.START_EVENT)) {
            warnings.add(Warning.warning(WarningCode.NO_START_EVENT, null, "Process has no start event"));
        }
        if (document.elements().stream().noneMatch(e -> e.getKind() == ElementKind.END_EVENT)) {
            warnings.add(Warning.warning(WarningCode.NO_END_EVENT, null, "Process has no end event"));
        }
    }

    /**
     * Walks sequence flows from every start event. Entering a subprocess also enters its start events;
     * reaching an activity also reaches its boundary events. Orphans are already reported and skipped.
     */
    static void checkReachability(ProcessDocument document, Set<NodeRef> orphans, List<Warning> warnings) {
        Deque<NodeRef> queue = new ArrayDeque<>();
        Set<NodeRef> reached = new HashSet<>();
        for (int i = 0; i < document.elements().size(); i++) {
            NodeRef ref = NodeRef.element(i);
            if (document.element(i).getKind() == ElementKind.START_EVENT && !insideSubprocess(document, ref)) {
                queue.add(ref);
            }
        }
        if (queue.isEmpty()) {
            return;
        }

        while (!queue.isEmpty()) {
            NodeRef current = queue.poll();
            if (!reached.add(current)) {
                continue;
            }
            for (Flow flow : document.outgoing(current)) {
                if (flow.getKind().isSequenceLike()) {
                    queue.add(flow.getTarget());
                }
            }
            for (int boundary : document.boundaryEventsOf(current)) {
                queue.add(NodeRef.element(boundary));
            }
            if (current.isContainer()) {
                for (NodeRef child : document.container(current.index()).getChildren()) {
                    if (isEntryPoint(document, child)) {
                        queue.add(child);
                    }
                }
            }
        }

        for (int i = 0; i < document.elements().size(); i++) {
            NodeRef ref = NodeRef.element(i);
            Element element = document.element(i);
            if (element.getKind().isPassive() || orphans.contains(ref) || reached.contains(ref)) {
                continue;
            }
            warnings.add(Warning.info(WarningCode.DISCONNECTED, element.getId(),
                    "Element '" + element.getId() + "' cannot be reached from any start event"));
        }
    }

    static void checkMissingLabels(ProcessDocument document, List<Warning> warnings) {
        for (Element element : document.elements()) {
            if (element.getKind().isActivity() && (element.getLabel() == null || element.getLabel().isBlank())) {
                warnings.add(Warning.info(WarningCode.MISSING_LABEL, element.getId(),
                        "Task '" + element.getId() + "' has no label"));
            }
        }
    }

    /**
     * Reports siblings whose source shapes overlap. Groups span other nodes on purpose and
     * boundary events sit on their host's border, so both are exempt.
     */
    static void checkOverlaps(ProcessDocument document, List<Warning> warnings) {
        if (!document.hasUsableGeometry()) {
            return;
        }
        for (Container container : document.containers()) {
            if (container.hasLaneChildren()) {
                continue;
            }
            List<NodeRef> nodes = container.getChildren().stream()
                    .filter(child -> !isExemptFromOverlap(document, child))
                    .toList();
            for (int a = 0; a < nodes.size(); a++) {
                for (int b = a + 1; b < nodes.size(); b++) {
                    Bounds first = document.sourceBounds(nodes.get(a));
                    Bounds second = document.sourceBounds(nodes.get(b));
                    if (first != null && second != null && first.intersects(second)) {
                        String firstId = document.id(nodes.get(a));
                        String secondId = document.id(nodes.get(b));
                        warnings.add(Warning.warning(WarningCode.OVERLAP, firstId,
                                "Elements '" + firstId + "' and '" + secondId + "' overlap"));
                    }
                }
            }
        }
    }

    private static boolean isExemptFromOverlap(ProcessDocument document, NodeRef ref) {
        if (!ref.isElement()) {
            return false;
        }
        ElementKind kind = document.element(ref.index()).getKind();
        return kind == ElementKind.GROUP || kind == ElementKind.BOUNDARY_EVENT;
    }

    private static boolean isUnconnected(ProcessDocument document, NodeRef ref) {
        return document.incoming(ref).isEmpty() && document.outgoing(ref).isEmpty();
    }

    private static boolean isEntryPoint(ProcessDocument document, NodeRef child) {
        if (child.isContainer()) {
            return document.container(child.index()).getKind() == ContainerKind.EVENT_SUBPROCESS;
        }
        return document.element(child.index()).getKind() == ElementKind.START_EVENT;
    }

    private static boolean insideSubprocess(ProcessDocument document, NodeRef ref) {
        return document.ancestors(ref).stream().anyMatch(index -> document.container(index).isSubprocess());
    }
}
