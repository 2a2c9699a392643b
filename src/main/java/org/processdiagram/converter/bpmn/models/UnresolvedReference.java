package org.processdiagram.converter.bpmn.models;

/**
 * A flow that was dropped because one of its endpoints does not name a usable node.
 */
public record UnresolvedReference(String flowId, FlowKind kind, String missingRef) {
}
