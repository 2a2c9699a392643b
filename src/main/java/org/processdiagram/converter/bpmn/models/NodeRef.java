package org.processdiagram.converter.bpmn.models;

/**
 * Index into one of the arena tables of a {@link ProcessDocument}.
 * Used for container children and for resolved flow endpoints.
 */
public record NodeRef(NodeType type, int index) {

    public static NodeRef element(int index) {
        return new NodeRef(NodeType.ELEMENT, index);
    }

    public static NodeRef container(int index) {
        return new NodeRef(NodeType.CONTAINER, index);
    }

    public boolean isElement() {
        return type == NodeType.ELEMENT;
    }

    public boolean isContainer() {
        return type == NodeType.CONTAINER;
    }
}
