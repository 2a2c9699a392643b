package org.processdiagram.converter.bpmn.models;

public enum NodeType {
    ELEMENT,
    CONTAINER
}
