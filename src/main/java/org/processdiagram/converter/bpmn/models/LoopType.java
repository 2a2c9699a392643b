package org.processdiagram.converter.bpmn.models;

public enum LoopType {
    NONE,
    STANDARD,
    MULTI_INSTANCE_PARALLEL,
    MULTI_INSTANCE_SEQUENTIAL
}
