package org.processdiagram.converter.bpmn.models;

public enum ElementCategory {
    EVENT,
    ACTIVITY,
    GATEWAY,
    DATA,
    ARTIFACT,
    GENERIC
}
