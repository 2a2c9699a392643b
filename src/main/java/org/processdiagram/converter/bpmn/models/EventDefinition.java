package org.processdiagram.converter.bpmn.models;

import java.util.Arrays;
import java.util.Optional;

public enum EventDefinition {
    NONE(null),
    MESSAGE("messageEventDefinition"),
    TIMER("timerEventDefinition"),
    ERROR("errorEventDefinition"),
    SIGNAL("signalEventDefinition"),
    ESCALATION("escalationEventDefinition"),
    COMPENSATION("compensateEventDefinition"),
    CONDITIONAL("conditionalEventDefinition"),
    LINK("linkEventDefinition"),
    TERMINATE("terminateEventDefinition"),
    CANCEL("cancelEventDefinition"),
    MULTIPLE(null);

    private final String tag;

    EventDefinition(String tag) {
        this.tag = tag;
    }

    public static Optional<EventDefinition> fromTag(String localName) {
        return Arrays.stream(values())
                .filter(definition -> definition.tag != null && definition.tag.equals(localName))
                .findFirst();
    }
}
