package org.processdiagram.converter.bpmn.models;

import java.util.Optional;

public enum ContainerKind implements KindKey {
    POOL("pool"),
    LANE("lane"),
    SUBPROCESS("subProcess"),
    TRANSACTION("transaction"),
    AD_HOC_SUBPROCESS("adHocSubProcess"),
    EVENT_SUBPROCESS("eventSubProcess");

    private final String key;

    ContainerKind(String key) {
        this.key = key;
    }

    /**
     * Maps a BPMN subprocess tag to its container kind.
     *
     * @param localName        element local name
     * @param triggeredByEvent value of the {@code triggeredByEvent} attribute
     */
    public static Optional<ContainerKind> subprocessFromTag(String localName, boolean triggeredByEvent) {
        return switch (localName) {
            case "subProcess" -> Optional.of(triggeredByEvent ? EVENT_SUBPROCESS : SUBPROCESS);
            case "transaction" -> Optional.of(TRANSACTION);
            case "adHocSubProcess" -> Optional.of(AD_HOC_SUBPROCESS);
            default -> Optional.empty();
        };
    }

    @Override
    public String key() {
        return key;
    }

    public boolean isSubprocess() {
        return this != POOL && this != LANE;
    }
}
