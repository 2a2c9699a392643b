package org.processdiagram.converter.bpmn.models;

public enum FlowKind implements KindKey {
    SEQUENCE("sequenceFlow"),
    CONDITIONAL("conditionalFlow"),
    DEFAULT("defaultFlow"),
    MESSAGE("messageFlow"),
    ASSOCIATION("association");

    private final String key;

    FlowKind(String key) {
        this.key = key;
    }

    @Override
    public String key() {
        return key;
    }

    /**
     * Sequence, conditional and default flows all carry control flow inside one pool.
     */
    public boolean isSequenceLike() {
        return this == SEQUENCE || this == CONDITIONAL || this == DEFAULT;
    }
}
