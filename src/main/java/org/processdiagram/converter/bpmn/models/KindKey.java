package org.processdiagram.converter.bpmn.models;

/**
 * Anything a style can be looked up for: element kinds, container kinds, flow kinds and markers.
 */
public interface KindKey {

    /**
     * Stable lower camel case key, e.g. {@code userTask} or {@code messageFlow}.
     */
    String key();
}
