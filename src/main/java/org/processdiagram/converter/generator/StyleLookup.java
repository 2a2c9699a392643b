package org.processdiagram.converter.generator;

import org.processdiagram.converter.bpmn.models.KindKey;

/**
 * Maps a kind to a style for a theme. The generator never styles anything itself.
 */
@FunctionalInterface
public interface StyleLookup {

    StyleKey styleFor(KindKey kind, String theme);

    /**
     * Keys of the form {@code theme.kind}, e.g. {@code default.userTask}.
     */
    static StyleLookup themed() {
        return (kind, theme) -> new StyleKey(theme + "." + kind.key());
    }
}
