package org.processdiagram.converter.generator;

/**
 * Opaque style reference resolved by the renderer.
 */
public record StyleKey(String value) {
}
