package org.processdiagram.converter.layout;

import org.processdiagram.converter.validation.Warning;

import java.util.List;

/**
 * @param appliedMode the mode actually used, which differs from the requested one when preserve had to fall back
 * @param warnings    degradation and correction notices
 */
public record LayoutResult(LayoutMode appliedMode, List<Warning> warnings) {
}
