package org.processdiagram.converter.generator;

public enum CellType {
    CONTAINER,
    SHAPE,
    EDGE,
    DECORATION
}
