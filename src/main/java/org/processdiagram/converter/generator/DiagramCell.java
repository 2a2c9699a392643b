package org.processdiagram.converter.generator;

import lombok.Builder;
import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.KindKey;
import org.processdiagram.converter.bpmn.models.Point;
import org.processdiagram.converter.routing.EdgeTreatment;
import org.processdiagram.converter.validation.Warning;

import java.util.List;

/**
 * One renderable cell. Geometry and waypoints are relative to the parent cell, or absolute for root cells.
 */
@Builder
public record DiagramCell(
        String id,
        CellType type,
        String sourceId,  // BPMN id this cell was generated from
        String parentId,  // null for root cells
        KindKey kind,
        String label,
        StyleKey style,
        Bounds geometry,  // null for edges
        List<Point> waypoints,  // edges only

        //for edges
        String sourceCellId,
        String targetCellId,
        EdgeTreatment treatment,

        List<Warning> warnings
) {
    public DiagramCell {
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isEdge() {
        return type == CellType.EDGE;
    }
}
