package org.processdiagram.converter;

import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.generator.CellType;
import org.processdiagram.converter.generator.DiagramCell;
import org.processdiagram.converter.layout.LayoutMode;
import org.processdiagram.converter.routing.Route;
import org.processdiagram.converter.validation.Warning;
import org.processdiagram.converter.validation.WarningCode;

import java.util.List;
import java.util.Optional;

/**
 * Output of one conversion.
 *
 * @param cells       renderable cells in emission order
 * @param warnings    every warning of the pipeline, in stage order
 * @param document    the laid-out document
 * @param routes      one route per flow, in document flow order
 * @param appliedMode layout mode actually used
 */
public record ConversionResult(List<DiagramCell> cells,
                               List<Warning> warnings,
                               ProcessDocument document,
                               List<Route> routes,
                               LayoutMode appliedMode) {

    public List<DiagramCell> cellsOfType(CellType type) {
        return cells.stream().filter(cell -> cell.type() == type).toList();
    }

    public Optional<DiagramCell> cell(String id) {
        return cells.stream().filter(cell -> cell.id().equals(id)).findFirst();
    }

    public List<Warning> warnings(WarningCode code) {
        return warnings.stream().filter(warning -> warning.code() == code).toList();
    }
}
