package org.processdiagram.converter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Spacing, header sizes and minimum sizes used by the layout engine, in diagram units.
 * "Length" is measured along the rank direction, "depth" across it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutSettings {
    public double rankGap = 60;
    public double nodeGap = 40;
    public double containerMargin = 20;

    public double poolHeaderSize = 40;
    public double laneHeaderSize = 30;
    public double subprocessHeaderSize = 20;

    public double minPoolLength = 400;
    public double minPoolDepth = 150;
    public double minLaneDepth = 120;
    public double minSubprocessWidth = 200;
    public double minSubprocessHeight = 150;

    public double poolGap = 40;
    public double diagramMargin = 50;

    /**
     * Minimum free space between boundary events attached to the same host.
     */
    public double boundaryEventGap = 14;

    /**
     * Columns of the grid used when ranking is abandoned.
     */
    public int gridColumns = 5;

    /**
     * Upper bound on estimated ranking work (nodes times edges) per rank domain before falling back to a grid.
     */
    public long maxRankingWork = 1_000_000;
}
