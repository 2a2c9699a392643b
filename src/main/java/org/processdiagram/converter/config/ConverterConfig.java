package org.processdiagram.converter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.processdiagram.converter.layout.Direction;
import org.processdiagram.converter.layout.LayoutMode;

/**
 * Root configuration of a conversion.
 * Every field has a default, so an empty JSON object is a valid configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    /**
     * "compute" lays the diagram out from scratch, "preserve" keeps the source geometry when it is complete.
     */
    public LayoutMode layoutMode = LayoutMode.COMPUTE;

    /**
     * Direction in which ranks advance: LR, TB, RL or BT.
     */
    public Direction direction = Direction.LR;

    /**
     * Theme name handed to the style lookup.
     */
    public String theme = "default";

    /**
     * Check the source against the BPMN 2.0 XML schema before converting.
     */
    public boolean schemaValidation = false;

    public LayoutSettings layout = new LayoutSettings();
    public RoutingSettings routing = new RoutingSettings();

    public static ConverterConfig defaults() {
        return new ConverterConfig();
    }
}
