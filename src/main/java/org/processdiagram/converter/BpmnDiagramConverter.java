package org.processdiagram.converter;

import lombok.extern.slf4j.Slf4j;
import org.processdiagram.converter.bpmn.BpmnParser;
import org.processdiagram.converter.bpmn.BpmnSchemaValidator;
import org.processdiagram.converter.bpmn.MalformedSourceException;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.config.ConverterConfig;
import org.processdiagram.converter.generator.DiagramCell;
import org.processdiagram.converter.generator.DiagramGenerator;
import org.processdiagram.converter.generator.StyleLookup;
import org.processdiagram.converter.layout.ContainerLayoutEngine;
import org.processdiagram.converter.layout.LayoutResult;
import org.processdiagram.converter.routing.EdgeRouter;
import org.processdiagram.converter.routing.RoutingResult;
import org.processdiagram.converter.validation.ModelValidator;
import org.processdiagram.converter.validation.Warning;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the whole pipeline: parse, validate, lay out, route, generate.
 * Only {@link MalformedSourceException} stops a conversion; everything else ends up as a warning.
 */
@Slf4j
public class BpmnDiagramConverter {
    private final ConverterConfig config;
    private final StyleLookup styles;

    public BpmnDiagramConverter(ConverterConfig config, StyleLookup styles) {
        this.config = config;
        this.styles = styles;
    }

    public BpmnDiagramConverter() {
        this(ConverterConfig.defaults(), StyleLookup.themed());
    }

    public ConversionResult convert(Path bpmnFile) {
        try {
            return convert(Files.readAllBytes(bpmnFile));
        } catch (IOException e) {
            throw new MalformedSourceException("Failed to read BPMN file: " + bpmnFile, e);
        }
    }

    public ConversionResult convert(InputStream in) {
        try {
            return convert(in.readAllBytes());
        } catch (IOException e) {
            throw new MalformedSourceException("Failed to read BPMN stream", e);
        }
    }

    public ConversionResult convertString(String xml) {
        return convert(xml.getBytes(StandardCharsets.UTF_8));
    }

    public ConversionResult convert(byte[] xml) {
        log.info("Converting BPMN document ({} bytes, layout={}, direction={})",
                xml.length, config.layoutMode.value(), config.direction);

        ProcessDocument document = BpmnParser.parse(xml);

        List<Warning> warnings = new ArrayList<>();
        if (config.schemaValidation) {
            warnings.addAll(BpmnSchemaValidator.validate(xml));
        }
        warnings.addAll(ModelValidator.validate(document));

        LayoutResult layout = new ContainerLayoutEngine(config).layout(document, config.layoutMode);
        warnings.addAll(layout.warnings());

        RoutingResult routing = new EdgeRouter(config).route(document, layout.appliedMode());
        warnings.addAll(routing.warnings());

        List<DiagramCell> cells = new DiagramGenerator(styles, config.theme)
                .generate(document, routing.routes(), warnings);

        log.info("Converted {} elements and {} flows into {} cells with {} warnings",
                document.elements().size(), document.flows().size(), cells.size(), warnings.size());
        return new ConversionResult(cells, List.copyOf(warnings), document, routing.routes(), layout.appliedMode());
    }
}
