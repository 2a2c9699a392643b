package org.processdiagram.converter.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;
import org.processdiagram.converter.validation.Warning;
import org.processdiagram.converter.validation.WarningCode;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Checks a BPMN document against the BPMN 2.0 XML schema using the Camunda model API.
 * Schema problems never stop a conversion, they are reported as warnings.
 */
@Slf4j
public class BpmnSchemaValidator {

    /**
     * Validates BPMN XML.
     *
     * @param xml raw document bytes
     * @return a single {@link WarningCode#SCHEMA_VIOLATION} warning, or an empty list when the document is valid
     */
    public static List<Warning> validate(byte[] xml) {
        try {
            BpmnModelInstance modelInstance = Bpmn.readModelFromStream(new ByteArrayInputStream(xml));
            Bpmn.validateModel(modelInstance);  // throws exception if invalid
            return List.of();
        } catch (ModelException e) {
            log.warn("BPMN document does not conform to the BPMN 2.0 schema: {}", rootMessage(e));
            return List.of(Warning.warning(WarningCode.SCHEMA_VIOLATION, null,
                    "Document does not conform to the BPMN 2.0 schema: " + rootMessage(e)));
        }
    }

    /**
     * Validates a BPMN file from disk.
     */
    public static List<Warning> validate(Path bpmnFile) {
        try {
            return validate(Files.readAllBytes(bpmnFile));
        } catch (IOException e) {
            throw new MalformedSourceException("Failed to read BPMN file: " + bpmnFile, e);
        }
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(byte[] xml) {
        return validate(xml).isEmpty();
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : e.getMessage();
    }
}
