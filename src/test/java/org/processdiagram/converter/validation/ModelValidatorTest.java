package org.processdiagram.converter.validation;

import org.processdiagram.converter.bpmn.BpmnParser;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelValidatorTest {
    private static final Path GATEWAY_BPMN = Path.of("src/test/resources/bpmn/gateway_branches.bpmn");
    private static final Path GATEWAY_DEFAULT_BPMN = Path.of("src/test/resources/bpmn/gateway_default.bpmn");
    private static final Path SUBPROCESS_BPMN = Path.of("src/test/resources/bpmn/subprocess.bpmn");
    private static final Path TWO_POOLS_BPMN = Path.of("src/test/resources/bpmn/two_pools.bpmn");
    private static final Path DATA_BPMN = Path.of("src/test/resources/bpmn/data_and_artifacts.bpmn");
    private static final Path WITH_DI_BPMN = Path.of("src/test/resources/bpmn/with_di.bpmn");

    private static final String HEADER = """
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL" id="D">
              <bpmn:process id="P">
            """;
    private static final String FOOTER = """
              </bpmn:process>
            </bpmn:definitions>
            """;

    @Test
    void shouldWarnOnceForUnlabeledGatewayBranch() {
        List<Warning> warnings = ModelValidator.validate(BpmnParser.parse(GATEWAY_BPMN));

        assertEquals(1, warnings.size());
        Warning warning = warnings.get(0);
        assertEquals(WarningCode.MISSING_CONDITION, warning.code());
        assertEquals(Severity.WARNING, warning.severity());
        assertEquals("F_Escalate", warning.elementId());
    }

    @Test
    void shouldNotWarnWhenUnlabeledBranchIsDefault() {
        List<Warning> warnings = ModelValidator.validate(BpmnParser.parse(GATEWAY_DEFAULT_BPMN));

        assertTrue(warnings.isEmpty());
    }

    @Test
    void shouldAcceptCleanDocuments() {
        assertTrue(ModelValidator.validate(BpmnParser.parse(SUBPROCESS_BPMN)).isEmpty());
        assertTrue(ModelValidator.validate(BpmnParser.parse(TWO_POOLS_BPMN)).isEmpty());
    }

    @Test
    void shouldReportUnresolvedReferenceOrphanAndMissingLabel() {
        List<Warning> warnings = ModelValidator.validate(BpmnParser.parse(DATA_BPMN));

        Warning unresolved = single(warnings, WarningCode.UNRESOLVED_REFERENCE);
        assertEquals(Severity.RECOVERABLE_ERROR, unresolved.severity());
        assertEquals("F4", unresolved.elementId());
        assertTrue(unresolved.message().contains("Ghost"));

        assertEquals("Lonely", single(warnings, WarningCode.ORPHAN_ELEMENT).elementId());
        assertEquals("Lonely", single(warnings, WarningCode.MISSING_LABEL).elementId());
        assertEquals(Severity.INFO, single(warnings, WarningCode.MISSING_LABEL).severity());

        // Orphans are not reported a second time as unreachable, and data objects never are
        assertTrue(ofCode(warnings, WarningCode.DISCONNECTED).isEmpty());
    }

    @Test
    void shouldReportMissingStartAndEndEvents() {
        String xml = HEADER + """
                    <bpmn:task id="A" name="A" />
                    <bpmn:task id="B" name="B" />
                    <bpmn:sequenceFlow id="F1" sourceRef="A" targetRef="B" />
                """ + FOOTER;

        List<Warning> warnings = ModelValidator.validate(BpmnParser.parseString(xml));

        assertEquals(1, ofCode(warnings, WarningCode.NO_START_EVENT).size());
        assertEquals(1, ofCode(warnings, WarningCode.NO_END_EVENT).size());
        assertNull(single(warnings, WarningCode.NO_START_EVENT).elementId());
    }

    @Test
    void shouldReportNodesUnreachableFromStart() {
        String xml = HEADER + """
                    <bpmn:startEvent id="S" />
                    <bpmn:task id="A" name="A" />
                    <bpmn:endEvent id="E" />
                    <bpmn:task id="B" name="B" />
                    <bpmn:task id="C" name="C" />
                    <bpmn:sequenceFlow id="F1" sourceRef="S" targetRef="A" />
                    <bpmn:sequenceFlow id="F2" sourceRef="A" targetRef="E" />
                    <bpmn:sequenceFlow id="F3" sourceRef="B" targetRef="C" />
                """ + FOOTER;

        List<Warning> warnings = ModelValidator.validate(BpmnParser.parseString(xml));

        List<String> disconnected = ofCode(warnings, WarningCode.DISCONNECTED).stream()
                .map(Warning::elementId)
                .toList();
        assertEquals(List.of("B", "C"), disconnected);
        assertTrue(ofCode(warnings, WarningCode.ORPHAN_ELEMENT).isEmpty());
    }

    @Test
    void shouldIgnoreBranchesOfParallelGateway() {
        String xml = HEADER + """
                    <bpmn:startEvent id="S" />
                    <bpmn:parallelGateway id="Split" />
                    <bpmn:task id="A" name="A" />
                    <bpmn:task id="B" name="B" />
                    <bpmn:parallelGateway id="Join" />
                    <bpmn:endEvent id="E" />
                    <bpmn:sequenceFlow id="F1" sourceRef="S" targetRef="Split" />
                    <bpmn:sequenceFlow id="F2" sourceRef="Split" targetRef="A" />
                    <bpmn:sequenceFlow id="F3" sourceRef="Split" targetRef="B" />
                    <bpmn:sequenceFlow id="F4" sourceRef="A" targetRef="Join" />
                    <bpmn:sequenceFlow id="F5" sourceRef="B" targetRef="Join" />
                    <bpmn:sequenceFlow id="F6" sourceRef="Join" targetRef="E" />
                """ + FOOTER;

        assertTrue(ModelValidator.validate(BpmnParser.parseString(xml)).isEmpty());
    }

    @Test
    void shouldReportOverlappingShapes() throws IOException {
        String xml = Files.readString(WITH_DI_BPMN)
                .replace("<dc:Bounds x=\"450\" y=\"160\"", "<dc:Bounds x=\"350\" y=\"160\"");

        List<Warning> warnings = ModelValidator.validate(BpmnParser.parseString(xml));

        Warning overlap = single(warnings, WarningCode.OVERLAP);
        assertEquals("Task_A", overlap.elementId());
        assertTrue(overlap.message().contains("Task_B"));
    }

    @Test
    void shouldSkipOverlapCheckWithoutGeometry() {
        List<Warning> warnings = new ArrayList<>();
        ModelValidator.checkOverlaps(BpmnParser.parse(GATEWAY_BPMN), warnings);
        assertTrue(warnings.isEmpty());
    }

    @Test
    void shouldNotModifyDocument() {
        ProcessDocument document = BpmnParser.parse(DATA_BPMN);
        int flows = document.flows().size();

        ModelValidator.validate(document);
        ModelValidator.validate(document);

        assertEquals(flows, document.flows().size());
        assertNull(document.element(0).getBounds());
    }

    @Test
    void shouldCarryParseDiagnosticsFirst() {
        String xml = HEADER + """
                    <bpmn:startEvent id="S" />
                    <bpmn:robotTask id="R" name="Robot" />
                    <bpmn:endEvent id="E" />
                    <bpmn:sequenceFlow id="F1" sourceRef="S" targetRef="R" />
                    <bpmn:sequenceFlow id="F2" sourceRef="R" targetRef="E" />
                """ + FOOTER;

        List<Warning> warnings = ModelValidator.validate(BpmnParser.parseString(xml));

        assertEquals(WarningCode.UNSUPPORTED_KIND, warnings.get(0).code());
        assertEquals("R", warnings.get(0).elementId());
    }

    private static List<Warning> ofCode(List<Warning> warnings, WarningCode code) {
        return warnings.stream().filter(warning -> warning.code() == code).toList();
    }

    private static Warning single(List<Warning> warnings, WarningCode code) {
        List<Warning> matching = ofCode(warnings, code);
        assertEquals(1, matching.size(), "Expected exactly one " + code + " in " + warnings);
        return matching.get(0);
    }
}
