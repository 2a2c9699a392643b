package org.processdiagram.converter.generator;

import org.processdiagram.converter.bpmn.BpmnParser;
import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.ContainerKind;
import org.processdiagram.converter.bpmn.models.ElementKind;
import org.processdiagram.converter.bpmn.models.FlowKind;
import org.processdiagram.converter.bpmn.models.NodeRef;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.config.ConverterConfig;
import org.processdiagram.converter.layout.ContainerLayoutEngine;
import org.processdiagram.converter.layout.LayoutMode;
import org.processdiagram.converter.routing.EdgeRouter;
import org.processdiagram.converter.routing.EdgeTreatment;
import org.processdiagram.converter.routing.Route;
import org.processdiagram.converter.validation.ModelValidator;
import org.processdiagram.converter.validation.Warning;
import org.processdiagram.converter.validation.WarningCode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagramGeneratorTest {
    private static final Path GATEWAY_BPMN = Path.of("src/test/resources/bpmn/gateway_branches.bpmn");
    private static final Path SUBPROCESS_BPMN = Path.of("src/test/resources/bpmn/subprocess.bpmn");
    private static final Path TWO_POOLS_BPMN = Path.of("src/test/resources/bpmn/two_pools.bpmn");
    private static final Path NESTED_LANES_BPMN = Path.of("src/test/resources/bpmn/nested_lanes.bpmn");
    private static final Path EMPTY_BPMN = Path.of("src/test/resources/bpmn/empty_containers.bpmn");
    private static final Path EMPTY_DI_BPMN = Path.of("src/test/resources/bpmn/empty_containers_di.bpmn");

    @Test
    void shouldEmitSubprocessContentUnderSubprocessCell() {
        List<DiagramCell> cells = generate(BpmnParser.parse(SUBPROCESS_BPMN), List.of());

        List<DiagramCell> innerShapes = cells.stream()
                .filter(cell -> cell.type() == CellType.SHAPE && "Handle".equals(cell.parentId()))
                .toList();
        List<DiagramCell> innerEdges = cells.stream()
                .filter(cell -> cell.type() == CellType.EDGE && "Handle".equals(cell.parentId()))
                .toList();

        assertEquals(List.of("Sub_Start", "Check", "Pay", "Sub_End"), innerShapes.stream().map(DiagramCell::id).toList());
        assertEquals(List.of("SF1", "SF2", "SF3"), innerEdges.stream().map(DiagramCell::id).toList());
        assertEquals(ContainerKind.SUBPROCESS, cell(cells, "Handle").kind());
    }

    @Test
    void shouldEmitContainersBeforeChildrenAndEdgesLast() {
        List<DiagramCell> cells = generate(BpmnParser.parse(SUBPROCESS_BPMN), List.of());

        assertTrue(indexOf(cells, "Handle") < indexOf(cells, "Sub_Start"));
        assertTrue(indexOf(cells, "Check") < indexOf(cells, "Check__loop"));

        int firstEdge = cells.indexOf(cells.stream().filter(DiagramCell::isEdge).findFirst().orElseThrow());
        for (int i = firstEdge; i < cells.size(); i++) {
            assertTrue(cells.get(i).isEdge(), cells.get(i).id());
        }
        for (DiagramCell cell : cells) {
            if (cell.parentId() != null) {
                assertTrue(indexOf(cells, cell.parentId()) < indexOf(cells, cell.id()), cell.id());
            }
        }
    }

    @Test
    void shouldSkipSyntheticContainers() {
        ProcessDocument document = BpmnParser.parse(GATEWAY_BPMN);
        List<DiagramCell> cells = generate(document, List.of());

        assertTrue(cells.stream().noneMatch(cell -> cell.type() == CellType.CONTAINER));
        DiagramCell review = cell(cells, "Review");
        assertNull(review.parentId());
        assertEquals(document.bounds(document.find("Review").orElseThrow()), review.geometry());
        assertEquals(17, cells.size());
    }

    @Test
    void shouldEmitTwoPoolsAndMessageFlowsAtRoot() {
        List<DiagramCell> cells = generate(BpmnParser.parse(TWO_POOLS_BPMN), List.of());

        List<DiagramCell> pools = cells.stream().filter(cell -> cell.type() == CellType.CONTAINER).toList();
        assertEquals(List.of("Pool_Customer", "Pool_Shop"), pools.stream().map(DiagramCell::id).toList());

        List<DiagramCell> messages = cells.stream().filter(cell -> cell.kind() == FlowKind.MESSAGE).toList();
        assertEquals(4, messages.size());
        for (DiagramCell message : messages) {
            assertNull(message.parentId());
            assertEquals(EdgeTreatment.MESSAGE, message.treatment());
        }
        assertEquals("Pool_Shop", cell(cells, "M3").targetCellId());
        assertEquals("C_End", cell(cells, "M3").sourceCellId());

        // Sequence flows stay inside their pool
        assertEquals("Pool_Customer", cell(cells, "CF1").parentId());
    }

    @Test
    void shouldEmitEmptyContainersWithSize() {
        List<DiagramCell> cells = generate(BpmnParser.parse(EMPTY_BPMN), List.of());

        List<DiagramCell> containers = cells.stream().filter(cell -> cell.type() == CellType.CONTAINER).toList();
        assertEquals(List.of("Pool_Main", "Wrap", "Pool_Empty", "Pool_Partner"),
                containers.stream().map(DiagramCell::id).toList());
        for (DiagramCell container : containers) {
            assertTrue(container.geometry().width() > 0 && container.geometry().height() > 0, container.id());
        }
        assertEquals("Pool_Main", cell(cells, "Wrap").parentId());
        assertTrue(cells.stream().noneMatch(cell -> "Pool_Empty".equals(cell.parentId())
                || "Pool_Partner".equals(cell.parentId()) || "Wrap".equals(cell.parentId())));
        assertFalse(cell(cells, "Pool_Main").geometry().intersects(cell(cells, "Pool_Empty").geometry()));
        assertFalse(cell(cells, "Pool_Empty").geometry().intersects(cell(cells, "Pool_Partner").geometry()));
        assertEquals("Pool_Partner", cell(cells, "M1").targetCellId());
    }

    @Test
    void shouldEmitSeparateBoundaryEventCells() {
        List<DiagramCell> cells = generate(BpmnParser.parse(EMPTY_BPMN), List.of());

        List<DiagramCell> events = List.of(cell(cells, "B1"), cell(cells, "B2"), cell(cells, "B3"));
        Bounds review = cell(cells, "Review").geometry();
        for (int a = 0; a < events.size(); a++) {
            assertEquals(cell(cells, "Review").parentId(), events.get(a).parentId());
            assertEquals(review.maxY(), events.get(a).geometry().centerY(), 1e-6);
            for (int b = a + 1; b < events.size(); b++) {
                assertFalse(events.get(a).geometry().intersects(events.get(b).geometry()),
                        events.get(a).id() + " overlaps " + events.get(b).id());
            }
        }
    }

    @Test
    void shouldKeepSourceGeometryOfEmptyPool() {
        ConverterConfig config = ConverterConfig.defaults();
        ProcessDocument document = BpmnParser.parse(EMPTY_DI_BPMN);
        new ContainerLayoutEngine(config).layout(document, LayoutMode.PRESERVE);
        List<Route> routes = new EdgeRouter(config).route(document, LayoutMode.PRESERVE).routes();

        List<DiagramCell> cells = new DiagramGenerator(StyleLookup.themed(), "default")
                .generate(document, routes, List.of());

        assertEquals(new Bounds(160, 400, 600, 150), cell(cells, "Ext").geometry());
        assertEquals(new Bounds(160, 600, 600, 100), cell(cells, "Pool_Partner").geometry());
        assertEquals(new Bounds(140, 60, 200, 120), cell(cells, "Wrap").geometry());
        assertEquals("Pool_Main", cell(cells, "Wrap").parentId());
    }

    @Test
    void shouldMakeGeometryRelativeToParent() {
        ProcessDocument document = laidOut(BpmnParser.parse(TWO_POOLS_BPMN));
        List<Route> routes = new EdgeRouter(ConverterConfig.defaults()).route(document, LayoutMode.COMPUTE).routes();
        List<DiagramCell> cells = new DiagramGenerator(StyleLookup.themed(), "default")
                .generate(document, routes, List.of());

        Bounds pool = document.bounds(document.find("Pool_Shop").orElseThrow());
        Bounds task = document.bounds(document.find("S_Process").orElseThrow());
        DiagramCell cell = cell(cells, "S_Process");

        assertEquals("Pool_Shop", cell.parentId());
        assertEquals(new Bounds(task.x() - pool.x(), task.y() - pool.y(), task.width(), task.height()),
                cell.geometry());

        Route absolute = routes.stream().filter(route -> route.flowId().equals("SF1")).findFirst().orElseThrow();
        DiagramCell edge = cell(cells, "SF1");
        assertEquals(absolute.waypoints().size(), edge.waypoints().size());
        for (int i = 0; i < edge.waypoints().size(); i++) {
            assertEquals(absolute.waypoints().get(i).translate(-pool.x(), -pool.y()), edge.waypoints().get(i));
        }

        // Root cells keep absolute coordinates
        assertEquals(pool, cell(cells, "Pool_Shop").geometry());
    }

    @Test
    void shouldDecorateTasksGatewaysAndEvents() {
        List<DiagramCell> cells = generate(BpmnParser.parse(GATEWAY_BPMN), List.of());

        DiagramCell userIcon = cell(cells, "Review__marker");
        assertEquals(CellType.DECORATION, userIcon.type());
        assertEquals("Review", userIcon.parentId());
        assertEquals(MarkerKind.USER_TASK_ICON, userIcon.kind());
        assertEquals(new Bounds(5, 5, 20, 20), userIcon.geometry());

        DiagramCell gatewayMarker = cell(cells, "Decide__marker");
        assertEquals(MarkerKind.EXCLUSIVE_GATEWAY_MARKER, gatewayMarker.kind());
        assertEquals(new Bounds(15, 15, 20, 20), gatewayMarker.geometry());

        // Plain start and end events carry no symbol
        assertTrue(cells.stream().noneMatch(cell -> cell.id().equals("Start__marker")));
    }

    @Test
    void shouldAddLoopMarkersAndEventIcons() {
        List<DiagramCell> cells = generate(BpmnParser.parse(SUBPROCESS_BPMN), List.of());

        DiagramCell loop = cell(cells, "Check__loop");
        assertEquals(MarkerKind.STANDARD_LOOP_MARKER, loop.kind());
        assertEquals(new Bounds(52, 62, 16, 16), loop.geometry());
        assertEquals(MarkerKind.SEQUENTIAL_MULTI_INSTANCE_MARKER, cell(cells, "Pay__loop").kind());
        assertEquals(MarkerKind.SERVICE_TASK_ICON, cell(cells, "Pay__marker").kind());
        assertEquals(MarkerKind.TIMER_EVENT_ICON, cell(cells, "Timeout__marker").kind());
        assertEquals(new Bounds(8, 8, 20, 20), cell(cells, "Timeout__marker").geometry());
    }

    @Test
    void shouldLookUpStylesThroughLookup() {
        List<String> requested = new ArrayList<>();
        StyleLookup recording = (kind, theme) -> {
            requested.add(theme + ":" + kind.key());
            return new StyleKey(kind.key());
        };
        ProcessDocument document = laidOut(BpmnParser.parse(GATEWAY_BPMN));
        List<Route> routes = new EdgeRouter(ConverterConfig.defaults()).route(document, LayoutMode.COMPUTE).routes();

        List<DiagramCell> cells = new DiagramGenerator(recording, "dark").generate(document, routes, List.of());

        assertEquals(cells.size(), requested.size());
        assertTrue(requested.contains("dark:userTask"));
        assertTrue(requested.contains("dark:conditionalFlow"));
        assertEquals(new StyleKey("exclusiveGateway"), cell(cells, "Decide").style());
    }

    @Test
    void shouldUseThemedStyleKeys() {
        List<DiagramCell> cells = generate(BpmnParser.parse(GATEWAY_BPMN), List.of());

        assertEquals(new StyleKey("default.userTask"), cell(cells, "Review").style());
        assertEquals(new StyleKey("default.sequenceFlow"), cell(cells, "F1").style());
        assertEquals(ElementKind.EXCLUSIVE_GATEWAY, cell(cells, "Decide").kind());
    }

    @Test
    void shouldAttachWarningsToCells() {
        ProcessDocument document = BpmnParser.parse(GATEWAY_BPMN);
        List<Warning> warnings = ModelValidator.validate(document);

        List<DiagramCell> cells = generate(document, warnings);

        DiagramCell escalate = cell(cells, "F_Escalate");
        assertEquals(1, escalate.warnings().size());
        assertEquals(WarningCode.MISSING_CONDITION, escalate.warnings().get(0).code());
        assertTrue(cell(cells, "F_Approve").warnings().isEmpty());
    }

    @Test
    void shouldEmitImplicitLaneWithoutSourceId() {
        List<DiagramCell> cells = generate(BpmnParser.parse(NESTED_LANES_BPMN), List.of());

        DiagramCell unassigned = cell(cells, "Pool_Org__unassigned");
        assertEquals(CellType.CONTAINER, unassigned.type());
        assertNull(unassigned.sourceId());
        assertEquals("Pool_Org", unassigned.parentId());
        assertEquals("Lane_Sales", cell(cells, "Lane_Inside").parentId());
        assertEquals("Lane_Inside", cell(cells, "Start").parentId());
    }

    @Test
    void shouldParentEdgeToLowestCommonRenderedAncestor() {
        ProcessDocument document = BpmnParser.parse(NESTED_LANES_BPMN);
        NodeRef start = document.find("Start").orElseThrow();
        NodeRef visit = document.find("Visit").orElseThrow();
        NodeRef deliver = document.find("Deliver").orElseThrow();

        assertEquals(document.find("Lane_Sales").orElseThrow().index(),
                DiagramGenerator.lowestCommonRenderedAncestor(document, start, visit));
        assertEquals(document.find("Pool_Org").orElseThrow().index(),
                DiagramGenerator.lowestCommonRenderedAncestor(document, visit, deliver));
    }

    private static ProcessDocument laidOut(ProcessDocument document) {
        new ContainerLayoutEngine(ConverterConfig.defaults()).layout(document, LayoutMode.COMPUTE);
        return document;
    }

    private static List<DiagramCell> generate(ProcessDocument document, List<Warning> warnings) {
        laidOut(document);
        List<Route> routes = new EdgeRouter(ConverterConfig.defaults()).route(document, LayoutMode.COMPUTE).routes();
        return new DiagramGenerator(StyleLookup.themed(), "default").generate(document, routes, warnings);
    }

    private static DiagramCell cell(List<DiagramCell> cells, String id) {
        return cells.stream()
                .filter(cell -> cell.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No cell " + id));
    }

    private static int indexOf(List<DiagramCell> cells, String id) {
        return cells.indexOf(cell(cells, id));
    }
}
