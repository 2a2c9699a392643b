package org.processdiagram.converter.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.processdiagram.converter.bpmn.models.Bounds;
import org.processdiagram.converter.bpmn.models.Container;
import org.processdiagram.converter.bpmn.models.ContainerKind;
import org.processdiagram.converter.bpmn.models.Element;
import org.processdiagram.converter.bpmn.models.ElementKind;
import org.processdiagram.converter.bpmn.models.EventDefinition;
import org.processdiagram.converter.bpmn.models.Flow;
import org.processdiagram.converter.bpmn.models.FlowKind;
import org.processdiagram.converter.bpmn.models.LoopType;
import org.processdiagram.converter.bpmn.models.Point;
import org.processdiagram.converter.bpmn.models.ProcessDocument;
import org.processdiagram.converter.bpmn.models.ProcessDocumentBuilder;
import org.processdiagram.converter.validation.Warning;
import org.processdiagram.converter.validation.WarningCode;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads BPMN 2.0 XML into a {@link ProcessDocument}.
 * <p>
 * The parser is tolerant: unknown tags are skipped, unsupported flow nodes are kept as
 * {@link ElementKind#GENERIC}, and flows with dangling references are left for the validator to report.
 * Only documents that are not BPMN at all, or that break the containment model, are rejected.
 */
@Slf4j
public class BpmnParser {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";

    private final ProcessDocumentBuilder builder = new ProcessDocumentBuilder();
    private final Map<String, Bounds> shapes = new HashMap<>();
    private final Map<String, List<Point>> edges = new HashMap<>();
    private final Set<String> defaultFlowIds = new HashSet<>();

    private BpmnParser() {
    }

    /**
     * Parses a BPMN file.
     *
     * @param path the path to the .bpmn file
     * @return the parsed document
     * @throws MalformedSourceException if the file cannot be read or is not BPMN 2.0
     */
    public static ProcessDocument parse(Path path) {
        try {
            return parse(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new MalformedSourceException("Failed to read BPMN file: " + path, e);
        }
    }

    /**
     * Parses BPMN XML from a stream. The stream is read fully but not closed.
     */
    public static ProcessDocument parse(InputStream in) {
        try {
            return parse(in.readAllBytes());
        } catch (IOException e) {
            throw new MalformedSourceException("Failed to read BPMN stream", e);
        }
    }

    public static ProcessDocument parseString(String xml) {
        return parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    public static ProcessDocument parse(byte[] xml) {
        Document doc = readDocument(xml);
        return new BpmnParser().parseDocument(doc);
    }

    private static Document readDocument(byte[] xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder documentBuilder = factory.newDocumentBuilder();
            return documentBuilder.parse(new ByteArrayInputStream(xml));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        } catch (SAXException | IOException e) {
            throw new MalformedSourceException("Failed to parse BPMN XML: " + e.getMessage(), e);
        }
    }

    private ProcessDocument parseDocument(Document doc) {
        // Get root definitions element
        org.w3c.dom.Element definitionsEl = doc.getDocumentElement();
        if (!"definitions".equals(definitionsEl.getLocalName()) || !BPMN_NS.equals(definitionsEl.getNamespaceURI())) {
            throw new MalformedSourceException("Root element is not BPMN 2.0 'definitions' but '"
                    + definitionsEl.getNodeName() + "'");
        }

        readDiagramInterchange(doc);
        collectDefaultFlows(doc);

        try {
            // Collect processes by id, in document order
            Map<String, org.w3c.dom.Element> processesById = new LinkedHashMap<>();
            for (org.w3c.dom.Element processEl : children(definitionsEl, "process")) {
                processesById.put(processEl.getAttribute("id"), processEl);
            }

            // Participants become pools
            Set<String> parsedProcesses = new HashSet<>();
            List<org.w3c.dom.Element> collaborations = children(definitionsEl, "collaboration");
            for (org.w3c.dom.Element collaborationEl : collaborations) {
                for (org.w3c.dom.Element participantEl : children(collaborationEl, "participant")) {
                    String participantId = participantEl.getAttribute("id");
                    String processRef = attribute(participantEl, "processRef");
                    int pool = builder.addPool(Container.builder()
                            .id(participantId)
                            .kind(ContainerKind.POOL)
                            .label(attribute(participantEl, "name"))
                            .processRef(processRef)
                            .sourceBounds(shapes.get(participantId)));
                    org.w3c.dom.Element processEl = processRef != null ? processesById.get(processRef) : null;
                    if (processEl != null && parsedProcesses.add(processRef)) {
                        parseProcess(processEl, pool);
                    }
                }
            }

            // Processes without a participant get an implicit pool that is not rendered
            for (Map.Entry<String, org.w3c.dom.Element> entry : processesById.entrySet()) {
                if (parsedProcesses.contains(entry.getKey())) {
                    continue;
                }
                int pool = builder.addPool(Container.builder()
                        .id(uniqueId(entry.getKey() + "__pool"))
                        .kind(ContainerKind.POOL)
                        .label(attribute(entry.getValue(), "name"))
                        .processRef(entry.getKey())
                        .implicit(true)
                        .synthetic(true));
                parseProcess(entry.getValue(), pool);
            }

            // Message flows between pools
            for (org.w3c.dom.Element collaborationEl : collaborations) {
                for (org.w3c.dom.Element messageFlowEl : children(collaborationEl, "messageFlow")) {
                    addFlow(messageFlowEl, FlowKind.MESSAGE, attribute(messageFlowEl, "sourceRef"),
                            attribute(messageFlowEl, "targetRef"), null);
                }
            }

            ProcessDocument document = builder.build();
            log.debug("Parsed {} elements, {} containers and {} flows ({} unresolved)",
                    document.elements().size(), document.containers().size(), document.flows().size(),
                    document.unresolvedReferences().size());
            return document;
        } catch (IllegalStateException e) {
            throw new MalformedSourceException("Invalid BPMN structure: " + e.getMessage(), e);
        }
    }

    /**
     * Parses one process into the given pool: lanes first, then its flow elements.
     */
    private void parseProcess(org.w3c.dom.Element processEl, int pool) {
        String poolId = builder.container(pool).getId();
        Map<String, Integer> laneOfNode = new HashMap<>();

        List<org.w3c.dom.Element> laneSets = children(processEl, "laneSet");
        boolean hasLanes = laneSets.stream().anyMatch(laneSet -> !children(laneSet, "lane").isEmpty());

        int[] fallbackLane = {-1};
        if (hasLanes) {
            for (org.w3c.dom.Element laneSetEl : laneSets) {
                parseLaneSet(laneSetEl, pool, laneOfNode);
            }
        } else {
            fallbackLane[0] = builder.addContainer(Container.builder()
                    .id(uniqueId(poolId + "__lane"))
                    .kind(ContainerKind.LANE)
                    .implicit(true)
                    .synthetic(true), pool);
        }

        // Boundary events not listed in any lane follow their host
        Map<String, String> hostOfBoundary = new HashMap<>();
        for (org.w3c.dom.Element boundaryEl : children(processEl, "boundaryEvent")) {
            String host = attribute(boundaryEl, "attachedToRef");
            if (host != null) {
                hostOfBoundary.put(boundaryEl.getAttribute("id"), host);
            }
        }

        Function<String, Integer> laneResolver = nodeId -> {
            Integer lane = laneOfNode.get(nodeId);
            if (lane == null && hostOfBoundary.containsKey(nodeId)) {
                lane = laneOfNode.get(hostOfBoundary.get(nodeId));
            }
            if (lane != null) {
                return lane;
            }
            if (fallbackLane[0] < 0) {
                // Laned pool with elements outside every lane
                fallbackLane[0] = builder.addContainer(Container.builder()
                        .id(uniqueId(poolId + "__unassigned"))
                        .kind(ContainerKind.LANE)
                        .implicit(true), pool);
            }
            return fallbackLane[0];
        };

        parseFlowElements(processEl, laneResolver);
    }

    private void parseLaneSet(org.w3c.dom.Element laneSetEl, int parent, Map<String, Integer> laneOfNode) {
        for (org.w3c.dom.Element laneEl : children(laneSetEl, "lane")) {
            String laneId = laneEl.getAttribute("id");
            int lane = builder.addContainer(Container.builder()
                    .id(laneId)
                    .kind(ContainerKind.LANE)
                    .label(attribute(laneEl, "name"))
                    .sourceBounds(shapes.get(laneId)), parent);

            List<String> refs = new ArrayList<>();
            for (org.w3c.dom.Element refEl : children(laneEl, "flowNodeRef")) {
                refs.add(refEl.getTextContent().trim());
            }

            List<org.w3c.dom.Element> childLaneSets = children(laneEl, "childLaneSet");
            boolean hasChildLanes = childLaneSets.stream().anyMatch(set -> !children(set, "lane").isEmpty());

            // Nodes of a parent lane are assigned before its children so the deepest lane wins
            for (String ref : refs) {
                laneOfNode.put(ref, lane);
            }
            if (hasChildLanes) {
                for (org.w3c.dom.Element childLaneSetEl : childLaneSets) {
                    parseLaneSet(childLaneSetEl, lane, laneOfNode);
                }
                // A lane with sub-lanes cannot hold nodes itself: move leftovers to its first leaf
                int leaf = firstLeafLane(lane);
                laneOfNode.replaceAll((node, assigned) -> assigned == lane ? leaf : assigned);
            }
        }
    }

    private int firstLeafLane(int lane) {
        Container container = builder.container(lane);
        while (container.hasLaneChildren()) {
            lane = container.getChildren().get(0).index();
            container = builder.container(lane);
        }
        return lane;
    }

    /**
     * Parses the direct flow elements of a process or subprocess.
     *
     * @param scopeEl       the process or subprocess element
     * @param containerOf   maps a node id to the container it is placed in
     */
    private void parseFlowElements(org.w3c.dom.Element scopeEl, Function<String, Integer> containerOf) {
        for (org.w3c.dom.Element childEl : children(scopeEl, null)) {
            String localName = childEl.getLocalName();
            String id = childEl.getAttribute("id");

            // Subprocesses are containers, their content is parsed recursively
            Optional<ContainerKind> subprocessKind = ContainerKind.subprocessFromTag(localName,
                    "true".equalsIgnoreCase(childEl.getAttribute("triggeredByEvent")));
            if (subprocessKind.isPresent()) {
                int subprocess = builder.addContainer(Container.builder()
                        .id(id)
                        .kind(subprocessKind.get())
                        .label(attribute(childEl, "name"))
                        .loopType(loopType(childEl))
                        .sourceBounds(shapes.get(id)), containerOf.apply(id));
                parseFlowElements(childEl, nodeId -> subprocess);
                parseDataAssociations(childEl, id);
                continue;
            }

            switch (localName) {
                case "sequenceFlow" -> {
                    String condition = childText(childEl, "conditionExpression");
                    FlowKind kind = defaultFlowIds.contains(id)
                            ? FlowKind.DEFAULT
                            : condition != null ? FlowKind.CONDITIONAL : FlowKind.SEQUENCE;
                    addFlow(childEl, kind, attribute(childEl, "sourceRef"), attribute(childEl, "targetRef"),
                            condition);
                }
                case "association" -> addFlow(childEl, FlowKind.ASSOCIATION, attribute(childEl, "sourceRef"),
                        attribute(childEl, "targetRef"), null);
                default -> parseFlowNode(childEl, localName, id, containerOf);
            }
        }
    }

    private void parseFlowNode(org.w3c.dom.Element nodeEl, String localName, String id,
                               Function<String, Integer> containerOf) {
        ElementKind kind = ElementKind.fromTag(localName).orElse(null);
        if (kind == null) {
            if (!ElementKind.isGenericFlowNodeTag(localName)) {
                return;  // definitions, laneSet, documentation, extensions...
            }
            kind = ElementKind.GENERIC;
            builder.addDiagnostic(Warning.info(WarningCode.UNSUPPORTED_KIND, id,
                    "Element type '" + localName + "' is not supported in detail and is drawn as a generic node"));
        }

        String label = kind == ElementKind.TEXT_ANNOTATION ? childText(nodeEl, "text") : attribute(nodeEl, "name");

        builder.addElement(Element.builder()
                .id(id)
                .kind(kind)
                .tag(localName)
                .label(label)
                .eventDefinition(eventDefinition(nodeEl))
                .attachedToRef(attribute(nodeEl, "attachedToRef"))
                .cancelActivity(!"false".equalsIgnoreCase(nodeEl.getAttribute("cancelActivity")))
                .loopType(loopType(nodeEl))
                .defaultFlowRef(attribute(nodeEl, "default"))
                .sourceBounds(shapes.get(id)), containerOf.apply(id));

        if (kind.isActivity()) {
            parseDataAssociations(nodeEl, id);
        }
    }

    /**
     * Data input associations point from a data object to the activity that owns them,
     * data output associations from the activity to a data object.
     */
    private void parseDataAssociations(org.w3c.dom.Element activityEl, String activityId) {
        int counter = 0;
        for (org.w3c.dom.Element inputEl : children(activityEl, "dataInputAssociation")) {
            for (org.w3c.dom.Element sourceEl : children(inputEl, "sourceRef")) {
                String flowId = associationId(inputEl, activityId + "__dataInput" + counter++);
                addFlow(flowId, FlowKind.ASSOCIATION, sourceEl.getTextContent().trim(), activityId, null, null);
            }
        }
        for (org.w3c.dom.Element outputEl : children(activityEl, "dataOutputAssociation")) {
            String target = childText(outputEl, "targetRef");
            if (target != null) {
                String flowId = associationId(outputEl, activityId + "__dataOutput" + counter++);
                addFlow(flowId, FlowKind.ASSOCIATION, activityId, target, null, null);
            }
        }
    }

    private String associationId(org.w3c.dom.Element associationEl, String fallback) {
        String id = attribute(associationEl, "id");
        return id != null && !builder.containsId(id) ? id : uniqueId(fallback);
    }

    private void addFlow(org.w3c.dom.Element flowEl, FlowKind kind, String sourceRef, String targetRef,
                         String condition) {
        addFlow(flowEl.getAttribute("id"), kind, sourceRef, targetRef, attribute(flowEl, "name"), condition);
    }

    private void addFlow(String id, FlowKind kind, String sourceRef, String targetRef, String label,
                         String condition) {
        builder.addFlow(Flow.builder()
                .id(id)
                .kind(kind)
                .sourceRef(sourceRef)
                .targetRef(targetRef)
                .label(label)
                .condition(condition)
                .sourceWaypoints(new ArrayList<>(edges.getOrDefault(id, List.of()))));
    }

    private static EventDefinition eventDefinition(org.w3c.dom.Element nodeEl) {
        List<EventDefinition> found = new ArrayList<>();
        for (org.w3c.dom.Element childEl : children(nodeEl, null)) {
            EventDefinition.fromTag(childEl.getLocalName()).ifPresent(found::add);
        }
        if (found.isEmpty()) {
            return EventDefinition.NONE;
        }
        return found.size() == 1 ? found.get(0) : EventDefinition.MULTIPLE;
    }

    private static LoopType loopType(org.w3c.dom.Element nodeEl) {
        if (!children(nodeEl, "standardLoopCharacteristics").isEmpty()) {
            return LoopType.STANDARD;
        }
        List<org.w3c.dom.Element> multiInstance = children(nodeEl, "multiInstanceLoopCharacteristics");
        if (!multiInstance.isEmpty()) {
            return "true".equalsIgnoreCase(multiInstance.get(0).getAttribute("isSequential"))
                    ? LoopType.MULTI_INSTANCE_SEQUENTIAL
                    : LoopType.MULTI_INSTANCE_PARALLEL;
        }
        return LoopType.NONE;
    }

    /**
     * Reads BPMNShape bounds and BPMNEdge waypoints, keyed by the referenced BPMN element id.
     * When several diagrams describe the same element the first one wins.
     */
    private void readDiagramInterchange(Document doc) {
        NodeList shapeNodes = doc.getElementsByTagNameNS(BPMNDI_NS, "BPMNShape");
        for (int i = 0; i < shapeNodes.getLength(); i++) {
            org.w3c.dom.Element shapeEl = (org.w3c.dom.Element) shapeNodes.item(i);
            String ref = attribute(shapeEl, "bpmnElement");
            NodeList boundsNodes = shapeEl.getElementsByTagNameNS(DC_NS, "Bounds");
            if (ref == null || boundsNodes.getLength() == 0) {
                continue;
            }
            org.w3c.dom.Element boundsEl = (org.w3c.dom.Element) boundsNodes.item(0);
            Bounds bounds = new Bounds(number(boundsEl, "x"), number(boundsEl, "y"),
                    number(boundsEl, "width"), number(boundsEl, "height"));
            shapes.putIfAbsent(ref, bounds);
        }

        NodeList edgeNodes = doc.getElementsByTagNameNS(BPMNDI_NS, "BPMNEdge");
        for (int i = 0; i < edgeNodes.getLength(); i++) {
            org.w3c.dom.Element edgeEl = (org.w3c.dom.Element) edgeNodes.item(i);
            String ref = attribute(edgeEl, "bpmnElement");
            if (ref == null) {
                continue;
            }
            List<Point> waypoints = new ArrayList<>();
            NodeList waypointNodes = edgeEl.getElementsByTagNameNS(DI_NS, "waypoint");
            for (int j = 0; j < waypointNodes.getLength(); j++) {
                org.w3c.dom.Element waypointEl = (org.w3c.dom.Element) waypointNodes.item(j);
                waypoints.add(new Point(number(waypointEl, "x"), number(waypointEl, "y")));
            }
            if (waypoints.size() >= 2) {
                edges.putIfAbsent(ref, waypoints);
            }
        }
    }

    private void collectDefaultFlows(Document doc) {
        NodeList all = doc.getElementsByTagNameNS(BPMN_NS, "*");
        for (int i = 0; i < all.getLength(); i++) {
            String defaultFlow = attribute((org.w3c.dom.Element) all.item(i), "default");
            if (defaultFlow != null) {
                defaultFlowIds.add(defaultFlow);
            }
        }
    }

    private String uniqueId(String base) {
        String candidate = base;
        int suffix = 1;
        while (builder.containsId(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    /**
     * Direct BPMN children of an element, optionally filtered by local name.
     * Unlike getElementsByTagNameNS this does not descend into nested subprocesses.
     */
    private static List<org.w3c.dom.Element> children(org.w3c.dom.Element parent, String localName) {
        List<org.w3c.dom.Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && BPMN_NS.equals(node.getNamespaceURI())
                    && (localName == null || localName.equals(node.getLocalName()))) {
                result.add((org.w3c.dom.Element) node);
            }
        }
        return result;
    }

    private static String childText(org.w3c.dom.Element parent, String localName) {
        List<org.w3c.dom.Element> matches = children(parent, localName);
        if (matches.isEmpty()) {
            return null;
        }
        String text = matches.get(0).getTextContent().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Attribute value, or null when missing or blank.
     */
    private static String attribute(org.w3c.dom.Element el, String name) {
        String value = el.getAttribute(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static double number(org.w3c.dom.Element el, String name) {
        String value = el.getAttribute(name);
        try {
            return value.isBlank() ? 0 : Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedSourceException("Attribute '" + name + "' of " + el.getNodeName()
                    + " is not a number: " + value, e);
        }
    }
}
