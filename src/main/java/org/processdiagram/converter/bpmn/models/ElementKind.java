package org.processdiagram.converter.bpmn.models;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of flow node and artifact kinds the converter knows how to lay out and render.
 * Subprocesses are not listed here, they are containers (see {@link ContainerKind}).
 */
public enum ElementKind implements KindKey {
    // Events (36x36)
    START_EVENT("startEvent", ElementCategory.EVENT, 36, 36),
    END_EVENT("endEvent", ElementCategory.EVENT, 36, 36),
    INTERMEDIATE_CATCH_EVENT("intermediateCatchEvent", ElementCategory.EVENT, 36, 36),
    INTERMEDIATE_THROW_EVENT("intermediateThrowEvent", ElementCategory.EVENT, 36, 36),
    BOUNDARY_EVENT("boundaryEvent", ElementCategory.EVENT, 36, 36),

    // Tasks (120x80)
    TASK("task", ElementCategory.ACTIVITY, 120, 80),
    USER_TASK("userTask", ElementCategory.ACTIVITY, 120, 80),
    SERVICE_TASK("serviceTask", ElementCategory.ACTIVITY, 120, 80),
    SCRIPT_TASK("scriptTask", ElementCategory.ACTIVITY, 120, 80),
    SEND_TASK("sendTask", ElementCategory.ACTIVITY, 120, 80),
    RECEIVE_TASK("receiveTask", ElementCategory.ACTIVITY, 120, 80),
    BUSINESS_RULE_TASK("businessRuleTask", ElementCategory.ACTIVITY, 120, 80),
    MANUAL_TASK("manualTask", ElementCategory.ACTIVITY, 120, 80),
    CALL_ACTIVITY("callActivity", ElementCategory.ACTIVITY, 120, 80),

    // Gateways (50x50)
    EXCLUSIVE_GATEWAY("exclusiveGateway", ElementCategory.GATEWAY, 50, 50),
    PARALLEL_GATEWAY("parallelGateway", ElementCategory.GATEWAY, 50, 50),
    INCLUSIVE_GATEWAY("inclusiveGateway", ElementCategory.GATEWAY, 50, 50),
    EVENT_BASED_GATEWAY("eventBasedGateway", ElementCategory.GATEWAY, 50, 50),
    COMPLEX_GATEWAY("complexGateway", ElementCategory.GATEWAY, 50, 50),

    // Data
    DATA_OBJECT_REFERENCE("dataObjectReference", ElementCategory.DATA, 40, 50),
    DATA_STORE_REFERENCE("dataStoreReference", ElementCategory.DATA, 50, 50),

    // Artifacts
    TEXT_ANNOTATION("textAnnotation", ElementCategory.ARTIFACT, 100, 40),
    GROUP("group", ElementCategory.ARTIFACT, 200, 150),

    // Recognized as a flow node but not supported in detail
    GENERIC("generic", ElementCategory.GENERIC, 120, 80);

    private static final Map<String, ElementKind> BY_TAG = Arrays.stream(values())
            .filter(kind -> kind != GENERIC)
            .collect(Collectors.toMap(ElementKind::tag, Function.identity()));

    private final String tag;
    private final ElementCategory category;
    private final double defaultWidth;
    private final double defaultHeight;

    ElementKind(String tag, ElementCategory category, double defaultWidth, double defaultHeight) {
        this.tag = tag;
        this.category = category;
        this.defaultWidth = defaultWidth;
        this.defaultHeight = defaultHeight;
    }

    /**
     * Looks up a kind by its BPMN local element name.
     *
     * @param localName e.g. {@code userTask}
     * @return the kind, or empty when the tag is not one of the supported kinds
     */
    public static Optional<ElementKind> fromTag(String localName) {
        return Optional.ofNullable(BY_TAG.get(localName));
    }

    /**
     * Tags that are flow nodes in BPMN but have no dedicated kind here.
     * They are kept as {@link #GENERIC} so that nothing is dropped from the diagram.
     */
    public static boolean isGenericFlowNodeTag(String localName) {
        return localName.endsWith("Task")
                || localName.endsWith("Event")
                || localName.endsWith("Gateway")
                || localName.equals("subChoreography");
    }

    public String tag() {
        return tag;
    }

    @Override
    public String key() {
        return tag;
    }

    public ElementCategory category() {
        return category;
    }

    public double defaultWidth() {
        return defaultWidth;
    }

    public double defaultHeight() {
        return defaultHeight;
    }

    public boolean isEvent() {
        return category == ElementCategory.EVENT;
    }

    public boolean isGateway() {
        return category == ElementCategory.GATEWAY;
    }

    public boolean isActivity() {
        return category == ElementCategory.ACTIVITY;
    }

    /**
     * Data objects, data stores and artifacts carry no control flow.
     */
    public boolean isPassive() {
        return category == ElementCategory.DATA || category == ElementCategory.ARTIFACT;
    }

    /**
     * Gateways whose outgoing branches are chosen by a condition.
     */
    public boolean isDecisionGateway() {
        return this == EXCLUSIVE_GATEWAY || this == INCLUSIVE_GATEWAY || this == COMPLEX_GATEWAY;
    }
}
