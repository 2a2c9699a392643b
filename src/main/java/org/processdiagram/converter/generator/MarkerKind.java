package org.processdiagram.converter.generator;

import org.processdiagram.converter.bpmn.models.Element;
import org.processdiagram.converter.bpmn.models.LoopType;
import org.processdiagram.converter.bpmn.models.KindKey;

import java.util.Optional;

/**
 * Decorations drawn on top of a shape: gateway symbols, task type icons, event definition icons
 * and loop markers.
 */
public enum MarkerKind implements KindKey {
    EXCLUSIVE_GATEWAY_MARKER("exclusiveGatewayMarker", 20, 20),
    PARALLEL_GATEWAY_MARKER("parallelGatewayMarker", 22, 22),
    INCLUSIVE_GATEWAY_MARKER("inclusiveGatewayMarker", 20, 20),
    EVENT_BASED_GATEWAY_MARKER("eventBasedGatewayMarker", 26, 26),
    COMPLEX_GATEWAY_MARKER("complexGatewayMarker", 16, 16),

    USER_TASK_ICON("userTaskIcon", 20, 20),
    SERVICE_TASK_ICON("serviceTaskIcon", 20, 20),
    SCRIPT_TASK_ICON("scriptTaskIcon", 20, 20),
    SEND_TASK_ICON("sendTaskIcon", 20, 20),
    RECEIVE_TASK_ICON("receiveTaskIcon", 20, 20),
    BUSINESS_RULE_TASK_ICON("businessRuleTaskIcon", 20, 20),
    MANUAL_TASK_ICON("manualTaskIcon", 20, 20),

    MESSAGE_EVENT_ICON("messageEventIcon", 20, 20),
    TIMER_EVENT_ICON("timerEventIcon", 20, 20),
    ERROR_EVENT_ICON("errorEventIcon", 20, 20),
    SIGNAL_EVENT_ICON("signalEventIcon", 20, 20),
    ESCALATION_EVENT_ICON("escalationEventIcon", 20, 20),
    COMPENSATION_EVENT_ICON("compensationEventIcon", 20, 20),
    CONDITIONAL_EVENT_ICON("conditionalEventIcon", 20, 20),
    LINK_EVENT_ICON("linkEventIcon", 20, 20),
    TERMINATE_EVENT_ICON("terminateEventIcon", 20, 20),
    CANCEL_EVENT_ICON("cancelEventIcon", 20, 20),
    MULTIPLE_EVENT_ICON("multipleEventIcon", 20, 20),

    STANDARD_LOOP_MARKER("standardLoopMarker", 16, 16),
    PARALLEL_MULTI_INSTANCE_MARKER("parallelMultiInstanceMarker", 16, 16),
    SEQUENTIAL_MULTI_INSTANCE_MARKER("sequentialMultiInstanceMarker", 16, 16);

    private final String key;
    private final double width;
    private final double height;

    MarkerKind(String key, double width, double height) {
        this.key = key;
        this.width = width;
        this.height = height;
    }

    @Override
    public String key() {
        return key;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public boolean isTaskIcon() {
        return key.endsWith("TaskIcon");
    }

    /**
     * Symbol drawn inside a gateway, task or event, if its kind has one.
     */
    public static Optional<MarkerKind> symbolFor(Element element) {
        MarkerKind marker = switch (element.getKind()) {
            case EXCLUSIVE_GATEWAY -> EXCLUSIVE_GATEWAY_MARKER;
            case PARALLEL_GATEWAY -> PARALLEL_GATEWAY_MARKER;
            case INCLUSIVE_GATEWAY -> INCLUSIVE_GATEWAY_MARKER;
            case EVENT_BASED_GATEWAY -> EVENT_BASED_GATEWAY_MARKER;
            case COMPLEX_GATEWAY -> COMPLEX_GATEWAY_MARKER;
            case USER_TASK -> USER_TASK_ICON;
            case SERVICE_TASK -> SERVICE_TASK_ICON;
            case SCRIPT_TASK -> SCRIPT_TASK_ICON;
            case SEND_TASK -> SEND_TASK_ICON;
            case RECEIVE_TASK -> RECEIVE_TASK_ICON;
            case BUSINESS_RULE_TASK -> BUSINESS_RULE_TASK_ICON;
            case MANUAL_TASK -> MANUAL_TASK_ICON;
            case START_EVENT, END_EVENT, INTERMEDIATE_CATCH_EVENT, INTERMEDIATE_THROW_EVENT, BOUNDARY_EVENT ->
                    eventIcon(element);
            default -> null;
        };
        return Optional.ofNullable(marker);
    }

    public static Optional<MarkerKind> loopMarkerFor(LoopType loopType) {
        return Optional.ofNullable(switch (loopType) {
            case STANDARD -> STANDARD_LOOP_MARKER;
            case MULTI_INSTANCE_PARALLEL -> PARALLEL_MULTI_INSTANCE_MARKER;
            case MULTI_INSTANCE_SEQUENTIAL -> SEQUENTIAL_MULTI_INSTANCE_MARKER;
            case NONE -> null;
        });
    }

    private static MarkerKind eventIcon(Element element) {
        return switch (element.getEventDefinition()) {
            case MESSAGE -> MESSAGE_EVENT_ICON;
            case TIMER -> TIMER_EVENT_ICON;
            case ERROR -> ERROR_EVENT_ICON;
            case SIGNAL -> SIGNAL_EVENT_ICON;
            case ESCALATION -> ESCALATION_EVENT_ICON;
            case COMPENSATION -> COMPENSATION_EVENT_ICON;
            case CONDITIONAL -> CONDITIONAL_EVENT_ICON;
            case LINK -> LINK_EVENT_ICON;
            case TERMINATE -> TERMINATE_EVENT_ICON;
            case CANCEL -> CANCEL_EVENT_ICON;
            case MULTIPLE -> MULTIPLE_EVENT_ICON;
            case NONE -> null;
        };
    }
}
