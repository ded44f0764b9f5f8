package org.flowcanvas.interchange.bpmn.models;

import java.util.HashMap;
import java.util.Map;

/**
 * BPMN process children that decode into graph nodes, keyed by their local element name.
 * This is the fixed dispatch table used by both the decoder and the encoder.
 */
public enum BpmnElementType {
    START_EVENT("startEvent", NodeKind.START_EVENT),
    END_EVENT("endEvent", NodeKind.END_EVENT),
    INTERMEDIATE_THROW_EVENT("intermediateThrowEvent", NodeKind.INTERMEDIATE_EVENT),
    INTERMEDIATE_CATCH_EVENT("intermediateCatchEvent", NodeKind.INTERMEDIATE_EVENT),
    BOUNDARY_EVENT("boundaryEvent", NodeKind.BOUNDARY_EVENT),
    TASK("task", NodeKind.TASK),
    SERVICE_TASK("serviceTask", NodeKind.TASK),
    USER_TASK("userTask", NodeKind.TASK),
    SCRIPT_TASK("scriptTask", NodeKind.TASK),
    BUSINESS_RULE_TASK("businessRuleTask", NodeKind.TASK),
    SEND_TASK("sendTask", NodeKind.TASK),
    RECEIVE_TASK("receiveTask", NodeKind.TASK),
    MANUAL_TASK("manualTask", NodeKind.TASK),
    SUB_PROCESS("subProcess", NodeKind.SUB_PROCESS),
    TRANSACTION("transaction", NodeKind.SUB_PROCESS),
    AD_HOC_SUB_PROCESS("adHocSubProcess", NodeKind.SUB_PROCESS),
    CALL_ACTIVITY("callActivity", NodeKind.CALL_ACTIVITY),
    EXCLUSIVE_GATEWAY("exclusiveGateway", NodeKind.GATEWAY),
    INCLUSIVE_GATEWAY("inclusiveGateway", NodeKind.GATEWAY),
    PARALLEL_GATEWAY("parallelGateway", NodeKind.GATEWAY),
    EVENT_BASED_GATEWAY("eventBasedGateway", NodeKind.GATEWAY),
    COMPLEX_GATEWAY("complexGateway", NodeKind.GATEWAY),
    DATA_OBJECT_REFERENCE("dataObjectReference", NodeKind.DATA_OBJECT),
    DATA_STORE_REFERENCE("dataStoreReference", NodeKind.DATA_STORE),
    GROUP("group", NodeKind.GROUP),
    TEXT_ANNOTATION("textAnnotation", NodeKind.TEXT_ANNOTATION);

    private static final Map<String, BpmnElementType> BY_LOCAL_NAME = new HashMap<>();

    static {
        for (BpmnElementType type : values()) {
            BY_LOCAL_NAME.put(type.localName, type);
        }
    }

    private final String localName;
    private final NodeKind kind;

    BpmnElementType(String localName, NodeKind kind) {
        this.localName = localName;
        this.kind = kind;
    }

    public String localName() {
        return localName;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * @return the element type for a local name, or null when the element is not a graph node
     */
    public static BpmnElementType fromLocalName(String localName) {
        return localName == null ? null : BY_LOCAL_NAME.get(localName);
    }
}
