package org.flowcanvas.interchange.bpmn.models;

/**
 * Closed set of node variants the editor graph understands.
 * <p>
 * Several BPMN element types collapse onto one kind (every task flavour is a {@link #TASK},
 * every gateway flavour a {@link #GATEWAY}); the exact element type survives in
 * {@link FlowElement#elementType()}.
 */
public enum NodeKind {
    START_EVENT("startEvent"),
    END_EVENT("endEvent"),
    INTERMEDIATE_EVENT("intermediateEvent"),
    BOUNDARY_EVENT("boundaryEvent"),
    TASK("task"),
    GATEWAY("gateway"),
    SUB_PROCESS("subProcess"),
    CALL_ACTIVITY("callActivity"),
    DATA_OBJECT("dataObject"),
    DATA_STORE("dataStore"),
    GROUP("group"),
    TEXT_ANNOTATION("textAnnotation"),
    PARTICIPANT("participant"),
    LANE("lane");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * The editor's variant tag, e.g. "gateway" or "startEvent".
     */
    public String tag() {
        return tag;
    }

    /**
     * Element type used when a node carries no originally recorded element type.
     * Participants and lanes are structural and have none.
     */
    public BpmnElementType defaultElementType() {
        return switch (this) {
            case START_EVENT -> BpmnElementType.START_EVENT;
            case END_EVENT -> BpmnElementType.END_EVENT;
            case INTERMEDIATE_EVENT -> BpmnElementType.INTERMEDIATE_CATCH_EVENT;
            case BOUNDARY_EVENT -> BpmnElementType.BOUNDARY_EVENT;
            case TASK -> BpmnElementType.TASK;
            case GATEWAY -> BpmnElementType.EXCLUSIVE_GATEWAY;
            case SUB_PROCESS -> BpmnElementType.SUB_PROCESS;
            case CALL_ACTIVITY -> BpmnElementType.CALL_ACTIVITY;
            case DATA_OBJECT -> BpmnElementType.DATA_OBJECT_REFERENCE;
            case DATA_STORE -> BpmnElementType.DATA_STORE_REFERENCE;
            case GROUP -> BpmnElementType.GROUP;
            case TEXT_ANNOTATION -> BpmnElementType.TEXT_ANNOTATION;
            case PARTICIPANT, LANE -> null;
        };
    }

    /**
     * Whether the element takes part in sequence flow and therefore carries
     * incoming/outgoing references.
     */
    public boolean isFlowNode() {
        return switch (this) {
            case START_EVENT, END_EVENT, INTERMEDIATE_EVENT, BOUNDARY_EVENT,
                    TASK, GATEWAY, SUB_PROCESS, CALL_ACTIVITY -> true;
            case DATA_OBJECT, DATA_STORE, GROUP, TEXT_ANNOTATION, PARTICIPANT, LANE -> false;
        };
    }

    public boolean isEvent() {
        return this == START_EVENT || this == END_EVENT || this == INTERMEDIATE_EVENT || this == BOUNDARY_EVENT;
    }

    public boolean isContainer() {
        return this == PARTICIPANT || this == LANE;
    }
}
