package org.flowcanvas.interchange.bpmn.models;

/**
 * Event definition carried by an event node, read from its {@code *EventDefinition} child.
 */
public enum EventDefinitionType {
    MESSAGE("messageEventDefinition"),
    TIMER("timerEventDefinition"),
    SIGNAL("signalEventDefinition"),
    ERROR("errorEventDefinition"),
    ESCALATION("escalationEventDefinition"),
    CONDITIONAL("conditionalEventDefinition"),
    COMPENSATE("compensateEventDefinition"),
    LINK("linkEventDefinition"),
    CANCEL("cancelEventDefinition"),
    TERMINATE("terminateEventDefinition");

    private final String localName;

    EventDefinitionType(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public static EventDefinitionType fromLocalName(String localName) {
        for (EventDefinitionType type : values()) {
            if (type.localName.equals(localName)) {
                return type;
            }
        }
        return null;
    }
}
