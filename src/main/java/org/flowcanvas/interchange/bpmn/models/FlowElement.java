package org.flowcanvas.interchange.bpmn.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.util.List;

/**
 * A node of the editor graph: a flow node, an artifact, a participant (pool) or a lane.
 * <p>
 * Positions of nodes owned by a participant are relative to the participant's origin.
 * Participants and nodes outside any participant use document coordinates.
 */
@Builder(toBuilder = true)
public record FlowElement(
        String id,
        NodeKind kind,
        BpmnElementType elementType,  // originally recorded element type, null for nodes built in the editor
        String name,
        Point position,
        Size size,                    // explicit size, null falls back to the diagram or the default size table
        String participantId,
        String laneId,

        //for participants
        String processRef,

        //for lanes
        List<String> flowNodeRefs,

        //for events
        EventDefinitionType eventDefinition,

        ColorStyle style,
        String documentation,
        PreservedContent preserved,
        ProcessMeta processMeta,
        DiagramShape shape
) {
    public FlowElement {
        if (position == null) {
            position = Point.ORIGIN;
        }
        if (name == null) {
            name = "";
        }
        flowNodeRefs = flowNodeRefs == null ? List.of() : List.copyOf(flowNodeRefs);
        if (preserved == null) {
            preserved = PreservedContent.EMPTY;
        }
    }

    /**
     * The element type to write: the recorded one while it still matches the node kind,
     * otherwise the kind's default.
     */
    public BpmnElementType effectiveElementType() {
        if (elementType != null && elementType.kind() == kind) {
            return elementType;
        }
        return kind.defaultElementType();
    }

    @JsonIgnore
    public boolean isParticipant() {
        return kind == NodeKind.PARTICIPANT;
    }

    @JsonIgnore
    public boolean isLane() {
        return kind == NodeKind.LANE;
    }

    /**
     * Id of the participant this element belongs to; a participant owns itself.
     */
    public String owningParticipantId() {
        return isParticipant() ? id : participantId;
    }
}
