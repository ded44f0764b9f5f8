package org.flowcanvas.interchange.bpmn.models;

import lombok.Builder;

/**
 * A directed edge of the editor graph. Whether it is a message flow is decided when the edge
 * is created (decoded or connected) and is not re-derived on export.
 */
@Builder(toBuilder = true)
public record FlowEdge(
        String id,
        String sourceId,
        String targetId,
        boolean messageFlow,
        String name,
        String documentation,
        PreservedContent preserved,
        DiagramEdge diagram
) {
    public FlowEdge {
        if (name == null) {
            name = "";
        }
        if (preserved == null) {
            preserved = PreservedContent.EMPTY;
        }
    }
}
