package org.flowcanvas.interchange.bpmn.models;

import java.util.List;
import java.util.Map;

/**
 * Layout of a flow as found in the decoded diagram section.
 */
public record DiagramEdge(
        String shapeId,
        List<Point> waypoints,
        Bounds labelBounds,
        Map<String, String> attributes
) {
    public DiagramEdge {
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
