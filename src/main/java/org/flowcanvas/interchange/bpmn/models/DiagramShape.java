package org.flowcanvas.interchange.bpmn.models;

import java.util.Map;

/**
 * Layout of a node as found in the decoded diagram section.
 *
 * @param shapeId           id of the {@code BPMNShape}
 * @param bounds            original absolute bounds
 * @param labelBounds       original label bounds, may be null
 * @param attributes        remaining shape attributes (e.g. {@code isMarkerVisible}, {@code isExpanded})
 * @param extensionElements serialized {@code BPMNExtensionElements} block, may be null
 */
public record DiagramShape(
        String shapeId,
        Bounds bounds,
        Bounds labelBounds,
        Map<String, String> attributes,
        String extensionElements
) {
    public DiagramShape {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
