package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.Bounds;
import org.flowcanvas.interchange.bpmn.models.FlowEdge;
import org.flowcanvas.interchange.bpmn.models.FlowElement;
import org.flowcanvas.interchange.bpmn.models.NodeKind;
import org.flowcanvas.interchange.bpmn.models.Point;
import org.flowcanvas.interchange.bpmn.models.Size;

import java.util.List;

/**
 * Derives diagram geometry on export: shape bounds, label boxes and edge waypoints.
 * Preserved geometry is reused where the element has not moved.
 */
public final class DiagramLayoutDeriver {
    public static final Size PARTICIPANT_SIZE = new Size(910, 250);
    public static final double LANE_HEIGHT = 120;
    /**
     * Width of the participant's label band; lanes start right of it.
     */
    public static final double PARTICIPANT_LABEL_BAND = 30;

    static final double LABEL_GAP = 5;
    static final double LABEL_HEIGHT = 40;
    static final double EDGE_LABEL_WIDTH = 100;
    private static final double EPSILON = 0.001;

    private DiagramLayoutDeriver() {
    }

    public static Size defaultSize(NodeKind kind) {
        return switch (kind) {
            case START_EVENT, END_EVENT, INTERMEDIATE_EVENT, BOUNDARY_EVENT -> new Size(36, 36);
            case GATEWAY -> new Size(50, 50);
            case TASK -> new Size(100, 80);
            case SUB_PROCESS, CALL_ACTIVITY -> new Size(120, 80);
            case DATA_OBJECT -> new Size(36, 50);
            case DATA_STORE -> new Size(50, 50);
            case GROUP -> new Size(200, 150);
            case TEXT_ANNOTATION -> new Size(100, 30);
            case PARTICIPANT -> PARTICIPANT_SIZE;
            case LANE -> new Size(PARTICIPANT_SIZE.width() - PARTICIPANT_LABEL_BAND, LANE_HEIGHT);
        };
    }

    /**
     * Explicit size first, then the size found in the decoded diagram, then the default for the kind.
     */
    public static Size sizeOf(FlowElement node) {
        if (node.size() != null) {
            return node.size();
        }
        if (node.shape() != null && node.shape().bounds() != null) {
            return node.shape().bounds().size();
        }
        return defaultSize(node.kind());
    }

    public static Bounds shapeBounds(FlowElement node, Point absolutePosition) {
        return Bounds.of(absolutePosition, sizeOf(node));
    }

    /**
     * Label box of a node. A decoded label moves along with its shape and a decoded shape without
     * a label keeps having none. Nodes the editor created get a box below the shape when they are
     * named and their kind is labelled outside the shape.
     *
     * @return the label bounds, or null when the node gets no label
     */
    public static Bounds labelBounds(FlowElement node, Bounds shapeBounds) {
        if (node.shape() != null) {
            Bounds original = node.shape().bounds();
            Bounds label = node.shape().labelBounds();
            if (label == null || original == null) {
                return label;
            }
            return label.translate(shapeBounds.x() - original.x(), shapeBounds.y() - original.y());
        }
        if (node.name().isBlank() || !hasExternalLabel(node.kind())) {
            return null;
        }
        return new Bounds(shapeBounds.x(), shapeBounds.y() + shapeBounds.height() + LABEL_GAP,
                shapeBounds.width(), LABEL_HEIGHT);
    }

    /**
     * Kinds whose name is drawn next to the shape rather than inside it.
     */
    static boolean hasExternalLabel(NodeKind kind) {
        return switch (kind) {
            case START_EVENT, END_EVENT, INTERMEDIATE_EVENT, BOUNDARY_EVENT, GATEWAY, DATA_OBJECT, DATA_STORE -> true;
            case TASK, SUB_PROCESS, CALL_ACTIVITY, GROUP, TEXT_ANNOTATION, PARTICIPANT, LANE -> false;
        };
    }

    /**
     * Waypoints of an edge. Decoded waypoints are kept while both endpoints sit where they were
     * decoded; otherwise a straight connection from the source's right edge to the target's
     * left edge, both at mid-height.
     */
    public static List<Point> waypoints(FlowEdge edge, FlowElement source, Bounds sourceBounds,
                                        FlowElement target, Bounds targetBounds) {
        if (reusesWaypoints(edge, source, sourceBounds, target, targetBounds)) {
            return edge.diagram().waypoints();
        }
        return List.of(
                new Point(sourceBounds.x() + sourceBounds.width(), sourceBounds.y() + sourceBounds.height() / 2),
                new Point(targetBounds.x(), targetBounds.y() + targetBounds.height() / 2));
    }

    public static boolean reusesWaypoints(FlowEdge edge, FlowElement source, Bounds sourceBounds,
                                          FlowElement target, Bounds targetBounds) {
        return edge.diagram() != null
                && edge.diagram().waypoints().size() >= 2
                && isUnmoved(source, sourceBounds)
                && isUnmoved(target, targetBounds);
    }

    /**
     * Label box of an edge: the decoded one (or none) while the path is kept, else a box centred
     * on the path's midpoint for named edges.
     *
     * @return the label bounds, or null when the edge gets no label
     */
    public static Bounds edgeLabelBounds(FlowEdge edge, List<Point> waypoints, boolean waypointsReused) {
        if (waypointsReused) {
            return edge.diagram().labelBounds();
        }
        if (edge.name().isBlank() || waypoints.isEmpty()) {
            return null;
        }
        Point mid = midpoint(waypoints);
        return new Bounds(mid.x() - EDGE_LABEL_WIDTH / 2, mid.y() - LABEL_HEIGHT / 4, EDGE_LABEL_WIDTH, LABEL_HEIGHT);
    }

    static Point midpoint(List<Point> waypoints) {
        Point a = waypoints.get((waypoints.size() - 1) / 2);
        Point b = waypoints.get(waypoints.size() / 2);
        return new Point((a.x() + b.x()) / 2, (a.y() + b.y()) / 2);
    }

    /**
     * Whether a node still occupies the bounds it was decoded with.
     */
    static boolean isUnmoved(FlowElement node, Bounds current) {
        if (node.shape() == null || node.shape().bounds() == null) {
            return false;
        }
        Bounds original = node.shape().bounds();
        return Math.abs(original.x() - current.x()) < EPSILON
                && Math.abs(original.y() - current.y()) < EPSILON
                && Math.abs(original.width() - current.width()) < EPSILON
                && Math.abs(original.height() - current.height()) < EPSILON;
    }
}
