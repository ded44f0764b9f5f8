package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.Point;

/**
 * Converts between document coordinates and coordinates relative to a participant.
 * Nodes outside any participant keep document coordinates and are never passed through here.
 */
public final class CoordinateNormalizer {
    /**
     * Left padding of a participant's content area; the participant label band sits inside it.
     */
    public static final double CONTENT_PADDING_X = 80;
    public static final double CONTENT_PADDING_Y = 30;

    private CoordinateNormalizer() {
    }

    public static Point toRelative(Point absolute, Point participantOrigin) {
        return absolute.minus(participantOrigin);
    }

    public static Point toAbsolute(Point relative, Point participantOrigin) {
        return relative.plus(participantOrigin);
    }

    /**
     * Relative position kept inside the participant's content area.
     */
    public static Point toContentRelative(Point absolute, Point participantOrigin) {
        Point relative = toRelative(absolute, participantOrigin);
        return new Point(Math.max(CONTENT_PADDING_X, relative.x()), Math.max(CONTENT_PADDING_Y, relative.y()));
    }
}
