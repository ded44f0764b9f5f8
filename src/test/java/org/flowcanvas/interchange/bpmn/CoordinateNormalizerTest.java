package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.Point;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateNormalizerTest {
    private static final Point POOL = new Point(160, 80);

    @Test
    void shouldSubtractParticipantOrigin() {
        assertEquals(new Point(92, 42), CoordinateNormalizer.toRelative(new Point(252, 122), POOL));
    }

    @Test
    void shouldAddParticipantOrigin() {
        assertEquals(new Point(252, 122), CoordinateNormalizer.toAbsolute(new Point(92, 42), POOL));
    }

    @Test
    void shouldKeepContentInsideThePadding() {
        Point relative = CoordinateNormalizer.toContentRelative(new Point(170, 90), POOL);

        assertEquals(new Point(CoordinateNormalizer.CONTENT_PADDING_X, CoordinateNormalizer.CONTENT_PADDING_Y), relative);
    }

    @Test
    void shouldNotClampContentAlreadyInside() {
        assertEquals(new Point(180, 30), CoordinateNormalizer.toContentRelative(new Point(340, 110), POOL));
    }

    @Test
    void shouldClampNodesLeftOfTheParticipant() {
        assertEquals(new Point(80, 100), CoordinateNormalizer.toContentRelative(new Point(100, 180), POOL));
    }
}
