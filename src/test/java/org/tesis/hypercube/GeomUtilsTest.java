package org.tesis.hypercube;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeomUtilsTest {

    @Test
    void rectangleWithoutRotationKeepsCornerOrder() {
        BoundsRect r = GeomUtils.rectangleCorners(0, 0, 1, 0.5, 0, 0, 0);

        assertCorner(r.corner(0), 1, 0.5);
        assertCorner(r.corner(1), 1, -0.5);
        assertCorner(r.corner(2), -1, -0.5);
        assertCorner(r.corner(3), -1, 0.5);
    }

    @Test
    void quarterTurnSwapsExtents() {
        BoundsRect r = GeomUtils.rectangleCorners(2, 3, 1, 0.5, 0, 0, 90);
        Envelope env = r.toPolygon().getEnvelopeInternal();

        assertThat(env.getWidth()).isCloseTo(1.0, within(1e-9));
        assertThat(env.getHeight()).isCloseTo(2.0, within(1e-9));
        assertThat(r.centroid().x).isCloseTo(2.0, within(1e-9));
        assertThat(r.centroid().y).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void offsetMovesTheRectangle() {
        BoundsRect r = GeomUtils.objectBounds(new Vec3(1, 1, 1), new Vec3(0.5, 0, 0), new Vec3(0, 0, 0), 0);

        assertThat(r.centroid().x).isCloseTo(0.5, within(1e-9));
        assertThat(r.centroid().y).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void adjacencyUsesPolygonDistance() {
        BoundsRect a = GeomUtils.rectangleCorners(0, 0, 0.5, 0.5, 0, 0, 0);
        BoundsRect b = GeomUtils.rectangleCorners(1.4, 0, 0.5, 0.5, 0, 0, 0);
        BoundsRect c = GeomUtils.rectangleCorners(3, 0, 0.5, 0.5, 0, 0, 0);

        assertThat(GeomUtils.polygonDistance(a, b)).isCloseTo(0.4, within(1e-9));
        assertThat(GeomUtils.areAdjacent(a, b)).isTrue();
        assertThat(GeomUtils.areAdjacent(a, c)).isFalse();
    }

    @Test
    void randomRealStaysOnTheGrid() {
        Random rnd = new Random(7);
        for (int i = 0; i < 200; i++) {
            double v = GeomUtils.randomReal(rnd, -1, 1);
            assertThat(v).isBetween(-1.0, 1.0);
            double steps = (v + 1) / GeomUtils.MIN_RANDOM_INTERVAL;
            assertThat(steps).isCloseTo(Math.rint(steps), within(1e-6));
        }
    }

    @Test
    void randomRealRejectsInvertedRange() {
        assertThatThrownBy(() -> GeomUtils.randomReal(new Random(1), 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void randomRotationIsAValidAngle() {
        Random rnd = new Random(3);
        for (int i = 0; i < 50; i++) {
            assertThat(GeomUtils.randomRotation(rnd)).isIn(0, 45, 90, 135, 180, 225, 270, 315);
        }
    }

    private static void assertCorner(Coordinate c, double x, double z) {
        assertThat(c.x).isCloseTo(x, within(1e-9));
        assertThat(c.y).isCloseTo(z, within(1e-9));
    }
}
