package org.tesis.hypercube;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SeparatingAxisTest {

    private static BoundsRect square(double cx, double cz, double half, double rotation) {
        return GeomUtils.rectangleCorners(cx, cz, half, half, 0, 0, rotation);
    }

    @Test
    void overlappingSquaresIntersect() {
        assertThat(SeparatingAxis.intersects(square(0, 0, 1, 0), square(1.5, 0, 1, 0))).isTrue();
    }

    @Test
    void touchingEdgesDoNotIntersect() {
        assertThat(SeparatingAxis.intersects(square(0, 0, 1, 0), square(2, 0, 1, 0))).isFalse();
    }

    @Test
    void separatedSquaresDoNotIntersect() {
        assertThat(SeparatingAxis.intersects(square(0, 0, 1, 0), square(5, 5, 1, 0))).isFalse();
    }

    @Test
    void rotatedSquareNeedsItsOwnAxes() {
        // el envolvente del rombo toca al cuadrado pero el rombo no
        BoundsRect diamond = square(2.3, 2.3, 1, 45);
        assertThat(SeparatingAxis.intersects(square(0, 0, 1, 0), diamond)).isFalse();
        assertThat(SeparatingAxis.intersects(square(0, 0, 1, 0), square(1.5, 1.5, 1, 45))).isTrue();
    }

    @Test
    void containedSquareIntersects() {
        assertThat(SeparatingAxis.intersects(square(0, 0, 2, 0), square(0.2, 0.2, 0.3, 30))).isTrue();
    }

    // ------------- en cada rotación válida -------------

    private static BoundsRect plank(double cx, double cz, double rotation) {
        return GeomUtils.rectangleCorners(cx, cz, 1.0, 0.4, 0, 0, rotation);
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 45, 90, 135, 180, 225, 270, 315 })
    void identicalRectangleIntersects(int rotation) {
        assertThat(SeparatingAxis.intersects(plank(1.3, -0.7, rotation), plank(1.3, -0.7, rotation))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 45, 90, 135, 180, 225, 270, 315 })
    void rectangleMovedPastItsDiagonalDoesNotIntersect(int rotation) {
        double diagonal = 2 * Math.hypot(1.0, 0.4);
        BoundsRect rect = plank(0, 0, rotation);
        for (int bearing : GeomUtils.VALID_ROTATIONS) {
            double rad = Math.toRadians(bearing);
            double dx = (diagonal + 0.01) * Math.cos(rad);
            double dz = (diagonal + 0.01) * Math.sin(rad);
            for (int other : GeomUtils.VALID_ROTATIONS) {
                assertThat(SeparatingAxis.intersects(rect, plank(dx, dz, other)))
                        .as("rotación %d, rumbo %d, otra %d", rotation, bearing, other)
                        .isFalse();
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 45, 90, 135, 180, 225, 270, 315 })
    void rectangleMovedLessThanItsShortSideIntersects(int rotation) {
        BoundsRect rect = plank(0, 0, rotation);
        for (int bearing : GeomUtils.VALID_ROTATIONS) {
            double rad = Math.toRadians(bearing);
            assertThat(SeparatingAxis.intersects(rect, plank(0.3 * Math.cos(rad), 0.3 * Math.sin(rad), rotation)))
                    .as("rotación %d, rumbo %d", rotation, bearing)
                    .isTrue();
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 45, 90, 135, 180, 225, 270, 315 })
    void neighboursSharingAnEdgeDoNotIntersect(int rotation) {
        // eje x local del rectángulo girado
        double rad = Math.PI * (2 - rotation / 180.0);
        BoundsRect left = plank(0, 0, rotation);
        BoundsRect right = plank(2.0 * Math.cos(rad), 2.0 * Math.sin(rad), rotation);

        assertThat(SeparatingAxis.intersects(left, right)).isFalse();
    }
}
