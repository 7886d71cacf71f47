package org.tesis.hypercube;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

import java.util.Arrays;

/*
 * Rectángulo orientado de 4 esquinas en el plano del piso.
 * La coordenada JTS (x, y) representa (x, z) de la escena.
 */
public final class BoundsRect {
    private final Coordinate[] corners;

    BoundsRect(Coordinate a, Coordinate b, Coordinate c, Coordinate d) {
        this.corners = new Coordinate[]{ a, b, c, d };
    }

    public Coordinate corner(int i) { return new Coordinate(corners[i]); }

    public Coordinate[] corners() {
        Coordinate[] out = new Coordinate[4];
        for (int i = 0; i < 4; i++) out[i] = new Coordinate(corners[i]);
        return out;
    }

    // polígono cerrado (último = primero) sobre la fábrica compartida
    public Polygon toPolygon() {
        Coordinate[] ring = new Coordinate[5];
        for (int i = 0; i < 4; i++) ring[i] = new Coordinate(corners[i]);
        ring[4] = new Coordinate(corners[0]);
        return GeomUtils.GF.createPolygon(ring);
    }

    public Coordinate centroid() {
        return toPolygon().getCentroid().getCoordinate();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundsRect r)) return false;
        for (int i = 0; i < 4; i++) {
            if (Double.compare(corners[i].x, r.corners[i].x) != 0) return false;
            if (Double.compare(corners[i].y, r.corners[i].y) != 0) return false;
        }
        return true;
    }

    @Override public int hashCode() {
        int h = 1;
        for (Coordinate c : corners) {
            h = 31 * h + Double.hashCode(c.x);
            h = 31 * h + Double.hashCode(c.y);
        }
        return h;
    }

    @Override public String toString() {
        return "BoundsRect" + Arrays.toString(corners);
    }
}
