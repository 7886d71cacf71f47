package org.tesis.hypercube;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

/*
 * Chequeos de línea de visión desde el performer hacia un rectángulo objetivo.
 * Se muestrea un conjunto fijo de puntos: 4 esquinas + centroide, y para "parcial"
 * además el punto medio de cada borde y los puntos medios de cada mitad.
 */
public final class Visibility {

    private Visibility() {}

    public static final class Obstruction {
        final boolean fully;
        final boolean partly;

        Obstruction(boolean fully, boolean partly) {
            this.fully = fully;
            this.partly = partly;
        }

        public boolean fully()  { return fully; }
        public boolean partly() { return partly; }

        @Override public String toString() {
            return "Obstruction[fully=" + fully + ", partly=" + partly + "]";
        }
    }

    public static Obstruction visibilityLineObstructed(Vec3 observer, Polygon blocker, BoundsRect target) {
        List<Coordinate> points = samplePoints(target, true);
        int hits = 0;
        boolean fully = true;
        for (int i = 0; i < points.size(); i++) {
            boolean hit = blocker.intersects(sightline(observer, points.get(i)));
            if (hit) hits++;
            // las primeras 5 muestras (esquinas + centroide) definen "total"
            else if (i < 5) fully = false;
        }
        return new Obstruction(fully, hits > 0);
    }

    public static boolean fullyObstructs(Vec3 observer, BoundsRect target, Polygon blocker) {
        for (Coordinate c : samplePoints(target, false)) {
            if (!blocker.intersects(sightline(observer, c))) return false;
        }
        return true;
    }

    public static boolean partlyObstructs(Vec3 observer, BoundsRect target, Polygon blocker) {
        for (Coordinate c : samplePoints(target, true)) {
            if (blocker.intersects(sightline(observer, c))) return true;
        }
        return false;
    }

    static List<Coordinate> samplePoints(BoundsRect target, boolean withEdges) {
        Coordinate[] bounds = target.corners();
        List<Coordinate> points = new ArrayList<>(17);
        for (Coordinate c : bounds) points.add(c);
        points.add(target.centroid());
        if (!withEdges) return points;

        for (int i = 0; i < bounds.length; i++) {
            Coordinate previous = bounds[i > 0 ? i - 1 : bounds.length - 1];
            Coordinate next = bounds[i];
            Coordinate center = midpoint(previous, next);
            points.add(center);
            points.add(midpoint(previous, center));
            points.add(midpoint(center, next));
        }
        return points;
    }

    private static Coordinate midpoint(Coordinate a, Coordinate b) {
        return new Coordinate((a.x + b.x) / 2.0, (a.y + b.y) / 2.0);
    }

    private static Geometry sightline(Vec3 observer, Coordinate to) {
        if (observer.x == to.x && observer.z == to.y) {
            return GeomUtils.GF.createPoint(new Coordinate(to));
        }
        return GeomUtils.line(observer.x, observer.z, to.x, to.y);
    }
}
