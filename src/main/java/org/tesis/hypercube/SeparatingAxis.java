package org.tesis.hypercube;

import org.locationtech.jts.geom.Coordinate;

/*
 * Test de ejes separadores para dos cuadriláteros convexos.
 * Solo hay intersección si las proyecciones se solapan con medida positiva en
 * todos los ejes candidatos; tocarse en un borde o vértice no cuenta.
 */
public final class SeparatingAxis {

    static final double EPS_AXIS  = 1e-12;
    static final double EPS_TOUCH = 1e-9;    // solapes menores cuentan como contacto (ruido del seno/coseno)

    private SeparatingAxis() {}

    public static boolean intersects(BoundsRect a, BoundsRect b) {
        Coordinate[] pa = a.corners();
        Coordinate[] pb = b.corners();
        return !hasSeparatingAxis(pa, pa, pb) && !hasSeparatingAxis(pb, pa, pb);
    }

    // prueba como ejes las normales de los bordes de "edges"
    private static boolean hasSeparatingAxis(Coordinate[] edges, Coordinate[] pa, Coordinate[] pb) {
        for (int i = 0; i < edges.length; i++) {
            Coordinate p = edges[i];
            Coordinate q = edges[(i + 1) % edges.length];
            double nx = -(q.y - p.y);
            double ny = q.x - p.x;
            // borde degenerado, no aporta eje
            if (nx * nx + ny * ny < EPS_AXIS) continue;

            double[] ra = project(pa, nx, ny);
            double[] rb = project(pb, nx, ny);
            double tolerance = EPS_TOUCH * Math.sqrt(nx * nx + ny * ny);
            if (ra[1] <= rb[0] + tolerance || rb[1] <= ra[0] + tolerance) return true;
        }
        return false;
    }

    private static double[] project(Coordinate[] pts, double nx, double ny) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (Coordinate c : pts) {
            double d = c.x * nx + c.y * ny;
            if (d < min) min = d;
            if (d > max) max = d;
        }
        return new double[]{ min, max };
    }
}
