package org.tesis.hypercube;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.Random;

public class GeomUtils {

    // ===================== Parámetros geométricos =====================
    static final int      POSITION_DIGITS               = 2;     // decimales de las posiciones sorteadas
    static final double   MIN_RANDOM_INTERVAL           = 0.05;  // paso de randomReal
    static final double   MAX_OBJECTS_ADJACENT_DISTANCE = 0.5;
    static final int[]    VALID_ROTATIONS               = { 0, 45, 90, 135, 180, 225, 270, 315 };

    static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    private GeomUtils() {}

    /*
     * Esquinas del rectángulo de medio ancho (halfX, halfZ), corrido por el offset y
     * rotado según la rotación en grados de la escena. Orden: (+x,+z), (+x,-z), (-x,-z), (-x,+z).
     */
    public static BoundsRect rectangleCorners(double centerX, double centerZ, double halfX, double halfZ,
                                              double offsetX, double offsetZ, double rotationDeg) {
        double rad = Math.PI * (2 - rotationDeg / 180.0);
        double sin = Math.sin(rad);
        double cos = Math.cos(rad);
        double xPlus  =  halfX + offsetX;
        double xMinus = -halfX + offsetX;
        double zPlus  =  halfZ + offsetZ;
        double zMinus = -halfZ + offsetZ;

        return new BoundsRect(
                corner(centerX, centerZ, xPlus,  zPlus,  sin, cos),
                corner(centerX, centerZ, xPlus,  zMinus, sin, cos),
                corner(centerX, centerZ, xMinus, zMinus, sin, cos),
                corner(centerX, centerZ, xMinus, zPlus,  sin, cos));
    }

    private static Coordinate corner(double cx, double cz, double dx, double dz, double sin, double cos) {
        return new Coordinate(cx + dx * cos - dz * sin, cz + dx * sin + dz * cos);
    }

    // rectángulo de un objeto con sus dimensiones y offset en la posición/rotación dadas
    public static BoundsRect objectBounds(Vec3 dimensions, Vec3 offset, Vec3 position, double rotationY) {
        Vec3 off = offset == null ? Vec3.ZERO : offset;
        return rectangleCorners(position.x, position.z, dimensions.x / 2.0, dimensions.z / 2.0,
                off.x, off.z, rotationY);
    }

    // huella cuadrada del performer, alineada a los ejes
    public static BoundsRect performerRect(Vec3 position) {
        double hw = Room.PERFORMER_HALF_WIDTH;
        return new BoundsRect(
                new Coordinate(position.x - hw, position.z - hw),
                new Coordinate(position.x - hw, position.z + hw),
                new Coordinate(position.x + hw, position.z + hw),
                new Coordinate(position.x + hw, position.z - hw));
    }

    public static boolean overlaps(BoundsRect a, BoundsRect b) {
        return SeparatingAxis.intersects(a, b);
    }

    // distancia euclídea; incluye y cuando difiere
    public static double distanceBetween(Vec3 a, Vec3 b) {
        double dx = a.x - b.x, dy = a.y - b.y, dz = a.z - b.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    // distancia entre los polígonos de ambos rectángulos
    public static double polygonDistance(BoundsRect a, BoundsRect b) {
        return a.toPolygon().distance(b.toPolygon());
    }

    public static boolean areAdjacent(BoundsRect a, BoundsRect b) {
        return areAdjacent(a, b, MAX_OBJECTS_ADJACENT_DISTANCE);
    }

    public static boolean areAdjacent(BoundsRect a, BoundsRect b, double distance) {
        return polygonDistance(a, b) <= distance;
    }

    static Polygon box(double minX, double minY, double maxX, double maxY) {
        Coordinate[] c = {
                new Coordinate(minX, minY), new Coordinate(maxX, minY),
                new Coordinate(maxX, maxY), new Coordinate(minX, maxY),
                new Coordinate(minX, minY)
        };
        return GF.createPolygon(c);
    }

    static LineString line(double x0, double y0, double x1, double y1) {
        return GF.createLineString(new Coordinate[]{ new Coordinate(x0, y0), new Coordinate(x1, y1) });
    }

    // rota una geometría (grados, antihorario) alrededor del punto dado
    static Geometry rotate(Geometry g, double angleDeg, double originX, double originY) {
        if (angleDeg % 360 == 0) return g.copy();
        return AffineTransformation.rotationInstance(Math.toRadians(angleDeg), originX, originY).transform(g);
    }

    // traslada una geometría en dx y dy
    static Geometry translate(Geometry g, double dx, double dy) {
        return AffineTransformation.translationInstance(dx, dy).transform(g);
    }

    // ------------- azar -------------

    static double uniform(Random rnd, double a, double b) {
        return a + (b - a) * rnd.nextDouble();
    }

    static double round(double v, int digits) {
        double f = Math.pow(10, digits);
        return Math.round(v * f) / f;
    }

    // número a <= N <= b tal que N - a es múltiplo de step
    static double randomReal(Random rnd, double a, double b, double step) {
        int steps = (int) ((b - a) / step);
        if (steps < 0) {
            throw new IllegalArgumentException("Argumentos inválidos para randomReal: (" + a + ", " + b + ", " + step + ")");
        }
        return a + rnd.nextInt(steps + 1) * step;
    }

    static double randomReal(Random rnd, double a, double b) {
        return randomReal(rnd, a, b, MIN_RANDOM_INTERVAL);
    }

    static int randomRotation(Random rnd) {
        return VALID_ROTATIONS[rnd.nextInt(VALID_ROTATIONS.length)];
    }
}
