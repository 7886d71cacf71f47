package org.tesis.hypercube;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

import java.util.Random;

/* Límites del piso donde puede quedar un objeto; inmutable por corrida. */
public final class Room {

    // ===================== Parámetros de la sala =====================
    static final double PERFORMER_HALF_WIDTH = 0.27;   // medio ancho del performer
    static final double PERFORMER_CAMERA_Y   = 0.762;  // altura de la cámara
    static final double PERFORMER_MASS       = 2.0;
    static final Vec3   DEFAULT_DIMENSIONS   = new Vec3(10, 3, 10);

    public static final Room DEFAULT = fromDimensions(DEFAULT_DIMENSIONS);

    final Vec3 dimensions;
    final double minX, maxX, minZ, maxZ;

    private Room(Vec3 dimensions, double minX, double maxX, double minZ, double maxZ) {
        this.dimensions = dimensions;
        this.minX = minX; this.maxX = maxX;
        this.minZ = minZ; this.maxZ = maxZ;
    }

    // la sala queda recortada en el medio ancho del performer para que pueda entrar y salir
    public static Room fromDimensions(Vec3 dims) {
        if (dims.x <= 2 * PERFORMER_HALF_WIDTH || dims.z <= 2 * PERFORMER_HALF_WIDTH) {
            throw new IllegalArgumentException("Sala demasiado chica: " + dims);
        }
        return new Room(dims,
                -dims.x / 2.0 + PERFORMER_HALF_WIDTH, dims.x / 2.0 - PERFORMER_HALF_WIDTH,
                -dims.z / 2.0 + PERFORMER_HALF_WIDTH, dims.z / 2.0 - PERFORMER_HALF_WIDTH);
    }

    public Vec3 dimensions() { return dimensions; }
    public double minX() { return minX; }
    public double maxX() { return maxX; }
    public double minZ() { return minZ; }
    public double maxZ() { return maxZ; }

    public boolean contains(double x, double z) {
        return x >= minX && x <= maxX && z >= minZ && z <= maxZ;
    }

    // todas las esquinas dentro de la sala (inclusivo)
    public boolean withinRoom(BoundsRect rect) {
        for (Coordinate c : rect.corners()) {
            if (!contains(c.x, c.y)) return false;
        }
        return true;
    }

    public Polygon box() {
        return GeomUtils.box(minX, minZ, maxX, maxZ);
    }

    // caja de la sala recortada "margin" por lado; null si no queda área
    public Polygon shrunkBox(double margin) {
        if (minX + margin >= maxX - margin || minZ + margin >= maxZ - margin) return null;
        return GeomUtils.box(minX + margin, minZ + margin, maxX - margin, maxZ - margin);
    }

    double randomX(Random rnd) {
        return GeomUtils.round(GeomUtils.uniform(rnd, minX, maxX), GeomUtils.POSITION_DIGITS);
    }

    double randomZ(Random rnd) {
        return GeomUtils.round(GeomUtils.uniform(rnd, minZ, maxZ), GeomUtils.POSITION_DIGITS);
    }

    @Override public String toString() {
        return "Room[x=" + minX + ".." + maxX + ", z=" + minZ + ".." + maxZ + "]";
    }
}
