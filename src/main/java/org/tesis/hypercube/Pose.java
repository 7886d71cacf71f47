package org.tesis.hypercube;

/* Dimensiones, offset, altura y rotación base de una definición (usado para la variante de costado). */
public final class Pose {
    final Vec3 dimensions;
    final Vec3 offset;
    final double positionY;
    final Vec3 rotation;

    public Pose(Vec3 dimensions, Vec3 offset, double positionY, Vec3 rotation) {
        this.dimensions = dimensions;
        this.offset = offset == null ? Vec3.ZERO : offset;
        this.positionY = positionY;
        this.rotation = rotation == null ? Vec3.ZERO : rotation;
    }
}
