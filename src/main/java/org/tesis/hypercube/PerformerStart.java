package org.tesis.hypercube;

import java.util.Random;

/* Posición y orientación inicial del performer. */
public final class PerformerStart {
    final Vec3 position;
    final double rotationY;

    public PerformerStart(Vec3 position, double rotationY) {
        this.position = position;
        this.rotationY = rotationY;
    }

    public Vec3 position() { return position; }
    public double rotationY() { return rotationY; }

    // sortea una posición dentro de la sala (recortada otra vez en el medio ancho) y una rotación válida
    static PerformerStart random(Room room, Random rnd) {
        double hw = Room.PERFORMER_HALF_WIDTH;
        double x = GeomUtils.round(GeomUtils.uniform(rnd, room.minX + hw, room.maxX - hw), GeomUtils.POSITION_DIGITS);
        double z = GeomUtils.round(GeomUtils.uniform(rnd, room.minZ + hw, room.maxZ - hw), GeomUtils.POSITION_DIGITS);
        return new PerformerStart(new Vec3(x, 0, z), GeomUtils.randomRotation(rnd));
    }

    @Override public String toString() {
        return "PerformerStart[pos=" + position + ", rotY=" + rotationY + "]";
    }
}
