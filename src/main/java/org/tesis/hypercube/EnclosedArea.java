package org.tesis.hypercube;

/* Sub-volumen interior de un receptáculo (posición relativa al contenedor). */
public final class EnclosedArea {
    final Vec3 position;
    final Vec3 dimensions;

    public EnclosedArea(Vec3 position, Vec3 dimensions) {
        this.position = position;
        this.dimensions = dimensions;
    }

    public Vec3 position() { return position; }
    public Vec3 dimensions() { return dimensions; }

    @Override public String toString() {
        return "EnclosedArea[pos=" + position + ", dim=" + dimensions + "]";
    }
}
