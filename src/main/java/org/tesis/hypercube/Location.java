package org.tesis.hypercube;

/* Ubicación resuelta: posición, rotación y rectángulo validado. */
public final class Location {
    final Vec3 position;
    final Vec3 rotation;
    final BoundsRect bounds;

    public Location(Vec3 position, Vec3 rotation, BoundsRect bounds) {
        this.position = position;
        this.rotation = rotation;
        this.bounds = bounds;
    }

    public Vec3 position() { return position; }
    public Vec3 rotation() { return rotation; }
    public BoundsRect bounds() { return bounds; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location l)) return false;
        return position.equals(l.position) && rotation.equals(l.rotation)
                && (bounds == null ? l.bounds == null : bounds.equals(l.bounds));
    }

    @Override public int hashCode() {
        return 31 * position.hashCode() + rotation.hashCode();
    }

    @Override public String toString() {
        return "Location[pos=" + position + ", rotY=" + rotation.y + "]";
    }
}
