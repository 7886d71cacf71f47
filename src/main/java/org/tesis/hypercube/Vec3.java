package org.tesis.hypercube;

import java.util.Locale;

/* Vector inmutable (x, y, z); y es la altura, el plano del piso es x/z. */
public final class Vec3 {
    public static final Vec3 ZERO = new Vec3(0, 0, 0);
    public static final Vec3 ONE  = new Vec3(1, 1, 1);

    public final double x, y, z;

    public Vec3(double x, double y, double z) {
        this.x = x; this.y = y; this.z = z;
    }

    public Vec3 plus(Vec3 o)  { return new Vec3(x + o.x, y + o.y, z + o.z); }
    public Vec3 minus(Vec3 o) { return new Vec3(x - o.x, y - o.y, z - o.z); }

    public Vec3 withX(double v) { return new Vec3(v, y, z); }
    public Vec3 withY(double v) { return new Vec3(x, v, z); }
    public Vec3 withZ(double v) { return new Vec3(x, y, v); }

    // intercambia x y z (objeto girado 90 grados)
    public Vec3 swapXZ() { return new Vec3(z, y, x); }

    public double maxXZ() { return Math.max(x, z); }
    public double minXZ() { return Math.min(x, z); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vec3 v)) return false;
        return Double.compare(x, v.x) == 0 && Double.compare(y, v.y) == 0 && Double.compare(z, v.z) == 0;
    }

    @Override public int hashCode() {
        int h = Double.hashCode(x);
        h = 31 * h + Double.hashCode(y);
        return 31 * h + Double.hashCode(z);
    }

    @Override public String toString() {
        return String.format(Locale.US, "(%.3f, %.3f, %.3f)", x, y, z);
    }
}
