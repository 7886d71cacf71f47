package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/*
 * Pruebas de encaje en las áreas interiores de un receptáculo y colocación adentro.
 * Las posiciones de los objetos contenidos quedan expresadas relativas al contenedor.
 */
public final class ContainmentFitter {

    private ContainmentFitter() {}

    static final double SIDEWAYS = 90.0;

    /* Cómo quedan dos objetos dentro de una misma área. */
    public enum Orientation { SIDE_BY_SIDE, FRONT_TO_BACK }

    // ======= Resultado =======
    public static final class Containment {
        final int areaIndex;
        final List<Double> angles;        // una por objeto; null para un objeto no evaluado
        final Orientation orientation;    // solo cuando se evaluaron dos objetos juntos

        Containment(int areaIndex, List<Double> angles, Orientation orientation) {
            this.areaIndex = areaIndex;
            this.angles = Collections.unmodifiableList(new ArrayList<>(angles));
            this.orientation = orientation;
        }

        public int areaIndex() { return areaIndex; }
        public List<Double> angles() { return angles; }
        public Double angle(int i) { return angles.get(i); }
        public Orientation orientation() { return orientation; }

        @Override public String toString() {
            return "Containment[area=" + areaIndex + ", angles=" + angles
                    + (orientation != null ? ", " + orientation : "") + "]";
        }
    }

    // 0 si entra derecho, 90 si entra girado, null si no entra
    static Double canEnclose(EnclosedArea area, ObjectDefinition def) {
        Vec3 a = area.dimensions;
        Vec3 d = def.dimensions;
        if (d.y > a.y) return null;
        if (d.x <= a.x && d.z <= a.z) return 0.0;
        if (d.z <= a.x && d.x <= a.z) return SIDEWAYS;
        return null;
    }

    /*
     * Primera área del contenedor donde entra cada definición no nula.
     * null si el contenedor no tiene áreas o ninguna sirve.
     */
    public static Containment canContain(ObjectDefinition container, ObjectDefinition... defs) {
        List<EnclosedArea> areas = container.enclosedAreas;
        for (int i = 0; i < areas.size(); i++) {
            List<Double> angles = new ArrayList<>();
            boolean fits = true;
            for (ObjectDefinition def : defs) {
                if (def == null) {
                    angles.add(null);
                    continue;
                }
                Double angle = canEnclose(areas.get(i), def);
                if (angle == null) {
                    fits = false;
                    break;
                }
                angles.add(angle);
            }
            if (fits) return new Containment(i, angles, null);
        }
        return null;
    }

    /*
     * Dos objetos en la misma área: primero lado a lado (en x), después uno delante del
     * otro (en z), probando cada combinación de giros. Se recorren todas las áreas.
     */
    public static Containment canContainBoth(ObjectDefinition container, ObjectDefinition a, ObjectDefinition b) {
        Vec3 da = a.dimensions;
        Vec3 db = b.dimensions;
        double height = Math.max(da.y, db.y);
        List<EnclosedArea> areas = container.enclosedAreas;

        for (int i = 0; i < areas.size(); i++) {
            Vec3 area = areas.get(i).dimensions;
            if (height > area.y) continue;

            // lado a lado: anchos sumados, profundidad máxima
            if (fits(area, da.x + db.x, Math.max(da.z, db.z)))
                return both(i, 0, 0, Orientation.SIDE_BY_SIDE);
            if (fits(area, da.x + db.z, Math.max(da.z, db.x)))
                return both(i, 0, SIDEWAYS, Orientation.SIDE_BY_SIDE);
            if (fits(area, da.z + db.x, Math.max(da.x, db.z)))
                return both(i, SIDEWAYS, 0, Orientation.SIDE_BY_SIDE);
            if (fits(area, da.z + db.z, Math.max(da.x, db.x)))
                return both(i, SIDEWAYS, SIDEWAYS, Orientation.SIDE_BY_SIDE);

            // uno delante del otro: profundidades sumadas
            if (fits(area, Math.max(da.x, db.x), da.z + db.z))
                return both(i, 0, 0, Orientation.FRONT_TO_BACK);
            if (fits(area, Math.max(da.x, db.z), da.z + db.x))
                return both(i, 0, SIDEWAYS, Orientation.FRONT_TO_BACK);
            if (fits(area, Math.max(da.z, db.x), da.x + db.z))
                return both(i, SIDEWAYS, 0, Orientation.FRONT_TO_BACK);
            if (fits(area, Math.max(da.z, db.z), da.x + db.x))
                return both(i, SIDEWAYS, SIDEWAYS, Orientation.FRONT_TO_BACK);
        }
        return null;
    }

    private static boolean fits(Vec3 area, double width, double depth) {
        return area.x >= width && area.z >= depth;
    }

    private static Containment both(int area, double angleA, double angleB, Orientation orientation) {
        return new Containment(area, Arrays.asList(angleA, angleB), orientation);
    }

    // ------------- colocación -------------

    /*
     * Pone el objeto en el área indicada, apoyado en su piso.
     * rotation == null mantiene la rotación actual del objeto.
     */
    public static void placeInside(ObjectInstance container, ObjectInstance obj, int areaIndex, Double rotation) {
        EnclosedArea area = areaOf(container, areaIndex);
        Vec3 off = obj.definition.offset;
        boolean sideways = rotation != null && rotation == SIDEWAYS;

        double x = area.position.x - (sideways ? off.z : off.x);
        double z = area.position.z - (sideways ? off.x : off.z);
        double y = area.position.y - area.dimensions.y / 2.0 + obj.definition.positionY;

        obj.position = new Vec3(x, y, z);
        if (rotation != null) obj.rotation = obj.rotation.withY(rotation);
        nest(container, obj, areaIndex);
    }

    /*
     * Pone dos objetos en la misma área, tocándose en el centro del área.
     * Solo se aceptan giros de 0 o 90 grados.
     */
    public static void placeBothInside(ObjectInstance container, ObjectInstance a, ObjectInstance b,
                                       int areaIndex, double rotationA, double rotationB, Orientation orientation) {
        if (!isRightAngle(rotationA) || !isRightAngle(rotationB)) {
            throw new IllegalArgumentException("Giros inválidos para dos objetos en un contenedor: "
                    + rotationA + ", " + rotationB);
        }
        EnclosedArea area = areaOf(container, areaIndex);
        Vec3 da = a.definition.dimensions;
        Vec3 db = b.definition.dimensions;
        double floor = area.position.y - area.dimensions.y / 2.0;

        double ax = area.position.x, az = area.position.z;
        double bx = area.position.x, bz = area.position.z;
        if (orientation == Orientation.SIDE_BY_SIDE) {
            ax -= (rotationA == SIDEWAYS ? da.z : da.x) / 2.0;
            bx += (rotationB == SIDEWAYS ? db.z : db.x) / 2.0;
        } else {
            az -= (rotationA == SIDEWAYS ? da.x : da.z) / 2.0;
            bz += (rotationB == SIDEWAYS ? db.x : db.z) / 2.0;
        }

        a.position = new Vec3(ax, floor + a.definition.positionY, az);
        a.rotation = new Vec3(0, rotationA, 0);
        b.position = new Vec3(bx, floor + b.definition.positionY, bz);
        b.rotation = new Vec3(0, rotationB, 0);
        nest(container, a, areaIndex);
        nest(container, b, areaIndex);
    }

    private static boolean isRightAngle(double rotation) {
        return rotation == 0 || rotation == SIDEWAYS;
    }

    private static EnclosedArea areaOf(ObjectInstance container, int areaIndex) {
        List<EnclosedArea> areas = container.definition.enclosedAreas;
        if (areaIndex < 0 || areaIndex >= areas.size()) {
            throw new IllegalArgumentException("El contenedor " + container.definition.type
                    + " no tiene el área " + areaIndex);
        }
        return areas.get(areaIndex);
    }

    private static void nest(ObjectInstance container, ObjectInstance obj, int areaIndex) {
        obj.locationParent = container.id;
        obj.parentArea = areaIndex;
        obj.bounds = GeomUtils.objectBounds(obj.definition.dimensions, obj.definition.offset,
                obj.position, obj.rotation.y);
        if (!container.isParentOf.contains(obj.id)) container.isParentOf.add(obj.id);
    }
}
