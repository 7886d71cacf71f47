package org.tesis.hypercube;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.linearref.LengthIndexedLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.DoubleSupplier;

/*
 * Busca una ubicación válida para un objeto según una política (al azar, frente o
 * espalda del performer, en línea con un objeto ancla, lejos de otro).
 * Cada búsqueda exitosa agrega su rectángulo al registro recibido; si falla devuelve
 * null y el registro queda igual.
 */
public class PlacementSearch {

    // ===================== Parámetros de búsqueda =====================
    static final int    MAX_TRIES                        = 50;
    static final double MIN_FORWARD_VISIBILITY_DISTANCE  = 1.25;  // distancia mínima delante del performer
    static final double MIN_GAP                          = 0.1;   // separación y paso sobre los rayos
    static final double MAX_REACH_DISTANCE               = 1.0;   // alcance del brazo del performer
    static final double MIN_OBJECTS_SEPARATION_DISTANCE  = 2.0;   // "lejos de"
    static final double REAR_CLEARANCE                   = 0.5;   // hueco detrás del performer

    // ======= Tipos =======

    /* Relación con el objeto ancla en generateInLine. */
    public enum InLine {
        CLOSE,        // entre el ancla y el performer
        ADJACENT,     // a izquierda o derecha del ancla
        BEHIND,       // detrás del ancla
        OBSTRUCT,     // tapa por completo al ancla
        UNREACHABLE   // deja al ancla fuera del alcance del performer
    }

    // fuente de posiciones (x, z); null si no pudo generar una
    interface PositionSampler {
        double[] next();
    }

    final Room room;
    final Random rnd;

    public PlacementSearch(Room room, Random rnd) {
        this.room = room;
        this.rnd = rnd;
    }

    // ------------- al azar -------------

    // posición al azar en la sala con una rotación discreta al azar
    public Location randomLocation(ObjectDefinition def, Vec3 performerPos, BoundsRegistry registry) {
        return randomLocation(def, List.of(), performerPos, registry, null);
    }

    // rotation == null => rotación discreta al azar en cada intento
    public Location randomLocation(ObjectDefinition def, Vec3 performerPos, BoundsRegistry registry,
                                   DoubleSupplier rotation) {
        return randomLocation(def, List.of(), performerPos, registry, rotation);
    }

    // "variants": otras definiciones que van a ocupar la misma ubicación y también tienen que caber
    public Location randomLocation(ObjectDefinition def, List<ObjectDefinition> variants, Vec3 performerPos,
                                   BoundsRegistry registry, DoubleSupplier rotation) {
        return calcObjectPosition(def, variants, performerPos, registry,
                () -> new double[]{ room.randomX(rnd), room.randomZ(rnd) }, rotation);
    }

    /*
     * Bucle base: hasta MAX_TRIES candidatos del sampler. La rotación del candidato es la
     * rotación base de la definición más la rotación pedida. Cada variante se valida en la
     * misma posición y rotación.
     */
    Location calcObjectPosition(ObjectDefinition def, List<ObjectDefinition> variants, Vec3 performerPos,
                                BoundsRegistry registry, PositionSampler sampler, DoubleSupplier rotation) {
        for (int tries = 0; tries < MAX_TRIES; tries++) {
            double rotationY = def.rotation.y
                    + (rotation != null ? rotation.getAsDouble() : GeomUtils.randomRotation(rnd));
            double[] xz = sampler.next();
            if (xz == null) continue;

            Vec3 position = new Vec3(xz[0], def.positionY, xz[1]);
            BoundsRect rect = def.placementBounds(position, rotationY);
            if (validateLocationRect(rect, performerPos, registry.list())
                    && validateVariants(variants, position, rotationY, performerPos, registry.list())) {
                registry.add(rect);
                return new Location(position, new Vec3(def.rotation.x, rotationY, def.rotation.z), rect);
            }
        }
        return null;
    }

    // dentro de la sala y sin pisar al performer ni a nadie de la lista
    boolean validateLocationRect(BoundsRect rect, Vec3 performerPos, List<BoundsRect> others) {
        if (!room.withinRoom(rect)) return false;
        if (GeomUtils.overlaps(rect, GeomUtils.performerRect(performerPos))) return false;
        for (BoundsRect other : others) {
            if (GeomUtils.overlaps(rect, other)) return false;
        }
        return true;
    }

    boolean validateVariants(List<ObjectDefinition> variants, Vec3 position, double rotationY, Vec3 performerPos,
                             List<BoundsRect> others) {
        for (ObjectDefinition variant : variants) {
            if (!validateLocationRect(variant.placementBounds(position, rotationY), performerPos, others)) return false;
        }
        return true;
    }

    // ------------- frente / espalda del performer -------------

    /*
     * Segmento visible delante del performer: desde MIN_FORWARD_VISIBILITY_DISTANCE
     * hasta fuera de la sala, recortado a la sala. null si no queda nada.
     */
    LineString visibleSegment(PerformerStart performer) {
        double maxDimension = Math.max(room.dimensions.x, room.dimensions.z);
        Geometry segment = GeomUtils.line(0, MIN_FORWARD_VISIBILITY_DISTANCE, 0, maxDimension * 2);
        segment = GeomUtils.rotate(segment, -performer.rotationY, 0, 0);
        segment = GeomUtils.translate(segment, performer.position.x, performer.position.z);

        Geometry visible = room.box().intersection(segment);
        if (visible.isEmpty() || !(visible instanceof LineString line)) return null;
        return line;
    }

    public Location inFrontOfPerformer(PerformerStart performer, ObjectDefinition def,
                                       BoundsRegistry registry, DoubleSupplier rotation) {
        return inFrontOfPerformer(performer, def, List.of(), registry, rotation);
    }

    public Location inFrontOfPerformer(PerformerStart performer, ObjectDefinition def, List<ObjectDefinition> variants,
                                       BoundsRegistry registry, DoubleSupplier rotation) {
        LineString visible = visibleSegment(performer);
        if (visible == null) return null;
        LengthIndexedLine indexed = new LengthIndexedLine(visible);
        double length = visible.getLength();

        return calcObjectPosition(def, variants, performer.position, registry, () -> {
            Coordinate c = indexed.extractPoint(rnd.nextDouble() * length);
            return new double[]{ c.x, c.y };
        }, rotation);
    }

    /*
     * Semiplano detrás del performer (a REAR_CLEARANCE más medio tamaño del objeto),
     * girado con el performer y recortado a la sala achicada en ese medio tamaño.
     * Se elige una x sobre la grilla cuya vertical corte la región y un punto sobre esa vertical.
     */
    public Location inBackOfPerformer(PerformerStart performer, ObjectDefinition def,
                                      BoundsRegistry registry, DoubleSupplier rotation) {
        return inBackOfPerformer(performer, def, List.of(), registry, rotation);
    }

    public Location inBackOfPerformer(PerformerStart performer, ObjectDefinition def, List<ObjectDefinition> variants,
                                      BoundsRegistry registry, DoubleSupplier rotation) {
        double halfSize = Math.max(def.dimensions.x / 2.0 - def.offset.x, def.dimensions.z / 2.0 - def.offset.z);

        Geometry rear = GeomUtils.box(-room.dimensions.x, -room.dimensions.z,
                room.dimensions.x, -REAR_CLEARANCE - halfSize);
        rear = GeomUtils.translate(rear, performer.position.x, performer.position.z);
        rear = GeomUtils.rotate(rear, -performer.rotationY, performer.position.x, performer.position.z);

        Polygon roomPoly = room.shrunkBox(halfSize);
        if (roomPoly == null) return null;
        Geometry region = rear.intersection(roomPoly);
        if (region.isEmpty()) return null;

        Envelope env = region.getEnvelopeInternal();
        double minX = clamp(env.getMinX(), room.minX, room.maxX);
        double maxX = clamp(env.getMaxX(), room.minX, room.maxX);
        double minZ = clamp(env.getMinY(), room.minZ, room.maxZ);
        double maxZ = clamp(env.getMaxY(), room.minZ, room.maxZ);

        return calcObjectPosition(def, variants, performer.position, registry,
                () -> sampleRear(region, minX, maxX, minZ, maxZ), rotation);
    }

    private double[] sampleRear(Geometry region, double minX, double maxX, double minZ, double maxZ) {
        Geometry inRear = null;
        for (int i = 0; i < MAX_TRIES; i++) {
            double x = GeomUtils.randomReal(rnd, minX, maxX);
            Geometry vertical = GeomUtils.line(x, minZ, x, maxZ).intersection(region);
            if (!vertical.isEmpty()) {
                inRear = vertical;
                break;
            }
        }
        if (inRear == null) return null;
        // puede quedar un único punto
        if (inRear instanceof Point p) return new double[]{ p.getX(), p.getY() };
        LengthIndexedLine indexed = new LengthIndexedLine(inRear);
        Coordinate c = indexed.extractPoint(rnd.nextDouble() * inRear.getLength());
        return new double[]{ c.x, c.y };
    }

    private static double clamp(double v, double min, double max) {
        return Math.min(max, Math.max(min, v));
    }

    // ------------- en línea con un ancla -------------

    /*
     * Camina desde el ancla sobre uno o dos rayos definidos por el rumbo performer -> ancla,
     * de a MIN_GAP, desde la distancia mínima hasta la máxima. Gana el primer paso válido.
     * Las dimensiones "cerradas" del objeto ganan si existen.
     */
    public Location inLineWithObject(ObjectDefinition def, ObjectDefinition anchorDef, Location anchorLocation,
                                     PerformerStart performer, BoundsRegistry registry, InLine mode) {
        return inLineWithObject(def, List.of(), anchorDef, anchorLocation, performer, registry, mode);
    }

    public Location inLineWithObject(ObjectDefinition def, List<ObjectDefinition> variants, ObjectDefinition anchorDef,
                                     Location anchorLocation, PerformerStart performer, BoundsRegistry registry,
                                     InLine mode) {
        Vec3 dims = def.placementDimensions();
        Vec3 off = def.placementOffset();
        Vec3 anchorDims = anchorDef.dimensions;
        Vec3 anchorOff = anchorDef.offset;
        Vec3 performerPos = performer.position;

        double anchorX = anchorLocation.position.x + anchorOff.x;
        double anchorZ = anchorLocation.position.z + anchorOff.z;
        BoundsRect anchorRect = GeomUtils.objectBounds(anchorDims, anchorOff, anchorLocation.position,
                anchorLocation.rotation.y);
        BoundsRect anchorView = anchorLocation.bounds != null ? anchorLocation.bounds : anchorRect;

        double minDistance = MIN_GAP + Math.min(anchorDims.x / 2.0, anchorDims.z / 2.0)
                + Math.min(dims.x / 2.0, dims.z / 2.0);
        double performerDistance = Math.hypot(anchorX - performerPos.x, anchorZ - performerPos.z);

        boolean blocking = mode == InLine.OBSTRUCT || mode == InLine.UNREACHABLE;
        if (mode != InLine.ADJACENT && mode != InLine.BEHIND && performerDistance < minDistance * 2) {
            return null;
        }

        double diagonalDistance = MIN_GAP + Math.hypot(anchorDims.x / 2.0, anchorDims.z / 2.0)
                + Math.hypot(dims.x / 2.0, dims.z / 2.0);
        double maxDistance = blocking ? performerDistance - minDistance : diagonalDistance;

        double performerAngle = Math.toDegrees(Math.atan2(anchorZ - performerPos.z, anchorX - performerPos.x));
        List<Double> rays = new ArrayList<>();
        if (mode == InLine.BEHIND) rays.add(performerAngle);
        else if (mode == InLine.ADJACENT) {
            rays.add(performerAngle + 90);
            rays.add(performerAngle + 270);
        } else rays.add(performerAngle + 180);
        Collections.shuffle(rays, rnd);

        // el objeto queda alineado con el performer
        double rotationY = normalizeDegrees(def.rotation.y + 450 - performerAngle);

        List<BoundsRect> others = new ArrayList<>(registry.list());
        others.add(anchorRect);

        for (double ray : rays) {
            double rad = Math.toRadians(ray);
            for (double distance = minDistance; distance <= maxDistance; distance += MIN_GAP) {
                double x = anchorX + distance * Math.cos(rad) - off.x;
                double z = anchorZ + distance * Math.sin(rad) - off.z;
                Vec3 position = new Vec3(x, def.positionY, z);
                BoundsRect rect = GeomUtils.objectBounds(dims, off, position, rotationY);

                if (!validateLocationRect(rect, performerPos, others)) continue;
                if (!validateVariants(variants, position, rotationY, performerPos, others)) continue;

                if (mode == InLine.OBSTRUCT) {
                    Polygon poly = rect.toPolygon();
                    if (poly.distance(anchorRect.toPolygon()) > MAX_REACH_DISTANCE) continue;
                    if (!Visibility.fullyObstructs(performerPos, anchorView, poly)) continue;
                }
                if (mode == InLine.UNREACHABLE) {
                    double reachable = GeomUtils.polygonDistance(rect, anchorRect) + Math.min(dims.x / 2.0, dims.z / 2.0);
                    if (reachable <= MAX_REACH_DISTANCE) continue;
                }

                registry.add(rect);
                return new Location(position, new Vec3(def.rotation.x, rotationY, def.rotation.z), rect);
            }
        }
        return null;
    }

    static double normalizeDegrees(double deg) {
        double r = deg % 360.0;
        return r < 0 ? r + 360.0 : r;
    }

    // ------------- lejos de -------------

    // ubicación al azar a más de MIN_OBJECTS_SEPARATION_DISTANCE de "existing"
    public Location farFrom(ObjectDefinition def, Location existing, Vec3 performerPos, BoundsRegistry registry) {
        return farFrom(def, List.of(), existing, performerPos, registry);
    }

    public Location farFrom(ObjectDefinition def, List<ObjectDefinition> variants, Location existing,
                            Vec3 performerPos, BoundsRegistry registry) {
        for (int tries = 0; tries < MAX_TRIES; tries++) {
            Location candidate = randomLocation(def, variants, performerPos, registry.copy(), null);
            if (candidate != null && farEnough(existing.bounds, candidate, variants)) {
                registry.add(candidate.bounds);
                return candidate;
            }
        }
        return null;
    }

    private static boolean farEnough(BoundsRect existing, Location candidate, List<ObjectDefinition> variants) {
        if (GeomUtils.areAdjacent(existing, candidate.bounds, MIN_OBJECTS_SEPARATION_DISTANCE)) return false;
        for (ObjectDefinition variant : variants) {
            BoundsRect rect = variant.placementBounds(candidate.position, candidate.rotation.y);
            if (GeomUtils.areAdjacent(existing, rect, MIN_OBJECTS_SEPARATION_DISTANCE)) return false;
        }
        return true;
    }
}
