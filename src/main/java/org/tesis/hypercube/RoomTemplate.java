package org.tesis.hypercube;

import java.util.List;
import java.util.Random;

/* Sala de partida de un hipercubo: dimensiones y materiales de piso y paredes. */
public final class RoomTemplate {

    // ===================== Parámetros de la sala al azar =====================
    static final int[] ROOM_SIZE_X = { 10, 11, 12, 13, 14, 15 };
    static final int[] ROOM_SIZE_Y = { 3, 4, 5 };
    static final int[] ROOM_SIZE_Z = { 10, 11, 12, 13, 14, 15 };

    final Vec3 dimensions;
    final Material floor;
    final Material wall;

    public RoomTemplate(Vec3 dimensions, Material floor, Material wall) {
        this.dimensions = dimensions;
        this.floor = floor;
        this.wall = wall;
    }

    // sala 10 x 3 x 10 con el primer piso y la primera pared del catálogo
    public static RoomTemplate defaults(Catalog catalog) {
        return new RoomTemplate(Room.DEFAULT_DIMENSIONS, first(catalog.floorMaterials()), first(catalog.wallMaterials()));
    }

    public static RoomTemplate random(Catalog catalog, Random rnd) {
        Vec3 dims = new Vec3(
                ROOM_SIZE_X[rnd.nextInt(ROOM_SIZE_X.length)],
                ROOM_SIZE_Y[rnd.nextInt(ROOM_SIZE_Y.length)],
                ROOM_SIZE_Z[rnd.nextInt(ROOM_SIZE_Z.length)]);
        return new RoomTemplate(dims, pick(catalog.floorMaterials(), rnd), pick(catalog.wallMaterials(), rnd));
    }

    private static Material first(List<Material> options) {
        if (options.isEmpty()) throw new IllegalStateException("El catálogo no tiene materiales de sala");
        return options.get(0);
    }

    private static Material pick(List<Material> options, Random rnd) {
        if (options.isEmpty()) throw new IllegalStateException("El catálogo no tiene materiales de sala");
        return options.get(rnd.nextInt(options.size()));
    }

    public Room room() { return Room.fromDimensions(dimensions); }
    public Vec3 dimensions() { return dimensions; }
    public Material floor() { return floor; }
    public Material wall() { return wall; }

    @Override public String toString() {
        return "RoomTemplate[" + dimensions + " floor=" + floor + " wall=" + wall + "]";
    }
}
