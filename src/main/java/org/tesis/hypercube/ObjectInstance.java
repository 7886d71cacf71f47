package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/*
 * Definición materializada en una escena. El rectángulo se recalcula cada vez que
 * cambian posición o rotación; null significa que quedó desactualizado.
 */
public final class ObjectInstance {
    final String id;
    Role role;
    final ObjectDefinition definition;
    Vec3 position;
    Vec3 rotation;
    BoundsRect bounds;

    String locationParent;          // id del contenedor, si está adentro
    Integer parentArea;             // índice del área del contenedor
    final List<String> isParentOf = new ArrayList<>();
    boolean canContainTarget;

    private ObjectInstance(String id, ObjectDefinition definition, Vec3 position, Vec3 rotation, BoundsRect bounds) {
        this.id = id;
        this.definition = definition;
        this.position = position;
        this.rotation = rotation;
        this.bounds = bounds;
    }

    // instancia en el origen con la rotación base de la definición
    static ObjectInstance atOrigin(ObjectDefinition definition, String id) {
        Vec3 pos = new Vec3(-definition.offset.x, definition.positionY, -definition.offset.z);
        return new ObjectInstance(id, definition, pos, definition.rotation, null);
    }

    static String newId(java.util.Random rnd) {
        return new UUID(rnd.nextLong(), rnd.nextLong()).toString();
    }

    /*
     * Mueve la instancia a la ubicación. La posición de la ubicación está expresada con el
     * offset de "previous", por eso se suma ese offset y se resta el propio.
     */
    void moveTo(Location location, ObjectDefinition previous) {
        Vec3 prevOffset = previous == null ? Vec3.ZERO : previous.offset;
        this.position = new Vec3(
                location.position.x + prevOffset.x - definition.offset.x,
                location.position.y,
                location.position.z + prevOffset.z - definition.offset.z);
        this.rotation = location.rotation;
        this.bounds = location.bounds;
    }

    void moveTo(Location location) {
        moveTo(location, definition);
    }

    // copia independiente (mismos ids)
    ObjectInstance copy() {
        ObjectInstance c = new ObjectInstance(id, definition, position, rotation, bounds);
        c.role = role;
        c.locationParent = locationParent;
        c.parentArea = parentArea;
        c.isParentOf.addAll(isParentOf);
        c.canContainTarget = canContainTarget;
        return c;
    }

    Location toLocation() {
        return new Location(position, rotation, bounds);
    }

    public String id() { return id; }
    public Role role() { return role; }
    public ObjectDefinition definition() { return definition; }
    public Vec3 position() { return position; }
    public Vec3 rotation() { return rotation; }
    public Vec3 scale() { return definition.scale; }
    public BoundsRect bounds() { return bounds; }
    public String locationParent() { return locationParent; }
    public Integer parentArea() { return parentArea; }
    public List<String> isParentOf() { return List.copyOf(isParentOf); }
    public boolean canContainTarget() { return canContainTarget; }
    public List<String> materials() { return definition.materials; }
    public List<String> colors() { return definition.colors; }

    @Override public String toString() {
        return "ObjectInstance[" + (role == null ? "?" : role.label()) + " " + definition.type + " pos=" + position
                + " rotY=" + rotation.y + (locationParent != null ? " in=" + locationParent : "") + "]";
    }
}
