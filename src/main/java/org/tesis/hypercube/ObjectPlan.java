package org.tesis.hypercube;

/* Plan de un rol en una escena: política de ubicación, variante y definición fija opcional. */
public final class ObjectPlan {

    public static final ObjectPlan NONE = new ObjectPlan(LocationPlan.NONE, false, null);

    final LocationPlan location;
    final boolean untrained;
    final ObjectDefinition definition;   // null => se elige al generar

    public ObjectPlan(LocationPlan location, boolean untrained, ObjectDefinition definition) {
        if (location == null) throw new IllegalArgumentException("El plan necesita una ubicación");
        this.location = location;
        this.untrained = untrained;
        this.definition = definition;
    }

    public static ObjectPlan of(LocationPlan location) {
        return new ObjectPlan(location, false, null);
    }

    public static ObjectPlan untrained(LocationPlan location) {
        return new ObjectPlan(location, true, null);
    }

    public static ObjectPlan of(LocationPlan location, ObjectDefinition definition) {
        return new ObjectPlan(location, false, definition);
    }

    public LocationPlan location() { return location; }
    public boolean isUntrained() { return untrained; }
    public ObjectDefinition definition() { return definition; }

    // NONE: el rol no aparece en la escena
    public boolean isPresent() { return location != LocationPlan.NONE; }

    @Override public String toString() {
        return location + (untrained ? "(untrained)" : "");
    }
}
