package org.tesis.hypercube;

import java.util.*;

/**
 * Plantilla inmutable de un objeto del catálogo. Las elecciones pendientes
 * (material, tamaño, variante) se resuelven con {@link DefinitionFinalizer}.
 */
public final class ObjectDefinition {
    final String type;
    final List<String> shape;
    final String size;
    final double mass;
    final Vec3 dimensions;
    final Vec3 offset;
    final double positionY;
    final Vec3 rotation;
    final Vec3 scale;
    final Set<Attribute> attributes;
    final List<EnclosedArea> enclosedAreas;
    final List<String> materialCategory;
    final List<String> materials;
    final List<String> colors;
    final Set<Novelty> novelty;
    final Vec3 closedDimensions;     // puede ser null
    final Vec3 closedOffset;         // puede ser null
    final Pose sideways;             // variante de costado, puede ser null
    final Pose notSideways;          // pose original cuando esta definición está de costado
    final List<Choice> materialChoices;
    final List<Choice> sizeChoices;
    final List<Choice> typeChoices;
    final String similarity;         // eje en que difiere un confusor (color/shape/size)

    private ObjectDefinition(Builder b) {
        this.type = Objects.requireNonNull(b.type, "type");
        this.shape = List.copyOf(b.shape);
        this.size = b.size;
        this.mass = b.mass;
        if (b.dimensions == null && b.sizeChoices.isEmpty()) {
            throw new IllegalArgumentException("Definición sin dimensiones: " + b.type);
        }
        this.dimensions = b.dimensions;
        this.offset = b.offset == null ? Vec3.ZERO : b.offset;
        this.positionY = b.positionY;
        this.rotation = b.rotation == null ? Vec3.ZERO : b.rotation;
        this.scale = b.scale == null ? Vec3.ONE : b.scale;
        this.attributes = b.attributes.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(b.attributes));
        this.enclosedAreas = List.copyOf(b.enclosedAreas);
        this.materialCategory = List.copyOf(b.materialCategory);
        this.materials = List.copyOf(b.materials);
        this.colors = List.copyOf(b.colors);
        this.novelty = b.novelty.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(b.novelty));
        this.closedDimensions = b.closedDimensions;
        this.closedOffset = b.closedOffset;
        this.sideways = b.sideways;
        this.notSideways = b.notSideways;
        this.materialChoices = List.copyOf(b.materialChoices);
        this.sizeChoices = List.copyOf(b.sizeChoices);
        this.typeChoices = List.copyOf(b.typeChoices);
        this.similarity = b.similarity;
    }

    public String type() { return type; }
    public List<String> shape() { return shape; }
    public String size() { return size; }
    public double mass() { return mass; }
    public Vec3 dimensions() { return dimensions; }
    public Vec3 offset() { return offset; }
    public double positionY() { return positionY; }
    public Vec3 rotation() { return rotation; }
    public Vec3 scale() { return scale; }
    public List<EnclosedArea> enclosedAreas() { return enclosedAreas; }
    public List<String> materials() { return materials; }
    public List<String> colors() { return colors; }
    public Set<Novelty> novelty() { return novelty; }
    public String similarity() { return similarity; }

    public boolean has(Attribute a) { return attributes.contains(a); }

    public boolean isPickupable() { return has(Attribute.PICKUPABLE); }

    public boolean isUntrained() { return !novelty.isEmpty(); }

    // no quedan elecciones por resolver
    public boolean isFinalized() {
        return materialChoices.isEmpty() && sizeChoices.isEmpty() && typeChoices.isEmpty();
    }

    // dimensiones/offset usados al ubicar: las "cerradas" ganan si existen
    Vec3 placementDimensions() { return closedDimensions != null ? closedDimensions : dimensions; }
    Vec3 placementOffset() { return closedOffset != null ? closedOffset : offset; }

    // rectángulo que ocupa al ubicarlo en esa posición y rotación
    BoundsRect placementBounds(Vec3 position, double rotationY) {
        return GeomUtils.objectBounds(placementDimensions(), placementOffset(), position, rotationY);
    }

    String lastShape() { return shape.isEmpty() ? type : shape.get(shape.size() - 1); }

    // copia con las propiedades de costado; null si no tiene variante
    ObjectDefinition turnedSideways() {
        if (sideways == null) return null;
        Builder b = toBuilder();
        b.notSideways = new Pose(dimensions, offset, positionY, rotation);
        b.dimensions = sideways.dimensions;
        b.offset = sideways.offset;
        b.positionY = sideways.positionY;
        b.rotation = sideways.rotation;
        b.sideways = null;
        return b.build();
    }

    // deshace turnedSideways (se usa para ubicar al lado del contenedor)
    ObjectDefinition reverted() {
        if (notSideways == null) return this;
        Builder b = toBuilder();
        b.dimensions = notSideways.dimensions;
        b.offset = notSideways.offset;
        b.positionY = notSideways.positionY;
        b.rotation = notSideways.rotation;
        b.notSideways = null;
        return b.build();
    }

    ObjectDefinition withRotationY(double rotationY) {
        Builder b = toBuilder();
        b.rotation = rotation.withY(rotationY);
        return b.build();
    }

    // "pequeño rojo pelota", usado en la descripción de la meta
    String goalString() {
        StringBuilder sb = new StringBuilder();
        if (size != null && !size.isEmpty()) sb.append(size).append(' ');
        for (String c : colors) sb.append(c).append(' ');
        sb.append(shape.isEmpty() ? type : String.join(" ", shape));
        return sb.toString();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.type = type;
        b.shape = shape;
        b.size = size;
        b.mass = mass;
        b.dimensions = dimensions;
        b.offset = offset;
        b.positionY = positionY;
        b.rotation = rotation;
        b.scale = scale;
        b.attributes.addAll(attributes);
        b.enclosedAreas = enclosedAreas;
        b.materialCategory = materialCategory;
        b.materials = materials;
        b.colors = colors;
        b.novelty.addAll(novelty);
        b.closedDimensions = closedDimensions;
        b.closedOffset = closedOffset;
        b.sideways = sideways;
        b.notSideways = notSideways;
        b.materialChoices = materialChoices;
        b.sizeChoices = sizeChoices;
        b.typeChoices = typeChoices;
        b.similarity = similarity;
        return b;
    }

    @Override public String toString() {
        return "ObjectDefinition[" + type + (size != null ? " " + size : "") + " dim=" + dimensions
                + (materials.isEmpty() ? "" : " materials=" + materials) + "]";
    }

    /* Campos mutables para armar una definición. */
    public static final class Builder {
        String type;
        List<String> shape = List.of();
        String size;
        double mass = 1.0;
        Vec3 dimensions;
        Vec3 offset = Vec3.ZERO;
        double positionY;
        Vec3 rotation = Vec3.ZERO;
        Vec3 scale = Vec3.ONE;
        final Set<Attribute> attributes = EnumSet.noneOf(Attribute.class);
        List<EnclosedArea> enclosedAreas = List.of();
        List<String> materialCategory = List.of();
        List<String> materials = List.of();
        List<String> colors = List.of();
        final Set<Novelty> novelty = EnumSet.noneOf(Novelty.class);
        Vec3 closedDimensions;
        Vec3 closedOffset;
        Pose sideways;
        Pose notSideways;
        List<Choice> materialChoices = List.of();
        List<Choice> sizeChoices = List.of();
        List<Choice> typeChoices = List.of();
        String similarity;

        public Builder type(String v) { type = v; return this; }
        public Builder shape(String... v) { shape = List.of(v); return this; }
        public Builder size(String v) { size = v; return this; }
        public Builder mass(double v) { mass = v; return this; }
        public Builder dimensions(double x, double y, double z) { dimensions = new Vec3(x, y, z); return this; }
        public Builder offset(double x, double y, double z) { offset = new Vec3(x, y, z); return this; }
        public Builder positionY(double v) { positionY = v; return this; }
        public Builder attributes(Attribute... v) { attributes.addAll(Arrays.asList(v)); return this; }
        public Builder enclosedAreas(EnclosedArea... v) { enclosedAreas = List.of(v); return this; }
        public Builder materials(Material... v) {
            List<String> ids = new ArrayList<>();
            List<String> cols = new ArrayList<>();
            for (Material m : v) {
                ids.add(m.id);
                for (String c : m.colors) if (!cols.contains(c)) cols.add(c);
            }
            materials = ids;
            colors = cols;
            return this;
        }

        public ObjectDefinition build() {
            return new ObjectDefinition(this);
        }
    }
}
