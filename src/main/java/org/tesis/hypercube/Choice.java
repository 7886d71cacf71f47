package org.tesis.hypercube;

import java.util.List;
import java.util.Set;

/*
 * Punto de elección de una definición (material, tamaño o variante).
 * Los campos nulos no se sobreescriben al resolver la elección.
 */
public final class Choice {

    public enum Kind { MATERIAL, SIZE, TYPE }

    final Kind kind;
    String type;
    List<String> shape;
    String size;
    Double mass;
    Vec3 dimensions;
    Vec3 offset;
    Double positionY;
    Vec3 scale;
    Vec3 closedDimensions;
    Vec3 closedOffset;
    List<String> materialCategory;
    List<EnclosedArea> enclosedAreas;
    Set<Novelty> novelty;

    public Choice(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    // aplica los campos presentes sobre el builder
    void applyTo(ObjectDefinition.Builder b) {
        if (type != null) b.type = type;
        if (shape != null) b.shape = shape;
        if (size != null) b.size = size;
        if (mass != null) b.mass = mass;
        if (dimensions != null) b.dimensions = dimensions;
        if (offset != null) b.offset = offset;
        if (positionY != null) b.positionY = positionY;
        if (scale != null) b.scale = scale;
        if (closedDimensions != null) b.closedDimensions = closedDimensions;
        if (closedOffset != null) b.closedOffset = closedOffset;
        if (materialCategory != null) b.materialCategory = materialCategory;
        if (enclosedAreas != null) b.enclosedAreas = enclosedAreas;
        if (novelty != null) b.novelty.addAll(novelty);
    }

    @Override public String toString() {
        return "Choice[" + kind + (type != null ? " type=" + type : "") + (size != null ? " size=" + size : "") + "]";
    }
}
