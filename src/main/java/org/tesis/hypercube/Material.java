package org.tesis.hypercube;

import java.util.List;

/* Par (material, colores) del catálogo. */
public final class Material {
    final String id;
    final List<String> colors;

    public Material(String id, List<String> colors) {
        this.id = id;
        this.colors = List.copyOf(colors);
    }

    public String id() { return id; }
    public List<String> colors() { return colors; }

    @Override public String toString() {
        return id + colors;
    }
}
