package org.tesis.hypercube;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Catálogo inmutable de definiciones (listas anidadas por grupo) y materiales.
 * Se carga una vez y se pasa por referencia al generador.
 */
public final class Catalog {

    public enum DefinitionList {
        ALL, CONTAINERS, OBSTACLES, OCCLUDERS, PICKUPABLES;

        static DefinitionList parse(String s) {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        }
    }

    static final String FLOOR = "FLOOR";
    static final String WALL  = "WALL";

    private static Catalog defaultCatalog;

    private final Map<String, ObjectDefinition> definitions;
    private final Map<DefinitionList, List<List<ObjectDefinition>>> lists;
    private final Map<String, List<Material>> materials;

    Catalog(Map<String, ObjectDefinition> definitions,
            Map<DefinitionList, List<List<ObjectDefinition>>> lists,
            Map<String, List<Material>> materials) {
        this.definitions = Map.copyOf(definitions);
        this.lists = Map.copyOf(lists);
        this.materials = Map.copyOf(materials);
    }

    // catálogo del classpath, leído una sola vez
    public static synchronized Catalog getDefault() {
        if (defaultCatalog == null) {
            try {
                defaultCatalog = CatalogCsvReader.readDefault();
            } catch (IOException e) {
                throw new UncheckedIOException("No se pudo leer el catálogo por defecto", e);
            }
        }
        return defaultCatalog;
    }

    public List<List<ObjectDefinition>> definitions(DefinitionList list) {
        return lists.getOrDefault(list, List.of());
    }

    public ObjectDefinition definition(String id) {
        ObjectDefinition d = definitions.get(id);
        if (d == null) throw new IllegalArgumentException("Definición inexistente: " + id);
        return d;
    }

    public List<Material> materials(String category) {
        return materials.getOrDefault(category.toUpperCase(Locale.ROOT), List.of());
    }

    public List<Material> floorMaterials() { return materials(FLOOR); }
    public List<Material> wallMaterials()  { return materials(WALL); }
}
