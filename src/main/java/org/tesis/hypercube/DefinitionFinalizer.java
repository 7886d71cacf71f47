package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/*
 * Resuelve los puntos de elección de una definición (variante, material, tamaño)
 * y expande las combinaciones de materiales del catálogo.
 * Nunca modifica la definición recibida: siempre devuelve copias.
 */
public final class DefinitionFinalizer {

    private DefinitionFinalizer() {}

    // elige al azar cada elección pendiente; la variante (type) se resuelve primero
    public static ObjectDefinition finalizeDefinition(ObjectDefinition def, Random rnd) {
        Choice type = def.typeChoices.isEmpty() ? null : def.typeChoices.get(rnd.nextInt(def.typeChoices.size()));
        Choice material = def.materialChoices.isEmpty() ? null : def.materialChoices.get(rnd.nextInt(def.materialChoices.size()));
        Choice size = def.sizeChoices.isEmpty() ? null : def.sizeChoices.get(rnd.nextInt(def.sizeChoices.size()));
        return finalizeDefinition(def, material, size, type);
    }

    // aplica las elecciones dadas (null = la definición no tiene esa elección)
    public static ObjectDefinition finalizeDefinition(ObjectDefinition def, Choice material, Choice size, Choice type) {
        ObjectDefinition.Builder b = def.toBuilder();
        if (type != null) {
            type.applyTo(b);
            b.typeChoices = List.of();
        }
        if (material != null) {
            material.applyTo(b);
            b.materialChoices = List.of();
        }
        if (size != null) {
            size.applyTo(b);
            b.sizeChoices = List.of();
        }
        return b.build();
    }

    /*
     * Producto cartesiano material x tamaño x variante de todas las elecciones,
     * cada combinación ya resuelta. Sin elecciones devuelve una sola copia.
     */
    public static List<ObjectDefinition> eachChoice(ObjectDefinition def, Random rnd) {
        List<Choice[]> combos = new ArrayList<>();
        combos.add(new Choice[3]);
        combos = expand(combos, def.materialChoices, 0);
        combos = expand(combos, def.sizeChoices, 1);
        combos = expand(combos, def.typeChoices, 2);

        List<ObjectDefinition> out = new ArrayList<>(combos.size());
        for (Choice[] c : combos) out.add(finalizeDefinition(def, c[0], c[1], c[2]));
        if (out.size() > 1) Collections.shuffle(out, rnd);
        return out;
    }

    private static List<Choice[]> expand(List<Choice[]> previous, List<Choice> choices, int slot) {
        if (choices.isEmpty()) return previous;
        List<Choice[]> next = new ArrayList<>(previous.size() * choices.size());
        for (Choice choice : choices) {
            for (Choice[] p : previous) {
                Choice[] c = p.clone();
                c[slot] = choice;
                next.add(c);
            }
        }
        return next;
    }

    /*
     * Una copia por cada material de la primera categoría, con el mismo material en
     * todas las ranuras. Sin categorías devuelve la definición con sus propios colores.
     */
    public static List<ObjectDefinition> materialVariants(ObjectDefinition def, Catalog catalog, Random rnd) {
        if (def.materialCategory.isEmpty()) return List.of(def);

        List<Material> options = catalog.materials(def.materialCategory.get(0));
        if (options.isEmpty()) {
            throw new IllegalStateException("Categoría de material sin materiales: " + def.materialCategory.get(0));
        }
        int slots = def.materialCategory.size();
        List<ObjectDefinition> out = new ArrayList<>(options.size());
        for (Material m : options) {
            ObjectDefinition.Builder b = def.toBuilder();
            b.materials = Collections.nCopies(slots, m.id);
            b.colors = m.colors;
            out.add(b.build());
        }
        Collections.shuffle(out, rnd);
        return out;
    }

    // finaliza una definición y le elige un material al azar
    public static ObjectDefinition finalizeWithMaterials(ObjectDefinition def, Catalog catalog, Random rnd) {
        List<ObjectDefinition> variants = materialVariants(finalizeDefinition(def, rnd), catalog, rnd);
        return variants.get(rnd.nextInt(variants.size()));
    }

    /*
     * grupos -> selecciones -> variantes de material. Cada definición del grupo se
     * expande en todas sus elecciones y cada elección en todos sus materiales.
     */
    public static List<List<List<ObjectDefinition>>> completeList(List<List<ObjectDefinition>> groups,
                                                                 Catalog catalog, Random rnd) {
        List<List<List<ObjectDefinition>>> out = new ArrayList<>(groups.size());
        for (List<ObjectDefinition> selections : groups) {
            List<List<ObjectDefinition>> outSelections = new ArrayList<>();
            for (ObjectDefinition def : selections) {
                for (ObjectDefinition chosen : eachChoice(def, rnd)) {
                    outSelections.add(materialVariants(chosen, catalog, rnd));
                }
            }
            Collections.shuffle(outSelections, rnd);
            out.add(outSelections);
        }
        Collections.shuffle(out, rnd);
        return out;
    }
}
