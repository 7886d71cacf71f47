package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

/*
 * Colección inmutable de definiciones finalizadas en tres niveles:
 * grupo -> selección -> variantes de material.
 */
public final class DefinitionDataset {
    private final List<List<List<ObjectDefinition>>> groups;

    DefinitionDataset(List<List<List<ObjectDefinition>>> groups) {
        List<List<List<ObjectDefinition>>> copy = new ArrayList<>(groups.size());
        for (List<List<ObjectDefinition>> selections : groups) {
            List<List<ObjectDefinition>> s = new ArrayList<>(selections.size());
            for (List<ObjectDefinition> variants : selections) s.add(List.copyOf(variants));
            copy.add(List.copyOf(s));
        }
        this.groups = List.copyOf(copy);
    }

    // expande la lista del catálogo en todas sus elecciones y materiales
    public static DefinitionDataset create(Catalog catalog, Catalog.DefinitionList list, Random rnd) {
        return new DefinitionDataset(DefinitionFinalizer.completeList(catalog.definitions(list), catalog, rnd));
    }

    public List<List<List<ObjectDefinition>>> groups() { return groups; }

    public boolean isEmpty() { return groups.isEmpty(); }

    public int size() {
        int n = 0;
        for (List<List<ObjectDefinition>> selections : groups) {
            for (List<ObjectDefinition> variants : selections) n += variants.size();
        }
        return n;
    }

    // todas las definiciones, mezcladas
    public List<ObjectDefinition> definitions(Random rnd) {
        List<ObjectDefinition> out = new ArrayList<>(size());
        for (List<List<ObjectDefinition>> selections : groups) {
            for (List<ObjectDefinition> variants : selections) out.addAll(variants);
        }
        Collections.shuffle(out, rnd);
        return out;
    }

    // grupo al azar, selección al azar, variante al azar
    public ObjectDefinition chooseRandom(Random rnd) {
        if (groups.isEmpty()) throw new IllegalStateException("Dataset vacío");
        List<List<ObjectDefinition>> selections = groups.get(rnd.nextInt(groups.size()));
        List<ObjectDefinition> variants = selections.get(rnd.nextInt(selections.size()));
        return variants.get(rnd.nextInt(variants.size()));
    }

    // copia filtrada; se descartan las selecciones y grupos que quedan vacíos
    public DefinitionDataset filter(Predicate<ObjectDefinition> keep) {
        List<List<List<ObjectDefinition>>> out = new ArrayList<>();
        for (List<List<ObjectDefinition>> selections : groups) {
            List<List<ObjectDefinition>> outSelections = new ArrayList<>();
            for (List<ObjectDefinition> variants : selections) {
                List<ObjectDefinition> kept = variants.stream().filter(keep).toList();
                if (!kept.isEmpty()) outSelections.add(kept);
            }
            if (!outSelections.isEmpty()) out.add(outSelections);
        }
        return new DefinitionDataset(out);
    }

    public DefinitionDataset filterOnTrained() {
        return filter(d -> d.novelty.isEmpty());
    }

    // solo las definiciones marcadas con esa novedad y ninguna otra
    public DefinitionDataset filterOnUntrained(Novelty novelty) {
        Set<Novelty> only = EnumSet.of(novelty);
        return filter(d -> d.novelty.equals(only));
    }

    public DefinitionDataset filterOnTypeNot(Set<String> types) {
        return filter(d -> !types.contains(d.type));
    }

    @Override public String toString() {
        return "DefinitionDataset[groups=" + groups.size() + ", size=" + size() + "]";
    }
}
