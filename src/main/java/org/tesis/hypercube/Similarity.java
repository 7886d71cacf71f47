package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/*
 * Reglas de "parecido salvo en ..." entre dos definiciones finalizadas.
 * Un confusor se parece al objetivo en dos de tres ejes: color, forma, tamaño.
 */
public final class Similarity {

    // ===================== Parámetros =====================
    static final double MAX_SIZE_DIFFERENCE = 0.05;   // por eje (x, y, z)
    static final String[] TYPE_PREFIXES = { "apple", "crayon" };

    public static final String COLOR = "color";
    public static final String SHAPE = "shape";
    public static final String SIZE  = "size";

    private Similarity() {}

    // mismo tipo y tamaño, distinto color
    public static boolean exceptInColor(ObjectDefinition a, ObjectDefinition b) {
        return a != b
                && baseType(a).equals(baseType(b))
                && !materialsMatch(a, b)
                && sameSize(a, b);
    }

    // mismo color y tamaño, distinto tipo
    public static boolean exceptInShape(ObjectDefinition a, ObjectDefinition b) {
        return a != b
                && !baseType(a).equals(baseType(b))
                && materialsMatch(a, b)
                && sameSize(a, b);
    }

    // mismo tipo y color, distinto tamaño en algún eje
    public static boolean exceptInSize(ObjectDefinition a, ObjectDefinition b) {
        return a != b
                && baseType(a).equals(baseType(b))
                && materialsMatch(a, b)
                && !sameSize(a, b);
    }

    /*
     * Primera definición del dataset parecida al objetivo en algún eje, probando los
     * ejes en orden aleatorio. La devuelta lleva anotado el eje en que difiere; null si no hay.
     */
    public static ObjectDefinition similarDefinition(ObjectDefinition target, DefinitionDataset dataset, Random rnd) {
        List<String> axes = new ArrayList<>(List.of(COLOR, SIZE, SHAPE));
        Collections.shuffle(axes, rnd);
        List<ObjectDefinition> candidates = dataset.definitions(rnd);
        for (String axis : axes) {
            for (ObjectDefinition d : candidates) {
                if (matches(axis, target, d)) {
                    ObjectDefinition.Builder b = d.toBuilder();
                    b.similarity = axis;
                    return b.build();
                }
            }
        }
        return null;
    }

    static boolean matches(String axis, ObjectDefinition target, ObjectDefinition d) {
        if (COLOR.equals(axis)) return exceptInColor(target, d);
        if (SHAPE.equals(axis)) return exceptInShape(target, d);
        if (SIZE.equals(axis)) return exceptInSize(target, d);
        throw new IllegalArgumentException("Eje de parecido desconocido: " + axis);
    }

    /*
     * Con materiales en ambos se comparan las listas; si alguno no tiene,
     * alcanza con que compartan algún color.
     */
    static boolean materialsMatch(ObjectDefinition a, ObjectDefinition b) {
        if (!a.materials.isEmpty() && !b.materials.isEmpty()) return a.materials.equals(b.materials);
        Set<String> common = new HashSet<>(a.colors);
        common.retainAll(b.colors);
        return !common.isEmpty();
    }

    static boolean sameSize(ObjectDefinition a, ObjectDefinition b) {
        return within(a.dimensions.x, b.dimensions.x)
                && within(a.dimensions.y, b.dimensions.y)
                && within(a.dimensions.z, b.dimensions.z);
    }

    private static boolean within(double s1, double s2) {
        return s1 + MAX_SIZE_DIFFERENCE >= s2 && s1 - MAX_SIZE_DIFFERENCE <= s2;
    }

    // "apple_1" y "apple_2" cuentan como el mismo tipo
    static String baseType(ObjectDefinition d) {
        for (String prefix : TYPE_PREFIXES) {
            if (d.type.startsWith(prefix)) return prefix;
        }
        return d.type;
    }
}
