package org.tesis.hypercube;

import java.util.Locale;

/* Marcas de novedad (no entrenado) de una definición. */
public enum Novelty {
    CATEGORY, COLOR, COMBINATION, SHAPE, SIZE;

    static Novelty parse(String s) {
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
