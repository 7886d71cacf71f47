package org.tesis.hypercube;

import java.util.Locale;

public enum Attribute {
    MOVEABLE, PICKUPABLE, RECEPTACLE, OPENABLE, OCCLUDER, OBSTACLE, STACKABLE;

    static Attribute parse(String s) {
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
