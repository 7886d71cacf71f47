package org.tesis.hypercube;

import java.util.Locale;

public enum Role {
    TARGET, CONFUSOR, CONTAINER, OBSTACLE, OCCLUDER, CONTEXT;

    public String label() { return name().toLowerCase(Locale.ROOT); }
}
