package org.tesis.hypercube;

/* Política de ubicación de un rol en una escena. */
public enum LocationPlan {
    BACK, BETWEEN, CLOSE, FAR, FRONT, INSIDE, NONE, RANDOM
}
