package org.tesis.hypercube;

/*
 * Falla del generador de escenas. El tipo indica de dónde viene:
 * ubicación (se reintenta el intento completo), definición (no se reintenta)
 * o hipercubo (se agotaron los intentos).
 */
public class SceneException extends RuntimeException {

    public enum Kind { PLACEMENT, DEFINITION, HYPERCUBE }

    private final Kind kind;

    public SceneException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SceneException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    static SceneException placement(String message) {
        return new SceneException(Kind.PLACEMENT, message);
    }

    static SceneException definition(String message) {
        return new SceneException(Kind.DEFINITION, message);
    }
}
