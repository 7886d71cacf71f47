package org.tesis.hypercube;

import java.util.List;

/* Resultado final de un hipercubo: todas sus escenas o la causa de la falla. Nunca parcial. */
public final class HypercubeResult {

    private final List<Scene> scenes;
    private final SceneException cause;

    private HypercubeResult(List<Scene> scenes, SceneException cause) {
        this.scenes = scenes;
        this.cause = cause;
    }

    static HypercubeResult committed(List<Scene> scenes) {
        return new HypercubeResult(List.copyOf(scenes), null);
    }

    static HypercubeResult failed(SceneException cause) {
        return new HypercubeResult(List.of(), cause);
    }

    public boolean isCommitted() { return cause == null; }

    public List<Scene> scenes() { return scenes; }

    public SceneException cause() { return cause; }

    // escenas o la excepción de la falla
    public List<Scene> scenesOrThrow() {
        if (cause != null) throw cause;
        return scenes;
    }

    @Override public String toString() {
        return isCommitted() ? "Committed[" + scenes.size() + " escenas]" : "Failed[" + cause.getMessage() + "]";
    }
}
