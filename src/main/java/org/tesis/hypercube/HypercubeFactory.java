package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Supplier;

/*
 * Arma hipercubos de una familia de planes. Cada hipercubo se reintenta desde cero
 * (sala nueva, orquestador nuevo) hasta MAX_BUILD_TRIES veces.
 */
public class HypercubeFactory {

    // ===================== Parámetros de la fábrica =====================
    static final int MAX_BUILD_TRIES = 100;

    private final String name;
    private final Function<Catalog, List<ScenePlan>> family;
    private final boolean training;
    private final Catalog catalog;
    private final Random rnd;
    private final SceneLog log;

    public HypercubeFactory(String name, Function<Catalog, List<ScenePlan>> family, boolean training,
                            Catalog catalog, Random rnd, SceneLog log) {
        this.name = name;
        this.family = family;
        this.training = training;
        this.catalog = catalog;
        this.rnd = rnd;
        this.log = log;
    }

    // familias conocidas por nombre
    public static HypercubeFactory named(String family, boolean training, Catalog catalog, Random rnd, SceneLog log) {
        String n = family.toLowerCase(Locale.ROOT);
        if (n.equals("container")) return new HypercubeFactory("container", ScenePlans::container, training, catalog, rnd, log);
        if (n.equals("eval4container")) return new HypercubeFactory("eval 4 container", ScenePlans::eval4Container, training, catalog, rnd, log);
        if (n.equals("obstacle")) return new HypercubeFactory("obstacle", ScenePlans::obstacle, training, catalog, rnd, log);
        if (n.equals("occluder")) return new HypercubeFactory("occluder", ScenePlans::occluder, training, catalog, rnd, log);
        if (n.equals("single")) return new HypercubeFactory("single", ScenePlans::single, training, catalog, rnd, log);
        throw new IllegalArgumentException("Familia de hipercubos desconocida: " + family);
    }

    public String name() { return name; }

    /*
     * Devuelve "total" hipercubos confirmados. Un hipercubo fallido se vuelve a armar;
     * la falla se relanza si throwError o si se agotaron los intentos.
     * En modo entrenamiento solo quedan las escenas que no son de evaluación.
     */
    public List<HypercubeResult> build(int total, Supplier<RoomTemplate> rooms, boolean throwError) {
        List<HypercubeResult> hypercubes = new ArrayList<>();
        for (int count = 1; count <= total; count++) {
            log.logf("Generando hipercubo %s %d / %d", name, count, total);
            for (int tries = 1; tries <= MAX_BUILD_TRIES; tries++) {
                try {
                    HypercubeOrchestrator orchestrator = new HypercubeOrchestrator(name, family.apply(catalog),
                            catalog, rooms.get(), rnd, log);
                    List<Scene> scenes = orchestrator.generate().scenesOrThrow();
                    hypercubes.add(HypercubeResult.committed(training ? trainingScenes(scenes) : scenes));
                    break;
                } catch (SceneException | IllegalArgumentException | IllegalStateException e) {
                    log.error("Falla al crear el hipercubo " + name + " (intento " + tries + ")", e);
                    if (throwError || tries >= MAX_BUILD_TRIES) throw e;
                }
            }
        }
        return hypercubes;
    }

    private List<Scene> trainingScenes(List<Scene> scenes) {
        List<Scene> out = new ArrayList<>();
        for (Scene s : scenes) {
            if (!s.isEvaluationOnly()) out.add(s);
        }
        log.logf("%s: %d escenas de entrenamiento de %d", name, out.size(), scenes.size());
        return out;
    }
}
