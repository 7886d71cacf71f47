package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Familias de planes predefinidas. Cada letra es una celda del hipercubo y cada celda
 * tiene dos escenas: "1" con todo entrenado y "2" con la variante no entrenada del rol
 * que se estudia. Las listas salen ordenadas por id.
 */
public final class ScenePlans {

    private ScenePlans() {}

    // ===================== Tags de slice =====================
    public static final String CONTAINERS_LARGE   = "largeContainers";
    public static final String CONTAINERS_SMALL   = "smallContainers";
    public static final String CONTAINERS_TRAINED = "containersTrained";
    public static final String OBSTACLE_BETWEEN   = "obstacleBetween";
    public static final String OBSTACLE_TRAINED   = "obstacleTrained";
    public static final String OCCLUDERS          = "occluders";
    public static final String OCCLUDERS_TRAINED  = "occludersTrained";
    public static final String TARGET_BEHIND      = "targetBehind";
    public static final String TARGET_HIDDEN      = "targetHidden";
    public static final String TARGET_INSIDE      = "targetInside";

    static final String ZERO = "zero", ONE = "one", TWO = "two", THREE = "three";
    static final String YES = "yes", NO = "no";

    static final String TARGET_TYPE = "soccer_ball";

    // ------------- contenedores -------------

    // 18 celdas: objetivo adentro del primer contenedor (o cerca), 0-2 contenedores grandes
    // extra y 0-2 chicos; las escenas "2" usan contenedores no entrenados
    public static List<ScenePlan> container(Catalog catalog) {
        return containerFamily(catalog, "abcdefghijklmnopqr", "defjklpqr", "abcdefghijkl", "abcdef",
                "bcefhiknoqr", "cfilor", true);
    }

    // variante reducida de la familia de contenedores (sin contenedores chicos)
    public static List<ScenePlan> eval4Container(Catalog catalog) {
        return containerFamily(catalog, "adgjmp", "djp", "adgj", "ad", "", "", false);
    }

    private static List<ScenePlan> containerFamily(Catalog catalog, String cells, String targetClose,
                                                   String secondLarge, String thirdLarge,
                                                   String firstSmall, String secondSmall, boolean withSmall) {
        ObjectDefinition target = catalog.definition(TARGET_TYPE);
        Map<String, Draft> drafts = new LinkedHashMap<>();

        for (char i : cells.toCharArray()) {
            for (char j : new char[]{ '1', '2' }) {
                Draft d = new Draft("" + i + j, LocationPlan.INSIDE, target);
                d.large = slots(LocationPlan.RANDOM, LocationPlan.NONE, LocationPlan.NONE);
                if (withSmall) d.small = slots(LocationPlan.NONE, LocationPlan.NONE);
                d.tags.put(CONTAINERS_LARGE, ONE);
                d.tags.put(CONTAINERS_SMALL, ZERO);
                d.tags.put(CONTAINERS_TRAINED, YES);
                d.tags.put(TARGET_INSIDE, YES);
                drafts.put(d.id, d);
            }
        }

        for (Draft d : drafts.values()) {
            char cell = d.id.charAt(0);
            // objetivo cerca del contenedor, no adentro
            if (targetClose.indexOf(cell) >= 0) {
                d.target = LocationPlan.CLOSE;
                d.tags.put(TARGET_INSIDE, NO);
            }
            if (secondLarge.indexOf(cell) >= 0) {
                d.large[1].location = LocationPlan.RANDOM;
                if (thirdLarge.indexOf(cell) >= 0) {
                    d.large[2].location = LocationPlan.RANDOM;
                    d.tags.put(CONTAINERS_LARGE, THREE);
                } else {
                    d.tags.put(CONTAINERS_LARGE, TWO);
                }
            }
            if (firstSmall.indexOf(cell) >= 0) {
                d.small[0].location = LocationPlan.RANDOM;
                if (secondSmall.indexOf(cell) >= 0) {
                    d.small[1].location = LocationPlan.RANDOM;
                    d.tags.put(CONTAINERS_SMALL, TWO);
                } else {
                    d.tags.put(CONTAINERS_SMALL, ONE);
                }
            }
            if (d.id.charAt(1) == '2') {
                for (Slot s : d.large) s.untrained = true;
                for (Slot s : d.small) s.untrained = true;
                d.tags.put(CONTAINERS_TRAINED, NO);
            }
        }
        return build(drafts);
    }

    // ------------- obstáculos -------------

    // objetivo detrás del performer (o delante en c/d) con un obstáculo entre ambos (o detrás en b/d)
    public static List<ScenePlan> obstacle(Catalog catalog) {
        ObjectDefinition target = catalog.definition(TARGET_TYPE);
        Map<String, Draft> drafts = new LinkedHashMap<>();

        for (char i : "abcd".toCharArray()) {
            for (char j : new char[]{ '1', '2' }) {
                Draft d = new Draft("" + i + j, LocationPlan.BACK, target);
                d.obstacles = slots(LocationPlan.BETWEEN);
                d.tags.put(OBSTACLE_BETWEEN, YES);
                d.tags.put(OBSTACLE_TRAINED, YES);
                d.tags.put(TARGET_BEHIND, YES);
                if (i == 'c' || i == 'd') {
                    d.target = LocationPlan.FRONT;
                    d.tags.put(TARGET_BEHIND, NO);
                }
                if (i == 'b' || i == 'd') {
                    d.obstacles[0].location = LocationPlan.CLOSE;
                    d.tags.put(OBSTACLE_BETWEEN, NO);
                }
                if (j == '2') {
                    d.obstacles[0].untrained = true;
                    d.tags.put(OBSTACLE_TRAINED, NO);
                }
                drafts.put(d.id, d);
            }
        }
        return build(drafts);
    }

    // ------------- oclusores -------------

    // como obstáculos pero con un oclusor principal y hasta dos oclusores extra al azar
    public static List<ScenePlan> occluder(Catalog catalog) {
        ObjectDefinition target = catalog.definition(TARGET_TYPE);
        Map<String, Draft> drafts = new LinkedHashMap<>();

        for (char i : "abcdefghijkl".toCharArray()) {
            for (char j : new char[]{ '1', '2' }) {
                Draft d = new Draft("" + i + j, LocationPlan.BACK, target);
                d.occluders = slots(LocationPlan.BETWEEN, LocationPlan.NONE, LocationPlan.NONE);
                d.tags.put(OCCLUDERS, ONE);
                d.tags.put(OCCLUDERS_TRAINED, YES);
                d.tags.put(TARGET_BEHIND, YES);
                d.tags.put(TARGET_HIDDEN, YES);

                if ("cdghkl".indexOf(i) >= 0) {
                    d.target = LocationPlan.FRONT;
                    d.tags.put(TARGET_BEHIND, NO);
                }
                if ("bdfhjl".indexOf(i) >= 0) {
                    d.occluders[0].location = LocationPlan.CLOSE;
                    d.tags.put(TARGET_HIDDEN, NO);
                }
                if ("abcdefgh".indexOf(i) >= 0) {
                    d.occluders[1].location = LocationPlan.RANDOM;
                    if ("abcd".indexOf(i) >= 0) {
                        d.occluders[2].location = LocationPlan.RANDOM;
                        d.tags.put(OCCLUDERS, THREE);
                    } else {
                        d.tags.put(OCCLUDERS, TWO);
                    }
                }
                if (j == '2') {
                    for (Slot s : d.occluders) s.untrained = true;
                    d.tags.put(OCCLUDERS_TRAINED, NO);
                }
                drafts.put(d.id, d);
            }
        }
        return build(drafts);
    }

    // ------------- escena única -------------

    // una sola escena: el objetivo en cualquier lugar
    public static List<ScenePlan> single(Catalog catalog) {
        return List.of(ScenePlan.builder("a1")
                .target(ObjectPlan.of(LocationPlan.RANDOM, catalog.definition(TARGET_TYPE)))
                .build());
    }

    // ======= Borradores =======

    private static final class Slot {
        LocationPlan location;
        boolean untrained;

        Slot(LocationPlan location) { this.location = location; }

        ObjectPlan toPlan() { return new ObjectPlan(location, untrained, null); }
    }

    private static Slot[] slots(LocationPlan... locations) {
        return Arrays.stream(locations).map(Slot::new).toArray(Slot[]::new);
    }

    private static final class Draft {
        final String id;
        final ObjectDefinition targetDefinition;
        LocationPlan target;
        Slot[] large = new Slot[0];
        Slot[] small = new Slot[0];
        Slot[] obstacles = new Slot[0];
        Slot[] occluders = new Slot[0];
        final Map<String, String> tags = new LinkedHashMap<>();

        Draft(String id, LocationPlan target, ObjectDefinition targetDefinition) {
            this.id = id;
            this.target = target;
            this.targetDefinition = targetDefinition;
        }

        ScenePlan toPlan() {
            ScenePlan.Builder b = ScenePlan.builder(id)
                    .target(ObjectPlan.of(target, targetDefinition));
            for (Slot s : large) b.largeContainer(s.toPlan());
            for (Slot s : small) b.smallContainer(s.toPlan());
            for (Slot s : obstacles) b.obstacle(s.toPlan());
            for (Slot s : occluders) b.occluder(s.toPlan());
            tags.forEach(b::tag);
            return b.build();
        }
    }

    private static List<ScenePlan> build(Map<String, Draft> drafts) {
        List<ScenePlan> plans = new ArrayList<>();
        drafts.keySet().stream().sorted().forEach(id -> plans.add(drafts.get(id).toPlan()));
        return plans;
    }
}
