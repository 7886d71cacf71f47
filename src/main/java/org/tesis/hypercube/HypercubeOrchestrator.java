package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.function.DoubleSupplier;

/*
 * Genera una familia de escenas enlazadas (hipercubo) a partir de sus planes.
 * Cada intento es un pipeline lineal sobre un PlacementContext:
 *   reset -> definiciones -> plantillas -> ubicaciones -> validación -> contexto -> escenas.
 * Una falla de ubicación descarta el intento entero; una falla de definición termina sin reintentar.
 */
public class HypercubeOrchestrator {

    // ===================== Parámetros del hipercubo =====================
    static final int      MAX_TRIES        = 50;       // intentos completos
    static final int[]    CONTEXT_COUNTS   = { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
    static final double[] CONTEXT_WEIGHTS  = { 5, 5, 10, 10, 12.5, 15, 12.5, 10, 10, 5, 5 };

    private final String name;
    private final List<ScenePlan> plans;
    private final Catalog catalog;
    private final RoomTemplate template;
    private final Random rnd;
    private final SceneLog log;
    private final DefinitionSelector selector;
    private final RetrievalGoal goal;
    private final PlacementContext ctx;

    public HypercubeOrchestrator(String name, List<ScenePlan> plans, Catalog catalog, RoomTemplate template,
                                 Random rnd, SceneLog log) {
        this.name = name;
        this.plans = List.copyOf(plans);
        this.catalog = catalog;
        this.template = template;
        this.rnd = rnd;
        this.log = log;
        this.selector = new DefinitionSelector(catalog, rnd, log);
        this.goal = new RetrievalGoal(selector.pickupables(), rnd);
        this.ctx = new PlacementContext(this.plans, template.room(), rnd, log);
        validatePlans();
    }

    public String name() { return name; }

    // ------------- validación de planes -------------

    // combinaciones de planes que el generador no sabe resolver
    private void validatePlans() {
        TargetData target = ctx.target;
        for (ScenePlan p : plans) {
            if (p.target.definition != target.originalDefinition) {
                throw SceneException.definition(name + ": el objetivo no puede cambiar de definición entre escenas");
            }
        }
        if (target.anyUntrained()) {
            throw SceneException.definition(name + ": el objetivo no puede usar una variante no entrenada");
        }
        if (target.uses(LocationPlan.BETWEEN)) {
            throw SceneException.definition(name + ": el objetivo no admite la ubicación BETWEEN");
        }
        if (target.uses(LocationPlan.FAR) && ctx.firstContainer() == null) {
            throw SceneException.definition(name + ": el objetivo FAR necesita un contenedor de referencia");
        }
        if ((target.isClose() || target.isInside()) && ctx.firstContainer() == null) {
            throw SceneException.definition(name + ": el objetivo CLOSE/INSIDE necesita un contenedor");
        }
        if (ctx.confusor != null && (ctx.confusor.uses(LocationPlan.BETWEEN) || ctx.confusor.isRandom())) {
            throw SceneException.definition(name + ": el confusor no admite las ubicaciones BETWEEN, RANDOM");
        }
        for (ReceptacleData c : ctx.containers()) {
            for (ObjectPlan p : c.plans) {
                if (p.location != LocationPlan.RANDOM && p.location != LocationPlan.NONE) {
                    throw SceneException.definition(name + ": los contenedores solo admiten RANDOM o NONE, no "
                            + p.location);
                }
            }
        }
        List<ReceptacleData> blockers = new ArrayList<>(ctx.obstacles);
        blockers.addAll(ctx.occluders);
        for (ReceptacleData b : blockers) {
            if (b.uses(LocationPlan.BACK) || b.uses(LocationPlan.FAR)
                    || b.uses(LocationPlan.FRONT) || b.uses(LocationPlan.INSIDE)) {
                throw SceneException.definition(name + ": obstáculos y oclusores no admiten BACK, FAR, FRONT, INSIDE");
            }
        }
    }

    // ------------- bucle de intentos -------------

    /*
     * Hasta MAX_TRIES intentos completos. Devuelve todas las escenas o la causa de la falla;
     * nunca un resultado parcial.
     */
    public HypercubeResult generate() {
        SceneException last = null;
        for (int tries = 1; tries <= MAX_TRIES; tries++) {
            log.debug(name + " intento " + tries);
            try {
                List<Scene> scenes = attempt();
                log.logf("%s listo en %d intento(s): %d escenas", name, tries, scenes.size());
                return HypercubeResult.committed(scenes);
            } catch (SceneException e) {
                if (e.kind() == SceneException.Kind.DEFINITION) {
                    log.error(name + " sin definiciones válidas", e);
                    return HypercubeResult.failed(e);
                }
                log.error(name + " intento " + tries + " fallido", e);
                last = e;
            }
        }
        return HypercubeResult.failed(new SceneException(SceneException.Kind.HYPERCUBE,
                name + ": no se pudieron ubicar los objetos tras " + MAX_TRIES + " intentos", last));
    }

    private List<Scene> attempt() {
        ctx.reset();
        chooseEachObjectDefinition();
        for (RoleData r : ctx.allRoles()) r.recreateTemplates(rnd);

        assignEachObjectLocation();
        for (int i = 0; i < ctx.sceneCount(); i++) {
            if (ctx.target.instanceIn(i) == null) {
                throw SceneException.placement(name + ": la escena " + plans.get(i).id
                        + " quedó sin objetivo (plan=" + ctx.target.planIn(i) + ")");
            }
        }
        logObjects();

        initializeContextObjects();
        for (ReceptacleData c : ctx.largeContainers) setCanContainTarget(c, true);
        for (ReceptacleData c : ctx.smallContainers) setCanContainTarget(c, false);

        List<Scene> scenes = createScenes();
        updateFloorAndWalls(scenes);
        return scenes;
    }

    // ------------- definiciones -------------

    private void chooseEachObjectDefinition() {
        selector.assignTarget(ctx.target, goal);
        selector.assignConfusor(ctx.confusor, ctx.target.trainedDefinition);

        for (int i = 0; i < ctx.largeContainers.size(); i++) {
            selector.assignContainer(ctx.largeContainers.get(i), ctx.target, ctx.confusor, false, i == 0);
        }
        for (ReceptacleData c : ctx.smallContainers) {
            selector.assignContainer(c, ctx.target, ctx.confusor, true, false);
        }

        ObjectDefinition larger = ctx.target.largerDefinitionOf(ctx.largeContainers, ctx.confusor);
        for (ReceptacleData o : ctx.obstacles) selector.assignBlocker(o, larger, false);
        for (ReceptacleData o : ctx.occluders) selector.assignBlocker(o, larger, true);
    }

    // ------------- ubicaciones -------------

    private void assignEachObjectLocation() {
        // la mayor definición entre objetivo, confusor y contenedor reserva lugar suficiente
        ObjectDefinition largerTarget = ctx.target.largerDefinitionOf(ctx.largeContainers, ctx.confusor);
        log.debug(name + " definición mayor de objetivo/confusor/contenedor: " + largerTarget);

        Map<LocationPlan, Location> anchors = assignTargetLocation(largerTarget);
        assignRelativeLocations(largerTarget, anchors);

        List<ReceptacleData> remaining = new ArrayList<>();
        if (ctx.largeContainers.size() > 1) remaining.addAll(ctx.largeContainers.subList(1, ctx.largeContainers.size()));
        remaining.addAll(ctx.smallContainers);
        for (ReceptacleData c : remaining) {
            if (!c.isRandom()) continue;
            Location location = goal.chooseLocation(ctx.search, c.largerDefinition(), c.definitions(),
                    ctx.performer, ctx.registry);
            log.debug(name + " contenedor al azar: " + location);
            ctx.register(c.assignLocation(location, LocationPlan.RANDOM, null));
        }

        assignInsideContainer();
    }

    /*
     * Frente/espalda primero (puede cambiar al performer), después el primer contenedor,
     * y el objetivo cerca, lejos o al azar. Devuelve la ubicación de referencia de cada
     * política del objetivo; INSIDE apunta a la ubicación del contenedor.
     */
    private Map<LocationPlan, Location> assignTargetLocation(ObjectDefinition largerTarget) {
        Map<LocationPlan, Location> anchors = new EnumMap<>(LocationPlan.class);
        TargetData target = ctx.target;

        List<RoleData> frontAndBack = new ArrayList<>();
        frontAndBack.add(target);
        if (ctx.confusor != null) frontAndBack.add(ctx.confusor);
        boolean needsFrontOrBack = false;
        for (RoleData r : frontAndBack) {
            needsFrontOrBack |= r.uses(LocationPlan.FRONT) || r.uses(LocationPlan.BACK);
        }
        if (needsFrontOrBack) {
            List<ObjectDefinition> variants = new ArrayList<>();
            for (RoleData r : frontAndBack) variants.addAll(r.definitions());
            Location[] frontBack = generateFrontAndBack(largerTarget, variants);
            for (RoleData r : frontAndBack) {
                ctx.register(r.assignLocation(frontBack[0], LocationPlan.FRONT, null));
                ctx.register(r.assignLocation(frontBack[1], LocationPlan.BACK, null));
            }
            anchors.put(LocationPlan.FRONT, frontBack[0]);
            anchors.put(LocationPlan.BACK, frontBack[1]);
        }
        // de acá en adelante el performer no cambia
        log.debug(name + " performer: " + ctx.performer);

        ReceptacleData container = ctx.firstContainer();
        Location containerLocation = null;
        if (container != null && container.isRandom()) {
            containerLocation = goal.chooseLocation(ctx.search, container.largerDefinition(), container.definitions(),
                    ctx.performer, ctx.registry);
            log.debug(name + " primer contenedor al azar: " + containerLocation);
            ctx.register(container.assignLocation(containerLocation, LocationPlan.RANDOM, null));
            anchors.put(LocationPlan.INSIDE, containerLocation);
        }

        // un objetivo "cerca" siempre está cerca de su contenedor, y parado
        if (target.isClose()) {
            requireAnchor(containerLocation, LocationPlan.CLOSE);
            ObjectDefinition upright = target.largerDefinition().reverted();
            Location location = generateInLine(upright, target.definitions(), container.largerDefinition(),
                    containerLocation, PlacementSearch.InLine.CLOSE);
            log.debug(name + " objetivo cerca del contenedor: " + location);
            ctx.register(target.assignLocation(location, LocationPlan.CLOSE, null));
            anchors.put(LocationPlan.CLOSE, location);
        }

        if (target.uses(LocationPlan.FAR)) {
            requireAnchor(containerLocation, LocationPlan.FAR);
            Location location = generateFarFrom(target.largerDefinition().reverted(), target.definitions(),
                    containerLocation);
            log.debug(name + " objetivo lejos del contenedor: " + location);
            ctx.register(target.assignLocation(location, LocationPlan.FAR, null));
            anchors.put(LocationPlan.FAR, location);
        }

        if (target.isRandom()) {
            Location location = goal.chooseLocation(ctx.search, largerTarget, target.definitions(),
                    ctx.performer, ctx.registry);
            log.debug(name + " objetivo al azar: " + location);
            ctx.register(target.assignLocation(location, LocationPlan.RANDOM, null));
            anchors.put(LocationPlan.RANDOM, location);
        }
        return anchors;
    }

    private void requireAnchor(Location containerLocation, LocationPlan plan) {
        if (containerLocation == null) {
            throw SceneException.placement(name + ": el objetivo " + plan + " necesita al primer contenedor ubicado");
        }
    }

    /*
     * Obstáculos, oclusores y confusor se ubican respecto de cada ubicación distinta del
     * objetivo (o de su contenedor), con la misma ubicación en todas las escenas que la comparten.
     */
    private void assignRelativeLocations(ObjectDefinition largerTarget, Map<LocationPlan, Location> anchors) {
        Map<LocationPlan, List<Integer>> targetLocations = ctx.target.locationsWithIndexes();
        List<ReceptacleData> blockers = new ArrayList<>(ctx.obstacles);
        blockers.addAll(ctx.occluders);
        ReceptacleData container = ctx.firstContainer();

        for (Map.Entry<LocationPlan, List<Integer>> e : targetLocations.entrySet()) {
            LocationPlan plan = e.getKey();
            List<Integer> indexes = e.getValue();
            Location anchor = anchors.get(plan);
            ObjectDefinition anchorDef = plan == LocationPlan.INSIDE ? container.largerDefinition() : largerTarget;

            for (ReceptacleData blocker : blockers) {
                boolean isObstacle = blocker.role == Role.OBSTACLE;
                if (usesAmong(blocker, LocationPlan.BETWEEN, indexes)) {
                    assignBlockerInLine(blocker, anchorDef, requireTargetAnchor(anchor, plan), indexes,
                            LocationPlan.BETWEEN,
                            isObstacle ? PlacementSearch.InLine.UNREACHABLE : PlacementSearch.InLine.OBSTRUCT);
                }
                if (usesAmong(blocker, LocationPlan.CLOSE, indexes)) {
                    assignBlockerInLine(blocker, anchorDef, requireTargetAnchor(anchor, plan), indexes,
                            LocationPlan.CLOSE, PlacementSearch.InLine.BEHIND);
                }
            }

            RoleData confusor = ctx.confusor;
            if (confusor == null) continue;
            if (usesAmong(confusor, LocationPlan.CLOSE, indexes)) {
                Location location = generateInLine(confusor.largerDefinition(), confusor.definitions(), anchorDef,
                        requireTargetAnchor(anchor, plan), PlacementSearch.InLine.ADJACENT);
                log.debug(name + " confusor al lado de " + plan + ": " + location);
                ctx.register(confusor.assignLocation(location, LocationPlan.CLOSE, indexes));
            }
            if (usesAmong(confusor, LocationPlan.FAR, indexes)) {
                Location location = generateFarFrom(confusor.largerDefinition(), confusor.definitions(),
                        requireTargetAnchor(anchor, plan));
                log.debug(name + " confusor lejos de " + plan + ": " + location);
                ctx.register(confusor.assignLocation(location, LocationPlan.FAR, indexes));
            }
        }

        // bloqueadores al azar: una sola ubicación que no tape a ninguna ubicación del objetivo
        List<Location> targetAnchors = new ArrayList<>();
        for (LocationPlan plan : targetLocations.keySet()) {
            if (anchors.containsKey(plan)) targetAnchors.add(anchors.get(plan));
        }
        for (ReceptacleData blocker : blockers) {
            if (!blocker.isRandom()) continue;
            Location location = generateVisibleRandom(blocker, targetAnchors);
            log.debug(name + " " + blocker.role.label() + " al azar sin tapar al objetivo: " + location);
            ctx.register(blocker.assignLocation(location, LocationPlan.RANDOM, null));
        }
    }

    private static boolean usesAmong(RoleData role, LocationPlan plan, List<Integer> indexes) {
        for (int i : indexes) {
            if (role.planIn(i) == plan) return true;
        }
        return false;
    }

    private Location requireTargetAnchor(Location anchor, LocationPlan plan) {
        if (anchor == null) {
            throw SceneException.placement(name + ": no hay ubicación de referencia para el objetivo " + plan);
        }
        return anchor;
    }

    /*
     * Las variantes entrenada y no entrenada buscan cada una su lugar (ambas tienen que
     * bloquear al objetivo) sobre el mismo registro; recién después se registran.
     */
    private void assignBlockerInLine(ReceptacleData blocker, ObjectDefinition anchorDef, Location anchor,
                                     List<Integer> indexes, LocationPlan plan, PlacementSearch.InLine mode) {
        List<Integer> trainedIndexes = new ArrayList<>();
        List<Integer> untrainedIndexes = new ArrayList<>();
        for (int i : indexes) {
            if (blocker.isUntrainedIn(i)) untrainedIndexes.add(i);
            else trainedIndexes.add(i);
        }
        Location trained = trainedIndexes.isEmpty() ? null
                : generateInLine(blocker.trainedDefinition, anchorDef, anchor, mode);
        Location untrained = untrainedIndexes.isEmpty() ? null
                : generateInLine(blocker.untrainedDefinition, anchorDef, anchor, mode);
        log.debug(name + " " + blocker.role.label() + " " + mode + ": entrenado=" + trained
                + " no entrenado=" + untrained);

        if (trained != null) ctx.register(blocker.assignLocation(trained, plan, trainedIndexes));
        if (untrained != null) ctx.register(blocker.assignLocation(untrained, plan, untrainedIndexes));
    }

    private Location[] generateFrontAndBack(ObjectDefinition def, List<ObjectDefinition> variants) {
        DoubleSupplier facing = () -> ctx.performer.rotationY;
        for (int tries = 0; tries < PlacementSearch.MAX_TRIES; tries++) {
            Location front = ctx.search.inFrontOfPerformer(ctx.performer, def, variants, new BoundsRegistry(), facing);
            if (front != null) {
                Location back = ctx.search.inBackOfPerformer(ctx.performer, def, variants, new BoundsRegistry(), facing);
                if (back != null) return new Location[]{ front, back };
            }
            ctx.redrawPerformer();
        }
        throw SceneException.placement(name + ": no se pudo ubicar al performer con lugar delante y detrás para " + def);
    }

    private Location generateInLine(ObjectDefinition def, ObjectDefinition anchorDef, Location anchor,
                                    PlacementSearch.InLine mode) {
        return generateInLine(def, List.of(), anchorDef, anchor, mode);
    }

    private Location generateInLine(ObjectDefinition def, List<ObjectDefinition> variants, ObjectDefinition anchorDef,
                                    Location anchor, PlacementSearch.InLine mode) {
        Location location = ctx.search.inLineWithObject(def, variants, anchorDef, anchor, ctx.performer,
                ctx.registry.copy(), mode);
        if (location == null) {
            throw SceneException.placement(name + ": no se pudo ubicar " + def.type + " (" + mode
                    + ") respecto de " + anchorDef.type + " en " + anchor.position + ", performer=" + ctx.performer);
        }
        return location;
    }

    private Location generateFarFrom(ObjectDefinition def, List<ObjectDefinition> variants, Location existing) {
        Location location = ctx.search.farFrom(def, variants, existing, ctx.performer.position, ctx.registry.copy());
        if (location == null) {
            throw SceneException.placement(name + ": no se pudo ubicar " + def.type + " lejos de " + existing.position);
        }
        return location;
    }

    /*
     * Al azar con la rotación del performer. Ninguna de sus definiciones puede pisar a otro
     * objeto, tapar del todo o quedar tapada por un objeto ya registrado, ni tapar en parte a
     * alguna ubicación del objetivo.
     */
    private Location generateVisibleRandom(RoleData role, List<Location> targets) {
        List<ObjectDefinition> definitions = role.definitions();
        Vec3 observer = ctx.performer.position;

        for (int tries = 0; tries < PlacementSearch.MAX_TRIES; tries++) {
            Location location = goal.chooseLocation(ctx.search, role.largerDefinition(), definitions,
                    ctx.performer, ctx.registry);
            if (isVisibleEverywhere(definitions, location, observer, targets)) return location;
        }
        throw SceneException.placement(name + ": no se pudo ubicar " + role.largerDefinition().type
                + " al azar sin tapar al objetivo");
    }

    private boolean isVisibleEverywhere(List<ObjectDefinition> definitions, Location location, Vec3 observer,
                                        List<Location> targets) {
        for (ObjectDefinition def : definitions) {
            BoundsRect rect = def.placementBounds(location.position, location.rotation.y);
            for (BoundsRect existing : ctx.registry.list()) {
                if (Visibility.fullyObstructs(observer, rect, existing.toPolygon())
                        || Visibility.fullyObstructs(observer, existing, rect.toPolygon())) {
                    return false;
                }
            }
            for (Location t : targets) {
                if (Visibility.partlyObstructs(observer, t.bounds, rect.toPolygon())) return false;
            }
        }
        return true;
    }

    /*
     * Por último, el objetivo (y el confusor, si va con él) adentro del primer contenedor,
     * con el área y los giros elegidos al seleccionar el contenedor. Después el confusor
     * que va adentro solo.
     */
    private void assignInsideContainer() {
        TargetData target = ctx.target;
        RoleData confusor = ctx.confusor;

        for (RoleData.Contained c : target.containedIndexes(ctx.largeContainers, confusor)) {
            ObjectInstance containerInstance = requireContainerInstance(c);
            ContainmentFitter.Containment containment = c.container.containmentIn(c.index);
            ObjectInstance targetInstance = target.trainedTemplate.copy();

            if (c.together == null) {
                ContainmentFitter.placeInside(containerInstance, targetInstance, containment.areaIndex,
                        containment.angle(0));
            } else {
                ObjectInstance confusorInstance = templateIn(confusor, c.index).copy();
                ContainmentFitter.placeBothInside(containerInstance, targetInstance, confusorInstance,
                        containment.areaIndex, containment.angle(0), containment.angle(1), containment.orientation);
                confusor.instances.set(c.index, confusorInstance);
            }
            target.instances.set(c.index, targetInstance);
        }

        if (confusor == null) return;
        for (RoleData.Contained c : confusor.containedIndexes(ctx.largeContainers, target)) {
            if (c.together != null) continue;   // ya quedó adentro junto al objetivo
            ObjectInstance containerInstance = requireContainerInstance(c);
            ContainmentFitter.Containment containment = c.container.containmentIn(c.index);
            ObjectInstance confusorInstance = templateIn(confusor, c.index).copy();
            ContainmentFitter.placeInside(containerInstance, confusorInstance, containment.areaIndex,
                    containment.angle(1));
            confusor.instances.set(c.index, confusorInstance);
        }
    }

    private ObjectInstance requireContainerInstance(RoleData.Contained c) {
        ObjectInstance instance = c.container.instanceIn(c.index);
        if (instance == null || c.container.containmentIn(c.index) == null) {
            throw SceneException.placement(name + ": la escena " + plans.get(c.index).id
                    + " no tiene contenedor para el objeto de adentro");
        }
        return instance;
    }

    private static ObjectInstance templateIn(RoleData role, int scene) {
        return role.isUntrainedIn(scene) && role.untrainedTemplate != null ? role.untrainedTemplate : role.trainedTemplate;
    }

    private void logObjects() {
        if (!log.isDebug()) return;
        for (RoleData r : ctx.allRoles()) {
            for (int i = 0; i < r.sceneCount(); i++) {
                ObjectInstance o = r.instanceIn(i);
                log.debug(name + " " + r.role.label() + "_" + i + " "
                        + (o == null ? "None" : o.definition.type + " " + o.id + " parent=" + o.locationParent));
            }
        }
    }

    // ------------- objetos de contexto -------------

    // 0-10 objetos decorativos compartidos por todas las escenas, sin tapar a ningún objeto crítico
    private void initializeContextObjects() {
        int count = CONTEXT_COUNTS[weightedIndex(CONTEXT_WEIGHTS)];
        Set<String> criticalShapes = new HashSet<>();
        List<ObjectInstance> critical = new ArrayList<>();
        for (RoleData r : ctx.criticalRoles()) {
            if (r.trainedDefinition != null) criticalShapes.add(r.trainedDefinition.lastShape());
            if (r.untrainedDefinition != null) criticalShapes.add(r.untrainedDefinition.lastShape());
            for (ObjectInstance o : r.instances) {
                // los de adentro tienen coordenadas del contenedor
                if (o != null && o.locationParent == null) critical.add(o);
            }
        }

        for (int n = 0; n < count; n++) {
            ObjectDefinition def = selector.chooseContextDefinition(criticalShapes);
            Location location = null;
            for (int tries = 0; tries < PlacementSearch.MAX_TRIES && location == null; tries++) {
                Location candidate = goal.chooseLocation(ctx.search, def, ctx.performer, ctx.registry);
                boolean hides = false;
                for (ObjectInstance o : critical) {
                    if (Visibility.fullyObstructs(ctx.performer.position, o.bounds, candidate.bounds.toPolygon())) {
                        hides = true;
                        break;
                    }
                }
                if (!hides) location = candidate;
            }
            if (location == null) {
                throw SceneException.placement(name + ": no se pudo ubicar el objeto de contexto " + def.type);
            }
            ctx.registry.add(location.bounds);
            ObjectInstance instance = ObjectInstance.atOrigin(def, ObjectInstance.newId(rnd));
            instance.role = Role.CONTEXT;
            instance.moveTo(location);
            ctx.contextObjects.add(instance);
        }
        log.debug(name + " objetos de contexto: " + count);
    }

    private int weightedIndex(double[] weights) {
        double total = 0;
        for (double w : weights) total += w;
        double r = rnd.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            r -= weights[i];
            if (r < 0) return i;
        }
        return weights.length - 1;
    }

    private static void setCanContainTarget(ReceptacleData container, boolean value) {
        for (ObjectInstance o : container.instances) {
            if (o != null) o.canContainTarget = value;
        }
    }

    // ------------- escenas -------------

    private List<Scene> createScenes() {
        String prefix = (name == null || name.isEmpty() ? "" : name + " ").replace(' ', '_');
        String uuid = new UUID(rnd.nextLong(), rnd.nextLong()).toString().toUpperCase();
        String goalDescription = goal.description(ctx.target.trainedDefinition);

        List<Scene> scenes = new ArrayList<>();
        for (int i = 0; i < plans.size(); i++) {
            ScenePlan plan = plans.get(i);
            String id = plan.id.toUpperCase();
            String sceneName = prefix + id;

            List<ObjectInstance> objects = new ArrayList<>();
            addPresent(objects, ctx.target, i);
            if (ctx.confusor != null) addPresent(objects, ctx.confusor, i);
            for (ReceptacleData c : ctx.containers()) addPresent(objects, c, i);
            for (ObjectInstance o : ctx.contextObjects) objects.add(o.copy());
            for (ReceptacleData o : ctx.obstacles) addPresent(objects, o, i);
            for (ReceptacleData o : ctx.occluders) addPresent(objects, o, i);

            scenes.add(new Scene(id, sceneName, sceneName + "_" + uuid, plan.isEvaluationOnly(), plan.sliceTags,
                    goalDescription, ctx.target.instanceIn(i).id, template.dimensions, ctx.performer,
                    template.floor, template.wall, objects));
        }
        scenes.sort((a, b) -> a.id.compareTo(b.id));
        return scenes;
    }

    private static void addPresent(List<ObjectInstance> objects, RoleData role, int scene) {
        ObjectInstance o = role.instanceIn(scene);
        if (o != null) objects.add(o);
    }

    /*
     * Si el color del piso o de las paredes aparece en algún objeto con rol, se busca otro
     * material del catálogo sin esos colores y se aplica a todas las escenas.
     */
    private void updateFloorAndWalls(List<Scene> scenes) {
        Set<String> objectColors = new LinkedHashSet<>();
        for (RoleData r : ctx.allRoles()) {
            for (ObjectInstance t : r.templates()) objectColors.addAll(t.definition.colors);
        }
        Material floor = chooseRoomMaterial("piso", template.floor, catalog.floorMaterials(), objectColors);
        Material wall = chooseRoomMaterial("pared", template.wall, catalog.wallMaterials(), objectColors);
        for (Scene s : scenes) {
            s.floor = floor;
            s.wall = wall;
        }
    }

    private Material chooseRoomMaterial(String label, Material current, List<Material> options, Set<String> colors) {
        if (Collections.disjoint(current.colors, colors)) return current;
        List<Material> shuffled = new ArrayList<>(options);
        Collections.shuffle(shuffled, rnd);
        for (Material m : shuffled) {
            if (Collections.disjoint(m.colors, colors)) {
                log.debug(name + " material de " + label + " cambiado a " + m);
                return m;
            }
        }
        throw SceneException.placement(name + ": no hay material de " + label + " sin los colores " + colors);
    }
}
