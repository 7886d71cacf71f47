package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/*
 * Estado compartido de un intento: sala, performer, registro de rectángulos y la tabla de
 * roles con sus instancias por escena. Se reinicia entero al comenzar cada intento.
 */
final class PlacementContext {

    final Room room;
    final Random rnd;
    final SceneLog log;
    final PlacementSearch search;
    final BoundsRegistry registry = new BoundsRegistry();
    PerformerStart performer;

    final TargetData target;
    final RoleData confusor;                    // null si la familia no tiene confusor
    final List<ReceptacleData> largeContainers = new ArrayList<>();
    final List<ReceptacleData> smallContainers = new ArrayList<>();
    final List<ReceptacleData> obstacles = new ArrayList<>();
    final List<ReceptacleData> occluders = new ArrayList<>();
    final List<ObjectInstance> contextObjects = new ArrayList<>();

    PlacementContext(List<ScenePlan> plans, Room room, Random rnd, SceneLog log) {
        if (plans.isEmpty()) throw new IllegalArgumentException("La familia no tiene escenas");
        this.room = room;
        this.rnd = rnd;
        this.log = log;
        this.search = new PlacementSearch(room, rnd);

        ScenePlan first = plans.get(0);
        this.target = new TargetData(first.target, 0);
        this.confusor = first.confusor != null ? new RoleData(Role.CONFUSOR, first.confusor) : null;
        for (ObjectPlan p : first.largeContainers) largeContainers.add(new ReceptacleData(Role.CONTAINER, p));
        for (ObjectPlan p : first.smallContainers) smallContainers.add(new ReceptacleData(Role.CONTAINER, p));
        for (ObjectPlan p : first.obstacles) obstacles.add(new ReceptacleData(Role.OBSTACLE, p));
        for (ObjectPlan p : first.occluders) occluders.add(new ReceptacleData(Role.OCCLUDER, p));

        // cada escena tiene que traer un plan por cada objeto de la primera
        for (ScenePlan plan : plans.subList(1, plans.size())) {
            if ((plan.confusor != null) != (confusor != null)
                    || plan.largeContainers.size() != largeContainers.size()
                    || plan.smallContainers.size() != smallContainers.size()
                    || plan.obstacles.size() != obstacles.size()
                    || plan.occluders.size() != occluders.size()) {
                throw SceneException.definition("La escena " + plan.id + " no tiene los mismos roles que " + first.id);
            }
            target.appendPlan(plan.target);
            if (confusor != null) confusor.appendPlan(plan.confusor);
            append(largeContainers, plan.largeContainers);
            append(smallContainers, plan.smallContainers);
            append(obstacles, plan.obstacles);
            append(occluders, plan.occluders);
        }
    }

    private static void append(List<ReceptacleData> roles, List<ObjectPlan> plans) {
        for (int i = 0; i < roles.size(); i++) roles.get(i).appendPlan(plans.get(i));
    }

    int sceneCount() { return target.sceneCount(); }

    List<RoleData> allRoles() {
        List<RoleData> all = new ArrayList<>();
        all.add(target);
        if (confusor != null) all.add(confusor);
        all.addAll(largeContainers);
        all.addAll(smallContainers);
        all.addAll(obstacles);
        all.addAll(occluders);
        return all;
    }

    // objetos que el performer tiene que poder ver
    List<RoleData> criticalRoles() {
        List<RoleData> critical = new ArrayList<>();
        critical.add(target);
        if (confusor != null) critical.add(confusor);
        critical.addAll(obstacles);
        critical.addAll(occluders);
        return critical;
    }

    List<ReceptacleData> containers() {
        List<ReceptacleData> all = new ArrayList<>(largeContainers);
        all.addAll(smallContainers);
        return all;
    }

    ReceptacleData firstContainer() {
        return largeContainers.isEmpty() ? null : largeContainers.get(0);
    }

    void reset() {
        registry.clear();
        contextObjects.clear();
        for (RoleData r : allRoles()) r.resetAllProperties();
        performer = PerformerStart.random(room, rnd);
    }

    void redrawPerformer() {
        performer = PerformerStart.random(room, rnd);
    }

    void register(List<BoundsRect> bounds) {
        registry.addAll(bounds);
    }
}
