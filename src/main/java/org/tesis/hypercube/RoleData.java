package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/*
 * Un objeto de la familia a lo largo de todas sus escenas: un plan por escena, las
 * definiciones entrenada/no entrenada, sus plantillas en el origen y la instancia de
 * cada escena (null si todavía no se ubicó o si el plan es NONE).
 */
class RoleData {

    final Role role;
    final List<ObjectPlan> plans = new ArrayList<>();
    final ObjectDefinition originalDefinition;     // definición fija del plan, puede ser null

    ObjectDefinition trainedDefinition;
    ObjectDefinition untrainedDefinition;
    ObjectInstance trainedTemplate;
    ObjectInstance untrainedTemplate;
    final List<ObjectInstance> instances = new ArrayList<>();

    RoleData(Role role, ObjectPlan first) {
        this.role = role;
        this.originalDefinition = first.definition;
        this.trainedDefinition = first.definition;
        this.untrainedDefinition = first.definition;
        appendPlan(first);
    }

    void appendPlan(ObjectPlan plan) {
        plans.add(plan);
        instances.add(null);
    }

    int sceneCount() { return plans.size(); }

    LocationPlan planIn(int scene) { return plans.get(scene).location; }

    boolean isUntrainedIn(int scene) { return plans.get(scene).untrained; }

    ObjectInstance instanceIn(int scene) { return instances.get(scene); }

    // el rol usa esa política en alguna escena
    boolean uses(LocationPlan location) {
        for (ObjectPlan p : plans) {
            if (p.location == location) return true;
        }
        return false;
    }

    boolean isInside() { return uses(LocationPlan.INSIDE); }
    boolean isClose()  { return uses(LocationPlan.CLOSE); }
    boolean isRandom() { return uses(LocationPlan.RANDOM); }

    boolean anyUntrained() {
        for (ObjectPlan p : plans) {
            if (p.untrained) return true;
        }
        return false;
    }

    /*
     * Crea una copia de la plantilla correspondiente en cada escena cuyo plan coincide
     * (y cuyo índice está en "indexes", si se pasa) y la mueve a la ubicación.
     * Devuelve los rectángulos de las variantes usadas, para sumarlos al registro.
     */
    List<BoundsRect> assignLocation(Location location, LocationPlan plan, Collection<Integer> indexes) {
        ObjectInstance trained = placedCopy(trainedTemplate, trainedDefinition, location);
        ObjectInstance untrained = untrainedTemplate == null ? null
                : placedCopy(untrainedTemplate, untrainedDefinition, location);

        boolean trainedNeeded = false, untrainedNeeded = false;
        for (int i = 0; i < plans.size(); i++) {
            if (plans.get(i).location != plan) continue;
            if (indexes != null && !indexes.contains(i)) continue;
            if (plans.get(i).untrained && untrained != null) {
                instances.set(i, untrained.copy());
                untrainedNeeded = true;
            } else {
                instances.set(i, trained.copy());
                trainedNeeded = true;
            }
        }

        List<BoundsRect> bounds = new ArrayList<>();
        if (trainedNeeded) bounds.add(trained.bounds);
        if (untrainedNeeded) bounds.add(untrained.bounds);
        return bounds;
    }

    private static ObjectInstance placedCopy(ObjectInstance template, ObjectDefinition def, Location location) {
        ObjectInstance copy = template.copy();
        copy.moveTo(location);
        copy.bounds = def.placementBounds(location.position, location.rotation.y);
        return copy;
    }

    // definiciones que pueden ocupar la ubicación del rol (entrenada y no entrenada)
    List<ObjectDefinition> definitions() {
        List<ObjectDefinition> out = new ArrayList<>();
        if (trainedDefinition != null) out.add(trainedDefinition);
        if (untrainedDefinition != null && untrainedDefinition != trainedDefinition) out.add(untrainedDefinition);
        return out;
    }

    // la mayor de las dos definiciones
    ObjectDefinition largerDefinition() {
        return untrainedDefinition == null ? trainedDefinition
                : identifyLarger(trainedDefinition, untrainedDefinition);
    }

    /*
     * La que cubre a la otra en x y en z; si ninguna la cubre (una más ancha y la otra más
     * profunda), la de mayor superficie.
     */
    static ObjectDefinition identifyLarger(ObjectDefinition one, ObjectDefinition two) {
        if (one == null) return two;
        if (two == null) return one;
        Vec3 a = one.dimensions, b = two.dimensions;
        if (a.x >= b.x && a.z >= b.z) return one;
        if (b.x >= a.x && b.z >= a.z) return two;
        return a.x * a.z >= b.x * b.z ? one : two;
    }

    /*
     * Políticas distintas del rol y las escenas que usan cada una, en orden de aparición.
     * Las escenas NONE no cuentan.
     */
    Map<LocationPlan, List<Integer>> locationsWithIndexes() {
        Map<LocationPlan, List<Integer>> out = new LinkedHashMap<>();
        for (int i = 0; i < plans.size(); i++) {
            LocationPlan p = plans.get(i).location;
            if (p == LocationPlan.NONE) continue;
            out.computeIfAbsent(p, k -> new ArrayList<>()).add(i);
        }
        return out;
    }

    // escenas en que este objeto va adentro del primer contenedor; "other" solo si va con él
    List<Contained> containedIndexes(List<ReceptacleData> containers, RoleData other) {
        List<Contained> out = new ArrayList<>();
        for (int i = 0; i < plans.size(); i++) {
            if (planIn(i) != LocationPlan.INSIDE) continue;
            RoleData together = other != null && other.planIn(i) == LocationPlan.INSIDE ? other : null;
            out.add(new Contained(i, containers.get(0), together));
        }
        return out;
    }

    // ambos objetos van juntos adentro del mismo contenedor en alguna escena
    boolean containerizeWith(RoleData other) {
        if (other == null) return false;
        for (int i = 0; i < plans.size(); i++) {
            if (planIn(i) == LocationPlan.INSIDE && other.planIn(i) == LocationPlan.INSIDE) return true;
        }
        return false;
    }

    // plantillas en el origen; la no entrenada comparte el id de la entrenada
    void recreateTemplates(Random rnd) {
        String id = ObjectInstance.newId(rnd);
        trainedTemplate = ObjectInstance.atOrigin(trainedDefinition, id);
        trainedTemplate.role = role;
        untrainedTemplate = null;
        if (untrainedDefinition != null) {
            untrainedTemplate = ObjectInstance.atOrigin(untrainedDefinition, id);
            untrainedTemplate.role = role;
        }
        resetAllInstances();
    }

    List<ObjectInstance> templates() {
        List<ObjectInstance> out = new ArrayList<>();
        if (trainedTemplate != null) out.add(trainedTemplate);
        if (untrainedTemplate != null) out.add(untrainedTemplate);
        return out;
    }

    void resetAllInstances() {
        for (int i = 0; i < instances.size(); i++) instances.set(i, null);
    }

    void resetAllProperties() {
        trainedDefinition = originalDefinition;
        untrainedDefinition = originalDefinition;
        trainedTemplate = null;
        untrainedTemplate = null;
        resetAllInstances();
    }

    @Override public String toString() {
        return role.label() + plans;
    }

    // ======= Tipos =======

    /* Escena en que el objeto va adentro de un contenedor, opcionalmente junto con otro. */
    static final class Contained {
        final int index;
        final ReceptacleData container;
        final RoleData together;

        Contained(int index, ReceptacleData container, RoleData together) {
            this.index = index;
            this.container = container;
            this.together = together;
        }
    }
}
