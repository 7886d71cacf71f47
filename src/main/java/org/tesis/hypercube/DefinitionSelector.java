package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

/*
 * Elige las definiciones de cada rol según las reglas de emparejamiento con el objetivo.
 * Cualquier falla es una SceneException de definición: no se arregla reubicando.
 */
public class DefinitionSelector {

    // ===================== Parámetros de selección =====================
    static final double MIN_BLOCKER_HEIGHT = Room.PERFORMER_CAMERA_Y / 2.0;  // no se puede pasar por encima
    static final double MIN_BLOCKER_MASS   = Room.PERFORMER_MASS;            // no se puede empujar

    private final Catalog catalog;
    private final Random rnd;
    private final SceneLog log;

    // datasets armados una sola vez por selector
    private DefinitionDataset pickupables, containers, obstacles, occluders;

    DefinitionSelector(Catalog catalog, Random rnd, SceneLog log) {
        this.catalog = catalog;
        this.rnd = rnd;
        this.log = log;
    }

    DefinitionDataset pickupables() {
        if (pickupables == null) pickupables = DefinitionDataset.create(catalog, Catalog.DefinitionList.PICKUPABLES, rnd);
        return pickupables;
    }

    private DefinitionDataset containers() {
        if (containers == null) {
            containers = DefinitionDataset.create(catalog, Catalog.DefinitionList.CONTAINERS, rnd)
                    .filter(d -> !d.enclosedAreas.isEmpty());
        }
        return containers;
    }

    private DefinitionDataset blockers(boolean occluder) {
        if (occluder) {
            if (occluders == null) {
                occluders = DefinitionDataset.create(catalog, Catalog.DefinitionList.OCCLUDERS, rnd)
                        .filter(d -> d.has(Attribute.OCCLUDER));
            }
            return occluders;
        }
        if (obstacles == null) {
            obstacles = DefinitionDataset.create(catalog, Catalog.DefinitionList.OBSTACLES, rnd)
                    .filter(d -> d.has(Attribute.OBSTACLE));
        }
        return obstacles;
    }

    // la variante no entrenada es de forma nueva; sin candidatos se usa la entrenada
    private static DefinitionDataset untrainedOrTrained(DefinitionDataset dataset) {
        DefinitionDataset untrained = dataset.filterOnUntrained(Novelty.SHAPE);
        return untrained.isEmpty() ? dataset.filterOnTrained() : untrained;
    }

    // ------------- objetivo -------------

    void assignTarget(TargetData target, RetrievalGoal goal) {
        if (target.trainedDefinition == null) {
            target.trainedDefinition = goal.chooseTargetDefinition(target.choice);
        }
        log.debug("definición del objetivo: " + target.trainedDefinition);
    }

    // ------------- confusor -------------

    void assignConfusor(RoleData confusor, ObjectDefinition target) {
        if (confusor == null) return;
        DefinitionDataset trained = pickupables().filterOnTrained();
        DefinitionDataset untrained = untrainedOrTrained(pickupables());

        if (confusor.trainedDefinition == null) {
            confusor.trainedDefinition = Similarity.similarDefinition(target, trained, rnd);
            if (confusor.trainedDefinition == null) {
                throw SceneException.definition("No hay confusor entrenado parecido a " + target
                        + " (candidatos=" + trained.size() + ")");
            }
        }
        if (confusor.untrainedDefinition == null) {
            confusor.untrainedDefinition = Similarity.similarDefinition(target, untrained, rnd);
            if (confusor.untrainedDefinition == null) {
                throw SceneException.definition("No hay confusor no entrenado parecido a " + target
                        + " (candidatos=" + untrained.size() + ")");
            }
        }
        log.debug("definición del confusor: entrenado=" + confusor.trainedDefinition
                + " no entrenado=" + confusor.untrainedDefinition);
    }

    // ------------- obstáculos y oclusores -------------

    void assignBlocker(ReceptacleData blocker, ObjectDefinition target, boolean occluder) {
        DefinitionDataset dataset = blockers(occluder);
        if (blocker.trainedDefinition == null) {
            blocker.trainedDefinition = chooseBlocker(target, dataset.filterOnTrained(), occluder);
        }
        if (blocker.untrainedDefinition == null) {
            blocker.untrainedDefinition = chooseBlocker(target, untrainedOrTrained(dataset), occluder);
        }
        log.debug("definición del " + (occluder ? "oclusor" : "obstáculo") + ": entrenado="
                + blocker.trainedDefinition + " no entrenado=" + blocker.untrainedDefinition);
    }

    /*
     * Más alto que media cámara, más pesado que el performer y (si es oclusor) al menos tan
     * alto como el objetivo. Si es más ancho que el objetivo va derecho; si solo su
     * profundidad alcanza, se gira 90 grados.
     */
    ObjectDefinition chooseBlocker(ObjectDefinition target, DefinitionDataset dataset, boolean occluder) {
        List<ObjectDefinition> matches = new ArrayList<>();
        List<Double> angles = new ArrayList<>();
        Vec3 targetDims = target.placementDimensions();

        for (ObjectDefinition d : dataset.definitions(rnd)) {
            Vec3 dims = d.placementDimensions();
            boolean cannotWalkOver = dims.y >= MIN_BLOCKER_HEIGHT;
            boolean cannotWalkInto = d.mass > MIN_BLOCKER_MASS;
            if (!cannotWalkOver || !cannotWalkInto) continue;
            if (occluder && dims.y < targetDims.y) continue;

            if (dims.x >= targetDims.x) {
                matches.add(d);
                angles.add(0.0);
            } else if (dims.z >= targetDims.x) {
                matches.add(d);
                angles.add(90.0);
            }
        }
        if (matches.isEmpty()) {
            throw SceneException.definition("No hay " + (occluder ? "oclusor" : "obstáculo")
                    + " para el objetivo " + target + " (candidatos=" + dataset.size() + ")");
        }
        int pick = rnd.nextInt(matches.size());
        ObjectDefinition chosen = matches.get(pick);
        return chosen.withRotationY(chosen.rotation.y + angles.get(pick));
    }

    // ------------- contenedores -------------

    /*
     * mayTurnTarget: solo el contenedor principal, en su variante entrenada, puede acostar
     * al objetivo; el resto tiene que aceptar al objetivo como ya quedó.
     */
    void assignContainer(ReceptacleData container, TargetData target, RoleData confusor, boolean findInvalid,
                         boolean mayTurnTarget) {
        DefinitionDataset dataset = containers();
        if (container.trainedDefinition == null) {
            ContainerChoice c = chooseContainer(target, confusor,
                    confusor != null ? confusor.trainedDefinition : null, dataset.filterOnTrained(), findInvalid,
                    mayTurnTarget);
            container.trainedDefinition = c.definition;
            container.trainedContainment = c.containment;
        }
        if (container.untrainedDefinition == null) {
            ContainerChoice c = chooseContainer(target, confusor,
                    confusor != null ? confusor.untrainedDefinition : null, untrainedOrTrained(dataset), findInvalid,
                    false);
            container.untrainedDefinition = c.definition;
            container.untrainedContainment = c.containment;
        }
        log.debug("definición del contenedor " + (findInvalid ? "chico" : "grande") + ": entrenado="
                + container.trainedDefinition + " no entrenado=" + container.untrainedDefinition);
    }

    static final class ContainerChoice {
        final ObjectDefinition definition;
        final ContainmentFitter.Containment containment;   // null para contenedores chicos

        ContainerChoice(ObjectDefinition definition, ContainmentFitter.Containment containment) {
            this.definition = definition;
            this.containment = containment;
        }
    }

    /*
     * Recorre el dataset al azar (grupo, luego selección sin repetir, luego material) hasta
     * encontrar un contenedor donde entre (o, si findInvalid, donde no entre) el objetivo,
     * probando también al objetivo acostado si se permite. Si el objetivo y el confusor van juntos
     * adentro alguna vez, tienen que entrar los dos en la misma área.
     * Con mayTurnTarget puede dejar al objetivo acostado.
     */
    ContainerChoice chooseContainer(TargetData target, RoleData confusor, ObjectDefinition confusorDef,
                                    DefinitionDataset dataset, boolean findInvalid, boolean mayTurnTarget) {
        List<ObjectDefinition> targetOptions = new ArrayList<>();
        targetOptions.add(target.trainedDefinition);
        ObjectDefinition sideways = mayTurnTarget ? target.trainedDefinition.turnedSideways() : null;
        if (sideways != null) targetOptions.add(sideways);

        boolean together = target.containerizeWith(confusor);
        if (!together && !target.isInside()) {
            targetOptions = new ArrayList<>();
            targetOptions.add(null);
        }
        ObjectDefinition confusorInside = confusor != null && confusor.isInside() ? confusorDef : null;

        List<List<List<ObjectDefinition>>> groups = dataset.groups();
        List<Integer> groupIndexes = new ArrayList<>();
        List<List<Integer>> innerIndexes = new ArrayList<>();
        for (int g = 0; g < groups.size(); g++) {
            groupIndexes.add(g);
            List<Integer> inner = new ArrayList<>();
            for (int s = 0; s < groups.get(g).size(); s++) inner.add(s);
            innerIndexes.add(inner);
        }

        while (!groupIndexes.isEmpty()) {
            Integer group = groupIndexes.get(rnd.nextInt(groupIndexes.size()));
            List<Integer> inner = innerIndexes.get(group);
            Integer selection = inner.remove(rnd.nextInt(inner.size()));
            if (inner.isEmpty()) groupIndexes.remove(group);
            List<ObjectDefinition> variants = groups.get(group).get(selection);
            ObjectDefinition candidate = variants.get(rnd.nextInt(variants.size()));

            for (ObjectDefinition t : targetOptions) {
                ContainmentFitter.Containment containment = together
                        ? ContainmentFitter.canContainBoth(candidate, t, confusorDef)
                        : ContainmentFitter.canContain(candidate, t, confusorInside);
                if (containment != null && !findInvalid) {
                    if (t != null) target.trainedDefinition = t;
                    return new ContainerChoice(candidate, containment);
                }
                if (containment == null && findInvalid) {
                    if (t != null) target.trainedDefinition = t;
                    return new ContainerChoice(candidate, null);
                }
            }
        }
        throw SceneException.definition("No se pudo elegir un contenedor " + (findInvalid ? "chico" : "grande")
                + " (candidatos=" + dataset.size() + ") objetivo=" + target.trainedDefinition
                + " confusor=" + confusorDef);
    }

    // ------------- contexto -------------

    // objeto chico y entrenado cuya forma no se confunda con la de ningún objeto crítico
    ObjectDefinition chooseContextDefinition(Set<String> criticalShapes) {
        DefinitionDataset candidates = pickupables().filterOnTrained()
                .filter(d -> !criticalShapes.contains(d.lastShape()));
        if (candidates.isEmpty()) {
            throw SceneException.definition("No hay objetos de contexto distintos de " + criticalShapes);
        }
        return candidates.chooseRandom(rnd);
    }
}
