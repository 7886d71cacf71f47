package org.tesis.hypercube;

import java.util.List;
import java.util.Random;

/*
 * Meta de recuperación: encontrar y levantar un objeto. Elige la definición del objetivo
 * cuando el plan no la fija y ubica objetos al azar mirando hacia donde mira el performer.
 */
public class RetrievalGoal {

    static final String DESCRIPTION = "Find and pick up the %s.";

    private final DefinitionDataset pickupables;
    private final Random rnd;

    RetrievalGoal(DefinitionDataset pickupables, Random rnd) {
        this.pickupables = pickupables.filterOnTrained();
        this.rnd = rnd;
    }

    // un objetivo levantable y entrenado al azar; la meta tiene un único objetivo
    ObjectDefinition chooseTargetDefinition(int choice) {
        if (pickupables.isEmpty()) {
            throw SceneException.definition("No hay objetivos levantables para la meta (objetivo " + choice + ")");
        }
        return pickupables.chooseRandom(rnd);
    }

    /*
     * Ubicación al azar con la rotación del performer, calculada sobre una copia del
     * registro: quien llama decide qué rectángulos registrar.
     */
    Location chooseLocation(PlacementSearch search, ObjectDefinition def, PerformerStart performer,
                            BoundsRegistry registry) {
        return chooseLocation(search, def, List.of(), performer, registry);
    }

    // las variantes ocupan la misma ubicación y también tienen que caber
    Location chooseLocation(PlacementSearch search, ObjectDefinition def, List<ObjectDefinition> variants,
                            PerformerStart performer, BoundsRegistry registry) {
        Location location = search.randomLocation(def, variants, performer.position, registry.copy(),
                () -> performer.rotationY);
        if (location == null) {
            throw SceneException.placement("No se pudo ubicar " + def);
        }
        return location;
    }

    String description(ObjectDefinition target) {
        return String.format(DESCRIPTION, target.goalString());
    }
}
