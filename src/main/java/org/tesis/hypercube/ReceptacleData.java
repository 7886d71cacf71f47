package org.tesis.hypercube;

/*
 * Rol que puede tener objetos adentro (contenedores) o que bloquea al objetivo
 * (obstáculos y oclusores). Guarda cómo entra el objetivo en cada variante.
 */
class ReceptacleData extends RoleData {

    ContainmentFitter.Containment trainedContainment;
    ContainmentFitter.Containment untrainedContainment;

    ReceptacleData(Role role, ObjectPlan first) {
        super(role, first);
    }

    ContainmentFitter.Containment containmentIn(int scene) {
        return isUntrainedIn(scene) ? untrainedContainment : trainedContainment;
    }

    ObjectInstance templateIn(int scene) {
        return isUntrainedIn(scene) && untrainedTemplate != null ? untrainedTemplate : trainedTemplate;
    }

    @Override void resetAllProperties() {
        super.resetAllProperties();
        trainedContainment = null;
        untrainedContainment = null;
    }
}
