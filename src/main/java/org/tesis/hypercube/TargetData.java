package org.tesis.hypercube;

import java.util.List;

/* El objetivo de la meta. Siempre es el primer objetivo de la meta (índice 0). */
class TargetData extends RoleData {

    final int choice;

    TargetData(ObjectPlan first, int choice) {
        super(Role.TARGET, first);
        this.choice = choice;
    }

    /*
     * Definición que reserva lugar para el objetivo: la del primer contenedor si alguna vez
     * va adentro (solo o con el confusor), la mayor entre objetivo y confusor si el confusor
     * va cerca, o la propia.
     */
    ObjectDefinition largerDefinitionOf(List<ReceptacleData> containers, RoleData confusor) {
        boolean confusorCloseAndInside = confusor != null && confusor.isClose() && confusor.isInside();
        if ((isInside() || confusorCloseAndInside) && !containers.isEmpty()) {
            return containers.get(0).largerDefinition();
        }
        if (confusor != null && confusor.isClose()) {
            return identifyLarger(largerDefinition(), confusor.largerDefinition());
        }
        return largerDefinition();
    }
}
