package org.tesis.hypercube;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefinitionSelectorTest {

    private final Catalog catalog = Catalog.getDefault();
    private final ObjectDefinition soccerBall = catalog.definition("soccer_ball");

    private DefinitionSelector selector(long seed) {
        return new DefinitionSelector(catalog, new Random(seed), SceneLog.silent());
    }

    private static DefinitionDataset trainedBlockers(Catalog catalog, boolean occluder) {
        return DefinitionDataset.create(catalog,
                occluder ? Catalog.DefinitionList.OCCLUDERS : Catalog.DefinitionList.OBSTACLES, new Random(1))
                .filterOnTrained();
    }

    @Test
    void occluderIsTallHeavyAndWideEnough() {
        DefinitionSelector s = selector(1);
        for (int i = 0; i < 20; i++) {
            ObjectDefinition base = soccerBall;
            ObjectDefinition occluder = s.chooseBlocker(base, trainedBlockers(catalog, true), true);

            Vec3 dims = occluder.placementDimensions();
            assertThat(dims.y).isGreaterThanOrEqualTo(DefinitionSelector.MIN_BLOCKER_HEIGHT);
            assertThat(dims.y).isGreaterThanOrEqualTo(base.dimensions.y);
            assertThat(occluder.mass).isGreaterThan(DefinitionSelector.MIN_BLOCKER_MASS);
            assertThat(Math.max(dims.x, dims.z)).isGreaterThanOrEqualTo(base.dimensions.x);
            assertThat(occluder.rotation.y).isIn(0.0, 90.0);
        }
    }

    @Test
    void blockerTooNarrowForTheTarget() {
        // ni el ancho ni la profundidad del librero alcanzan para 1.2
        ObjectDefinition wide = new ObjectDefinition.Builder().type("wide").dimensions(1.2, 0.3, 0.1).build();
        DefinitionDataset bookcases = DefinitionDataset.create(catalog, Catalog.DefinitionList.OBSTACLES, new Random(1))
                .filter(d -> d.type.equals("bookcase_1_shelf"));

        assertThatThrownBy(() -> selector(2).chooseBlocker(wide, bookcases, false))
                .isInstanceOfSatisfying(SceneException.class,
                        e -> assertThat(e.kind()).isEqualTo(SceneException.Kind.DEFINITION));
    }

    @Test
    void deepBlockerIsTurned() {
        ObjectDefinition target = new ObjectDefinition.Builder().type("target").dimensions(0.6, 0.3, 0.1).build();
        ObjectDefinition cabinet = new ObjectDefinition.Builder().type("cabinet").mass(10)
                .dimensions(0.5, 1.0, 1.2).build();
        DefinitionDataset dataset = new DefinitionDataset(List.of(List.of(List.of(cabinet))));

        ObjectDefinition chosen = selector(2).chooseBlocker(target, dataset, false);

        assertThat(chosen.type).isEqualTo("cabinet");
        assertThat(chosen.rotation.y).isEqualTo(90.0);
    }

    @Test
    void largeContainerHoldsTheTarget() {
        DefinitionSelector s = selector(3);
        TargetData target = new TargetData(ObjectPlan.of(LocationPlan.INSIDE, soccerBall), 0);
        ReceptacleData container = new ReceptacleData(Role.CONTAINER, ObjectPlan.of(LocationPlan.RANDOM));
        container.appendPlan(ObjectPlan.untrained(LocationPlan.RANDOM));
        target.appendPlan(ObjectPlan.of(LocationPlan.INSIDE, soccerBall));

        s.assignContainer(container, target, null, false, true);

        assertThat(container.trainedContainment).isNotNull();
        assertThat(container.untrainedContainment).isNotNull();
        assertThat(ContainmentFitter.canContain(container.trainedDefinition, target.trainedDefinition)).isNotNull();
        assertThat(container.trainedDefinition.novelty).isEmpty();
        assertThat(container.untrainedDefinition.novelty).containsExactly(Novelty.SHAPE);
    }

    @Test
    void smallContainerCannotHoldTheTarget() {
        DefinitionSelector s = selector(4);
        TargetData target = new TargetData(ObjectPlan.of(LocationPlan.INSIDE, soccerBall), 0);
        ReceptacleData small = new ReceptacleData(Role.CONTAINER, ObjectPlan.of(LocationPlan.RANDOM));

        s.assignContainer(small, target, null, true, false);

        assertThat(small.trainedContainment).isNull();
        assertThat(ContainmentFitter.canContain(small.trainedDefinition, soccerBall)).isNull();
        assertThat(ContainmentFitter.canContain(small.untrainedDefinition, soccerBall)).isNull();
    }

    @Test
    void onlyThePrimaryContainerMayTurnTheTarget() {
        ObjectDefinition trophy = DefinitionFinalizer.finalizeWithMaterials(catalog.definition("trophy"), catalog,
                new Random(1));
        // área donde el trofeo solo entra acostado
        EnclosedArea low = new EnclosedArea(new Vec3(0, 0.1, 0), new Vec3(0.5, 0.2, 0.5));
        ObjectDefinition tray = new ObjectDefinition.Builder().type("tray").dimensions(0.6, 0.25, 0.6)
                .enclosedAreas(low).build();
        DefinitionDataset trays = new DefinitionDataset(List.of(List.of(List.of(tray))));

        TargetData target = new TargetData(ObjectPlan.of(LocationPlan.INSIDE, trophy), 0);
        assertThatThrownBy(() -> selector(5).chooseContainer(target, null, null, trays, false, false))
                .isInstanceOf(SceneException.class);
        assertThat(target.trainedDefinition.dimensions).isEqualTo(trophy.dimensions);

        selector(5).chooseContainer(target, null, null, trays, false, true);
        assertThat(target.trainedDefinition.dimensions.y).isEqualTo(0.14);
    }

    @Test
    void confusorDiffersInOneAxis() {
        DefinitionSelector s = selector(6);
        ObjectDefinition racecar = s.pickupables().filterOnTrained()
                .filter(d -> d.type.equals("racecar_red")).chooseRandom(new Random(1));
        RoleData confusor = new RoleData(Role.CONFUSOR, ObjectPlan.of(LocationPlan.CLOSE));

        s.assignConfusor(confusor, racecar);

        assertThat(confusor.trainedDefinition.similarity).isNotNull();
        assertThat(Similarity.matches(confusor.trainedDefinition.similarity, racecar, confusor.trainedDefinition)).isTrue();
        assertThat(confusor.untrainedDefinition.type).isEqualTo("car_2");
    }

    @Test
    void missingConfusorIsADefinitionFailure() {
        DefinitionSelector s = selector(7);
        ObjectDefinition odd = new ObjectDefinition.Builder().type("odd").dimensions(3, 3, 3).build();
        RoleData confusor = new RoleData(Role.CONFUSOR, ObjectPlan.of(LocationPlan.CLOSE));

        assertThatThrownBy(() -> s.assignConfusor(confusor, odd))
                .isInstanceOfSatisfying(SceneException.class,
                        e -> assertThat(e.kind()).isEqualTo(SceneException.Kind.DEFINITION));
    }

    @Test
    void contextObjectsAvoidCriticalShapes() {
        DefinitionSelector s = selector(8);
        for (int i = 0; i < 30; i++) {
            ObjectDefinition d = s.chooseContextDefinition(Set.of("ball", "car"));
            assertThat(d.lastShape()).isNotIn("ball", "car");
            assertThat(d.novelty).isEmpty();
        }
    }
}
