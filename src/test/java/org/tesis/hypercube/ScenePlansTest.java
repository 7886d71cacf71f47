package org.tesis.hypercube;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenePlansTest {

    private final Catalog catalog = Catalog.getDefault();

    @Test
    void containerFamilyHasTwoScenesPerCell() {
        List<ScenePlan> plans = ScenePlans.container(catalog);

        assertThat(plans).hasSize(36);
        assertThat(plans).extracting(p -> p.id).isSorted();
        assertThat(plans.get(0).id).isEqualTo("a1");
        assertThat(plans).allMatch(p -> p.target.definition == catalog.definition("soccer_ball"));
        assertThat(plans).allMatch(p -> p.largeContainers.size() == 3 && p.smallContainers.size() == 2);
    }

    @Test
    void firstContainerCellTags() {
        ScenePlan a1 = ScenePlans.container(catalog).get(0);

        assertThat(a1.sliceTags).containsEntry(ScenePlans.CONTAINERS_LARGE, "three")
                .containsEntry(ScenePlans.CONTAINERS_SMALL, "zero")
                .containsEntry(ScenePlans.CONTAINERS_TRAINED, "yes")
                .containsEntry(ScenePlans.TARGET_INSIDE, "yes");
        assertThat(a1.target.location).isEqualTo(LocationPlan.INSIDE);
        assertThat(a1.isEvaluationOnly()).isFalse();
    }

    @Test
    void secondSceneOfEachCellIsUntrained() {
        List<ScenePlan> plans = ScenePlans.container(catalog);
        ScenePlan d2 = plans.stream().filter(p -> p.id.equals("d2")).findFirst().orElseThrow();

        assertThat(d2.isEvaluationOnly()).isTrue();
        assertThat(d2.largeContainers).allMatch(p -> p.untrained);
        assertThat(d2.target.location).isEqualTo(LocationPlan.CLOSE);
        assertThat(d2.sliceTags).containsEntry(ScenePlans.CONTAINERS_TRAINED, "no")
                .containsEntry(ScenePlans.TARGET_INSIDE, "no");
    }

    @Test
    void reducedContainerFamilyHasNoSmallContainers() {
        List<ScenePlan> plans = ScenePlans.eval4Container(catalog);

        assertThat(plans).hasSize(12);
        assertThat(plans).allMatch(p -> p.smallContainers.isEmpty());
    }

    @Test
    void obstacleFamily() {
        List<ScenePlan> plans = ScenePlans.obstacle(catalog);

        assertThat(plans).hasSize(8);
        ScenePlan a1 = plans.get(0);
        assertThat(a1.target.location).isEqualTo(LocationPlan.BACK);
        assertThat(a1.obstacles.get(0).location).isEqualTo(LocationPlan.BETWEEN);
        ScenePlan d2 = plans.get(7);
        assertThat(d2.id).isEqualTo("d2");
        assertThat(d2.target.location).isEqualTo(LocationPlan.FRONT);
        assertThat(d2.obstacles.get(0).location).isEqualTo(LocationPlan.CLOSE);
        assertThat(d2.obstacles.get(0).untrained).isTrue();
    }

    @Test
    void occluderFamily() {
        List<ScenePlan> plans = ScenePlans.occluder(catalog);

        assertThat(plans).hasSize(24);
        assertThat(plans.get(0).sliceTags).containsEntry(ScenePlans.OCCLUDERS, "three");
        assertThat(plans.get(0).occluders).extracting(p -> p.location)
                .containsExactly(LocationPlan.BETWEEN, LocationPlan.RANDOM, LocationPlan.RANDOM);
        ScenePlan l1 = plans.get(22);
        assertThat(l1.id).isEqualTo("l1");
        assertThat(l1.sliceTags).containsEntry(ScenePlans.OCCLUDERS, "one")
                .containsEntry(ScenePlans.TARGET_HIDDEN, "no");
    }

    @Test
    void singleScene() {
        List<ScenePlan> plans = ScenePlans.single(catalog);

        assertThat(plans).hasSize(1);
        assertThat(plans.get(0).target.location).isEqualTo(LocationPlan.RANDOM);
        assertThat(plans.get(0).objectPlans()).hasSize(1);
    }

    @Test
    void planNeedsAnIdAndATarget() {
        assertThatThrownBy(() -> ScenePlan.builder(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScenePlan.builder("a1").target(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sliceLabelsSplitCamelCase() {
        assertThat(Scene.tagToLabel("largeContainers")).isEqualTo("large containers");
        assertThat(Scene.tagToLabel("targetInside")).isEqualTo("target inside");
    }
}
