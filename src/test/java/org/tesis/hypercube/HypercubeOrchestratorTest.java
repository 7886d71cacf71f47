package org.tesis.hypercube;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HypercubeOrchestratorTest {

    private final Catalog catalog = Catalog.getDefault();
    private final ObjectDefinition soccerBall = catalog.definition("soccer_ball");

    private HypercubeResult generate(List<ScenePlan> plans, long seed) {
        return orchestrator(plans, seed).generate();
    }

    private HypercubeOrchestrator orchestrator(List<ScenePlan> plans, long seed) {
        return new HypercubeOrchestrator("test", plans, catalog, RoomTemplate.defaults(catalog),
                new Random(seed), SceneLog.silent());
    }

    private ObjectPlan target(LocationPlan location) {
        return ObjectPlan.of(location, soccerBall);
    }

    private static List<Scene> committed(HypercubeResult result) {
        assertThat(result.cause()).as("causa de la falla").isNull();
        assertThat(result.isCommitted()).isTrue();
        return result.scenes();
    }

    private static ObjectInstance only(Scene scene, Role role) {
        List<ObjectInstance> objects = scene.objects(role);
        assertThat(objects).hasSize(1);
        return objects.get(0);
    }

    @Test
    void singleSceneHasAPlacedTarget() {
        List<Scene> scenes = committed(generate(ScenePlans.single(catalog), 1));

        assertThat(scenes).hasSize(1);
        Scene scene = scenes.get(0);
        ObjectInstance t = scene.target();
        assertThat(t).isNotNull();
        assertThat(t.role).isEqualTo(Role.TARGET);
        assertThat(Room.DEFAULT.withinRoom(t.bounds)).isTrue();
        assertThat(scene.goalDescription).isEqualTo("Find and pick up the small white black ball.");
        assertThat(scene.name).isEqualTo("test_A1");
        assertThat(scene.hypercubeId).startsWith("test_A1_");
        assertThat(scene.isEvaluationOnly()).isFalse();
    }

    @Test
    void sameSeedSameHypercube() {
        Scene a = committed(generate(ScenePlans.single(catalog), 17)).get(0);
        Scene b = committed(generate(ScenePlans.single(catalog), 17)).get(0);

        assertThat(a.hypercubeId).isEqualTo(b.hypercubeId);
        assertThat(a.performerStart.position).isEqualTo(b.performerStart.position);
        assertThat(a.objects).extracting(o -> o.id).isEqualTo(b.objects.stream().map(o -> o.id).toList());
        assertThat(a.target().position).isEqualTo(b.target().position);
    }

    @Test
    void scenesSharingAPlanShareTheLocation() {
        List<ScenePlan> plans = List.of(
                ScenePlan.builder("a1").target(target(LocationPlan.CLOSE))
                        .largeContainer(ObjectPlan.of(LocationPlan.RANDOM)).build(),
                ScenePlan.builder("b1").target(target(LocationPlan.CLOSE))
                        .largeContainer(ObjectPlan.of(LocationPlan.RANDOM)).build());

        List<Scene> scenes = committed(generate(plans, 5));

        ObjectInstance t0 = scenes.get(0).target();
        ObjectInstance t1 = scenes.get(1).target();
        assertThat(t0.id).isEqualTo(t1.id);
        assertThat(t0.position).isEqualTo(t1.position);
        assertThat(t0.bounds).isEqualTo(t1.bounds);
        ObjectInstance c0 = only(scenes.get(0), Role.CONTAINER);
        assertThat(GeomUtils.overlaps(t0.bounds, c0.bounds)).isFalse();
    }

    @Test
    void closeAndFarScenesDiffer() {
        List<ScenePlan> plans = List.of(
                ScenePlan.builder("a1").target(target(LocationPlan.CLOSE))
                        .largeContainer(ObjectPlan.of(LocationPlan.RANDOM)).build(),
                ScenePlan.builder("b1").target(target(LocationPlan.FAR))
                        .largeContainer(ObjectPlan.of(LocationPlan.RANDOM)).build());

        List<Scene> scenes = committed(generate(plans, 9));

        ObjectInstance close = scenes.get(0).target();
        ObjectInstance far = scenes.get(1).target();
        ObjectInstance container = only(scenes.get(1), Role.CONTAINER);
        assertThat(close.position).isNotEqualTo(far.position);
        assertThat(GeomUtils.polygonDistance(far.bounds, container.bounds))
                .isGreaterThan(PlacementSearch.MIN_OBJECTS_SEPARATION_DISTANCE);
        assertThat(GeomUtils.overlaps(close.bounds, far.bounds)).isFalse();
    }

    @Test
    void targetInsideTheContainer() {
        List<ScenePlan> plans = List.of(
                ScenePlan.builder("a1").target(target(LocationPlan.INSIDE))
                        .largeContainer(ObjectPlan.of(LocationPlan.RANDOM)).build(),
                ScenePlan.builder("a2").target(target(LocationPlan.INSIDE))
                        .largeContainer(ObjectPlan.untrained(LocationPlan.RANDOM)).build());

        List<Scene> scenes = committed(generate(plans, 23));

        for (Scene scene : scenes) {
            ObjectInstance t = scene.target();
            ObjectInstance container = only(scene, Role.CONTAINER);
            assertThat(t.locationParent).isEqualTo(container.id);
            assertThat(t.parentArea).isNotNull();
            assertThat(container.isParentOf).containsExactly(t.id);
            assertThat(container.canContainTarget).isTrue();
        }
        ObjectInstance trained = only(scenes.get(0), Role.CONTAINER);
        ObjectInstance untrained = only(scenes.get(1), Role.CONTAINER);
        assertThat(trained.id).isEqualTo(untrained.id);
        assertThat(trained.definition.isUntrained()).isFalse();
        assertThat(untrained.definition.isUntrained()).isTrue();
        assertThat(scenes.get(0).isEvaluationOnly()).isFalse();
        assertThat(scenes.get(1).isEvaluationOnly()).isTrue();
    }

    @Test
    void occluderHidesTheTarget() {
        List<ScenePlan> plans = List.of(
                ScenePlan.builder("a1").target(target(LocationPlan.RANDOM))
                        .occluder(ObjectPlan.of(LocationPlan.BETWEEN)).build());

        Scene scene = committed(generate(plans, 31)).get(0);

        ObjectInstance occluder = only(scene, Role.OCCLUDER);
        ObjectInstance t = scene.target();
        assertThat(Visibility.fullyObstructs(scene.performerStart.position, t.bounds, occluder.bounds.toPolygon()))
                .isTrue();
        assertThat(GeomUtils.overlaps(occluder.bounds, t.bounds)).isFalse();
    }

    @Test
    void contextObjectsAreSharedAndNeverHideCriticalObjects() {
        List<ScenePlan> plans = List.of(
                ScenePlan.builder("a1").target(target(LocationPlan.RANDOM)).build(),
                ScenePlan.builder("b1").target(target(LocationPlan.RANDOM)).build());

        for (long seed = 40; seed < 45; seed++) {
            List<Scene> scenes = committed(generate(plans, seed));
            List<ObjectInstance> context0 = scenes.get(0).objects(Role.CONTEXT);
            List<ObjectInstance> context1 = scenes.get(1).objects(Role.CONTEXT);

            assertThat(context0).hasSizeBetween(0, 10);
            assertThat(context0).extracting(o -> o.id)
                    .isEqualTo(context1.stream().map(o -> o.id).toList());
            for (ObjectInstance o : context0) {
                assertThat(o.definition.lastShape()).isNotEqualTo("ball");
                assertThat(Visibility.fullyObstructs(scenes.get(0).performerStart.position,
                        scenes.get(0).target().bounds, o.bounds.toPolygon())).isFalse();
            }
        }
    }

    @Test
    void roomMaterialsAvoidObjectColors() {
        List<Scene> scenes = committed(generate(ScenePlans.single(catalog), 3));

        Set<String> colors = new HashSet<>();
        for (Scene s : scenes) {
            for (ObjectInstance o : s.objects) {
                if (o.role != Role.CONTEXT) colors.addAll(o.definition.colors);
            }
        }
        for (Scene s : scenes) {
            assertThat(s.floor.colors).doesNotContainAnyElementsOf(colors);
            assertThat(s.wall.colors).doesNotContainAnyElementsOf(colors);
        }
    }

    @Test
    void objectsAreListedByRole() {
        List<ScenePlan> plans = List.of(
                ScenePlan.builder("a1").target(target(LocationPlan.INSIDE))
                        .largeContainer(ObjectPlan.of(LocationPlan.RANDOM))
                        .smallContainer(ObjectPlan.of(LocationPlan.RANDOM))
                        .obstacle(ObjectPlan.of(LocationPlan.RANDOM)).build());

        Scene scene = committed(generate(plans, 8)).get(0);

        List<Role> roles = new ArrayList<>();
        for (ObjectInstance o : scene.objects) {
            if (roles.isEmpty() || roles.get(roles.size() - 1) != o.role) roles.add(o.role);
        }
        roles.remove(Role.CONTEXT);
        assertThat(roles).containsExactly(Role.TARGET, Role.CONTAINER, Role.OBSTACLE);
        List<ObjectInstance> containers = scene.objects(Role.CONTAINER);
        assertThat(containers.get(0).canContainTarget).isTrue();
        assertThat(containers.get(1).canContainTarget).isFalse();
    }

    @Test
    void definitionFailureIsNotRetried() {
        ObjectDefinition huge = new ObjectDefinition.Builder().type("huge").dimensions(3, 3, 3)
                .attributes(Attribute.PICKUPABLE).build();
        List<ScenePlan> plans = List.of(ScenePlan.builder("a1")
                .target(ObjectPlan.of(LocationPlan.INSIDE, huge))
                .largeContainer(ObjectPlan.of(LocationPlan.RANDOM)).build());

        HypercubeResult result = generate(plans, 2);

        assertThat(result.isCommitted()).isFalse();
        assertThat(result.scenes()).isEmpty();
        assertThat(result.cause().kind()).isEqualTo(SceneException.Kind.DEFINITION);
        assertThatThrownBy(result::scenesOrThrow).isSameAs(result.cause());
    }

    @Test
    void rejectsUnsupportedPlans() {
        assertRejected(ScenePlan.builder("a1").target(target(LocationPlan.BETWEEN)).build());
        assertRejected(ScenePlan.builder("a1").target(target(LocationPlan.RANDOM))
                .largeContainer(ObjectPlan.of(LocationPlan.CLOSE)).build());
        assertRejected(ScenePlan.builder("a1").target(target(LocationPlan.RANDOM))
                .obstacle(ObjectPlan.of(LocationPlan.FRONT)).build());
        assertRejected(ScenePlan.builder("a1").target(target(LocationPlan.RANDOM))
                .confusor(ObjectPlan.of(LocationPlan.RANDOM)).build());
        assertRejected(ScenePlan.builder("a1").target(new ObjectPlan(LocationPlan.RANDOM, true, soccerBall)).build());
        assertRejected(ScenePlan.builder("a1").target(target(LocationPlan.CLOSE)).build());
    }

    @Test
    void rejectsScenesWithDifferentRoles() {
        List<ScenePlan> plans = List.of(
                ScenePlan.builder("a1").target(target(LocationPlan.RANDOM)).build(),
                ScenePlan.builder("b1").target(target(LocationPlan.RANDOM))
                        .obstacle(ObjectPlan.of(LocationPlan.RANDOM)).build());

        assertThatThrownBy(() -> orchestrator(plans, 1))
                .isInstanceOfSatisfying(SceneException.class,
                        e -> assertThat(e.kind()).isEqualTo(SceneException.Kind.DEFINITION));
    }

    private void assertRejected(ScenePlan plan) {
        assertThatThrownBy(() -> orchestrator(List.of(plan), 1))
                .isInstanceOfSatisfying(SceneException.class,
                        e -> assertThat(e.kind()).isEqualTo(SceneException.Kind.DEFINITION));
    }

    // ------------- invariantes de todas las familias -------------

    @Test
    void placedObjectsNeverOverlapInAnyFamily() {
        Map<String, Function<Catalog, List<ScenePlan>>> families = new LinkedHashMap<>();
        families.put("container", ScenePlans::container);
        families.put("eval4container", ScenePlans::eval4Container);
        families.put("obstacle", ScenePlans::obstacle);
        families.put("occluder", ScenePlans::occluder);
        families.put("single", ScenePlans::single);

        int committed = 0;
        for (Map.Entry<String, Function<Catalog, List<ScenePlan>>> family : families.entrySet()) {
            for (long seed = 0; seed < 15; seed++) {
                HypercubeResult result = new HypercubeOrchestrator(family.getKey(), family.getValue().apply(catalog),
                        catalog, RoomTemplate.defaults(catalog), new Random(seed), SceneLog.silent()).generate();
                if (!result.isCommitted()) continue;
                committed++;
                for (Scene scene : result.scenes()) {
                    assertConsistent(family.getKey() + " seed " + seed + " " + scene.id, scene);
                }
            }
        }
        assertThat(committed).isGreaterThan(0);
    }

    private static void assertConsistent(String label, Scene scene) {
        List<ObjectInstance> placed = new ArrayList<>();
        for (ObjectInstance o : scene.objects) {
            if (o.locationParent != null) {
                ObjectInstance parent = scene.object(o.locationParent);
                assertThat(parent).as("%s: contenedor de %s", label, o.id).isNotNull();
                assertThat(parent.isParentOf).as(label).contains(o.id);
                continue;
            }
            placed.add(o);
        }
        BoundsRect performer = GeomUtils.performerRect(scene.performerStart.position);
        for (int i = 0; i < placed.size(); i++) {
            ObjectInstance a = placed.get(i);
            assertThat(Room.DEFAULT.withinRoom(a.bounds)).as("%s: %s dentro de la sala", label, a).isTrue();
            assertThat(GeomUtils.overlaps(a.bounds, performer)).as("%s: %s sobre el performer", label, a).isFalse();
            for (int j = i + 1; j < placed.size(); j++) {
                ObjectInstance b = placed.get(j);
                assertThat(GeomUtils.overlaps(a.bounds, b.bounds))
                        .as("%s: %s (%s) pisa a %s (%s)", label, a.definition.type, a.role, b.definition.type, b.role)
                        .isFalse();
            }
        }
    }
}
