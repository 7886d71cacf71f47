package org.tesis.hypercube;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PlacementSearchTest {

    private static final ObjectDefinition BALL = new ObjectDefinition.Builder()
            .type("ball").dimensions(0.22, 0.22, 0.22).positionY(0.11).build();
    private static final ObjectDefinition SOFA = new ObjectDefinition.Builder()
            .type("sofa").mass(33).dimensions(1.98, 1.15, 1.23).build();

    private static PlacementSearch search(long seed) {
        return new PlacementSearch(Room.DEFAULT, new Random(seed));
    }

    @Test
    void randomLocationIsInsideTheRoomAndAwayFromOthers() {
        PlacementSearch s = search(11);
        BoundsRegistry registry = new BoundsRegistry();
        Vec3 performer = new Vec3(0, 0, 0);

        for (int i = 0; i < 10; i++) {
            BoundsRegistry before = registry.copy();
            Location loc = s.randomLocation(SOFA, performer, registry);
            assertThat(loc).isNotNull();
            assertThat(Room.DEFAULT.withinRoom(loc.bounds)).isTrue();
            assertThat(GeomUtils.overlaps(loc.bounds, GeomUtils.performerRect(performer))).isFalse();
            assertThat(before.overlapsAny(loc.bounds)).isFalse();
            assertThat(registry.size()).isEqualTo(before.size() + 1);
        }
    }

    @Test
    void sameSeedGivesSameLocation() {
        Location a = search(99).randomLocation(BALL, Vec3.ZERO, new BoundsRegistry());
        Location b = search(99).randomLocation(BALL, Vec3.ZERO, new BoundsRegistry());

        assertThat(a).isEqualTo(b);
    }

    @Test
    void failedSearchLeavesRegistryUntouched() {
        ObjectDefinition huge = new ObjectDefinition.Builder().type("huge").dimensions(20, 1, 20).build();
        BoundsRegistry registry = new BoundsRegistry();

        assertThat(search(1).randomLocation(huge, Vec3.ZERO, registry)).isNull();
        assertThat(registry.size()).isZero();
    }

    @Test
    void denseRegistryExhaustsTheTries() {
        // baldosas de 1 x 1 cada 0.9 cubren toda la sala
        BoundsRegistry registry = new BoundsRegistry();
        for (double x = -5; x <= 5; x += 0.9) {
            for (double z = -5; z <= 5; z += 0.9) {
                registry.add(GeomUtils.rectangleCorners(x, z, 0.5, 0.5, 0, 0, 0));
            }
        }
        int before = registry.size();
        int[] samples = { 0 };
        PlacementSearch s = search(2);

        Location loc = s.calcObjectPosition(BALL, List.of(), new Vec3(0, 0, -20), registry, () -> {
            samples[0]++;
            return new double[]{ Room.DEFAULT.randomX(s.rnd), Room.DEFAULT.randomZ(s.rnd) };
        }, null);

        assertThat(loc).isNull();
        assertThat(samples[0]).isEqualTo(PlacementSearch.MAX_TRIES);
        assertThat(registry.size()).isEqualTo(before);
        assertThat(s.randomLocation(BALL, Vec3.ZERO, registry)).isNull();
    }

    @Test
    void everyVariantFitsAtTheChosenLocation() {
        ObjectDefinition chair = new ObjectDefinition.Builder().type("chair").mass(20).dimensions(1.2, 1, 1.1).build();
        ObjectDefinition longSofa = new ObjectDefinition.Builder().type("sofa").mass(40).dimensions(2.1, 1, 1.0).build();
        PlacementSearch s = search(14);
        BoundsRegistry registry = new BoundsRegistry();
        Vec3 performer = new Vec3(0, 0, 0);

        for (int i = 0; i < 5; i++) {
            Location loc = s.randomLocation(chair, List.of(chair, longSofa), performer, registry, null);
            assertThat(loc).isNotNull();
            BoundsRect sofaRect = longSofa.placementBounds(loc.position, loc.rotation.y);
            BoundsRegistry before = registry.copy();
            assertThat(Room.DEFAULT.withinRoom(sofaRect)).isTrue();
            assertThat(GeomUtils.overlaps(sofaRect, GeomUtils.performerRect(performer))).isFalse();
            // el registro recibe solo el rectángulo principal; la variante se agrega a mano
            registry.add(sofaRect);
            assertThat(before.list().subList(0, before.size() - 1))
                    .noneMatch(r -> GeomUtils.overlaps(r, sofaRect));
        }
    }

    @Test
    void inLineRejectsAStepWhereAVariantCollides() {
        ObjectDefinition narrow = new ObjectDefinition.Builder().type("narrow").mass(10).dimensions(0.4, 1, 0.4).build();
        ObjectDefinition wide = new ObjectDefinition.Builder().type("wide").mass(10).dimensions(2.4, 1, 0.4).build();
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, -3), 0);
        Location anchor = new Location(new Vec3(0, 0.11, 2), Vec3.ZERO,
                BALL.placementBounds(new Vec3(0, 0.11, 2), 0));
        BoundsRegistry registry = new BoundsRegistry();
        // postes a los costados de la pelota
        registry.add(GeomUtils.rectangleCorners(1.5, 2, 0.5, 2, 0, 0, 0));
        registry.add(GeomUtils.rectangleCorners(-1.5, 2, 0.5, 2, 0, 0, 0));

        Location loc = search(4).inLineWithObject(narrow, List.of(wide), BALL, anchor, performer, registry,
                PlacementSearch.InLine.BEHIND);

        // la variante ancha pisa los postes en todos los pasos detrás de la pelota
        assertThat(loc).isNull();
        assertThat(registry.size()).isEqualTo(2);
        assertThat(search(4).inLineWithObject(narrow, BALL, anchor, performer, registry,
                PlacementSearch.InLine.BEHIND)).isNotNull();
    }

    @Test
    void rectangleValidation() {
        PlacementSearch s = search(1);
        Vec3 performer = new Vec3(0, 0, 0);

        BoundsRect outside = GeomUtils.rectangleCorners(4.9, 0, 0.5, 0.5, 0, 0, 0);
        BoundsRect onPerformer = GeomUtils.rectangleCorners(0.3, 0, 0.2, 0.2, 0, 0, 0);
        BoundsRect free = GeomUtils.rectangleCorners(2, 2, 0.2, 0.2, 0, 0, 0);

        assertThat(s.validateLocationRect(outside, performer, java.util.List.of())).isFalse();
        assertThat(s.validateLocationRect(onPerformer, performer, java.util.List.of())).isFalse();
        assertThat(s.validateLocationRect(free, performer, java.util.List.of())).isTrue();
        assertThat(s.validateLocationRect(free, performer, java.util.List.of(free))).isFalse();
    }

    @Test
    void frontIsAheadOfThePerformer() {
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, -3), 0);
        Location loc = search(5).inFrontOfPerformer(performer, BALL, new BoundsRegistry(), () -> 0);

        assertThat(loc).isNotNull();
        assertThat(loc.position.x).isCloseTo(0.0, within(1e-6));
        assertThat(loc.position.z - performer.position.z)
                .isGreaterThanOrEqualTo(PlacementSearch.MIN_FORWARD_VISIBILITY_DISTANCE - 1e-6);
    }

    @Test
    void frontFollowsThePerformerRotation() {
        // mirando a +x
        PerformerStart performer = new PerformerStart(new Vec3(-3, 0, 0), 90);
        Location loc = search(5).inFrontOfPerformer(performer, BALL, new BoundsRegistry(), () -> 90);

        assertThat(loc).isNotNull();
        assertThat(loc.position.z).isCloseTo(0.0, within(1e-6));
        assertThat(loc.position.x).isGreaterThan(performer.position.x + 1.0);
        assertThat(loc.rotation.y).isEqualTo(90.0);
    }

    @Test
    void backIsBehindThePerformer() {
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, 1), 0);
        Location loc = search(8).inBackOfPerformer(performer, BALL, new BoundsRegistry(), () -> 0);

        assertThat(loc).isNotNull();
        assertThat(loc.position.z).isLessThanOrEqualTo(performer.position.z - PlacementSearch.REAR_CLEARANCE);
    }

    @Test
    void noBackWhenThePerformerIsAgainstTheWall() {
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, Room.DEFAULT.minZ), 0);

        assertThat(search(8).inBackOfPerformer(performer, BALL, new BoundsRegistry(), () -> 0)).isNull();
    }

    @Test
    void obstructingObjectHidesTheAnchor() {
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, -3), 0);
        Location anchor = new Location(new Vec3(0, 0.11, 2), Vec3.ZERO,
                GeomUtils.objectBounds(BALL.dimensions, BALL.offset, new Vec3(0, 0.11, 2), 0));

        Location loc = search(3).inLineWithObject(SOFA, BALL, anchor, performer, new BoundsRegistry(),
                PlacementSearch.InLine.OBSTRUCT);

        assertThat(loc).isNotNull();
        assertThat(loc.position.z).isBetween(performer.position.z, anchor.position.z);
        assertThat(Visibility.fullyObstructs(performer.position, anchor.bounds, loc.bounds.toPolygon())).isTrue();
        assertThat(GeomUtils.polygonDistance(loc.bounds, anchor.bounds))
                .isLessThanOrEqualTo(PlacementSearch.MAX_REACH_DISTANCE);
    }

    @Test
    void unreachableKeepsTheAnchorOutOfReach() {
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, -4), 0);
        Location anchor = new Location(new Vec3(0, 0.11, 3), Vec3.ZERO,
                GeomUtils.objectBounds(BALL.dimensions, BALL.offset, new Vec3(0, 0.11, 3), 0));

        Location loc = search(3).inLineWithObject(SOFA, BALL, anchor, performer, new BoundsRegistry(),
                PlacementSearch.InLine.UNREACHABLE);

        assertThat(loc).isNotNull();
        double reach = GeomUtils.polygonDistance(loc.bounds, anchor.bounds) + Math.min(1.98, 1.23) / 2.0;
        assertThat(reach).isGreaterThan(PlacementSearch.MAX_REACH_DISTANCE);
    }

    @Test
    void closeAnchorCannotBeBlocked() {
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, 0), 0);
        Location anchor = new Location(new Vec3(0, 0.11, 1), Vec3.ZERO,
                GeomUtils.objectBounds(BALL.dimensions, BALL.offset, new Vec3(0, 0.11, 1), 0));

        assertThat(search(3).inLineWithObject(SOFA, BALL, anchor, performer, new BoundsRegistry(),
                PlacementSearch.InLine.OBSTRUCT)).isNull();
    }

    @Test
    void behindIsFartherFromThePerformerThanTheAnchor() {
        PerformerStart performer = new PerformerStart(new Vec3(0, 0, -3), 0);
        Location anchor = new Location(new Vec3(0, 0.11, 0), Vec3.ZERO,
                GeomUtils.objectBounds(BALL.dimensions, BALL.offset, new Vec3(0, 0.11, 0), 0));

        Location loc = search(4).inLineWithObject(SOFA, BALL, anchor, performer, new BoundsRegistry(),
                PlacementSearch.InLine.BEHIND);

        assertThat(loc).isNotNull();
        assertThat(loc.position.z).isGreaterThan(anchor.position.z);
        assertThat(GeomUtils.overlaps(loc.bounds, anchor.bounds)).isFalse();
    }

    @Test
    void farFromKeepsTheSeparation() {
        PlacementSearch s = search(21);
        Location existing = s.randomLocation(BALL, new Vec3(3, 0, 3), new BoundsRegistry());
        Location far = s.farFrom(BALL, existing, new Vec3(3, 0, 3), new BoundsRegistry());

        assertThat(far).isNotNull();
        assertThat(GeomUtils.polygonDistance(existing.bounds, far.bounds))
                .isGreaterThan(PlacementSearch.MIN_OBJECTS_SEPARATION_DISTANCE);
    }

    @Test
    void normalizesDegrees() {
        assertThat(PlacementSearch.normalizeDegrees(450)).isEqualTo(90.0);
        assertThat(PlacementSearch.normalizeDegrees(-90)).isEqualTo(270.0);
        assertThat(PlacementSearch.normalizeDegrees(360)).isEqualTo(0.0);
    }
}
