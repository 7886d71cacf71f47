package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Plan de una escena de la familia: un plan por rol (el objetivo y a lo sumo un confusor)
 * más las listas de contenedores grandes/chicos, obstáculos y oclusores, y los tags de slice.
 */
public final class ScenePlan {

    final String id;
    final ObjectPlan target;
    final ObjectPlan confusor;                  // null => la familia no tiene confusor
    final List<ObjectPlan> largeContainers;
    final List<ObjectPlan> smallContainers;
    final List<ObjectPlan> obstacles;
    final List<ObjectPlan> occluders;
    final Map<String, String> sliceTags;

    private ScenePlan(Builder b) {
        this.id = b.id;
        this.target = b.target;
        this.confusor = b.confusor;
        this.largeContainers = List.copyOf(b.largeContainers);
        this.smallContainers = List.copyOf(b.smallContainers);
        this.obstacles = List.copyOf(b.obstacles);
        this.occluders = List.copyOf(b.occluders);
        this.sliceTags = Collections.unmodifiableMap(new LinkedHashMap<>(b.sliceTags));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() { return id; }
    public ObjectPlan target() { return target; }
    public ObjectPlan confusor() { return confusor; }
    public List<ObjectPlan> largeContainers() { return largeContainers; }
    public List<ObjectPlan> smallContainers() { return smallContainers; }
    public List<ObjectPlan> obstacles() { return obstacles; }
    public List<ObjectPlan> occluders() { return occluders; }
    public Map<String, String> sliceTags() { return sliceTags; }

    // todos los planes de objetos de la escena
    List<ObjectPlan> objectPlans() {
        List<ObjectPlan> all = new ArrayList<>();
        all.add(target);
        if (confusor != null) all.add(confusor);
        all.addAll(largeContainers);
        all.addAll(smallContainers);
        all.addAll(obstacles);
        all.addAll(occluders);
        return all;
    }

    // solo para evaluación si algún plan pide la variante no entrenada
    public boolean isEvaluationOnly() {
        for (ObjectPlan p : objectPlans()) {
            if (p.untrained) return true;
        }
        return false;
    }

    @Override public String toString() {
        return "ScenePlan[" + id + " target=" + target + (confusor != null ? " confusor=" + confusor : "")
                + " large=" + largeContainers + " small=" + smallContainers
                + " obstacles=" + obstacles + " occluders=" + occluders + "]";
    }

    public static final class Builder {
        final String id;
        ObjectPlan target = ObjectPlan.of(LocationPlan.RANDOM);
        ObjectPlan confusor;
        final List<ObjectPlan> largeContainers = new ArrayList<>();
        final List<ObjectPlan> smallContainers = new ArrayList<>();
        final List<ObjectPlan> obstacles = new ArrayList<>();
        final List<ObjectPlan> occluders = new ArrayList<>();
        final Map<String, String> sliceTags = new LinkedHashMap<>();

        Builder(String id) {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("La escena necesita un id");
            this.id = id;
        }

        public Builder target(ObjectPlan p) { this.target = p; return this; }
        public Builder confusor(ObjectPlan p) { this.confusor = p; return this; }
        public Builder largeContainer(ObjectPlan p) { largeContainers.add(p); return this; }
        public Builder smallContainer(ObjectPlan p) { smallContainers.add(p); return this; }
        public Builder obstacle(ObjectPlan p) { obstacles.add(p); return this; }
        public Builder occluder(ObjectPlan p) { occluders.add(p); return this; }
        public Builder tag(String key, String value) { sliceTags.put(key, value); return this; }

        public ScenePlan build() {
            if (target == null) throw new IllegalArgumentException("La escena " + id + " no tiene objetivo");
            return new ScenePlan(this);
        }
    }
}
