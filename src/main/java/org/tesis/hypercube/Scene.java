package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/*
 * Una escena terminada: metadatos de la sala y del performer, la meta y la lista plana
 * de instancias con su rol. Los objetos contenidos tienen posición relativa a su contenedor.
 */
public final class Scene {

    final String id;
    final String name;
    final String hypercubeId;
    final boolean evaluationOnly;
    final Map<String, String> sliceTags;
    final String goalDescription;
    final String targetId;
    final Vec3 roomDimensions;
    final PerformerStart performerStart;
    Material floor;
    Material wall;
    final List<ObjectInstance> objects;

    Scene(String id, String name, String hypercubeId, boolean evaluationOnly, Map<String, String> sliceTags,
          String goalDescription, String targetId, Vec3 roomDimensions, PerformerStart performerStart,
          Material floor, Material wall, List<ObjectInstance> objects) {
        this.id = id;
        this.name = name;
        this.hypercubeId = hypercubeId;
        this.evaluationOnly = evaluationOnly;
        this.sliceTags = Collections.unmodifiableMap(new LinkedHashMap<>(sliceTags));
        this.goalDescription = goalDescription;
        this.targetId = targetId;
        this.roomDimensions = roomDimensions;
        this.performerStart = performerStart;
        this.floor = floor;
        this.wall = wall;
        this.objects = List.copyOf(objects);
    }

    public String id() { return id; }
    public String name() { return name; }
    public String hypercubeId() { return hypercubeId; }
    public boolean isEvaluationOnly() { return evaluationOnly; }
    public Map<String, String> sliceTags() { return sliceTags; }
    public String goalDescription() { return goalDescription; }
    public String targetId() { return targetId; }
    public Vec3 roomDimensions() { return roomDimensions; }
    public PerformerStart performerStart() { return performerStart; }
    public Material floor() { return floor; }
    public Material wall() { return wall; }
    public List<ObjectInstance> objects() { return objects; }

    // "largeContainers" + "three" => "large containers three"
    public List<String> slices() {
        List<String> out = new ArrayList<>();
        sliceTags.forEach((tag, value) -> out.add(tagToLabel(tag) + " " + value));
        return out;
    }

    static String tagToLabel(String tag) {
        return tag.replaceAll("([a-z])([A-Z])", "$1 $2").toLowerCase(Locale.ROOT);
    }

    public List<ObjectInstance> objects(Role role) {
        return objects.stream().filter(o -> o.role == role).toList();
    }

    public ObjectInstance target() {
        for (ObjectInstance o : objects) {
            if (o.id.equals(targetId)) return o;
        }
        return null;
    }

    public ObjectInstance object(String id) {
        for (ObjectInstance o : objects) {
            if (o.id.equals(id)) return o;
        }
        return null;
    }

    @Override public String toString() {
        return "Scene[" + name + " objects=" + objects.size() + (evaluationOnly ? " eval" : "") + "]";
    }
}
