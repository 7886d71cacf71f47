package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/* Rectángulos ya validados del intento actual; solo se agregan, se vacía al reintentar. */
public final class BoundsRegistry {
    private final List<BoundsRect> rects = new ArrayList<>();

    public BoundsRegistry() {}

    private BoundsRegistry(List<BoundsRect> rects) {
        this.rects.addAll(rects);
    }

    public void add(BoundsRect rect) {
        rects.add(rect);
    }

    public void addAll(List<BoundsRect> more) {
        rects.addAll(more);
    }

    public List<BoundsRect> list() {
        return Collections.unmodifiableList(rects);
    }

    public int size() { return rects.size(); }

    public void clear() { rects.clear(); }

    // copia independiente para probar ubicaciones sin tocar este registro
    public BoundsRegistry copy() {
        return new BoundsRegistry(rects);
    }

    public boolean overlapsAny(BoundsRect candidate) {
        for (BoundsRect r : rects) {
            if (GeomUtils.overlaps(candidate, r)) return true;
        }
        return false;
    }

    @Override public String toString() {
        return "BoundsRegistry[" + rects.size() + "]";
    }
}
