package org.tesis.hypercube;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/* Fila del CSV de definiciones. */
public class DefinitionRow {
    String entityType;   // DEF | MATERIAL | SIZE | TYPE | AREA | SIDEWAYS | CLOSED
    String entityId;
    Integer choiceIdx;   // MATERIAL/SIZE/TYPE y AREA de un tamaño

    String group;        // DEF
    List<String> lists; // DEF
    String type;
    List<String> shape;
    String size;
    Double mass;
    Double dimX, dimY, dimZ;
    Double offX, offY, offZ;
    Double posX, posY, posZ;     // AREA
    Double positionY;
    Double rotX, rotY, rotZ;
    List<String> attributes;
    List<String> materialCategory;
    List<String> colors;
    List<String> novelty;

    static DefinitionRow fromCsv(String[] h, String[] v) {
        DefinitionRow r = new DefinitionRow();
        r.entityType = get(v, idx(h, "entity_type")).toUpperCase(Locale.ROOT);
        r.entityId   = get(v, idx(h, "entity_id"));
        r.choiceIdx  = parseNullableInt(getOpt(v, h, "choice_idx"));

        r.group            = getOpt(v, h, "group");
        r.lists            = parseList(getOpt(v, h, "lists"));
        r.type             = emptyToNull(getOpt(v, h, "type"));
        r.shape            = parseList(getOpt(v, h, "shape"));
        r.size             = emptyToNull(getOpt(v, h, "size"));
        r.mass             = parseNullableDouble(getOpt(v, h, "mass"));
        r.dimX             = parseNullableDouble(getOpt(v, h, "dim_x"));
        r.dimY             = parseNullableDouble(getOpt(v, h, "dim_y"));
        r.dimZ             = parseNullableDouble(getOpt(v, h, "dim_z"));
        r.offX             = parseNullableDouble(getOpt(v, h, "off_x"));
        r.offY             = parseNullableDouble(getOpt(v, h, "off_y"));
        r.offZ             = parseNullableDouble(getOpt(v, h, "off_z"));
        r.posX             = parseNullableDouble(getOpt(v, h, "pos_x"));
        r.posY             = parseNullableDouble(getOpt(v, h, "pos_y"));
        r.posZ             = parseNullableDouble(getOpt(v, h, "pos_z"));
        r.positionY        = parseNullableDouble(getOpt(v, h, "position_y"));
        r.rotX             = parseNullableDouble(getOpt(v, h, "rot_x"));
        r.rotY             = parseNullableDouble(getOpt(v, h, "rot_y"));
        r.rotZ             = parseNullableDouble(getOpt(v, h, "rot_z"));
        r.attributes       = parseList(getOpt(v, h, "attributes"));
        r.materialCategory = parseList(getOpt(v, h, "material_category"));
        r.colors           = parseList(getOpt(v, h, "colors"));
        r.novelty          = parseList(getOpt(v, h, "novelty"));
        return r;
    }

    // vector (x, y, z) si hay al menos un componente; los faltantes valen 0
    static Vec3 vec(Double x, Double y, Double z) {
        if (x == null && y == null && z == null) return null;
        return new Vec3(x == null ? 0 : x, y == null ? 0 : y, z == null ? 0 : z);
    }

    Vec3 dimensions() { return vec(dimX, dimY, dimZ); }
    Vec3 offset()     { return vec(offX, offY, offZ); }
    Vec3 position()   { return vec(posX, posY, posZ); }
    Vec3 rotation()   { return vec(rotX, rotY, rotZ); }

    // ------------- helpers CSV -------------
    static String[] splitCsv(String s) {
        String[] raw = s.split(",", -1);
        for (int i=0;i<raw.length;i++) raw[i] = raw[i].trim();
        return raw;
    }
    static int idx(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].equalsIgnoreCase(name)) return i;
        throw new IllegalArgumentException("Cabecera CSV faltante: " + name);
    }
    static int idxOpt(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].equalsIgnoreCase(name)) return i;
        return -1;
    }
    static String get(String[] v, int idx) {
        if (idx < 0 || idx >= v.length) return "";
        return v[idx];
    }
    static String getOpt(String[] v, String[] h, String name) {
        int i = idxOpt(h, name);
        return i == -1 ? "" : get(v, i);
    }

    // lista separada por '|'
    static List<String> parseList(String s) {
        if (s == null || s.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        for (String p : Arrays.asList(s.split("\\|"))) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
    static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
    static Integer parseNullableInt(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Integer.parseInt(s); } catch (NumberFormatException e) { return null; }
    }
    static Double parseNullableDouble(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Double.parseDouble(s); } catch (NumberFormatException e) { return null; }
    }
}
