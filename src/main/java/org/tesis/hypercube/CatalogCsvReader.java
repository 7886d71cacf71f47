package org.tesis.hypercube;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

public class CatalogCsvReader {

    static final String DEFAULT_DEFINITIONS = "catalog/definitions.csv";
    static final String DEFAULT_MATERIALS   = "catalog/materials.csv";

    // catálogo empaquetado en el classpath
    public static Catalog readDefault() throws IOException {
        return read(open(DEFAULT_DEFINITIONS), open(DEFAULT_MATERIALS));
    }

    public static Catalog read(Path definitions, Path materials) throws IOException {
        return read(Files.newInputStream(definitions), Files.newInputStream(materials));
    }

    static Catalog read(InputStream definitions, InputStream materials) throws IOException {
        List<DefinitionRow> rows;
        Map<String, List<Material>> mats;
        try (Reader d = new InputStreamReader(definitions, StandardCharsets.UTF_8);
             Reader m = new InputStreamReader(materials, StandardCharsets.UTF_8)) {
            rows = readDefinitions(d);
            mats = readMaterials(m);
        }
        return buildCatalog(rows, mats);
    }

    private static InputStream open(String resource) throws IOException {
        InputStream in = CatalogCsvReader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) throw new FileNotFoundException("Recurso no encontrado: " + resource);
        return in;
    }

    // función para leer el CSV de definiciones y devolver sus filas
    static List<DefinitionRow> readDefinitions(Reader reader) throws IOException {
        List<DefinitionRow> out = new ArrayList<>();
        BufferedReader br = new BufferedReader(reader);
        String header = br.readLine();
        if (header == null) throw new IOException("CSV de definiciones vacío");
        String[] h = DefinitionRow.splitCsv(header);
        String line;
        while ((line = br.readLine()) != null) {
            if (line.trim().isEmpty() || line.startsWith("#")) continue;
            out.add(DefinitionRow.fromCsv(h, DefinitionRow.splitCsv(line)));
        }
        return out;
    }

    // categoría (en mayúsculas) -> materiales en orden de aparición
    static Map<String, List<Material>> readMaterials(Reader reader) throws IOException {
        Map<String, List<Material>> out = new LinkedHashMap<>();
        BufferedReader br = new BufferedReader(reader);
        String header = br.readLine();
        if (header == null) throw new IOException("CSV de materiales vacío");
        String[] h = DefinitionRow.splitCsv(header);
        int iCat = DefinitionRow.idx(h, "category");
        int iId = DefinitionRow.idx(h, "material_id");
        int iCol = DefinitionRow.idx(h, "colors");
        String line;
        while ((line = br.readLine()) != null) {
            if (line.trim().isEmpty() || line.startsWith("#")) continue;
            String[] v = DefinitionRow.splitCsv(line);
            String cat = DefinitionRow.get(v, iCat).toUpperCase(Locale.ROOT);
            Material m = new Material(DefinitionRow.get(v, iId), DefinitionRow.parseList(DefinitionRow.get(v, iCol)));
            out.computeIfAbsent(cat, k -> new ArrayList<>()).add(m);
        }
        return out;
    }

    // construye las definiciones a partir de las filas, agrupando por entity_id
    static Catalog buildCatalog(List<DefinitionRow> rows, Map<String, List<Material>> materials) {
        Map<String, List<DefinitionRow>> byId = rows.stream()
                .collect(Collectors.groupingBy(r -> r.entityId, LinkedHashMap::new, Collectors.toList()));

        Map<String, ObjectDefinition> definitions = new LinkedHashMap<>();
        Map<Catalog.DefinitionList, Map<String, List<ObjectDefinition>>> grouped = new EnumMap<>(Catalog.DefinitionList.class);

        for (Map.Entry<String, List<DefinitionRow>> e : byId.entrySet()) {
            String id = e.getKey();
            List<DefinitionRow> entityRows = e.getValue();
            DefinitionRow base = entityRows.stream()
                    .filter(r -> "DEF".equals(r.entityType))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Falta la fila DEF de " + id));

            ObjectDefinition.Builder b = new ObjectDefinition.Builder();
            b.type = base.type != null ? base.type : id;
            b.shape = base.shape;
            b.size = base.size;
            if (base.mass != null) b.mass = base.mass;
            b.dimensions = base.dimensions();
            if (base.offset() != null) b.offset = base.offset();
            if (base.positionY != null) b.positionY = base.positionY;
            if (base.rotation() != null) b.rotation = base.rotation();
            for (String a : base.attributes) b.attributes.add(Attribute.parse(a));
            for (String n : base.novelty) b.novelty.add(Novelty.parse(n));
            b.materialCategory = base.materialCategory;
            b.colors = base.colors;

            List<Choice> materialChoices = new ArrayList<>();
            List<Choice> sizeChoices = new ArrayList<>();
            List<Choice> typeChoices = new ArrayList<>();
            Map<Integer, List<EnclosedArea>> choiceAreas = new HashMap<>();
            List<EnclosedArea> baseAreas = new ArrayList<>();

            List<DefinitionRow> sorted = entityRows.stream()
                    .sorted(Comparator.comparingInt(r -> r.choiceIdx == null ? -1 : r.choiceIdx))
                    .toList();
            for (DefinitionRow r : sorted) {
                String t = r.entityType;
                if ("DEF".equals(t)) continue;
                if ("MATERIAL".equals(t)) materialChoices.add(toChoice(Choice.Kind.MATERIAL, r));
                else if ("SIZE".equals(t)) sizeChoices.add(toChoice(Choice.Kind.SIZE, r));
                else if ("TYPE".equals(t)) typeChoices.add(toChoice(Choice.Kind.TYPE, r));
                else if ("AREA".equals(t)) {
                    EnclosedArea area = new EnclosedArea(
                            r.position() == null ? Vec3.ZERO : r.position(), r.dimensions());
                    if (r.choiceIdx == null) baseAreas.add(area);
                    else choiceAreas.computeIfAbsent(r.choiceIdx, k -> new ArrayList<>()).add(area);
                } else if ("SIDEWAYS".equals(t)) {
                    b.sideways = new Pose(r.dimensions(), r.offset(),
                            r.positionY == null ? 0 : r.positionY, r.rotation());
                } else if ("CLOSED".equals(t)) {
                    b.closedDimensions = r.dimensions();
                    b.closedOffset = r.offset();
                } else {
                    throw new IllegalArgumentException("entity_type desconocido: " + t);
                }
            }
            // las áreas de un tamaño se asignan a la elección de ese tamaño
            for (int i = 0; i < sizeChoices.size(); i++) {
                List<EnclosedArea> areas = choiceAreas.get(i);
                if (areas != null) sizeChoices.get(i).enclosedAreas = List.copyOf(areas);
            }
            b.enclosedAreas = baseAreas;
            b.materialChoices = materialChoices;
            b.sizeChoices = sizeChoices;
            b.typeChoices = typeChoices;

            ObjectDefinition def = b.build();
            definitions.put(id, def);

            String group = base.group == null || base.group.isEmpty() ? id : base.group;
            for (String list : base.lists) {
                Catalog.DefinitionList dl = Catalog.DefinitionList.parse(list);
                grouped.computeIfAbsent(dl, k -> new LinkedHashMap<>())
                        .computeIfAbsent(group, k -> new ArrayList<>())
                        .add(def);
            }
        }

        if (definitions.isEmpty()) throw new IllegalStateException("El catálogo no tiene definiciones");

        Map<Catalog.DefinitionList, List<List<ObjectDefinition>>> lists = new EnumMap<>(Catalog.DefinitionList.class);
        for (Catalog.DefinitionList dl : Catalog.DefinitionList.values()) {
            Map<String, List<ObjectDefinition>> g = grouped.getOrDefault(dl, Map.of());
            List<List<ObjectDefinition>> nested = new ArrayList<>();
            for (List<ObjectDefinition> l : g.values()) nested.add(List.copyOf(l));
            lists.put(dl, List.copyOf(nested));
        }
        return new Catalog(definitions, lists, materials);
    }

    private static Choice toChoice(Choice.Kind kind, DefinitionRow r) {
        Choice c = new Choice(kind);
        c.type = r.type;
        c.shape = r.shape.isEmpty() ? null : r.shape;
        c.size = r.size;
        c.mass = r.mass;
        c.dimensions = r.dimensions();
        c.offset = r.offset();
        c.positionY = r.positionY;
        c.materialCategory = r.materialCategory.isEmpty() ? null : r.materialCategory;
        if (!r.novelty.isEmpty()) {
            c.novelty = EnumSet.noneOf(Novelty.class);
            for (String n : r.novelty) c.novelty.add(Novelty.parse(n));
        }
        return c;
    }
}
