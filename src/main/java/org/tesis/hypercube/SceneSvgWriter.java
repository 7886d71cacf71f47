package org.tesis.hypercube;

import org.locationtech.jts.geom.*;

import java.util.Locale;

/* Planta de una escena vista desde arriba: sala, performer y rectángulo de cada objeto. */
class SceneSvgWriter {

    static String toSVG(Scene scene) {
        Room room = Room.fromDimensions(scene.roomDimensions);
        double w = scene.roomDimensions.x, h = scene.roomDimensions.z;
        double minX = -w / 2.0, minY = -h / 2.0;

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(fmt(w * 50))
          .append("\" height=\"").append(fmt(h * 50)).append("\" viewBox=\"")
          .append(fmt(minX)).append(" ").append(fmt(minY)).append(" ").append(fmt(w)).append(" ").append(fmt(h)).append("\">\n");
        sb.append("  <title>").append(scene.name).append("</title>\n");

        // Fondo
        sb.append("  <rect x=\"").append(fmt(minX)).append("\" y=\"").append(fmt(minY))
          .append("\" width=\"").append(fmt(w)).append("\" height=\"").append(fmt(h))
          .append("\" fill=\"white\"/>\n");

        // Grupo invertido en Y (z de la escena crece hacia arriba)
        sb.append("  <g transform=\"scale(1,-1)\">\n");

        // Zona donde puede quedar un objeto
        sb.append("    <path d=\"").append(pathFor(room.box()))
          .append("\" fill=\"#f0f0f0\" stroke=\"#333\" stroke-width=\"0.02\"/>\n");

        // Objetos (los de adentro de un contenedor no tienen coordenadas de sala)
        for (ObjectInstance o : scene.objects) {
            if (o.bounds == null || o.locationParent != null) continue;
            emitObject(sb, o, fillFor(o.role, o.id.equals(scene.targetId)));
        }

        // Performer y hacia dónde mira
        PerformerStart p = scene.performerStart;
        sb.append("    <path d=\"").append(pathFor(GeomUtils.performerRect(p.position).toPolygon()))
          .append("\" fill=\"#222\" fill-opacity=\"0.6\"/>\n");
        double rad = Math.toRadians(p.rotationY);
        sb.append("    <path d=\"M ").append(fmt(p.position.x)).append(" ").append(fmt(p.position.z))
          .append(" L ").append(fmt(p.position.x + Math.sin(rad))).append(" ").append(fmt(p.position.z + Math.cos(rad)))
          .append("\" fill=\"none\" stroke=\"#111\" stroke-width=\"0.03\"/>\n");

        sb.append("  </g>\n</svg>\n");
        return sb.toString();
    }

    // ---------- helpers de dibujo ----------

    static String fillFor(Role role, boolean target) {
        if (target) return "#e6550d";
        if (role == null) return "#bdbdbd";
        if (role == Role.CONFUSOR) return "#fdae6b";
        if (role == Role.CONTAINER) return "#6baed6";
        if (role == Role.OBSTACLE) return "#756bb1";
        if (role == Role.OCCLUDER) return "#9e9ac8";
        return "#a1d99b";
    }

    static void emitObject(StringBuilder sb, ObjectInstance o, String fill) {
        sb.append("    <path d=\"").append(pathFor(o.bounds.toPolygon()))
          .append("\" fill=\"").append(fill)
          .append("\" fill-opacity=\"0.85\" stroke=\"#111\" stroke-width=\"0.02\">\n");
        sb.append("      <title>").append(o.role == null ? "" : o.role.label()).append(" | ")
          .append(o.definition.type).append(" | θ=").append(fmt(o.rotation.y)).append("°")
          .append(o.isParentOf.isEmpty() ? "" : " | contiene " + o.isParentOf.size())
          .append("</title>\n");
        sb.append("    </path>\n");
    }

    // Genera el atributo "d" de un path SVG a partir de un Polygon
    static String pathFor(Polygon poly) {
        StringBuilder sb = new StringBuilder();
        appendLineString(sb, poly.getExteriorRing());
        return sb.toString();
    }

    // Agrega comandos M/L/Z para una LineString cerrada
    static void appendLineString(StringBuilder sb, LineString ls) {
        Coordinate[] c = ls.getCoordinates();
        if (c.length == 0) return;
        sb.append("M ").append(fmt(c[0].x)).append(" ").append(fmt(c[0].y)).append(" ");
        for (int i = 1; i < c.length; i++) {
            sb.append("L ").append(fmt(c[i].x)).append(" ").append(fmt(c[i].y)).append(" ");
        }
        sb.append("Z ");
    }

    static String fmt(double d) {
        return String.format(Locale.US, "%.3f", d);
    }
}
