package org.tesis.hypercube;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;


public class HypercubeMain {

    public static void main(String[] args) throws Exception {
        //Acá se puede cambiar la familia, la semilla y la carpeta de salida.
        String family    = "container";
        long seed        = 12345L;
        String outputDir = "out";

        if (args.length >= 1) family = args[0];
        if (args.length >= 2) seed = Long.parseLong(args[1]);
        if (args.length >= 3) outputDir = args[2];

        new File(outputDir).mkdirs();

        // 1) Catálogo empaquetado
        Catalog catalog = Catalog.getDefault();

        // 2) Una sola fuente de azar para todo el hipercubo
        Random rnd = new Random(seed);

        try (SceneLog log = SceneLog.toFile(outputDir + "/hypercube.log", true)) {
            // 3) Armar el hipercubo en una sala al azar
            HypercubeFactory factory = HypercubeFactory.named(family, false, catalog, rnd, log);
            List<HypercubeResult> results = factory.build(1, () -> RoomTemplate.random(catalog, rnd), false);

            // 4) Exportar una planta SVG por escena
            for (Scene scene : results.get(0).scenes()) {
                String outputSvg = outputDir + "/" + scene.name + ".svg";
                try (Writer w = new OutputStreamWriter(new FileOutputStream(outputSvg), StandardCharsets.UTF_8)) {
                    w.write(SceneSvgWriter.toSVG(scene));
                }
                System.out.println(scene + " " + scene.slices());
            }
            System.err.println("Escenas generadas en: " + outputDir);
        }
    }
}
