package org.tesis.hypercube;

import java.io.File;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/* Logger mínimo con timestamp; las líneas de debug solo salen si se habilitan. */
public final class SceneLog implements AutoCloseable {
    private final PrintStream out;
    private final boolean debug;
    private final DateTimeFormatter fmt = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    public SceneLog(PrintStream out, boolean debug) {
        this.out = out;
        this.debug = debug;
    }

    public static SceneLog stderr() {
        return new SceneLog(System.err, false);
    }

    // descarta todo (útil en tests)
    public static SceneLog silent() {
        return new SceneLog(new PrintStream(PrintStream.nullOutputStream()), false);
    }

    public static SceneLog toFile(String path, boolean debug) {
        try {
            File f = new File(path);
            File dir = f.getParentFile();
            if (dir != null) dir.mkdirs();
            PrintStream ps = new PrintStream(new FileOutputStream(f, /*append*/false), true, StandardCharsets.UTF_8);
            return new SceneLog(ps, debug);
        } catch (Exception e) {
            throw new RuntimeException("No se pudo abrir el log " + path, e);
        }
    }

    public boolean isDebug() { return debug; }

    public void log(String msg) {
        String t = "[" + LocalTime.now().format(fmt) + "] ";
        out.println(t + msg);
    }

    public void logf(String pattern, Object... args) {
        log(String.format(Locale.US, pattern, args));
    }

    public void debug(String msg) {
        if (debug) log("DEBUG " + msg);
    }

    public void debugf(String pattern, Object... args) {
        if (debug) log("DEBUG " + String.format(Locale.US, pattern, args));
    }

    // mensaje y causa en la misma línea, sin stack trace
    public void error(String msg, Throwable e) {
        log("ERROR " + msg + ": " + e.getMessage());
    }

    @Override public void close() {
        out.flush();
        if (out != System.err && out != System.out) out.close();
    }
}
