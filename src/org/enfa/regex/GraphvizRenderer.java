/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders an {@link Automaton} to an image by piping its
 * {@linkplain Automaton#toGraphDescription() graph description} into the
 * GraphViz <code>dot</code> tool, run as a subprocess. A missing or failing
 * tool is not an error: {@link #render(Automaton, File)} logs a warning and
 * returns false, and callers carry on with text output only.
 */
public final class GraphvizRenderer {

    private static final Logger logger = Logger.getLogger("org.enfa.regex");

    /**
     * System property naming the <code>dot</code> executable: either a path,
     * or a name looked up on the <code>PATH</code>.
     */
    public static final String DOT_PROPERTY = "enfa.dot";

    public static final String DEFAULT_DOT = "dot";
    public static final String DEFAULT_FORMAT = "png";

    final String dot;
    final String format;

    /**
     * Uses the executable named by the {@value #DOT_PROPERTY} system property
     * (default {@value #DEFAULT_DOT}), producing {@value #DEFAULT_FORMAT}
     * images.
     */
    public GraphvizRenderer() {
        this(System.getProperty(DOT_PROPERTY, DEFAULT_DOT), DEFAULT_FORMAT);
    }

    public GraphvizRenderer(String dot, String format) {
        if (dot == null || format == null) {
            throw new NullPointerException();
        }
        this.dot = dot;
        this.format = format;
    }

    /**
     * @return true if the executable exists: as given, when it names a path,
     *         otherwise somewhere on the <code>PATH</code>.
     */
    public boolean isInstalled() {
        File f = new File(dot);
        if (f.isAbsolute() || dot.indexOf(File.separatorChar) >= 0) {
            return isExecutable(f);
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.length() == 0) continue;
            if (isExecutable(new File(dir, dot)) || isExecutable(new File(dir, dot + ".exe"))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExecutable(File f) {
        return f.isFile() && f.canExecute();
    }

    /**
     * Writes an image of <code>automaton</code> to <code>output</code>.
     *
     * @return true if the image was written; false if the tool is not
     *         installed, could not be run, or failed.
     */
    public boolean render(Automaton automaton, File output) {
        if (!isInstalled()) {
            logger.warning("graphviz not found: " + dot);
            return false;
        }
        ProcessBuilder pb = new ProcessBuilder(
                dot, "-T" + format, "-o", output.getPath());
        pb.redirectErrorStream(true);
        StringBuilder gvOut = new StringBuilder();
        Process proc = null;
        try {
            proc = pb.start();
            Writer gvw = new OutputStreamWriter(proc.getOutputStream(), StandardCharsets.UTF_8);
            try {
                gvw.write(automaton.toGraphDescription());
            } finally {
                gvw.close();
            }
            BufferedReader gvr = new BufferedReader(
                    new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8));
            try {
                String line;
                while ((line = gvr.readLine()) != null) {
                    gvOut.append(line).append(Misc.LS);
                }
            } finally {
                gvr.close();
            }
            int gvReturn = proc.waitFor();
            if (gvReturn != 0) {
                logger.warning("graphviz returned " + gvReturn + ": " + gvOut);
                return false;
            }
        } catch (IOException e) {
            if (proc != null) {
                proc.destroy();
            }
            logger.log(Level.WARNING, "error running graphviz: " + dot, e);
            return false;
        } catch (InterruptedException e) {
            proc.destroy();
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "interrupted waiting for graphviz", e);
            return false;
        }
        logger.fine("graphviz wrote " + output);
        return true;
    }

    @Override
    public String toString() {
        return dot + " -T" + format;
    }
}
