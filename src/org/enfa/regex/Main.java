/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.io.File;
import java.io.PrintStream;

/**
 * Command line entry point:
 * <blockquote><pre>
 * java org.enfa.regex.Main [regex [input...]]
 * </pre></blockquote>
 * Prints the automaton built from <code>regex</code> (default
 * {@value #DEFAULT_REGEX}), whether each <code>input</code> is accepted, and
 * writes <code>graphnfa.png</code> when GraphViz is installed. Exits with
 * status 1 on a malformed regex.
 */
public final class Main {

    static final String DEFAULT_REGEX = "(01*1)*1";
    static final String IMAGE_FILE = "graphnfa.png";

    private Main() {}

    public static void main(String[] args) {
        int status = run(args, System.out, new GraphvizRenderer(), new File(IMAGE_FILE));
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, GraphvizRenderer renderer, File image) {
        final long t = System.nanoTime();
        int status = 0;
        try {
            String regex = args.length > 0 ? args[0] : DEFAULT_REGEX;
            out.println("Regular Expression: " + regex);
            Nfa nfa = Nfa.compile(regex);
            out.println();
            out.println("NFA: ");
            out.print(nfa.toDisplayText().text());
            for (int i = 1; i < args.length; ++i) {
                out.println("'" + args[i] + "' " + (nfa.accepts(args[i]) ? "accepted" : "rejected"));
            }
            if (renderer.isInstalled() && renderer.render(nfa.automaton(), image)) {
                out.println();
                out.println("Graph has been created: " + image.getPath());
            }
        } catch (RegexSyntaxException e) {
            out.println();
            out.println("Failure: " + e.getMessage());
            status = 1;
        }
        out.println();
        out.println("Execution time: " + (System.nanoTime() - t) / 1e9 + " seconds");
        return status;
    }
}
