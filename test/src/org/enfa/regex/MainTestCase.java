/* @LICENSE@
 */

package org.enfa.regex;

import static org.enfa.regex.Misc.LS;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

public class MainTestCase extends AbstractRxTestCase {

    private static final GraphvizRenderer NO_GRAPHVIZ = new GraphvizRenderer(
        new File(System.getProperty("java.io.tmpdir"), "no-such-dir" + File.separator + "dot").getPath(),
        "png");

    private ByteArrayOutputStream bytes;
    private PrintStream out;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(MainTestCase.class);
    }

    public MainTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        bytes = new ByteArrayOutputStream();
        out = new PrintStream(bytes, true, "UTF-8");
    }

    private String output() throws UnsupportedEncodingException {
        out.flush();
        return bytes.toString("UTF-8");
    }

    private int runMain(String... args) {
        return Main.run(args, out, NO_GRAPHVIZ, new File(Main.IMAGE_FILE));
    }

    public void testDefaultRegex() throws Exception {
        assertEquals(0, runMain());
        String text = output();
        assertTrue(text, text.startsWith("Regular Expression: (01*1)*1" + LS));
        assertTrue(text, text.contains("NFA: " + LS));
        assertTrue(text, text.contains(Nfa.compile(Main.DEFAULT_REGEX).toDisplayText().text()));
        assertFalse(text, text.contains("Graph has been created"));
        assertTrue(text, text.contains("Execution time: "));
        assertTrue(text, text.trim().endsWith(" seconds"));
    }

    public void testInputs() throws Exception {
        assertEquals(0, runMain("ab*", "abb", "ba", ""));
        String text = output();
        assertTrue(text, text.contains("'abb' accepted" + LS));
        assertTrue(text, text.contains("'ba' rejected" + LS));
        assertTrue(text, text.contains("'' rejected" + LS));
    }

    public void testSyntaxError() throws Exception {
        assertEquals(1, runMain("(a", "a"));
        String text = output();
        assertTrue(text, text.contains("Failure: Unbalanced parenthesis"));
        assertFalse(text, text.contains("NFA:"));
        assertFalse(text, text.contains("accepted"));
        assertTrue(text, text.contains("Execution time: "));
    }
}
