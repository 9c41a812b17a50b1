/* @LICENSE@
 */

package org.enfa.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.enfa.regex.test");
    protected static final Level level = Level.FINEST;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    public AbstractRxTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }

    /*
     * wrapper for Misc functions needed by subclasses outside package
     */
    protected static String esc(String s) {
        return Misc.Esc.JAVA.esc(s);
    }

    /**
     * Re-creates the automaton for a regex, bypassing {@link Nfa} - useful
     * for logging and testing.
     * @param regex the regex to build.
     * @return the general form of the automaton.
     */
    protected static Automaton automatonOf(String regex) {
        return new RegexParser().parse(regex).toAutomaton();
    }
}
