/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides acceptance of an input string by simultaneously tracking every
 * state the automaton may be in. One set update per input character; no
 * recursion, so input length is not limited by the call stack.
 * <p>
 * The automaton is only read, never modified: any number of simulations may
 * run concurrently against the same automaton.
 */
public final class Simulator {

    private static final Logger logger = Logger.getLogger("org.enfa.regex");
    private static final Level level = Level.FINEST;

    private Simulator() {}   // not instantiable.

    /**
     * @return true iff <code>automaton</code> accepts <code>input</code>. The
     *         empty input tests only the epsilon closure of the start state.
     * @throws IllegalStateException
     *             if the automaton has no start state.
     */
    public static boolean accepts(Automaton automaton, CharSequence input) {
        Set<Integer> current = automaton.epsilonClosure(automaton.start());
        for (int i = 0; i < input.length(); ++i) {
            current = automaton.epsilonClosure(
                automaton.transitionsOn(current, input.charAt(i)));
            if (current.isEmpty()) {
                if (logger.isLoggable(level)) {
                    logger.log(level, "rejected at index " + i + ": " + input);
                }
                return false;
            }
        }
        for (int state : current) {
            if (automaton.isFinal(state)) return true;
        }
        return false;
    }

    static boolean accepts(CompositeAutomaton fragment, CharSequence input) {
        return accepts(fragment.automaton(), input);
    }
}
