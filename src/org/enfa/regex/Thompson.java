/*
 * @LICENSE@
 */

package org.enfa.regex;

import static org.enfa.regex.Automaton.EPSILON;

import java.util.Collections;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Uninstantiable class which serves as a source container for the four
 * construction primitives of Thompson's construction. Each primitive
 * relabels its operands into disjoint ranges of identifiers, wires a fixed
 * skeleton of epsilon transitions around them, and returns a new fragment.
 * Operands are never modified.
 */
final class Thompson {

    private static final Logger logger = Logger.getLogger("org.enfa.regex");
    private static final Level level = Level.FINER;

    private Thompson() {}   // not instantiable.

    /**
     * <pre>
     *   1 --c--> 2
     * </pre>
     */
    static CompositeAutomaton literal(char c) {
        Automaton basic = new Automaton(Collections.singleton(c));
        basic.setStart(1);
        basic.addFinal(2);
        basic.addTransition(1, 2, c);
        return new CompositeAutomaton(basic);
    }

    /**
     * <pre>
     *         e         e
     *     +-----> a -----+
     *   1 +              +--> last
     *     +-----> b -----+
     *         e         e
     * </pre>
     */
    static CompositeAutomaton union(CompositeAutomaton a, CompositeAutomaton b) {
        CompositeAutomaton.Renumbered ra = a.renumberFrom(2);
        CompositeAutomaton.Renumbered rb = b.renumberFrom(ra.next);
        final int last = rb.next;
        Automaton plus = new Automaton();
        plus.setStart(1);
        plus.addFinal(last);
        plus.addTransition(1, ra.fragment.start(), EPSILON);
        plus.addTransition(1, rb.fragment.start(), EPSILON);
        plus.addTransition(ra.fragment.accept(), last, EPSILON);
        plus.addTransition(rb.fragment.accept(), last, EPSILON);
        splice(plus, ra.fragment);
        splice(plus, rb.fragment);
        return log("union", new CompositeAutomaton(plus));
    }

    /**
     * <pre>
     *   a --e--> b
     * </pre>
     * No new states: the start of <code>a</code> and the accept of
     * <code>b</code> become the boundary states of the composite.
     */
    static CompositeAutomaton concat(CompositeAutomaton a, CompositeAutomaton b) {
        CompositeAutomaton.Renumbered ra = a.renumberFrom(1);
        CompositeAutomaton.Renumbered rb = b.renumberFrom(ra.next);
        Automaton dot = new Automaton();
        dot.setStart(ra.fragment.start());
        dot.addFinal(rb.fragment.accept());
        dot.addTransition(ra.fragment.accept(), rb.fragment.start(), EPSILON);
        splice(dot, ra.fragment);
        splice(dot, rb.fragment);
        return log("concat", new CompositeAutomaton(dot));
    }

    /**
     * <pre>
     *                e
     *             +-----+
     *             v     |
     *   1 --e--> a -----+--e--> last
     *   |                        ^
     *   +-----------e------------+
     * </pre>
     */
    static CompositeAutomaton star(CompositeAutomaton a) {
        CompositeAutomaton.Renumbered ra = a.renumberFrom(2);
        final int last = ra.next;
        Automaton star = new Automaton();
        star.setStart(1);
        star.addFinal(last);
        star.addTransition(1, ra.fragment.start(), EPSILON);
        star.addTransition(1, last, EPSILON);
        star.addTransition(ra.fragment.accept(), last, EPSILON);
        star.addTransition(ra.fragment.accept(), ra.fragment.start(), EPSILON);
        splice(star, ra.fragment);
        return log("star", new CompositeAutomaton(star));
    }

    /*
     * copies the internals of an already renumbered fragment
     */
    private static void splice(Automaton target, CompositeAutomaton part) {
        target.addAll(part.automaton());
    }

    private static CompositeAutomaton log(String op, CompositeAutomaton ret) {
        if (logger.isLoggable(level)) {
            logger.log(level, op + ": " + ret.size() + " states", ret);
        }
        return ret;
    }
}
