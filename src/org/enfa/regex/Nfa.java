/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.enfa.regex.Automaton.Listing;
import org.enfa.regex.Automaton.Transition;

/**
 * A compiled representation of a regular expression as an epsilon-NFA, built
 * by Thompson's construction; loosely analog to the
 * {@link java.util.regex.Pattern} class. Instances are immutable and thread
 * safe.
 * <p>
 * <strong>Syntax:</strong> the regex syntax is deliberately small:
 * <ul>
 * <li>characters of the {@linkplain Alphabet alphabet} (by default
 * {@linkplain Alphabet#ALPHANUMERIC letters and digits}) match themselves;</li>
 * <li><code>*</code> is the Kleene star and binds tightest;</li>
 * <li>concatenation is implicit (<code>ab</code>), or explicit with
 * <code>.</code> (<code>a.b</code>);</li>
 * <li><code>|</code> or <code>+</code> is union, and binds loosest;</li>
 * <li><code>(</code> and <code>)</code> group.</li>
 * </ul>
 * There are no character classes, anchors, <code>?</code> or <code>+</code>
 * quantifiers, and no back references.
 */
public final class Nfa {

    private static final Logger logger = Logger.getLogger("org.enfa.regex");
    private static final Level level = Level.FINEST;

    final String regex;
    final Alphabet alphabet;
    private final Automaton automaton;

    private Nfa(String regex, Alphabet alphabet, CompositeAutomaton fragment) {
        this.regex = regex;
        this.alphabet = alphabet;
        this.automaton = fragment.toAutomaton();
        logger.log(level, "nfa: {0}", automaton);
    }

    /**
     * @throws RegexSyntaxException
     *             if <code>regex</code> is malformed.
     */
    public static Nfa compile(String regex) {
        return compile(regex, Alphabet.ALPHANUMERIC);
    }

    /**
     * @param regex
     *            the regular expression to be compiled.
     * @param alphabet
     *            the characters allowed as literals.
     * @return the automaton.
     * @throws RegexSyntaxException
     *             if <code>regex</code> is malformed.
     */
    public static Nfa compile(String regex, Alphabet alphabet) {
        CompositeAutomaton fragment = new RegexParser(alphabet).parse(regex);
        return new Nfa(regex, alphabet, fragment);
    }

    public static boolean matches(String regex, CharSequence input) {
        return Nfa.compile(regex).accepts(input);
    }

    public boolean accepts(CharSequence input) {
        return Simulator.accepts(automaton, input);
    }

    /**
     * @return the automaton; {@linkplain Automaton#unmodifiableCopy()
     *         unmodifiable}.
     */
    public Automaton automaton() {
        return automaton;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public List<Transition> transitions() {
        return automaton.transitions();
    }

    public Listing toDisplayText() {
        return automaton.toDisplayText();
    }

    public String toGraphDescription() {
        return automaton.toGraphDescription();
    }

    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        return regex;
    }
}
