/*
 * @LICENSE@
 */

/**
 * <h3><b>enfa</b> - regular expressions to epsilon-NFAs by Thompson's
 * construction.</h3>
 * <p>
 * <h4>Overview.</h4>
 * <p>
 * A regular expression over a small alphabet (letters and digits by default)
 * is parsed by an operator precedence parser, which sequences the four
 * primitives of Thompson's construction: literal, union, concatenation and
 * Kleene star. Each primitive relabels the automata it combines into disjoint
 * ranges of state identifiers and joins them with epsilon transitions, so the
 * result is a non-deterministic finite automaton with one start state, one
 * final state, and epsilon transitions.
 * <p>
 * Acceptance of a string is decided by simulation: the set of states the
 * automaton may be in is carried along the input, taking the epsilon closure
 * after every step.
 * <p>
 * <h4>Usage.</h4>
 * <blockquote><pre>
 *  Nfa nfa = Nfa.compile("(a|b)*c");
 *  nfa.accepts("abababc");                  // true
 *  nfa.accepts("ab");                       // false
 *  System.out.print(nfa.toDisplayText());   // states and transitions
 *  new GraphvizRenderer().render(nfa.automaton(), new File("nfa.png"));
 * </pre></blockquote>
 * <p>
 * <h4>Syntax.</h4>
 * <p>
 * <code>*</code> (star) binds tightest, then concatenation (implicit, or
 * explicit with <code>.</code>), then union (<code>|</code> or
 * <code>+</code>). Parenthesis group. Malformed expressions raise
 * {@link org.enfa.regex.RegexSyntaxException}, a
 * {@link java.util.regex.PatternSyntaxException}.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * All classes log to the <code>java.util.logging</code> logger
 * <code>"org.enfa.regex"</code>: construction at <code>FINER</code> and
 * <code>FINEST</code>, GraphViz failures at <code>WARNING</code>.
 */
package org.enfa.regex;
