/*
 * @LICENSE@
 */

package org.enfa.regex;

import static org.enfa.regex.Misc.LS;
import static org.enfa.regex.Misc.braced;
import static org.enfa.regex.Misc.symbolString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A non-deterministic finite automaton with epsilon transitions. States are
 * non-negative integer identifiers; the transition relation maps a source
 * state to its destination states, each with the non-empty set of symbols
 * labelling the transition. Symbols are <code>char</code> values, plus the
 * {@link #EPSILON} sentinel.
 * <p>
 * Instances are built incrementally (by the {@linkplain Thompson
 * combinators}) and are treated as read-only afterwards. The instances handed
 * out by {@link Nfa#automaton()} are {@linkplain #unmodifiableCopy()
 * unmodifiable}; any number of threads may query them concurrently.
 */
public final class Automaton {

    private static final Logger logger = Logger.getLogger("org.enfa.regex");
    private static final Level level = Level.FINEST;

    /**
     * The symbol of an epsilon transition. Negative, so it can never collide
     * with a character of any alphabet.
     */
    public static final int EPSILON = -1;

    /**
     * A single (from, to, symbol) row of the transition relation.
     */
    public static final class Transition {

        final int from;
        final int to;
        final int symbol;

        Transition(int from, int to, int symbol) {
            this.from = from;
            this.to = to;
            this.symbol = symbol;
        }
        public int from() {
            return from;
        }
        public int to() {
            return to;
        }
        /**
         * @return the character, or {@link Automaton#EPSILON}.
         */
        public int symbol() {
            return symbol;
        }
        public boolean isEpsilon() {
            return symbol == EPSILON;
        }
        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + from;
            result = prime * result + to;
            result = prime * result + symbol;
            return result;
        }
        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof Transition))
                return false;
            final Transition other = (Transition) obj;
            return from == other.from && to == other.to
                    && symbol == other.symbol;
        }
        @Override
        public String toString() {
            return from + " -> " + to + " on '" + symbolString(symbol) + "'";
        }
    }

    /**
     * Human readable listing of an automaton, together with its number of
     * lines.
     */
    public static final class Listing {

        final String text;
        final int lineCount;

        Listing(String text, int lineCount) {
            this.text = text;
            this.lineCount = lineCount;
        }
        public String text() {
            return text;
        }
        public int lineCount() {
            return lineCount;
        }
        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * Result of {@link Automaton#renumberFrom(int)}: the relabelled automaton,
     * and the first identifier it does not use.
     */
    public static final class Renumbered {

        final Automaton automaton;
        final int next;

        Renumbered(Automaton automaton, int next) {
            this.automaton = automaton;
            this.next = next;
        }
        public Automaton automaton() {
            return automaton;
        }
        public int next() {
            return next;
        }
    }

    private final SortedSet<Integer> states = new TreeSet<Integer>();
    private final List<Integer> finalStates = new ArrayList<Integer>();
    private final SortedMap<Integer, SortedMap<Integer, SortedSet<Integer>>> transitions =
            new TreeMap<Integer, SortedMap<Integer, SortedSet<Integer>>>();
    private final SortedSet<Character> language = new TreeSet<Character>();
    private Integer start = null;
    private boolean frozen = false;

    public Automaton() {
    }

    public Automaton(Collection<Character> language) {
        this.language.addAll(language);
    }

    /*
     * mutators
     */

    public void setStart(int state) {
        checkMutable();
        addState(state);
        start = state;
    }

    public void addFinal(int... states) {
        checkMutable();
        for (int state : states) {
            addState(state);
            if (!finalStates.contains(state)) {
                finalStates.add(state);
            }
        }
    }

    public void addFinal(Collection<Integer> states) {
        checkMutable();
        for (int state : states) {
            addFinal(state);
        }
    }

    public void addTransition(int from, int to, int symbol) {
        checkMutable();
        checkSymbol(symbol);
        checkState(from);
        checkState(to);
        addState(from);
        addState(to);
        symbolsFor(from, to).add(symbol);
    }

    /**
     * Widens the transition from <code>from</code> to <code>to</code> by the
     * given symbols; repeated symbols are harmless.
     *
     * @throws IllegalArgumentException
     *             if <code>symbols</code> is empty.
     */
    public void addTransition(int from, int to, Set<Integer> symbols) {
        checkMutable();
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException(
                "empty symbol set for " + from + " -> " + to);
        }
        for (int symbol : symbols) {
            checkSymbol(symbol);
        }
        checkState(from);
        checkState(to);
        addState(from);
        addState(to);
        symbolsFor(from, to).addAll(symbols);
    }

    /**
     * Adds every (from, to, symbols) triple of <code>relation</code> to this
     * automaton, as is. Used to splice already renumbered sub-automata into
     * a composite.
     */
    public void mergeTransitions(
            Map<Integer, ? extends Map<Integer, ? extends Set<Integer>>> relation) {
        checkMutable();
        for (Map.Entry<Integer, ? extends Map<Integer, ? extends Set<Integer>>> e
                : relation.entrySet()) {
            for (Map.Entry<Integer, ? extends Set<Integer>> f : e.getValue().entrySet()) {
                addTransition(e.getKey(), f.getKey(), Collections.<Integer>unmodifiableSet(f.getValue()));
            }
        }
    }

    void addState(int state) {
        checkMutable();
        checkState(state);
        states.add(state);
    }

    /*
     * copies the states, transitions and language of part, whose identifiers
     * are already disjoint from this automaton's; start and final states are
     * left alone
     */
    void addAll(Automaton part) {
        checkMutable();
        states.addAll(part.states);
        for (Map.Entry<Integer, SortedMap<Integer, SortedSet<Integer>>> e : part.transitions.entrySet()) {
            for (Map.Entry<Integer, SortedSet<Integer>> f : e.getValue().entrySet()) {
                symbolsFor(e.getKey(), f.getKey()).addAll(f.getValue());
            }
        }
        language.addAll(part.language);
    }

    private SortedSet<Integer> symbolsFor(int from, int to) {
        SortedMap<Integer, SortedSet<Integer>> out = transitions.get(from);
        if (out == null) {
            transitions.put(from, out = new TreeMap<Integer, SortedSet<Integer>>());
        }
        SortedSet<Integer> symbols = out.get(to);
        if (symbols == null) {
            out.put(to, symbols = new TreeSet<Integer>());
        }
        return symbols;
    }

    private static void checkState(int state) {
        if (state < 0) {
            throw new IllegalArgumentException("negative state: " + state);
        }
    }

    private static void checkSymbol(int symbol) {
        if (symbol != EPSILON && symbol != (char) symbol) {
            throw new IllegalArgumentException("not a symbol: " + symbol);
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("unmodifiable automaton");
        }
    }

    /*
     * accessors
     */

    public boolean hasStart() {
        return start != null;
    }

    /**
     * @throws IllegalStateException
     *             if the start state has not been set.
     */
    public int start() {
        if (start == null) {
            throw new IllegalStateException("start state not set");
        }
        return start;
    }

    public Set<Integer> states() {
        return Collections.unmodifiableSet(states);
    }

    public List<Integer> finalStates() {
        return Collections.unmodifiableList(finalStates);
    }

    public boolean isFinal(int state) {
        return finalStates.contains(state);
    }

    /**
     * @return the alphabet characters used by this automaton; informational
     *         only, never consulted by the transition queries.
     */
    public Set<Character> language() {
        return Collections.unmodifiableSet(language);
    }

    /**
     * @return an unmodifiable snapshot of the transition relation:
     *         <code>from -> (to -> symbols)</code>.
     */
    public Map<Integer, Map<Integer, Set<Integer>>> transitionRelation() {
        Map<Integer, Map<Integer, Set<Integer>>> ret =
                new LinkedHashMap<Integer, Map<Integer, Set<Integer>>>();
        for (Map.Entry<Integer, SortedMap<Integer, SortedSet<Integer>>> e : transitions.entrySet()) {
            Map<Integer, Set<Integer>> out = new LinkedHashMap<Integer, Set<Integer>>();
            for (Map.Entry<Integer, SortedSet<Integer>> f : e.getValue().entrySet()) {
                out.put(f.getKey(), Collections.unmodifiableSet(new TreeSet<Integer>(f.getValue())));
            }
            ret.put(e.getKey(), Collections.unmodifiableMap(out));
        }
        return Collections.unmodifiableMap(ret);
    }

    /**
     * @return every row of the transition relation, ordered by source,
     *         destination and symbol.
     */
    public List<Transition> transitions() {
        List<Transition> ret = new ArrayList<Transition>();
        for (Map.Entry<Integer, SortedMap<Integer, SortedSet<Integer>>> e : transitions.entrySet()) {
            for (Map.Entry<Integer, SortedSet<Integer>> f : e.getValue().entrySet()) {
                for (int symbol : f.getValue()) {
                    ret.add(new Transition(e.getKey(), f.getKey(), symbol));
                }
            }
        }
        return Collections.unmodifiableList(ret);
    }

    /*
     * queries
     */

    /**
     * The states reachable from <code>state</code> following zero or more
     * epsilon transitions. Terminates on epsilon cycles.
     */
    public Set<Integer> epsilonClosure(int state) {
        return epsilonClosure(Collections.singleton(state));
    }

    /**
     * The union of the epsilon closures of <code>from</code>.
     */
    public Set<Integer> epsilonClosure(Collection<Integer> from) {
        final Set<Integer> black = new TreeSet<Integer>(from);
        final LinkedList<Integer> gray = new LinkedList<Integer>(black);
        while (!gray.isEmpty()) {
            SortedMap<Integer, SortedSet<Integer>> out = transitions.get(gray.removeFirst());
            if (out == null) continue;
            for (Map.Entry<Integer, SortedSet<Integer>> e : out.entrySet()) {
                if (e.getValue().contains(EPSILON) && black.add(e.getKey())) {
                    gray.addLast(e.getKey());
                }
            }
        }
        return black;
    }

    public Set<Integer> transitionsOn(int state, int symbol) {
        return transitionsOn(Collections.singleton(state), symbol);
    }

    /**
     * The destinations of the direct transitions labelled <code>symbol</code>
     * out of <code>from</code>. No epsilon transitions are followed, unless
     * <code>symbol</code> is {@link #EPSILON}.
     */
    public Set<Integer> transitionsOn(Collection<Integer> from, int symbol) {
        final Set<Integer> ret = new TreeSet<Integer>();
        for (int state : from) {
            SortedMap<Integer, SortedSet<Integer>> out = transitions.get(state);
            if (out == null) continue;
            for (Map.Entry<Integer, SortedSet<Integer>> e : out.entrySet()) {
                if (e.getValue().contains(symbol)) {
                    ret.add(e.getKey());
                }
            }
        }
        return ret;
    }

    /*
     * relabelling
     */

    /**
     * Creates a structurally identical automaton whose states are the
     * contiguous range starting at <code>startId</code>. This automaton is
     * not modified.
     *
     * @return the relabelled automaton and the first unused identifier.
     */
    public Renumbered renumberFrom(int startId) {
        final Map<Integer, Integer> translations = new LinkedHashMap<Integer, Integer>();
        int next = startId;
        for (int state : states) {
            translations.put(state, next++);
        }
        Automaton rebuild = new Automaton(language);
        for (int state : states) {
            rebuild.addState(translations.get(state));
        }
        if (start != null) {
            rebuild.setStart(translations.get(start));
        }
        for (int state : finalStates) {
            rebuild.addFinal(translations.get(state));
        }
        for (Map.Entry<Integer, SortedMap<Integer, SortedSet<Integer>>> e : transitions.entrySet()) {
            for (Map.Entry<Integer, SortedSet<Integer>> f : e.getValue().entrySet()) {
                rebuild.addTransition(
                    translations.get(e.getKey()), translations.get(f.getKey()), f.getValue());
            }
        }
        assert rebuild.states.size() == states.size();
        if (logger.isLoggable(level)) {
            logger.log(level, "renumbered " + states.size() + " states from " + startId);
        }
        return new Renumbered(rebuild, next);
    }

    /**
     * @return a copy of this automaton which throws
     *         {@link UnsupportedOperationException} from every mutator.
     */
    public Automaton unmodifiableCopy() {
        if (frozen) return this;
        Automaton copy = new Automaton(language);
        copy.states.addAll(states);
        copy.start = start;
        copy.finalStates.addAll(finalStates);
        copy.mergeTransitions(transitions);
        copy.frozen = true;
        return copy;
    }

    /*
     * export
     */

    /**
     * Emits a GraphViz (dot language) description of this automaton: one node
     * per state, double circled if final, and one labelled edge per symbol.
     */
    public String toGraphDescription() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph NFA {").append(LS);
        sb.append('\t').append("rankdir=\"LR\";").append(LS);
        if (!states.isEmpty()) {
            sb.append('\t').append("start [shape=point];").append(LS);
            for (int state : states) {
                sb.append('\t').append(nodeId(state))
                  .append(" [shape=").append(isFinal(state) ? "doublecircle" : "circle")
                  .append(", label=\"").append(state).append("\"];").append(LS);
            }
            if (start != null) {
                sb.append('\t').append("start -> ").append(nodeId(start))
                  .append(';').append(LS);
            }
            for (Transition t : transitions()) {
                sb.append('\t').append(nodeId(t.from)).append(" -> ").append(nodeId(t.to))
                  .append(" [label=\"").append(Misc.Esc.DOT.esc(symbolString(t.symbol)))
                  .append("\"];").append(LS);
            }
        }
        sb.append('}').append(LS);
        return sb.toString();
    }

    private static String nodeId(int state) {
        return "s" + state;
    }

    /**
     * Emits the language, states, start state, final states and one line per
     * transition.
     */
    public Listing toDisplayText() {
        StringBuilder sb = new StringBuilder();
        sb.append("language: ").append(braced(language)).append(LS);
        sb.append("states: ").append(braced(states)).append(LS);
        sb.append("start state: ").append(start == null ? "none" : start.toString()).append(LS);
        sb.append("final states: ").append(braced(finalStates)).append(LS);
        sb.append("transitions:").append(LS);
        int lineCount = 5;
        for (Transition t : transitions()) {
            sb.append("    ").append(t).append(LS);
            ++lineCount;
        }
        return new Listing(sb.toString(), lineCount);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + states.hashCode();
        result = prime * result + ((start == null) ? 0 : start.hashCode());
        result = prime * result + finalStates.hashCode();
        result = prime * result + transitions.hashCode();
        return result;
    }

    /**
     * Structural equality: same states, start, final states (in order) and
     * transitions. The informational language is not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Automaton))
            return false;
        final Automaton other = (Automaton) obj;
        if (start == null) {
            if (other.start != null)
                return false;
        } else if (!start.equals(other.start))
            return false;
        return states.equals(other.states)
                && finalStates.equals(other.finalStates)
                && transitions.equals(other.transitions);
    }

    @Override
    public String toString() {
        return toDisplayText().text();
    }
}
