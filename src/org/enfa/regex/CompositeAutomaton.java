/*
 * @LICENSE@
 */

package org.enfa.regex;

import java.util.Set;

/**
 * An automaton fragment produced by the {@linkplain Thompson combinators}:
 * exactly one start state and exactly one final ("accept") state. The single
 * final state is checked when the fragment is created, so the combinators
 * never have to pick it out of a list.
 * <p>
 * Fragments are never modified once created; combinators relabel them with
 * {@link #renumberFrom(int)} before splicing them into a new fragment.
 */
final class CompositeAutomaton {

    /**
     * A relabelled fragment, and the first identifier it does not use.
     */
    static final class Renumbered {

        final CompositeAutomaton fragment;
        final int next;

        Renumbered(CompositeAutomaton fragment, int next) {
            this.fragment = fragment;
            this.next = next;
        }
    }

    private final Automaton automaton;
    private final int start;
    private final int accept;

    /**
     * Takes ownership of <code>automaton</code>, which must not be modified
     * by the caller afterwards.
     *
     * @throws IllegalArgumentException
     *             if the automaton has no start state, or not exactly one final
     *             state.
     */
    CompositeAutomaton(Automaton automaton) {
        if (!automaton.hasStart()) {
            throw new IllegalArgumentException("fragment without start state");
        }
        if (automaton.finalStates().size() != 1) {
            throw new IllegalArgumentException(
                "fragment must have exactly one final state: " + automaton.finalStates());
        }
        this.automaton = automaton;
        this.start = automaton.start();
        this.accept = automaton.finalStates().iterator().next();
    }

    int start() {
        return start;
    }

    int accept() {
        return accept;
    }

    Set<Integer> states() {
        return automaton.states();
    }

    Set<Character> language() {
        return automaton.language();
    }

    /*
     * read-only access for the simulator, without copying
     */
    Automaton automaton() {
        return automaton;
    }

    Renumbered renumberFrom(int startId) {
        Automaton.Renumbered r = automaton.renumberFrom(startId);
        return new Renumbered(new CompositeAutomaton(r.automaton), r.next);
    }

    /**
     * @return the general form of this fragment, for listing and export.
     */
    Automaton toAutomaton() {
        return automaton.unmodifiableCopy();
    }

    int size() {
        return automaton.states().size();
    }

    @Override
    public String toString() {
        return "{start=" + start + ",accept=" + accept + ",states=" + automaton.states() + '}';
    }
}
