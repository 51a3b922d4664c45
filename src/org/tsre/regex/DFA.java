/* @LICENSE@
 */

package org.tsre.regex;

import static org.tsre.regex.Misc.LS;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deterministic automaton built from an {@link NFA} by subset construction.
 * There is no sink state: a missing arc is a rejection.
 */
final class DFA {

    private static final Logger logger = Logger.getLogger("org.tsre.regex");
    private static final Level level = Level.FINEST;

    private static final int NONE = -1;

    static final class State {

        final int handle;
        private final BitSet nfaStates;
        final boolean accept;
        private final SortedMap<Character, Integer> arcs =
                new TreeMap<Character, Integer>();

        private State(int handle, NFA nfa, BitSet nfaStates) {
            this.handle = handle;
            this.nfaStates = (BitSet) nfaStates.clone();
            boolean accept = false;
            for (int i = nfaStates.nextSetBit(0); i >= 0; i = nfaStates.nextSetBit(i + 1)) {
                if (nfa.isAccept(i)) {
                    accept = true;
                    break;
                }
            }
            this.accept = accept;   // fixed now, whatever is reached later
        }

        private void arc(char c, int ns) {
            Integer old = arcs.put(c, ns);
            assert old == null || old == ns : "nondeterministic on " + c;
        }

        int next(char c) {
            Integer ns = arcs.get(c);
            return ns == null ? NONE : ns;
        }

        BitSet nfaStates() {
            return (BitSet) nfaStates.clone();
        }

        Map<Character, Integer> arcs() {
            return Collections.unmodifiableSortedMap(arcs);
        }

        private String toLabel() {
            return Misc.stringFrom(nfaStates);
        }

        private static final String INDENT = "    ";

        @Override
        public String toString() {

            StringBuilder sb = new StringBuilder();
            sb.append("state: ").append(handle).append(' ');
            sb.append(toLabel()).append(' ');
            if (accept) sb.append("(accept) ");
            sb.append(LS);

            for (Map.Entry<Character, Integer> arc : arcs.entrySet()) {
                sb.append(INDENT).append("{sym:")
                    .append(Misc.Esc.RX.esc(arc.getKey())).append(", ns:")
                    .append(arc.getValue()).append('}').append(LS);
            }
            return sb.toString();
        }
    }

    private final List<State> states = new ArrayList<State>();
    final Alphabet alphabet;
    final int init;

    /**
     * Construct the DFA for <code>nfa</code> over <code>alphabet</code>.
     */
    DFA(final NFA nfa, Alphabet alphabet) {

        this.alphabet = alphabet;

        /*
         * DFA state identity is the exact member set of NFA states.
         */
        final class StateFactory {

            private final Map<BitSet, State> map = new HashMap<BitSet, State>();
            private final Deque<State> unmarked = new ArrayDeque<State>();

            private State stateFrom(BitSet nfaStates) {
                State state = map.get(nfaStates);
                if (state == null) {
                    state = new State(states.size(), nfa, nfaStates);
                    states.add(state);
                    map.put(state.nfaStates, state);
                    unmarked.push(state);
                }
                return state;
            }
        }
        final StateFactory factory = new StateFactory();

        BitSet alpha = new BitSet(nfa.size());
        alpha.set(nfa.start);
        init = factory.stateFrom(nfa.epsilonClosure(alpha)).handle;

        while (!factory.unmarked.isEmpty()) {
            State state = factory.unmarked.pop();
            for (char c : alphabet) {
                BitSet next = nfa.epsilonClosure(nfa.move(state.nfaStates, c));
                if (next.isEmpty()) continue;
                state.arc(c, factory.stateFrom(next).handle);
            }
        }

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + toString());
        }
    }

    int size() {
        return states.size();
    }

    State stateAt(int handle) {
        return states.get(handle);
    }

    boolean isAccept(int handle) {
        return states.get(handle).accept;
    }

    /**
     * @return the next state from <code>handle</code> on <code>c</code>, or
     *         -1 if there is no arc.
     */
    int next(int handle, char c) {
        return states.get(handle).next(c);
    }

    /**
     * Whole string match: every char of <code>csq</code> must have an arc,
     * and the last state reached must be accepting.
     */
    boolean accepts(CharSequence csq) {
        int state = init;
        for (int i = 0; i < csq.length(); ++i) {
            state = next(state, csq.charAt(i));
            if (state == NONE) return false;
        }
        return isAccept(state);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (State state : states) nArcs += state.arcs.size();
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(nArcs)
            .append(" alphabet ").append(alphabet)
            .append(LS);
        for (State state : states) {
            sb.append(state);
        }
        return sb.toString();
    }
}
