/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata, by Thompson construction.
 */
package org.tsre.regex;

import static org.tsre.regex.Misc.LS;
import static org.tsre.regex.Misc.isSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tsre.regex.Token.Kind;

final class NFA {

    private static final Logger logger = Logger.getLogger("org.tsre.regex");
    private static final Level level = Level.FINER;

    /**
     * A node of the automaton. States live in the NFA's arena and refer to
     * each other by handle (index into the arena), never by reference, so the
     * cycles that <code>*</code> and <code>+</code> create are just ints.
     */
    static final class State {

        final int handle;
        boolean accept;
        private final Map<String, List<Integer>> arcs =
                new LinkedHashMap<String, List<Integer>>();
        private final List<Integer> epsilons = new ArrayList<Integer>(2);

        private State(int handle, boolean accept) {
            this.handle = handle;
            this.accept = accept;
        }

        private void arc(String symbol, int ns) {
            List<Integer> nss = arcs.get(symbol);
            if (nss == null) {
                nss = new ArrayList<Integer>(1);
                arcs.put(symbol, nss);
            }
            nss.add(ns);
        }

        private void epsilon(int... nss) {
            for (int ns : nss) epsilons.add(ns);
        }

        boolean hasArc(String symbol) {
            return arcs.containsKey(symbol);
        }

        List<Integer> arcs(String symbol) {
            List<Integer> nss = arcs.get(symbol);
            return nss == null
                    ? Collections.<Integer>emptyList()
                    : Collections.unmodifiableList(nss);
        }

        List<Integer> epsilons() {
            return Collections.unmodifiableList(epsilons);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("state: ").append(handle);
            if (accept) sb.append(" (accept)");
            for (Map.Entry<String, List<Integer>> e : arcs.entrySet()) {
                sb.append(LS).append("    ")
                    .append(Misc.Esc.RX.esc(e.getKey())).append(" -> ")
                    .append(e.getValue());
            }
            if (!epsilons.isEmpty()) {
                sb.append(LS).append("    eps -> ").append(epsilons);
            }
            return sb.toString();
        }
    }

    /**
     * A (start, accept) pair of handles. Before an operator combines it,
     * exactly one state of a fragment is accepting: its accept state.
     */
    static final class Fragment {
        final int start;
        final int accept;

        Fragment(int start, int accept) {
            this.start = start;
            this.accept = accept;
        }

        @Override
        public String toString() {
            return "(" + start + ", " + accept + ")";
        }
    }

    private final List<State> states = new ArrayList<State>();
    private final Alphabet alphabet;
    private final List<Token> tokens;

    final int start;
    final int accept;

    /**
     * Build the NFA for a token sequence.
     *
     * @param tokens
     *            the token sequence, as from {@link RegexParser#parse(String)}.
     * @param alphabet
     *            the alphabet negation is taken against.
     * @param flags
     *            {@link Pattern#X_TOP_FRAGMENT} or 0.
     * @throws StructuralException
     *             if an operator is short of operands, or the tokens don't
     *             leave exactly one fragment.
     */
    NFA(List<Token> tokens, Alphabet alphabet, int flags) {

        this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
        this.alphabet = alphabet;

        final Deque<Fragment> stack = new ArrayDeque<Fragment>();
        boolean anchorPending = false;
        Token anchor = null;

        for (int i = 0; i < this.tokens.size(); ++i) {
            final Token token = this.tokens.get(i);
            final Kind kind = token.kind();
            Fragment result;

            switch (kind) {
            case LITERAL:
            case CLASS:
                result = basic(token.text());
                break;
            case CONCAT: {
                require(stack, token);
                Fragment nfa2 = stack.pop();
                Fragment nfa1 = stack.pop();
                result = cat(nfa1, nfa2);
                break;
            }
            case ALTERNATION: {
                require(stack, token);
                Fragment nfa2 = stack.pop();
                Fragment nfa1 = stack.pop();
                result = alt(nfa1, nfa2);
                break;
            }
            case STAR:
                require(stack, token);
                result = star(stack.pop());
                break;
            case PLUS:
                require(stack, token);
                result = plus(stack.pop());
                break;
            case OPTIONAL:
                require(stack, token);
                result = question(stack.pop());
                break;
            case CARET:
                if (stack.isEmpty()) {
                    /*
                     * start anchor: wraps whatever fragment comes next
                     */
                    anchorPending = true;
                    anchor = token;
                    continue;
                }
                result = negate(stack.pop());
                break;
            case DOLLAR:
                if (stack.size() != 1) {
                    throw new StructuralException(
                        "'$' requires exactly 1 operand, found " + stack.size()
                        + " in: " + this.tokens, token, this.tokens);
                }
                result = dollar(stack.pop());
                break;
            case BRACKET_OPEN: {
                StringBuilder sb = new StringBuilder();
                while (i + 1 < this.tokens.size()
                        && this.tokens.get(i + 1).kind() != Kind.BRACKET_CLOSE) {
                    sb.append(this.tokens.get(++i).text());
                }
                if (i + 1 < this.tokens.size()) ++i;    // the ']'
                result = basic(sb.toString());
                break;
            }
            case BRACKET_CLOSE:
                continue;
            default:
                throw new AssertionError(kind);
            }

            if (anchorPending) {
                result = anchor(result);
                anchorPending = false;
            }
            stack.push(result);
        }

        if (anchorPending) {
            throw new StructuralException(
                "'^' requires 1 operand, found 0 in: " + this.tokens,
                anchor, this.tokens);
        }
        if (stack.isEmpty()) {
            throw new StructuralException(
                "no fragment left in: " + this.tokens, null, this.tokens);
        }
        if (stack.size() > 1 && !isSet(flags, Pattern.X_TOP_FRAGMENT)) {
            throw new StructuralException(
                stack.size() + " fragments left in: " + this.tokens,
                null, this.tokens);
        }

        Fragment nfa = stack.peek();
        this.start = nfa.start;
        this.accept = nfa.accept;

        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: " + toString());
        }
    }

    private void require(Deque<Fragment> stack, Token token) {
        int arity = token.kind().arity();
        if (stack.size() < arity) {
            throw new StructuralException(
                "'" + token.text() + "' requires " + arity
                + (arity == 1 ? " operand" : " operands") + ", found "
                + stack.size() + " in: " + tokens, token, tokens);
        }
    }

    /*
     * Thompson construction. The order states are minted and accept flags
     * cleared in is significant; don't shuffle.
     */

    private State newState(boolean accept) {
        State state = new State(states.size(), accept);
        states.add(state);
        return state;
    }

    private State state(int handle) {
        return states.get(handle);
    }

    Fragment basic(String symbol) {
        State s = newState(false);
        State a = newState(true);
        s.arc(symbol, a.handle);
        return new Fragment(s.handle, a.handle);
    }

    Fragment cat(Fragment nfa1, Fragment nfa2) {
        State a1 = state(nfa1.accept);
        a1.accept = false;
        a1.epsilon(nfa2.start);
        return new Fragment(nfa1.start, nfa2.accept);
    }

    Fragment alt(Fragment nfa1, Fragment nfa2) {
        State s = newState(false);
        State a = newState(true);
        s.epsilon(nfa1.start, nfa2.start);
        State a1 = state(nfa1.accept);
        State a2 = state(nfa2.accept);
        a1.accept = false;
        a2.accept = false;
        a1.epsilon(a.handle);
        a2.epsilon(a.handle);
        return new Fragment(s.handle, a.handle);
    }

    Fragment star(Fragment nfa) {
        State s = newState(false);
        State a = newState(true);
        s.epsilon(nfa.start, a.handle);
        State old = state(nfa.accept);
        old.accept = false;
        old.epsilon(nfa.start, a.handle);
        return new Fragment(s.handle, a.handle);
    }

    Fragment plus(Fragment nfa) {
        State s = newState(false);
        State a = newState(true);
        s.epsilon(nfa.start);
        State old = state(nfa.accept);
        old.accept = false;
        old.epsilon(nfa.start, a.handle);
        return new Fragment(s.handle, a.handle);
    }

    Fragment question(Fragment nfa) {
        State s = newState(false);
        State a = newState(true);
        s.epsilon(nfa.start, a.handle);
        State old = state(nfa.accept);
        old.accept = false;
        old.epsilon(a.handle);
        return new Fragment(s.handle, a.handle);
    }

    /*
     * Shallow: only the symbols leaving nfa's start state are excluded, not
     * its language. The popped fragment is left unreachable.
     */
    Fragment negate(Fragment nfa) {
        State s = newState(false);
        State a = newState(true);
        State old = state(nfa.start);
        for (char c : alphabet) {
            String symbol = String.valueOf(c);
            if (!old.hasArc(symbol)) s.arc(symbol, a.handle);
        }
        return new Fragment(s.handle, a.handle);
    }

    Fragment anchor(Fragment nfa) {
        State s = newState(false);
        s.epsilon(nfa.start);
        return new Fragment(s.handle, nfa.accept);
    }

    Fragment dollar(Fragment nfa) {
        State a = newState(true);
        State old = state(nfa.accept);
        old.epsilon(a.handle);
        old.accept = false;
        return new Fragment(nfa.start, a.handle);
    }

    /*
     * queries for the subset construction
     */

    int size() {
        return states.size();
    }

    boolean isAccept(int handle) {
        return state(handle).accept;
    }

    State stateAt(int handle) {
        return state(handle);
    }

    List<Token> tokens() {
        return tokens;
    }

    /**
     * The states reachable from <code>handles</code> by epsilon arcs alone,
     * <code>handles</code> included.
     */
    BitSet epsilonClosure(BitSet handles) {
        BitSet closure = (BitSet) handles.clone();
        Deque<Integer> work = new ArrayDeque<Integer>();
        for (int i = handles.nextSetBit(0); i >= 0; i = handles.nextSetBit(i + 1)) {
            work.push(i);
        }
        while (!work.isEmpty()) {
            for (int ns : state(work.pop()).epsilons) {
                if (!closure.get(ns)) {
                    closure.set(ns);
                    work.push(ns);
                }
            }
        }
        return closure;
    }

    /**
     * The union of the destinations of <code>handles</code> on
     * <code>symbol</code>; epsilon arcs are not followed.
     */
    BitSet move(BitSet handles, char symbol) {
        String key = String.valueOf(symbol);
        BitSet ret = new BitSet(states.size());
        for (int i = handles.nextSetBit(0); i >= 0; i = handles.nextSetBit(i + 1)) {
            for (int ns : state(i).arcs(key)) ret.set(ns);
        }
        return ret;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("total states: ").append(states.size())
            .append(" start: ").append(start)
            .append(" accept: ").append(accept).append(LS);
        for (State state : states) {
            sb.append(state).append(LS);
        }
        return sb.toString();
    }
}
