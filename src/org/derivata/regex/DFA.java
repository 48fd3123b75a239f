/* @LICENSE@
 */


package org.derivata.regex;


import static org.derivata.regex.Misc.LS;
import static org.derivata.regex.Misc.iterize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.derivata.regex.Misc.Esc;
import org.derivata.regex.Misc.FlagMgr;


/**
 * An immutable deterministic finite automaton: a set of states, a set of
 * labelled transitions, a start state and a set of accepting states. Built
 * from a {@link Language} by {@link #build(Language, Set)}, then queried with
 * {@link #accepts(CharSequence)}. Instances are immutable and thread safe.
 * <p>
 * A built DFA is total over the alphabet it was built with: every state has
 * exactly one transition per symbol. Input outside that alphabet has no
 * transition and fails with an {@link InvalidTransitionException}, not with
 * a rejection.
 */
public final class DFA {

    /**
     * A state, identified by the canonical label of the reduced language it
     * stands for. Two states with equal labels are the same state.
     */
    public static final class State {

        private final String label;

        public State(String label) {
            if (label == null) {
                throw new NullPointerException("null label");
            }
            this.label = label;
        }

        public String label() {
            return label;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof State && ((State) o).label.equals(label);
        }

        @Override
        public int hashCode() {
            return label.hashCode();
        }

        @Override
        public String toString() {
            return label;
        }
    }

    /**
     * An edge <code>from --symbol--&gt; to</code>.
     */
    public static final class Transition {

        private final State from;
        private final State to;
        private final char symbol;

        public Transition(State from, State to, char symbol) {
            if (from == null || to == null) {
                throw new NullPointerException("null state");
            }
            this.from = from;
            this.to = to;
            this.symbol = symbol;
        }

        public State from() {
            return from;
        }

        public State to() {
            return to;
        }

        public char symbol() {
            return symbol;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Transition)) return false;
            Transition t = (Transition) o;
            return symbol == t.symbol && from.equals(t.from) && to.equals(t.to);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * from.hashCode() + to.hashCode()) + symbol;
        }

        /*
         * Transition is immutable, so caching works.
         */
        @Override
        public String toString() {
            if (s != null) return s;
            StringBuilder sb = new StringBuilder();
            sb.append('{').append(from).append(" --");
            Esc.JAVA.esc(sb, symbol);
            sb.append("--> ").append(to).append('}');
            return s = sb.toString();
        }
        private String s;
    }

    /**
     * Thrown when a (state, symbol) pair does not resolve to exactly one
     * transition: the automaton is malformed, or it is being run on a symbol
     * outside the alphabet it was built over. This is a programming error,
     * never a rejection of the input.
     */
    public static final class InvalidTransitionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final State state;
        private final char symbol;
        private final int matches;

        public InvalidTransitionException(State state, char symbol,
                List<Transition> matches) {
            super("Invalid transition from state " + state + " on symbol '"
                + Esc.JAVA.esc(symbol) + "' (" + matches.size() + " matches: "
                + matches + ")");
            this.state = state;
            this.symbol = symbol;
            this.matches = matches.size();
        }

        public State state() {
            return state;
        }

        public char symbol() {
            return symbol;
        }

        /**
         * @return how many transitions matched; anything but 1
         */
        public int matches() {
            return matches;
        }
    }

    /**
     * A runtime exception thrown when a DFA cannot be constructed within the
     * configured state limit.
     */
    public static final class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ConstructionException(String msg) {
            super(msg);
        }
    }

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Explore derivatives depth first instead of breadth first. The resulting
     * automaton is the same; only the order of discovery differs.
     */
    public static final int DEPTH_FIRST = flagMgr.next("DEPTH_FIRST");

    /**
     * Refuse to build from a language mentioning a character that is not in
     * the alphabet. Without this flag such characters are legal and simply
     * never match.
     */
    public static final int STRICT_ALPHABET = flagMgr.next("STRICT_ALPHABET");

    static {
        flagMgr.freezeAndCount();
    }

    /**
     * System property overriding the default state limit.
     */
    public static final String MAX_STATES_PROPERTY = "org.derivata.regex.maxStates";

    /**
     * Default limit on the number of states, after which construction fails
     * with a {@link ConstructionException}.
     */
    public static final int MAX_STATE_COUNT =
        Integer.getInteger(MAX_STATES_PROPERTY, 10 * 1000);

    /**
     * Builds a DFA recognizing <code>language</code> over <code>alphabet</code>.
     *
     * @param language the language to recognize
     * @param alphabet the symbols the DFA has transitions for; never inferred
     *        from the language
     * @return a total DFA over <code>alphabet</code>
     * @throws ConstructionException if the state count exceeds
     *         {@link #MAX_STATE_COUNT}
     */
    public static DFA build(Language language, Set<Character> alphabet) {
        return build(language, alphabet, 0);
    }

    public static DFA build(Language language, Set<Character> alphabet,
            int flags) {
        return build(language, alphabet, flags, MAX_STATE_COUNT);
    }

    public static DFA build(Language language, Set<Character> alphabet,
            int flags, int maxStates) {
        if (language == null || alphabet == null) {
            throw new NullPointerException("null language or alphabet");
        }
        flagMgr.check(flags);
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates: " + maxStates);
        }
        return new DFABuilder(Misc.charSetFrom(alphabet), flags, maxStates)
            .build(language);
    }

    /**
     * @return the sorted, unmodifiable set of chars in <code>symbols</code>
     */
    public static Set<Character> alphabet(CharSequence symbols) {
        return Misc.charSetFrom(symbols);
    }

    static String flagsString(int flags) {
        return flagMgr.stringFrom(flags);
    }

    private final Set<State> states;
    private final Set<Transition> transitions;
    private final State start;
    private final Set<State> accept;

    private final Map<State, Map<Character, List<Transition>>> index =
        new HashMap<State, Map<Character, List<Transition>>>();

    /**
     * Assembles a DFA from its parts. Only membership is checked here;
     * determinism and totality are not, and a lookup that finds zero or
     * several transitions fails when the automaton is run.
     *
     * @throws IllegalArgumentException if <code>start</code>, an accepting
     *         state or a transition endpoint is not one of <code>states</code>
     */
    public DFA(Set<State> states, Set<Transition> transitions, State start,
            Set<State> accept) {

        this.states = Collections.unmodifiableSet(new LinkedHashSet<State>(states));
        this.transitions = Collections.unmodifiableSet(
            new LinkedHashSet<Transition>(transitions));
        this.start = start;
        this.accept = Collections.unmodifiableSet(new LinkedHashSet<State>(accept));

        if (!this.states.contains(start)) {
            throw new IllegalArgumentException("start not a state: " + start);
        }
        if (!this.states.containsAll(this.accept)) {
            throw new IllegalArgumentException("accept not a subset of states: "
                + this.accept);
        }
        for (Transition t : this.transitions) {
            if (!this.states.contains(t.from) || !this.states.contains(t.to)) {
                throw new IllegalArgumentException(
                    "transition between unknown states: " + t);
            }
            Map<Character, List<Transition>> arcs = index.get(t.from);
            if (arcs == null) {
                index.put(t.from, arcs = new HashMap<Character, List<Transition>>());
            }
            List<Transition> ts = arcs.get(t.symbol);
            if (ts == null) {
                arcs.put(t.symbol, ts = new ArrayList<Transition>(1));
            }
            ts.add(t);
        }
    }

    public Set<State> states() {
        return states;
    }

    public Set<Transition> transitions() {
        return transitions;
    }

    public State start() {
        return start;
    }

    public Set<State> accept() {
        return accept;
    }

    /**
     * @return the sorted set of symbols appearing on some transition
     */
    public Set<Character> symbols() {
        Set<Character> ret = new TreeSet<Character>();
        for (Transition t : transitions) {
            ret.add(t.symbol);
        }
        return Collections.unmodifiableSet(ret);
    }

    /**
     * Runs the machine on the input.
     *
     * @param input the string of input symbols
     * @return true if the machine accepts the input; false otherwise
     * @throws InvalidTransitionException if some step does not have exactly
     *         one transition, e.g. for a symbol outside the alphabet
     */
    public boolean accepts(CharSequence input) {
        State state = start;
        for (char c : iterize(input)) {
            state = findTransition(state, c).to;
        }
        return accept.contains(state);
    }

    /**
     * @return the only transition out of <code>state</code> on
     *         <code>symbol</code>
     * @throws InvalidTransitionException if there is none, or more than one
     */
    public Transition findTransition(State state, char symbol) {
        Map<Character, List<Transition>> arcs = index.get(state);
        List<Transition> ts = arcs == null ? null : arcs.get(symbol);
        if (ts == null) {
            ts = Collections.emptyList();
        }
        if (ts.size() != 1) {
            throw new InvalidTransitionException(state, symbol, ts);
        }
        return ts.get(0);
    }

    private static final String INDENT = "    ";

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(states.size())
            .append(" total transitions: ").append(transitions.size())
            .append(LS);
        for (State state : states) {
            sb.append("state: ").append(state).append(' ');
            if (state.equals(start))    sb.append("(start) ");
            if (accept.contains(state)) sb.append("(accept) ");
            sb.append(LS);
            Map<Character, List<Transition>> arcs = index.get(state);
            if (arcs == null) continue;
            for (Character c : new TreeSet<Character>(arcs.keySet())) {
                for (Transition t : arcs.get(c)) {
                    sb.append(INDENT).append(t).append(LS);
                }
            }
        }
        return sb.toString();
    }
}
