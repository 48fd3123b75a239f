/* @LICENSE@
 */
package org.derivata.regex;

import static org.derivata.regex.Misc.isSet;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.derivata.regex.DFA.State;
import org.derivata.regex.DFA.Transition;
import org.derivata.regex.Language.Char;
import org.derivata.regex.Language.Visitor;
import org.derivata.regex.Language.Visitor.TraversalOrder;

/**
 * Derivative construction: every reduced language reachable from the start
 * language becomes a state named by its label, each (language, symbol) pair
 * becomes the transition to the reduced derivative, and the nullable
 * languages accept.
 */
final class DFABuilder {

    private static final Logger logger = Logger.getLogger("org.derivata.regex");
    private static final Level level = Level.FINEST;

    private final Set<Character> alphabet;
    private final int flags;
    private final Closure closure;

    DFABuilder(Set<Character> alphabet, int flags, int maxStates) {
        this.alphabet = alphabet;
        this.flags = flags;
        this.closure = new Closure(
            alphabet,
            isSet(flags, DFA.DEPTH_FIRST)
                ? Closure.Order.DEPTH_FIRST
                : Closure.Order.BREADTH_FIRST,
            maxStates);
    }

    /*
     * Reduced language -> state; label collisions between distinct languages
     * would merge states that must stay apart.
     */
    private final class StateFactory {

        private final Map<Language, State> map =
            new LinkedHashMap<Language, State>();
        private final Map<String, Language> labels =
            new HashMap<String, Language>();

        State stateFrom(Language lang) {
            State state = map.get(lang);
            if (state == null) {
                state = new State(lang.toString());
                Language prior = labels.put(state.label(), lang);
                assert prior == null : "label collision: " + state;
                map.put(lang, state);
            }
            return state;
        }
    }

    DFA build(Language language) {

        if (isSet(flags, DFA.STRICT_ALPHABET)) {
            checkAlphabet(language);
        }

        final Language start = Canonicalizer.reduce(language);
        if (logger.isLoggable(level)) {
            logger.log(level, "building " + language + " reduced to " + start
                + " over " + alphabet + " flags: " + DFA.flagsString(flags));
        }

        final Set<Language> derivs = new LinkedHashSet<Language>();
        for (Language d : closure.explore(start)) {
            derivs.add(Canonicalizer.reduce(d));
        }

        final StateFactory factory = new StateFactory();
        final Set<State> states = new LinkedHashSet<State>();
        final Set<Transition> transitions = new LinkedHashSet<Transition>();
        final Set<State> accept = new LinkedHashSet<State>();

        states.add(factory.stateFrom(start));
        for (Language d : derivs) {
            State from = factory.stateFrom(d);
            states.add(from);
            for (char c : alphabet) {
                State to = factory.stateFrom(
                    Canonicalizer.reduce(Derivatives.derivative(d, c)));
                transitions.add(new Transition(from, to, c));
            }
            if (Derivatives.nullable(d)) {
                accept.add(from);
            }
        }

        final DFA dfa = new DFA(states, transitions, factory.stateFrom(start), accept);

        assert new Object() {
            boolean test() {
                for (State state : dfa.states()) {
                    for (char c : alphabet) {
                        dfa.findTransition(state, c);
                    }
                }
                return true;
            }
        }.test();

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + dfa.toString(), dfa);
        }
        return dfa;
    }

    private void checkAlphabet(Language language) {
        final Set<Character> missing = new TreeSet<Character>();
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Char node) {
                if (!alphabet.contains(node.c)) {
                    missing.add(node.c);
                }
            }
        }.visit(language);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("language " + language
                + " uses symbols outside the alphabet " + alphabet + ": "
                + missing);
        }
    }
}
