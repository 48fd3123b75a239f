/*@LICENSE@
 */

package org.derivata.regex;

import static junit.framework.Assert.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import org.derivata.regex.DFA.State;
import org.derivata.regex.DFA.Transition;


/**
 * @author ndw
 *
 */
public final class DFAAssert {

    private DFAAssert() {}   // not instantiable.

    /*
     * every string over the alphabet up to maxLen, shortest first
     */
    public static List<String> strings(String alphabet, int maxLen) {
        List<String> ret = new ArrayList<String>();
        List<String> level = new ArrayList<String>();
        level.add("");
        ret.add("");
        for (int len = 1; len <= maxLen; ++len) {
            List<String> next = new ArrayList<String>();
            for (String s : level) {
                for (char c : alphabet.toCharArray()) {
                    next.add(s + c);
                }
            }
            ret.addAll(next);
            level = next;
        }
        return ret;
    }

    /*
     * DFA vs. derivative semantics, both traversal orders
     */
    public static void assertAgrees(Language lang, String alphabet, int maxLen) {
        DFA bfs = DFA.build(lang, DFA.alphabet(alphabet));
        DFA dfs = DFA.build(lang, DFA.alphabet(alphabet), DFA.DEPTH_FIRST);
        assertEquals(lang.toString(), bfs.states(), dfs.states());
        assertEquals(lang.toString(), bfs.transitions(), dfs.transitions());
        assertEquals(lang.toString(), bfs.accept(), dfs.accept());
        assertEquals(lang.toString(), bfs.start(), dfs.start());

        for (String s : strings(alphabet, maxLen)) {
            assertEquals(lang + " on \"" + s + '"', lang.matches(s), bfs.accepts(s));
        }
        assertTotal(bfs, alphabet);
        assertAcceptCorrect(lang, bfs);
    }

    /*
     * exactly one transition per (state, symbol), counted on the raw
     * transition set rather than through findTransition
     */
    public static void assertTotal(DFA dfa, String alphabet) {
        Set<Character> sigma = DFA.alphabet(alphabet);
        for (State state : dfa.states()) {
            for (char c : sigma) {
                int n = 0;
                for (Transition t : dfa.transitions()) {
                    if (t.from().equals(state) && t.symbol() == c) ++n;
                }
                assertEquals(state + " on " + c, 1, n);
            }
        }
        for (Transition t : dfa.transitions()) {
            assertTrue(t.toString(), sigma.contains(t.symbol()));
        }
    }

    /*
     * A state accepts iff the words leading to it are in the language. The
     * shortest word reaching each state stands in for its residual language.
     */
    public static void assertAcceptCorrect(Language lang, DFA dfa) {
        for (Map.Entry<State, String> e : shortestWords(dfa).entrySet()) {
            assertEquals(e.getKey() + " via \"" + e.getValue() + '"',
                lang.matches(e.getValue()), dfa.accept().contains(e.getKey()));
        }
    }

    public static Map<State, String> shortestWords(DFA dfa) {
        Map<State, String> ret = new LinkedHashMap<State, String>();
        Queue<State> gray = new LinkedList<State>();
        ret.put(dfa.start(), "");
        gray.add(dfa.start());
        while (!gray.isEmpty()) {
            State state = gray.remove();
            for (char c : dfa.symbols()) {
                State next = dfa.findTransition(state, c).to();
                if (!ret.containsKey(next)) {
                    ret.put(next, ret.get(state) + c);
                    gray.add(next);
                }
            }
        }
        return ret;
    }

    public static void assertAccepts(DFA dfa, String... inputs) {
        for (String input : inputs) {
            assertTrue("should accept \"" + input + '"', dfa.accepts(input));
        }
    }

    public static void assertRejects(DFA dfa, String... inputs) {
        for (String input : inputs) {
            assertFalse("should reject \"" + input + '"', dfa.accepts(input));
        }
    }
}
