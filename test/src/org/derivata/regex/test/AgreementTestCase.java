/* @LICENSE@  
 */

package org.derivata.regex.test;

import static org.derivata.regex.DFAAssert.*;
import static org.derivata.regex.Language.*;

import java.util.Map;

import org.derivata.regex.AbstractRxTestCase;
import org.derivata.regex.DFA;
import org.derivata.regex.DFA.State;
import org.derivata.regex.Language;


/*
 * DFA acceptance against the derivative semantics it was built from, over
 * every short string of the alphabet.
 */
public class AgreementTestCase extends AbstractRxTestCase {
    
    public static void main(String[] args) {
        junit.textui.TestRunner.run(AgreementTestCase.class);
    }

    public AgreementTestCase(String name) {
        super(name);
    }

    private static final Language a = literal('a');
    private static final Language b = literal('b');
    private static final Language c = literal('c');
    private static final Language ab = union(a, b);
    
    public void testBasics() {
        assertAgrees(empty(), "ab", 4);
        assertAgrees(epsilon(), "ab", 4);
        assertAgrees(a, "ab", 4);
        assertAgrees(ab, "ab", 4);
        assertAgrees(cat(a, b), "ab", 4);
        assertAgrees(star(a), "ab", 5);
    }
    
    public void testStarEtc() {
        assertAgrees(star(cat(a, b)), "ab", 6);
        assertAgrees(cat(star(a), a), "ab", 5);
        assertAgrees(plus(cat(a, question(b))), "ab", 5);
        assertAgrees(star(star(a)), "a", 6);
        assertAgrees(cat(star(a), star(b)), "ab", 5);
        assertAgrees(star(union(a, cat(a, a))), "a", 7);
        assertAgrees(star(union(star(a), b)), "ab", 5);
    }
    
    public void testOr() {
        assertAgrees(union(literal("foo"), literal("fob")), "fob", 4);
        assertAgrees(cat(ab, ab, ab), "ab", 4);
        assertAgrees(union(cat(a, star(b)), cat(star(a), b)), "ab", 5);
        assertAgrees(union(literal("ab"), a, literal("abc")), "abc", 4);
    }

    public void testTailPatterns() {
        assertAgrees(cat(star(ab), literal("abb")), "ab", 6);
        assertAgrees(cat(star(ab), a, ab, ab), "ab", 5);
    }

    public void testDegenerate() {
        assertAgrees(star(empty()), "a", 3);
        assertAgrees(star(epsilon()), "a", 3);
        assertAgrees(cat(a, empty()), "ab", 3);
        assertAgrees(union(empty(), empty()), "ab", 3);
        assertAgrees(cat(epsilon(), epsilon()), "ab", 3);
        assertAgrees(star(cat(union(a, epsilon()), union(b, empty()))), "ab", 5);
    }

    public void testMetaCharacters() {
        Language l = union(literal("(a*)"), star(literal('ε')), literal("∅∪\\"));
        assertAgrees(l, "(a*)ε∅∪\\", 3);
    }
    
    public void testThreeSymbols() {
        Language l = cat(star(union(a, cat(b, c))), question(c));
        assertAgrees(l, "abc", 4);
        assertAgrees(plus(union(literal("ab"), question(c))), "abc", 4);
    }

    public void testAllStatesReachable() {
        DFA dfa = DFA.build(cat(star(ab), literal("abb")), DFA.alphabet("ab"));
        Map<State, String> words = shortestWords(dfa);
        assertEquals(dfa.states(), words.keySet());
        assertEquals("abb", words.get(dfa.accept().iterator().next()));
    }
}
