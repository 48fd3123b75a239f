/*@LICENSE@
 */
package org.derivata.regex.test;

import static org.derivata.regex.Language.*;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.derivata.regex.AbstractRxTestCase;
import org.derivata.regex.DFA;
import org.derivata.regex.DFA.ConstructionException;
import org.derivata.regex.Language;

public class LogDemoTestCase extends AbstractRxTestCase {

    public LogDemoTestCase(String name) {
        super(name);
    }

    private List<LogRecord> records;

    protected void setUp() throws Exception {
        super.setUp();
        records = captureRxLog();
    }

    protected void tearDown() throws Exception {
        super.tearDown();
    }

    private String logged(Level level) {
        StringBuilder sb = new StringBuilder();
        for (LogRecord record : records) {
            if (record.getLevel().equals(level)) {
                sb.append(record.getMessage()).append('\n');
            }
        }
        return sb.toString();
    }
    
    public void testDFA() {
        DFA dfa = DFA.build(cat(literal('a'), literal('b')), DFA.alphabet("ab"));
        String finest = logged(Level.FINEST);
        assertTrue(finest, finest.contains("reduced to (ab)"));
        assertTrue(finest, finest.contains("closure BREADTH_FIRST: 4 languages"));
        assertTrue(finest, finest.contains(dfa.toString()));
    }

    public void testFlagsLogged() {
        DFA.build(star(literal('a')), DFA.alphabet("a"), DFA.DEPTH_FIRST);
        String finest = logged(Level.FINEST);
        assertTrue(finest, finest.contains("flags: DEPTH_FIRST"));
        assertTrue(finest, finest.contains("closure DEPTH_FIRST: 1 languages"));
    }
    
    public void testStateLimitLogged() {
        Language ab = union(literal('a'), literal('b'));
        try {
            DFA.build(cat(star(ab), literal('a'), ab), DFA.alphabet("ab"), 0, 2);
            fail();
        } catch (ConstructionException e) {
            assertTrue(logged(Level.FINE), 
                logged(Level.FINE).contains(e.getMessage()));
        }
    }

    public void testQueriesAreQuiet() {
        DFA dfa = DFA.build(star(literal('a')), DFA.alphabet("a"));
        records.clear();
        dfa.accepts("aaaa");
        assertTrue(records.isEmpty());
    }
}
