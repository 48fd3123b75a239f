/* @LICENSE@
 */
package org.derivata.regex;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.derivata.regex.DFA.ConstructionException;

/**
 * Worklist computation of every reduced language reachable from a start
 * language by finitely many single character derivatives.
 * <p>
 * Languages enter the frontier already {@linkplain Canonicalizer#reduce
 * reduced}, so the visited test compares the same canonical forms the DFA
 * states are later named after. Duplicates are allowed in the frontier and
 * discarded when polled.
 */
final class Closure {

    private static final Logger logger = Logger.getLogger("org.derivata.regex");
    private static final Level level = Level.FINEST;

    enum Order {
        BREADTH_FIRST, DEPTH_FIRST;
    }

    private final Set<Character> alphabet;
    private final Order order;
    private final int maxStates;

    /**
     * @param alphabet iterated in its own order; callers pass a sorted set
     * @param maxStates more distinct languages than this aborts the search
     */
    Closure(Set<Character> alphabet, Order order, int maxStates) {
        assert maxStates > 0;
        this.alphabet = alphabet;
        this.order = order;
        this.maxStates = maxStates;
    }

    /**
     * @return the reachable languages, including <code>start</code> itself,
     *         in discovery order
     * @throws ConstructionException if there are more than
     *         <code>maxStates</code> of them
     */
    Set<Language> explore(Language start) {

        final LinkedList<Language> gray = new LinkedList<Language>();
        final Set<Language> black = new LinkedHashSet<Language>();

        gray.add(Canonicalizer.reduce(start));
        while (!gray.isEmpty()) {
            Language lang = order == Order.DEPTH_FIRST
                    ? gray.removeLast()
                    : gray.removeFirst();
            if (black.contains(lang)) {
                continue;   // seen it
            }
            if (black.size() == maxStates) {
                String msg = "DFA state count exceeded: " + maxStates;
                logger.log(Level.FINE, msg + ", start: " + start);
                throw new ConstructionException(msg);
            }
            for (char c : alphabet) {
                gray.add(Canonicalizer.reduce(Derivatives.derivative(lang, c)));
            }
            black.add(lang);
        }

        if (logger.isLoggable(level)) {
            logger.log(level, "closure " + order + ": " + black.size()
                + " languages from " + start);
        }
        return Collections.unmodifiableSet(black);
    }
}
