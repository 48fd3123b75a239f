/*
 * @LICENSE@
 */

/**
 * <h3><b>derivata</b> - regular languages to DFAs by Brzozowski derivatives.</h3>
 * <p>
 * <h4>Usage.</h4>
 * <p>
 * There is no pattern syntax. A {@link org.derivata.regex.Language} is built
 * from six forms with static factories, and turned into a
 * {@link org.derivata.regex.DFA} over an explicitly supplied alphabet:
 * <blockquote><pre>
 *   Language ab = Language.cat(Language.literal('a'), Language.literal('b'));
 *   DFA dfa = DFA.build(Language.star(ab), DFA.alphabet("ab"));
 *   dfa.accepts("abab");   // true
 *   dfa.accepts("aba");    // false
 *   dfa.accepts("abc");    // InvalidTransitionException: 'c' not in alphabet
 * </pre></blockquote>
 * <p>
 * <h4>Construction.</h4>
 * <p>
 * The derivative of a language L with respect to a character c is the set of
 * strings w such that cw is in L. Starting from L, the builder takes the
 * derivative with respect to every symbol of the alphabet, reduces each result
 * to a canonical form by repeated algebraic simplification
 * ({@link org.derivata.regex.Canonicalizer}), and repeats on every new form
 * until no new ones appear. Each canonical form is a state, named by its
 * printed label; a state accepts iff its language contains the empty string.
 * Union is simplified modulo associativity, commutativity and idempotence,
 * which is what keeps the number of forms finite.
 * <p>
 * The resulting automaton is deterministic and total over its alphabet, but
 * not necessarily minimal.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * Construction logs to the <code>java.util.logging</code> logger
 * <code>org.derivata.regex</code>: at <code>FINEST</code> the reduced start
 * language, the closure and the complete automaton; at <code>FINE</code>
 * constructions aborted by the state limit.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Janusz Brzozowski, <i>Derivatives of Regular Expressions</i>, JACM
 * 1964, which introduces the construction and proves it finite modulo
 * similarity of union.</li>
 * <li>Scott Owens, John Reppy and Aaron Turon, <i>Regular-expression
 * derivatives re-examined</i>, JFP 2009, for the simplification rules in
 * practice.</li>
 * </ul>
 */
package org.derivata.regex;
