/* @LICENSE@
 */
package org.derivata.regex;

import static org.derivata.regex.Language.cat;
import static org.derivata.regex.Language.empty;
import static org.derivata.regex.Language.epsilon;
import static org.derivata.regex.Language.star;
import static org.derivata.regex.Language.union;
import static org.derivata.regex.Misc.iterize;

import java.util.SortedSet;
import java.util.TreeSet;

import org.derivata.regex.Language.Char;
import org.derivata.regex.Language.Concat;
import org.derivata.regex.Language.Empty;
import org.derivata.regex.Language.Epsilon;
import org.derivata.regex.Language.Leaf;
import org.derivata.regex.Language.Star;
import org.derivata.regex.Language.Union;
import org.derivata.regex.Language.Visitor;
import org.derivata.regex.Language.Visitor.TraversalOrder;

/**
 * The regular language algebra: Brzozowski derivatives, nullability and
 * algebraic simplification. All operations are pure; none of them mutate or
 * cache anything.
 */
public final class Derivatives {

    private Derivatives() {}    // uninstantiable

    /**
     * Computes the derivative of a language with respect to a character: the
     * set of strings <code>w</code> such that <code>cw</code> is in
     * <code>lang</code>. The result is not simplified.
     *
     * @param lang a regular language
     * @param c the character consumed
     * @return &#x2202;c(lang)
     */
    public static Language derivative(final Language lang, final char c) {
        return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

            private Language result;

            Language apply() {
                visit(lang);
                return result;
            }

            // ∂c(∅) = ∅
            @Override
            protected void visit(Empty node) {
                result = empty();
            }

            // ∂c(ε) = ∅
            @Override
            protected void visit(Epsilon node) {
                result = empty();
            }

            // ∂c({c}) = ε, ∂c({d}) = ∅
            @Override
            protected void visit(Char node) {
                result = node.c == c ? epsilon() : empty();
            }

            // ∂c(l1 ∪ l2) = ∂c(l1) ∪ ∂c(l2)
            @Override
            protected void visit(Union node) {
                result = union(
                    derivative(node.first, c),
                    derivative(node.second, c));
            }

            // ∂c(l*) = ∂c(l) · l*
            @Override
            protected void visit(Star node) {
                result = cat(derivative(node.child, c), node);
            }

            // ∂c(l1 · l2) = ∂c(l1) · l2              if ε ∉ l1
            //               (∂c(l1) · l2) ∪ ∂c(l2)   otherwise
            @Override
            protected void visit(Concat node) {
                Language l = cat(derivative(node.first, c), node.second);
                result = nullable(node.first)
                        ? union(l, derivative(node.second, c))
                        : l;
            }
        }.apply();
    }

    /**
     * @return true iff <code>lang</code> contains the empty string.
     */
    public static boolean nullable(final Language lang) {
        return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

            private boolean result;

            boolean test() {
                visit(lang);
                return result;
            }

            @Override
            protected void visit(Empty node) {
                result = false;
            }
            @Override
            protected void visit(Epsilon node) {
                result = true;
            }
            @Override
            protected void visit(Char node) {
                result = false;
            }
            @Override
            protected void visit(Union node) {
                result = nullable(node.first) || nullable(node.second);
            }
            @Override
            protected void visit(Concat node) {
                result = nullable(node.first) && nullable(node.second);
            }
            @Override
            protected void visit(Star node) {
                result = true;
            }
        }.test();
    }

    /**
     * One recursive pass of local algebraic identities:
     * <ul>
     * <li><code>&#x03b5;l = l&#x03b5; = l</code>,
     * <code>&#x2205;l = l&#x2205; = &#x2205;</code></li>
     * <li><code>(ab)c = a(bc)</code></li>
     * <li><code>&#x2205; &#x222a; l = l &#x222a; &#x2205; = l</code></li>
     * <li>union operands are flattened, deduplicated and sorted by label,
     * then nested to the right</li>
     * <li><code>&#x03b5;* = &#x2205;* = &#x03b5;</code></li>
     * </ul>
     * The result never has more nodes than <code>lang</code>. One pass is not
     * a fixpoint; see {@link Canonicalizer#reduce(Language)}.
     */
    public static Language simplify(final Language lang) {
        return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

            private Language result;

            Language apply() {
                visit(lang);
                return result;
            }

            @Override
            protected void visit(Leaf node) {
                result = node;
            }

            @Override
            protected void visit(Concat node) {
                Language l = node.first;
                Language r = node.second;
                if (l instanceof Epsilon) {
                    result = simplify(r);
                } else if (r instanceof Epsilon) {
                    result = simplify(l);
                } else if (l instanceof Empty || r instanceof Empty) {
                    result = empty();
                } else if (l instanceof Concat) {
                    Concat lc = (Concat) l;
                    result = cat(
                        simplify(lc.first),
                        cat(simplify(lc.second), simplify(r)));
                } else {
                    result = cat(simplify(l), simplify(r));
                }
            }

            @Override
            protected void visit(Union node) {
                Language l = node.first;
                Language r = node.second;
                if (l instanceof Empty) {
                    result = simplify(r);
                } else if (r instanceof Empty) {
                    result = simplify(l);
                } else {
                    SortedSet<Language> operands =
                        new TreeSet<Language>(Canonicalizer.ORDER);
                    flatten(simplify(l), operands);
                    flatten(simplify(r), operands);
                    result = nest(operands);
                }
            }

            @Override
            protected void visit(Star node) {
                Language child = node.child;
                if (child instanceof Epsilon || child instanceof Empty) {
                    result = epsilon();
                } else {
                    result = star(simplify(child));
                }
            }
        }.apply();
    }

    /*
     * Collects the operands of a (possibly nested) union; ∅ contributes
     * nothing.
     */
    private static void flatten(Language lang, SortedSet<Language> operands) {
        if (lang instanceof Union) {
            Union u = (Union) lang;
            flatten(u.first, operands);
            flatten(u.second, operands);
        } else if (!(lang instanceof Empty)) {
            operands.add(lang);
        }
    }

    /*
     * (a ∪ (b ∪ (c ∪ d))) in operand order; ∅ for no operands.
     */
    private static Language nest(SortedSet<Language> operands) {
        if (operands.isEmpty()) {
            return empty();
        }
        Language[] ops = operands.toArray(new Language[operands.size()]);
        Language ret = ops[ops.length - 1];
        for (int i = ops.length - 2; i >= 0; --i) {
            ret = union(ops[i], ret);
        }
        return ret;
    }

    /**
     * Reference membership test: folds {@link #derivative(Language, char)}
     * over the input and checks the residue for {@linkplain #nullable(Language)
     * nullability}. No simplification takes place, so this stays independent
     * of the state construction and serves as its oracle; the intermediate
     * terms can grow quickly with input length.
     */
    public static boolean matches(Language lang, CharSequence s) {
        Language residue = lang;
        for (char c : iterize(s)) {
            residue = derivative(residue, c);
        }
        return nullable(residue);
    }
}
