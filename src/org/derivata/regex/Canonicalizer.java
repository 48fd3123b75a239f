/* @LICENSE@
 */
package org.derivata.regex;

import java.util.Comparator;

import org.derivata.regex.Language.Char;
import org.derivata.regex.Language.Concat;
import org.derivata.regex.Language.Empty;
import org.derivata.regex.Language.Epsilon;
import org.derivata.regex.Language.Star;
import org.derivata.regex.Language.Union;
import org.derivata.regex.Language.Visitor;
import org.derivata.regex.Language.Visitor.TraversalOrder;
import org.derivata.regex.Misc.Esc;

/**
 * Canonical forms for languages, and the labels that name DFA states.
 * <p>
 * A reduced language is the fixpoint of {@link Derivatives#simplify(Language)}.
 * Its label is its printed form; two reduced languages are the same state iff
 * their labels are equal, which the printer guarantees is iff they are
 * structurally equal.
 */
public final class Canonicalizer {

    private Canonicalizer() {}    // uninstantiable

    /**
     * Orders languages by label. Consistent with {@link Language#equals(Object)}
     * since labels are injective.
     */
    static final Comparator<Language> ORDER = new Comparator<Language>() {
        public int compare(Language a, Language b) {
            return a.toString().compareTo(b.toString());
        }
    };

    /**
     * Applies {@link Derivatives#simplify(Language)} until the result stops
     * changing. Terminates because simplify never adds nodes.
     *
     * @return the canonical form of <code>lang</code>
     */
    public static Language reduce(Language lang) {
        Language previous = lang;
        Language next = Derivatives.simplify(previous);
        while (!previous.equals(next)) {
            previous = next;
            next = Derivatives.simplify(previous);
        }
        return next;
    }

    /**
     * Prints <code>&#x2205;</code>, <code>&#x03b5;</code>, the character
     * itself, <code>(A &#x222a; B)</code>, <code>(AB)</code> and
     * <code>(A*)</code>. Characters that the printer uses for its own
     * structure are backslash escaped, as are control characters
     * (<code>\\uXXXX</code>), so no two different trees print alike.
     */
    public static String toCanonicalString(final Language lang) {
        return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

            private final StringBuilder sb = new StringBuilder();

            /*
             * children print through their own cached labels
             */
            @Override
            public String toString() {
                visit(lang);
                return sb.toString();
            }

            @Override
            protected void visit(Empty node) {
                sb.append('∅');
            }

            @Override
            protected void visit(Epsilon node) {
                sb.append('ε');
            }

            @Override
            protected void visit(Char node) {
                Esc.LABEL.esc(sb, node.c);
            }

            @Override
            protected void visit(Union node) {
                sb.append('(');
                sb.append(node.first);
                sb.append(" ∪ ");
                sb.append(node.second);
                sb.append(')');
            }

            @Override
            protected void visit(Concat node) {
                sb.append('(');
                sb.append(node.first);
                sb.append(node.second);
                sb.append(')');
            }

            @Override
            protected void visit(Star node) {
                sb.append('(');
                sb.append(node.child);
                sb.append("*)");
            }
        }.toString();
    }
}
