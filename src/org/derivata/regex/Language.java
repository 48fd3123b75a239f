/* @LICENSE@
 */
package org.derivata.regex;

import static org.derivata.regex.Misc.LS;

import java.io.Flushable;
import java.io.IOException;

/**
 * An immutable regular language, built from the six forms {@link Empty},
 * {@link Epsilon}, {@link Char}, {@link Union}, {@link Concat} and
 * {@link Star}. There is no parser: callers assemble the tree with the static
 * factories at the bottom of this class.
 * <p>
 * Unlike most syntax trees, equality here is <em>structural</em>: two
 * languages are equal iff they are built from the same forms over the same
 * characters in the same shape. Instances serve as set and map keys during
 * DFA construction. Equality says nothing about the denoted set of strings;
 * <code>union(a, b)</code> and <code>union(b, a)</code> are different values
 * until {@linkplain Canonicalizer#reduce(Language) reduced}.
 * <p>
 * The {@link #toString()} form is the canonical label, e.g.
 * <code>((a*) &#x222a; b)</code>.
 */
public abstract class Language {

    private final int hash;
    private String label;    // lazy, see toString()

    Language(int hash) {
        this.hash = hash;
    }

    /**
     * @return true iff the string is in this language. Evaluated directly by
     *         derivatives, without building an automaton.
     */
    public final boolean matches(CharSequence s) {
        return Derivatives.matches(this, s);
    }

    /**
     * @return the number of nodes in this tree.
     */
    public final int size() {
        return new Visitor(Visitor.TraversalOrder.BOTTOM_UP) {
            int n = 0;
            int count() {
                visit(Language.this);
                return n;
            }
            @Override
            protected void visit(Language node) {
                ++n;
                super.visit(node);
            }
        }.count();
    }

    public final String toTreeString() {
        final StringBuilder sb = new StringBuilder();
        new AbstractTreePrinter(sb) {
            @Override
            protected Formatter newFormatter() {
                return new Formatter() {
                    private int nspace = 0;
                    private void indent() throws IOException {
                        for (int i=0; i<nspace; ++i) {
                            a.append(' ');
                        }
                    }
                    @Override
                    void push() {
                        nspace += 4;
                    }
                    @Override
                    void pop() {
                        nspace -= 4;
                    }
                    @Override
                    void appendNonTerminal(String label) {
                        try {
                            indent();
                            a.append(label).append(LS);
                        } catch (IOException e) {
                            throw new RuntimeException(e);
                        }
                    };
                    @Override
                    void appendTerminal(String label) {
                        try {
                            indent();
                            a.append(label).append(LS);
                        } catch (IOException e) {
                            throw new RuntimeException(e);
                        }
                    }
                };
            }
        }.print(this);
        return sb.toString();
    }

    @Override
    public final int hashCode() {
        return hash;
    }

    @Override
    public final boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof Language)) return false;
        Language that = (Language) o;
        return hash == that.hash && sameShape(that);
    }

    /*
     * called only with equal hashes
     */
    abstract boolean sameShape(Language that);

    /**
     * The canonical label, see {@link Canonicalizer#toCanonicalString(Language)}.
     * Language is "immutable enough" for caching to work.
     */
    @Override
    public final String toString() {
        if (label != null) return label;
        return label = Canonicalizer.toCanonicalString(this);
    }

    /**
     * The forms without children.
     */
    public static abstract class Leaf extends Language {
        private Leaf(int hash) {
            super(hash);
        }
    }

    /**
     * &#x2205;, the language with no strings.
     */
    public static final class Empty extends Leaf {
        private static final Empty INSTANCE = new Empty();
        private Empty() {
            super(0x2205);
        }
        @Override
        boolean sameShape(Language that) {
            return that == INSTANCE;
        }
    }

    /**
     * &#x03b5;, the language containing only the empty string.
     */
    public static final class Epsilon extends Leaf {
        private static final Epsilon INSTANCE = new Epsilon();
        private Epsilon() {
            super(0x03b5);
        }
        @Override
        boolean sameShape(Language that) {
            return that == INSTANCE;
        }
    }

    /**
     * The language containing the single one character string <code>c</code>.
     */
    public static final class Char extends Leaf {

        public final char c;

        private Char(char c) {
            super(0x10000 + c);
            this.c = c;
        }
        @Override
        boolean sameShape(Language that) {
            return that instanceof Char && ((Char) that).c == c;
        }
    }

    public static abstract class NonTerminal extends Language {

        private NonTerminal(int hash) {
            super(hash);
        }

        abstract Language[] children();
    }

    public static abstract class Binary extends NonTerminal {

        public final Language first, second;

        private Binary(int tag, Language first, Language second) {
            super(tag + 31 * (31 * first.hashCode() + second.hashCode()));
            this.first = first;
            this.second = second;
        }

        @Override
        final Language[] children() {
            return new Language[] {first, second};
        }

        @Override
        final boolean sameShape(Language that) {
            if (that.getClass() != getClass()) return false;
            Binary b = (Binary) that;
            return first.equals(b.first) && second.equals(b.second);
        }
    }

    /**
     * <code>first &#x222a; second</code>.
     */
    public static final class Union extends Binary {
        private Union(Language first, Language second) {
            super(0x222a, first, second);
        }
    }

    /**
     * <code>first</code> followed by <code>second</code>.
     */
    public static final class Concat extends Binary {
        private Concat(Language first, Language second) {
            super(0x00b7, first, second);
        }
    }

    /**
     * Kleene closure of <code>child</code>.
     */
    public static final class Star extends NonTerminal {

        public final Language child;

        private Star(Language child) {
            super(0x2a + 31 * child.hashCode());
            this.child = child;
        }

        @Override
        final Language[] children() {
            return new Language[] {child};
        }

        @Override
        boolean sameShape(Language that) {
            return that instanceof Star && child.equals(((Star) that).child);
        }
    }

    /**
     * Exhaustive case analysis over the six forms. Subclasses override the
     * <code>visit</code> methods for the forms they care about.
     */
    public static abstract class Visitor {

        public enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Language node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Leaf) {
                visit((Leaf) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Language n : node.children()) {
                    visit(n);
                }
            }
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Star) {
                visit((Star) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Language n : node.children()) {
                    visit(n);
                }
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Concat) {
                visit((Concat) node);
            } else if (node instanceof Union) {
                visit((Union) node);
            } else {
                error(node);
            }
        }

        protected void visit(Leaf node) {
            if (node instanceof Char) {
                visit((Char) node);
            } else if (node instanceof Epsilon) {
                visit((Epsilon) node);
            } else if (node instanceof Empty) {
                visit((Empty) node);
            } else {
                error(node);
            }
        }

        protected void visit(Concat node) {}
        protected void visit(Union node) {}
        protected void visit(Star node) {}

        protected void visit(Char node) {}
        protected void visit(Epsilon node) {}
        protected void visit(Empty node) {}

        private static void error(Language node) {
            throw new AssertionError("unknown language type " + node.getClass());
        }
    }

    static abstract class AbstractTreePrinter extends Visitor {

        protected abstract class Formatter {

            abstract void appendNonTerminal(String label);
            abstract void appendTerminal(String label);
            abstract void push();
            abstract void pop();

            protected String prolog() {return "";}
            protected String epilog() {return "";}
        }

        protected final Appendable a;

        protected AbstractTreePrinter(Appendable a) {
            super(TraversalOrder.TOP_DOWN);
            this.a = a;
            formatter = newFormatter();
        }

        final void print(Language root) {
            try {
                a.append(formatter.prolog());
                visit(root);
                a.append(formatter.epilog());
            } catch (IOException e1) {
                throw new RuntimeException(e1);
            }
            if (a instanceof Flushable) {
                try {
                    ((Flushable) a).flush();
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
            }
        }

        private final Formatter formatter;
        protected abstract Formatter newFormatter();

        @Override
        protected final void visit(NonTerminal node) {
            super.visit(node);
            formatter.pop();
        }

        @Override
        protected final void visit(Concat node) {
            formatter.appendNonTerminal("·");
            formatter.push();
        }

        @Override
        protected final void visit(Union node) {
            formatter.appendNonTerminal("∪");
            formatter.push();
        }

        @Override
        protected final void visit(Star node) {
            formatter.appendNonTerminal("*");
            formatter.push();
        }

        @Override
        protected final void visit(Leaf node) {
            formatter.appendTerminal(node.toString());
        }
        /*
         * prevent subclasses from overriding
         */
        @Override
        protected final void visit(Language node) {
            super.visit(node);
        }
        @Override
        protected final void visit(Binary node) {
            super.visit(node);
        }
    }


    /*
     * static factories
     */

    public static Language empty() {
        return Empty.INSTANCE;
    }

    public static Language epsilon() {
        return Epsilon.INSTANCE;
    }

    public static Language literal(char c) {
        return new Char(c);
    }

    /**
     * @return the concatenation of the chars of <code>s</code>, left to
     *         right; &#x03b5; for the empty string.
     */
    public static Language literal(String s) {
        Language root = null;
        for (char c : s.toCharArray()) {
            Language lc = new Char(c);
            if (root == null) {
                root = lc;
            } else {
                root = new Concat(root, lc);
            }
        }
        return root == null ? epsilon() : root;
    }

    /**
     * Left nested: <code>cat(a, b, c)</code> is <code>((ab)c)</code>. No
     * arguments gives &#x03b5;.
     */
    public static Language cat(Language... nodes) {
        Language root = null;
        for (Language node : nodes) {
            if (root == null) {
                root = nonNull(node);
            } else {
                root = new Concat(root, nonNull(node));
            }
        }
        return root == null ? epsilon() : root;
    }

    /**
     * Left nested, like {@link #cat(Language...)}. No arguments gives
     * &#x2205;.
     */
    public static Language union(Language... nodes) {
        Language root = null;
        for (Language node : nodes) {
            if (root == null) {
                root = nonNull(node);
            } else {
                root = new Union(root, nonNull(node));
            }
        }
        return root == null ? empty() : root;
    }

    public static Language star(Language child) {
        return new Star(nonNull(child));
    }

    /**
     * One or more: <code>cat(child, star(child))</code>.
     */
    public static Language plus(Language child) {
        return new Concat(nonNull(child), new Star(child));
    }

    /**
     * Zero or one: <code>union(child, epsilon())</code>.
     */
    public static Language question(Language child) {
        return new Union(nonNull(child), epsilon());
    }

    private static Language nonNull(Language node) {
        if (node == null) {
            throw new NullPointerException("null language");
        }
        return node;
    }
}
