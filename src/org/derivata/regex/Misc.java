/*
 * @LICENSE@
 */

package org.derivata.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for Strings
     */
    static Iterable<Character> iterize(final CharSequence cs) {
        return new Iterable<Character>() {
            public Iterator<Character> iterator() {
                return new Iterator<Character>() {
                    private int i = 0;

                    public boolean hasNext() {
                        return i < cs.length();
                    }

                    public Character next() {
                        return cs.charAt(i++);
                    }

                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    /*
     * sorted, so that anything iterating an alphabet does so in char order
     */
    static Set<Character> charSetFrom(CharSequence cs) {
        Set<Character> ret = new TreeSet<Character>();
        for (char c : iterize(cs)) {
            ret.add(c);
        }
        return Collections.unmodifiableSet(ret);
    }

    static Set<Character> charSetFrom(Set<Character> chars) {
        Set<Character> ret = new TreeSet<Character>();
        for (Character c : chars) {
            if (c == null) {
                throw new NullPointerException("null symbol in alphabet");
            }
            ret.add(c);
        }
        return Collections.unmodifiableSet(ret);
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        };

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            }
        }

        String stringFrom(int flags) {
            check(flags);
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    };

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper jsEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"");
    private static final MapEscaper labelEscaper =
            new MapEscaper().map('\\', "\\\\").map('(', "\\(").map(')', "\\)")
                .map('*', "\\*").map('\u2205', "\\\u2205")
                .map('\u03b5', "\\\u03b5").map('\u222a', "\\\u222a");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 32 || 126 < c) {
                appendUnicode(sb, c);
                ret = true;
            }
            return ret;
        }
    };

    private static final Escaper controlEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = Character.isISOControl(c);
            if (ret) {
                appendUnicode(sb, c);
            }
            return ret;
        }
    };

    private static void appendUnicode(StringBuilder sb, int c) {
        int mark = sb.length();
        sb.append(Integer.toHexString(c));
        while (sb.length() - mark < 4) {
            sb.insert(mark, "0");
        }
        sb.insert(mark, "\\u");
    }

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Java lang escaper - escapes " and \, non-printable-ASCI and beyond ->
         * \\u codes
         */
        JAVA(jsEscaper, unicodeEscaper),
        /**
         * State label escaper - escapes the glyphs the canonical printer uses
         * for its own structure (\ ( ) * and the empty set, epsilon and union
         * signs), control chars -> \\u codes. Everything else, including
         * non-ASCII letters, prints as itself.
         */
        LABEL(labelEscaper, controlEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (char c : iterize(cs)) {
                esc(sb, c);
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }
}
